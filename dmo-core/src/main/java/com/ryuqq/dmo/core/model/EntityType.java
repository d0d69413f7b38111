package com.ryuqq.dmo.core.model;

/**
 * 저장소가 관리하는 엔티티 종류.
 *
 * @author DMO Team
 * @since 1.0.0
 */
public enum EntityType {

    ROUTINE("DMO"),

    ACTIVITY("Activity"),

    COMPLETION("Completion");

    private final String displayName;

    EntityType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * 오류 메시지에 쓰이는 표시 이름.
     *
     * @return 표시 이름
     */
    public String displayName() {
        return displayName;
    }
}
