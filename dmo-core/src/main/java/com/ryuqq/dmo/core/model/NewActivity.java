package com.ryuqq.dmo.core.model;

/**
 * 활동 생성 입력.
 *
 * @param routineId 소유 루틴 ID
 * @param name 이름 (trim 후 1~500자)
 * @param order 정렬 순서 (0 이상)
 *
 * @author DMO Team
 * @since 1.0.0
 */
public record NewActivity(long routineId, String name, int order) {

    public static final int MAX_NAME_LENGTH = 500;

    public NewActivity {
        name = Texts.requireName("name", name, MAX_NAME_LENGTH);
        order = Texts.requireOrder(order);
    }

    /**
     * order=0 으로 생성.
     *
     * @param routineId 소유 루틴 ID
     * @param name 이름
     * @return NewActivity 인스턴스
     */
    public static NewActivity of(long routineId, String name) {
        return new NewActivity(routineId, name, 0);
    }
}
