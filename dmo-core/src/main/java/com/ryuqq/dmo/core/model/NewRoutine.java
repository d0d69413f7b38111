package com.ryuqq.dmo.core.model;

/**
 * 루틴 생성 입력.
 *
 * <p>생성 시점에 이름을 trim하고 길이를 검증합니다. 위반 시
 * {@link com.ryuqq.dmo.core.error.DmoException} (INVALID_INPUT).</p>
 *
 * @param name 이름 (trim 후 1~255자)
 * @param description 설명 (null 허용, 최대 2000자)
 * @param timezone 시간대 라벨 (null 허용, 최대 50자)
 *
 * @author DMO Team
 * @since 1.0.0
 */
public record NewRoutine(String name, String description, String timezone) {

    public static final int MAX_NAME_LENGTH = 255;
    public static final int MAX_DESCRIPTION_LENGTH = 2000;
    public static final int MAX_TIMEZONE_LENGTH = 50;

    public NewRoutine {
        name = Texts.requireName("name", name, MAX_NAME_LENGTH);
        description = Texts.optional("description", description, MAX_DESCRIPTION_LENGTH);
        timezone = Texts.optional("timezone", timezone, MAX_TIMEZONE_LENGTH);
    }

    /**
     * 이름만으로 생성.
     *
     * @param name 이름
     * @return NewRoutine 인스턴스
     */
    public static NewRoutine of(String name) {
        return new NewRoutine(name, null, null);
    }
}
