package com.ryuqq.dmo.core.model;

import com.ryuqq.dmo.core.error.DmoException;

/**
 * 입력 문자열 정규화/검증 헬퍼.
 */
final class Texts {

    private Texts() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 앞뒤 공백을 제거하고 1~maxLength 길이를 검증합니다.
     */
    static String requireName(String field, String value, int maxLength) {
        if (value == null) {
            throw DmoException.invalidInput(field + " cannot be null");
        }
        String stripped = value.strip();
        if (stripped.isEmpty()) {
            throw DmoException.invalidInput(field + " cannot be empty or whitespace");
        }
        requireMaxLength(field, stripped, maxLength);
        return stripped;
    }

    /**
     * null 허용 필드. 앞뒤 공백만 제거하고 최대 길이를 검증합니다.
     */
    static String optional(String field, String value, int maxLength) {
        if (value == null) {
            return null;
        }
        String stripped = value.strip();
        requireMaxLength(field, stripped, maxLength);
        return stripped;
    }

    /**
     * 길이는 code point 기준 (보조 평면 문자도 1자).
     */
    static void requireMaxLength(String field, String value, int maxLength) {
        int length = value.codePointCount(0, value.length());
        if (length > maxLength) {
            throw DmoException.invalidInput(
                field + " length cannot exceed " + maxLength + " characters (current: " + length + ")");
        }
    }

    static int requireOrder(int order) {
        if (order < 0) {
            throw DmoException.invalidInput("order must be >= 0 (current: " + order + ")");
        }
        return order;
    }
}
