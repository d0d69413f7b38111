package com.ryuqq.dmo.core.util;

import java.util.Comparator;

/**
 * Name ordering shared by all backends.
 *
 * <p>Compares by Unicode code point, which matches SQLite's {@code BINARY} collation and
 * PostgreSQL's {@code "C"} collation on UTF-8 data. {@link String#compareTo(String)}
 * compares UTF-16 units and disagrees for supplementary characters.</p>
 *
 * @author DMO Team
 * @since 1.0.0
 */
public final class NameOrder {

    /**
     * Code point order comparator.
     */
    public static final Comparator<String> CODE_POINT = NameOrder::compare;

    private NameOrder() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Compares two strings code point by code point.
     *
     * @param a first string
     * @param b second string
     * @return negative, zero or positive
     */
    public static int compare(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }
}
