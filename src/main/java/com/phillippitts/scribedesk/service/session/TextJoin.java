package com.phillippitts.scribedesk.service.session;

/**
 * Joins recognized fragments with single spaces, skipping blank ones.
 */
final class TextJoin {

    private TextJoin() {
    }

    static String join(String first, String second) {
        String a = first == null ? "" : first.strip();
        String b = second == null ? "" : second.strip();
        if (a.isEmpty()) {
            return b;
        }
        if (b.isEmpty()) {
            return a;
        }
        return a + " " + b;
    }
}
