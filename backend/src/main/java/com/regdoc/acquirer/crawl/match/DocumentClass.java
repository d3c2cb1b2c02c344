package com.regdoc.acquirer.crawl.match;

import java.util.List;

public enum DocumentClass {
    STATUTE,
    REGULATION,
    RULE,
    INTERPRETATION,
    OTHER;

    private static final List<String> INTERPRETATION_MARKERS = List.of(
        "解释", "意见", "通知", "批复", "答复", "interpretation", "opinion", "notice", "reply", "circular"
    );
    private static final List<String> RULE_MARKERS = List.of(
        "办法", "规定", "细则", "规则", "rules", "measures", "provisions"
    );
    private static final List<String> REGULATION_MARKERS = List.of("条例", "regulation");
    private static final List<String> STATUTE_MARKERS = List.of(" law", "law of", " code", "法典");

    public static DocumentClass of(String normalizedTitle) {
        if (normalizedTitle == null || normalizedTitle.isBlank()) {
            return OTHER;
        }
        String title = " " + normalizedTitle;
        if (containsAny(title, INTERPRETATION_MARKERS)) {
            return INTERPRETATION;
        }
        if (containsAny(title, RULE_MARKERS)) {
            return RULE;
        }
        if (containsAny(title, REGULATION_MARKERS)) {
            return REGULATION;
        }
        if (containsAny(title, STATUTE_MARKERS) || normalizedTitle.endsWith("法")) {
            return STATUTE;
        }
        return OTHER;
    }

    private static boolean containsAny(String title, List<String> markers) {
        for (String marker : markers) {
            if (title.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
