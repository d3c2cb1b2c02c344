package com.regdoc.acquirer.crawl.match;

import java.util.List;
import java.util.Locale;

public enum ValidityStatus {
    IN_FORCE,
    SUPERSEDED,
    UNKNOWN;

    private static final List<String> PENDING_MARKERS = List.of("not yet", "尚未");
    private static final List<String> SUPERSEDED_MARKERS = List.of(
        "superseded", "repealed", "expired", "amended", "invalid", "ineffective", "not in force", "no longer",
        "失效", "废止", "已修改", "已被修改", "已修订"
    );
    private static final List<String> IN_FORCE_MARKERS = List.of(
        "in force", "effective", "valid", "current", "有效", "现行"
    );

    public static ValidityStatus fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        String value = label.trim().toLowerCase(Locale.ROOT);
        for (String marker : PENDING_MARKERS) {
            if (value.contains(marker)) {
                return UNKNOWN;
            }
        }
        for (String marker : SUPERSEDED_MARKERS) {
            if (value.contains(marker)) {
                return SUPERSEDED;
            }
        }
        for (String marker : IN_FORCE_MARKERS) {
            if (value.contains(marker)) {
                return IN_FORCE;
            }
        }
        return UNKNOWN;
    }

    public boolean isConfirmedInForce() {
        return this == IN_FORCE;
    }
}
