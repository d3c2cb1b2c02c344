package com.regdoc.acquirer.crawl.model;

import java.util.Map;

public record MatchCandidate(
    String title,
    String sourceRef,
    String statusLabel,
    String documentNumber,
    String publishDate,
    Integer rank,
    Map<String, String> attributes
) {
    public MatchCandidate {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static MatchCandidate of(String title, String sourceRef, String statusLabel) {
        return new MatchCandidate(title, sourceRef, statusLabel, null, null, null, Map.of());
    }
}
