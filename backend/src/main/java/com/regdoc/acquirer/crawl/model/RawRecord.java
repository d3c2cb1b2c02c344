package com.regdoc.acquirer.crawl.model;

import java.util.Map;

public record RawRecord(
    String sourceUrl,
    String title,
    String documentNumber,
    String publishDate,
    String status,
    String content,
    Map<String, String> attributes
) {
    public RawRecord {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
