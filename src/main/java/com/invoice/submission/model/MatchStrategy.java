package com.invoice.submission.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchStrategy {

    NORMALIZED_KEY("normalized-key"),
    IDENTIFIER_SUBSTRING("identifier-substring"),
    DOCUMENT_TEXT("document-text"),
    NONE("none");

    private final String label;

    MatchStrategy(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
