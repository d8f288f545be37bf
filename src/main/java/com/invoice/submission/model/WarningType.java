package com.invoice.submission.model;

public enum WarningType {
    STRUCTURAL_PARSE_ERROR,
    UNMATCHED_DOCUMENT,
    IDENTIFIER_LENGTH_VIOLATION,
    DUPLICATE_UPLOAD_KEY,
    DUPLICATE_MATCH,
    NON_NUMERIC_TOTAL
}
