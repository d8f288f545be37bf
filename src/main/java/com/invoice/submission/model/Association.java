package com.invoice.submission.model;

import lombok.Value;

/**
 * Result of matching one record against the uploaded scans. {@code document} is null
 * when no strategy produced a hit.
 */
@Value
public class Association {

    CanonicalInvoiceRecord record;
    UploadedFile document;
    MatchStrategy strategy;

    public static Association resolved(CanonicalInvoiceRecord record, UploadedFile document,
                                       MatchStrategy strategy) {
        return new Association(record, document, strategy);
    }

    public static Association unmatched(CanonicalInvoiceRecord record) {
        return new Association(record, null, MatchStrategy.NONE);
    }

    public boolean isResolved() {
        return document != null;
    }

    public String getMatchedFileName() {
        return document == null ? null : document.getFileName();
    }
}
