package com.invoice.submission.model;

import lombok.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * What the review screen shows: the sequenced rows, where each scan went,
 * and one consolidated warning list.
 */
@Data
public class SubmissionPreview {

    private List<Row> rows = new ArrayList<>();
    private List<SubmissionWarning> warnings = new ArrayList<>();
    private BigDecimal totalTaxAmount = BigDecimal.ZERO;
    private int matchedCount;
    private int unmatchedCount;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Row {
        private String sequenceLabel;
        private String identifier;
        private String issuerTaxId;
        private BigDecimal taxAmount;
        private String totalAmount;
        private String category;
        private String currencyCode;
        private String sourceFileName;
        private String matchedFileName;
        private MatchStrategy matchStrategy;
        private String parseError;
    }
}
