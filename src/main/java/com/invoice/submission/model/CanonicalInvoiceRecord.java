package com.invoice.submission.model;

import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One CFDI reduced to the fields the IVA submission needs.
 * Records are never dropped: a payload that could not be read still yields
 * a record carrying {@link #parseError} and zeroed amounts.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class CanonicalInvoiceRecord {

    public static final int IDENTIFIER_LENGTH = 36;

    // Ordering only, never rendered.
    public static final LocalDate UNKNOWN_ISSUE_DATE = LocalDate.EPOCH;

    @Builder.Default
    private String identifier = "";

    @Builder.Default
    private String issuerTaxId = "";

    @Builder.Default
    private BigDecimal taxAmount = BigDecimal.ZERO;

    @Builder.Default
    private String totalAmount = "0";

    private String currencyCode;

    @Builder.Default
    private LocalDate issueDate = UNKNOWN_ISSUE_DATE;

    private String expenseCategory;

    private String sourceFileName;

    private String parseError;

    public boolean hasParseError() {
        return parseError != null;
    }

    public boolean hasIdentifier() {
        return identifier != null && !identifier.isEmpty();
    }

    public boolean hasValidIdentifierLength() {
        return identifier != null && identifier.length() == IDENTIFIER_LENGTH;
    }

    public static CanonicalInvoiceRecord failed(String sourceFileName, String error,
                                                String currencyCode, String category) {
        return CanonicalInvoiceRecord.builder()
                .sourceFileName(sourceFileName)
                .currencyCode(currencyCode)
                .expenseCategory(category)
                .parseError(error)
                .build();
    }
}
