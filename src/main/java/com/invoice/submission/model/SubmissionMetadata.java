package com.invoice.submission.model;

import lombok.Builder;
import lombok.Value;

/**
 * Free-text header values printed above the invoice table.
 */
@Value
@Builder
public class SubmissionMetadata {
    String requestedPeriod;
    String claimantName;
    String contactEmail;
    String identifierLast4;
}
