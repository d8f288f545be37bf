package com.invoice.submission.model;

import lombok.Value;

@Value
public class SequencedRecord {
    String sequenceLabel;
    CanonicalInvoiceRecord record;
}
