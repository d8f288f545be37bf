package com.invoice.submission.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One change made in the review step, addressed by the CFDI file name.
 * Null fields are left untouched.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecordEdit {
    private String sourceFileName;
    private String category;
    private String currencyCode;
    private Boolean remove;

    public boolean isRemoval() {
        return Boolean.TRUE.equals(remove);
    }
}
