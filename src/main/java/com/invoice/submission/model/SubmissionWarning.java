package com.invoice.submission.model;

import lombok.Builder;
import lombok.Value;

import java.util.Comparator;

/**
 * A non-fatal finding. Warnings are gathered per action and handed back together.
 */
@Value
@Builder(toBuilder = true)
public class SubmissionWarning {

    // zero-padded digits: the longer label is always the later one ("100" after "99")
    private static final Comparator<String> LABEL_ORDER = Comparator
            .<String>comparingInt(String::length)
            .thenComparing(Comparator.<String>naturalOrder());

    public static final Comparator<SubmissionWarning> BY_LABEL = Comparator
            .comparing(SubmissionWarning::getSequenceLabel, Comparator.nullsLast(LABEL_ORDER))
            .thenComparing(SubmissionWarning::getType);

    WarningType type;
    String sequenceLabel;
    String sourceFileName;
    String message;

    @Override
    public String toString() {
        return sequenceLabel == null
                ? type + ": " + message
                : "[" + sequenceLabel + "] " + type + ": " + message;
    }
}
