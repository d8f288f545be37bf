package com.invoice.submission.service;

import com.invoice.submission.config.SubmissionProperties;
import com.invoice.submission.model.Association;
import com.invoice.submission.model.CanonicalInvoiceRecord;
import com.invoice.submission.model.MatchReport;
import com.invoice.submission.model.RecordEdit;
import com.invoice.submission.model.SequencedRecord;
import com.invoice.submission.model.SubmissionWarning;
import com.invoice.submission.model.UploadedFile;
import com.invoice.submission.model.WarningType;
import com.invoice.submission.service.matching.DocumentMatcher;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The record set and scans of one review/build session.
 *
 * Any edit drops the cached associations and labels; the next read recomputes both,
 * so a label from before an edit can never reach the spreadsheet or the archive.
 * Not thread-safe, a batch belongs to a single request.
 */
@Slf4j
public class SubmissionBatch {

    private final List<CanonicalInvoiceRecord> records;
    private final List<UploadedFile> scans;
    private final DocumentMatcher matcher;
    private final Sequencer sequencer;
    private final SubmissionProperties properties;

    private List<SequencedRecord> sequenced;
    private MatchReport matchReport;

    SubmissionBatch(List<CanonicalInvoiceRecord> records, List<UploadedFile> scans,
                    DocumentMatcher matcher, Sequencer sequencer, SubmissionProperties properties) {
        this.records = new ArrayList<>(records);
        this.scans = List.copyOf(scans);
        this.matcher = matcher;
        this.sequencer = sequencer;
        this.properties = properties;
    }

    public List<CanonicalInvoiceRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public List<UploadedFile> scans() {
        return scans;
    }

    public boolean hasScans() {
        return !scans.isEmpty();
    }

    // ─── EDITS ─────────────────────────────────────────────────────────────

    public void apply(RecordEdit edit) {
        if (edit == null || edit.getSourceFileName() == null) {
            throw new IllegalArgumentException("Edit must name the CFDI file it applies to");
        }
        if (edit.isRemoval()) {
            remove(edit.getSourceFileName());
            return;
        }
        if (edit.getCategory() != null) {
            updateCategory(edit.getSourceFileName(), edit.getCategory());
        }
        if (edit.getCurrencyCode() != null) {
            updateCurrency(edit.getSourceFileName(), edit.getCurrencyCode());
        }
    }

    public void updateCategory(String sourceFileName, String category) {
        if (!properties.isKnownCategory(category)) {
            throw new IllegalArgumentException("Unknown category '" + category
                    + "', expected one of " + properties.getCategories());
        }
        require(sourceFileName).setExpenseCategory(category);
        invalidate();
    }

    public void updateCurrency(String sourceFileName, String currencyCode) {
        if (!properties.isKnownCurrency(currencyCode)) {
            throw new IllegalArgumentException("Unknown currency '" + currencyCode
                    + "', expected one of " + properties.getCurrencies());
        }
        require(sourceFileName).setCurrencyCode(currencyCode);
        invalidate();
    }

    public void remove(String sourceFileName) {
        records.remove(require(sourceFileName));
        invalidate();
    }

    private CanonicalInvoiceRecord require(String sourceFileName) {
        return find(sourceFileName).orElseThrow(() ->
                new IllegalArgumentException("No CFDI named '" + sourceFileName + "' in this batch"));
    }

    private Optional<CanonicalInvoiceRecord> find(String sourceFileName) {
        return records.stream()
                .filter(r -> sourceFileName.equals(r.getSourceFileName()))
                .findFirst();
    }

    private void invalidate() {
        sequenced = null;
        matchReport = null;
    }

    // ─── DERIVED ───────────────────────────────────────────────────────────

    public List<SequencedRecord> sequenced() {
        if (sequenced == null) {
            sequenced = sequencer.sequence(records);
        }
        return sequenced;
    }

    public List<Association> associations() {
        return matchReport().getAssociations();
    }

    private MatchReport matchReport() {
        if (matchReport == null) {
            matchReport = matcher.match(records, scans);
        }
        return matchReport;
    }

    public List<SubmissionWarning> parseWarnings() {
        List<SubmissionWarning> warnings = new ArrayList<>();
        for (SequencedRecord s : sequenced()) {
            if (s.getRecord().hasParseError()) {
                warnings.add(SubmissionWarning.builder()
                        .type(WarningType.STRUCTURAL_PARSE_ERROR)
                        .sequenceLabel(s.getSequenceLabel())
                        .sourceFileName(s.getRecord().getSourceFileName())
                        .message(s.getRecord().getParseError())
                        .build());
            }
        }
        return warnings;
    }

    /**
     * Matcher findings with the current sequence label filled in.
     */
    public List<SubmissionWarning> matchWarnings() {
        List<SubmissionWarning> warnings = new ArrayList<>();
        for (SubmissionWarning warning : matchReport().getWarnings()) {
            warnings.add(warning.getSourceFileName() == null
                    ? warning
                    : warning.toBuilder().sequenceLabel(labelOf(warning.getSourceFileName())).build());
        }
        return warnings;
    }

    private String labelOf(String sourceFileName) {
        return sequenced().stream()
                .filter(s -> sourceFileName.equals(s.getRecord().getSourceFileName()))
                .map(SequencedRecord::getSequenceLabel)
                .findFirst()
                .orElse(null);
    }
}
