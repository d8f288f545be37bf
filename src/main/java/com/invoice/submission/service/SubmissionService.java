package com.invoice.submission.service;

import com.invoice.submission.config.SubmissionProperties;
import com.invoice.submission.exception.MissingUploadSetException;
import com.invoice.submission.model.*;
import com.invoice.submission.service.matching.DocumentMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level orchestrator. Parses the uploaded CFDIs into a {@link SubmissionBatch},
 * applies review edits and produces the two artifacts from the same sequenced list.
 *
 * Each action hands back one consolidated, label-ordered warning list.
 */
@Service
@Slf4j
public class SubmissionService {

    private final CfdiParser parser;
    private final DocumentMatcher matcher;
    private final Sequencer sequencer;
    private final SubmissionSpreadsheetBuilder spreadsheetBuilder;
    private final PackageAssembler packageAssembler;
    private final SubmissionProperties properties;

    public SubmissionService(CfdiParser parser,
                             DocumentMatcher matcher,
                             Sequencer sequencer,
                             SubmissionSpreadsheetBuilder spreadsheetBuilder,
                             PackageAssembler packageAssembler,
                             SubmissionProperties properties) {
        this.parser = parser;
        this.matcher = matcher;
        this.sequencer = sequencer;
        this.spreadsheetBuilder = spreadsheetBuilder;
        this.packageAssembler = packageAssembler;
        this.properties = properties;
    }

    public SubmissionBatch openBatch(List<UploadedFile> invoices, List<UploadedFile> scans) {
        List<CanonicalInvoiceRecord> records = new ArrayList<>(invoices.size());
        for (UploadedFile invoice : invoices) {
            // one bad file never stops the rest of the batch
            records.add(parser.parse(invoice));
        }
        long failed = records.stream().filter(CanonicalInvoiceRecord::hasParseError).count();
        log.info("Opened batch: {} CFDIs ({} unreadable), {} scans", records.size(), failed, scans.size());
        return new SubmissionBatch(records, scans, matcher, sequencer, properties);
    }

    public void applyEdits(SubmissionBatch batch, List<RecordEdit> edits) {
        if (edits == null) return;
        for (RecordEdit edit : edits) {
            batch.apply(edit);
        }
        if (!edits.isEmpty()) {
            log.debug("Applied {} review edits", edits.size());
        }
    }

    public SubmissionPreview preview(SubmissionBatch batch) {
        List<SequencedRecord> sequenced = batch.sequenced();
        Map<CanonicalInvoiceRecord, Association> byRecord = index(batch.associations());

        SubmissionPreview preview = new SubmissionPreview();
        BigDecimal totalTax = BigDecimal.ZERO;
        List<SubmissionWarning> warnings = new ArrayList<>(batch.parseWarnings());
        warnings.addAll(batch.matchWarnings());

        for (SequencedRecord s : sequenced) {
            CanonicalInvoiceRecord record = s.getRecord();
            Association association = byRecord.get(record);
            boolean resolved = association != null && association.isResolved();

            preview.getRows().add(SubmissionPreview.Row.builder()
                    .sequenceLabel(s.getSequenceLabel())
                    .identifier(record.getIdentifier())
                    .issuerTaxId(record.getIssuerTaxId())
                    .taxAmount(record.getTaxAmount())
                    .totalAmount(record.getTotalAmount())
                    .category(record.getExpenseCategory())
                    .currencyCode(record.getCurrencyCode())
                    .sourceFileName(record.getSourceFileName())
                    .matchedFileName(resolved ? association.getMatchedFileName() : null)
                    .matchStrategy(resolved ? association.getStrategy() : MatchStrategy.NONE)
                    .parseError(record.getParseError())
                    .build());

            if (resolved) {
                preview.setMatchedCount(preview.getMatchedCount() + 1);
            } else {
                preview.setUnmatchedCount(preview.getUnmatchedCount() + 1);
                if (batch.hasScans()) {
                    warnings.add(unmatched(s));
                }
            }
            if (!record.hasValidIdentifierLength()) {
                warnings.add(SubmissionWarning.builder()
                        .type(WarningType.IDENTIFIER_LENGTH_VIOLATION)
                        .sequenceLabel(s.getSequenceLabel())
                        .sourceFileName(record.getSourceFileName())
                        .message("UUID must be exactly " + CanonicalInvoiceRecord.IDENTIFIER_LENGTH + " characters")
                        .build());
            }
            totalTax = totalTax.add(record.getTaxAmount());
        }

        preview.setTotalTaxAmount(totalTax);
        preview.setWarnings(sorted(warnings));
        return preview;
    }

    public SpreadsheetArtifact buildSpreadsheet(SubmissionBatch batch, SubmissionMetadata metadata) {
        SpreadsheetArtifact built = spreadsheetBuilder.build(batch.sequenced(), metadata);

        List<SubmissionWarning> warnings = new ArrayList<>(batch.parseWarnings());
        warnings.addAll(built.getWarnings());
        logWarnings("spreadsheet", warnings);
        return new SpreadsheetArtifact(built.getFileName(), built.getContent(), sorted(warnings));
    }

    /**
     * @throws MissingUploadSetException when the batch carries no scans at all
     */
    public PackageArtifact buildPackage(SubmissionBatch batch, SubmissionMetadata metadata) {
        if (!batch.hasScans()) {
            throw new MissingUploadSetException(
                    "No scanned documents were uploaded; the submission archive needs at least one");
        }

        List<SequencedRecord> sequenced = batch.sequenced();
        List<Association> associations = batch.associations();
        SpreadsheetArtifact spreadsheet = spreadsheetBuilder.build(sequenced, metadata);
        PackageArtifact assembled = packageAssembler.assemble(sequenced, associations, spreadsheet.getContent());

        List<SubmissionWarning> warnings = new ArrayList<>(batch.parseWarnings());
        warnings.addAll(spreadsheet.getWarnings());
        warnings.addAll(batch.matchWarnings());
        warnings.addAll(assembled.getWarnings());
        logWarnings("archive", warnings);
        return new PackageArtifact(assembled.getContent(), assembled.getUnresolvedLabels(), sorted(warnings));
    }

    // ─── HELPERS ───────────────────────────────────────────────────────────

    private static SubmissionWarning unmatched(SequencedRecord s) {
        return SubmissionWarning.builder()
                .type(WarningType.UNMATCHED_DOCUMENT)
                .sequenceLabel(s.getSequenceLabel())
                .sourceFileName(s.getRecord().getSourceFileName())
                .message("No scan found for " + s.getRecord().getSourceFileName())
                .build();
    }

    private static Map<CanonicalInvoiceRecord, Association> index(List<Association> associations) {
        Map<CanonicalInvoiceRecord, Association> byRecord = new IdentityHashMap<>();
        for (Association association : associations) {
            byRecord.put(association.getRecord(), association);
        }
        return byRecord;
    }

    private static List<SubmissionWarning> sorted(List<SubmissionWarning> warnings) {
        List<SubmissionWarning> copy = new ArrayList<>(warnings);
        copy.sort(SubmissionWarning.BY_LABEL);
        return List.copyOf(copy);
    }

    private static void logWarnings(String action, List<SubmissionWarning> warnings) {
        if (warnings.isEmpty()) {
            log.info("Built {} without warnings", action);
            return;
        }
        log.warn("Built {} with {} warnings:\n  {}", action, warnings.size(),
                String.join("\n  ", warnings.stream().map(SubmissionWarning::toString).toList()));
    }
}
