package com.invoice.submission.service.matching;

import com.invoice.submission.model.Association;
import com.invoice.submission.model.CanonicalInvoiceRecord;
import com.invoice.submission.model.MatchReport;
import com.invoice.submission.model.SubmissionWarning;
import com.invoice.submission.model.UploadedFile;
import com.invoice.submission.model.WarningType;
import com.invoice.submission.service.FileNameNormalizer;
import com.invoice.submission.service.ScanTextExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Pairs every record with at most one uploaded scan.
 *
 * Strategies are tried in order and the first hit wins. Uploads are always walked in the
 * order they were given, so when several scans qualify the earliest one is taken; such
 * collisions are reported, never resolved silently.
 */
@Service
@Slf4j
public class DocumentMatcher {

    private final List<MatchingStrategy> strategies;
    private final FileNameNormalizer normalizer;
    private final ScanTextExtractor textExtractor;

    public DocumentMatcher(List<MatchingStrategy> strategies,
                           FileNameNormalizer normalizer,
                           ScanTextExtractor textExtractor) {
        this.strategies = List.copyOf(strategies);
        this.normalizer = normalizer;
        this.textExtractor = textExtractor;
    }

    public MatchReport match(List<CanonicalInvoiceRecord> records, List<UploadedFile> uploads) {
        MatchContext context = new MatchContext(uploads, normalizer::normalize, textExtractor::extractText);

        List<Association> associations = new ArrayList<>(records.size());
        for (CanonicalInvoiceRecord record : records) {
            associations.add(associate(record, context));
        }

        List<SubmissionWarning> warnings = new ArrayList<>();
        warnings.addAll(duplicateKeyWarnings(context));
        warnings.addAll(duplicateMatchWarnings(associations));

        long matched = associations.stream().filter(Association::isResolved).count();
        log.info("Matched {} of {} records against {} scans ({} warnings)",
                matched, records.size(), uploads.size(), warnings.size());

        return new MatchReport(List.copyOf(associations), List.copyOf(warnings));
    }

    private Association associate(CanonicalInvoiceRecord record, MatchContext context) {
        if (context.isEmpty()) {
            return Association.unmatched(record);
        }
        for (MatchingStrategy strategy : strategies) {
            Optional<UploadedFile> hit = strategy.findMatch(record, context);
            if (hit.isPresent()) {
                log.debug("{} -> {} via {}", record.getSourceFileName(),
                        hit.get().getFileName(), strategy.strategy().getLabel());
                return Association.resolved(record, hit.get(), strategy.strategy());
            }
        }
        log.debug("{}: no scan found", record.getSourceFileName());
        return Association.unmatched(record);
    }

    // ─── COLLISIONS ────────────────────────────────────────────────────────

    private List<SubmissionWarning> duplicateKeyWarnings(MatchContext context) {
        Map<String, List<String>> namesByKey = new LinkedHashMap<>();
        for (MatchContext.Candidate candidate : context.candidates()) {
            if (candidate.key().isEmpty()) continue;
            namesByKey.computeIfAbsent(candidate.key(), k -> new ArrayList<>())
                    .add(candidate.document().getFileName());
        }

        List<SubmissionWarning> warnings = new ArrayList<>();
        namesByKey.forEach((key, names) -> {
            if (names.size() > 1) {
                warnings.add(SubmissionWarning.builder()
                        .type(WarningType.DUPLICATE_UPLOAD_KEY)
                        .message("Scans " + names + " all normalize to '" + key
                                + "'; only '" + names.get(0) + "' can be matched by name")
                        .build());
            }
        });
        return warnings;
    }

    private List<SubmissionWarning> duplicateMatchWarnings(List<Association> associations) {
        Map<UploadedFile, List<CanonicalInvoiceRecord>> recordsByScan = new IdentityHashMap<>();
        List<UploadedFile> order = new ArrayList<>();
        for (Association association : associations) {
            if (!association.isResolved()) continue;
            List<CanonicalInvoiceRecord> list = recordsByScan.get(association.getDocument());
            if (list == null) {
                list = new ArrayList<>();
                recordsByScan.put(association.getDocument(), list);
                order.add(association.getDocument());
            }
            list.add(association.getRecord());
        }

        List<SubmissionWarning> warnings = new ArrayList<>();
        for (UploadedFile scan : order) {
            List<CanonicalInvoiceRecord> claimants = recordsByScan.get(scan);
            if (claimants.size() < 2) continue;
            for (CanonicalInvoiceRecord record : claimants) {
                warnings.add(SubmissionWarning.builder()
                        .type(WarningType.DUPLICATE_MATCH)
                        .sourceFileName(record.getSourceFileName())
                        .message("Scan '" + scan.getFileName() + "' is matched by "
                                + claimants.stream()
                                        .map(CanonicalInvoiceRecord::getSourceFileName)
                                        .collect(Collectors.joining(", ")))
                        .build());
            }
        }
        return warnings;
    }
}
