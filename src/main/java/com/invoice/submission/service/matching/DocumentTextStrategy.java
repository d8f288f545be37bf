package com.invoice.submission.service.matching;

import com.invoice.submission.config.SubmissionProperties;
import com.invoice.submission.model.CanonicalInvoiceRecord;
import com.invoice.submission.model.MatchStrategy;
import com.invoice.submission.model.UploadedFile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Last resort: the printed CFDI carries its UUID, so look for it in the PDF text layer.
 */
@Component
@Order(3)
public class DocumentTextStrategy implements MatchingStrategy {

    private final SubmissionProperties properties;

    public DocumentTextStrategy(SubmissionProperties properties) {
        this.properties = properties;
    }

    @Override
    public MatchStrategy strategy() {
        return MatchStrategy.DOCUMENT_TEXT;
    }

    @Override
    public Optional<UploadedFile> findMatch(CanonicalInvoiceRecord record, MatchContext context) {
        if (!properties.getMatching().isDocumentTextEnabled() || !record.hasIdentifier()) {
            return Optional.empty();
        }
        String identifier = record.getIdentifier().toLowerCase(Locale.ROOT);

        return context.candidates().stream()
                .filter(c -> c.document().looksLikePdf())
                .filter(c -> context.textOf(c).toLowerCase(Locale.ROOT).contains(identifier))
                .map(MatchContext.Candidate::document)
                .findFirst();
    }
}
