package com.invoice.submission.service.matching;

import com.invoice.submission.model.CanonicalInvoiceRecord;
import com.invoice.submission.model.MatchStrategy;
import com.invoice.submission.model.UploadedFile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Scans renamed after the fiscal UUID: the scan key contains either the whole identifier
 * or its first eight characters.
 */
@Component
@Order(2)
public class IdentifierSubstringStrategy implements MatchingStrategy {

    static final int SHORT_PREFIX_LENGTH = 8;

    @Override
    public MatchStrategy strategy() {
        return MatchStrategy.IDENTIFIER_SUBSTRING;
    }

    @Override
    public Optional<UploadedFile> findMatch(CanonicalInvoiceRecord record, MatchContext context) {
        if (!record.hasIdentifier()) {
            return Optional.empty();
        }
        String full = record.getIdentifier().toLowerCase(Locale.ROOT);
        String prefix = full.substring(0, Math.min(SHORT_PREFIX_LENGTH, full.length()));

        return context.candidates().stream()
                .filter(c -> c.key().contains(full) || c.key().contains(prefix))
                .map(MatchContext.Candidate::document)
                .findFirst();
    }
}
