package com.invoice.submission.service.matching;

import com.invoice.submission.model.CanonicalInvoiceRecord;
import com.invoice.submission.model.MatchStrategy;
import com.invoice.submission.model.UploadedFile;
import com.invoice.submission.service.FileNameNormalizer;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * "factura-03-final.xml" pairs with "Factura 03 (final).pdf": same key once both names
 * are normalized.
 */
@Component
@Order(1)
public class NormalizedKeyStrategy implements MatchingStrategy {

    private final FileNameNormalizer normalizer;

    public NormalizedKeyStrategy(FileNameNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    @Override
    public MatchStrategy strategy() {
        return MatchStrategy.NORMALIZED_KEY;
    }

    @Override
    public Optional<UploadedFile> findMatch(CanonicalInvoiceRecord record, MatchContext context) {
        String recordKey = normalizer.normalize(record.getSourceFileName());
        if (recordKey.isEmpty()) {
            return Optional.empty();
        }
        return context.candidates().stream()
                .filter(c -> recordKey.equals(c.key()))
                .map(MatchContext.Candidate::document)
                .findFirst();
    }
}
