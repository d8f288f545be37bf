package com.invoice.submission.service.matching;

import com.invoice.submission.model.CanonicalInvoiceRecord;
import com.invoice.submission.model.MatchStrategy;
import com.invoice.submission.model.UploadedFile;

import java.util.Optional;

/**
 * One way of pairing a record with an uploaded scan. Implementations must be total and
 * must not mutate the record or the context; {@link DocumentMatcher} tries them in
 * {@link org.springframework.core.annotation.Order} order and keeps the first hit.
 */
public interface MatchingStrategy {

    MatchStrategy strategy();

    /**
     * @return the first scan, in upload order, this strategy accepts for the record
     */
    Optional<UploadedFile> findMatch(CanonicalInvoiceRecord record, MatchContext context);
}
