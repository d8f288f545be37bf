package com.invoice.submission.service;

import com.invoice.submission.config.SubmissionProperties;
import com.invoice.submission.model.CanonicalInvoiceRecord;
import com.invoice.submission.model.SequencedRecord;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders records by issue date (stable, so same-day records keep their upload order)
 * and labels them "01", "02", ... Labels are produced fresh on every call.
 */
@Service
public class Sequencer {

    private final SubmissionProperties properties;

    public Sequencer(SubmissionProperties properties) {
        this.properties = properties;
    }

    public List<SequencedRecord> sequence(List<CanonicalInvoiceRecord> records) {
        List<CanonicalInvoiceRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparing(CanonicalInvoiceRecord::getIssueDate));

        List<SequencedRecord> result = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            result.add(new SequencedRecord(label(i + 1), ordered.get(i)));
        }
        return List.copyOf(result);
    }

    public String label(int ordinal) {
        int width = Math.max(1, properties.getSequenceWidth());
        return String.format("%0" + width + "d", ordinal);
    }
}
