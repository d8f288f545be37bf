package com.invoice.submission.service.matching;

import com.invoice.submission.model.UploadedFile;
import lombok.Value;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Uploaded scans for one matching run, in upload order, with their normalized keys
 * computed once. Text layers are extracted lazily and remembered for the run only.
 */
public class MatchContext {

    private final List<Candidate> candidates;
    private final Function<UploadedFile, String> textExtractor;
    private final Map<Integer, String> textByPosition = new HashMap<>();

    public MatchContext(List<UploadedFile> uploads,
                        Function<String, String> normalizer,
                        Function<UploadedFile, String> textExtractor) {
        List<Candidate> list = new ArrayList<>(uploads.size());
        for (int i = 0; i < uploads.size(); i++) {
            UploadedFile upload = uploads.get(i);
            list.add(new Candidate(i, upload, normalizer.apply(upload.getFileName())));
        }
        this.candidates = Collections.unmodifiableList(list);
        this.textExtractor = textExtractor;
    }

    public List<Candidate> candidates() {
        return candidates;
    }

    public String textOf(Candidate candidate) {
        return textByPosition.computeIfAbsent(candidate.position(),
                p -> textExtractor.apply(candidate.document()));
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    @Value
    @Accessors(fluent = true)
    public static class Candidate {
        int position;
        UploadedFile document;
        String key;
    }
}
