package com.invoice.submission.service;

import com.invoice.submission.model.UploadedFile;
import org.springframework.stereotype.Service;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns an uploaded file name into a comparison key: "Fåctura 03 (final).PDF" becomes
 * "factura-03-final". Total over any input and idempotent on its own output.
 */
@Service
public class FileNameNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC_RUN = Pattern.compile("[^a-z0-9]+");

    public String normalize(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }

        String stem = stripExtension(UploadedFile.baseName(name));

        // decompose, drop the accents, recompose what is left
        String folded = Normalizer.normalize(stem, Normalizer.Form.NFD);
        folded = COMBINING_MARKS.matcher(folded).replaceAll("");
        folded = Normalizer.normalize(folded, Normalizer.Form.NFC).toLowerCase(Locale.ROOT);

        String key = NON_ALPHANUMERIC_RUN.matcher(folded).replaceAll("-");
        return trimDashes(key);
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    private static String trimDashes(String key) {
        int start = 0;
        int end = key.length();
        while (start < end && key.charAt(start) == '-') start++;
        while (end > start && key.charAt(end - 1) == '-') end--;
        return key.substring(start, end);
    }
}
