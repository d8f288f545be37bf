package com.invoice.submission.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the submission pipeline treats as data rather than structure:
 * the category and currency enumerations, label width and artifact names.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "submission")
public class SubmissionProperties {

    private int sequenceWidth = 2;

    private String defaultCurrency = "MXN";
    private List<String> currencies = new ArrayList<>(List.of("MXN", "USD"));

    private String defaultCategory = "Miscellaneous";
    private List<String> categories = new ArrayList<>(List.of("Miscellaneous", "Gasoline"));

    private Spreadsheet spreadsheet = new Spreadsheet();
    private Archive archive = new Archive();
    private Matching matching = new Matching();

    public boolean isKnownCategory(String category) {
        return category != null && categories.contains(category);
    }

    public boolean isKnownCurrency(String currency) {
        return currency != null && currencies.contains(currency);
    }

    @Getter
    @Setter
    public static class Spreadsheet {
        private String fileName = "SUBMISSION IVA FORM.xlsx";
        private String sheetName = "SUBMISSION IVA FORM";
        private String title = "SUBMISSION IVA FORM";
        private int extraValidationRows = 50;
    }

    @Getter
    @Setter
    public static class Archive {
        private String manifestName = "MANIFEST.txt";
    }

    @Getter
    @Setter
    public static class Matching {
        private boolean documentTextEnabled = false;
    }
}
