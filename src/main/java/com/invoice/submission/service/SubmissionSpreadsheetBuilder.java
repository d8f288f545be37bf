package com.invoice.submission.service;

import com.invoice.submission.config.SubmissionProperties;
import com.invoice.submission.model.CanonicalInvoiceRecord;
import com.invoice.submission.model.SequencedRecord;
import com.invoice.submission.model.SpreadsheetArtifact;
import com.invoice.submission.model.SubmissionMetadata;
import com.invoice.submission.model.SubmissionWarning;
import com.invoice.submission.model.WarningType;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.ss.util.CellRangeAddressList;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders the "SUBMISSION IVA FORM" workbook.
 *
 * Layout is fixed, downstream tooling reads cells by position:
 * <pre>
 *   row 1      title (merged A:G)
 *   rows 3-6   Requested month / Claimant name / Official email / SSN (last 4), label in A, value in B
 *   row 8      column captions
 *   row 9..    one row per sequenced record
 * </pre>
 */
@Service
@Slf4j
public class SubmissionSpreadsheetBuilder {

    public static final int TITLE_ROW = 0;
    public static final int METADATA_FIRST_ROW = 2;
    public static final int HEADER_ROW = 7;
    public static final int FIRST_DATA_ROW = 8;

    public static final int COL_LABEL = 0;
    public static final int COL_IDENTIFIER = 1;
    public static final int COL_ISSUER = 2;
    public static final int COL_TAX = 3;
    public static final int COL_TOTAL = 4;
    public static final int COL_CATEGORY = 5;
    public static final int COL_CURRENCY = 6;

    public static final List<String> COLUMN_CAPTIONS = List.of(
            "No.", "FacturaID (UUID)", "RFC Emisor", "Total Impuestos (IVA)",
            "Total Comprobante", "Type", "Currency");

    static final List<String> METADATA_CAPTIONS = List.of(
            "Requested month:", "Claimant name:", "Official email:", "SSN (last 4):");

    private final SubmissionProperties properties;
    private final Sequencer sequencer;

    public SubmissionSpreadsheetBuilder(SubmissionProperties properties, Sequencer sequencer) {
        this.properties = properties;
        this.sequencer = sequencer;
    }

    public SpreadsheetArtifact build(List<SequencedRecord> records, SubmissionMetadata metadata) {
        List<SubmissionWarning> warnings = new ArrayList<>();

        try (XSSFWorkbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {

            Styles styles = new Styles(workbook);
            Sheet sheet = workbook.createSheet(properties.getSpreadsheet().getSheetName());

            writeTitle(sheet, styles);
            writeMetadata(sheet, styles, metadata);
            writeHeader(sheet, styles);

            int bodyRows;
            if (records.isEmpty()) {
                writePlaceholderRow(sheet, styles);
                bodyRows = 1;
            } else {
                int rowIndex = FIRST_DATA_ROW;
                for (SequencedRecord sequenced : records) {
                    writeRecordRow(sheet.createRow(rowIndex++), styles, sequenced, warnings);
                }
                bodyRows = records.size();
            }

            int lastValidatedRow = FIRST_DATA_ROW + bodyRows - 1
                    + Math.max(0, properties.getSpreadsheet().getExtraValidationRows());
            addValidations(sheet, lastValidatedRow);

            for (int col = COL_LABEL; col <= COL_CURRENCY; col++) {
                sheet.setColumnWidth(col, col == COL_IDENTIFIER ? 42 * 256 : 20 * 256);
            }
            sheet.createFreezePane(0, FIRST_DATA_ROW);

            workbook.write(out);
            log.info("Built submission spreadsheet: {} rows, {} warnings", records.size(), warnings.size());
            return new SpreadsheetArtifact(properties.getSpreadsheet().getFileName(),
                    out.toByteArray(), List.copyOf(warnings));

        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render submission spreadsheet", e);
        }
    }

    // ─── BANDS ─────────────────────────────────────────────────────────────

    private void writeTitle(Sheet sheet, Styles styles) {
        Row row = sheet.createRow(TITLE_ROW);
        row.setHeightInPoints(24);
        Cell cell = row.createCell(COL_LABEL);
        cell.setCellValue(properties.getSpreadsheet().getTitle());
        cell.setCellStyle(styles.title);
        sheet.addMergedRegion(new CellRangeAddress(TITLE_ROW, TITLE_ROW, COL_LABEL, COL_CURRENCY));
    }

    private void writeMetadata(Sheet sheet, Styles styles, SubmissionMetadata metadata) {
        List<String> values = List.of(
                nullToEmpty(metadata.getRequestedPeriod()),
                nullToEmpty(metadata.getClaimantName()),
                nullToEmpty(metadata.getContactEmail()),
                nullToEmpty(metadata.getIdentifierLast4()));

        for (int i = 0; i < METADATA_CAPTIONS.size(); i++) {
            Row row = sheet.createRow(METADATA_FIRST_ROW + i);
            Cell label = row.createCell(0);
            label.setCellValue(METADATA_CAPTIONS.get(i));
            label.setCellStyle(styles.metadataLabel);
            Cell value = row.createCell(1);
            value.setCellValue(values.get(i));
            value.setCellStyle(styles.metadataValue);
        }
    }

    private void writeHeader(Sheet sheet, Styles styles) {
        Row row = sheet.createRow(HEADER_ROW);
        for (int col = 0; col < COLUMN_CAPTIONS.size(); col++) {
            Cell cell = row.createCell(col);
            cell.setCellValue(COLUMN_CAPTIONS.get(col));
            cell.setCellStyle(styles.header);
        }
    }

    private void writeRecordRow(Row row, Styles styles, SequencedRecord sequenced,
                                List<SubmissionWarning> warnings) {
        CanonicalInvoiceRecord record = sequenced.getRecord();
        String label = sequenced.getSequenceLabel();

        if (!record.hasValidIdentifierLength()) {
            warnings.add(SubmissionWarning.builder()
                    .type(WarningType.IDENTIFIER_LENGTH_VIOLATION)
                    .sequenceLabel(label)
                    .sourceFileName(record.getSourceFileName())
                    .message("UUID '" + nullToEmpty(record.getIdentifier()) + "' has "
                            + nullToEmpty(record.getIdentifier()).length() + " characters, expected "
                            + CanonicalInvoiceRecord.IDENTIFIER_LENGTH)
                    .build());
        }

        textCell(row, COL_LABEL, label, styles.text);
        textCell(row, COL_IDENTIFIER, record.getIdentifier(), styles.text);
        textCell(row, COL_ISSUER, record.getIssuerTaxId(), styles.text);

        Cell tax = row.createCell(COL_TAX);
        tax.setCellValue(record.getTaxAmount() == null ? 0d : record.getTaxAmount().doubleValue());
        tax.setCellStyle(styles.amount);

        Cell total = row.createCell(COL_TOTAL);
        total.setCellValue(totalAsNumber(record, label, warnings));
        total.setCellStyle(styles.amount);

        textCell(row, COL_CATEGORY, record.getExpenseCategory(), styles.text);
        textCell(row, COL_CURRENCY, record.getCurrencyCode(), styles.text);
    }

    private void writePlaceholderRow(Sheet sheet, Styles styles) {
        Row row = sheet.createRow(FIRST_DATA_ROW);
        textCell(row, COL_LABEL, sequencer.label(1), styles.text);
        textCell(row, COL_IDENTIFIER, "", styles.text);
        textCell(row, COL_ISSUER, "", styles.text);
        Cell tax = row.createCell(COL_TAX);
        tax.setCellValue(0d);
        tax.setCellStyle(styles.amount);
        Cell total = row.createCell(COL_TOTAL);
        total.setCellValue(0d);
        total.setCellStyle(styles.amount);
        textCell(row, COL_CATEGORY, properties.getDefaultCategory(), styles.text);
        textCell(row, COL_CURRENCY, properties.getDefaultCurrency(), styles.text);
    }

    // ─── VALIDATION ────────────────────────────────────────────────────────

    private void addValidations(Sheet sheet, int lastRow) {
        DataValidationHelper helper = sheet.getDataValidationHelper();

        addValidation(sheet, helper.createExplicitListConstraint(
                        properties.getCategories().toArray(new String[0])),
                COL_CATEGORY, lastRow, "Type", "Choose one of " + properties.getCategories());

        addValidation(sheet, helper.createExplicitListConstraint(
                        properties.getCurrencies().toArray(new String[0])),
                COL_CURRENCY, lastRow, "Currency", "Choose one of " + properties.getCurrencies());

        addValidation(sheet, helper.createTextLengthConstraint(
                        DataValidationConstraint.OperatorType.EQUAL,
                        String.valueOf(CanonicalInvoiceRecord.IDENTIFIER_LENGTH), null),
                COL_IDENTIFIER, lastRow, "UUID",
                "The UUID must be exactly " + CanonicalInvoiceRecord.IDENTIFIER_LENGTH + " characters");
    }

    private void addValidation(Sheet sheet, DataValidationConstraint constraint, int column,
                               int lastRow, String title, String message) {
        DataValidationHelper helper = sheet.getDataValidationHelper();
        CellRangeAddressList range = new CellRangeAddressList(FIRST_DATA_ROW, lastRow, column, column);
        DataValidation validation = helper.createValidation(constraint, range);
        validation.setShowErrorBox(true);
        validation.setErrorStyle(DataValidation.ErrorStyle.STOP);
        validation.createErrorBox(title, message);
        sheet.addValidationData(validation);
    }

    // ─── CELLS ─────────────────────────────────────────────────────────────

    private double totalAsNumber(CanonicalInvoiceRecord record, String label, List<SubmissionWarning> warnings) {
        String raw = nullToEmpty(record.getTotalAmount()).trim();
        try {
            return new BigDecimal(raw).doubleValue();
        } catch (NumberFormatException e) {
            warnings.add(SubmissionWarning.builder()
                    .type(WarningType.NON_NUMERIC_TOTAL)
                    .sequenceLabel(label)
                    .sourceFileName(record.getSourceFileName())
                    .message("Total '" + raw + "' is not a number; written as 0")
                    .build());
            return 0d;
        }
    }

    private static void textCell(Row row, int column, String value, CellStyle style) {
        Cell cell = row.createCell(column, CellType.STRING);
        cell.setCellValue(nullToEmpty(value));
        cell.setCellStyle(style);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static final class Styles {
        final CellStyle title;
        final CellStyle metadataLabel;
        final CellStyle metadataValue;
        final CellStyle header;
        final CellStyle text;
        final CellStyle amount;

        Styles(Workbook workbook) {
            Font titleFont = workbook.createFont();
            titleFont.setBold(true);
            titleFont.setFontHeightInPoints((short) 14);
            title = workbook.createCellStyle();
            title.setFont(titleFont);
            title.setAlignment(HorizontalAlignment.CENTER);
            title.setVerticalAlignment(VerticalAlignment.CENTER);

            Font labelFont = workbook.createFont();
            labelFont.setBold(true);
            labelFont.setColor(IndexedColors.GREEN.getIndex());
            metadataLabel = workbook.createCellStyle();
            metadataLabel.setFont(labelFont);

            Font boldFont = workbook.createFont();
            boldFont.setBold(true);
            metadataValue = workbook.createCellStyle();
            metadataValue.setFont(boldFont);

            Font headerFont = workbook.createFont();
            headerFont.setBold(true);
            headerFont.setColor(IndexedColors.WHITE.getIndex());
            header = workbook.createCellStyle();
            header.setFont(headerFont);
            header.setAlignment(HorizontalAlignment.CENTER);
            header.setVerticalAlignment(VerticalAlignment.CENTER);
            header.setFillForegroundColor(IndexedColors.ROYAL_BLUE.getIndex());
            header.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            bordered(header);

            DataFormat format = workbook.createDataFormat();
            text = workbook.createCellStyle();
            text.setDataFormat(format.getFormat("@"));
            bordered(text);

            amount = workbook.createCellStyle();
            amount.setDataFormat(format.getFormat("#,##0.00"));
            bordered(amount);
        }

        private static void bordered(CellStyle style) {
            style.setBorderTop(BorderStyle.THIN);
            style.setBorderBottom(BorderStyle.THIN);
            style.setBorderLeft(BorderStyle.THIN);
            style.setBorderRight(BorderStyle.THIN);
        }
    }
}
