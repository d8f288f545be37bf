package com.invoice.submission.service;

import com.invoice.submission.config.SubmissionProperties;
import com.invoice.submission.model.*;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataValidationConstraint;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFDataValidation;
import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openxmlformats.schemas.spreadsheetml.x2006.main.CTDataValidation;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;

import static com.invoice.submission.service.SubmissionSpreadsheetBuilder.*;
import static com.invoice.submission.support.CfdiFixtures.UUID_A;
import static com.invoice.submission.support.CfdiFixtures.UUID_B;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class SubmissionSpreadsheetBuilderTest {

    private SubmissionProperties properties;
    private SubmissionSpreadsheetBuilder builder;

    private final SubmissionMetadata metadata = SubmissionMetadata.builder()
            .requestedPeriod("FEBRUARY 2024")
            .claimantName("Ana López")
            .contactEmail("ana@example.com")
            .identifierLast4("1234")
            .build();

    @BeforeEach
    void setUp() {
        properties = new SubmissionProperties();
        builder = new SubmissionSpreadsheetBuilder(properties, new Sequencer(properties));
    }

    private static SequencedRecord row(String label, String identifier, String total) {
        return new SequencedRecord(label, CanonicalInvoiceRecord.builder()
                .sourceFileName("f" + label + ".xml")
                .identifier(identifier)
                .issuerTaxId("AAA010101AAA")
                .taxAmount(new BigDecimal("160.50"))
                .totalAmount(total)
                .expenseCategory("Gasoline")
                .currencyCode("MXN")
                .build());
    }

    private static XSSFWorkbook read(SpreadsheetArtifact artifact) throws IOException {
        return new XSSFWorkbook(new ByteArrayInputStream(artifact.getContent()));
    }

    @Test
    void writesFixedLayout() throws IOException {
        SpreadsheetArtifact artifact = builder.build(List.of(
                row("01", UUID_A, "1160.00"), row("02", UUID_B, "2320.5")), metadata);

        assertThat(artifact.getFileName()).isEqualTo("SUBMISSION IVA FORM.xlsx");
        try (XSSFWorkbook workbook = read(artifact)) {
            XSSFSheet sheet = workbook.getSheet("SUBMISSION IVA FORM");
            assertThat(sheet).isNotNull();

            assertThat(sheet.getRow(TITLE_ROW).getCell(0).getStringCellValue()).isEqualTo("SUBMISSION IVA FORM");
            assertThat(sheet.getMergedRegions()).contains(new CellRangeAddress(0, 0, 0, 6));

            assertThat(sheet.getRow(METADATA_FIRST_ROW).getCell(0).getStringCellValue()).isEqualTo("Requested month:");
            assertThat(sheet.getRow(METADATA_FIRST_ROW).getCell(1).getStringCellValue()).isEqualTo("FEBRUARY 2024");
            assertThat(sheet.getRow(METADATA_FIRST_ROW + 1).getCell(1).getStringCellValue()).isEqualTo("Ana López");
            assertThat(sheet.getRow(METADATA_FIRST_ROW + 2).getCell(1).getStringCellValue()).isEqualTo("ana@example.com");
            assertThat(sheet.getRow(METADATA_FIRST_ROW + 3).getCell(1).getStringCellValue()).isEqualTo("1234");

            for (int col = 0; col < COLUMN_CAPTIONS.size(); col++) {
                assertThat(sheet.getRow(HEADER_ROW).getCell(col).getStringCellValue())
                        .isEqualTo(COLUMN_CAPTIONS.get(col));
            }

            XSSFRow first = sheet.getRow(FIRST_DATA_ROW);
            assertThat(first.getCell(COL_LABEL).getCellType()).isEqualTo(CellType.STRING);
            assertThat(first.getCell(COL_LABEL).getStringCellValue()).isEqualTo("01");
            assertThat(first.getCell(COL_IDENTIFIER).getStringCellValue()).isEqualTo(UUID_A);
            assertThat(first.getCell(COL_ISSUER).getStringCellValue()).isEqualTo("AAA010101AAA");
            assertThat(first.getCell(COL_TAX).getCellType()).isEqualTo(CellType.NUMERIC);
            assertThat(first.getCell(COL_TAX).getNumericCellValue()).isEqualTo(160.50);
            assertThat(first.getCell(COL_TOTAL).getNumericCellValue()).isEqualTo(1160.00);
            assertThat(first.getCell(COL_CATEGORY).getStringCellValue()).isEqualTo("Gasoline");
            assertThat(first.getCell(COL_CURRENCY).getStringCellValue()).isEqualTo("MXN");

            assertThat(sheet.getRow(FIRST_DATA_ROW + 1).getCell(COL_LABEL).getStringCellValue()).isEqualTo("02");
            assertThat(sheet.getRow(FIRST_DATA_ROW + 1).getCell(COL_TOTAL).getNumericCellValue()).isEqualTo(2320.5);
            assertThat(sheet.getLastRowNum()).isEqualTo(FIRST_DATA_ROW + 1);
        }
        assertThat(artifact.getWarnings()).isEmpty();
    }

    @Test
    void embedsThreeValidationsReachingPastTheData() throws IOException {
        SpreadsheetArtifact artifact = builder.build(List.of(row("01", UUID_A, "1"), row("02", UUID_B, "2")), metadata);

        try (XSSFWorkbook workbook = read(artifact)) {
            XSSFSheet sheet = workbook.getSheetAt(0);
            List<XSSFDataValidation> validations = sheet.getDataValidations();
            assertThat(validations).hasSize(3);

            int expectedLastRow = FIRST_DATA_ROW + 2 - 1 + 50;
            assertThat(validations).allSatisfy(v -> {
                CellRangeAddress region = v.getRegions().getCellRangeAddresses()[0];
                assertThat(region.getFirstRow()).isEqualTo(FIRST_DATA_ROW);
                assertThat(region.getLastRow()).isGreaterThanOrEqualTo(expectedLastRow);
            });

            assertThat(validations).extracting(v -> v.getRegions().getCellRangeAddresses()[0].getFirstColumn())
                    .containsExactlyInAnyOrder(COL_CATEGORY, COL_CURRENCY, COL_IDENTIFIER);

            XSSFDataValidation uuid = validations.stream()
                    .filter(v -> v.getRegions().getCellRangeAddresses()[0].getFirstColumn() == COL_IDENTIFIER)
                    .findFirst().orElseThrow();
            assertThat(uuid.getValidationConstraint().getValidationType())
                    .isEqualTo(DataValidationConstraint.ValidationType.TEXT_LENGTH);

            CTDataValidation[] raw = sheet.getCTWorksheet().getDataValidations().getDataValidationArray();
            assertThat(raw).extracting(CTDataValidation::getFormula1).contains("36");
            assertThat(raw).extracting(CTDataValidation::getFormula1)
                    .anySatisfy(f -> assertThat(f).contains("Miscellaneous").contains("Gasoline"))
                    .anySatisfy(f -> assertThat(f).contains("MXN").contains("USD"));
        }
    }

    @Test
    void enumerationsComeFromConfiguration() throws IOException {
        properties.setCategories(List.of("Miscellaneous", "Gasoline", "Tolls"));

        SpreadsheetArtifact artifact = builder.build(List.of(row("01", UUID_A, "1")), metadata);

        try (XSSFWorkbook workbook = read(artifact)) {
            CTDataValidation[] raw = workbook.getSheetAt(0).getCTWorksheet()
                    .getDataValidations().getDataValidationArray();
            assertThat(raw).extracting(CTDataValidation::getFormula1).anySatisfy(f -> assertThat(f).contains("Tolls"));
        }
    }

    @Test
    void emptyRecordSetStillHasOnePlaceholderRow() throws IOException {
        SpreadsheetArtifact artifact = builder.build(List.of(), metadata);

        try (XSSFWorkbook workbook = read(artifact)) {
            XSSFSheet sheet = workbook.getSheetAt(0);
            assertThat(sheet.getLastRowNum()).isEqualTo(FIRST_DATA_ROW);
            XSSFRow placeholder = sheet.getRow(FIRST_DATA_ROW);
            assertThat(placeholder.getCell(COL_LABEL).getStringCellValue()).isEqualTo("01");
            assertThat(placeholder.getCell(COL_CATEGORY).getStringCellValue()).isEqualTo("Miscellaneous");
            assertThat(placeholder.getCell(COL_CURRENCY).getStringCellValue()).isEqualTo("MXN");
            assertThat(sheet.getDataValidations()).hasSize(3);
        }
        assertThat(artifact.getWarnings()).isEmpty();
    }

    @Test
    void flagsIdentifiersOfTheWrongLengthButStillBuilds() throws IOException {
        SpreadsheetArtifact artifact = builder.build(List.of(
                row("01", "", "10"), row("02", UUID_A, "10"), row("03", "SHORT-ID", "10")), metadata);

        assertThat(artifact.getWarnings())
                .extracting(SubmissionWarning::getType, SubmissionWarning::getSequenceLabel)
                .containsExactly(
                        tuple(WarningType.IDENTIFIER_LENGTH_VIOLATION, "01"),
                        tuple(WarningType.IDENTIFIER_LENGTH_VIOLATION, "03"));
        try (XSSFWorkbook workbook = read(artifact)) {
            assertThat(workbook.getSheetAt(0).getRow(FIRST_DATA_ROW + 2).getCell(COL_IDENTIFIER).getStringCellValue())
                    .isEqualTo("SHORT-ID");
        }
    }

    @Test
    void nonNumericTotalIsWrittenAsZeroWithAWarning() throws IOException {
        SpreadsheetArtifact artifact = builder.build(List.of(row("01", UUID_A, "12,5O")), metadata);

        assertThat(artifact.getWarnings()).singleElement()
                .extracting(SubmissionWarning::getType).isEqualTo(WarningType.NON_NUMERIC_TOTAL);
        try (XSSFWorkbook workbook = read(artifact)) {
            assertThat(workbook.getSheetAt(0).getRow(FIRST_DATA_ROW).getCell(COL_TOTAL).getNumericCellValue())
                    .isZero();
        }
    }
}
