package com.invoice.submission.service;

import com.invoice.submission.config.SubmissionProperties;
import com.invoice.submission.model.*;
import com.invoice.submission.support.ZipContents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static com.invoice.submission.support.CfdiFixtures.scan;
import static org.assertj.core.api.Assertions.assertThat;

class PackageAssemblerTest {

    private static final byte[] SPREADSHEET = "xlsx-bytes".getBytes(StandardCharsets.UTF_8);

    private PackageAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new PackageAssembler(new SubmissionProperties());
    }

    private static CanonicalInvoiceRecord record(String source) {
        return CanonicalInvoiceRecord.builder().sourceFileName(source).build();
    }

    @Test
    void renamesMatchedScansToTheirLabels() {
        CanonicalInvoiceRecord a = record("a.xml");
        CanonicalInvoiceRecord b = record("b.xml");
        UploadedFile scanA = scan("Factura A.PDF");
        UploadedFile scanB = scan("b.jpeg");

        PackageArtifact artifact = assembler.assemble(
                List.of(new SequencedRecord("01", b), new SequencedRecord("02", a)),
                List.of(Association.resolved(a, scanA, MatchStrategy.NORMALIZED_KEY),
                        Association.resolved(b, scanB, MatchStrategy.IDENTIFIER_SUBSTRING)),
                SPREADSHEET);

        Map<String, byte[]> entries = ZipContents.read(artifact.getContent());
        assertThat(entries.keySet())
                .containsExactly("SUBMISSION IVA FORM.xlsx", "01.jpeg", "02.PDF", "MANIFEST.txt");
        assertThat(entries.get("SUBMISSION IVA FORM.xlsx")).isEqualTo(SPREADSHEET);
        assertThat(entries.get("01.jpeg")).isEqualTo(scanB.getContent());
        assertThat(entries.get("02.PDF")).isEqualTo(scanA.getContent());
        assertThat(artifact.getUnresolvedLabels()).isEmpty();
        assertThat(artifact.getWarnings()).isEmpty();

        String manifest = new String(entries.get("MANIFEST.txt"), StandardCharsets.UTF_8);
        assertThat(manifest)
                .contains("01  b.xml  ->  01.jpeg  (from 'b.jpeg', identifier-substring)")
                .contains("02  a.xml  ->  02.PDF  (from 'Factura A.PDF', normalized-key)")
                .contains("All records have a scan.");
    }

    @Test
    void omitsUnresolvedRecordsAndListsThem() {
        CanonicalInvoiceRecord a = record("a.xml");
        CanonicalInvoiceRecord b = record("b.xml");

        PackageArtifact artifact = assembler.assemble(
                List.of(new SequencedRecord("01", a), new SequencedRecord("02", b)),
                List.of(Association.resolved(a, scan("a.pdf"), MatchStrategy.NORMALIZED_KEY),
                        Association.unmatched(b)),
                SPREADSHEET);

        Map<String, byte[]> entries = ZipContents.read(artifact.getContent());
        assertThat(entries.keySet()).containsExactly("SUBMISSION IVA FORM.xlsx", "01.pdf", "MANIFEST.txt");
        assertThat(artifact.getUnresolvedLabels()).containsExactly("02");
        assertThat(artifact.getWarnings()).singleElement().satisfies(w -> {
            assertThat(w.getType()).isEqualTo(WarningType.UNMATCHED_DOCUMENT);
            assertThat(w.getSequenceLabel()).isEqualTo("02");
        });
        assertThat(new String(entries.get("MANIFEST.txt"), StandardCharsets.UTF_8))
                .contains("02  b.xml  ->  (no scan)")
                .contains("Unresolved: 02");
    }

    @Test
    void scanWithoutExtensionIsNamedByLabelAlone() {
        CanonicalInvoiceRecord a = record("a.xml");

        PackageArtifact artifact = assembler.assemble(List.of(new SequencedRecord("01", a)),
                List.of(Association.resolved(a, scan("a"), MatchStrategy.NORMALIZED_KEY)), SPREADSHEET);

        assertThat(ZipContents.read(artifact.getContent())).containsKey("01");
    }

    @Test
    void manifestIsWrittenEvenForAnEmptySet() {
        PackageArtifact artifact = assembler.assemble(List.of(), List.of(), SPREADSHEET);

        assertThat(ZipContents.read(artifact.getContent()).keySet())
                .containsExactly("SUBMISSION IVA FORM.xlsx", "MANIFEST.txt");
    }

    @Test
    void entriesAreDeflated() throws IOException {
        CanonicalInvoiceRecord a = record("a.xml");
        PackageArtifact artifact = assembler.assemble(List.of(new SequencedRecord("01", a)),
                List.of(Association.resolved(a, scan("a.pdf"), MatchStrategy.NORMALIZED_KEY)), SPREADSHEET);

        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(artifact.getContent()))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                assertThat(entry.getMethod()).isEqualTo(ZipEntry.DEFLATED);
            }
        }
    }
}
