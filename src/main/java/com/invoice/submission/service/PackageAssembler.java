package com.invoice.submission.service;

import com.invoice.submission.config.SubmissionProperties;
import com.invoice.submission.model.Association;
import com.invoice.submission.model.CanonicalInvoiceRecord;
import com.invoice.submission.model.PackageArtifact;
import com.invoice.submission.model.SequencedRecord;
import com.invoice.submission.model.SubmissionWarning;
import com.invoice.submission.model.WarningType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes the submission archive: the spreadsheet, every matched scan renamed to its
 * sequence label ("01.pdf", "02.jpg", ...) and a plain-text manifest. Labels come from
 * the same sequenced list the spreadsheet was rendered from.
 */
@Service
@Slf4j
public class PackageAssembler {

    private final SubmissionProperties properties;

    public PackageAssembler(SubmissionProperties properties) {
        this.properties = properties;
    }

    public PackageArtifact assemble(List<SequencedRecord> records, List<Association> associations,
                                    byte[] spreadsheet) {
        Map<CanonicalInvoiceRecord, Association> byRecord = new IdentityHashMap<>();
        for (Association association : associations) {
            byRecord.put(association.getRecord(), association);
        }

        List<String> unresolved = new ArrayList<>();
        List<SubmissionWarning> warnings = new ArrayList<>();
        StringBuilder manifest = new StringBuilder();
        manifest.append(properties.getSpreadsheet().getTitle()).append('\n')
                .append("Spreadsheet: ").append(properties.getSpreadsheet().getFileName()).append('\n')
                .append("Records: ").append(records.size()).append("\n\n");

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(buffer, StandardCharsets.UTF_8)) {
            zip.setMethod(ZipOutputStream.DEFLATED);
            zip.setLevel(Deflater.DEFAULT_COMPRESSION);

            writeEntry(zip, properties.getSpreadsheet().getFileName(), spreadsheet);

            for (SequencedRecord sequenced : records) {
                String label = sequenced.getSequenceLabel();
                CanonicalInvoiceRecord record = sequenced.getRecord();
                Association association = byRecord.get(record);

                if (association == null || !association.isResolved()) {
                    unresolved.add(label);
                    warnings.add(SubmissionWarning.builder()
                            .type(WarningType.UNMATCHED_DOCUMENT)
                            .sequenceLabel(label)
                            .sourceFileName(record.getSourceFileName())
                            .message("No scan found for " + record.getSourceFileName())
                            .build());
                    manifest.append(label).append("  ").append(record.getSourceFileName())
                            .append("  ->  (no scan)\n");
                    continue;
                }

                String entryName = label + association.getDocument().getExtension();
                writeEntry(zip, entryName, association.getDocument().getContent());
                manifest.append(label).append("  ").append(record.getSourceFileName())
                        .append("  ->  ").append(entryName)
                        .append("  (from '").append(association.getMatchedFileName())
                        .append("', ").append(association.getStrategy().getLabel()).append(")\n");
            }

            manifest.append('\n');
            if (unresolved.isEmpty()) {
                manifest.append("All records have a scan.\n");
            } else {
                manifest.append("Unresolved: ").append(String.join(", ", unresolved)).append('\n');
            }

            writeEntry(zip, properties.getArchive().getManifestName(),
                    manifest.toString().getBytes(StandardCharsets.UTF_8));

        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write submission archive", e);
        }

        log.info("Assembled archive: {} scans, {} unresolved", records.size() - unresolved.size(), unresolved.size());
        return new PackageArtifact(buffer.toByteArray(), List.copyOf(unresolved), List.copyOf(warnings));
    }

    private static void writeEntry(ZipOutputStream zip, String name, byte[] content) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(content);
        zip.closeEntry();
    }
}
