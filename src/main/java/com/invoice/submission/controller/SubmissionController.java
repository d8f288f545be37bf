package com.invoice.submission.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoice.submission.model.*;
import com.invoice.submission.service.RequestedPeriodProvider;
import com.invoice.submission.service.SubmissionBatch;
import com.invoice.submission.service.SubmissionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Upload surface for the IVA submission. Every call is self-contained: CFDIs, scans and
 * review edits arrive together, the batch is rebuilt and the requested artifact returned.
 */
@RestController
@RequestMapping("/api/submissions")
@Slf4j
public class SubmissionController {

    static final String WARNINGS_HEADER = "X-Submission-Warnings";
    static final String UNRESOLVED_HEADER = "X-Submission-Unresolved";
    static final MediaType XLSX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");
    static final String ARCHIVE_NAME = "submission.zip";

    private final SubmissionService submissionService;
    private final RequestedPeriodProvider requestedPeriodProvider;
    private final ObjectMapper objectMapper;

    public SubmissionController(SubmissionService submissionService,
                                RequestedPeriodProvider requestedPeriodProvider,
                                ObjectMapper objectMapper) {
        this.submissionService = submissionService;
        this.requestedPeriodProvider = requestedPeriodProvider;
        this.objectMapper = objectMapper;
    }

    /**
     * Review step: sequenced rows, where each scan landed, and every warning.
     */
    @PostMapping(value = "/preview", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<SubmissionPreview> preview(
            @RequestParam("invoices") List<MultipartFile> invoices,
            @RequestParam(value = "scans", required = false) List<MultipartFile> scans,
            @RequestParam(value = "edits", required = false) String edits) throws IOException {

        SubmissionBatch batch = openBatch(invoices, scans, edits);
        return ResponseEntity.ok(submissionService.preview(batch));
    }

    @PostMapping(value = "/spreadsheet", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> spreadsheet(
            @RequestParam("invoices") List<MultipartFile> invoices,
            @RequestParam(value = "scans", required = false) List<MultipartFile> scans,
            @RequestParam(value = "edits", required = false) String edits,
            @RequestParam(value = "claimantName", required = false) String claimantName,
            @RequestParam(value = "contactEmail", required = false) String contactEmail,
            @RequestParam(value = "identifierLast4", required = false) String identifierLast4,
            @RequestParam(value = "requestedPeriod", required = false) String requestedPeriod) throws IOException {

        SubmissionBatch batch = openBatch(invoices, scans, edits);
        SpreadsheetArtifact artifact = submissionService.buildSpreadsheet(batch,
                metadata(claimantName, contactEmail, identifierLast4, requestedPeriod));

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, attachment(artifact.getFileName()))
                .header(WARNINGS_HEADER, String.valueOf(artifact.getWarnings().size()))
                .contentType(XLSX)
                .body(artifact.getContent());
    }

    @PostMapping(value = "/package", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> submissionPackage(
            @RequestParam("invoices") List<MultipartFile> invoices,
            @RequestParam(value = "scans", required = false) List<MultipartFile> scans,
            @RequestParam(value = "edits", required = false) String edits,
            @RequestParam(value = "claimantName", required = false) String claimantName,
            @RequestParam(value = "contactEmail", required = false) String contactEmail,
            @RequestParam(value = "identifierLast4", required = false) String identifierLast4,
            @RequestParam(value = "requestedPeriod", required = false) String requestedPeriod) throws IOException {

        SubmissionBatch batch = openBatch(invoices, scans, edits);
        PackageArtifact artifact = submissionService.buildPackage(batch,
                metadata(claimantName, contactEmail, identifierLast4, requestedPeriod));

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, attachment(ARCHIVE_NAME))
                .header(WARNINGS_HEADER, String.valueOf(artifact.getWarnings().size()))
                .header(UNRESOLVED_HEADER, String.join(",", artifact.getUnresolvedLabels()))
                .contentType(MediaType.parseMediaType("application/zip"))
                .body(artifact.getContent());
    }

    // ─── REQUEST MAPPING ───────────────────────────────────────────────────

    private SubmissionBatch openBatch(List<MultipartFile> invoices, List<MultipartFile> scans,
                                      String edits) throws IOException {
        SubmissionBatch batch = submissionService.openBatch(read(invoices), read(scans));
        submissionService.applyEdits(batch, parseEdits(edits));
        return batch;
    }

    private static List<UploadedFile> read(List<MultipartFile> files) throws IOException {
        List<UploadedFile> uploads = new ArrayList<>();
        if (files == null) return uploads;
        for (MultipartFile file : files) {
            if (file == null) continue;
            String name = file.getOriginalFilename();
            // browsers post an empty, nameless part when nothing was picked
            if (file.isEmpty() && (name == null || name.isBlank())) continue;
            uploads.add(new UploadedFile(name, file.getBytes()));
        }
        return uploads;
    }

    private List<RecordEdit> parseEdits(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, new TypeReference<List<RecordEdit>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed edits: " + e.getOriginalMessage(), e);
        }
    }

    private SubmissionMetadata metadata(String claimantName, String contactEmail,
                                        String identifierLast4, String requestedPeriod) {
        return SubmissionMetadata.builder()
                .claimantName(claimantName)
                .contactEmail(contactEmail)
                .identifierLast4(lastFour(identifierLast4))
                .requestedPeriod(requestedPeriod == null || requestedPeriod.isBlank()
                        ? requestedPeriodProvider.currentRequestedPeriod()
                        : requestedPeriod)
                .build();
    }

    private static String lastFour(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.length() <= 4 ? trimmed : trimmed.substring(trimmed.length() - 4);
    }

    // the charset form also turns filename into an RFC 2047 word, so keep it for non-ASCII names
    static String attachment(String fileName) {
        ContentDisposition.Builder disposition = ContentDisposition.attachment();
        if (StandardCharsets.US_ASCII.newEncoder().canEncode(fileName)) {
            disposition.filename(fileName);
        } else {
            disposition.filename(fileName, StandardCharsets.UTF_8);
        }
        return disposition.build().toString();
    }
}
