package com.invoice.submission.service;

import com.invoice.submission.model.UploadedFile;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.io.RandomAccessReadBuffer;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Pulls the text layer out of a scanned PDF. Image-only scans simply yield no text.
 */
@Service
@Slf4j
public class ScanTextExtractor {

    /**
     * @return the extracted text, or "" when the upload is not a readable PDF
     */
    public String extractText(UploadedFile scan) {
        if (!scan.looksLikePdf() || scan.getContent().length == 0) {
            return "";
        }
        try (PDDocument doc = Loader.loadPDF(new RandomAccessReadBuffer(scan.getContent()))) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            String text = stripper.getText(doc);
            return text == null ? "" : text;
        } catch (IOException e) {
            log.warn("Could not read text from scan {}: {}", scan.getFileName(), e.getMessage());
            return "";
        }
    }
}
