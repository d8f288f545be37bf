package com.invoice.submission.model;

import lombok.Value;

import java.util.Locale;

/**
 * An uploaded payload read fully into memory, either a CFDI XML or a scan.
 */
@Value
public class UploadedFile {

    private static final byte[] PDF_MAGIC = {'%', 'P', 'D', 'F'};

    String fileName;
    byte[] content;

    public UploadedFile(String fileName, byte[] content) {
        this.fileName = fileName == null ? "" : fileName;
        this.content = content == null ? new byte[0] : content;
    }

    /**
     * Extension including the leading dot, exactly as uploaded, or "" when there is none.
     */
    public String getExtension() {
        String baseName = baseName(fileName);
        int dot = baseName.lastIndexOf('.');
        return dot < 0 ? "" : baseName.substring(dot);
    }

    public boolean looksLikePdf() {
        if (content.length >= PDF_MAGIC.length) {
            boolean magic = true;
            for (int i = 0; i < PDF_MAGIC.length; i++) {
                if (content[i] != PDF_MAGIC[i]) {
                    magic = false;
                    break;
                }
            }
            if (magic) return true;
        }
        return ".pdf".equals(getExtension().toLowerCase(Locale.ROOT));
    }

    public static String baseName(String name) {
        if (name == null) return "";
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        return slash < 0 ? name : name.substring(slash + 1);
    }
}
