package com.invoice.submission.model;

import lombok.Value;

import java.util.List;

@Value
public class SpreadsheetArtifact {
    String fileName;
    byte[] content;
    List<SubmissionWarning> warnings;
}
