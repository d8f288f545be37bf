package com.invoice.submission.model;

import lombok.Value;

import java.util.List;

/**
 * The archive plus the labels whose scan could not be resolved and were left out of it.
 */
@Value
public class PackageArtifact {
    byte[] content;
    List<String> unresolvedLabels;
    List<SubmissionWarning> warnings;
}
