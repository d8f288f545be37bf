package com.invoice.submission.model;

import lombok.Value;

import java.util.List;

@Value
public class MatchReport {
    List<Association> associations;
    List<SubmissionWarning> warnings;
}
