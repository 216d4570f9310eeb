package uk.gegc.schoolwork.features.progress.domain.model;

public enum SubmissionType {
    VIDEO,
    READING,
    PRONUNCIATION,
    Q_AND_A,
    IMAGE,
    CUSTOM
}
