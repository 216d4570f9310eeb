package uk.gegc.schoolwork.features.assignment.domain.model;

public enum EvaluationType {
    CUSTOM,
    IMAGE,
    VIDEO,
    Q_AND_A,
    READING,
    PRONUNCIATION
}
