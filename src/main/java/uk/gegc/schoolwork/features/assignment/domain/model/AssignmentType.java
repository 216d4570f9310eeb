package uk.gegc.schoolwork.features.assignment.domain.model;

public enum AssignmentType {
    CLASS,
    INDIVIDUAL
}
