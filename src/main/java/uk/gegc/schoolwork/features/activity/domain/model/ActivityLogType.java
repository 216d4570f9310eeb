package uk.gegc.schoolwork.features.activity.domain.model;

public enum ActivityLogType {
    CLASS_CREATED,
    ASSIGNMENT_CREATED,
    INDIVIDUAL_ASSIGNMENT_CREATED,
    ASSIGNMENT_ACTIVATED,
    STUDENT_CREATED,
    TEACHER_CREATED,
    USER_CREATED
}
