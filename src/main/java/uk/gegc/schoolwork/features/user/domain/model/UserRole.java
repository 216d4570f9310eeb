package uk.gegc.schoolwork.features.user.domain.model;

public enum UserRole {
    TEACHER,
    ADMIN,
    STUDENT,
    PARENT;

    public String authority() {
        return "ROLE_" + name();
    }
}
