package uk.gegc.schoolwork.features.studenthelp.domain.model;

public enum HelpSeverity {
    RECENT,
    WARNING,
    CRITICAL
}
