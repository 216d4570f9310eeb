package uk.gegc.schoolwork.features.assignment.domain.model;

public enum LanguageAssessmentType {
    SCRIPTED_US,
    SCRIPTED_UK,
    UNSCRIPTED_US,
    UNSCRIPTED_UK,
    PRONUNCIATION_US,
    PRONUNCIATION_UK;

    /**
     * Maps an accent code ({@code us}/{@code uk}, case-insensitive) to the pronunciation assessment.
     * Anything other than {@code uk} is treated as US English.
     */
    public static LanguageAssessmentType pronunciationFor(String accent) {
        return "uk".equalsIgnoreCase(accent) ? PRONUNCIATION_UK : PRONUNCIATION_US;
    }

    public static LanguageAssessmentType scriptedFor(String accent) {
        return "uk".equalsIgnoreCase(accent) ? SCRIPTED_UK : SCRIPTED_US;
    }

    public static LanguageAssessmentType unscriptedFor(String accent) {
        return "uk".equalsIgnoreCase(accent) ? UNSCRIPTED_UK : UNSCRIPTED_US;
    }
}
