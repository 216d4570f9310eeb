package uk.gegc.schoolwork.features.language.domain.model;

public enum LanguageType {
    ENGLISH,
    VIETNAMESE,
    JAPANESE,
    SPANISH,
    ITALIAN,
    FRENCH,
    GERMAN,
    PORTUGUESE
}
