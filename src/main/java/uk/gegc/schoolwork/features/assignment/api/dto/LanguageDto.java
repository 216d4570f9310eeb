package uk.gegc.schoolwork.features.assignment.api.dto;

import uk.gegc.schoolwork.features.language.domain.model.LanguageType;

import java.util.UUID;

public record LanguageDto(UUID id, LanguageType language, String code) {
}
