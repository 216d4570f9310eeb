package uk.gegc.schoolwork.features.assignment.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.schoolwork.features.assignment.domain.model.EvaluationType;

import java.util.UUID;

public record EvaluationSettingsDto(
        UUID id,
        EvaluationType type,
        String customPrompt,
        JsonNode rules,
        JsonNode acceptableResponses,
        JsonNode feedbackSettings
) {
}
