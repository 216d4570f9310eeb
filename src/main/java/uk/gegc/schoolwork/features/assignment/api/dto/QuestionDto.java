package uk.gegc.schoolwork.features.assignment.api.dto;

import java.util.UUID;

public record QuestionDto(UUID id, String textQuestion, String textAnswer, String image, String videoUrl) {
}
