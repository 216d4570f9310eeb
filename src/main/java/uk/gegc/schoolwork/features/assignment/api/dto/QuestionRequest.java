package uk.gegc.schoolwork.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

@Schema(name = "QuestionRequest", description = "A question attached to a new assignment")
public record QuestionRequest(
        @Schema(description = "Prompt shown to the student", example = "What colour is the sky?")
        @Size(max = 5000, message = "Question text must not exceed 5000 characters")
        String textQuestion,

        @Schema(description = "Expected answer or passage text")
        @Size(max = 10000, message = "Answer text must not exceed 10000 characters")
        String textAnswer,

        @Schema(description = "Image URL")
        String image,

        @Schema(description = "Video URL for video questions")
        String videoUrl
) {
}
