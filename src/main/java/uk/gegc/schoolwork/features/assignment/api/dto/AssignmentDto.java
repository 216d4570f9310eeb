package uk.gegc.schoolwork.features.assignment.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.schoolwork.features.assignment.domain.model.AssignmentType;
import uk.gegc.schoolwork.features.assignment.domain.model.LanguageAssessmentType;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "AssignmentDto", description = "Assignment with its questions, evaluation settings and scope")
public record AssignmentDto(
        UUID id,
        String topic,
        AssignmentType type,
        String color,
        JsonNode vocabularyItems,
        Instant scheduledPublishAt,
        Instant dueDate,
        boolean isActive,
        Instant publishedAt,
        String videoUrl,
        String videoTranscript,
        LanguageAssessmentType languageAssessmentType,
        boolean isIELTS,
        String context,
        int totalStudentsInScope,
        int completedStudentsCount,
        Double completionRate,
        Double averageScoreOfCompleted,
        Instant createdAt,
        Instant updatedAt,
        UserSummaryDto teacher,
        LanguageDto language,
        EvaluationSettingsDto evaluationSettings,
        List<QuestionDto> questions,
        List<ClassSummaryDto> classes,
        List<UserSummaryDto> students
) {
}
