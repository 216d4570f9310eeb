package uk.gegc.schoolwork.features.assignment.infra.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.schoolwork.features.assignment.api.dto.AssignmentDto;
import uk.gegc.schoolwork.features.assignment.api.dto.ClassSummaryDto;
import uk.gegc.schoolwork.features.assignment.api.dto.EvaluationSettingsDto;
import uk.gegc.schoolwork.features.assignment.api.dto.LanguageDto;
import uk.gegc.schoolwork.features.assignment.api.dto.QuestionDto;
import uk.gegc.schoolwork.features.assignment.api.dto.UserSummaryDto;
import uk.gegc.schoolwork.features.assignment.domain.model.Assignment;
import uk.gegc.schoolwork.features.assignment.domain.model.EvaluationSettings;
import uk.gegc.schoolwork.features.assignment.domain.model.Question;
import uk.gegc.schoolwork.features.language.domain.model.Language;
import uk.gegc.schoolwork.features.user.domain.model.User;

import java.util.Comparator;
import java.util.List;

/**
 * Entity to DTO conversion for assignments. JSON columns are stored as text and exposed as trees.
 */
@Component
@RequiredArgsConstructor
public class AssignmentMapper {

    private final ObjectMapper objectMapper;

    public AssignmentDto toDto(Assignment assignment) {
        return new AssignmentDto(
                assignment.getId(),
                assignment.getTopic(),
                assignment.getType(),
                assignment.getColor(),
                readJson(assignment.getVocabularyItems()),
                assignment.getScheduledPublishAt(),
                assignment.getDueDate(),
                assignment.isActive(),
                assignment.getPublishedAt(),
                assignment.getVideoUrl(),
                assignment.getVideoTranscript(),
                assignment.getLanguageAssessmentType(),
                assignment.isIelts(),
                assignment.getContext(),
                assignment.getTotalStudentsInScope(),
                assignment.getCompletedStudentsCount(),
                assignment.getCompletionRate(),
                assignment.getAverageScoreOfCompleted(),
                assignment.getCreatedAt(),
                assignment.getUpdatedAt(),
                toSummary(assignment.getTeacher()),
                toDto(assignment.getLanguage()),
                toDto(assignment.getEvaluationSettings()),
                assignment.getQuestions().stream().map(this::toDto).toList(),
                assignment.getClasses().stream()
                        .map(c -> new ClassSummaryDto(c.getId(), c.getName()))
                        .sorted(Comparator.comparing(ClassSummaryDto::name, Comparator.nullsLast(String::compareTo)))
                        .toList(),
                assignment.getStudents().stream()
                        .map(this::toSummary)
                        .sorted(Comparator.comparing(UserSummaryDto::username, Comparator.nullsLast(String::compareTo)))
                        .toList()
        );
    }

    public List<AssignmentDto> toDtoList(List<Assignment> assignments) {
        return assignments.stream()
                .map(this::toDto)
                .toList();
    }

    public QuestionDto toDto(Question question) {
        return new QuestionDto(
                question.getId(),
                question.getTextQuestion(),
                question.getTextAnswer(),
                question.getImage(),
                question.getVideoUrl()
        );
    }

    public UserSummaryDto toSummary(User user) {
        return user == null ? null : new UserSummaryDto(user.getId(), user.getUsername());
    }

    private LanguageDto toDto(Language language) {
        return language == null ? null : new LanguageDto(language.getId(), language.getLanguage(), language.getCode());
    }

    private EvaluationSettingsDto toDto(EvaluationSettings settings) {
        if (settings == null) {
            return null;
        }
        return new EvaluationSettingsDto(
                settings.getId(),
                settings.getType(),
                settings.getCustomPrompt(),
                readJson(settings.getRules()),
                readJson(settings.getAcceptableResponses()),
                readJson(settings.getFeedbackSettings())
        );
    }

    public String writeJson(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise JSON value", e);
        }
    }

    public JsonNode readJson(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored JSON value is malformed", e);
        }
    }
}
