package uk.gegc.schoolwork.features.assignment.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.schoolwork.features.assignment.api.dto.AssignmentDto;
import uk.gegc.schoolwork.features.assignment.api.dto.CreateAssignmentRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.EvaluationSettingsRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.FeedbackSettingsRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.IeltsPronunciationRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.IeltsQuestionAndAnswerRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.IeltsQuestionRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.IeltsReadingRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.PassageRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.PronunciationAssignmentRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.QuestionRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.ReadingAssignmentRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.VideoAssignmentRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.VideoQuestionRequest;
import uk.gegc.schoolwork.features.assignment.application.AssignmentService;
import uk.gegc.schoolwork.features.assignment.application.AssignmentVariantService;
import uk.gegc.schoolwork.features.assignment.domain.model.AssignmentType;
import uk.gegc.schoolwork.features.assignment.domain.model.EvaluationType;
import uk.gegc.schoolwork.features.assignment.domain.model.LanguageAssessmentType;
import uk.gegc.schoolwork.features.language.application.LanguageResolver;
import uk.gegc.schoolwork.features.user.domain.model.User;
import uk.gegc.schoolwork.shared.exception.ValidationException;
import uk.gegc.schoolwork.shared.security.AccessPolicy;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AssignmentVariantServiceImpl implements AssignmentVariantService {

    static final String IELTS_QA_COLOR = "#22C55E";
    static final String IELTS_PRONUNCIATION_COLOR = "#8B5CF6";
    static final String IELTS_READING_COLOR = "#10B981";
    static final String IELTS_SCORING = "ielts";

    private final AssignmentService assignmentService;
    private final LanguageResolver languageResolver;
    private final AccessPolicy accessPolicy;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public AssignmentDto createVideoAssignment(User currentUser, VideoAssignmentRequest request) {
        accessPolicy.requireStaff(currentUser);
        UUID languageId = languageResolver.resolveRequired(request.languageId()).getId();

        List<QuestionRequest> questions = request.questions().stream()
                .map(this::toQuestion)
                .toList();

        ArrayNode rules = objectMapper.createArrayNode();
        if (request.rules() != null) {
            request.rules().forEach(rules::add);
        }
        ObjectNode feedback = objectMapper.createObjectNode();
        FeedbackSettingsRequest fs = request.feedbackSettings();
        if (fs != null) {
            feedback.put("detailedFeedback", Boolean.TRUE.equals(fs.detailedFeedback()));
            feedback.put("encouragementEnabled", Boolean.TRUE.equals(fs.encouragementEnabled()));
        }

        boolean entireClass = request.assignToEntireClass();
        CreateAssignmentRequest create = new CreateAssignmentRequest(
                request.topic(),
                entireClass ? AssignmentType.CLASS : AssignmentType.INDIVIDUAL,
                request.color(),
                null,
                request.scheduledPublishAt(),
                request.dueDate(),
                request.videoUrl(),
                blankToNull(request.videoTranscript()),
                null,
                false,
                null,
                languageId,
                entireClass ? request.classIds() : null,
                entireClass ? null : request.studentIds(),
                questions,
                new EvaluationSettingsRequest(EvaluationType.VIDEO, null, rules, objectMapper.createArrayNode(), feedback)
        );
        return assignmentService.createAssignment(currentUser, create);
    }

    @Override
    @Transactional
    public AssignmentDto createReadingAssignment(User currentUser, ReadingAssignmentRequest request) {
        accessPolicy.requireStaff(currentUser);
        UUID languageId = languageResolver.resolveRequired(request.languageId()).getId();

        EvaluationSettingsRequest settings = request.evaluationSettings();
        if (settings == null) {
            settings = new EvaluationSettingsRequest(EvaluationType.READING, null, null, null, null);
        } else if (settings.type() != EvaluationType.READING) {
            throw new ValidationException("Reading assignments must use READING evaluation");
        }

        boolean byClass = request.type() == AssignmentType.CLASS;
        CreateAssignmentRequest create = new CreateAssignmentRequest(
                request.topic(),
                request.type(),
                request.color(),
                request.vocabularyItems(),
                request.scheduledPublishAt(),
                request.dueDate(),
                null,
                null,
                null,
                request.isIELTS(),
                request.context(),
                languageId,
                byClass ? request.classIds() : null,
                byClass ? null : request.studentIds(),
                null,
                settings
        );
        return assignmentService.createAssignment(currentUser, create);
    }

    @Override
    @Transactional
    public AssignmentDto createPronunciationAssignment(User currentUser, PronunciationAssignmentRequest request) {
        accessPolicy.requireStaff(currentUser);
        UUID languageId = languageResolver.resolve(request.languageId()).map(l -> l.getId()).orElse(null);

        boolean individual = request.studentIds() != null && !request.studentIds().isEmpty();
        CreateAssignmentRequest create = new CreateAssignmentRequest(
                request.topic(),
                individual ? AssignmentType.INDIVIDUAL : AssignmentType.CLASS,
                request.color(),
                null,
                request.scheduledPublishAt(),
                request.dueDate(),
                null,
                null,
                null,
                false,
                null,
                languageId,
                individual ? null : request.classIds(),
                individual ? request.studentIds() : null,
                passagesToQuestions(request.questions()),
                new EvaluationSettingsRequest(EvaluationType.PRONUNCIATION, null, null, null, null)
        );
        return assignmentService.createAssignment(currentUser, create);
    }

    @Override
    @Transactional
    public AssignmentDto createIeltsQuestionAndAnswer(User currentUser, IeltsQuestionAndAnswerRequest request) {
        accessPolicy.requireStaff(currentUser);
        UUID languageId = languageResolver.resolveRequired(request.languageId()).getId();

        List<QuestionRequest> questions = request.questions().stream()
                .map(q -> new QuestionRequest(q.text(), null, null, null))
                .toList();

        // Per-question topic and level travel as grading rules, in question order
        ArrayNode rules = objectMapper.createArrayNode();
        for (IeltsQuestionRequest question : request.questions()) {
            ObjectNode rule = rules.addObject();
            rule.put("question", question.text());
            if (question.topic() != null) {
                rule.put("topic", question.topic());
            }
            rule.put("expectedLevel", question.expectedLevel());
        }

        boolean entireClass = request.assignToEntireClass();
        CreateAssignmentRequest create = new CreateAssignmentRequest(
                request.topic(),
                entireClass ? AssignmentType.CLASS : AssignmentType.INDIVIDUAL,
                colorOrDefault(request.color(), IELTS_QA_COLOR),
                null,
                request.scheduledPublishAt(),
                request.dueDate(),
                null,
                null,
                LanguageAssessmentType.unscriptedFor(request.accent()),
                true,
                request.context(),
                languageId,
                entireClass ? request.classIds() : null,
                entireClass ? null : request.studentIds(),
                questions,
                new EvaluationSettingsRequest(EvaluationType.Q_AND_A, request.context(), rules,
                        objectMapper.createArrayNode(), ieltsFeedback(request.accent()))
        );
        return assignmentService.createAssignment(currentUser, create);
    }

    @Override
    @Transactional
    public AssignmentDto createIeltsPronunciation(User currentUser, IeltsPronunciationRequest request) {
        accessPolicy.requireStaff(currentUser);
        UUID languageId = languageResolver.resolveRequired(request.languageId()).getId();

        boolean entireClass = request.assignToEntireClass();
        CreateAssignmentRequest create = new CreateAssignmentRequest(
                request.topic(),
                entireClass ? AssignmentType.CLASS : AssignmentType.INDIVIDUAL,
                colorOrDefault(request.color(), IELTS_PRONUNCIATION_COLOR),
                null,
                request.scheduledPublishAt(),
                request.dueDate(),
                null,
                null,
                LanguageAssessmentType.pronunciationFor(request.accent()),
                true,
                null,
                languageId,
                entireClass ? request.classIds() : null,
                entireClass ? null : request.studentIds(),
                passagesToQuestions(request.passages()),
                new EvaluationSettingsRequest(EvaluationType.PRONUNCIATION, null, objectMapper.createArrayNode(),
                        objectMapper.createArrayNode(), ieltsFeedback(request.accent()))
        );
        return assignmentService.createAssignment(currentUser, create);
    }

    @Override
    @Transactional
    public AssignmentDto createIeltsReading(User currentUser, IeltsReadingRequest request) {
        accessPolicy.requireStaff(currentUser);
        UUID languageId = languageResolver.resolveRequired(request.languageId()).getId();

        boolean entireClass = request.assignToEntireClass();
        CreateAssignmentRequest create = new CreateAssignmentRequest(
                request.topic(),
                entireClass ? AssignmentType.CLASS : AssignmentType.INDIVIDUAL,
                colorOrDefault(request.color(), IELTS_READING_COLOR),
                null,
                request.scheduledPublishAt(),
                request.dueDate(),
                null,
                null,
                LanguageAssessmentType.scriptedFor(request.accent()),
                true,
                request.context(),
                languageId,
                entireClass ? request.classIds() : null,
                entireClass ? null : request.studentIds(),
                passagesToQuestions(request.passages()),
                new EvaluationSettingsRequest(EvaluationType.READING, request.context(), objectMapper.createArrayNode(),
                        objectMapper.createArrayNode(), ieltsFeedback(request.accent()))
        );
        return assignmentService.createAssignment(currentUser, create);
    }

    private ObjectNode ieltsFeedback(String accent) {
        ObjectNode feedback = objectMapper.createObjectNode();
        feedback.put("detailedFeedback", true);
        feedback.put("encouragementEnabled", true);
        feedback.put("accent", accent);
        feedback.put("scoringCriteria", IELTS_SCORING);
        return feedback;
    }

    private QuestionRequest toQuestion(VideoQuestionRequest question) {
        return new QuestionRequest(question.text(), question.answer(), null, null);
    }

    /**
     * A passage becomes a question whose answer is the passage text; the title, when present, is the prompt.
     */
    private static List<QuestionRequest> passagesToQuestions(List<PassageRequest> passages) {
        return passages.stream()
                .map(p -> new QuestionRequest(
                        p.title() != null && !p.title().isBlank() ? p.title().trim() : p.text(),
                        p.text(),
                        null,
                        null))
                .toList();
    }

    private static String colorOrDefault(String color, String fallback) {
        return color == null || color.isBlank() ? fallback : color;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
