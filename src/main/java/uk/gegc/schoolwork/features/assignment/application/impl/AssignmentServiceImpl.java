package uk.gegc.schoolwork.features.assignment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.schoolwork.features.activity.application.ActivityLogService;
import uk.gegc.schoolwork.features.activity.domain.model.ActivityLogType;
import uk.gegc.schoolwork.features.assignment.api.dto.AssignmentDto;
import uk.gegc.schoolwork.features.assignment.api.dto.AssignmentSearchCriteria;
import uk.gegc.schoolwork.features.assignment.api.dto.CreateAssignmentRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.EvaluationSettingsRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.QuestionRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.UpdateAssignmentRequest;
import uk.gegc.schoolwork.features.assignment.application.AssignmentAccessService;
import uk.gegc.schoolwork.features.assignment.application.AssignmentScopeResolver;
import uk.gegc.schoolwork.features.assignment.application.AssignmentService;
import uk.gegc.schoolwork.features.assignment.domain.model.Assignment;
import uk.gegc.schoolwork.features.assignment.domain.model.AssignmentType;
import uk.gegc.schoolwork.features.assignment.domain.model.EvaluationSettings;
import uk.gegc.schoolwork.features.assignment.domain.model.Question;
import uk.gegc.schoolwork.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.schoolwork.features.assignment.domain.repository.AssignmentSpecifications;
import uk.gegc.schoolwork.features.assignment.infra.mapping.AssignmentMapper;
import uk.gegc.schoolwork.features.classroom.domain.model.SchoolClass;
import uk.gegc.schoolwork.features.classroom.domain.repository.SchoolClassRepository;
import uk.gegc.schoolwork.features.language.application.LanguageResolver;
import uk.gegc.schoolwork.features.progress.domain.repository.StudentAssignmentProgressRepository;
import uk.gegc.schoolwork.features.statistics.application.StatisticsService;
import uk.gegc.schoolwork.features.user.domain.model.User;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;
import uk.gegc.schoolwork.features.user.domain.repository.UserRepository;
import uk.gegc.schoolwork.shared.exception.ResourceNotFoundException;
import uk.gegc.schoolwork.shared.exception.ValidationException;
import uk.gegc.schoolwork.shared.security.AccessPolicy;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class AssignmentServiceImpl implements AssignmentService {

    static final Sort DEFAULT_SORT = Sort.by(
            Sort.Order.asc("scheduledPublishAt"),
            Sort.Order.desc("createdAt")
    );

    private final AssignmentRepository assignmentRepository;
    private final SchoolClassRepository schoolClassRepository;
    private final UserRepository userRepository;
    private final StudentAssignmentProgressRepository progressRepository;
    private final LanguageResolver languageResolver;
    private final AssignmentAccessService accessService;
    private final AssignmentScopeResolver scopeResolver;
    private final ActivityLogService activityLogService;
    private final StatisticsService statisticsService;
    private final AssignmentMapper assignmentMapper;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Override
    @Transactional
    public AssignmentDto createAssignment(User currentUser, CreateAssignmentRequest request) {
        accessPolicy.requireStaff(currentUser);

        Set<SchoolClass> classes = resolveClasses(request.classIds());
        Set<User> students = resolveStudents(request.studentIds());
        Instant now = clock.instant();

        Assignment assignment = new Assignment();
        assignment.setTopic(request.topic().trim());
        assignment.setType(request.type());
        assignment.setColor(request.color());
        assignment.setVocabularyItems(assignmentMapper.writeJson(request.vocabularyItems()));
        assignment.setScheduledPublishAt(request.scheduledPublishAt());
        assignment.setDueDate(request.dueDate());
        assignment.setActive(request.scheduledPublishAt() == null || !request.scheduledPublishAt().isAfter(now));
        assignment.setPublishedAt(now);
        assignment.setVideoUrl(request.videoUrl());
        assignment.setVideoTranscript(request.videoTranscript());
        assignment.setLanguageAssessmentType(request.languageAssessmentType());
        assignment.setIelts(Boolean.TRUE.equals(request.isIELTS()));
        assignment.setContext(request.context());
        assignment.setTeacher(currentUser);
        assignment.setLanguage(languageResolver.resolve(request.languageId()).orElse(null));
        assignment.setClasses(classes);
        assignment.setStudents(students);

        for (QuestionRequest questionRequest : request.questions()) {
            assignment.addQuestion(toQuestion(questionRequest));
        }
        if (request.evaluationSettings() != null) {
            assignment.attachEvaluationSettings(toEvaluationSettings(request.evaluationSettings()));
        }

        Assignment saved = assignmentRepository.save(assignment);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("topic", saved.getTopic());
        details.put("classes", classes.size());
        details.put("students", students.size());
        details.put("scheduledPublishAt", saved.getScheduledPublishAt() != null ? saved.getScheduledPublishAt().toString() : null);
        activityLogService.record(
                saved.getType() == AssignmentType.CLASS
                        ? ActivityLogType.ASSIGNMENT_CREATED
                        : ActivityLogType.INDIVIDUAL_ASSIGNMENT_CREATED,
                currentUser.getId(), saved.getId(), null, details);

        statisticsService.initializeAssignmentStatistics(saved);

        log.info("Assignment {} '{}' created by {} (active={}, questions={})",
                saved.getId(), saved.getTopic(), currentUser.getUsername(), saved.isActive(), saved.getQuestions().size());
        return assignmentMapper.toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public AssignmentDto getAssignment(User currentUser, UUID assignmentId) {
        Assignment assignment = findAssignment(assignmentId);
        accessService.requireAccess(currentUser, assignment);
        return assignmentMapper.toDto(assignment);
    }

    @Override
    @Transactional
    public AssignmentDto updateAssignment(User currentUser, UUID assignmentId, UpdateAssignmentRequest request) {
        Assignment assignment = findAssignment(assignmentId);
        accessService.requireManage(currentUser, assignment, "Cannot modify this assignment");

        boolean wasActive = assignment.isActive();

        if (request.topic() != null) {
            if (request.topic().isBlank()) {
                throw new ValidationException("Topic must not be blank");
            }
            assignment.setTopic(request.topic().trim());
        }
        if (request.color() != null) {
            assignment.setColor(request.color());
        }
        if (request.vocabularyItems() != null) {
            assignment.setVocabularyItems(assignmentMapper.writeJson(request.vocabularyItems()));
        }
        if (request.dueDate() != null) {
            assignment.setDueDate(request.dueDate());
        }
        if (request.videoUrl() != null) {
            assignment.setVideoUrl(request.videoUrl());
        }
        if (request.videoTranscript() != null) {
            assignment.setVideoTranscript(request.videoTranscript());
        }
        if (request.languageAssessmentType() != null) {
            assignment.setLanguageAssessmentType(request.languageAssessmentType());
        }
        if (request.isIELTS() != null) {
            assignment.setIelts(request.isIELTS());
        }
        if (request.context() != null) {
            assignment.setContext(request.context());
        }
        if (request.languageId() != null) {
            assignment.setLanguage(languageResolver.requireById(request.languageId()));
        }

        applySchedule(assignment, request);

        Assignment saved = assignmentRepository.save(assignment);

        if (wasActive != saved.isActive()) {
            statisticsService.refreshScope(scopeResolver.studentIds(saved.getId()), classIds(saved));
            log.info("Assignment {} {} by {}", saved.getId(), saved.isActive() ? "activated" : "deactivated",
                    currentUser.getUsername());
        }
        return assignmentMapper.toDto(saved);
    }

    /**
     * Keeps an active assignment free of a future publish time. Clearing the schedule publishes
     * immediately, a future schedule deactivates, and activation is refused while one is pending.
     */
    private void applySchedule(Assignment assignment, UpdateAssignmentRequest request) {
        Instant now = clock.instant();

        if (Boolean.TRUE.equals(request.clearSchedule())) {
            assignment.setScheduledPublishAt(null);
            assignment.setActive(true);
        } else if (request.scheduledPublishAt() != null) {
            assignment.setScheduledPublishAt(request.scheduledPublishAt());
            assignment.setActive(!request.scheduledPublishAt().isAfter(now));
        }

        if (request.isActive() != null) {
            if (request.isActive() && assignment.isScheduledAfter(now)) {
                throw new ValidationException(
                        "Cannot activate an assignment before its scheduled publish time; clear or move the schedule first");
            }
            assignment.setActive(request.isActive());
        }
    }

    @Override
    @Transactional
    public void deleteAssignment(User currentUser, UUID assignmentId) {
        Assignment assignment = findAssignment(assignmentId);
        accessService.requireManage(currentUser, assignment, "Cannot delete this assignment");

        Set<UUID> studentIds = scopeResolver.studentIds(assignmentId);
        Set<UUID> classIds = classIds(assignment);

        int progressRows = progressRepository.deleteByAssignmentId(assignmentId);
        statisticsService.deleteAssignmentStatistics(assignmentId);
        activityLogService.deleteForAssignment(assignmentId);
        assignmentRepository.delete(assignment);
        assignmentRepository.flush();

        statisticsService.refreshScope(studentIds, classIds);

        log.info("Assignment {} deleted by {} ({} progress rows removed)",
                assignmentId, currentUser.getUsername(), progressRows);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<AssignmentDto> listAssignments(User currentUser, AssignmentSearchCriteria criteria, Pageable pageable) {
        Specification<Assignment> spec = roleScope(currentUser)
                .and(AssignmentSpecifications.build(criteria != null ? criteria : AssignmentSearchCriteria.empty()));
        Pageable sorted = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), DEFAULT_SORT);
        return assignmentRepository.findAll(spec, sorted).map(assignmentMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AssignmentDto> getMyAssignments(User currentUser, String status) {
        String normalized = status == null || status.isBlank() ? "active" : status.trim().toLowerCase(Locale.ROOT);
        Specification<Assignment> spec = roleScope(currentUser);
        spec = switch (normalized) {
            case "active" -> spec.and(AssignmentSpecifications.active());
            case "scheduled" -> spec.and(AssignmentSpecifications.awaitingPublish());
            case "all" -> spec;
            default -> throw new ValidationException("Unknown status '" + status + "'; expected active, scheduled or all");
        };
        return assignmentMapper.toDtoList(assignmentRepository.findAll(spec, DEFAULT_SORT));
    }

    /**
     * Role restriction applied before any caller-supplied filter, so filters can only narrow it.
     */
    private Specification<Assignment> roleScope(User currentUser) {
        if (accessPolicy.isAdmin(currentUser)) {
            return Specification.where(null);
        }
        if (currentUser.hasRole(UserRole.TEACHER)) {
            return AssignmentSpecifications.ownedBy(currentUser.getId());
        }
        return AssignmentSpecifications.visibleToStudent(currentUser.getId());
    }

    private Assignment findAssignment(UUID assignmentId) {
        return assignmentRepository.findById(assignmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Assignment " + assignmentId + " not found"));
    }

    private Set<SchoolClass> resolveClasses(List<UUID> classIds) {
        Set<UUID> wanted = new HashSet<>(classIds);
        if (wanted.isEmpty()) {
            return new HashSet<>();
        }
        List<SchoolClass> found = schoolClassRepository.findAllById(wanted);
        if (found.size() != wanted.size()) {
            throw new ValidationException("One or more classes were not found");
        }
        return new HashSet<>(found);
    }

    private Set<User> resolveStudents(List<UUID> studentIds) {
        Set<UUID> wanted = new HashSet<>(studentIds);
        if (wanted.isEmpty()) {
            return new HashSet<>();
        }
        List<User> found = userRepository.findAllByIdIn(wanted);
        if (found.size() != wanted.size()) {
            throw new ValidationException("One or more students were not found");
        }
        List<String> notStudents = found.stream()
                .filter(user -> !user.isStudent())
                .map(User::getUsername)
                .toList();
        if (!notStudents.isEmpty()) {
            throw new ValidationException("Only students can be assigned individually: " + String.join(", ", notStudents));
        }
        return new HashSet<>(found);
    }

    private Question toQuestion(QuestionRequest request) {
        Question question = new Question(request.textQuestion(), request.textAnswer());
        question.setImage(request.image());
        question.setVideoUrl(request.videoUrl());
        return question;
    }

    private EvaluationSettings toEvaluationSettings(EvaluationSettingsRequest request) {
        EvaluationSettings settings = new EvaluationSettings();
        settings.setType(request.type());
        settings.setCustomPrompt(request.customPrompt());
        settings.setRules(assignmentMapper.writeJson(request.rules()));
        settings.setAcceptableResponses(assignmentMapper.writeJson(request.acceptableResponses()));
        String feedback = assignmentMapper.writeJson(request.feedbackSettings());
        settings.setFeedbackSettings(feedback != null ? feedback : "{}");
        return settings;
    }

    private static Set<UUID> classIds(Assignment assignment) {
        return assignment.getClasses().stream()
                .map(SchoolClass::getId)
                .collect(Collectors.toSet());
    }
}
