package uk.gegc.schoolwork.features.progress.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.schoolwork.features.assignment.application.AssignmentAccessService;
import uk.gegc.schoolwork.features.assignment.domain.model.Assignment;
import uk.gegc.schoolwork.features.assignment.domain.model.Question;
import uk.gegc.schoolwork.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.schoolwork.features.assignment.domain.repository.QuestionRepository;
import uk.gegc.schoolwork.features.assignment.infra.mapping.AssignmentMapper;
import uk.gegc.schoolwork.features.classroom.domain.model.SchoolClass;
import uk.gegc.schoolwork.features.progress.api.dto.OverallProgressDto;
import uk.gegc.schoolwork.features.progress.api.dto.ProgressDto;
import uk.gegc.schoolwork.features.progress.api.dto.ProgressReportDto;
import uk.gegc.schoolwork.features.progress.api.dto.QuestionProgressDto;
import uk.gegc.schoolwork.features.progress.api.dto.ReportAssignmentDto;
import uk.gegc.schoolwork.features.progress.api.dto.ReportStudentDto;
import uk.gegc.schoolwork.features.progress.api.dto.StudentProgressDto;
import uk.gegc.schoolwork.features.progress.api.dto.StudentProgressStatsDto;
import uk.gegc.schoolwork.features.progress.api.dto.SubmitProgressRequest;
import uk.gegc.schoolwork.features.progress.application.ProgressService;
import uk.gegc.schoolwork.features.progress.domain.model.StudentAssignmentProgress;
import uk.gegc.schoolwork.features.progress.domain.repository.StudentAssignmentProgressRepository;
import uk.gegc.schoolwork.features.progress.infra.mapping.ProgressMapper;
import uk.gegc.schoolwork.features.statistics.application.StatisticsService;
import uk.gegc.schoolwork.features.user.domain.model.User;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;
import uk.gegc.schoolwork.shared.exception.ForbiddenException;
import uk.gegc.schoolwork.shared.exception.ResourceNotFoundException;
import uk.gegc.schoolwork.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static uk.gegc.schoolwork.features.statistics.domain.model.ProgressScoring.isComplete;
import static uk.gegc.schoolwork.features.statistics.domain.model.ProgressScoring.percent;
import static uk.gegc.schoolwork.features.statistics.domain.model.ProgressScoring.roundToInt;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProgressServiceImpl implements ProgressService {

    static final String SOURCE_CLASS = "class";
    static final String SOURCE_INDIVIDUAL = "individual";

    private static final Comparator<StudentProgressDto> REPORT_ORDER =
            Comparator.comparing((StudentProgressDto p) -> !p.stats().isComplete())
                    .thenComparing(p -> p.stats().completionRate(), Comparator.reverseOrder())
                    .thenComparing(p -> p.student().username(), Comparator.nullsLast(String::compareTo));

    private final AssignmentRepository assignmentRepository;
    private final QuestionRepository questionRepository;
    private final StudentAssignmentProgressRepository progressRepository;
    private final AssignmentAccessService accessService;
    private final StatisticsService statisticsService;
    private final ProgressMapper progressMapper;
    private final AssignmentMapper assignmentMapper;

    @Override
    @Transactional
    public ProgressDto submitProgress(User currentUser, UUID assignmentId, SubmitProgressRequest request) {
        if (!currentUser.isStudent()) {
            throw new ForbiddenException("Only students can submit progress");
        }

        Assignment assignment = findAssignment(assignmentId);
        if (!accessService.canAccess(currentUser, assignment)) {
            throw new ForbiddenException("You do not have access to this assignment");
        }
        if (!assignment.isActive()) {
            throw new ValidationException("Assignment is not published yet");
        }

        Question question = questionRepository.findByIdAndAssignment_Id(request.questionId(), assignmentId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Question " + request.questionId() + " not found in assignment " + assignmentId));

        Optional<StudentAssignmentProgress> existing = progressRepository
                .findByStudent_IdAndAssignment_IdAndQuestion_Id(currentUser.getId(), assignmentId, question.getId());
        boolean newAnswer = existing.map(p -> !p.isComplete()).orElse(true);
        boolean previouslyCorrect = existing.map(StudentAssignmentProgress::isCorrect).orElse(false);

        StudentAssignmentProgress progress = existing.orElseGet(() -> {
            StudentAssignmentProgress created = new StudentAssignmentProgress();
            created.setStudent(currentUser);
            created.setAssignment(assignment);
            created.setQuestion(question);
            return created;
        });
        boolean correct = request.isCorrect();
        progress.setComplete(true);
        progress.setCorrect(correct);
        progress.setSubmissionType(request.type());
        progress.setAnalysisResult(assignmentMapper.writeJson(request.result()));
        JsonNode grammar = request.result().get("grammarCorrected");
        if (grammar != null && !grammar.isNull()) {
            progress.setGrammarCorrected(assignmentMapper.writeJson(grammar));
        }

        StudentAssignmentProgress saved = progressRepository.saveAndFlush(progress);
        statisticsService.recordSubmission(assignmentId, currentUser.getId(), correct, newAnswer, previouslyCorrect);

        log.debug("Student {} answered question {} of assignment {} (correct={}, new={})",
                currentUser.getUsername(), question.getId(), assignmentId, correct, newAnswer);
        return progressMapper.toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProgressDto> getAssignmentProgress(User currentUser, UUID assignmentId, UUID studentId) {
        Assignment assignment = findAssignment(assignmentId);
        UUID target = studentId != null ? studentId : currentUser.getId();

        if (!currentUser.isStaff()) {
            if (!target.equals(currentUser.getId())) {
                throw new ForbiddenException("You can only view your own progress");
            }
            accessService.requireAccess(currentUser, assignment);
        }
        return progressMapper.toDtoList(progressRepository.findForStudent(assignmentId, target));
    }

    @Override
    @Transactional(readOnly = true)
    public ProgressReportDto getProgressReport(User currentUser, UUID assignmentId) {
        Assignment assignment = findAssignment(assignmentId);
        boolean staff = currentUser.isStaff();

        if (staff) {
            accessService.requireManage(currentUser, assignment, "You can only view progress for your own assignments");
        } else if (!accessService.canAccess(currentUser, assignment)) {
            throw new ForbiddenException("You do not have access to this assignment");
        }

        List<Question> questions = questionRepository.findByAssignment_IdOrderByPositionAsc(assignmentId);
        int totalQuestions = questions.size();

        Map<UUID, ReportStudentDto> scope = collectScope(assignment);
        List<ReportStudentDto> students = staff
                ? new ArrayList<>(scope.values())
                : scope.values().stream().filter(s -> s.id().equals(currentUser.getId())).toList();

        List<StudentAssignmentProgress> rows = staff
                ? progressRepository.findAllForAssignment(assignmentId)
                : progressRepository.findForStudent(assignmentId, currentUser.getId());
        Map<UUID, Map<UUID, StudentAssignmentProgress>> byStudent = new HashMap<>();
        for (StudentAssignmentProgress row : rows) {
            byStudent.computeIfAbsent(row.getStudent().getId(), k -> new HashMap<>())
                    .put(row.getQuestion().getId(), row);
        }

        List<StudentProgressDto> studentProgress = new ArrayList<>();
        for (ReportStudentDto student : students) {
            Map<UUID, StudentAssignmentProgress> answers = byStudent.getOrDefault(student.id(), Map.of());
            studentProgress.add(toStudentProgress(student, answers, questions));
        }
        studentProgress.sort(REPORT_ORDER);

        int totalStudents = staff ? scope.size() : 1;
        int completed = (int) studentProgress.stream().filter(p -> p.stats().isComplete()).count();
        List<StudentProgressDto> started = studentProgress.stream()
                .filter(p -> p.stats().completedQuestions() > 0)
                .toList();
        double averageAccuracy = started.stream()
                .mapToInt(p -> p.stats().accuracyRate())
                .average()
                .orElse(0.0);

        OverallProgressDto overall = new OverallProgressDto(
                totalStudents,
                started.size(),
                completed,
                roundToInt(percent(completed, totalStudents)),
                roundToInt(averageAccuracy)
        );

        ReportAssignmentDto header = new ReportAssignmentDto(
                assignment.getId(),
                assignment.getTopic(),
                assignment.getType(),
                totalQuestions,
                assignmentMapper.toSummary(assignment.getTeacher())
        );

        return new ProgressReportDto(
                header,
                overall,
                studentProgress,
                questions.stream().map(assignmentMapper::toDto).toList()
        );
    }

    /**
     * STUDENT members of the linked classes, then individually linked students. An individual link
     * replaces the class entry of the same student.
     */
    private Map<UUID, ReportStudentDto> collectScope(Assignment assignment) {
        Map<UUID, ReportStudentDto> scope = new LinkedHashMap<>();
        for (SchoolClass schoolClass : assignment.getClasses()) {
            for (User member : schoolClass.getMembers()) {
                if (member.getRole() == UserRole.STUDENT) {
                    scope.put(member.getId(), new ReportStudentDto(
                            member.getId(), member.getUsername(), member.getEmail(), SOURCE_CLASS, schoolClass.getName()));
                }
            }
        }
        for (User student : assignment.getStudents()) {
            if (student.getRole() == UserRole.STUDENT) {
                scope.put(student.getId(), new ReportStudentDto(
                        student.getId(), student.getUsername(), student.getEmail(), SOURCE_INDIVIDUAL, null));
            }
        }
        return scope;
    }

    private StudentProgressDto toStudentProgress(ReportStudentDto student,
                                                 Map<UUID, StudentAssignmentProgress> answers,
                                                 List<Question> questions) {
        Set<UUID> answered = new HashSet<>();
        Set<UUID> correct = new HashSet<>();
        List<QuestionProgressDto> perQuestion = new ArrayList<>();

        for (Question question : questions) {
            StudentAssignmentProgress row = answers.get(question.getId());
            boolean complete = row != null && row.isComplete();
            boolean right = complete && row.isCorrect();
            if (complete) {
                answered.add(question.getId());
            }
            if (right) {
                correct.add(question.getId());
            }
            perQuestion.add(new QuestionProgressDto(
                    question.getId(),
                    question.getTextQuestion(),
                    complete,
                    right,
                    row != null ? row.getCreatedAt() : null
            ));
        }

        int total = questions.size();
        StudentProgressStatsDto stats = new StudentProgressStatsDto(
                total,
                answered.size(),
                correct.size(),
                roundToInt(percent(answered.size(), total)),
                roundToInt(percent(correct.size(), answered.size())),
                isComplete(answered.size(), total)
        );
        return new StudentProgressDto(student, stats, perQuestion);
    }

    private Assignment findAssignment(UUID assignmentId) {
        return assignmentRepository.findById(assignmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Assignment " + assignmentId + " not found"));
    }
}
