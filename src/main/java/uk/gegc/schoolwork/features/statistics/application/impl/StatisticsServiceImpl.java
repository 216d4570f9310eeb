package uk.gegc.schoolwork.features.statistics.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.schoolwork.features.assignment.application.AssignmentScopeResolver;
import uk.gegc.schoolwork.features.assignment.domain.model.Assignment;
import uk.gegc.schoolwork.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.schoolwork.features.assignment.domain.repository.QuestionRepository;
import uk.gegc.schoolwork.features.classroom.domain.repository.SchoolClassRepository;
import uk.gegc.schoolwork.features.progress.domain.repository.StudentAssignmentProgressRepository;
import uk.gegc.schoolwork.features.statistics.api.dto.AssignmentStatsDto;
import uk.gegc.schoolwork.features.statistics.api.dto.ClassStatsDto;
import uk.gegc.schoolwork.features.statistics.api.dto.SchoolStatsDto;
import uk.gegc.schoolwork.features.statistics.api.dto.StudentStatsDto;
import uk.gegc.schoolwork.features.statistics.api.dto.TeacherStatsDto;
import uk.gegc.schoolwork.features.statistics.application.StatisticsService;
import uk.gegc.schoolwork.features.statistics.config.StatisticsProperties;
import uk.gegc.schoolwork.features.statistics.domain.model.AssignmentStats;
import uk.gegc.schoolwork.features.statistics.domain.model.ClassStats;
import uk.gegc.schoolwork.features.statistics.domain.model.ProgressScoring;
import uk.gegc.schoolwork.features.statistics.domain.model.ProgressScoring.Tally;
import uk.gegc.schoolwork.features.statistics.domain.model.ProgressScoring.Transition;
import uk.gegc.schoolwork.features.statistics.domain.model.SchoolStats;
import uk.gegc.schoolwork.features.statistics.domain.model.StudentStats;
import uk.gegc.schoolwork.features.statistics.domain.model.TeacherStats;
import uk.gegc.schoolwork.features.statistics.domain.repository.AssignmentStatsRepository;
import uk.gegc.schoolwork.features.statistics.domain.repository.ClassStatsRepository;
import uk.gegc.schoolwork.features.statistics.domain.repository.SchoolStatsRepository;
import uk.gegc.schoolwork.features.statistics.domain.repository.StudentStatsRepository;
import uk.gegc.schoolwork.features.statistics.domain.repository.TeacherStatsRepository;
import uk.gegc.schoolwork.features.statistics.infra.mapping.StatisticsMapper;
import uk.gegc.schoolwork.features.user.domain.model.User;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;
import uk.gegc.schoolwork.features.user.domain.repository.UserRepository;
import uk.gegc.schoolwork.shared.exception.ResourceNotFoundException;
import uk.gegc.schoolwork.shared.exception.ValidationException;
import uk.gegc.schoolwork.shared.security.AccessPolicy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static uk.gegc.schoolwork.features.statistics.domain.model.ProgressScoring.isComplete;
import static uk.gegc.schoolwork.features.statistics.domain.model.ProgressScoring.percent;
import static uk.gegc.schoolwork.features.statistics.domain.model.ProgressScoring.round2;

/**
 * Implementation of {@link StatisticsService}.
 * <p>
 * Submission updates are incremental and run inside the submitting transaction, in the order
 * assignment, student, classes, school. A rollup row that does not exist yet is rebuilt from the
 * progress rows instead, which already include the submission being recorded.
 * </p>
 * <p>
 * Rows carry {@code @Version}; a concurrent update surfaces as an optimistic locking failure.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatisticsServiceImpl implements StatisticsService {

    private static final int MAX_TREND_DAYS = 366;

    private final AssignmentRepository assignmentRepository;
    private final QuestionRepository questionRepository;
    private final StudentAssignmentProgressRepository progressRepository;
    private final SchoolClassRepository schoolClassRepository;
    private final UserRepository userRepository;
    private final AssignmentStatsRepository assignmentStatsRepository;
    private final StudentStatsRepository studentStatsRepository;
    private final ClassStatsRepository classStatsRepository;
    private final TeacherStatsRepository teacherStatsRepository;
    private final SchoolStatsRepository schoolStatsRepository;
    private final AssignmentScopeResolver scopeResolver;
    private final StatisticsProperties properties;
    private final StatisticsMapper statisticsMapper;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Override
    @Transactional
    public void recordSubmission(UUID assignmentId, UUID studentId, boolean correct, boolean newAnswer,
                                 boolean previouslyCorrect) {
        long answeredAfter = progressRepository.countAnsweredQuestions(studentId, assignmentId);
        long answeredBefore = newAnswer ? Math.max(0, answeredAfter - 1) : answeredAfter;
        int correctDelta = correctDelta(correct, newAnswer, previouslyCorrect);

        Assignment assignment = assignmentRepository.findById(assignmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Assignment " + assignmentId + " not found"));

        updateAssignmentOnSubmission(assignment, newAnswer, correctDelta, answeredBefore, answeredAfter);
        updateStudentOnSubmission(assignment, studentId, newAnswer, correctDelta, answeredBefore, answeredAfter);

        for (UUID classId : schoolClassRepository.findClassIdsForAssignmentAndMember(assignmentId, studentId)) {
            updateClassStatistics(classId);
        }

        recordSchoolAnswer(newAnswer, correctDelta);

        log.debug("Recorded submission for student {} on assignment {} (new={}, correct={}, answered {} -> {})",
                studentId, assignmentId, newAnswer, correct, answeredBefore, answeredAfter);
    }

    /**
     * Change in distinct correct answers caused by one submission. A re-submission only moves the
     * count when its correctness differs from the stored answer.
     */
    static int correctDelta(boolean correct, boolean newAnswer, boolean previouslyCorrect) {
        if (newAnswer) {
            return correct ? 1 : 0;
        }
        if (correct == previouslyCorrect) {
            return 0;
        }
        return correct ? 1 : -1;
    }

    private void updateAssignmentOnSubmission(Assignment assignment, boolean newAnswer, int correctDelta,
                                              long answeredBefore, long answeredAfter) {
        Optional<AssignmentStats> existing = assignmentStatsRepository.findById(assignment.getId());
        if (existing.isEmpty()) {
            rebuildAssignmentStats(assignment);
            return;
        }

        AssignmentStats stats = existing.get();
        stats.setTotalCorrectAnswers(Math.max(0, stats.getTotalCorrectAnswers() + correctDelta));
        if (newAnswer) {
            stats.setTotalAnswers(stats.getTotalAnswers() + 1);
            Transition transition = ProgressScoring.transition(answeredBefore, answeredAfter, stats.getTotalQuestions());
            if (transition.started()) {
                stats.setNotStartedStudents(Math.max(0, stats.getNotStartedStudents() - 1));
                stats.setInProgressStudents(stats.getInProgressStudents() + 1);
            }
            if (transition.completed()) {
                stats.setInProgressStudents(Math.max(0, stats.getInProgressStudents() - 1));
                stats.setCompletedStudents(stats.getCompletedStudents() + 1);
            }
        }

        stats.setCompletionRate(round2(percent(stats.getCompletedStudents(), stats.getTotalStudents())));
        stats.setAccuracyRate(round2(percent(stats.getTotalCorrectAnswers(), stats.getTotalAnswers())));
        stats.setAverageScore(round2(averageScoreOfCompleted(assignment.getId(), stats.getTotalQuestions())));
        stats.setLastUpdated(clock.instant());
        assignmentStatsRepository.save(stats);
        mirrorOntoAssignment(assignment, stats);
    }

    private void updateStudentOnSubmission(Assignment assignment, UUID studentId, boolean newAnswer, int correctDelta,
                                           long answeredBefore, long answeredAfter) {
        Optional<StudentStats> existing = studentStatsRepository.findById(studentId);
        if (existing.isEmpty()) {
            StudentStats rebuilt = rebuildStudentStats(studentId);
            rebuilt.setLastActivityDate(clock.instant());
            studentStatsRepository.save(rebuilt);
            return;
        }

        StudentStats stats = existing.get();
        stats.setTotalCorrectAnswers(Math.max(0, stats.getTotalCorrectAnswers() + correctDelta));
        if (newAnswer) {
            stats.setTotalAnswers(stats.getTotalAnswers() + 1);
            long totalQuestions = questionRepository.countByAssignment_Id(assignment.getId());
            Transition transition = ProgressScoring.transition(answeredBefore, answeredAfter, totalQuestions);
            if (transition.started()) {
                stats.setNotStartedAssignments(Math.max(0, stats.getNotStartedAssignments() - 1));
                stats.setInProgressAssignments(stats.getInProgressAssignments() + 1);
            }
            if (transition.completed()) {
                stats.setInProgressAssignments(Math.max(0, stats.getInProgressAssignments() - 1));
                stats.setCompletedAssignments(stats.getCompletedAssignments() + 1);
            }
        }

        Instant now = clock.instant();
        stats.setLastActivityDate(now);
        stats.setCompletionRate(round2(percent(stats.getCompletedAssignments(), stats.getTotalAssignments())));
        stats.setAccuracyRate(round2(percent(stats.getTotalCorrectAnswers(), stats.getTotalAnswers())));
        stats.setAverageScore(round2(averageScoreOfStudent(studentId)));
        stats.setLastUpdated(now);
        studentStatsRepository.save(stats);
    }

    private void recordSchoolAnswer(boolean newAnswer, int correctDelta) {
        LocalDate today = LocalDate.now(clock);
        Optional<SchoolStats> existing = schoolStatsRepository.findByDate(today);
        if (existing.isEmpty()) {
            updateSchoolStatistics(today);
            return;
        }
        if (!newAnswer && correctDelta == 0) {
            return;
        }
        SchoolStats stats = existing.get();
        if (newAnswer) {
            stats.setTotalAnswers(stats.getTotalAnswers() + 1);
        }
        stats.setTotalCorrectAnswers(Math.max(0, stats.getTotalCorrectAnswers() + correctDelta));
        stats.setLastUpdated(clock.instant());
        schoolStatsRepository.save(stats);
    }

    @Override
    @Transactional
    public void initializeAssignmentStatistics(Assignment assignment) {
        Set<UUID> scope = scopeResolver.studentIds(assignment.getId());
        Instant now = clock.instant();

        for (UUID studentId : scope) {
            incrementStudentAssignmentCount(studentId);
        }
        assignment.getClasses().forEach(schoolClass ->
                incrementClassAssignmentCount(schoolClass.getId(), assignment.isActive()));
        incrementSchoolAssignmentCount(assignment.isActive(), assignment.isScheduledAfter(now));

        AssignmentStats stats = new AssignmentStats(assignment.getId());
        stats.setTotalStudents(scope.size());
        stats.setNotStartedStudents(scope.size());
        stats.setTotalQuestions(assignment.getQuestions().size());
        stats.setLastUpdated(now);
        assignmentStatsRepository.save(stats);
        mirrorOntoAssignment(assignment, stats);

        log.info("Initialised statistics for assignment {}: {} students in scope, {} questions",
                assignment.getId(), scope.size(), stats.getTotalQuestions());
    }

    @Override
    @Transactional
    public StudentStats incrementStudentAssignmentCount(UUID studentId) {
        int totalAssignments = assignmentRepository.findActiveIdsInScopeOfStudent(studentId).size();
        StudentStats stats = studentStatsRepository.findById(studentId)
                .orElseGet(() -> new StudentStats(studentId));

        stats.setTotalAssignments(totalAssignments);
        stats.setNotStartedAssignments(Math.max(0,
                totalAssignments - stats.getCompletedAssignments() - stats.getInProgressAssignments()));
        stats.setCompletionRate(round2(percent(stats.getCompletedAssignments(), totalAssignments)));
        stats.setLastUpdated(clock.instant());
        return studentStatsRepository.save(stats);
    }

    @Override
    @Transactional
    public ClassStats incrementClassAssignmentCount(UUID classId, boolean active) {
        Optional<ClassStats> existing = classStatsRepository.findById(classId);
        ClassStats stats;
        if (existing.isEmpty()) {
            stats = new ClassStats(classId);
            stats.setTotalStudents(schoolClassRepository.findMemberIdsByRole(classId, UserRole.STUDENT).size());
            stats.setTotalAssignments(assignmentRepository.findIdsByClassId(classId).size());
            stats.setActiveAssignments((int) assignmentRepository.countActiveByClassId(classId));
        } else {
            stats = existing.get();
            stats.setTotalAssignments(stats.getTotalAssignments() + 1);
            if (active) {
                stats.setActiveAssignments(stats.getActiveAssignments() + 1);
            }
        }
        stats.setLastUpdated(clock.instant());
        return classStatsRepository.save(stats);
    }

    @Override
    @Transactional
    public SchoolStats incrementSchoolAssignmentCount(boolean active, boolean scheduled) {
        LocalDate today = LocalDate.now(clock);
        Optional<SchoolStats> existing = schoolStatsRepository.findByDate(today);
        if (existing.isEmpty()) {
            return updateSchoolStatistics(today);
        }

        SchoolStats stats = existing.get();
        stats.setTotalAssignments(stats.getTotalAssignments() + 1);
        if (active) {
            stats.setActiveAssignments(stats.getActiveAssignments() + 1);
        }
        if (scheduled) {
            stats.setScheduledAssignments(stats.getScheduledAssignments() + 1);
        }
        stats.setLastUpdated(clock.instant());
        return schoolStatsRepository.save(stats);
    }

    @Override
    @Transactional
    public AssignmentStats recalculateAssignment(UUID assignmentId) {
        Assignment assignment = assignmentRepository.findById(assignmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Assignment " + assignmentId + " not found"));
        return rebuildAssignmentStats(assignment);
    }

    private AssignmentStats rebuildAssignmentStats(Assignment assignment) {
        UUID assignmentId = assignment.getId();
        Set<UUID> scope = scopeResolver.studentIds(assignmentId);
        int totalQuestions = (int) questionRepository.countByAssignment_Id(assignmentId);

        int completed = 0;
        int inProgress = 0;
        long answers = 0;
        long correctAnswers = 0;
        double scoreSum = 0.0;
        int scored = 0;

        for (Object[] row : progressRepository.tallyByStudent(assignmentId)) {
            Tally tally = Tally.fromRow(row);
            if (!scope.contains(tally.key())) {
                continue;
            }
            answers += tally.answered();
            correctAnswers += tally.correct();
            if (isComplete(tally.answered(), totalQuestions)) {
                scoreSum += ProgressScoring.score(tally.correct(), totalQuestions);
                scored++;
                completed++;
            } else if (tally.answered() > 0) {
                inProgress++;
            }
        }

        AssignmentStats stats = assignmentStatsRepository.findById(assignmentId)
                .orElseGet(() -> new AssignmentStats(assignmentId));
        stats.setTotalStudents(scope.size());
        stats.setTotalQuestions(totalQuestions);
        stats.setCompletedStudents(completed);
        stats.setInProgressStudents(inProgress);
        stats.setNotStartedStudents(Math.max(0, scope.size() - completed - inProgress));
        stats.setTotalAnswers((int) answers);
        stats.setTotalCorrectAnswers((int) correctAnswers);
        stats.setCompletionRate(round2(percent(completed, scope.size())));
        stats.setAccuracyRate(round2(percent(correctAnswers, answers)));
        stats.setAverageScore(round2(scored > 0 ? scoreSum / scored : 0.0));
        stats.setLastUpdated(clock.instant());

        AssignmentStats saved = assignmentStatsRepository.save(stats);
        mirrorOntoAssignment(assignment, saved);
        log.debug("Rebuilt statistics for assignment {}: {}/{} students complete", assignmentId, completed, scope.size());
        return saved;
    }

    @Override
    @Transactional
    public StudentStats recalculateStudent(UUID studentId) {
        if (!userRepository.existsById(studentId)) {
            throw new ResourceNotFoundException("User " + studentId + " not found");
        }
        return studentStatsRepository.save(rebuildStudentStats(studentId));
    }

    private StudentStats rebuildStudentStats(UUID studentId) {
        List<UUID> activeInScope = assignmentRepository.findActiveIdsInScopeOfStudent(studentId);
        Map<UUID, Tally> tallies = new HashMap<>();
        for (Object[] row : progressRepository.tallyByAssignment(studentId)) {
            Tally tally = Tally.fromRow(row);
            tallies.put(tally.key(), tally);
        }

        Set<UUID> assignmentIds = new HashSet<>(activeInScope);
        assignmentIds.addAll(tallies.keySet());
        Map<UUID, Long> questionCounts = questionCounts(assignmentIds);

        int completed = 0;
        int inProgress = 0;
        for (UUID assignmentId : activeInScope) {
            Tally tally = tallies.get(assignmentId);
            if (tally == null || tally.answered() == 0) {
                continue;
            }
            if (isComplete(tally.answered(), questionCounts.getOrDefault(assignmentId, 0L))) {
                completed++;
            } else {
                inProgress++;
            }
        }

        long answers = tallies.values().stream().mapToLong(Tally::answered).sum();
        long correctAnswers = tallies.values().stream().mapToLong(Tally::correct).sum();

        StudentStats stats = studentStatsRepository.findById(studentId)
                .orElseGet(() -> new StudentStats(studentId));
        stats.setTotalAssignments(activeInScope.size());
        stats.setCompletedAssignments(completed);
        stats.setInProgressAssignments(inProgress);
        stats.setNotStartedAssignments(Math.max(0, activeInScope.size() - completed - inProgress));
        stats.setTotalAnswers((int) answers);
        stats.setTotalCorrectAnswers((int) correctAnswers);
        stats.setCompletionRate(round2(percent(completed, activeInScope.size())));
        stats.setAccuracyRate(round2(percent(correctAnswers, answers)));
        stats.setAverageScore(round2(averageScore(tallies.values(), questionCounts)));
        stats.setLastUpdated(clock.instant());
        return stats;
    }

    @Override
    @Transactional
    public ClassStats updateClassStatistics(UUID classId) {
        if (!schoolClassRepository.existsById(classId)) {
            throw new ResourceNotFoundException("Class " + classId + " not found");
        }

        List<UUID> studentIds = schoolClassRepository.findMemberIdsByRole(classId, UserRole.STUDENT);
        Instant now = clock.instant();

        ClassStats stats = classStatsRepository.findById(classId)
                .orElseGet(() -> new ClassStats(classId));
        stats.setTotalStudents(studentIds.size());
        stats.setTotalAssignments(assignmentRepository.findIdsByClassId(classId).size());
        stats.setActiveAssignments((int) assignmentRepository.countActiveByClassId(classId));

        if (studentIds.isEmpty()) {
            stats.setAverageCompletion(0.0);
            stats.setAverageScore(0.0);
            stats.setAccuracyRate(0.0);
            stats.setTotalAnswers(0);
            stats.setTotalCorrectAnswers(0);
            stats.setActiveStudents(0);
            stats.setStudentsNeedingHelp(0);
        } else {
            Object[] agg = firstRow(studentStatsRepository.aggregateFor(studentIds), 5);
            stats.setAverageCompletion(round2(asDouble(agg[0])));
            stats.setAverageScore(round2(asDouble(agg[1])));
            stats.setAccuracyRate(round2(asDouble(agg[2])));
            stats.setTotalAnswers(asLong(agg[3]));
            stats.setTotalCorrectAnswers(asLong(agg[4]));

            Instant activeSince = now.minus(Duration.ofDays(properties.getActiveWindowDays()));
            stats.setActiveStudents((int) studentStatsRepository
                    .countByStudentIdInAndLastActivityDateGreaterThanEqual(studentIds, activeSince));
            stats.setStudentsNeedingHelp((int) studentStatsRepository.countNeedingHelp(
                    studentIds, properties.getNeedsHelpCompletionBelow(), properties.getNeedsHelpAccuracyBelow()));
        }
        stats.setLastUpdated(now);
        return classStatsRepository.save(stats);
    }

    @Override
    @Transactional
    public TeacherStats updateTeacherStatistics(UUID teacherId) {
        if (!userRepository.existsById(teacherId)) {
            throw new ResourceNotFoundException("User " + teacherId + " not found");
        }

        Instant now = clock.instant();
        List<UUID> classIds = schoolClassRepository.findClassIdsByMember(teacherId);
        long totalStudents = classIds.isEmpty()
                ? 0
                : schoolClassRepository.countDistinctMembersByRole(classIds, UserRole.STUDENT);
        Object[] averages = firstRow(assignmentStatsRepository.averagesForTeacher(teacherId), 2);

        TeacherStats stats = teacherStatsRepository.findById(teacherId)
                .orElseGet(() -> new TeacherStats(teacherId));
        stats.setTotalAssignments((int) assignmentRepository.countByTeacher_Id(teacherId));
        stats.setTotalClasses(classIds.size());
        stats.setTotalStudents((int) totalStudents);
        stats.setAverageClassCompletion(round2(asDouble(averages[0])));
        stats.setAverageClassScore(round2(asDouble(averages[1])));
        stats.setActiveAssignments((int) assignmentRepository.countByTeacher_IdAndActiveTrue(teacherId));
        stats.setScheduledAssignments((int) assignmentRepository.countScheduledByTeacher(teacherId, now));
        stats.setLastUpdated(now);
        return teacherStatsRepository.save(stats);
    }

    @Override
    @Transactional
    public SchoolStats updateSchoolStatistics(LocalDate date) {
        LocalDate key = date != null ? date : LocalDate.now(clock);
        Instant now = clock.instant();
        Instant dayAgo = now.minus(Duration.ofDays(1));

        Object[] averages = firstRow(assignmentStatsRepository.averagesForAll(), 2);
        Object[] answerTotals = firstRow(studentStatsRepository.answerTotals(), 2);

        SchoolStats stats = schoolStatsRepository.findByDate(key)
                .orElseGet(() -> new SchoolStats(key));
        stats.setTotalUsers(userRepository.count());
        stats.setTotalTeachers(userRepository.countByRole(UserRole.TEACHER));
        stats.setTotalStudents(userRepository.countByRole(UserRole.STUDENT));
        stats.setTotalClasses(schoolClassRepository.count());
        stats.setTotalAssignments(assignmentRepository.count());
        stats.setActiveAssignments(assignmentRepository.countByActiveTrue());
        stats.setScheduledAssignments(assignmentRepository.countScheduled(now));
        stats.setAverageCompletionRate(round2(asDouble(averages[0])));
        stats.setAverageScore(round2(asDouble(averages[1])));
        stats.setTotalAnswers(asLong(answerTotals[0]));
        stats.setTotalCorrectAnswers(asLong(answerTotals[1]));
        stats.setDailyActiveStudents(studentStatsRepository.countByLastActivityDateGreaterThanEqual(dayAgo));
        stats.setDailyActiveTeachers(teacherStatsRepository.countByLastUpdatedGreaterThanEqual(dayAgo));
        stats.setStudentsNeedingHelp(studentStatsRepository.countNeedingHelpSchoolWide(
                properties.getNeedsHelpCompletionBelow(), properties.getNeedsHelpAccuracyBelow()));
        stats.setLastUpdated(now);
        return schoolStatsRepository.save(stats);
    }

    @Override
    @Transactional
    public int pruneSchoolStatistics() {
        LocalDate cutoff = LocalDate.now(clock).minusDays(properties.getSchoolRetentionDays());
        int deleted = schoolStatsRepository.deleteOlderThan(cutoff);
        if (deleted > 0) {
            log.info("Pruned {} school statistics rows older than {}", deleted, cutoff);
        }
        return deleted;
    }

    @Override
    @Transactional
    public void refreshScope(Collection<UUID> studentIds, Collection<UUID> classIds) {
        for (UUID studentId : new HashSet<>(studentIds)) {
            studentStatsRepository.save(rebuildStudentStats(studentId));
        }
        for (UUID classId : new HashSet<>(classIds)) {
            updateClassStatistics(classId);
        }
        log.debug("Refreshed statistics for {} students and {} classes", studentIds.size(), classIds.size());
    }

    @Override
    @Transactional
    public void deleteAssignmentStatistics(UUID assignmentId) {
        if (assignmentStatsRepository.existsById(assignmentId)) {
            assignmentStatsRepository.deleteById(assignmentId);
        }
    }

    @Override
    @Transactional
    public void deleteStudentStatistics(UUID studentId) {
        if (studentStatsRepository.existsById(studentId)) {
            studentStatsRepository.deleteById(studentId);
        }
    }

    @Override
    @Transactional
    public AssignmentStatsDto getAssignmentStatistics(User currentUser, UUID assignmentId) {
        Assignment assignment = assignmentRepository.findById(assignmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Assignment " + assignmentId + " not found"));
        UUID ownerId = assignment.getTeacher() != null ? assignment.getTeacher().getId() : null;
        accessPolicy.requireOwnerOrAdmin(currentUser, ownerId, "Cannot view statistics of this assignment");

        AssignmentStats stats = assignmentStatsRepository.findById(assignmentId)
                .orElseGet(() -> rebuildAssignmentStats(assignment));
        return statisticsMapper.toDto(stats);
    }

    @Override
    @Transactional
    public StudentStatsDto getStudentStatistics(User currentUser, UUID studentId) {
        accessPolicy.requireSelfOrStaff(currentUser, studentId);
        StudentStats stats = studentStatsRepository.findById(studentId)
                .orElseGet(() -> recalculateStudent(studentId));
        return statisticsMapper.toDto(stats);
    }

    @Override
    @Transactional
    public ClassStatsDto getClassStatistics(User currentUser, UUID classId) {
        accessPolicy.requireStaff(currentUser);
        ClassStats stats = classStatsRepository.findById(classId)
                .orElseGet(() -> updateClassStatistics(classId));
        return statisticsMapper.toDto(stats);
    }

    @Override
    @Transactional
    public TeacherStatsDto getTeacherStatistics(User currentUser, UUID teacherId) {
        accessPolicy.requireOwnerOrAdmin(currentUser, teacherId, "Cannot view statistics of another teacher");
        TeacherStats stats = teacherStatsRepository.findById(teacherId)
                .orElseGet(() -> updateTeacherStatistics(teacherId));
        return statisticsMapper.toDto(stats);
    }

    @Override
    @Transactional(readOnly = true)
    public SchoolStatsDto getSchoolStatistics(User currentUser, LocalDate date) {
        accessPolicy.requireStaff(currentUser);
        LocalDate key = date != null ? date : LocalDate.now(clock);
        return schoolStatsRepository.findByDate(key)
                .or(schoolStatsRepository::findFirstByOrderByDateDesc)
                .map(statisticsMapper::toDto)
                .orElseThrow(() -> new ResourceNotFoundException("No school statistics recorded yet"));
    }

    @Override
    @Transactional(readOnly = true)
    public List<SchoolStatsDto> getSchoolStatisticsTrend(User currentUser, Integer days) {
        accessPolicy.requireStaff(currentUser);
        int window = days != null ? days : properties.getDefaultTrendDays();
        if (window < 1 || window > MAX_TREND_DAYS) {
            throw new ValidationException("days must be between 1 and " + MAX_TREND_DAYS);
        }
        LocalDate from = LocalDate.now(clock).minusDays(window);
        return statisticsMapper.toSchoolDtoList(schoolStatsRepository.findByDateGreaterThanEqualOrderByDateAsc(from));
    }

    private double averageScoreOfCompleted(UUID assignmentId, int totalQuestions) {
        Set<UUID> scope = scopeResolver.studentIds(assignmentId);
        double sum = 0.0;
        int count = 0;
        for (Object[] row : progressRepository.tallyByStudent(assignmentId)) {
            Tally tally = Tally.fromRow(row);
            if (scope.contains(tally.key()) && isComplete(tally.answered(), totalQuestions)) {
                sum += ProgressScoring.score(tally.correct(), totalQuestions);
                count++;
            }
        }
        return count > 0 ? sum / count : 0.0;
    }

    private double averageScoreOfStudent(UUID studentId) {
        Map<UUID, Tally> tallies = new HashMap<>();
        for (Object[] row : progressRepository.tallyByAssignment(studentId)) {
            Tally tally = Tally.fromRow(row);
            tallies.put(tally.key(), tally);
        }
        return averageScore(tallies.values(), questionCounts(tallies.keySet()));
    }

    private double averageScore(Iterable<Tally> tallies, Map<UUID, Long> questionCounts) {
        double sum = 0.0;
        int count = 0;
        for (Tally tally : tallies) {
            long totalQuestions = questionCounts.getOrDefault(tally.key(), 0L);
            if (isComplete(tally.answered(), totalQuestions)) {
                sum += ProgressScoring.score(tally.correct(), totalQuestions);
                count++;
            }
        }
        return count > 0 ? sum / count : 0.0;
    }

    private Map<UUID, Long> questionCounts(Set<UUID> assignmentIds) {
        Map<UUID, Long> counts = new HashMap<>();
        if (assignmentIds.isEmpty()) {
            return counts;
        }
        for (Object[] row : questionRepository.countByAssignmentIds(assignmentIds)) {
            counts.put((UUID) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    private void mirrorOntoAssignment(Assignment assignment, AssignmentStats stats) {
        assignment.setTotalStudentsInScope(stats.getTotalStudents());
        assignment.setCompletedStudentsCount(stats.getCompletedStudents());
        assignment.setCompletionRate(stats.getCompletionRate());
        assignment.setAverageScoreOfCompleted(stats.getAverageScore());
    }

    private static Object[] firstRow(List<Object[]> rows, int width) {
        return rows.isEmpty() || rows.get(0) == null ? new Object[width] : rows.get(0);
    }

    private static double asDouble(Object value) {
        return value != null ? ((Number) value).doubleValue() : 0.0;
    }

    private static long asLong(Object value) {
        return value != null ? ((Number) value).longValue() : 0L;
    }
}
