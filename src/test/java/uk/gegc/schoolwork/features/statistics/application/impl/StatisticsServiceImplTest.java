package uk.gegc.schoolwork.features.statistics.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.schoolwork.features.assignment.application.AssignmentScopeResolver;
import uk.gegc.schoolwork.features.assignment.domain.model.Assignment;
import uk.gegc.schoolwork.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.schoolwork.features.assignment.domain.repository.QuestionRepository;
import uk.gegc.schoolwork.features.classroom.domain.repository.SchoolClassRepository;
import uk.gegc.schoolwork.features.progress.domain.repository.StudentAssignmentProgressRepository;
import uk.gegc.schoolwork.features.statistics.config.StatisticsProperties;
import uk.gegc.schoolwork.features.statistics.domain.model.AssignmentStats;
import uk.gegc.schoolwork.features.statistics.domain.model.ClassStats;
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
import uk.gegc.schoolwork.shared.exception.ForbiddenException;
import uk.gegc.schoolwork.shared.exception.ResourceNotFoundException;
import uk.gegc.schoolwork.shared.exception.ValidationException;
import uk.gegc.schoolwork.shared.security.AccessPolicy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StatisticsServiceImpl")
class StatisticsServiceImplTest {

    private static final Instant NOW = Instant.parse("2025-03-10T09:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);

    @Mock private AssignmentRepository assignmentRepository;
    @Mock private QuestionRepository questionRepository;
    @Mock private StudentAssignmentProgressRepository progressRepository;
    @Mock private SchoolClassRepository schoolClassRepository;
    @Mock private UserRepository userRepository;
    @Mock private AssignmentStatsRepository assignmentStatsRepository;
    @Mock private StudentStatsRepository studentStatsRepository;
    @Mock private ClassStatsRepository classStatsRepository;
    @Mock private TeacherStatsRepository teacherStatsRepository;
    @Mock private SchoolStatsRepository schoolStatsRepository;
    @Mock private AssignmentScopeResolver scopeResolver;
    @Mock private StatisticsMapper statisticsMapper;

    private StatisticsServiceImpl statisticsService;

    private UUID assignmentId;
    private UUID studentId;
    private Assignment assignment;

    @BeforeEach
    void setUp() {
        statisticsService = new StatisticsServiceImpl(
                assignmentRepository, questionRepository, progressRepository, schoolClassRepository, userRepository,
                assignmentStatsRepository, studentStatsRepository, classStatsRepository, teacherStatsRepository,
                schoolStatsRepository, scopeResolver, new StatisticsProperties(), statisticsMapper,
                new AccessPolicy(), Clock.fixed(NOW, ZoneOffset.UTC));

        assignmentId = UUID.randomUUID();
        studentId = UUID.randomUUID();
        assignment = new Assignment();
        assignment.setId(assignmentId);
    }

    @Nested
    @DisplayName("recordSubmission")
    class RecordSubmission {

        private AssignmentStats assignmentStats;
        private StudentStats studentStats;
        private SchoolStats schoolStats;

        @BeforeEach
        void existingRollups() {
            assignmentStats = new AssignmentStats(assignmentId);
            assignmentStats.setTotalStudents(2);
            assignmentStats.setTotalQuestions(2);
            assignmentStats.setNotStartedStudents(1);
            assignmentStats.setInProgressStudents(1);
            assignmentStats.setTotalAnswers(1);
            assignmentStats.setTotalCorrectAnswers(1);

            studentStats = new StudentStats(studentId);
            studentStats.setTotalAssignments(1);
            studentStats.setInProgressAssignments(1);
            studentStats.setTotalAnswers(1);
            studentStats.setTotalCorrectAnswers(1);

            schoolStats = new SchoolStats(TODAY);
            schoolStats.setTotalAnswers(10);
            schoolStats.setTotalCorrectAnswers(7);

            when(assignmentRepository.findById(assignmentId)).thenReturn(Optional.of(assignment));
            when(assignmentStatsRepository.findById(assignmentId)).thenReturn(Optional.of(assignmentStats));
            when(studentStatsRepository.findById(studentId)).thenReturn(Optional.of(studentStats));
            when(schoolClassRepository.findClassIdsForAssignmentAndMember(assignmentId, studentId)).thenReturn(List.of());
            when(schoolStatsRepository.findByDate(TODAY)).thenReturn(Optional.of(schoolStats));
        }

        @Test
        @DisplayName("last missing answer moves the student to completed everywhere")
        void newAnswer_completingAssignment_updatesCounters() {
            when(progressRepository.countAnsweredQuestions(studentId, assignmentId)).thenReturn(2L);
            when(questionRepository.countByAssignment_Id(assignmentId)).thenReturn(2L);
            when(scopeResolver.studentIds(assignmentId)).thenReturn(Set.of(studentId));
            when(progressRepository.tallyByStudent(assignmentId))
                    .thenReturn(List.<Object[]>of(new Object[]{studentId, 2L, 2L}));
            when(progressRepository.tallyByAssignment(studentId))
                    .thenReturn(List.<Object[]>of(new Object[]{assignmentId, 2L, 2L}));
            when(questionRepository.countByAssignmentIds(Set.of(assignmentId)))
                    .thenReturn(List.<Object[]>of(new Object[]{assignmentId, 2L}));

            statisticsService.recordSubmission(assignmentId, studentId, true, true, false);

            assertThat(assignmentStats.getTotalAnswers()).isEqualTo(2);
            assertThat(assignmentStats.getTotalCorrectAnswers()).isEqualTo(2);
            assertThat(assignmentStats.getInProgressStudents()).isZero();
            assertThat(assignmentStats.getCompletedStudents()).isEqualTo(1);
            assertThat(assignmentStats.getNotStartedStudents()).isEqualTo(1);
            assertThat(assignmentStats.getCompletionRate()).isEqualTo(50.0);
            assertThat(assignmentStats.getAccuracyRate()).isEqualTo(100.0);
            assertThat(assignmentStats.getAverageScore()).isEqualTo(100.0);

            assertThat(assignment.getCompletedStudentsCount()).isEqualTo(1);
            assertThat(assignment.getCompletionRate()).isEqualTo(50.0);

            assertThat(studentStats.getCompletedAssignments()).isEqualTo(1);
            assertThat(studentStats.getInProgressAssignments()).isZero();
            assertThat(studentStats.getTotalAnswers()).isEqualTo(2);
            assertThat(studentStats.getCompletionRate()).isEqualTo(100.0);
            assertThat(studentStats.getLastActivityDate()).isEqualTo(NOW);

            assertThat(schoolStats.getTotalAnswers()).isEqualTo(11);
            assertThat(schoolStats.getTotalCorrectAnswers()).isEqualTo(8);
        }

        @Test
        @DisplayName("first answer moves the student from not started to in progress")
        void newAnswer_firstOfAssignment_marksStarted() {
            assignmentStats.setNotStartedStudents(2);
            assignmentStats.setInProgressStudents(0);
            assignmentStats.setTotalAnswers(0);
            assignmentStats.setTotalCorrectAnswers(0);
            studentStats.setNotStartedAssignments(1);
            studentStats.setInProgressAssignments(0);
            studentStats.setTotalAnswers(0);
            studentStats.setTotalCorrectAnswers(0);

            when(progressRepository.countAnsweredQuestions(studentId, assignmentId)).thenReturn(1L);
            when(questionRepository.countByAssignment_Id(assignmentId)).thenReturn(2L);
            when(scopeResolver.studentIds(assignmentId)).thenReturn(Set.of(studentId));
            when(progressRepository.tallyByStudent(assignmentId))
                    .thenReturn(List.<Object[]>of(new Object[]{studentId, 1L, 0L}));
            when(progressRepository.tallyByAssignment(studentId))
                    .thenReturn(List.<Object[]>of(new Object[]{assignmentId, 1L, 0L}));
            when(questionRepository.countByAssignmentIds(Set.of(assignmentId)))
                    .thenReturn(List.<Object[]>of(new Object[]{assignmentId, 2L}));

            statisticsService.recordSubmission(assignmentId, studentId, false, true, false);

            assertThat(assignmentStats.getNotStartedStudents()).isEqualTo(1);
            assertThat(assignmentStats.getInProgressStudents()).isEqualTo(1);
            assertThat(assignmentStats.getCompletedStudents()).isZero();
            assertThat(assignmentStats.getTotalAnswers()).isEqualTo(1);
            assertThat(assignmentStats.getTotalCorrectAnswers()).isZero();
            assertThat(assignmentStats.getAverageScore()).isZero();

            assertThat(studentStats.getNotStartedAssignments()).isZero();
            assertThat(studentStats.getInProgressAssignments()).isEqualTo(1);
            assertThat(studentStats.getAccuracyRate()).isZero();

            assertThat(schoolStats.getTotalAnswers()).isEqualTo(11);
            assertThat(schoolStats.getTotalCorrectAnswers()).isEqualTo(7);
        }

        @Test
        @DisplayName("correcting a wrong answer raises correct counts without adding an answer")
        void resubmission_wrongThenCorrect_countsCorrectAnswer() {
            assignmentStats.setTotalCorrectAnswers(0);
            studentStats.setTotalCorrectAnswers(0);
            stubResubmissionTallies(1L);

            statisticsService.recordSubmission(assignmentId, studentId, true, false, false);

            assertThat(assignmentStats.getTotalAnswers()).isEqualTo(1);
            assertThat(assignmentStats.getTotalCorrectAnswers()).isEqualTo(1);
            assertThat(assignmentStats.getAccuracyRate()).isEqualTo(100.0);
            assertThat(assignmentStats.getInProgressStudents()).isEqualTo(1);
            assertThat(assignmentStats.getCompletedStudents()).isZero();

            assertThat(studentStats.getTotalAnswers()).isEqualTo(1);
            assertThat(studentStats.getTotalCorrectAnswers()).isEqualTo(1);
            assertThat(studentStats.getAccuracyRate()).isEqualTo(100.0);

            assertThat(schoolStats.getTotalAnswers()).isEqualTo(10);
            assertThat(schoolStats.getTotalCorrectAnswers()).isEqualTo(8);
            verify(questionRepository, never()).countByAssignment_Id(any());
            verify(schoolStatsRepository).save(schoolStats);
        }

        @Test
        @DisplayName("turning a correct answer wrong lowers correct counts")
        void resubmission_correctThenWrong_dropsCorrectAnswer() {
            stubResubmissionTallies(0L);

            statisticsService.recordSubmission(assignmentId, studentId, false, false, true);

            assertThat(assignmentStats.getTotalAnswers()).isEqualTo(1);
            assertThat(assignmentStats.getTotalCorrectAnswers()).isZero();
            assertThat(assignmentStats.getAccuracyRate()).isZero();
            assertThat(studentStats.getTotalCorrectAnswers()).isZero();
            assertThat(schoolStats.getTotalAnswers()).isEqualTo(10);
            assertThat(schoolStats.getTotalCorrectAnswers()).isEqualTo(6);
        }

        @Test
        @DisplayName("re-answering with the same correctness leaves every counter untouched")
        void resubmission_sameCorrectness_keepsCounts() {
            stubResubmissionTallies(1L);

            statisticsService.recordSubmission(assignmentId, studentId, true, false, true);

            assertThat(assignmentStats.getTotalAnswers()).isEqualTo(1);
            assertThat(assignmentStats.getTotalCorrectAnswers()).isEqualTo(1);
            assertThat(studentStats.getTotalAnswers()).isEqualTo(1);
            assertThat(studentStats.getTotalCorrectAnswers()).isEqualTo(1);
            assertThat(schoolStats.getTotalAnswers()).isEqualTo(10);
            assertThat(schoolStats.getTotalCorrectAnswers()).isEqualTo(7);
            verify(schoolStatsRepository, never()).save(any());
        }

        private void stubResubmissionTallies(long correct) {
            when(progressRepository.countAnsweredQuestions(studentId, assignmentId)).thenReturn(1L);
            when(scopeResolver.studentIds(assignmentId)).thenReturn(Set.of(studentId));
            when(progressRepository.tallyByStudent(assignmentId))
                    .thenReturn(List.<Object[]>of(new Object[]{studentId, 1L, correct}));
            when(progressRepository.tallyByAssignment(studentId))
                    .thenReturn(List.<Object[]>of(new Object[]{assignmentId, 1L, correct}));
            when(questionRepository.countByAssignmentIds(Set.of(assignmentId)))
                    .thenReturn(List.<Object[]>of(new Object[]{assignmentId, 2L}));
        }
    }

    @Nested
    @DisplayName("recalculateAssignment")
    class RecalculateAssignment {

        @Test
        @DisplayName("rebuilds from the progress rows of students still in scope")
        void rebuild_ignoresStudentsOutOfScope() {
            UUID bob = UUID.randomUUID();
            UUID formerStudent = UUID.randomUUID();
            when(assignmentRepository.findById(assignmentId)).thenReturn(Optional.of(assignment));
            when(scopeResolver.studentIds(assignmentId)).thenReturn(Set.of(studentId, bob));
            when(questionRepository.countByAssignment_Id(assignmentId)).thenReturn(2L);
            when(progressRepository.tallyByStudent(assignmentId)).thenReturn(List.<Object[]>of(
                    new Object[]{studentId, 2L, 2L},
                    new Object[]{bob, 1L, 0L},
                    new Object[]{formerStudent, 2L, 0L}));
            when(assignmentStatsRepository.findById(assignmentId)).thenReturn(Optional.empty());
            when(assignmentStatsRepository.save(any(AssignmentStats.class))).thenAnswer(inv -> inv.getArgument(0));

            AssignmentStats stats = statisticsService.recalculateAssignment(assignmentId);

            assertThat(stats.getTotalStudents()).isEqualTo(2);
            assertThat(stats.getTotalQuestions()).isEqualTo(2);
            assertThat(stats.getCompletedStudents()).isEqualTo(1);
            assertThat(stats.getInProgressStudents()).isEqualTo(1);
            assertThat(stats.getNotStartedStudents()).isZero();
            assertThat(stats.getTotalAnswers()).isEqualTo(3);
            assertThat(stats.getTotalCorrectAnswers()).isEqualTo(2);
            assertThat(stats.getCompletionRate()).isEqualTo(50.0);
            assertThat(stats.getAccuracyRate()).isEqualTo(66.67);
            assertThat(stats.getAverageScore()).isEqualTo(100.0);
            assertThat(stats.getLastUpdated()).isEqualTo(NOW);

            assertThat(assignment.getTotalStudentsInScope()).isEqualTo(2);
            assertThat(assignment.getAverageScoreOfCompleted()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("nobody answering leaves every student not started")
        void rebuild_noProgress_allNotStarted() {
            when(assignmentRepository.findById(assignmentId)).thenReturn(Optional.of(assignment));
            when(scopeResolver.studentIds(assignmentId)).thenReturn(Set.of(studentId, UUID.randomUUID()));
            when(questionRepository.countByAssignment_Id(assignmentId)).thenReturn(3L);
            when(progressRepository.tallyByStudent(assignmentId)).thenReturn(List.of());
            AssignmentStats existing = new AssignmentStats(assignmentId);
            existing.setCompletedStudents(5);
            when(assignmentStatsRepository.findById(assignmentId)).thenReturn(Optional.of(existing));
            when(assignmentStatsRepository.save(any(AssignmentStats.class))).thenAnswer(inv -> inv.getArgument(0));

            AssignmentStats stats = statisticsService.recalculateAssignment(assignmentId);

            assertThat(stats).isSameAs(existing);
            assertThat(stats.getCompletedStudents()).isZero();
            assertThat(stats.getNotStartedStudents()).isEqualTo(2);
            assertThat(stats.getAccuracyRate()).isZero();
            assertThat(stats.getAverageScore()).isZero();
        }

        @Test
        @DisplayName("unknown assignment is not found")
        void rebuild_unknownAssignment_notFound() {
            when(assignmentRepository.findById(assignmentId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> statisticsService.recalculateAssignment(assignmentId))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Test
    @DisplayName("updateSchoolStatistics: snapshots today's counts into the dated row")
    void updateSchoolStatistics_snapshotsCounts() {
        when(assignmentStatsRepository.averagesForAll()).thenReturn(List.<Object[]>of(new Object[]{55.555, 70.25}));
        when(studentStatsRepository.answerTotals()).thenReturn(List.<Object[]>of(new Object[]{100L, 80L}));
        when(schoolStatsRepository.findByDate(TODAY)).thenReturn(Optional.empty());
        when(userRepository.count()).thenReturn(10L);
        when(userRepository.countByRole(UserRole.TEACHER)).thenReturn(2L);
        when(userRepository.countByRole(UserRole.STUDENT)).thenReturn(7L);
        when(schoolClassRepository.count()).thenReturn(3L);
        when(assignmentRepository.count()).thenReturn(5L);
        when(assignmentRepository.countByActiveTrue()).thenReturn(4L);
        when(assignmentRepository.countScheduled(NOW)).thenReturn(1L);
        when(studentStatsRepository.countByLastActivityDateGreaterThanEqual(NOW.minus(Duration.ofDays(1))))
                .thenReturn(6L);
        when(teacherStatsRepository.countByLastUpdatedGreaterThanEqual(NOW.minus(Duration.ofDays(1))))
                .thenReturn(2L);
        when(studentStatsRepository.countNeedingHelpSchoolWide(50.0, 60.0)).thenReturn(3L);
        when(schoolStatsRepository.save(any(SchoolStats.class))).thenAnswer(inv -> inv.getArgument(0));

        SchoolStats stats = statisticsService.updateSchoolStatistics(null);

        assertThat(stats.getDate()).isEqualTo(TODAY);
        assertThat(stats.getTotalUsers()).isEqualTo(10);
        assertThat(stats.getTotalTeachers()).isEqualTo(2);
        assertThat(stats.getTotalStudents()).isEqualTo(7);
        assertThat(stats.getTotalClasses()).isEqualTo(3);
        assertThat(stats.getTotalAssignments()).isEqualTo(5);
        assertThat(stats.getActiveAssignments()).isEqualTo(4);
        assertThat(stats.getScheduledAssignments()).isEqualTo(1);
        assertThat(stats.getAverageCompletionRate()).isEqualTo(55.56);
        assertThat(stats.getAverageScore()).isEqualTo(70.25);
        assertThat(stats.getTotalAnswers()).isEqualTo(100);
        assertThat(stats.getTotalCorrectAnswers()).isEqualTo(80);
        assertThat(stats.getDailyActiveStudents()).isEqualTo(6);
        assertThat(stats.getDailyActiveTeachers()).isEqualTo(2);
        assertThat(stats.getStudentsNeedingHelp()).isEqualTo(3);
    }

    @Test
    @DisplayName("updateTeacherStatistics: counts classes, distinct students and assignment averages")
    void updateTeacherStatistics_aggregates() {
        UUID teacherId = UUID.randomUUID();
        List<UUID> classIds = List.of(UUID.randomUUID(), UUID.randomUUID());
        when(userRepository.existsById(teacherId)).thenReturn(true);
        when(schoolClassRepository.findClassIdsByMember(teacherId)).thenReturn(classIds);
        when(schoolClassRepository.countDistinctMembersByRole(classIds, UserRole.STUDENT)).thenReturn(12L);
        when(assignmentStatsRepository.averagesForTeacher(teacherId))
                .thenReturn(List.<Object[]>of(new Object[]{62.5, 81.125}));
        when(teacherStatsRepository.findById(teacherId)).thenReturn(Optional.empty());
        when(assignmentRepository.countByTeacher_Id(teacherId)).thenReturn(4L);
        when(assignmentRepository.countByTeacher_IdAndActiveTrue(teacherId)).thenReturn(3L);
        when(assignmentRepository.countScheduledByTeacher(teacherId, NOW)).thenReturn(1L);
        when(teacherStatsRepository.save(any(TeacherStats.class))).thenAnswer(inv -> inv.getArgument(0));

        TeacherStats stats = statisticsService.updateTeacherStatistics(teacherId);

        assertThat(stats.getTeacherId()).isEqualTo(teacherId);
        assertThat(stats.getTotalClasses()).isEqualTo(2);
        assertThat(stats.getTotalStudents()).isEqualTo(12);
        assertThat(stats.getTotalAssignments()).isEqualTo(4);
        assertThat(stats.getActiveAssignments()).isEqualTo(3);
        assertThat(stats.getScheduledAssignments()).isEqualTo(1);
        assertThat(stats.getAverageClassCompletion()).isEqualTo(62.5);
        assertThat(stats.getAverageClassScore()).isEqualTo(81.13);
        assertThat(stats.getLastUpdated()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("updateTeacherStatistics: a teacher without classes or assignments gets zeros")
    void updateTeacherStatistics_noClasses_zeros() {
        UUID teacherId = UUID.randomUUID();
        when(userRepository.existsById(teacherId)).thenReturn(true);
        when(schoolClassRepository.findClassIdsByMember(teacherId)).thenReturn(List.of());
        when(assignmentStatsRepository.averagesForTeacher(teacherId))
                .thenReturn(List.<Object[]>of(new Object[]{null, null}));
        when(teacherStatsRepository.findById(teacherId)).thenReturn(Optional.empty());
        when(teacherStatsRepository.save(any(TeacherStats.class))).thenAnswer(inv -> inv.getArgument(0));

        TeacherStats stats = statisticsService.updateTeacherStatistics(teacherId);

        assertThat(stats.getTotalStudents()).isZero();
        assertThat(stats.getAverageClassCompletion()).isZero();
        verify(schoolClassRepository, never()).countDistinctMembersByRole(anyCollection(), any());
    }

    @Test
    @DisplayName("updateClassStatistics: a class without students gets zeroed aggregates")
    void updateClassStatistics_noStudents_zeroed() {
        UUID classId = UUID.randomUUID();
        when(schoolClassRepository.existsById(classId)).thenReturn(true);
        when(schoolClassRepository.findMemberIdsByRole(classId, UserRole.STUDENT)).thenReturn(List.of());
        when(classStatsRepository.findById(classId)).thenReturn(Optional.empty());
        when(assignmentRepository.findIdsByClassId(classId)).thenReturn(List.of(UUID.randomUUID(), UUID.randomUUID()));
        when(assignmentRepository.countActiveByClassId(classId)).thenReturn(1L);
        when(classStatsRepository.save(any(ClassStats.class))).thenAnswer(inv -> inv.getArgument(0));

        ClassStats stats = statisticsService.updateClassStatistics(classId);

        assertThat(stats.getTotalStudents()).isZero();
        assertThat(stats.getTotalAssignments()).isEqualTo(2);
        assertThat(stats.getActiveAssignments()).isEqualTo(1);
        assertThat(stats.getAverageCompletion()).isZero();
        assertThat(stats.getStudentsNeedingHelp()).isZero();
        assertThat(stats.getLastUpdated()).isEqualTo(NOW);
        verify(studentStatsRepository, never()).aggregateFor(anyCollection());
    }

    @Test
    @DisplayName("pruneSchoolStatistics: removes rows older than the retention window")
    void pruneSchoolStatistics_usesRetentionWindow() {
        when(schoolStatsRepository.deleteOlderThan(TODAY.minusDays(365))).thenReturn(3);

        assertThat(statisticsService.pruneSchoolStatistics()).isEqualTo(3);
    }

    @Test
    @DisplayName("deleteAssignmentStatistics: missing row is ignored")
    void deleteAssignmentStatistics_missing_noDelete() {
        when(assignmentStatsRepository.existsById(assignmentId)).thenReturn(false);

        statisticsService.deleteAssignmentStatistics(assignmentId);

        verify(assignmentStatsRepository, never()).deleteById(any());
    }

    @Test
    @DisplayName("getSchoolStatisticsTrend: rejects a window outside the allowed range")
    void trend_invalidWindow_rejected() {
        User teacher = user(UserRole.TEACHER);

        assertThatThrownBy(() -> statisticsService.getSchoolStatisticsTrend(teacher, 0))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> statisticsService.getSchoolStatisticsTrend(teacher, 400))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("getTeacherStatistics: another teacher is forbidden")
    void teacherStatistics_otherTeacher_forbidden() {
        User teacher = user(UserRole.TEACHER);

        assertThatThrownBy(() -> statisticsService.getTeacherStatistics(teacher, UUID.randomUUID()))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    @DisplayName("getStudentStatistics: a student cannot read another student")
    void studentStatistics_otherStudent_forbidden() {
        User student = user(UserRole.STUDENT);

        assertThatThrownBy(() -> statisticsService.getStudentStatistics(student, studentId))
                .isInstanceOf(ForbiddenException.class);
    }

    private static User user(UserRole role) {
        User user = new User();
        user.setId(UUID.randomUUID());
        user.setUsername(role.name().toLowerCase() + "-user");
        user.setRole(role);
        return user;
    }
}
