package uk.gegc.schoolwork.features.assignment.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
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
import uk.gegc.schoolwork.features.assignment.domain.model.Assignment;
import uk.gegc.schoolwork.features.assignment.domain.model.AssignmentType;
import uk.gegc.schoolwork.features.assignment.domain.model.EvaluationType;
import uk.gegc.schoolwork.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.schoolwork.features.assignment.infra.mapping.AssignmentMapper;
import uk.gegc.schoolwork.features.classroom.domain.model.SchoolClass;
import uk.gegc.schoolwork.features.classroom.domain.repository.SchoolClassRepository;
import uk.gegc.schoolwork.features.language.application.LanguageResolver;
import uk.gegc.schoolwork.features.progress.domain.repository.StudentAssignmentProgressRepository;
import uk.gegc.schoolwork.features.statistics.application.StatisticsService;
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
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AssignmentServiceImpl")
class AssignmentServiceImplTest {

    private static final Instant NOW = Instant.parse("2025-03-10T09:00:00Z");

    @Mock private AssignmentRepository assignmentRepository;
    @Mock private SchoolClassRepository schoolClassRepository;
    @Mock private UserRepository userRepository;
    @Mock private StudentAssignmentProgressRepository progressRepository;
    @Mock private LanguageResolver languageResolver;
    @Mock private AssignmentScopeResolver scopeResolver;
    @Mock private ActivityLogService activityLogService;
    @Mock private StatisticsService statisticsService;

    private AssignmentServiceImpl assignmentService;

    private User teacher;
    private User otherTeacher;
    private User student;
    private SchoolClass schoolClass;

    @BeforeEach
    void setUp() {
        AccessPolicy accessPolicy = new AccessPolicy();
        assignmentService = new AssignmentServiceImpl(
                assignmentRepository, schoolClassRepository, userRepository, progressRepository, languageResolver,
                new AssignmentAccessService(accessPolicy, scopeResolver), scopeResolver, activityLogService,
                statisticsService, new AssignmentMapper(new ObjectMapper()), accessPolicy,
                Clock.fixed(NOW, ZoneOffset.UTC));

        teacher = user("ms.green", UserRole.TEACHER);
        otherTeacher = user("mr.brown", UserRole.TEACHER);
        student = user("alice", UserRole.STUDENT);

        schoolClass = new SchoolClass();
        schoolClass.setId(UUID.randomUUID());
        schoolClass.setName("7B");
    }

    @Nested
    @DisplayName("createAssignment")
    class Create {

        @BeforeEach
        void persistEcho() {
            when(languageResolver.resolve(null)).thenReturn(Optional.empty());
            when(assignmentRepository.save(any(Assignment.class))).thenAnswer(inv -> {
                Assignment a = inv.getArgument(0);
                a.setId(UUID.randomUUID());
                return a;
            });
        }

        @Test
        @DisplayName("future publish time creates an inactive assignment")
        void futureSchedule_inactive() {
            when(schoolClassRepository.findAllById(Set.of(schoolClass.getId()))).thenReturn(List.of(schoolClass));
            Instant publishAt = NOW.plus(Duration.ofDays(2));

            AssignmentDto dto = assignmentService.createAssignment(teacher, request(publishAt, List.of(schoolClass.getId()), List.of()));

            assertThat(dto.isActive()).isFalse();
            assertThat(dto.scheduledPublishAt()).isEqualTo(publishAt);
            assertThat(dto.publishedAt()).isEqualTo(NOW);
            assertThat(dto.teacher().username()).isEqualTo("ms.green");
            assertThat(dto.questions()).hasSize(2);
            assertThat(dto.evaluationSettings().feedbackSettings().isObject()).isTrue();
            verify(activityLogService).record(eq(ActivityLogType.ASSIGNMENT_CREATED), eq(teacher.getId()),
                    any(UUID.class), isNull(), anyMap());
            verify(statisticsService).initializeAssignmentStatistics(any(Assignment.class));
        }

        @Test
        @DisplayName("a publish time in the past creates an active assignment")
        void pastSchedule_active() {
            AssignmentDto dto = assignmentService.createAssignment(teacher,
                    request(NOW.minus(Duration.ofMinutes(5)), List.of(), List.of()));

            assertThat(dto.isActive()).isTrue();
        }

        @Test
        @DisplayName("questions keep their request order")
        void questionsKeepOrder() {
            ArgumentCaptor<Assignment> captor = ArgumentCaptor.forClass(Assignment.class);

            assignmentService.createAssignment(teacher, request(null, List.of(), List.of()));

            verify(assignmentRepository).save(captor.capture());
            assertThat(captor.getValue().getQuestions())
                    .extracting(q -> q.getPosition() + ":" + q.getTextQuestion())
                    .containsExactly("0:Who is in your family?", "1:What does your mother do?");
        }
    }

    @Test
    @DisplayName("createAssignment: students cannot create assignments")
    void create_byStudent_forbidden() {
        assertThatThrownBy(() -> assignmentService.createAssignment(student, request(null, List.of(), List.of())))
                .isInstanceOf(ForbiddenException.class);
        verifyNoInteractions(assignmentRepository);
    }

    @Test
    @DisplayName("createAssignment: only students can be linked individually")
    void create_individualTeacher_rejected() {
        when(userRepository.findAllByIdIn(anyCollection())).thenReturn(List.of(otherTeacher));

        assertThatThrownBy(() -> assignmentService.createAssignment(teacher,
                request(null, List.of(), List.of(otherTeacher.getId()))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("mr.brown");
        verify(assignmentRepository, never()).save(any());
    }

    @Test
    @DisplayName("createAssignment: unknown class id is rejected")
    void create_unknownClass_rejected() {
        when(schoolClassRepository.findAllById(anyCollection())).thenReturn(List.of());

        assertThatThrownBy(() -> assignmentService.createAssignment(teacher,
                request(null, List.of(UUID.randomUUID()), List.of())))
                .isInstanceOf(ValidationException.class);
    }

    @Nested
    @DisplayName("updateAssignment")
    class Update {

        private Assignment scheduled;

        @BeforeEach
        void existing() {
            scheduled = new Assignment();
            scheduled.setId(UUID.randomUUID());
            scheduled.setTopic("Weather");
            scheduled.setTeacher(teacher);
            scheduled.setScheduledPublishAt(NOW.plus(Duration.ofDays(1)));
            scheduled.setActive(false);
            scheduled.getClasses().add(schoolClass);
            when(assignmentRepository.findById(scheduled.getId())).thenReturn(Optional.of(scheduled));
        }

        @Test
        @DisplayName("activating before the publish time is rejected")
        void activateBeforeSchedule_rejected() {
            UpdateAssignmentRequest request = update(null, null, true);

            assertThatThrownBy(() -> assignmentService.updateAssignment(teacher, scheduled.getId(), request))
                    .isInstanceOf(ValidationException.class);
            verify(assignmentRepository, never()).save(any());
        }

        @Test
        @DisplayName("clearing the schedule publishes and refreshes the scope rollups")
        void clearSchedule_activates() {
            UUID studentId = student.getId();
            when(assignmentRepository.save(scheduled)).thenReturn(scheduled);
            when(scopeResolver.studentIds(scheduled.getId())).thenReturn(Set.of(studentId));

            AssignmentDto dto = assignmentService.updateAssignment(teacher, scheduled.getId(), update(null, true, null));

            assertThat(dto.isActive()).isTrue();
            assertThat(dto.scheduledPublishAt()).isNull();
            verify(statisticsService).refreshScope(Set.of(studentId), Set.of(schoolClass.getId()));
        }

        @Test
        @DisplayName("moving the schedule to the past activates")
        void scheduleInPast_activates() {
            when(assignmentRepository.save(scheduled)).thenReturn(scheduled);
            when(scopeResolver.studentIds(scheduled.getId())).thenReturn(Set.of());

            AssignmentDto dto = assignmentService.updateAssignment(teacher, scheduled.getId(),
                    update(NOW.minus(Duration.ofHours(1)), null, null));

            assertThat(dto.isActive()).isTrue();
        }

        @Test
        @DisplayName("moving the schedule of a published assignment into the future deactivates it")
        void scheduleInFuture_deactivates() {
            scheduled.setActive(true);
            scheduled.setScheduledPublishAt(null);
            Instant later = NOW.plus(Duration.ofDays(3));
            UUID studentId = student.getId();
            when(assignmentRepository.save(scheduled)).thenReturn(scheduled);
            when(scopeResolver.studentIds(scheduled.getId())).thenReturn(Set.of(studentId));

            AssignmentDto dto = assignmentService.updateAssignment(teacher, scheduled.getId(),
                    update(later, null, null));

            assertThat(dto.isActive()).isFalse();
            assertThat(dto.scheduledPublishAt()).isEqualTo(later);
            verify(statisticsService).refreshScope(Set.of(studentId), Set.of(schoolClass.getId()));
        }

        @Test
        @DisplayName("another teacher cannot modify the assignment")
        void otherTeacher_forbidden() {
            assertThatThrownBy(() -> assignmentService.updateAssignment(otherTeacher, scheduled.getId(),
                    update(null, true, null)))
                    .isInstanceOf(ForbiddenException.class);
        }
    }

    @Test
    @DisplayName("deleteAssignment: removes dependants before the assignment, then refreshes rollups")
    void delete_cascadesInOrder() {
        Assignment assignment = new Assignment();
        assignment.setId(UUID.randomUUID());
        assignment.setTeacher(teacher);
        assignment.getClasses().add(schoolClass);
        when(assignmentRepository.findById(assignment.getId())).thenReturn(Optional.of(assignment));
        when(scopeResolver.studentIds(assignment.getId())).thenReturn(Set.of(student.getId()));

        assignmentService.deleteAssignment(teacher, assignment.getId());

        InOrder order = inOrder(progressRepository, statisticsService, activityLogService, assignmentRepository);
        order.verify(progressRepository).deleteByAssignmentId(assignment.getId());
        order.verify(statisticsService).deleteAssignmentStatistics(assignment.getId());
        order.verify(activityLogService).deleteForAssignment(assignment.getId());
        order.verify(assignmentRepository).delete(assignment);
        order.verify(assignmentRepository).flush();
        order.verify(statisticsService).refreshScope(Set.of(student.getId()), Set.of(schoolClass.getId()));
    }

    @Test
    @DisplayName("getAssignment: missing id is a 404")
    void get_missing_notFound() {
        UUID id = UUID.randomUUID();
        when(assignmentRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> assignmentService.getAssignment(teacher, id))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("getAssignment: a student outside the scope is forbidden")
    void get_outOfScope_forbidden() {
        Assignment assignment = new Assignment();
        assignment.setId(UUID.randomUUID());
        assignment.setTeacher(teacher);
        when(assignmentRepository.findById(assignment.getId())).thenReturn(Optional.of(assignment));
        when(scopeResolver.isInScope(assignment.getId(), student.getId())).thenReturn(false);

        assertThatThrownBy(() -> assignmentService.getAssignment(student, assignment.getId()))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    @DisplayName("listAssignments: the default ordering replaces any requested sort")
    @SuppressWarnings("unchecked")
    void list_forcesDefaultSort() {
        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        when(assignmentRepository.findAll(any(Specification.class), pageable.capture())).thenReturn(Page.empty());

        assignmentService.listAssignments(teacher, AssignmentSearchCriteria.empty(),
                PageRequest.of(1, 10, Sort.by("topic")));

        assertThat(pageable.getValue().getPageNumber()).isEqualTo(1);
        assertThat(pageable.getValue().getSort()).isEqualTo(AssignmentServiceImpl.DEFAULT_SORT);
    }

    @Test
    @DisplayName("getMyAssignments: unknown status is rejected")
    void mine_unknownStatus_rejected() {
        assertThatThrownBy(() -> assignmentService.getMyAssignments(student, "finished"))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(assignmentRepository);
    }

    private CreateAssignmentRequest request(Instant publishAt, List<UUID> classIds, List<UUID> studentIds) {
        ObjectMapper mapper = new ObjectMapper();
        return new CreateAssignmentRequest(
                "  My family ",
                classIds.isEmpty() && !studentIds.isEmpty() ? AssignmentType.INDIVIDUAL : AssignmentType.CLASS,
                "#3B82F6",
                mapper.valueToTree(List.of(Map.of("word", "mother"))),
                publishAt,
                null,
                null,
                null,
                null,
                false,
                null,
                null,
                classIds,
                studentIds,
                List.of(new QuestionRequest("Who is in your family?", null, null, null),
                        new QuestionRequest("What does your mother do?", null, null, null)),
                new EvaluationSettingsRequest(EvaluationType.Q_AND_A, null, null, null, null)
        );
    }

    private static UpdateAssignmentRequest update(Instant publishAt, Boolean clearSchedule, Boolean isActive) {
        return new UpdateAssignmentRequest(null, null, null, publishAt, clearSchedule, null, isActive,
                null, null, null, null, null, null);
    }

    private static User user(String username, UserRole role) {
        User user = new User();
        user.setId(UUID.randomUUID());
        user.setUsername(username);
        user.setRole(role);
        return user;
    }
}
