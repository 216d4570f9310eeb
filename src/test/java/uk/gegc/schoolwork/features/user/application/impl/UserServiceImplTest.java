package uk.gegc.schoolwork.features.user.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;
import uk.gegc.schoolwork.features.activity.application.ActivityLogService;
import uk.gegc.schoolwork.features.activity.domain.model.ActivityLogType;
import uk.gegc.schoolwork.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.schoolwork.features.classroom.domain.repository.SchoolClassRepository;
import uk.gegc.schoolwork.features.statistics.application.StatisticsService;
import uk.gegc.schoolwork.features.user.api.dto.CreateUserRequest;
import uk.gegc.schoolwork.features.user.api.dto.UpdateUserRequest;
import uk.gegc.schoolwork.features.user.api.dto.UserDto;
import uk.gegc.schoolwork.features.user.domain.model.User;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;
import uk.gegc.schoolwork.features.user.domain.repository.UserRepository;
import uk.gegc.schoolwork.features.user.infra.mapping.UserMapper;
import uk.gegc.schoolwork.shared.exception.ForbiddenException;
import uk.gegc.schoolwork.shared.exception.ResourceNotFoundException;
import uk.gegc.schoolwork.shared.exception.ValidationException;
import uk.gegc.schoolwork.shared.security.AccessPolicy;
import uk.gegc.schoolwork.testsupport.TestUsers;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("UserServiceImpl")
class UserServiceImplTest {

    @Mock private UserRepository userRepository;
    @Mock private SchoolClassRepository schoolClassRepository;
    @Mock private AssignmentRepository assignmentRepository;
    @Mock private StatisticsService statisticsService;
    @Mock private ActivityLogService activityLogService;
    @Mock private PasswordEncoder passwordEncoder;

    private UserServiceImpl userService;

    private User admin;
    private User teacher;
    private User student;

    @BeforeEach
    void setUp() {
        userService = new UserServiceImpl(userRepository, schoolClassRepository, assignmentRepository,
                statisticsService, activityLogService, passwordEncoder, new UserMapper(), new AccessPolicy());
        admin = TestUsers.user("head", UserRole.ADMIN);
        teacher = TestUsers.user("ms.green", UserRole.TEACHER);
        student = TestUsers.user("alice", UserRole.STUDENT);
    }

    @Nested
    @DisplayName("createUser")
    class CreateUser {

        @Test
        @DisplayName("stores a confirmed account with the hashed password and logs the creation")
        void admin_createsStudent() {
            CreateUserRequest request = new CreateUserRequest(" bob ", "bob@school.example", "secret1", UserRole.STUDENT);
            when(userRepository.existsByUsername("bob")).thenReturn(false);
            when(userRepository.existsByEmail("bob@school.example")).thenReturn(false);
            when(passwordEncoder.encode("secret1")).thenReturn("hashed");
            when(userRepository.save(any(User.class))).then(invocation -> {
                User saved = invocation.getArgument(0);
                saved.setId(UUID.randomUUID());
                return saved;
            });

            UserDto created = userService.createUser(admin, request);

            ArgumentCaptor<User> saved = ArgumentCaptor.forClass(User.class);
            verify(userRepository).save(saved.capture());
            assertThat(saved.getValue().getHashedPassword()).isEqualTo("hashed");
            assertThat(saved.getValue().isConfirmed()).isTrue();
            assertThat(created.username()).isEqualTo("bob");
            assertThat(created.role()).isEqualTo(UserRole.STUDENT);
            verify(activityLogService).record(eq(ActivityLogType.STUDENT_CREATED), eq(admin.getId()),
                    isNull(), isNull(), eq(Map.of("userId", created.id().toString(), "username", "bob",
                            "role", "STUDENT")));
        }

        @Test
        @DisplayName("a teacher account is logged as TEACHER_CREATED")
        void admin_createsTeacher_logsTeacherCreated() {
            CreateUserRequest request = new CreateUserRequest("mr.brown", "brown@school.example", "secret1", UserRole.TEACHER);
            when(passwordEncoder.encode("secret1")).thenReturn("hashed");
            when(userRepository.save(any(User.class))).then(invocation -> {
                User saved = invocation.getArgument(0);
                saved.setId(UUID.randomUUID());
                return saved;
            });

            userService.createUser(admin, request);

            verify(activityLogService).record(eq(ActivityLogType.TEACHER_CREATED), eq(admin.getId()),
                    isNull(), isNull(), anyMap());
        }

        @Test
        @DisplayName("a taken username is rejected")
        void duplicateUsername_rejected() {
            when(userRepository.existsByUsername("alice")).thenReturn(true);

            assertThatThrownBy(() -> userService.createUser(admin,
                    new CreateUserRequest("alice", "other@school.example", "secret1", UserRole.STUDENT)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Username already exists");
            verify(userRepository, never()).save(any());
        }

        @Test
        @DisplayName("a taken e-mail is rejected")
        void duplicateEmail_rejected() {
            when(userRepository.existsByUsername("carol")).thenReturn(false);
            when(userRepository.existsByEmail("alice@school.example")).thenReturn(true);

            assertThatThrownBy(() -> userService.createUser(admin,
                    new CreateUserRequest("carol", "alice@school.example", "secret1", UserRole.STUDENT)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Email already exists");
        }

        @Test
        @DisplayName("teachers cannot create accounts")
        void teacher_forbidden() {
            assertThatThrownBy(() -> userService.createUser(teacher,
                    new CreateUserRequest("carol", "carol@school.example", "secret1", UserRole.STUDENT)))
                    .isInstanceOf(ForbiddenException.class);
            verifyNoInteractions(userRepository, activityLogService);
        }
    }

    @Nested
    @DisplayName("updateUser")
    class UpdateUser {

        private UUID assignmentId;
        private UUID classId;

        @BeforeEach
        void setUp() {
            assignmentId = UUID.randomUUID();
            classId = UUID.randomUUID();
        }

        @Test
        @DisplayName("promoting a student rebuilds their assignments and drops their rollup")
        void studentToTeacher_rebuildsRollups() {
            when(userRepository.findById(student.getId())).thenReturn(Optional.of(student));
            when(assignmentRepository.findIdsInScopeOfUser(student.getId())).thenReturn(List.of(assignmentId));
            when(schoolClassRepository.findClassIdsByMember(student.getId())).thenReturn(List.of(classId));
            when(userRepository.saveAndFlush(student)).thenReturn(student);

            UserDto updated = userService.updateUser(admin, student.getId(),
                    new UpdateUserRequest(null, null, null, UserRole.TEACHER, null, null));

            assertThat(updated.role()).isEqualTo(UserRole.TEACHER);
            InOrder order = inOrder(userRepository, statisticsService);
            order.verify(userRepository).saveAndFlush(student);
            order.verify(statisticsService).recalculateAssignment(assignmentId);
            order.verify(statisticsService).deleteStudentStatistics(student.getId());
            order.verify(statisticsService).refreshScope(Set.of(), List.of(classId));
        }

        @Test
        @DisplayName("demoting a teacher to student builds their student rollup")
        void teacherToStudent_refreshesStudent() {
            when(userRepository.findById(teacher.getId())).thenReturn(Optional.of(teacher));
            when(assignmentRepository.findIdsInScopeOfUser(teacher.getId())).thenReturn(List.of(assignmentId));
            when(schoolClassRepository.findClassIdsByMember(teacher.getId())).thenReturn(List.of(classId));
            when(userRepository.saveAndFlush(teacher)).thenReturn(teacher);

            userService.updateUser(admin, teacher.getId(),
                    new UpdateUserRequest(null, null, null, UserRole.STUDENT, null, null));

            verify(statisticsService).recalculateAssignment(assignmentId);
            verify(statisticsService).refreshScope(Set.of(teacher.getId()), List.of(classId));
            verify(statisticsService, never()).deleteStudentStatistics(any());
        }

        @Test
        @DisplayName("profile fields change without touching statistics")
        void profileOnly_noStatistics() {
            when(userRepository.findById(student.getId())).thenReturn(Optional.of(student));
            when(userRepository.existsByEmailAndIdNot("alice@new.example", student.getId())).thenReturn(false);
            when(passwordEncoder.encode("newsecret")).thenReturn("rehashed");
            when(userRepository.save(student)).thenReturn(student);

            UserDto updated = userService.updateUser(admin, student.getId(),
                    new UpdateUserRequest(null, "alice@new.example", "newsecret", UserRole.STUDENT, null, true));

            assertThat(updated.email()).isEqualTo("alice@new.example");
            assertThat(updated.blocked()).isTrue();
            assertThat(student.getHashedPassword()).isEqualTo("rehashed");
            verifyNoInteractions(statisticsService);
        }

        @Test
        @DisplayName("admins cannot block themselves")
        void blockSelf_rejected() {
            when(userRepository.findById(admin.getId())).thenReturn(Optional.of(admin));

            assertThatThrownBy(() -> userService.updateUser(admin, admin.getId(),
                    new UpdateUserRequest(null, null, null, null, null, true)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Cannot block your own account");
        }

        @Test
        @DisplayName("admins cannot change their own role")
        void ownRole_rejected() {
            when(userRepository.findById(admin.getId())).thenReturn(Optional.of(admin));

            assertThatThrownBy(() -> userService.updateUser(admin, admin.getId(),
                    new UpdateUserRequest(null, null, null, UserRole.TEACHER, null, null)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Cannot change your own role");
            verify(userRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("a username taken by someone else is rejected")
        void takenUsername_rejected() {
            when(userRepository.findById(student.getId())).thenReturn(Optional.of(student));
            when(userRepository.existsByUsernameAndIdNot("ms.green", student.getId())).thenReturn(true);

            assertThatThrownBy(() -> userService.updateUser(admin, student.getId(),
                    new UpdateUserRequest("ms.green", null, null, null, null, null)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Username already exists");
        }
    }

    @Nested
    @DisplayName("deleteUser")
    class DeleteUser {

        @Test
        @DisplayName("deleting a student rebuilds the assignments and classes they were in")
        void student_rebuildsRollups() {
            UUID assignmentId = UUID.randomUUID();
            UUID classId = UUID.randomUUID();
            when(userRepository.findById(student.getId())).thenReturn(Optional.of(student));
            when(assignmentRepository.findIdsInScopeOfUser(student.getId())).thenReturn(List.of(assignmentId));
            when(schoolClassRepository.findClassIdsByMember(student.getId())).thenReturn(List.of(classId));

            userService.deleteUser(admin, student.getId());

            InOrder order = inOrder(userRepository, statisticsService);
            order.verify(userRepository).delete(student);
            order.verify(userRepository).flush();
            order.verify(statisticsService).recalculateAssignment(assignmentId);
            order.verify(statisticsService).refreshScope(Set.of(), List.of(classId));
        }

        @Test
        @DisplayName("deleting a teacher skips assignment rebuilds")
        void teacher_noAssignmentRebuild() {
            when(userRepository.findById(teacher.getId())).thenReturn(Optional.of(teacher));
            when(schoolClassRepository.findClassIdsByMember(teacher.getId())).thenReturn(List.of());

            userService.deleteUser(admin, teacher.getId());

            verify(userRepository).delete(teacher);
            verifyNoInteractions(assignmentRepository);
            verify(statisticsService, never()).recalculateAssignment(any());
        }

        @Test
        @DisplayName("admins cannot delete themselves")
        void self_rejected() {
            assertThatThrownBy(() -> userService.deleteUser(admin, admin.getId()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Cannot delete your own account");
            verifyNoInteractions(userRepository);
        }

        @Test
        @DisplayName("an unknown user is not found")
        void unknown_notFound() {
            UUID missing = UUID.randomUUID();
            when(userRepository.findById(missing)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> userService.deleteUser(admin, missing))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Test
    @DisplayName("countByRole: one entry per role")
    void countByRole_everyRole() {
        for (UserRole role : UserRole.values()) {
            when(userRepository.countByRole(role)).thenReturn((long) role.ordinal() + 1);
        }

        Map<UserRole, Long> counts = userService.countByRole(teacher);

        assertThat(counts).containsOnlyKeys(UserRole.values());
        assertThat(counts.get(UserRole.STUDENT)).isEqualTo(UserRole.STUDENT.ordinal() + 1L);
    }

    @Test
    @DisplayName("getUser: students may only read themselves")
    void getUser_otherStudent_forbidden() {
        User bob = TestUsers.user("bob", UserRole.STUDENT);

        assertThatThrownBy(() -> userService.getUser(student, bob.getId()))
                .isInstanceOf(ForbiddenException.class);
    }
}
