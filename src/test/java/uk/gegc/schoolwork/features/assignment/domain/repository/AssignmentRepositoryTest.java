package uk.gegc.schoolwork.features.assignment.domain.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.schoolwork.features.assignment.domain.model.Assignment;
import uk.gegc.schoolwork.features.assignment.domain.model.AssignmentType;
import uk.gegc.schoolwork.features.classroom.domain.model.SchoolClass;
import uk.gegc.schoolwork.features.user.domain.model.User;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("AssignmentRepository")
class AssignmentRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-03-10T09:00:00Z");

    @Autowired
    private AssignmentRepository assignmentRepository;

    @Autowired
    private TestEntityManager entityManager;

    private User teacher;
    private User alice;
    private User bob;
    private User carol;
    private SchoolClass schoolClass;

    @BeforeEach
    void setUp() {
        teacher = persistUser("ms.green", UserRole.TEACHER);
        alice = persistUser("alice", UserRole.STUDENT);
        bob = persistUser("bob", UserRole.STUDENT);
        carol = persistUser("carol", UserRole.STUDENT);

        schoolClass = new SchoolClass();
        schoolClass.setName("7B");
        schoolClass.getMembers().add(alice);
        schoolClass.getMembers().add(teacher);
        entityManager.persist(schoolClass);
        entityManager.flush();
    }

    @Test
    @DisplayName("isUserInScope: class members and individual students are in scope")
    void isUserInScope_classAndIndividual() {
        Assignment assignment = persistAssignment(true, null);

        assertThat(assignmentRepository.isUserInScope(assignment.getId(), alice.getId())).isTrue();
        assertThat(assignmentRepository.isUserInScope(assignment.getId(), bob.getId())).isTrue();
        assertThat(assignmentRepository.isUserInScope(assignment.getId(), carol.getId())).isFalse();
    }

    @Test
    @DisplayName("findClassMemberIds: only members with the requested role")
    void findClassMemberIds_filtersRole() {
        Assignment assignment = persistAssignment(true, null);

        assertThat(assignmentRepository.findClassMemberIds(assignment.getId(), UserRole.STUDENT))
                .containsExactly(alice.getId());
        assertThat(assignmentRepository.findIndividualStudentIds(assignment.getId(), UserRole.STUDENT))
                .containsExactly(bob.getId());
    }

    @Test
    @DisplayName("findActiveIdsInScopeOfStudent: skips unpublished assignments")
    void findActiveIdsInScopeOfStudent_skipsInactive() {
        Assignment active = persistAssignment(true, null);
        persistAssignment(false, NOW.plus(1, ChronoUnit.DAYS));

        assertThat(assignmentRepository.findActiveIdsInScopeOfStudent(alice.getId())).containsExactly(active.getId());
        assertThat(assignmentRepository.findActiveIdsInScopeOfStudent(carol.getId())).isEmpty();
    }

    @Test
    @DisplayName("findDueForPublishing: inactive with a passed schedule only")
    void findDueForPublishing_onlyDue() {
        Assignment due = persistAssignment(false, NOW.minus(5, ChronoUnit.MINUTES));
        persistAssignment(false, NOW.plus(1, ChronoUnit.HOURS));
        persistAssignment(true, NOW.minus(1, ChronoUnit.DAYS));

        List<Assignment> result = assignmentRepository.findDueForPublishing(NOW);

        assertThat(result).extracting(Assignment::getId).containsExactly(due.getId());
    }

    @Test
    @DisplayName("findIdsByClassId and countActiveByClassId follow the class link")
    void classLinkQueries() {
        persistAssignment(true, null);
        persistAssignment(false, NOW.plus(2, ChronoUnit.DAYS));

        assertThat(assignmentRepository.findIdsByClassId(schoolClass.getId())).hasSize(2);
        assertThat(assignmentRepository.countActiveByClassId(schoolClass.getId())).isEqualTo(1);
        assertThat(assignmentRepository.countScheduledByTeacher(teacher.getId(), NOW)).isEqualTo(1);
    }

    private Assignment persistAssignment(boolean active, Instant scheduledPublishAt) {
        Assignment assignment = new Assignment();
        assignment.setTopic("My family");
        assignment.setType(AssignmentType.CLASS);
        assignment.setTeacher(teacher);
        assignment.setActive(active);
        assignment.setScheduledPublishAt(scheduledPublishAt);
        assignment.setPublishedAt(NOW.minus(1, ChronoUnit.DAYS));
        assignment.getClasses().add(schoolClass);
        assignment.getStudents().add(bob);
        entityManager.persist(assignment);
        entityManager.flush();
        return assignment;
    }

    private User persistUser(String username, UserRole role) {
        User user = new User();
        user.setUsername(username);
        user.setEmail(username + "@school.example");
        user.setHashedPassword("{noop}password");
        user.setRole(role);
        user.setConfirmed(true);
        entityManager.persist(user);
        return user;
    }
}
