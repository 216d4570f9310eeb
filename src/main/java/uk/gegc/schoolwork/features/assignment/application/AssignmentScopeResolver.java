package uk.gegc.schoolwork.features.assignment.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.schoolwork.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Resolves the students an assignment targets: STUDENT members of the linked classes plus
 * individually linked students, deduplicated.
 */
@Component
@RequiredArgsConstructor
public class AssignmentScopeResolver {

    private final AssignmentRepository assignmentRepository;

    @Transactional(readOnly = true)
    public Set<UUID> studentIds(UUID assignmentId) {
        Set<UUID> ids = new LinkedHashSet<>(assignmentRepository.findClassMemberIds(assignmentId, UserRole.STUDENT));
        ids.addAll(assignmentRepository.findIndividualStudentIds(assignmentId, UserRole.STUDENT));
        return ids;
    }

    @Transactional(readOnly = true)
    public boolean isInScope(UUID assignmentId, UUID userId) {
        return assignmentRepository.isUserInScope(assignmentId, userId);
    }
}
