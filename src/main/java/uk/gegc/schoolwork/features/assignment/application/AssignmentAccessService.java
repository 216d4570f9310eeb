package uk.gegc.schoolwork.features.assignment.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.schoolwork.features.assignment.domain.model.Assignment;
import uk.gegc.schoolwork.features.user.domain.model.User;
import uk.gegc.schoolwork.shared.exception.ForbiddenException;
import uk.gegc.schoolwork.shared.security.AccessPolicy;

import java.util.UUID;

/**
 * Read and manage rules for a single assignment.
 * <ul>
 *     <li>Teachers and admins may read any assignment.</li>
 *     <li>Everyone else needs the assignment to reach them through a class or an individual link.</li>
 *     <li>Only the owning teacher or an admin may change or delete it.</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class AssignmentAccessService {

    private final AccessPolicy accessPolicy;
    private final AssignmentScopeResolver scopeResolver;

    public boolean canAccess(User user, Assignment assignment) {
        if (user == null) {
            return false;
        }
        if (user.isStaff()) {
            return true;
        }
        return scopeResolver.isInScope(assignment.getId(), user.getId());
    }

    public void requireAccess(User user, Assignment assignment) {
        if (!canAccess(user, assignment)) {
            throw new ForbiddenException("Cannot access this assignment");
        }
    }

    public void requireManage(User user, Assignment assignment, String message) {
        accessPolicy.requireOwnerOrAdmin(user, ownerId(assignment), message);
    }

    private static UUID ownerId(Assignment assignment) {
        return assignment.getTeacher() != null ? assignment.getTeacher().getId() : null;
    }
}
