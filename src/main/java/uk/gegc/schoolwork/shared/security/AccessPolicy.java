package uk.gegc.schoolwork.shared.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.schoolwork.features.user.domain.model.User;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;
import uk.gegc.schoolwork.shared.exception.ForbiddenException;

import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * Role and ownership checks shared by the feature services. Every denial surfaces as
 * a {@link ForbiddenException}.
 */
@Component
@Slf4j
public class AccessPolicy {

    private static final String DEFAULT_FORBIDDEN_MESSAGE = "Access denied";

    public boolean isOwner(User user, UUID ownerId) {
        return user != null && ownerId != null && ownerId.equals(user.getId());
    }

    public boolean isAdmin(User user) {
        return user != null && user.hasRole(UserRole.ADMIN);
    }

    public boolean hasAnyRole(User user, UserRole... roles) {
        if (user == null || roles == null || roles.length == 0) {
            return false;
        }
        return Arrays.stream(roles)
                .filter(Objects::nonNull)
                .anyMatch(user::hasRole);
    }

    public void requireAnyRole(User user, UserRole... roles) {
        if (!hasAnyRole(user, roles)) {
            throwForbidden("Required role missing");
        }
    }

    public void requireStaff(User user) {
        if (!hasAnyRole(user, UserRole.TEACHER, UserRole.ADMIN)) {
            throwForbidden("Teacher or admin role required");
        }
    }

    public void requireOwnerOrAdmin(User user, UUID ownerId, String message) {
        if (isOwner(user, ownerId) || isAdmin(user)) {
            return;
        }
        throwForbidden(message);
    }

    /**
     * Lets a user read their own data; teachers and admins may read anyone's.
     */
    public void requireSelfOrStaff(User user, UUID subjectId) {
        if (isOwner(user, subjectId) || hasAnyRole(user, UserRole.TEACHER, UserRole.ADMIN)) {
            return;
        }
        throwForbidden("You can only view your own data");
    }

    private void throwForbidden(String message) {
        String msg = message != null ? message : DEFAULT_FORBIDDEN_MESSAGE;
        log.debug("AccessPolicy denying access: {}", msg);
        throw new ForbiddenException(msg);
    }
}
