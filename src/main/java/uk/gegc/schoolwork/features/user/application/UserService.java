package uk.gegc.schoolwork.features.user.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.schoolwork.features.user.api.dto.CreateUserRequest;
import uk.gegc.schoolwork.features.user.api.dto.UpdateUserRequest;
import uk.gegc.schoolwork.features.user.api.dto.UserDto;
import uk.gegc.schoolwork.features.user.domain.model.User;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;

import java.util.Map;
import java.util.UUID;

/**
 * User account administration. Teachers and admins may read accounts; only admins create,
 * change or delete them.
 */
public interface UserService {

    Page<UserDto> listUsers(User currentUser, UserRole role, String search, UUID classId, Pageable pageable);

    Map<UserRole, Long> countByRole(User currentUser);

    UserDto getUser(User currentUser, UUID userId);

    UserDto createUser(User currentUser, CreateUserRequest request);

    /**
     * Role changes move the user in or out of assignment scopes, so the affected rollups are rebuilt.
     */
    UserDto updateUser(User currentUser, UUID userId, UpdateUserRequest request);

    void deleteUser(User currentUser, UUID userId);
}
