package uk.gegc.schoolwork.features.user.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;

/**
 * Partial update; null fields are left unchanged.
 */
@Schema(name = "UpdateUserRequest", description = "Partial update of a user account")
public record UpdateUserRequest(
        @Size(min = 3, max = 50, message = "Username must be 3-50 characters")
        String username,

        @Email(message = "Email must be valid")
        String email,

        @Schema(description = "New password")
        @Size(min = 6, max = 100, message = "Password must be 6-100 characters")
        String password,

        UserRole role,

        Boolean confirmed,

        Boolean blocked
) {
}
