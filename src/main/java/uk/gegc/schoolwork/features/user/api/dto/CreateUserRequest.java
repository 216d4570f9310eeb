package uk.gegc.schoolwork.features.user.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;

@Schema(name = "CreateUserRequest", description = "Payload for creating a user account")
public record CreateUserRequest(
        @Schema(description = "Login name", example = "alice")
        @NotBlank(message = "Username is required")
        @Size(min = 3, max = 50, message = "Username must be 3-50 characters")
        String username,

        @Schema(description = "E-mail address", example = "alice@school.example")
        @NotBlank(message = "Email is required")
        @Email(message = "Email must be valid")
        String email,

        @Schema(description = "Initial password")
        @NotBlank(message = "Password is required")
        @Size(min = 6, max = 100, message = "Password must be 6-100 characters")
        String password,

        @Schema(description = "Role of the new account")
        @NotNull(message = "Role is required")
        UserRole role
) {
}
