package uk.gegc.schoolwork.features.user.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "UserDto", description = "User account without credentials")
public record UserDto(
        @Schema(description = "User UUID") UUID id,
        @Schema(description = "Login name", example = "alice") String username,
        @Schema(description = "E-mail address") String email,
        @Schema(description = "Role") UserRole role,
        @Schema(description = "Whether the account is confirmed") boolean confirmed,
        @Schema(description = "Blocked accounts cannot sign in") boolean blocked,
        Instant createdAt,
        Instant updatedAt
) {
}
