package uk.gegc.schoolwork.features.classroom.api.dto;

import uk.gegc.schoolwork.features.user.domain.model.UserRole;

import java.util.UUID;

public record ClassMemberDto(
        UUID id,
        String username,
        String email,
        UserRole role
) {
}
