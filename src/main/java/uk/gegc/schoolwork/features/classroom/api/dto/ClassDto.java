package uk.gegc.schoolwork.features.classroom.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "ClassDto", description = "A class with its members")
public record ClassDto(
        UUID id,
        String name,
        int studentCount,
        List<ClassMemberDto> members,
        Instant createdAt,
        Instant updatedAt
) {
}
