package uk.gegc.schoolwork.features.studenthelp.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

@Schema(name = "TeacherNotesRequest", description = "Notes left by staff on a help record")
public record TeacherNotesRequest(
        @Schema(description = "Free text notes", example = "Spoke to parents, extra session on Friday")
        @Size(max = 2000, message = "Teacher notes must not exceed 2000 characters")
        String teacherNotes
) {
}
