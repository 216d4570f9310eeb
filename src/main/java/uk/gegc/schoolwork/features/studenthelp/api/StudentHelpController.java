package uk.gegc.schoolwork.features.studenthelp.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.schoolwork.features.studenthelp.api.dto.StudentNeedingHelpDto;
import uk.gegc.schoolwork.features.studenthelp.api.dto.StudentsNeedingHelpDto;
import uk.gegc.schoolwork.features.studenthelp.api.dto.TeacherNotesRequest;
import uk.gegc.schoolwork.features.studenthelp.application.StudentHelpService;
import uk.gegc.schoolwork.features.studenthelp.domain.model.HelpSeverity;
import uk.gegc.schoolwork.shared.api.dto.ApiResponse;
import uk.gegc.schoolwork.shared.security.AuthenticatedUserResolver;

import java.util.UUID;

@Tag(name = "Students needing help", description = "Students flagged by the hourly help job, and their follow-up.")
@RestController
@RequestMapping("/api/students-needing-help")
@RequiredArgsConstructor
@Validated
@Slf4j
@PreAuthorize("hasAnyRole('TEACHER','ADMIN')")
public class StudentHelpController {

    private final StudentHelpService studentHelpService;
    private final AuthenticatedUserResolver userResolver;

    @Operation(summary = "List open help records", description = "Most days first, with a summary per severity.")
    @GetMapping
    public ResponseEntity<ApiResponse<StudentsNeedingHelpDto>> listOpen(
            @Parameter(description = "Only records with this severity")
            @RequestParam(required = false) HelpSeverity severity,

            @Parameter(description = "Only students in this class")
            @RequestParam(required = false) UUID classId,

            Authentication authentication
    ) {
        return ResponseEntity.ok(ApiResponse.ok(
                studentHelpService.listOpen(userResolver.resolve(authentication), severity, classId)));
    }

    @Operation(summary = "Resolve a help record", description = "Optionally records the notes in the same call.")
    @PostMapping("/{recordId}/resolve")
    public ResponseEntity<ApiResponse<StudentNeedingHelpDto>> resolve(
            @Parameter(description = "UUID of the help record", required = true)
            @PathVariable UUID recordId,
            @RequestBody(required = false) @Valid TeacherNotesRequest request,
            Authentication authentication
    ) {
        String notes = request != null ? request.teacherNotes() : null;
        StudentNeedingHelpDto resolved = studentHelpService.resolve(userResolver.resolve(authentication), recordId, notes);
        return ResponseEntity.ok(ApiResponse.ok(resolved, "Help record resolved"));
    }

    @Operation(summary = "Update teacher notes")
    @PatchMapping("/{recordId}/notes")
    public ResponseEntity<ApiResponse<StudentNeedingHelpDto>> updateNotes(
            @Parameter(description = "UUID of the help record", required = true)
            @PathVariable UUID recordId,
            @RequestBody @Valid TeacherNotesRequest request,
            Authentication authentication
    ) {
        return ResponseEntity.ok(ApiResponse.ok(studentHelpService.updateNotes(
                userResolver.resolve(authentication), recordId, request.teacherNotes())));
    }
}
