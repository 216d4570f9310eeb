package uk.gegc.schoolwork.features.assignment.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.schoolwork.features.assignment.api.dto.AssignmentDto;
import uk.gegc.schoolwork.features.assignment.api.dto.AssignmentSearchCriteria;
import uk.gegc.schoolwork.features.assignment.api.dto.CreateAssignmentRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.UpdateAssignmentRequest;
import uk.gegc.schoolwork.features.assignment.application.AssignmentService;
import uk.gegc.schoolwork.features.progress.api.dto.ProgressDto;
import uk.gegc.schoolwork.features.progress.api.dto.ProgressReportDto;
import uk.gegc.schoolwork.features.progress.api.dto.SubmitProgressRequest;
import uk.gegc.schoolwork.features.progress.application.ProgressService;
import uk.gegc.schoolwork.features.user.domain.model.User;
import uk.gegc.schoolwork.shared.api.dto.ApiResponse;
import uk.gegc.schoolwork.shared.security.AuthenticatedUserResolver;

import java.util.List;
import java.util.UUID;

@Tag(name = "Assignments", description = "Create, read, update and delete assignments and record student progress.")
@RestController
@RequestMapping("/api/assignments")
@RequiredArgsConstructor
@Validated
@Slf4j
public class AssignmentController {

    private final AssignmentService assignmentService;
    private final ProgressService progressService;
    private final AuthenticatedUserResolver userResolver;

    @Operation(
            summary = "List assignments",
            description = "Teachers see their own assignments, students the active ones they are assigned, admins all. "
                    + "Ordered by scheduled publish time, then newest first."
    )
    @GetMapping
    public ResponseEntity<ApiResponse<Page<AssignmentDto>>> listAssignments(
            @ParameterObject
            @PageableDefault(page = 0, size = 20)
            Pageable pageable,

            @ParameterObject
            @ModelAttribute
            AssignmentSearchCriteria criteria,

            Authentication authentication
    ) {
        User user = userResolver.resolve(authentication);
        return ResponseEntity.ok(ApiResponse.ok(assignmentService.listAssignments(user, criteria, pageable)));
    }

    @Operation(
            summary = "Create an assignment",
            description = "Teachers and admins only. A future scheduledPublishAt keeps the assignment inactive until then."
    )
    @PostMapping
    @PreAuthorize("hasAnyRole('TEACHER','ADMIN')")
    public ResponseEntity<ApiResponse<AssignmentDto>> createAssignment(@RequestBody @Valid CreateAssignmentRequest request,
                                                                       Authentication authentication) {
        User user = userResolver.resolve(authentication);
        AssignmentDto created = assignmentService.createAssignment(user, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(created, "Assignment created successfully"));
    }

    @Operation(summary = "Assignments of the current user", description = "status: active (default), scheduled or all")
    @GetMapping("/mine")
    public ResponseEntity<ApiResponse<List<AssignmentDto>>> getMyAssignments(
            @RequestParam(required = false, defaultValue = "active") String status,
            Authentication authentication
    ) {
        User user = userResolver.resolve(authentication);
        return ResponseEntity.ok(ApiResponse.ok(assignmentService.getMyAssignments(user, status)));
    }

    @Operation(summary = "Get an assignment", description = "Students may only read assignments in their scope.")
    @GetMapping("/{assignmentId}")
    public ResponseEntity<ApiResponse<AssignmentDto>> getAssignment(
            @Parameter(description = "UUID of the assignment", required = true)
            @PathVariable UUID assignmentId,
            Authentication authentication
    ) {
        User user = userResolver.resolve(authentication);
        return ResponseEntity.ok(ApiResponse.ok(assignmentService.getAssignment(user, assignmentId)));
    }

    @Operation(
            summary = "Update an assignment",
            description = "Owner teacher or admin. Only provided fields are updated. Activating an assignment "
                    + "whose publish time is still in the future is rejected."
    )
    @PatchMapping("/{assignmentId}")
    @PreAuthorize("hasAnyRole('TEACHER','ADMIN')")
    public ResponseEntity<ApiResponse<AssignmentDto>> updateAssignment(
            @Parameter(description = "UUID of the assignment", required = true)
            @PathVariable UUID assignmentId,
            @RequestBody @Valid UpdateAssignmentRequest request,
            Authentication authentication
    ) {
        User user = userResolver.resolve(authentication);
        return ResponseEntity.ok(ApiResponse.ok(
                assignmentService.updateAssignment(user, assignmentId, request),
                "Assignment updated successfully"));
    }

    @Operation(summary = "Delete an assignment", description = "Owner teacher or admin. Removes questions, progress and statistics.")
    @DeleteMapping("/{assignmentId}")
    @PreAuthorize("hasAnyRole('TEACHER','ADMIN')")
    public ResponseEntity<ApiResponse<Void>> deleteAssignment(
            @Parameter(description = "UUID of the assignment", required = true)
            @PathVariable UUID assignmentId,
            Authentication authentication
    ) {
        User user = userResolver.resolve(authentication);
        assignmentService.deleteAssignment(user, assignmentId);
        return ResponseEntity.ok(ApiResponse.ok(null, "Assignment deleted successfully"));
    }

    @Operation(
            summary = "Submit an answer",
            description = "Students only. Re-submitting a question replaces the stored answer without counting it twice."
    )
    @PostMapping("/{assignmentId}/submit-progress")
    @PreAuthorize("hasRole('STUDENT')")
    public ResponseEntity<ApiResponse<ProgressDto>> submitProgress(
            @Parameter(description = "UUID of the assignment", required = true)
            @PathVariable UUID assignmentId,
            @RequestBody @Valid SubmitProgressRequest request,
            Authentication authentication
    ) {
        User user = userResolver.resolve(authentication);
        return ResponseEntity.ok(ApiResponse.ok(
                progressService.submitProgress(user, assignmentId, request),
                "Progress saved"));
    }

    @Operation(
            summary = "Progress report",
            description = "Per-student completion and accuracy. Teachers only for their own assignments; students get their own row."
    )
    @GetMapping("/{assignmentId}/progress")
    public ResponseEntity<ApiResponse<ProgressReportDto>> getProgressReport(
            @Parameter(description = "UUID of the assignment", required = true)
            @PathVariable UUID assignmentId,
            Authentication authentication
    ) {
        User user = userResolver.resolve(authentication);
        return ResponseEntity.ok(ApiResponse.ok(progressService.getProgressReport(user, assignmentId)));
    }

    @Operation(summary = "Stored answers of one student")
    @GetMapping("/{assignmentId}/student/{studentId}/progress")
    public ResponseEntity<ApiResponse<List<ProgressDto>>> getStudentProgress(
            @PathVariable UUID assignmentId,
            @PathVariable UUID studentId,
            Authentication authentication
    ) {
        User user = userResolver.resolve(authentication);
        return ResponseEntity.ok(ApiResponse.ok(progressService.getAssignmentProgress(user, assignmentId, studentId)));
    }
}
