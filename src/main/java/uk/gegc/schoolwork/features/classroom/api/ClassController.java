package uk.gegc.schoolwork.features.classroom.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.schoolwork.features.classroom.api.dto.ClassDto;
import uk.gegc.schoolwork.features.classroom.api.dto.ClassMembersRequest;
import uk.gegc.schoolwork.features.classroom.api.dto.CreateClassRequest;
import uk.gegc.schoolwork.features.classroom.application.ClassService;
import uk.gegc.schoolwork.shared.api.dto.ApiResponse;
import uk.gegc.schoolwork.shared.security.AuthenticatedUserResolver;

import java.util.List;
import java.util.UUID;

@Tag(name = "Classes", description = "Class administration and membership.")
@RestController
@RequestMapping("/api/classes")
@RequiredArgsConstructor
@Validated
@Slf4j
public class ClassController {

    private final ClassService classService;
    private final AuthenticatedUserResolver userResolver;

    @Operation(summary = "List classes", description = "Teachers and admins. Ordered by name.")
    @GetMapping
    @PreAuthorize("hasAnyRole('TEACHER','ADMIN')")
    public ResponseEntity<ApiResponse<List<ClassDto>>> listClasses(Authentication authentication) {
        return ResponseEntity.ok(ApiResponse.ok(classService.listClasses(userResolver.resolve(authentication))));
    }

    @Operation(summary = "Create a class", description = "Admins only. Members are optional.")
    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<ClassDto>> createClass(@RequestBody @Valid CreateClassRequest request,
                                                             Authentication authentication) {
        ClassDto created = classService.createClass(userResolver.resolve(authentication), request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(created, "Class created successfully"));
    }

    @Operation(summary = "Get a class with its members")
    @GetMapping("/{classId}")
    @PreAuthorize("hasAnyRole('TEACHER','ADMIN')")
    public ResponseEntity<ApiResponse<ClassDto>> getClass(
            @Parameter(description = "UUID of the class", required = true)
            @PathVariable UUID classId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(ApiResponse.ok(classService.getClass(userResolver.resolve(authentication), classId)));
    }

    @Operation(summary = "Add members", description = "Admins only. Refreshes the statistics of affected students and assignments.")
    @PostMapping("/{classId}/members")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<ClassDto>> addMembers(
            @PathVariable UUID classId,
            @RequestBody @Valid ClassMembersRequest request,
            Authentication authentication
    ) {
        ClassDto updated = classService.addMembers(userResolver.resolve(authentication), classId, request);
        return ResponseEntity.ok(ApiResponse.ok(updated, "Members added"));
    }

    @Operation(summary = "Remove members", description = "Admins only. Refreshes the statistics of affected students and assignments.")
    @DeleteMapping("/{classId}/members")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<ClassDto>> removeMembers(
            @PathVariable UUID classId,
            @RequestBody @Valid ClassMembersRequest request,
            Authentication authentication
    ) {
        ClassDto updated = classService.removeMembers(userResolver.resolve(authentication), classId, request);
        return ResponseEntity.ok(ApiResponse.ok(updated, "Members removed"));
    }

    @Operation(summary = "Delete a class", description = "Admins only. Assignments linked to the class are kept but unlinked.")
    @DeleteMapping("/{classId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deleteClass(@PathVariable UUID classId, Authentication authentication) {
        classService.deleteClass(userResolver.resolve(authentication), classId);
        return ResponseEntity.noContent().build();
    }
}
