package uk.gegc.schoolwork.features.user.api;

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
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.schoolwork.features.user.api.dto.CreateUserRequest;
import uk.gegc.schoolwork.features.user.api.dto.UpdateUserRequest;
import uk.gegc.schoolwork.features.user.api.dto.UserDto;
import uk.gegc.schoolwork.features.user.application.UserService;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;
import uk.gegc.schoolwork.shared.api.dto.ApiResponse;
import uk.gegc.schoolwork.shared.security.AuthenticatedUserResolver;

import java.util.Map;
import java.util.UUID;

@Tag(name = "Users", description = "User account administration.")
@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
@Validated
@Slf4j
public class UserController {

    private final UserService userService;
    private final AuthenticatedUserResolver userResolver;

    @Operation(summary = "List users", description = "Teachers and admins. Newest first unless a sort is given.")
    @GetMapping
    @PreAuthorize("hasAnyRole('TEACHER','ADMIN')")
    public ResponseEntity<ApiResponse<Page<UserDto>>> listUsers(
            @ParameterObject
            @PageableDefault(page = 0, size = 20)
            Pageable pageable,

            @Parameter(description = "Only users with this role")
            @RequestParam(required = false) UserRole role,

            @Parameter(description = "Case-insensitive match on username or e-mail")
            @RequestParam(required = false) String search,

            @Parameter(description = "Only members of this class")
            @RequestParam(required = false) UUID classId,

            Authentication authentication
    ) {
        return ResponseEntity.ok(ApiResponse.ok(userService.listUsers(
                userResolver.resolve(authentication), role, search, classId, pageable)));
    }

    @Operation(summary = "Count users per role", description = "Teachers and admins.")
    @GetMapping("/role-counts")
    @PreAuthorize("hasAnyRole('TEACHER','ADMIN')")
    public ResponseEntity<ApiResponse<Map<UserRole, Long>>> countByRole(Authentication authentication) {
        return ResponseEntity.ok(ApiResponse.ok(userService.countByRole(userResolver.resolve(authentication))));
    }

    @Operation(summary = "Get a user", description = "Own account, or any account for teachers and admins.")
    @GetMapping("/{userId}")
    public ResponseEntity<ApiResponse<UserDto>> getUser(
            @Parameter(description = "UUID of the user", required = true)
            @PathVariable UUID userId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(ApiResponse.ok(userService.getUser(userResolver.resolve(authentication), userId)));
    }

    @Operation(summary = "Create a user", description = "Admins only. The account is created confirmed.")
    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<UserDto>> createUser(@RequestBody @Valid CreateUserRequest request,
                                                           Authentication authentication) {
        UserDto created = userService.createUser(userResolver.resolve(authentication), request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(created, "User created successfully"));
    }

    @Operation(summary = "Update a user", description = "Admins only. Null fields are left unchanged.")
    @PatchMapping("/{userId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<UserDto>> updateUser(
            @Parameter(description = "UUID of the user", required = true)
            @PathVariable UUID userId,
            @RequestBody @Valid UpdateUserRequest request,
            Authentication authentication
    ) {
        UserDto updated = userService.updateUser(userResolver.resolve(authentication), userId, request);
        return ResponseEntity.ok(ApiResponse.ok(updated, "User updated successfully"));
    }

    @Operation(summary = "Delete a user", description = "Admins only. Their progress and statistics are removed with them.")
    @DeleteMapping("/{userId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<Void>> deleteUser(
            @Parameter(description = "UUID of the user", required = true)
            @PathVariable UUID userId,
            Authentication authentication
    ) {
        userService.deleteUser(userResolver.resolve(authentication), userId);
        return ResponseEntity.ok(ApiResponse.ok(null, "User deleted successfully"));
    }
}
