package uk.gegc.schoolwork.features.activity.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.schoolwork.features.activity.api.dto.ActivityLogDto;
import uk.gegc.schoolwork.features.activity.api.dto.ActivityLogFilter;
import uk.gegc.schoolwork.features.activity.application.ActivityLogService;
import uk.gegc.schoolwork.features.activity.domain.model.ActivityLogType;
import uk.gegc.schoolwork.shared.api.dto.ApiResponse;
import uk.gegc.schoolwork.shared.security.AuthenticatedUserResolver;

import java.time.Instant;
import java.util.UUID;

@Tag(name = "Activity logs", description = "Audit trail of class, assignment and user events.")
@RestController
@RequestMapping("/api/activity-logs")
@RequiredArgsConstructor
public class ActivityLogController {

    private final ActivityLogService activityLogService;
    private final AuthenticatedUserResolver userResolver;

    @Operation(summary = "Search activity logs", description = "Admins only. Newest first unless a sort is given.")
    @GetMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<Page<ActivityLogDto>>> search(
            @ParameterObject
            @PageableDefault(page = 0, size = 20)
            Pageable pageable,

            @Parameter(description = "Only entries by this actor")
            @RequestParam(required = false) UUID userId,

            @Parameter(description = "Only entries of this type")
            @RequestParam(required = false) ActivityLogType type,

            @Parameter(description = "Only entries about this assignment")
            @RequestParam(required = false) UUID assignmentId,

            @Parameter(description = "Only entries about this class")
            @RequestParam(required = false) UUID classId,

            @Parameter(description = "Inclusive lower bound, ISO-8601 instant")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,

            @Parameter(description = "Exclusive upper bound, ISO-8601 instant")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,

            Authentication authentication
    ) {
        ActivityLogFilter filter = new ActivityLogFilter(userId, type, assignmentId, classId, from, to);
        return ResponseEntity.ok(ApiResponse.ok(
                activityLogService.search(userResolver.resolve(authentication), filter, pageable)));
    }
}
