package uk.gegc.schoolwork.features.admin.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.schoolwork.features.admin.api.dto.PublishRunResult;
import uk.gegc.schoolwork.features.assignment.application.AssignmentPublishingService;
import uk.gegc.schoolwork.features.statistics.api.dto.StatisticsRefreshResult;
import uk.gegc.schoolwork.features.statistics.application.scheduler.StatisticsRefreshScheduler;
import uk.gegc.schoolwork.features.studenthelp.api.dto.StudentHelpRefreshResult;
import uk.gegc.schoolwork.features.studenthelp.application.scheduler.StudentHelpRefreshScheduler;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequestMapping("/api/admin/scheduled-tasks")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Admin", description = "Manual triggers for the scheduled jobs")
@PreAuthorize("hasRole('ADMIN')")
public class ScheduledTaskController {

    private final AssignmentPublishingService publishingService;
    private final StatisticsRefreshScheduler statisticsRefreshScheduler;
    private final StudentHelpRefreshScheduler studentHelpRefreshScheduler;
    private final Clock clock;

    @PostMapping("/publish")
    @Operation(
            summary = "Publish due assignments now",
            description = "Runs the scheduled publisher once. Requires ADMIN role."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Publisher ran",
                    content = @Content(schema = @Schema(implementation = PublishRunResult.class))),
            @ApiResponse(responseCode = "403", description = "Not an admin",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<PublishRunResult> publishDueAssignments(Authentication authentication) {
        log.info("Manual publish run triggered by {}", authentication.getName());
        int published = publishingService.publishDueAssignments();
        return ResponseEntity.ok(new PublishRunResult(published, Instant.now(clock)));
    }

    @PostMapping("/statistics")
    @Operation(
            summary = "Refresh statistics now",
            description = "Rebuilds school, class and teacher rollups and prunes old school rows. Requires ADMIN role."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Refresh finished",
                    content = @Content(schema = @Schema(implementation = StatisticsRefreshResult.class))),
            @ApiResponse(responseCode = "403", description = "Not an admin",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<StatisticsRefreshResult> refreshStatistics(Authentication authentication) {
        log.info("Manual statistics refresh triggered by {}", authentication.getName());
        return ResponseEntity.ok(statisticsRefreshScheduler.refreshAll());
    }

    @PostMapping("/students-needing-help")
    @Operation(
            summary = "Refresh students needing help now",
            description = "Re-judges every student, opening or closing help records. Requires ADMIN role."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Refresh finished",
                    content = @Content(schema = @Schema(implementation = StudentHelpRefreshResult.class))),
            @ApiResponse(responseCode = "403", description = "Not an admin",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<StudentHelpRefreshResult> refreshStudentsNeedingHelp(Authentication authentication) {
        log.info("Manual students-needing-help refresh triggered by {}", authentication.getName());
        return ResponseEntity.ok(studentHelpRefreshScheduler.refreshAll());
    }
}
