package uk.gegc.schoolwork.features.statistics.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.schoolwork.features.statistics.api.dto.AssignmentStatsDto;
import uk.gegc.schoolwork.features.statistics.api.dto.ClassStatsDto;
import uk.gegc.schoolwork.features.statistics.api.dto.SchoolStatsDto;
import uk.gegc.schoolwork.features.statistics.api.dto.StudentStatsDto;
import uk.gegc.schoolwork.features.statistics.api.dto.TeacherStatsDto;
import uk.gegc.schoolwork.features.statistics.application.StatisticsService;
import uk.gegc.schoolwork.shared.api.dto.ApiResponse;
import uk.gegc.schoolwork.shared.security.AuthenticatedUserResolver;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Tag(name = "Statistics", description = "Precomputed assignment, student, class, teacher and school rollups.")
@RestController
@RequestMapping("/api/statistics")
@RequiredArgsConstructor
public class StatisticsController {

    private final StatisticsService statisticsService;
    private final AuthenticatedUserResolver userResolver;

    @Operation(summary = "Assignment statistics", description = "Owner teacher or admin.")
    @GetMapping("/assignments/{assignmentId}")
    public ResponseEntity<ApiResponse<AssignmentStatsDto>> getAssignmentStatistics(
            @Parameter(description = "UUID of the assignment", required = true)
            @PathVariable UUID assignmentId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(ApiResponse.ok(
                statisticsService.getAssignmentStatistics(userResolver.resolve(authentication), assignmentId)));
    }

    @Operation(summary = "Student statistics", description = "Staff, or the student themself.")
    @GetMapping("/students/{studentId}")
    public ResponseEntity<ApiResponse<StudentStatsDto>> getStudentStatistics(@PathVariable UUID studentId,
                                                                             Authentication authentication) {
        return ResponseEntity.ok(ApiResponse.ok(
                statisticsService.getStudentStatistics(userResolver.resolve(authentication), studentId)));
    }

    @Operation(summary = "Class statistics")
    @GetMapping("/classes/{classId}")
    public ResponseEntity<ApiResponse<ClassStatsDto>> getClassStatistics(@PathVariable UUID classId,
                                                                         Authentication authentication) {
        return ResponseEntity.ok(ApiResponse.ok(
                statisticsService.getClassStatistics(userResolver.resolve(authentication), classId)));
    }

    @Operation(summary = "Teacher statistics", description = "The teacher themself or an admin.")
    @GetMapping("/teachers/{teacherId}")
    public ResponseEntity<ApiResponse<TeacherStatsDto>> getTeacherStatistics(@PathVariable UUID teacherId,
                                                                             Authentication authentication) {
        return ResponseEntity.ok(ApiResponse.ok(
                statisticsService.getTeacherStatistics(userResolver.resolve(authentication), teacherId)));
    }

    @Operation(summary = "School statistics for a day", description = "Defaults to today, falling back to the latest recorded day. Teachers and admins.")
    @GetMapping("/school")
    public ResponseEntity<ApiResponse<SchoolStatsDto>> getSchoolStatistics(
            @Parameter(description = "Day in ISO format (yyyy-MM-dd)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            Authentication authentication
    ) {
        return ResponseEntity.ok(ApiResponse.ok(
                statisticsService.getSchoolStatistics(userResolver.resolve(authentication), date)));
    }

    @Operation(summary = "School statistics trend", description = "Daily rows for the last N days, oldest first. Teachers and admins.")
    @GetMapping("/school/trend")
    public ResponseEntity<ApiResponse<List<SchoolStatsDto>>> getSchoolTrend(
            @RequestParam(required = false) Integer days,
            Authentication authentication
    ) {
        return ResponseEntity.ok(ApiResponse.ok(
                statisticsService.getSchoolStatisticsTrend(userResolver.resolve(authentication), days)));
    }
}
