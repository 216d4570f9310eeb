package uk.gegc.schoolwork.features.progress.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.schoolwork.features.assignment.api.dto.QuestionDto;

import java.util.List;

@Schema(name = "ProgressReportDto", description = "Per-student progress on one assignment")
public record ProgressReportDto(
        ReportAssignmentDto assignment,
        OverallProgressDto overallStats,
        List<StudentProgressDto> studentProgress,
        List<QuestionDto> questions
) {
}
