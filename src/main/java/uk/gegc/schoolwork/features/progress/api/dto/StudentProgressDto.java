package uk.gegc.schoolwork.features.progress.api.dto;

import java.util.List;

public record StudentProgressDto(
        ReportStudentDto student,
        StudentProgressStatsDto stats,
        List<QuestionProgressDto> questionProgress
) {
}
