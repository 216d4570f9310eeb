package uk.gegc.schoolwork.features.studenthelp.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "StudentHelpRefreshResult", description = "Outcome of one students-needing-help run")
public record StudentHelpRefreshResult(
        int studentsChecked,
        int flagged,
        int cleared,
        int failed,
        Instant finishedAt
) {
}
