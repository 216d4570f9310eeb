package uk.gegc.schoolwork.features.statistics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDate;

@Schema(name = "StatisticsRefreshResult", description = "Outcome of one statistics refresh run")
public record StatisticsRefreshResult(
        LocalDate schoolDate,
        int classesUpdated,
        int classesFailed,
        int teachersUpdated,
        int teachersFailed,
        int schoolRowsPruned
) {
}
