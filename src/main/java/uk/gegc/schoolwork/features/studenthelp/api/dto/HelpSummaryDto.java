package uk.gegc.schoolwork.features.studenthelp.api.dto;

public record HelpSummaryDto(int total, int critical, int warning, int recent) {
}
