package uk.gegc.schoolwork.features.studenthelp.api.dto;

import java.util.List;

public record StudentsNeedingHelpDto(List<StudentNeedingHelpDto> students, HelpSummaryDto summary) {
}
