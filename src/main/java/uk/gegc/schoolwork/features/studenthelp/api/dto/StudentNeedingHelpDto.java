package uk.gegc.schoolwork.features.studenthelp.api.dto;

import uk.gegc.schoolwork.features.studenthelp.domain.model.HelpReason;
import uk.gegc.schoolwork.features.studenthelp.domain.model.HelpSeverity;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

public record StudentNeedingHelpDto(
        UUID id,
        UUID studentId,
        String studentUsername,
        List<HelpReason> reasons,
        List<String> reasonDescriptions,
        Instant needsHelpSince,
        int daysNeedingHelp,
        int overdueAssignments,
        double averageScore,
        double completionRate,
        HelpSeverity severity,
        Set<UUID> classIds,
        Set<UUID> teacherIds,
        boolean resolved,
        Instant resolvedAt,
        UUID resolvedBy,
        String teacherNotes,
        Instant createdAt,
        Instant updatedAt
) {
}
