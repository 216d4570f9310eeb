package uk.gegc.schoolwork.features.progress.api.dto;

import java.util.UUID;

/**
 * @param source    {@code class} or {@code individual}
 * @param className set only when the student is reached through a class
 */
public record ReportStudentDto(
        UUID id,
        String username,
        String email,
        String source,
        String className
) {
}
