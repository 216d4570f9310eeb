package uk.gegc.schoolwork.features.studenthelp.domain.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum HelpReason {
    LOW_OVERDUE_COMPLETION("Low completion rate on overdue assignments"),
    LOW_AVERAGE_SCORE("Low average score on completed assignments"),
    LOW_OVERALL_COMPLETION("Low overall completion rate");

    private final String description;
}
