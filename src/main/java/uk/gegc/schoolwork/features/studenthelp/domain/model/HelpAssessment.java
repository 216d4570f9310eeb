package uk.gegc.schoolwork.features.studenthelp.domain.model;

import uk.gegc.schoolwork.features.statistics.domain.model.ProgressScoring;
import uk.gegc.schoolwork.features.studenthelp.config.StudentHelpProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Outcome of judging one student against {@link StudentHelpProperties}.
 * {@code needsHelpSince} is the earliest evidence behind the reasons, or the moment of judging
 * when the only reason is low overall completion.
 */
public record HelpAssessment(Set<HelpReason> reasons,
                             Instant needsHelpSince,
                             int overdueAssignments,
                             double averageScore,
                             double completionRate) {

    private static final long DAY_MILLIS = Duration.ofDays(1).toMillis();

    public boolean needsHelp() {
        return !reasons.isEmpty();
    }

    /**
     * An in-scope active assignment as seen by one student.
     */
    public record AssignmentSnapshot(UUID assignmentId, Instant dueDate, long totalQuestions,
                                     long answered, long correct) {

        boolean completed() {
            return ProgressScoring.isComplete(answered, totalQuestions);
        }

        boolean overdue(Instant now) {
            return dueDate != null && dueDate.isBefore(now);
        }
    }

    public static HelpAssessment assess(List<AssignmentSnapshot> assignments,
                                        Instant earliestWrongAnswer,
                                        Instant now,
                                        StudentHelpProperties rules) {
        Set<HelpReason> reasons = EnumSet.noneOf(HelpReason.class);
        Instant earliestOverdue = null;

        int overdue = 0;
        int overdueCompleted = 0;
        int completed = 0;
        long answered = 0;
        long correct = 0;
        for (AssignmentSnapshot assignment : assignments) {
            answered += assignment.answered();
            correct += assignment.correct();
            if (assignment.completed()) {
                completed++;
            }
            if (assignment.overdue(now)) {
                overdue++;
                if (assignment.completed()) {
                    overdueCompleted++;
                }
                if (earliestOverdue == null || assignment.dueDate().isBefore(earliestOverdue)) {
                    earliestOverdue = assignment.dueDate();
                }
            }
        }

        double completionRate = ProgressScoring.percent(completed, assignments.size());
        double averageScore = ProgressScoring.percent(correct, answered);

        Instant since = now;
        if (overdue > 0 && ProgressScoring.percent(overdueCompleted, overdue) < rules.getOverdueCompletionBelow()) {
            reasons.add(HelpReason.LOW_OVERDUE_COMPLETION);
            since = earliestOverdue;
        }
        if (answered >= rules.getMinAnsweredQuestions() && averageScore < rules.getAverageScoreBelow()) {
            reasons.add(HelpReason.LOW_AVERAGE_SCORE);
            if (earliestWrongAnswer != null && earliestWrongAnswer.isBefore(since)) {
                since = earliestWrongAnswer;
            }
        }
        if (assignments.size() >= rules.getMinAssignments() && completionRate < rules.getCompletionBelow()) {
            reasons.add(HelpReason.LOW_OVERALL_COMPLETION);
        }

        return new HelpAssessment(reasons, since, overdue,
                ProgressScoring.round2(averageScore), ProgressScoring.round2(completionRate));
    }

    /**
     * Whole days since {@code since}, rounded up and never below one.
     */
    public static int daysNeedingHelp(Instant since, Instant now) {
        long millis = Duration.between(since, now).toMillis();
        long days = (millis + DAY_MILLIS - 1) / DAY_MILLIS;
        return (int) Math.max(1, days);
    }

    public static HelpSeverity severity(int daysNeedingHelp, StudentHelpProperties rules) {
        if (daysNeedingHelp > rules.getCriticalAfterDays()) {
            return HelpSeverity.CRITICAL;
        }
        if (daysNeedingHelp > rules.getWarningAfterDays()) {
            return HelpSeverity.WARNING;
        }
        return HelpSeverity.RECENT;
    }
}
