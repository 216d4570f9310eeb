package uk.gegc.schoolwork.features.statistics.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * Dedupe-by-question scoring shared by every rollup.
 * <p>
 * For a student and an assignment with {@code T} questions, {@code answered} is the number of
 * distinct completed questions and {@code correct} the number of distinct correct ones.
 * The assignment is complete once {@code T > 0 && answered >= T}.
 * </p>
 */
public final class ProgressScoring {

    private ProgressScoring() {
    }

    public static boolean isComplete(long answered, long totalQuestions) {
        return totalQuestions > 0 && answered >= totalQuestions;
    }

    public static double percent(long part, long whole) {
        return whole > 0 ? (part * 100.0) / whole : 0.0;
    }

    /**
     * Score of a completed assignment: correct answers over all of its questions.
     */
    public static double score(long correct, long totalQuestions) {
        return percent(correct, totalQuestions);
    }

    public static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    public static int roundToInt(double value) {
        return (int) Math.round(value);
    }

    /**
     * State change caused by moving from {@code answeredBefore} to {@code answeredAfter} distinct answers.
     * Both flags fire together when a single submission finishes a one-question assignment.
     */
    public static Transition transition(long answeredBefore, long answeredAfter, long totalQuestions) {
        boolean started = answeredBefore == 0 && answeredAfter > 0;
        boolean completed = !isComplete(answeredBefore, totalQuestions) && isComplete(answeredAfter, totalQuestions);
        return new Transition(started, completed);
    }

    public record Transition(boolean started, boolean completed) {
    }

    /**
     * Aggregated answers of one student on one assignment, keyed by whichever side was grouped.
     */
    public record Tally(UUID key, long answered, long correct) {

        public static Tally fromRow(Object[] row) {
            UUID key = (UUID) row[0];
            long answered = row[1] != null ? ((Number) row[1]).longValue() : 0L;
            long correct = row[2] != null ? ((Number) row[2]).longValue() : 0L;
            return new Tally(key, answered, correct);
        }
    }
}
