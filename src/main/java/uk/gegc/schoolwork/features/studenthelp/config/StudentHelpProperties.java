package uk.gegc.schoolwork.features.studenthelp.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Rules used by the hourly job that flags students who are falling behind.
 */
@Data
@Component
@ConfigurationProperties(prefix = "schoolwork.student-help")
public class StudentHelpProperties {

    /**
     * Flag when the completion percentage of overdue assignments is below this.
     */
    private double overdueCompletionBelow = 50.0;

    /**
     * Flag when the percentage of correct answers is below this.
     */
    private double averageScoreBelow = 50.0;

    /**
     * Answered questions needed before the average score is judged.
     */
    private int minAnsweredQuestions = 3;

    /**
     * Flag when the overall completion percentage is below this.
     */
    private double completionBelow = 50.0;

    /**
     * Assignments in scope needed before overall completion is judged.
     */
    private int minAssignments = 3;

    /**
     * Records open longer than this many days are WARNING.
     */
    private int warningAfterDays = 7;

    /**
     * Records open longer than this many days are CRITICAL.
     */
    private int criticalAfterDays = 14;
}
