package uk.gegc.schoolwork.features.statistics.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Rollup of one assignment's progress across the students in its scope.
 * <p>
 * Updated incrementally on each submission and rebuilt from progress rows on demand.
 * Optimistic locking guards concurrent submissions.
 * </p>
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "assignment_stats")
public class AssignmentStats {

    @Id
    @Column(name = "assignment_id", nullable = false, updatable = false)
    private UUID assignmentId;

    @Column(name = "total_students", nullable = false)
    private int totalStudents;

    @Column(name = "completed_students", nullable = false)
    private int completedStudents;

    @Column(name = "in_progress_students", nullable = false)
    private int inProgressStudents;

    @Column(name = "not_started_students", nullable = false)
    private int notStartedStudents;

    @Column(name = "total_questions", nullable = false)
    private int totalQuestions;

    @Column(name = "total_answers", nullable = false)
    private int totalAnswers;

    @Column(name = "total_correct_answers", nullable = false)
    private int totalCorrectAnswers;

    @Column(name = "completion_rate", nullable = false)
    private double completionRate;

    @Column(name = "accuracy_rate", nullable = false)
    private double accuracyRate;

    @Column(name = "average_score", nullable = false)
    private double averageScore;

    @Column(name = "last_updated", nullable = false)
    private Instant lastUpdated;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public AssignmentStats(UUID assignmentId) {
        this.assignmentId = assignmentId;
    }
}
