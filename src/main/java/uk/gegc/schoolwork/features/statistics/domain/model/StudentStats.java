package uk.gegc.schoolwork.features.statistics.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "student_stats")
public class StudentStats {

    @Id
    @Column(name = "student_id", nullable = false, updatable = false)
    private UUID studentId;

    @Column(name = "total_assignments", nullable = false)
    private int totalAssignments;

    @Column(name = "completed_assignments", nullable = false)
    private int completedAssignments;

    @Column(name = "in_progress_assignments", nullable = false)
    private int inProgressAssignments;

    @Column(name = "not_started_assignments", nullable = false)
    private int notStartedAssignments;

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

    @Column(name = "last_activity_date")
    private Instant lastActivityDate;

    @Column(name = "last_updated", nullable = false)
    private Instant lastUpdated;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public StudentStats(UUID studentId) {
        this.studentId = studentId;
    }
}
