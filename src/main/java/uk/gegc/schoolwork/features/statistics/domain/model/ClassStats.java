package uk.gegc.schoolwork.features.statistics.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Class rollup derived from the student stats of the class's student members.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "class_stats")
public class ClassStats {

    @Id
    @Column(name = "class_id", nullable = false, updatable = false)
    private UUID classId;

    @Column(name = "total_students", nullable = false)
    private int totalStudents;

    @Column(name = "total_assignments", nullable = false)
    private int totalAssignments;

    @Column(name = "active_assignments", nullable = false)
    private int activeAssignments;

    @Column(name = "average_completion", nullable = false)
    private double averageCompletion;

    @Column(name = "average_score", nullable = false)
    private double averageScore;

    @Column(name = "total_answers", nullable = false)
    private long totalAnswers;

    @Column(name = "total_correct_answers", nullable = false)
    private long totalCorrectAnswers;

    @Column(name = "accuracy_rate", nullable = false)
    private double accuracyRate;

    @Column(name = "active_students", nullable = false)
    private int activeStudents;

    @Column(name = "students_needing_help", nullable = false)
    private int studentsNeedingHelp;

    @Column(name = "last_updated", nullable = false)
    private Instant lastUpdated;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public ClassStats(UUID classId) {
        this.classId = classId;
    }
}
