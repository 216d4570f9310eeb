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
@Table(name = "teacher_stats")
public class TeacherStats {

    @Id
    @Column(name = "teacher_id", nullable = false, updatable = false)
    private UUID teacherId;

    @Column(name = "total_assignments", nullable = false)
    private int totalAssignments;

    @Column(name = "total_classes", nullable = false)
    private int totalClasses;

    @Column(name = "total_students", nullable = false)
    private int totalStudents;

    @Column(name = "average_class_completion", nullable = false)
    private double averageClassCompletion;

    @Column(name = "average_class_score", nullable = false)
    private double averageClassScore;

    @Column(name = "active_assignments", nullable = false)
    private int activeAssignments;

    @Column(name = "scheduled_assignments", nullable = false)
    private int scheduledAssignments;

    @Column(name = "last_updated", nullable = false)
    private Instant lastUpdated;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public TeacherStats(UUID teacherId) {
        this.teacherId = teacherId;
    }
}
