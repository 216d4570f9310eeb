package uk.gegc.schoolwork.features.statistics.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * School-wide snapshot, one row per calendar date.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "school_stats")
public class SchoolStats {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "stats_date", nullable = false, unique = true)
    private LocalDate date;

    @Column(name = "total_users", nullable = false)
    private long totalUsers;

    @Column(name = "total_teachers", nullable = false)
    private long totalTeachers;

    @Column(name = "total_students", nullable = false)
    private long totalStudents;

    @Column(name = "total_classes", nullable = false)
    private long totalClasses;

    @Column(name = "total_assignments", nullable = false)
    private long totalAssignments;

    @Column(name = "active_assignments", nullable = false)
    private long activeAssignments;

    @Column(name = "scheduled_assignments", nullable = false)
    private long scheduledAssignments;

    @Column(name = "average_completion_rate", nullable = false)
    private double averageCompletionRate;

    @Column(name = "average_score", nullable = false)
    private double averageScore;

    @Column(name = "total_answers", nullable = false)
    private long totalAnswers;

    @Column(name = "total_correct_answers", nullable = false)
    private long totalCorrectAnswers;

    @Column(name = "daily_active_students", nullable = false)
    private long dailyActiveStudents;

    @Column(name = "daily_active_teachers", nullable = false)
    private long dailyActiveTeachers;

    @Column(name = "students_needing_help", nullable = false)
    private long studentsNeedingHelp;

    @Column(name = "last_updated", nullable = false)
    private Instant lastUpdated;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public SchoolStats(LocalDate date) {
        this.date = date;
    }
}
