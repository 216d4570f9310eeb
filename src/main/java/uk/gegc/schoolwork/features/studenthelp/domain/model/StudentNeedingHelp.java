package uk.gegc.schoolwork.features.studenthelp.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import uk.gegc.schoolwork.features.user.domain.model.User;

import java.time.Instant;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * One episode of a student falling behind. Open until the refresh job sees the student recover
 * or a member of staff resolves it; a later relapse opens a new record.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "students_needing_help")
public class StudentNeedingHelp {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "student_id", nullable = false, updatable = false)
    private User student;

    @ElementCollection(fetch = FetchType.EAGER)
    @Enumerated(EnumType.STRING)
    @CollectionTable(name = "student_help_reasons", joinColumns = @JoinColumn(name = "record_id"))
    @Column(name = "reason", nullable = false, length = 40)
    private Set<HelpReason> reasons = EnumSet.noneOf(HelpReason.class);

    @ElementCollection
    @CollectionTable(name = "student_help_classes", joinColumns = @JoinColumn(name = "record_id"))
    @Column(name = "class_id", nullable = false)
    private Set<UUID> classIds = new HashSet<>();

    @ElementCollection
    @CollectionTable(name = "student_help_teachers", joinColumns = @JoinColumn(name = "record_id"))
    @Column(name = "teacher_id", nullable = false)
    private Set<UUID> teacherIds = new HashSet<>();

    @Column(name = "needs_help_since", nullable = false)
    private Instant needsHelpSince;

    @Column(name = "days_needing_help", nullable = false)
    private int daysNeedingHelp;

    @Column(name = "overdue_assignments", nullable = false)
    private int overdueAssignments;

    @Column(name = "average_score", nullable = false)
    private double averageScore;

    @Column(name = "completion_rate", nullable = false)
    private double completionRate;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 20)
    private HelpSeverity severity;

    @Column(name = "is_resolved", nullable = false)
    private boolean resolved;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolved_by")
    private UUID resolvedBy;

    @Column(name = "teacher_notes", columnDefinition = "TEXT")
    private String teacherNotes;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public void resolve(Instant at, UUID by) {
        this.resolved = true;
        this.resolvedAt = at;
        this.resolvedBy = by;
    }
}
