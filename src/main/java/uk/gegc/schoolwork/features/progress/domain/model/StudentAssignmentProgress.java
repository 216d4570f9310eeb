package uk.gegc.schoolwork.features.progress.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;
import uk.gegc.schoolwork.features.assignment.domain.model.Assignment;
import uk.gegc.schoolwork.features.assignment.domain.model.Question;
import uk.gegc.schoolwork.features.user.domain.model.User;

import java.time.Instant;
import java.util.UUID;

/**
 * A student's recorded attempt at one question of an assignment. Re-submissions overwrite the row.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(
        name = "student_assignment_progress",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_progress_student_assignment_question",
                columnNames = {"student_id", "assignment_id", "question_id"}
        )
)
public class StudentAssignmentProgress {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "student_id", nullable = false)
    private User student;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "assignment_id", nullable = false)
    private Assignment assignment;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "question_id", nullable = false)
    private Question question;

    @Column(name = "is_complete", nullable = false)
    private boolean complete;

    @Column(name = "is_correct", nullable = false)
    private boolean correct;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "analysis_result", columnDefinition = "json")
    private String analysisResult;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "grammar_corrected", columnDefinition = "json")
    private String grammarCorrected;

    @Enumerated(EnumType.STRING)
    @Column(name = "submission_type", length = 20)
    private SubmissionType submissionType;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
