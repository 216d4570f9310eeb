package uk.gegc.schoolwork.features.assignment.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.UUID;

/**
 * How responses to an assignment are graded. One row per assignment.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "evaluation_settings")
public class EvaluationSettings {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assignment_id", nullable = false, unique = true)
    private Assignment assignment;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private EvaluationType type;

    @Column(name = "custom_prompt", columnDefinition = "text")
    private String customPrompt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "rules", columnDefinition = "json")
    private String rules;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "acceptable_responses", columnDefinition = "json")
    private String acceptableResponses;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "feedback_settings", columnDefinition = "json", nullable = false)
    private String feedbackSettings = "{}";
}
