package uk.gegc.schoolwork.features.assignment.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;
import uk.gegc.schoolwork.features.classroom.domain.model.SchoolClass;
import uk.gegc.schoolwork.features.language.domain.model.Language;
import uk.gegc.schoolwork.features.user.domain.model.User;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "assignments")
public class Assignment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "topic", length = 500)
    private String topic;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", length = 20)
    private AssignmentType type;

    @Column(name = "color", length = 20)
    private String color;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "vocabulary_items", columnDefinition = "json")
    private String vocabularyItems;

    @Column(name = "scheduled_publish_at")
    private Instant scheduledPublishAt;

    @Column(name = "due_date")
    private Instant dueDate;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "video_url", length = 2048)
    private String videoUrl;

    @Column(name = "video_transcript", columnDefinition = "text")
    private String videoTranscript;

    @Enumerated(EnumType.STRING)
    @Column(name = "language_assessment_type", length = 30)
    private LanguageAssessmentType languageAssessmentType;

    @Column(name = "is_ielts", nullable = false)
    private boolean ielts;

    @Column(name = "context", columnDefinition = "text")
    private String context;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "teacher_id")
    private User teacher;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "language_id")
    private Language language;

    @Column(name = "total_students_in_scope", nullable = false)
    private int totalStudentsInScope;

    @Column(name = "completed_students_count", nullable = false)
    private int completedStudentsCount;

    @Column(name = "completion_rate")
    private Double completionRate;

    @Column(name = "average_score_of_completed")
    private Double averageScoreOfCompleted;

    @OneToOne(mappedBy = "assignment", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    private EvaluationSettings evaluationSettings;

    @OneToMany(mappedBy = "assignment", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    private List<Question> questions = new ArrayList<>();

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "class_assignments",
            joinColumns = @JoinColumn(name = "assignment_id", nullable = false),
            inverseJoinColumns = @JoinColumn(name = "class_id", nullable = false)
    )
    private Set<SchoolClass> classes = new HashSet<>();

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "user_assignments",
            joinColumns = @JoinColumn(name = "assignment_id", nullable = false),
            inverseJoinColumns = @JoinColumn(name = "user_id", nullable = false)
    )
    private Set<User> students = new HashSet<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public void addQuestion(Question question) {
        question.setAssignment(this);
        question.setPosition(questions.size());
        questions.add(question);
    }

    public void attachEvaluationSettings(EvaluationSettings settings) {
        settings.setAssignment(this);
        this.evaluationSettings = settings;
    }

    public boolean isScheduledAfter(Instant now) {
        return scheduledPublishAt != null && scheduledPublishAt.isAfter(now);
    }
}
