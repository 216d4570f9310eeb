package uk.gegc.schoolwork.features.assignment.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "questions")
public class Question {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "assignment_id", nullable = false)
    private Assignment assignment;

    @Column(name = "text_question", columnDefinition = "text")
    private String textQuestion;

    @Column(name = "text_answer", columnDefinition = "text")
    private String textAnswer;

    @Column(name = "image", length = 2048)
    private String image;

    @Column(name = "video_url", length = 2048)
    private String videoUrl;

    @Column(name = "position", nullable = false)
    private int position;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public Question(String textQuestion, String textAnswer) {
        this.textQuestion = textQuestion;
        this.textAnswer = textAnswer;
    }
}
