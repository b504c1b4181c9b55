package uk.gegc.lingocards.features.vocabulary.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Dictionary entry shared by all learners. The text is stored normalized
 * (trimmed, lower case) and never changes after creation.
 * <p>
 * {@code claimedAt} is set by the lookup that created or last took over the row. The
 * language only changes through {@code WordRepository.reassignLanguage}, which checks
 * that claim.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(
        name = "words",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uq_words_text_language",
                        columnNames = {"text", "language"}
                )
        },
        indexes = {
                @Index(name = "idx_words_text", columnList = "text")
        }
)
public class Word {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "text", length = 200, nullable = false, updatable = false)
    private String text;

    @Column(name = "language", length = 10, nullable = false)
    private String language;

    @Column(name = "claimed_at", nullable = false)
    private Instant claimedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Word(String text, String language, Instant claimedAt) {
        this.text = text;
        this.language = language;
        this.claimedAt = claimedAt;
    }
}
