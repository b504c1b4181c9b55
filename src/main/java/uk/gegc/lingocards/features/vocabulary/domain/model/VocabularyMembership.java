package uk.gegc.lingocards.features.vocabulary.domain.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UpdateTimestamp;
import uk.gegc.lingocards.features.user.domain.model.User;

import java.time.Instant;
import java.util.UUID;

/**
 * A learner's saved word: link to a shared {@link ContentCard} plus the
 * learner's own familiarity rating.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(
        name = "vocabulary_memberships",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uq_vocabulary_memberships_user_card",
                        columnNames = {"user_id", "card_id"}
                )
        },
        indexes = {
                @Index(name = "idx_vocabulary_memberships_user_added", columnList = "user_id, added_at")
        }
)
public class VocabularyMembership {

    public static final int MIN_FAMILIARITY = 1;
    public static final int MAX_FAMILIARITY = 5;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "card_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private ContentCard card;

    @Min(MIN_FAMILIARITY)
    @Max(MAX_FAMILIARITY)
    @Column(name = "familiarity", nullable = false)
    private Integer familiarity = MIN_FAMILIARITY;

    @CreationTimestamp
    @Column(name = "added_at", nullable = false, updatable = false)
    private Instant addedAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
