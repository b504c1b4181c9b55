package uk.gegc.lingocards.features.user.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UpdateTimestamp;
import uk.gegc.lingocards.features.interest.domain.model.InterestTag;
import uk.gegc.lingocards.features.vocabulary.domain.model.CefrLevel;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Learner preferences that drive content personalization.
 * <p>
 * {@code interestGraph} holds the whole weighted interest graph as one JSON document.
 * It is always rewritten in full; {@code version} turns that rewrite into a
 * compare-and-swap so concurrent interactions cannot silently overwrite each other.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "user_profiles")
public class UserProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @OneToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false, unique = true)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @Column(name = "target_language", length = 10, nullable = false)
    private String targetLanguage = "fr";

    @Column(name = "native_language", length = 10, nullable = false)
    private String nativeLanguage = "en";

    @Enumerated(EnumType.STRING)
    @Column(name = "cefr_level", length = 2)
    private CefrLevel cefrLevel;

    @Enumerated(EnumType.STRING)
    @Column(name = "age_group", length = 20)
    private AgeGroup ageGroup;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "user_profile_interest_tags",
            joinColumns = @JoinColumn(name = "profile_id"),
            inverseJoinColumns = @JoinColumn(name = "tag_id")
    )
    @OrderBy("displayOrder ASC, name ASC")
    private Set<InterestTag> selectedInterests = new LinkedHashSet<>();

    @Column(name = "interest_graph", columnDefinition = "TEXT")
    private String interestGraph;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
