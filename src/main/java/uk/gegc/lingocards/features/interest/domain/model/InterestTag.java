package uk.gegc.lingocards.features.interest.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * A selectable interest, e.g. "Hockey" under "Sports &amp; Fitness".
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(
        name = "interest_tags",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uq_interest_tags_category_name",
                        columnNames = {"category_id", "name"}
                )
        }
)
public class InterestTag {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "category_id", nullable = false)
    private InterestCategory category;

    @Column(name = "name", length = 100, nullable = false)
    private String name;

    @Column(name = "slug", length = 100, nullable = false, unique = true)
    private String slug;

    @Column(name = "display_order", nullable = false)
    private Integer displayOrder = 0;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
