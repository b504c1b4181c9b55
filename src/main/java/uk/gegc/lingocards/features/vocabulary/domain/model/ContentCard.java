package uk.gegc.lingocards.features.vocabulary.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One generated explanation of a word, shared by every learner whose
 * personalization key matches. Cards are append-only: every column is
 * insert-only, so a loaded card can never be rewritten.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(
        name = "content_cards",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uq_content_cards_personalization_key",
                        columnNames = {"word_id", "target_language", "target_cefr", "interest_context", "tone_style"}
                )
        }
)
public class ContentCard {

    public static final int USAGE_EXAMPLE_COUNT = 3;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "word_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Word word;

    @Column(name = "definition", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String definition;

    @Column(name = "conversation", columnDefinition = "TEXT", updatable = false)
    private String conversation;

    @Convert(converter = UsageExamplesConverter.class)
    @Column(name = "examples", columnDefinition = "TEXT", nullable = false, updatable = false)
    private List<String> examples = new ArrayList<>();

    @Column(name = "part_of_speech", length = 30, updatable = false)
    private String partOfSpeech;

    @Column(name = "base_form", length = 200, updatable = false)
    private String baseForm;

    @Column(name = "gender", length = 1, updatable = false)
    private String gender;

    @Column(name = "target_language", length = 10, nullable = false, updatable = false)
    private String targetLanguage;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_cefr", length = 2, nullable = false, updatable = false)
    private CefrLevel targetCefr;

    @Column(name = "interest_context", length = 100, nullable = false, updatable = false)
    private String interestContext;

    @Column(name = "tone_style", length = 50, nullable = false, updatable = false)
    private String toneStyle;

    /**
     * Level the provider reports for the generated text; the key keeps the requested level.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "resolved_cefr", length = 2, updatable = false)
    private CefrLevel resolvedCefr;

    @Column(name = "resolved_language", length = 10, updatable = false)
    private String resolvedLanguage;

    @Column(name = "fallback", nullable = false, updatable = false)
    private boolean fallback;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public List<String> getExamples() {
        return examples == null ? List.of() : List.copyOf(examples);
    }
}
