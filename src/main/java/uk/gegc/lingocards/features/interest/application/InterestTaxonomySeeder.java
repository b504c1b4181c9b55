package uk.gegc.lingocards.features.interest.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.lingocards.features.interest.domain.model.InterestCategory;
import uk.gegc.lingocards.features.interest.domain.model.InterestTag;
import uk.gegc.lingocards.features.interest.domain.repository.InterestCategoryRepository;
import uk.gegc.lingocards.features.interest.domain.repository.InterestTagRepository;

import java.util.List;
import java.util.Map;

/**
 * Creates any missing built-in interest category or tag. Safe to run on every start.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "lingocards.interests", name = "seed-on-startup", havingValue = "true", matchIfMissing = true)
public class InterestTaxonomySeeder implements CommandLineRunner {

    private final InterestCategoryRepository categoryRepository;
    private final InterestTagRepository tagRepository;

    @Override
    @Transactional
    public void run(String... args) {
        log.info("Seeding interest categories and tags...");
        int createdCategories = 0;
        int createdTags = 0;

        int categoryOrder = 0;
        for (Map.Entry<String, List<String>> entry : InterestTaxonomy.DEFAULT.entrySet()) {
            String categoryName = entry.getKey();
            int order = categoryOrder++;

            InterestCategory category = categoryRepository.findByName(categoryName).orElse(null);
            if (category == null) {
                category = new InterestCategory();
                category.setName(categoryName);
                category.setSlug(InterestTaxonomy.slugify(categoryName));
                category.setDisplayOrder(order);
                category = categoryRepository.save(category);
                createdCategories++;
            }

            int tagOrder = 0;
            for (String tagName : entry.getValue()) {
                int currentTagOrder = tagOrder++;
                if (tagRepository.findByCategory_IdAndName(category.getId(), tagName).isPresent()) {
                    continue;
                }
                InterestTag tag = new InterestTag();
                tag.setCategory(category);
                tag.setName(tagName);
                tag.setSlug(InterestTaxonomy.slugify(tagName));
                tag.setDisplayOrder(currentTagOrder);
                tagRepository.save(tag);
                createdTags++;
            }
        }

        log.info("Interest seeding completed: createdCategories={}, createdTags={}", createdCategories, createdTags);
    }
}
