package uk.gegc.lingocards.features.interest.application;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Built-in interest categories and tags offered to learners.
 */
public final class InterestTaxonomy {

    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");

    public static final Map<String, List<String>> DEFAULT = defaults();

    private InterestTaxonomy() {
    }

    public static String slugify(String name) {
        String slug = NON_SLUG.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("-");
        return slug.replaceAll("^-+|-+$", "");
    }

    private static Map<String, List<String>> defaults() {
        Map<String, List<String>> taxonomy = new LinkedHashMap<>();
        taxonomy.put("Cooking & Food", List.of(
                "French cuisine", "Chinese cuisine", "Cantonese cuisine",
                "Baking & desserts", "Street food", "Healthy cooking"));
        taxonomy.put("Movies & TV", List.of(
                "French movies", "Chinese movies", "Hollywood movies",
                "TV series", "Documentaries", "Animation"));
        taxonomy.put("Reading & Literature", List.of(
                "Novels", "Short stories", "Comics / Manga", "Classic literature",
                "Modern fiction", "Non-fiction"));
        taxonomy.put("Games & Entertainment", List.of(
                "Video games", "Board games", "Mobile games", "Puzzle games",
                "Role-playing games", "Esports"));
        taxonomy.put("Culture & Society", List.of(
                "French culture", "Chinese culture", "Traditions & festivals",
                "Daily life", "History", "Cross-cultural topics"));
        taxonomy.put("News & Current Affairs", List.of(
                "World news", "Technology news", "Economy & business", "Education",
                "Environment", "Social issues"));
        taxonomy.put("Sports & Fitness", List.of(
                "Hockey", "Tennis", "Swimming", "Running", "Skating", "Fitness & training"));
        taxonomy.put("Travel & Geography", List.of(
                "Travel stories", "Cities & countries", "Cultural travel", "Food travel",
                "Nature & landscapes", "Travel tips"));
        taxonomy.put("Music & Arts", List.of(
                "Pop music", "Classical music", "Movie soundtracks", "Painting & art",
                "Photography", "Performing arts"));
        taxonomy.put("Language & Learning", List.of(
                "French learning", "Chinese learning", "Vocabulary building",
                "Grammar practice", "Speaking & pronunciation", "Exam preparation"));
        return Collections.unmodifiableMap(taxonomy);
    }
}
