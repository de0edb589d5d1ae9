package com.partd.campusqa.service;

import com.partd.campusqa.model.HallRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Matches questions against hall records: by hall name, and by wanted tags for shortlists.
 */
@Component
public class HallMatcher {

    static final int MIN_TOKEN_LENGTH = 4;

    // Words shared by many hall names; they do not identify one hall.
    private static final Set<String> GENERIC_NAME_TOKENS = Set.of(
        "hall", "halls", "court", "house", "block", "village", "accommodation",
        "residence", "residences", "student", "students", "campus"
    );

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Map<String, Pattern> TAG_KEYWORDS = new LinkedHashMap<>();

    static {
        TAG_KEYWORDS.put("budget", keywords(
            "budget", "cheap", "cheaper", "cheapest", "affordable", "inexpensive", "low[- ]cost", "value"));
        TAG_KEYWORDS.put("close_to_campus", keywords(
            "close", "closest", "near", "nearest", "nearby", "walk", "walking", "walkable", "distance", "central"));
        TAG_KEYWORDS.put("social", keywords(
            "social", "sociable", "lively", "party", "parties", "community", "friends"));
        TAG_KEYWORDS.put("undergraduate", keywords(
            "undergrad", "undergrads", "undergraduate", "undergraduates", "first[- ]year", "1st year",
            "year 1", "fresher", "freshers"));
        TAG_KEYWORDS.put("quiet", keywords(
            "quiet", "quieter", "peaceful", "calm"));
        TAG_KEYWORDS.put("postgraduate", keywords(
            "postgrad", "postgrads", "postgraduate", "postgraduates", "masters", "phd"));
        TAG_KEYWORDS.put("catered", keywords(
            "(?<!self[- ])catered", "meals included", "food included"));
        TAG_KEYWORDS.put("self_catered", keywords(
            "self[- ]catered", "self[- ]catering", "own kitchen", "cook"));
    }

    private final TextNormalizer normalizer;

    public HallMatcher(TextNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * First hall, in store order, whose name matches the text.
     * A name matches when either string contains the other, or when a distinctive token of at least
     * {@value #MIN_TOKEN_LENGTH} characters appears in both.
     */
    public Optional<HallRecord> findNamedHall(String text, List<HallRecord> halls) {
        String haystack = normalizer.normalize(text);
        if (haystack.isEmpty()) {
            return Optional.empty();
        }
        Set<String> textTokens = tokens(haystack);

        for (HallRecord hall : halls) {
            String name = normalizer.normalize(hall.getName());
            if (name.isEmpty()) {
                continue;
            }
            if (haystack.contains(name) || name.contains(haystack)) {
                return Optional.of(hall);
            }
            Set<String> nameTokens = tokens(name);
            nameTokens.retainAll(textTokens);
            if (!nameTokens.isEmpty()) {
                return Optional.of(hall);
            }
        }
        return Optional.empty();
    }

    /**
     * True when the full name of any hall appears in the text.
     */
    public boolean mentionsHallName(String text, List<HallRecord> halls) {
        String haystack = normalizer.normalize(text);
        if (haystack.isEmpty()) {
            return false;
        }
        return halls.stream()
                .map(hall -> normalizer.normalize(hall.getName()))
                .anyMatch(name -> !name.isEmpty() && haystack.contains(name));
    }

    /**
     * Tags implied by keyword groups in the text, in a fixed group order.
     */
    public Set<String> wantedTags(String text) {
        String haystack = normalizer.normalize(text);
        Set<String> wanted = new LinkedHashSet<>();
        TAG_KEYWORDS.forEach((tag, pattern) -> {
            if (pattern.matcher(haystack).find()) {
                wanted.add(tag);
            }
        });
        return wanted;
    }

    /**
     * Scores each hall by how many wanted tags it carries and keeps the top {@code limit}.
     * The sort is stable: equal scores stay in store order.
     */
    public List<ScoredHall> shortlist(List<HallRecord> halls, Set<String> wantedTags, int limit) {
        List<ScoredHall> scored = new ArrayList<>(halls.size());
        for (HallRecord hall : halls) {
            scored.add(new ScoredHall(hall, score(hall, wantedTags)));
        }
        scored.sort(Comparator.comparingInt(ScoredHall::getScore).reversed());
        return scored.stream().limit(Math.max(0, limit)).collect(Collectors.toList());
    }

    int score(HallRecord hall, Set<String> wantedTags) {
        Set<String> hallTags = new HashSet<>();
        hall.getTags().forEach(t -> hallTags.add(normalizeTag(t)));
        hall.getLifestyleTags().forEach(t -> hallTags.add(normalizeTag(t)));
        int score = 0;
        for (String tag : wantedTags) {
            if (hallTags.contains(tag)) {
                score++;
            }
        }
        return score;
    }

    private Set<String> tokens(String text) {
        return Arrays.stream(TOKEN_SPLIT.split(text))
                .filter(t -> t.length() >= MIN_TOKEN_LENGTH)
                .filter(t -> !GENERIC_NAME_TOKENS.contains(t))
                .collect(Collectors.toCollection(HashSet::new));
    }

    private String normalizeTag(String tag) {
        return tag == null ? "" : tag.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    }

    private static Pattern keywords(String... alternatives) {
        return Pattern.compile("\\b(?:" + String.join("|", alternatives) + ")\\b");
    }

    @Getter
    @ToString
    @AllArgsConstructor
    public static class ScoredHall {
        private final HallRecord hall;
        private final int score;
    }
}
