package com.tubetrail.checkin.service.ocr;

import com.tubetrail.checkin.entity.Station;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Three-pass matcher over normalized names:
 *   1. exact
 *   2. partial: the read text is a substring of the catalogue name, or every
 *      word of it appears in the catalogue name ("EUSTON" vs "Euston Underground Station")
 *   3. fuzzy: Levenshtein similarity of at least 0.85, best score wins
 */
@Component
@Slf4j
public class CatalogueStationNameMatcher implements StationNameMatcher {

    static final double FUZZY_MATCH_THRESHOLD = 0.85;
    static final double SUGGESTION_THRESHOLD = 0.6;

    private static final Pattern STATION_SUFFIX = Pattern.compile("\\s+(underground\\s+|tube\\s+)?station$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DASHES = Pattern.compile("[-\\u2013\\u2014]");
    private static final Pattern QUOTES = Pattern.compile("['‘’`\"]");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]");

    @Override
    public Optional<Station> match(String extractedName, List<Station> catalogue) {
        String target = normalize(extractedName);
        if (target.isEmpty()) {
            return Optional.empty();
        }

        Optional<Station> exact = catalogue.stream()
                .filter(s -> normalize(s.getName()).equals(target))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }

        Set<String> targetWords = words(target);
        Optional<Station> partial = catalogue.stream()
                .filter(s -> {
                    String candidate = normalize(s.getName());
                    return candidate.contains(target) || words(candidate).containsAll(targetWords);
                })
                .findFirst();
        if (partial.isPresent()) {
            log.debug("MATCH: partial '{}' -> {}", target, partial.get().getName());
            return partial;
        }

        Optional<Station> fuzzy = catalogue.stream()
                .filter(s -> similarity(target, normalize(s.getName())) >= FUZZY_MATCH_THRESHOLD)
                .max(Comparator.comparingDouble(s -> similarity(target, normalize(s.getName()))));
        fuzzy.ifPresent(s -> log.debug("MATCH: fuzzy '{}' -> {}", target, s.getName()));
        return fuzzy;
    }

    @Override
    public List<Station> suggest(String extractedName, List<Station> catalogue, int maxResults) {
        String target = normalize(extractedName);
        return catalogue.stream()
                .filter(s -> similarity(target, normalize(s.getName())) > SUGGESTION_THRESHOLD)
                .sorted(Comparator.comparingDouble(
                        (Station s) -> similarity(target, normalize(s.getName()))).reversed())
                .limit(maxResults)
                .collect(Collectors.toList());
    }

    /**
     * Lowercase, drop "station" suffixes, fold dashes to spaces and "&amp;" to
     * "and", strip quotes and remaining punctuation.
     */
    static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String s = name.toLowerCase().trim();
        s = STATION_SUFFIX.matcher(s).replaceAll("");
        s = DASHES.matcher(s).replaceAll(" ");
        s = s.replace("&", "and");
        s = QUOTES.matcher(s).replaceAll("");
        s = PUNCTUATION.matcher(s).replaceAll("");
        s = WHITESPACE.matcher(s).replaceAll(" ");
        return s.trim();
    }

    /** 1 - levenshtein / longer length; 1.0 for two empty strings. */
    static double similarity(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(a, b) / longest;
    }

    private static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private static Set<String> words(String normalized) {
        return Arrays.stream(normalized.split(" ")).collect(Collectors.toSet());
    }
}
