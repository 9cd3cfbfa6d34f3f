package com.pinclick.copilot.service;

import com.pinclick.copilot.model.Interceptor;
import com.pinclick.copilot.model.Utterance;
import com.pinclick.copilot.util.GeoUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword pre-routing over the raw message. Runs before the classifier and can replace it.
 */
@Service
public class UtteranceInterceptor {

    private static final Pattern RESET = Pattern.compile(
            "\\b(start over|start again|reset|new search|clear (all|everything|filters|requirements))\\b");
    private static final Pattern SHOW_MORE = Pattern.compile(
            "\\b((show|see|give|list)( me)? more|more (options|projects|results)|next (page|few|ones?))\\b");
    private static final Pattern NEARBY = Pattern.compile(
            "\\b(nearby|near by|close by|in the vicinity|around (here|there|it|this|that)|within \\d+\\s*(km|kms|kilomet(er|re)s?))\\b");
    private static final Pattern RADIUS = Pattern.compile("\\bwithin (\\d{1,4})\\s*(km|kms|kilomet(er|re)s?)\\b");
    private static final Pattern SITE_VISIT = Pattern.compile(
            "\\b(site visit|visit|see the (site|property|project)|schedule a (visit|tour))\\b");
    private static final Pattern SEARCH_SIGNALS = Pattern.compile(
            "\\b(\\d\\s*bhk|bhk|budget|under \\d|below \\d|\\d+(\\.\\d+)?\\s*(cr|crore|crores|l|lakh|lakhs|lac))\\b");
    private static final Pattern WORD = Pattern.compile("[a-z0-9]+");

    private static final Set<String> GENERIC_NAME_WORDS = Set.of(
            "the", "residency", "residences", "apartments", "apartment", "towers", "tower", "enclave", "gardens",
            "heights", "homes", "park", "city", "phase", "village", "county", "estate", "greens", "villas",
            "meadows", "square", "project", "projects", "bangalore", "bengaluru", "north", "south", "east", "west");

    public Utterance intercept(String raw, Collection<String> knownProjectNames) {
        String normalized = normalize(raw);
        String mentioned = findMentionedProject(normalized, knownProjectNames).orElse(null);
        Integer radiusKm = null;
        Matcher radius = RADIUS.matcher(normalized);
        if (radius.find()) {
            radiusKm = Integer.parseInt(radius.group(1));
        }

        Interceptor interceptor = Interceptor.NONE;
        if (RESET.matcher(normalized).find()) {
            interceptor = Interceptor.RESET;
        } else if (SHOW_MORE.matcher(normalized).find()) {
            interceptor = Interceptor.SHOW_MORE;
        } else if (NEARBY.matcher(normalized).find()) {
            interceptor = Interceptor.NEARBY;
        } else if (SITE_VISIT.matcher(normalized).find()) {
            interceptor = Interceptor.SITE_VISIT;
        } else if (mentioned != null && !SEARCH_SIGNALS.matcher(normalized).find()) {
            interceptor = Interceptor.PROJECT_MENTION;
        }
        return new Utterance(raw, normalized, interceptor, mentioned, radiusKm);
    }

    /**
     * Canonical name of the project the text refers to: a full name first (longest wins),
     * otherwise a distinctive word that belongs to exactly one known name.
     */
    Optional<String> findMentionedProject(String normalized, Collection<String> knownProjectNames) {
        if (normalized.isEmpty() || knownProjectNames == null || knownProjectNames.isEmpty()) {
            return Optional.empty();
        }
        Map<String, String> byNormalized = new LinkedHashMap<>();
        for (String name : knownProjectNames) {
            if (name != null && !name.isBlank()) {
                byNormalized.putIfAbsent(normalize(name), name);
            }
        }
        String padded = " " + normalized + " ";
        Optional<String> fullMatch = byNormalized.keySet().stream()
                .filter(n -> padded.contains(" " + n + " "))
                .max(Comparator.comparingInt(String::length));
        if (fullMatch.isPresent()) {
            return Optional.of(byNormalized.get(fullMatch.get()));
        }

        Map<String, Set<String>> owners = new HashMap<>();
        for (String n : byNormalized.keySet()) {
            for (String token : words(n)) {
                if (isDistinctive(token)) {
                    owners.computeIfAbsent(token, k -> new HashSet<>()).add(n);
                }
            }
        }
        List<String> hits = words(normalized).stream()
                .map(owners::get)
                .filter(o -> o != null && o.size() == 1)
                .map(o -> o.iterator().next())
                .distinct()
                .collect(Collectors.toList());
        return hits.size() == 1 ? Optional.of(byNormalized.get(hits.get(0))) : Optional.empty();
    }

    private boolean isDistinctive(String token) {
        return token.length() >= 5
                && !GENERIC_NAME_WORDS.contains(token)
                && GeoUtils.zoneOf(token).isEmpty();
    }

    private static List<String> words(String text) {
        Matcher m = WORD.matcher(text);
        List<String> out = new ArrayList<>();
        while (m.find()) {
            out.add(m.group());
        }
        return out;
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9.\\s]", " ")
                .replaceAll("(?<![0-9])\\.|\\.(?![0-9])", " "); // keep decimal points only
        return Arrays.stream(lower.trim().split("\\s+"))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(" "));
    }
}
