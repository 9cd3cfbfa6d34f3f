package com.pinclick.copilot.util;

import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads bedroom counts out of configuration strings such as "2BHK", "2, 3 BHK" or "3 & 4 bed".
 */
public final class ConfigurationParser {

    private static final Pattern BEDROOM_GROUP = Pattern.compile(
            "(?i)((?:\\d+(?:\\.5)?\\s*(?:,|/|&|and|or|-)\\s*)*\\d+(?:\\.5)?)\\s*(?:bhk|bed|br\\b)");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private ConfigurationParser() {
    }

    public static Set<Integer> bedrooms(String configuration) {
        if (!StringUtils.hasText(configuration)) {
            return Collections.emptySet();
        }
        Set<Integer> counts = new TreeSet<>();
        Matcher group = BEDROOM_GROUP.matcher(configuration);
        while (group.find()) {
            // 2.5 BHK counts as 2
            Matcher digits = DIGITS.matcher(group.group(1).replaceAll("\\.5", ""));
            while (digits.find()) {
                counts.add(Integer.parseInt(digits.group()));
            }
        }
        if (counts.isEmpty() && configuration.trim().matches("\\d+")) {
            counts.add(Integer.parseInt(configuration.trim()));
        }
        return Collections.unmodifiableSet(counts);
    }

    /**
     * Canonical "NBHK" label for a bedroom set, e.g. {2,3} becomes "2,3BHK".
     */
    public static String label(Set<Integer> bedrooms) {
        if (bedrooms == null || bedrooms.isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (Integer count : new TreeSet<>(bedrooms)) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(count);
        }
        return sb.append("BHK").toString();
    }
}
