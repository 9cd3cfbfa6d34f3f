package com.pinclick.copilot.service;

import com.pinclick.copilot.model.FallbackStage;
import com.pinclick.copilot.model.FilterModel;
import com.pinclick.copilot.model.ProjectSummary;
import com.pinclick.copilot.model.RankedProject;
import com.pinclick.copilot.model.SearchOutcome;
import com.pinclick.copilot.util.GeoUtils;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Scores catalog candidates against a filter and walks the fallback ladder:
 * exact, configuration flexibility, locality priority, nearest budget. The first stage with
 * at least one match wins; stages are never blended.
 *
 * <p>Once the exact stage has failed and a budget was asked for, every fallback stage scores by
 * budget proximity alone, so the closest-priced option always leads. Locality and configuration
 * fit then only break ties between equally priced options.
 */
@Service
public class RankingService {

    public static final double BUDGET_WEIGHT = 0.5;
    public static final double LOCALITY_WEIGHT = 0.3;
    public static final double CONFIGURATION_WEIGHT = 0.2;
    public static final double ZONE_ONLY_LOCALITY_SCORE = 0.5;

    /**
     * Score descending, then cheaper first, then name.
     */
    public static final Comparator<RankedProject> RANK_ORDER = Comparator
            .comparingDouble(RankedProject::matchScore).reversed()
            .thenComparing(r -> r.project().budgetMin(), Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(r -> r.project().name(), Comparator.nullsLast(Comparator.naturalOrder()));

    enum LocalityMatch { MICRO, ZONE, NONE }

    public SearchOutcome rank(FilterModel filters, List<ProjectSummary> candidates) {
        List<RankedProject> exact = exactMatches(filters, candidates);
        if (!exact.isEmpty()) {
            return new SearchOutcome(exact, FallbackStage.EXACT);
        }
        List<RankedProject> flexible = configurationFlexMatches(filters, candidates);
        if (!flexible.isEmpty()) {
            return new SearchOutcome(flexible, FallbackStage.CONFIGURATION_FLEX);
        }
        List<RankedProject> locality = localityPriorityMatches(filters, candidates);
        if (!locality.isEmpty()) {
            return new SearchOutcome(locality, FallbackStage.LOCALITY_PRIORITY);
        }
        List<RankedProject> nearest = nearestBudgetMatches(filters, candidates);
        if (!nearest.isEmpty()) {
            return new SearchOutcome(nearest, FallbackStage.NEAREST_BUDGET);
        }
        return SearchOutcome.empty();
    }

    /**
     * Every stated field strictly satisfied.
     */
    public List<RankedProject> exactMatches(FilterModel filters, List<ProjectSummary> candidates) {
        LocalityContext locality = LocalityContext.of(filters.locality(), candidates);
        return rankWith(candidates,
                p -> locality.match(p) == LocalityMatch.MICRO
                        && bedroomsExact(filters, p)
                        && withinBudget(filters, p)
                        && refinementsSatisfied(filters, p),
                p -> weightedScore(filters, locality, p));
    }

    /**
     * Bedroom count may go up; location and budget stay fixed.
     */
    public List<RankedProject> configurationFlexMatches(FilterModel filters, List<ProjectSummary> candidates) {
        if (filters.bedrooms().isEmpty()) {
            return List.of();
        }
        LocalityContext locality = LocalityContext.of(filters.locality(), candidates);
        return rankFallback(filters, locality, candidates,
                p -> locality.match(p) == LocalityMatch.MICRO
                        && bedroomsAtLeast(filters, p)
                        && withinBudget(filters, p)
                        && refinementsSatisfied(filters, p));
    }

    /**
     * Widens a micro-location to its broad zone, keeping named micro-locations ahead.
     */
    public List<RankedProject> localityPriorityMatches(FilterModel filters, List<ProjectSummary> candidates) {
        LocalityContext locality = LocalityContext.of(filters.locality(), candidates);
        if (locality.zone() == null) {
            return List.of();
        }
        return rankFallback(filters, locality, candidates,
                p -> locality.match(p) != LocalityMatch.NONE
                        && bedroomsAtLeast(filters, p)
                        && withinBudget(filters, p)
                        && refinementsSatisfied(filters, p));
    }

    /**
     * Drops the budget ceiling and orders survivors purely by distance from the requested budget.
     */
    public List<RankedProject> nearestBudgetMatches(FilterModel filters, List<ProjectSummary> candidates) {
        if (requestedBudget(filters) == null) {
            return List.of();
        }
        LocalityContext locality = LocalityContext.of(filters.locality(), candidates);
        return rankWith(candidates,
                p -> locality.match(p) != LocalityMatch.NONE
                        && p.budgetMin() != null
                        && bedroomsAtLeast(filters, p)
                        && refinementsSatisfied(filters, p),
                p -> budgetProximity(requestedBudget(filters), p));
    }

    /**
     * Orders an already-filtered list by closeness to a reference budget.
     */
    public List<RankedProject> rankByBudgetProximity(Long referenceBudget, List<ProjectSummary> projects) {
        return rankWith(projects, p -> true, p -> budgetProximity(referenceBudget, p));
    }

    public static double budgetProximity(Long requested, ProjectSummary project) {
        if (requested == null || requested <= 0) {
            return 1.0;
        }
        if (project.budgetMin() == null) {
            return 0.0;
        }
        double gap = Math.abs(project.budgetMin() - requested) / (double) requested;
        return 1.0 / (1.0 + gap);
    }

    private double weightedScore(FilterModel filters, LocalityContext locality, ProjectSummary p) {
        double localityScore;
        switch (locality.match(p)) {
            case MICRO:
                localityScore = 1.0;
                break;
            case ZONE:
                localityScore = ZONE_ONLY_LOCALITY_SCORE;
                break;
            default:
                localityScore = 0.0;
        }
        return BUDGET_WEIGHT * budgetProximity(requestedBudget(filters), p)
                + LOCALITY_WEIGHT * localityScore
                + CONFIGURATION_WEIGHT * configurationScore(filters, p);
    }

    private double configurationScore(FilterModel filters, ProjectSummary p) {
        if (filters.bedrooms().isEmpty() || bedroomsExact(filters, p)) {
            return 1.0;
        }
        int wantedMax = Collections.max(filters.bedrooms());
        Optional<Integer> nextUp = p.bedroomOptions().stream().filter(b -> b > wantedMax).min(Integer::compare);
        return nextUp.map(b -> 1.0 / (1.0 + (b - wantedMax))).orElse(0.0);
    }

    private static Long requestedBudget(FilterModel filters) {
        return filters.budgetMax() != null ? filters.budgetMax() : filters.budgetMin();
    }

    private boolean bedroomsExact(FilterModel filters, ProjectSummary p) {
        return filters.bedrooms().isEmpty() || !Collections.disjoint(filters.bedrooms(), p.bedroomOptions());
    }

    private boolean bedroomsAtLeast(FilterModel filters, ProjectSummary p) {
        if (filters.bedrooms().isEmpty()) {
            return true;
        }
        int wantedMin = Collections.min(filters.bedrooms());
        return p.bedroomOptions().stream().anyMatch(b -> b >= wantedMin);
    }

    private boolean withinBudget(FilterModel filters, ProjectSummary p) {
        if (filters.budgetMax() != null && (p.budgetMin() == null || p.budgetMin() > filters.budgetMax())) {
            return false;
        }
        if (filters.budgetMin() != null) {
            Long top = p.budgetMax() != null ? p.budgetMax() : p.budgetMin();
            return top != null && top >= filters.budgetMin();
        }
        return true;
    }

    private boolean refinementsSatisfied(FilterModel filters, ProjectSummary p) {
        if (!filters.propertyTypes().isEmpty() && !filters.propertyTypes().contains(p.propertyType())) {
            return false;
        }
        if (!filters.possessionStatuses().isEmpty() && !filters.possessionStatuses().contains(p.status())) {
            return false;
        }
        for (String wanted : filters.amenities()) {
            String needle = wanted.toLowerCase(Locale.ROOT);
            boolean offered = p.amenities().stream().anyMatch(a -> a.toLowerCase(Locale.ROOT).contains(needle));
            if (!offered) {
                return false;
            }
        }
        return true;
    }

    private List<RankedProject> rankFallback(FilterModel filters, LocalityContext locality,
                                             List<ProjectSummary> candidates, Predicate<ProjectSummary> keep) {
        Long budget = requestedBudget(filters);
        if (budget == null) {
            return rankWith(candidates, keep, p -> weightedScore(filters, locality, p));
        }
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        Comparator<RankedProject> order = Comparator
                .comparingDouble(RankedProject::matchScore).reversed()
                .thenComparing(Comparator.comparingDouble(
                        (RankedProject r) -> weightedScore(filters, locality, r.project())).reversed())
                .thenComparing(RANK_ORDER);
        return candidates.stream()
                .filter(keep)
                .map(p -> new RankedProject(p, round(budgetProximity(budget, p))))
                .sorted(order)
                .collect(Collectors.toList());
    }

    private List<RankedProject> rankWith(List<ProjectSummary> candidates,
                                         Predicate<ProjectSummary> keep,
                                         ToDoubleFunction<ProjectSummary> score) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        return candidates.stream()
                .filter(keep)
                .map(p -> new RankedProject(p, round(score.applyAsDouble(p))))
                .sorted(RANK_ORDER)
                .collect(Collectors.toList());
    }

    static double round(double score) {
        return Math.round(score * 10_000d) / 10_000d;
    }

    /**
     * The buyer's locality split into named parts plus the broad zone they sit in.
     */
    record LocalityContext(List<String> parts, String zone, boolean zoneRequested) {

        static LocalityContext of(String locality, List<ProjectSummary> candidates) {
            if (locality == null) {
                return new LocalityContext(List.of(), null, false);
            }
            List<String> parts = GeoUtils.localityParts(locality).stream()
                    .map(part -> part.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toList());
            boolean zoneRequested = parts.stream().allMatch(GeoUtils::isZone);
            String zone = parts.stream()
                    .map(GeoUtils::zoneOf)
                    .flatMap(Optional::stream)
                    .findFirst()
                    .orElseGet(() -> zoneFromCandidates(parts, candidates));
            return new LocalityContext(parts, zone, zoneRequested);
        }

        // A project already known to sit in the named micro-location tells us its zone.
        private static String zoneFromCandidates(List<String> parts, List<ProjectSummary> candidates) {
            if (candidates == null) {
                return null;
            }
            for (ProjectSummary p : candidates) {
                if (p.zone() != null && containsAny(p.location(), parts)) {
                    return p.zone().toLowerCase(Locale.ROOT);
                }
            }
            return null;
        }

        LocalityMatch match(ProjectSummary p) {
            if (parts.isEmpty()) {
                return LocalityMatch.MICRO;
            }
            if (containsAny(p.location(), parts)) {
                return LocalityMatch.MICRO;
            }
            if (zoneRequested && containsAny(p.zone(), parts)) {
                return LocalityMatch.MICRO;
            }
            if (zone != null && (contains(p.zone(), zone)
                    || GeoUtils.zoneOf(p.location()).map(zone::equals).orElse(false))) {
                return zoneRequested ? LocalityMatch.MICRO : LocalityMatch.ZONE;
            }
            return LocalityMatch.NONE;
        }

        private static boolean containsAny(String haystack, List<String> needles) {
            return needles.stream().anyMatch(n -> contains(haystack, n));
        }

        private static boolean contains(String haystack, String needle) {
            return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
        }
    }
}
