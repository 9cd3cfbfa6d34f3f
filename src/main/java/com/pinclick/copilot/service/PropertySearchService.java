package com.pinclick.copilot.service;

import com.pinclick.copilot.model.FallbackStage;
import com.pinclick.copilot.model.FilterModel;
import com.pinclick.copilot.model.ProjectSummary;
import com.pinclick.copilot.model.RadiusPivotResult;
import com.pinclick.copilot.model.RelaxationResult;
import com.pinclick.copilot.model.SearchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Full search for one filter: the ranking ladder, budget relaxation in place of a plain
 * nearest-budget list, and a radius pivot when nothing at all matched.
 */
@Service
public class PropertySearchService {

    private static final Logger log = LoggerFactory.getLogger(PropertySearchService.class);

    private final CatalogQueryAdapter catalogQueryAdapter;
    private final RankingService rankingService;
    private final BudgetRelaxationService budgetRelaxationService;
    private final RadiusPivotService radiusPivotService;

    public PropertySearchService(CatalogQueryAdapter catalogQueryAdapter,
                                 RankingService rankingService,
                                 BudgetRelaxationService budgetRelaxationService,
                                 RadiusPivotService radiusPivotService) {
        this.catalogQueryAdapter = catalogQueryAdapter;
        this.rankingService = rankingService;
        this.budgetRelaxationService = budgetRelaxationService;
        this.radiusPivotService = radiusPivotService;
    }

    public SearchOutcome search(FilterModel filters) {
        List<ProjectSummary> candidates = catalogQueryAdapter.query(catalogQueryAdapter.candidatePredicate(filters));
        SearchOutcome outcome = rankingService.rank(filters, candidates);
        log.debug("Ladder returned {} match(es) at stage {} from {} candidate(s)",
                outcome.matches().size(), outcome.stage(), candidates.size());

        if (outcome.stage() == FallbackStage.NEAREST_BUDGET && filters.budgetMax() != null) {
            RelaxationResult relaxed = budgetRelaxationService.relaxAndFind(filters.budgetMax(), filters.locality(), filters);
            if (relaxed.found()) {
                return new SearchOutcome(relaxed.projects(), FallbackStage.BUDGET_RELAXATION, relaxed.multiplier(),
                        budgetRelaxationService.explainRelaxation(filters.budgetMax(), relaxed.multiplier()));
            }
        }
        if (!outcome.isEmpty() || filters.locality() == null) {
            return outcome;
        }

        RadiusPivotResult pivot = pivot(filters.locality(), filters);
        if (!pivot.projects().isEmpty()) {
            log.info("No matches in '{}'; showing {} project(s) within {} km", filters.locality(),
                    pivot.projects().size(), pivot.radiusKm());
            return new SearchOutcome(pivot.projects(), FallbackStage.RADIUS_PIVOT);
        }
        return SearchOutcome.empty();
    }

    /**
     * Radius search around an anchor, ignoring the locality filter but keeping type and status.
     */
    public RadiusPivotResult pivot(String anchorLocation, FilterModel filters) {
        double radiusKm = filters.radiusKm() != null && filters.radiusKm() > 0
                ? filters.radiusKm()
                : radiusPivotService.defaultRadiusKm();
        List<ProjectSummary> candidates = catalogQueryAdapter.query(
                catalogQueryAdapter.candidatePredicate(filters.withLocality(null)));
        return radiusPivotService.withinRadius(anchorLocation, candidates, radiusKm);
    }
}
