package com.pinclick.copilot.service;

import com.pinclick.copilot.model.FilterModel;
import com.pinclick.copilot.model.ProjectSummary;
import com.pinclick.copilot.model.RankedProject;
import com.pinclick.copilot.model.RelaxationResult;
import com.pinclick.copilot.util.IndianCurrencyFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Widens the budget ceiling in fixed steps until the catalog has something to show.
 */
@Service
public class BudgetRelaxationService {

    private static final Logger log = LoggerFactory.getLogger(BudgetRelaxationService.class);

    public static final List<Double> RELAX_STEPS = List.of(1.0, 1.1, 1.2, 1.3);

    private final CatalogQueryAdapter catalogQueryAdapter;
    private final RankingService rankingService;

    public BudgetRelaxationService(CatalogQueryAdapter catalogQueryAdapter, RankingService rankingService) {
        this.catalogQueryAdapter = catalogQueryAdapter;
        this.rankingService = rankingService;
    }

    /**
     * Tries each step in ascending order and stops at the first one with results. Returns
     * {@link RelaxationResult#noInventory()} when even the widest step finds nothing.
     */
    public RelaxationResult relaxAndFind(long budget, String location, FilterModel filters) {
        FilterModel base = filters == null ? FilterModel.EMPTY : filters;
        if (StringUtils.hasText(location) && base.locality() == null) {
            base = base.withLocality(location);
        }
        for (double multiplier : RELAX_STEPS) {
            long ceiling = relaxedBudget(budget, multiplier);
            FilterModel stepFilters = base.withBudgetMax(ceiling);
            List<ProjectSummary> rows = catalogQueryAdapter.query(catalogQueryAdapter.strictPredicate(stepFilters));
            List<RankedProject> matches = rankingService.exactMatches(stepFilters, rows);
            if (!matches.isEmpty()) {
                log.info("Budget relaxation found {} project(s) at x{} ({} -> {})",
                        matches.size(), multiplier, budget, ceiling);
                if (multiplier > 1.0) {
                    matches = rankingService.rankByBudgetProximity(budget,
                            matches.stream().map(RankedProject::project).collect(Collectors.toList()));
                }
                return new RelaxationResult(matches, multiplier, ceiling);
            }
        }
        log.info("Budget relaxation exhausted all steps for budget {} without inventory", budget);
        return RelaxationResult.noInventory();
    }

    public static long relaxedBudget(long budget, double multiplier) {
        return BigDecimal.valueOf(budget)
                .multiply(BigDecimal.valueOf(multiplier))
                .setScale(0, RoundingMode.FLOOR)
                .longValueExact();
    }

    /**
     * Fixed buyer-facing sentence for a relaxation step.
     */
    public String explainRelaxation(long originalBudget, Double multiplier) {
        if (multiplier == null) {
            return null;
        }
        String before = IndianCurrencyFormat.format(originalBudget);
        String after = IndianCurrencyFormat.format(relaxedBudget(originalBudget, multiplier));
        if (Double.compare(multiplier, 1.0) == 0) {
            return "Found options within your budget of " + before;
        }
        if (Double.compare(multiplier, 1.1) == 0) {
            return "Relaxed budget by 10% (" + before + " → " + after + ") to show nearby options";
        }
        if (Double.compare(multiplier, 1.2) == 0) {
            return "Relaxed budget by 20% (" + before + " → " + after + ") - no exact matches found";
        }
        if (Double.compare(multiplier, 1.3) == 0) {
            return "Relaxed budget by 30% (" + before + " → " + after + ") - showing best available options";
        }
        return "Adjusted budget to " + after;
    }

    /**
     * Relaxation only makes sense when a budget is known and the exact search came back empty.
     */
    public boolean shouldApplyRelaxation(List<?> exactResults, Long budget) {
        return budget != null && (exactResults == null || exactResults.isEmpty());
    }
}
