package com.pinclick.copilot.service;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.pinclick.copilot.model.CatalogQuery;
import com.pinclick.copilot.model.FilterModel;
import com.pinclick.copilot.model.ProjectSummary;
import com.pinclick.copilot.repository.ProjectRecordRepository;
import com.pinclick.copilot.util.GeoUtils;
import jakarta.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Narrow bridge between the engine and the catalog store. Storage failures surface as
 * {@link CatalogUnavailableException}, never as an empty list.
 */
@Service
public class CatalogQueryAdapter {

    private static final Logger log = LoggerFactory.getLogger(CatalogQueryAdapter.class);

    private final ProjectRecordRepository repository;
    private final ExternalCallGuard callGuard;
    private final int maxCandidates;
    private final Supplier<List<String>> projectNames;

    public CatalogQueryAdapter(ProjectRecordRepository repository,
                               ExternalCallGuard callGuard,
                               @Value("${copilot.catalog.max-candidates:500}") int maxCandidates,
                               @Value("${copilot.catalog.names-cache-minutes:5}") long namesCacheMinutes) {
        this.repository = repository;
        this.callGuard = callGuard;
        this.maxCandidates = Math.max(1, maxCandidates);
        this.projectNames = Suppliers.memoizeWithExpiration(
                () -> run("catalog name listing", ProjectRecordRepository::findAllNames),
                Math.max(1, namesCacheMinutes), TimeUnit.MINUTES);
    }

    /**
     * Runs a predicate against the catalog and returns matching projects.
     */
    public List<ProjectSummary> query(CatalogQuery query) {
        List<ProjectSummary> rows = run("catalog query", repo -> repo.findByCatalogQuery(query, maxCandidates))
                .stream()
                .map(ProjectSummary::from)
                .collect(Collectors.toList());
        if (query.bedrooms().isEmpty()) {
            return rows;
        }
        return rows.stream()
                .filter(p -> !Collections.disjoint(p.bedroomOptions(), query.bedrooms()))
                .collect(Collectors.toList());
    }

    public List<ProjectSummary> findByName(String name) {
        if (!StringUtils.hasText(name)) {
            return List.of();
        }
        return run("catalog name lookup", repo -> repo.findByNameIgnoreCase(name.trim()))
                .stream()
                .map(ProjectSummary::from)
                .collect(Collectors.toList());
    }

    public List<String> knownProjectNames() {
        return projectNames.get();
    }

    /**
     * Predicate for a filter, widened so that the in-memory ladder can relax bedrooms and
     * budget: each named locality (plus its broad zone), type and status are pushed down, the rest is not.
     */
    public CatalogQuery candidatePredicate(FilterModel filters) {
        Set<String> localities = new LinkedHashSet<>();
        for (String part : GeoUtils.localityParts(filters.locality())) {
            localities.add(part);
            GeoUtils.zoneOf(part).ifPresent(localities::add);
        }
        return new CatalogQuery(null, localities, null, null,
                filters.propertyTypes(), filters.possessionStatuses());
    }

    /**
     * Strict predicate for a filter: every stated constraint is pushed down.
     */
    public CatalogQuery strictPredicate(FilterModel filters) {
        Set<String> localities = new LinkedHashSet<>(GeoUtils.localityParts(filters.locality()));
        return new CatalogQuery(filters.bedrooms(), localities, filters.budgetMin(), filters.budgetMax(),
                filters.propertyTypes(), filters.possessionStatuses());
    }

    private <T> T run(String callName, Function<ProjectRecordRepository, T> call) {
        try {
            return callGuard.call(callName, () -> call.apply(repository));
        } catch (DataAccessException | PersistenceException e) {
            log.error("{} failed against the catalog store: {}", callName, e.getMessage(), e);
            throw new CatalogUnavailableException(callName + " failed", e);
        }
    }
}
