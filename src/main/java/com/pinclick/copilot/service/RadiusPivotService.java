package com.pinclick.copilot.service;

import com.pinclick.copilot.model.Coordinates;
import com.pinclick.copilot.model.ProjectSummary;
import com.pinclick.copilot.model.RadiusPivotResult;
import com.pinclick.copilot.model.RankedProject;
import com.pinclick.copilot.util.GeoUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Keeps the candidates within a radius of a named anchor and orders them nearest first.
 */
@Service
public class RadiusPivotService {

    private static final Logger log = LoggerFactory.getLogger(RadiusPivotService.class);

    public static final double DEFAULT_RADIUS_KM = 10.0;

    private final double defaultRadiusKm;

    public RadiusPivotService(@Value("${copilot.radius.default-km:10}") double defaultRadiusKm) {
        this.defaultRadiusKm = defaultRadiusKm > 0 ? defaultRadiusKm : DEFAULT_RADIUS_KM;
    }

    public double defaultRadiusKm() {
        return defaultRadiusKm;
    }

    public RadiusPivotResult withinRadius(String anchorLocation, List<ProjectSummary> candidates) {
        return withinRadius(anchorLocation, candidates, defaultRadiusKm);
    }

    /**
     * Projects without coordinates are left out rather than treated as distance zero.
     */
    public RadiusPivotResult withinRadius(String anchorLocation, List<ProjectSummary> candidates, double radiusKm) {
        Optional<Coordinates> anchor = GeoUtils.resolve(anchorLocation);
        if (anchor.isEmpty()) {
            log.info("Radius pivot has no anchor: '{}' is not in the gazetteer", anchorLocation);
            return RadiusPivotResult.noAnchor(anchorLocation, radiusKm);
        }
        Coordinates origin = anchor.get();
        List<RankedProject> nearby = (candidates == null ? List.<ProjectSummary>of() : candidates).stream()
                .filter(ProjectSummary::hasCoordinates)
                .map(p -> {
                    double distance = GeoUtils.distanceKm(origin, p.coordinates());
                    return new RankedProject(p, RankingService.round(1.0 / (1.0 + distance / radiusKm)),
                            Math.round(distance * 100d) / 100d);
                })
                .filter(r -> r.distanceKm() <= radiusKm)
                .sorted(Comparator.comparingDouble(RankedProject::distanceKm)
                        .thenComparing(r -> r.project().name(), Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());
        return new RadiusPivotResult(anchorLocation, origin, radiusKm, nearby);
    }
}
