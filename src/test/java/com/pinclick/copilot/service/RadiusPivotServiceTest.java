package com.pinclick.copilot.service;

import com.pinclick.copilot.model.ProjectSummary;
import com.pinclick.copilot.model.RadiusPivotResult;
import com.pinclick.copilot.model.RankedProject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pinclick.copilot.ProjectFixtures.located;
import static com.pinclick.copilot.ProjectFixtures.project;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RadiusPivotServiceTest {

    private final RadiusPivotService radiusPivotService = new RadiusPivotService(10);

    private final ProjectSummary brookefield = located("Brookefield Heights", "Brookefield", "East Bangalore", "2 BHK",
            9_000_000L, 11_000_000L, 12.9650, 77.7180);
    private final ProjectSummary hebbal = located("Hebbal Lakefront", "Hebbal", "North Bangalore", "3 BHK",
            15_000_000L, 19_000_000L, 13.0354, 77.5988);
    private final ProjectSummary unmapped = project("Unmapped Towers", "Whitefield", "East Bangalore", "2 BHK",
            8_000_000L, 9_000_000L);

    @Test
    void keepsOnlyProjectsInsideTheRadius() {
        RadiusPivotResult result = radiusPivotService.withinRadius("Whitefield", List.of(hebbal, unmapped, brookefield));

        assertThat(result.anchorResolved()).isTrue();
        assertThat(result.radiusKm()).isEqualTo(10.0);
        assertThat(result.projects()).extracting(RankedProject::name).containsExactly("Brookefield Heights");
        RankedProject nearest = result.projects().get(0);
        assertThat(nearest.distanceKm()).isCloseTo(3.5, within(0.5));
        assertThat(nearest.matchScore()).isCloseTo(1.0 / (1.0 + nearest.distanceKm() / 10.0), within(0.001));
    }

    @Test
    void widerRadiusOrdersNearestFirst() {
        RadiusPivotResult result = radiusPivotService.withinRadius("Whitefield", List.of(hebbal, brookefield), 25);

        assertThat(result.projects()).extracting(RankedProject::name)
                .containsExactly("Brookefield Heights", "Hebbal Lakefront");
        assertThat(result.projects().get(0).matchScore()).isGreaterThan(result.projects().get(1).matchScore());
    }

    @Test
    void unknownAnchorGivesNoResults() {
        RadiusPivotResult result = radiusPivotService.withinRadius("Atlantis", List.of(brookefield));

        assertThat(result.anchorResolved()).isFalse();
        assertThat(result.anchorName()).isEqualTo("Atlantis");
        assertThat(result.projects()).isEmpty();
    }

    @Test
    void nonPositiveDefaultFallsBackToTenKm() {
        assertThat(new RadiusPivotService(0).defaultRadiusKm()).isEqualTo(RadiusPivotService.DEFAULT_RADIUS_KM);
    }
}
