package com.pinclick.copilot.repository;

import com.pinclick.copilot.model.CatalogQuery;
import com.pinclick.copilot.model.PossessionStatus;
import com.pinclick.copilot.model.ProjectRecord;
import com.pinclick.copilot.model.PropertyType;
import com.pinclick.copilot.util.GeoUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class ProjectRecordRepositoryTest {

    @Autowired
    private ProjectRecordRepository repository;

    @BeforeEach
    void setUp() {
        repository.saveAll(List.of(
                record("p1", "Prestige Lakeside Habitat", "Whitefield", "East Bangalore", 9_000_000L, 13_000_000L,
                        PossessionStatus.UNDER_CONSTRUCTION),
                record("p2", "Sobha Dream Acres", "Panathur", "East Bangalore", 7_500_000L, 9_000_000L,
                        PossessionStatus.READY_TO_MOVE),
                record("p3", "Godrej Aqua", "Hebbal", "North Bangalore", 8_000_000L, 11_000_000L,
                        PossessionStatus.READY_TO_MOVE),
                record("p4", "Brigade Utopia", "Varthur", "East Bangalore", 13_000_000L, null,
                        PossessionStatus.NEW_LAUNCH)));
    }

    @Test
    void localitiesMatchLocationOrZoneIgnoringCase() {
        List<ProjectRecord> micro = repository.findByCatalogQuery(
                new CatalogQuery(null, Set.of("whitefield"), null, null, null, null), 10);
        List<ProjectRecord> zone = repository.findByCatalogQuery(
                new CatalogQuery(null, Set.of("Whitefield", "east bangalore"), null, null, null, null), 10);

        assertThat(micro).extracting(ProjectRecord::getName).containsExactly("Prestige Lakeside Habitat");
        assertThat(zone).extracting(ProjectRecord::getName)
                .containsExactly("Sobha Dream Acres", "Prestige Lakeside Habitat", "Brigade Utopia");
    }

    @Test
    void severalLocalitiesMatchAnyOfThem() {
        List<ProjectRecord> rows = repository.findByCatalogQuery(
                new CatalogQuery(null, Set.copyOf(GeoUtils.localityParts("Hebbal or Whitefield")), null, null, null, null), 10);

        assertThat(rows).extracting(ProjectRecord::getName).containsExactly("Godrej Aqua", "Prestige Lakeside Habitat");
    }

    @Test
    void priceBandsAndStatusesArePushedDown() {
        List<ProjectRecord> affordable = repository.findByCatalogQuery(
                new CatalogQuery(null, null, null, 8_500_000L, null, Set.of(PossessionStatus.READY_TO_MOVE)), 10);
        List<ProjectRecord> upper = repository.findByCatalogQuery(
                new CatalogQuery(null, null, 12_000_000L, null, Set.of(PropertyType.APARTMENT), null), 10);

        assertThat(affordable).extracting(ProjectRecord::getName).containsExactly("Sobha Dream Acres", "Godrej Aqua");
        assertThat(upper).extracting(ProjectRecord::getName).containsExactly("Prestige Lakeside Habitat", "Brigade Utopia");
    }

    @Test
    void limitCapsTheResult() {
        assertThat(repository.findByCatalogQuery(CatalogQuery.all(), 2)).hasSize(2);
    }

    @Test
    void nameLookups() {
        assertThat(repository.findByNameIgnoreCase("sobha dream acres")).hasSize(1);
        assertThat(repository.findAllNames()).hasSize(4);
        assertThat(repository.findById("p1").orElseThrow().getAmenities()).containsExactly("Clubhouse", "Pool");
    }

    private static ProjectRecord record(String id, String name, String location, String zone,
                                        Long budgetMin, Long budgetMax, PossessionStatus status) {
        return ProjectRecord.builder()
                .projectId(id)
                .name(name)
                .developer("Test Developer")
                .location(location)
                .zone(zone)
                .configuration("2, 3 BHK")
                .budgetMin(budgetMin)
                .budgetMax(budgetMax)
                .status(status)
                .propertyType(PropertyType.APARTMENT)
                .amenities(List.of("Clubhouse", "Pool"))
                .build();
    }
}
