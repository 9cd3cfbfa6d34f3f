package com.pinclick.copilot.model;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class FilterModelTest {

    @Test
    void mergeKeepsBaseFieldsTheUpdateDoesNotCarry() {
        FilterModel base = new FilterModel(Set.of(2), "Whitefield", null, 10_000_000L,
                Set.of(PropertyType.APARTMENT), null, Set.of("gym"), null);
        FilterModel update = new FilterModel(null, "Hebbal", 5_000_000L, null,
                Set.of(), Set.of(PossessionStatus.READY_TO_MOVE), null, 5);

        FilterModel merged = FilterModel.merge(base, update);

        assertThat(merged.bedrooms()).containsExactly(2);
        assertThat(merged.locality()).isEqualTo("Hebbal");
        assertThat(merged.budgetMin()).isEqualTo(5_000_000L);
        assertThat(merged.budgetMax()).isEqualTo(10_000_000L);
        assertThat(merged.propertyTypes()).containsExactly(PropertyType.APARTMENT);
        assertThat(merged.possessionStatuses()).containsExactly(PossessionStatus.READY_TO_MOVE);
        assertThat(merged.amenities()).containsExactly("gym");
        assertThat(merged.radiusKm()).isEqualTo(5);
    }

    @Test
    void mergeWithMissingSideReturnsTheOther() {
        FilterModel only = new FilterModel(Set.of(3), null, null, null, null, null, null, null);

        assertThat(FilterModel.merge(null, only)).isEqualTo(only);
        assertThat(FilterModel.merge(only, null)).isEqualTo(only);
        assertThat(FilterModel.merge(null, null)).isEqualTo(FilterModel.EMPTY);
    }

    @Test
    void constructorNormalizesBlanksAndNulls() {
        FilterModel filters = new FilterModel(null, "   ", null, null, null, null, null, null);

        assertThat(filters.locality()).isNull();
        assertThat(filters.bedrooms()).isEmpty();
        assertThat(filters.isEmpty()).isTrue();
        assertThat(FilterModel.EMPTY.isEmpty()).isTrue();
    }

    @Test
    void fromRequirementsReadsTheConversationalSlots() {
        Requirements requirements = Requirements.builder()
                .configuration("2, 3 BHK")
                .location("Sarjapur Road")
                .budgetMax(12_000_000L)
                .build();

        FilterModel filters = FilterModel.fromRequirements(requirements);

        assertThat(filters.bedrooms()).containsExactly(2, 3);
        assertThat(filters.locality()).isEqualTo("Sarjapur Road");
        assertThat(filters.budgetMax()).isEqualTo(12_000_000L);
        assertThat(filters.budgetMin()).isNull();
    }
}
