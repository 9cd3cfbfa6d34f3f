package com.pinclick.copilot.service;

import com.pinclick.copilot.model.FilterModel;
import com.pinclick.copilot.model.ProjectSummary;
import com.pinclick.copilot.model.RankedProject;
import com.pinclick.copilot.model.RelaxationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static com.pinclick.copilot.ProjectFixtures.project;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BudgetRelaxationServiceTest {

    @Mock
    private CatalogQueryAdapter catalogQueryAdapter;

    private BudgetRelaxationService relaxationService;

    private final FilterModel twoBhkWhitefield = new FilterModel(Set.of(2), "Whitefield", null, null, null, null, null, null);

    @BeforeEach
    void setUp() {
        relaxationService = new BudgetRelaxationService(catalogQueryAdapter, new RankingService());
    }

    @Test
    void stopsAtTheSmallestStepThatFindsInventory() {
        ProjectSummary slightlyAbove = project("Slightly Above", "Whitefield", "East Bangalore", "2 BHK", 10_500_000L, 12_000_000L);
        ProjectSummary wellAbove = project("Well Above", "Whitefield", "East Bangalore", "2 BHK", 12_500_000L, 14_000_000L);
        when(catalogQueryAdapter.query(any())).thenReturn(List.of(slightlyAbove, wellAbove));

        RelaxationResult result = relaxationService.relaxAndFind(10_000_000L, "Whitefield", twoBhkWhitefield);

        assertThat(result.found()).isTrue();
        assertThat(result.multiplier()).isEqualTo(1.1);
        assertThat(result.relaxedBudget()).isEqualTo(11_000_000L);
        assertThat(result.projects()).extracting(RankedProject::name).containsExactly("Slightly Above");
        verify(catalogQueryAdapter, times(2)).query(any());
    }

    @Test
    void stepsAreTriedInAscendingOrder() {
        when(catalogQueryAdapter.query(any())).thenReturn(List.of());
        ArgumentCaptor<FilterModel> ceilings = ArgumentCaptor.forClass(FilterModel.class);

        relaxationService.relaxAndFind(10_000_000L, "Whitefield", twoBhkWhitefield);

        verify(catalogQueryAdapter, times(4)).strictPredicate(ceilings.capture());
        assertThat(ceilings.getAllValues()).extracting(FilterModel::budgetMax)
                .containsExactly(10_000_000L, 11_000_000L, 12_000_000L, 13_000_000L);
    }

    @Test
    void noInventoryWhenEvenTheWidestStepFindsNothing() {
        ProjectSummary luxury = project("Luxury", "Whitefield", "East Bangalore", "2 BHK", 20_000_000L, 25_000_000L);
        when(catalogQueryAdapter.query(any())).thenReturn(List.of(luxury));

        RelaxationResult result = relaxationService.relaxAndFind(10_000_000L, null, twoBhkWhitefield);

        assertThat(result.found()).isFalse();
        assertThat(result.multiplier()).isNull();
        assertThat(result.projects()).isEmpty();
    }

    @Test
    void relaxedBudgetRoundsDown() {
        assertThat(BudgetRelaxationService.relaxedBudget(8_000_000L, 1.1)).isEqualTo(8_800_000L);
        assertThat(BudgetRelaxationService.relaxedBudget(9_999_999L, 1.3)).isEqualTo(12_999_998L);
    }

    @Test
    void explanationTextsPerStep() {
        assertThat(relaxationService.explainRelaxation(10_000_000L, 1.0))
                .isEqualTo("Found options within your budget of 1Cr");
        assertThat(relaxationService.explainRelaxation(10_000_000L, 1.1))
                .isEqualTo("Relaxed budget by 10% (1Cr → 1.1Cr) to show nearby options");
        assertThat(relaxationService.explainRelaxation(8_000_000L, 1.2))
                .isEqualTo("Relaxed budget by 20% (80L → 96L) - no exact matches found");
        assertThat(relaxationService.explainRelaxation(10_000_000L, 1.3))
                .isEqualTo("Relaxed budget by 30% (1Cr → 1.3Cr) - showing best available options");
        assertThat(relaxationService.explainRelaxation(10_000_000L, 1.5)).isEqualTo("Adjusted budget to 1.5Cr");
        assertThat(relaxationService.explainRelaxation(10_000_000L, null)).isNull();
    }

    @Test
    void relaxationAppliesOnlyToAnEmptyExactSearchWithABudget() {
        assertThat(relaxationService.shouldApplyRelaxation(List.of(), 10_000_000L)).isTrue();
        assertThat(relaxationService.shouldApplyRelaxation(List.of("match"), 10_000_000L)).isFalse();
        assertThat(relaxationService.shouldApplyRelaxation(List.of(), null)).isFalse();
    }
}
