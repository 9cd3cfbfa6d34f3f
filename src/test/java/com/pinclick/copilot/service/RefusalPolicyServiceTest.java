package com.pinclick.copilot.service;

import com.pinclick.copilot.model.ConfidenceTier;
import com.pinclick.copilot.model.Intent;
import com.pinclick.copilot.model.RefusalDecision;
import com.pinclick.copilot.model.RefusalReason;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pinclick.copilot.ProjectFixtures.ranked;
import static org.assertj.core.api.Assertions.assertThat;

class RefusalPolicyServiceTest {

    private final RefusalPolicyService refusalPolicy = new RefusalPolicyService();

    @Test
    void outOfScopeQuestionsAreRefusedWithTheirFixedMessage() {
        RefusalDecision prediction = refusalPolicy.shouldRefuse(Intent.UNSUPPORTED, List.of(), ConfidenceTier.NOT_AVAILABLE,
                "Will prices in Whitefield appreciate in five years?");
        RefusalDecision legal = refusalPolicy.shouldRefuse(Intent.UNSUPPORTED, List.of(), ConfidenceTier.NOT_AVAILABLE,
                "Is the title deed clear?");
        RefusalDecision other = refusalPolicy.shouldRefuse(Intent.UNSUPPORTED, List.of(), ConfidenceTier.NOT_AVAILABLE,
                "What's the weather like?");

        assertThat(prediction.refuse()).isTrue();
        assertThat(prediction.reason()).isEqualTo(RefusalReason.FUTURE_PREDICTION);
        assertThat(prediction.reason().getMessage())
                .isEqualTo("I cannot provide predictions about future property values, ROI, or market trends.");
        assertThat(legal.reason()).isEqualTo(RefusalReason.LEGAL_ADVICE);
        assertThat(other.reason()).isEqualTo(RefusalReason.UNSUPPORTED_INTENT);
        assertThat(other.reason().getCode()).isEqualTo("unsupported_intent");
    }

    @Test
    void unsupportedIntentIsRefusedEvenWithStrongMatches() {
        RefusalDecision decision = refusalPolicy.shouldRefuse(Intent.UNSUPPORTED, List.of(ranked("A", 0.9)), ConfidenceTier.HIGH);

        assertThat(decision.refuse()).isTrue();
    }

    @Test
    void nothingRetrievedMeansNoRelevantInfo() {
        RefusalDecision decision = refusalPolicy.shouldRefuse(Intent.PROPERTY_SEARCH, List.of(), ConfidenceTier.NOT_AVAILABLE);

        assertThat(decision.reason()).isEqualTo(RefusalReason.NO_RELEVANT_INFO);
        assertThat(decision.reason().getMessage())
                .isEqualTo("This information is not available in the project documents or approved sources.");
    }

    @Test
    void weakMatchesMeanInsufficientConfidence() {
        RefusalDecision decision = refusalPolicy.shouldRefuse(Intent.PROPERTY_SEARCH, List.of(ranked("A", 0.3)),
                ConfidenceTier.NOT_AVAILABLE);

        assertThat(decision.reason()).isEqualTo(RefusalReason.INSUFFICIENT_CONFIDENCE);
    }

    @Test
    void confidentMatchesAreAnswered() {
        RefusalDecision decision = refusalPolicy.shouldRefuse(Intent.PROPERTY_SEARCH, List.of(ranked("A", 0.9)),
                ConfidenceTier.HIGH);

        assertThat(decision.refuse()).isFalse();
        assertThat(decision.reason()).isNull();
    }
}
