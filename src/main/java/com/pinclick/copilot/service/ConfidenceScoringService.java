package com.pinclick.copilot.service;

import com.pinclick.copilot.model.ConfidenceTier;
import com.pinclick.copilot.model.Intent;
import com.pinclick.copilot.model.RankedProject;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Maps ranked matches to a confidence tier.
 */
@Service
public class ConfidenceScoringService {

    public static final double HIGH_CONFIDENCE_THRESHOLD = 0.65;
    public static final double MEDIUM_CONFIDENCE_THRESHOLD = 0.50;

    public ConfidenceTier score(List<RankedProject> matches) {
        if (matches == null || matches.isEmpty()) {
            return ConfidenceTier.NOT_AVAILABLE;
        }
        double top = matches.get(0).matchScore();
        if (top >= HIGH_CONFIDENCE_THRESHOLD) {
            // A weak runner-up does not cost a strong single match its tier.
            return ConfidenceTier.HIGH;
        }
        if (top >= MEDIUM_CONFIDENCE_THRESHOLD) {
            return ConfidenceTier.MEDIUM;
        }
        return ConfidenceTier.NOT_AVAILABLE;
    }

    /**
     * True when the top two matches both clear their thresholds.
     */
    public boolean hasAgreement(List<RankedProject> matches) {
        return matches != null && matches.size() > 1
                && matches.get(0).matchScore() >= HIGH_CONFIDENCE_THRESHOLD
                && matches.get(1).matchScore() >= MEDIUM_CONFIDENCE_THRESHOLD;
    }

    public boolean requiresMultipleSources(Intent intent) {
        return intent == Intent.COMPARISON;
    }

    public String explanation(ConfidenceTier tier) {
        switch (tier) {
            case HIGH:
                return "Strong match with your requirements.";
            case MEDIUM:
                return "Partial match; some requirements could not be met exactly.";
            default:
                return "Not enough matching information to answer confidently.";
        }
    }
}
