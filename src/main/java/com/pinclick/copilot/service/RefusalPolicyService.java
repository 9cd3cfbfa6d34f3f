package com.pinclick.copilot.service;

import com.pinclick.copilot.model.ConfidenceTier;
import com.pinclick.copilot.model.Intent;
import com.pinclick.copilot.model.RefusalDecision;
import com.pinclick.copilot.model.RefusalReason;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether a turn is answered or refused. Refusals always use the fixed message of
 * their {@link RefusalReason}.
 */
@Service
public class RefusalPolicyService {

    private static final Pattern PREDICTION_TERMS = Pattern.compile(
            "\\b(predict\\w*|forecast\\w*|appreciat\\w*|roi|returns?|future (price|value)s?|resale value|market trend\\w*)\\b");
    private static final Pattern LEGAL_TERMS = Pattern.compile(
            "\\b(legal\\w*|lawyer|title deed|litigation|tax\\w*|loan eligibility|financial advice)\\b");

    public RefusalDecision shouldRefuse(Intent intent, List<?> matches, ConfidenceTier confidence) {
        return shouldRefuse(intent, matches, confidence, null);
    }

    /**
     * Checks, in order: out-of-scope intent, nothing retrieved, confidence not available.
     */
    public RefusalDecision shouldRefuse(Intent intent, List<?> matches, ConfidenceTier confidence, String rawText) {
        if (intent == Intent.UNSUPPORTED) {
            return RefusalDecision.refuse(unsupportedReason(rawText));
        }
        if (matches == null || matches.isEmpty()) {
            return RefusalDecision.refuse(RefusalReason.NO_RELEVANT_INFO);
        }
        if (confidence == ConfidenceTier.NOT_AVAILABLE) {
            return RefusalDecision.refuse(RefusalReason.INSUFFICIENT_CONFIDENCE);
        }
        return RefusalDecision.answer();
    }

    public RefusalReason unsupportedReason(String rawText) {
        if (rawText == null) {
            return RefusalReason.UNSUPPORTED_INTENT;
        }
        String text = rawText.toLowerCase(Locale.ROOT);
        if (PREDICTION_TERMS.matcher(text).find()) {
            return RefusalReason.FUTURE_PREDICTION;
        }
        if (LEGAL_TERMS.matcher(text).find()) {
            return RefusalReason.LEGAL_ADVICE;
        }
        return RefusalReason.UNSUPPORTED_INTENT;
    }
}
