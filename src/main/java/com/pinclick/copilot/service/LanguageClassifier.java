package com.pinclick.copilot.service;

import com.pinclick.copilot.model.ConversationState;
import com.pinclick.copilot.model.IntentClassification;

import java.util.Optional;

/**
 * Turn-level intent classification. Implementations return empty on any failure except
 * throttling, which propagates as {@link ThrottledException}.
 */
public interface LanguageClassifier {

    Optional<IntentClassification> classify(String message, ConversationState state);
}
