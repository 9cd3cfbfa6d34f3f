package com.pinclick.copilot.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pinclick.copilot.model.ConversationState;
import com.pinclick.copilot.model.Intent;
import com.pinclick.copilot.model.IntentClassification;
import com.pinclick.copilot.model.Requirements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

@Service
public class BedrockLanguageClassifier implements LanguageClassifier {

    private static final Logger log = LoggerFactory.getLogger(BedrockLanguageClassifier.class);

    private final BedrockChatService bedrockChatService;
    private final ObjectMapper objectMapper;
    private final String promptTemplate;

    public BedrockLanguageClassifier(BedrockChatService bedrockChatService, ObjectMapper objectMapper) {
        this.bedrockChatService = bedrockChatService;
        this.objectMapper = objectMapper;
        this.promptTemplate = loadPromptTemplate();
    }

    @Override
    public Optional<IntentClassification> classify(String message, ConversationState state) {
        if (!StringUtils.hasText(message)) {
            return Optional.empty();
        }
        String prompt = promptTemplate
                .replace("{history}", state == null ? "" : String.join("\n", state.getRecentMessages()))
                .replace("{selected_project}", state == null || state.getSelectedProjectName() == null
                        ? "none" : state.getSelectedProjectName())
                .replace("{requirements}", describe(state == null ? null : state.getRequirements()))
                .replace("{last_intent}", state == null || state.getLastIntent() == null
                        ? "none" : state.getLastIntent().name())
                .replace("{user_message}", message);
        try {
            String raw = bedrockChatService.invokeChatForText(prompt, 150);
            JsonNode root = objectMapper.readTree(raw);
            if (root == null || !root.isObject()) {
                return Optional.empty();
            }
            Intent intent = Intent.fromLabel(root.path("intent").asText(null));
            double confidence = root.path("confidence").asDouble(0.0);
            return Optional.of(new IntentClassification(intent, Math.max(0.0, Math.min(1.0, confidence))));
        } catch (ThrottledException te) {
            throw te;
        } catch (Exception ex) {
            log.warn("Intent classification failed, treating turn as unknown: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    private String describe(Requirements requirements) {
        if (requirements == null) {
            return "none";
        }
        return "configuration=" + requirements.getConfiguration()
                + ", location=" + requirements.getLocation()
                + ", budget_max=" + requirements.getBudgetMax();
    }

    private String loadPromptTemplate() {
        try {
            ClassPathResource resource = new ClassPathResource("prompts/intent_classification_prompt.txt");
            byte[] bytes = resource.getInputStream().readAllBytes();
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to load intent classification prompt template: {}", e.getMessage());
            return "Classify the real-estate sales message into one intent of: property_search, project_details, "
                    + "more_info_request, sales_objection, site_visit, contextual_query, comparison, greeting, "
                    + "scheduling, unsupported. Return JSON {\"intent\": ..., \"confidence\": 0..1}.\n\n"
                    + "Conversation so far:\n{history}\nSelected project: {selected_project}\n"
                    + "Known requirements: {requirements}\nLast intent: {last_intent}\n\n"
                    + "Message:\n{user_message}";
        }
    }
}
