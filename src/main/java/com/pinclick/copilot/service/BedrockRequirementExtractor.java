package com.pinclick.copilot.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pinclick.copilot.model.PossessionStatus;
import com.pinclick.copilot.model.PropertyType;
import com.pinclick.copilot.model.RequirementExtraction;
import com.pinclick.copilot.util.IndianCurrencyFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

@Service
public class BedrockRequirementExtractor implements RequirementExtractor {

    private static final Logger log = LoggerFactory.getLogger(BedrockRequirementExtractor.class);

    private final BedrockChatService bedrockChatService;
    private final ObjectMapper objectMapper;
    private final String promptTemplate;

    public BedrockRequirementExtractor(BedrockChatService bedrockChatService, ObjectMapper objectMapper) {
        this.bedrockChatService = bedrockChatService;
        this.objectMapper = objectMapper;
        this.promptTemplate = loadPromptTemplate();
    }

    @Override
    public Optional<RequirementExtraction> extract(String message) {
        if (!StringUtils.hasText(message)) {
            return Optional.empty();
        }
        String prompt = promptTemplate.replace("{user_message}", message);
        try {
            JsonNode root = objectMapper.readTree(bedrockChatService.invokeChatForText(prompt, 300));
            if (root == null || !root.isObject()) {
                return Optional.empty();
            }
            return Optional.of(parse(root));
        } catch (ThrottledException te) {
            throw te;
        } catch (Exception ex) {
            log.warn("Requirement extraction failed, keeping previous requirements: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    RequirementExtraction parse(JsonNode root) {
        return new RequirementExtraction(
                textOrNull(root.path("configuration")),
                textOrNull(root.path("location")),
                amountOrNull(root.path("budget_min")),
                amountOrNull(root.path("budget_max")),
                textOrNull(root.path("project_name")),
                textOrNull(root.path("feature_requested")),
                readEnumSet(root.path("property_type"), PropertyType::fromLabel),
                readEnumSet(root.path("possession_status"), PossessionStatus::fromLabel),
                readEnumSet(root.path("amenities"), s -> Optional.of(s.toLowerCase(Locale.ROOT)))
        );
    }

    private <T> Set<T> readEnumSet(JsonNode node, Function<String, Optional<T>> parser) {
        Set<T> values = new LinkedHashSet<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return values;
        }
        if (node.isArray()) {
            node.forEach(item -> {
                String text = textOrNull(item);
                if (text != null) {
                    parser.apply(text).ifPresent(values::add);
                }
            });
        } else {
            String text = textOrNull(node);
            if (text != null) {
                parser.apply(text).ifPresent(values::add);
            }
        }
        return values;
    }

    private Long amountOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            long value = node.asLong();
            return value > 0 ? value : null;
        }
        return IndianCurrencyFormat.parse(node.asText()).filter(v -> v > 0).orElse(null);
    }

    private String textOrNull(JsonNode node) {
        if (node != null && node.isTextual()) {
            String text = node.asText().trim();
            if (!text.isEmpty() && !"null".equalsIgnoreCase(text)) {
                return text;
            }
        }
        return null;
    }

    private String loadPromptTemplate() {
        try {
            ClassPathResource resource = new ClassPathResource("prompts/requirement_extraction_prompt.txt");
            byte[] bytes = resource.getInputStream().readAllBytes();
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to load requirement extraction prompt template: {}", e.getMessage());
            return "Extract property search fields from the message and return a JSON object with keys: "
                    + "configuration, location, budget_min, budget_max (rupees), project_name, feature_requested, "
                    + "property_type, possession_status, amenities. Use null for anything not stated.\n\n"
                    + "Message:\n{user_message}";
        }
    }
}
