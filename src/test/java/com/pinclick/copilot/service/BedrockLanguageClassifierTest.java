package com.pinclick.copilot.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pinclick.copilot.model.ConversationState;
import com.pinclick.copilot.model.Intent;
import com.pinclick.copilot.model.IntentClassification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BedrockLanguageClassifierTest {

    @Mock
    private BedrockChatService bedrockChatService;

    private BedrockLanguageClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new BedrockLanguageClassifier(bedrockChatService, new ObjectMapper());
    }

    @Test
    void readsIntentAndConfidenceFromModelJson() {
        when(bedrockChatService.invokeChatForText(anyString(), eq(150)))
                .thenReturn("{\"intent\": \"site_visit\", \"confidence\": 0.82}");
        ConversationState state = new ConversationState("s-1");
        state.recordMessage("show me 2bhk in whitefield");

        Optional<IntentClassification> result = classifier.classify("can I see it this weekend", state);

        assertThat(result).contains(new IntentClassification(Intent.SITE_VISIT, 0.82));
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(bedrockChatService).invokeChatForText(prompt.capture(), eq(150));
        assertThat(prompt.getValue())
                .contains("show me 2bhk in whitefield")
                .contains("can I see it this weekend");
    }

    @Test
    void confidenceIsClampedAndUnknownLabelsMapToUnknown() {
        when(bedrockChatService.invokeChatForText(anyString(), anyInt()))
                .thenReturn("{\"intent\": \"weather\", \"confidence\": 1.7}");

        assertThat(classifier.classify("is it raining", null))
                .contains(new IntentClassification(Intent.UNKNOWN, 1.0));
    }

    @Test
    void unparsableReplyIsTreatedAsNoClassification() {
        when(bedrockChatService.invokeChatForText(anyString(), anyInt())).thenReturn("I think it is a search");

        assertThat(classifier.classify("3bhk please", null)).isEmpty();
    }

    @Test
    void throttlingIsNotSwallowed() {
        when(bedrockChatService.invokeChatForText(anyString(), anyInt()))
                .thenThrow(new ThrottledException("Bedrock is throttling requests"));

        assertThatThrownBy(() -> classifier.classify("3bhk please", null))
                .isInstanceOf(ThrottledException.class);
    }

    @Test
    void blankMessageSkipsTheModel() {
        assertThat(classifier.classify("   ", null)).isEmpty();
        verifyNoInteractions(bedrockChatService);
    }
}
