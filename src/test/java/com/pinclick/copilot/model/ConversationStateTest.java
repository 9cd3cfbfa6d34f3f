package com.pinclick.copilot.model;

import com.pinclick.copilot.ProjectFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationStateTest {

    @Test
    void replaceShowsInitialWindowAndPagesAppend() {
        ConversationState state = new ConversationState("call-1");

        List<RankedProject> shown = state.replaceResults(ProjectFixtures.rankedList(10, 0.8), 3);
        assertThat(shown).hasSize(3);
        assertThat(state.getPaginationOffset()).isEqualTo(3);

        List<RankedProject> page = state.nextPage(5);
        assertThat(page).extracting(RankedProject::name)
                .containsExactly("Listing 4", "Listing 5", "Listing 6", "Listing 7", "Listing 8");
        assertThat(state.getLastShownProjects()).hasSize(8);
        assertThat(state.getPaginationOffset()).isEqualTo(8);

        assertThat(state.nextPage(5)).hasSize(2);
        assertThat(state.getPaginationOffset()).isEqualTo(10);
        assertThat(state.nextPage(5)).isEmpty();
        assertThat(state.getPaginationOffset()).isEqualTo(10);
    }

    @Test
    void keepsOnlyRecentMessages() {
        ConversationState state = new ConversationState("call-2");
        for (int i = 1; i <= 8; i++) {
            state.recordMessage("message " + i);
        }

        assertThat(state.getRecentMessages()).hasSize(ConversationState.MAX_RECENT_MESSAGES)
                .first().isEqualTo("message 3");
    }

    @Test
    void resetClearsRequirementsResultsAndSelection() {
        ConversationState state = new ConversationState("call-3");
        state.setRequirements(Requirements.builder().location("Whitefield").build());
        state.replaceResults(ProjectFixtures.rankedList(4, 0.8), 3);
        state.setSelectedProjectName("Listing 1");
        state.setCurrentNode(FlowNode.SEARCH_RESULTS);

        state.resetConversation();

        assertThat(state.getRequirements().getLocation()).isNull();
        assertThat(state.getLastSearchResults()).isEmpty();
        assertThat(state.getPaginationOffset()).isZero();
        assertThat(state.getSelectedProjectName()).isNull();
        assertThat(state.getCurrentNode()).isEqualTo(FlowNode.REQUIREMENT_GATHERING);
        assertThat(state.getSessionId()).isEqualTo("call-3");
    }
}
