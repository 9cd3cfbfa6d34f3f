package com.pinclick.copilot.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the engine remembers about one conversation between turns.
 */
@Data
@NoArgsConstructor
public class ConversationState {

    public static final int MAX_RECENT_MESSAGES = 6;

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("requirements")
    private Requirements requirements = new Requirements();

    // Non-slot refinements (type, status, amenities, budget floor, radius) kept across turns.
    @JsonProperty("refinements")
    private FilterModel refinements = FilterModel.EMPTY;

    @JsonProperty("last_search_results")
    private List<RankedProject> lastSearchResults = new ArrayList<>();

    @JsonProperty("last_shown_projects")
    private List<RankedProject> lastShownProjects = new ArrayList<>();

    @JsonProperty("pagination_offset")
    private int paginationOffset;

    @JsonProperty("last_intent")
    private Intent lastIntent;

    @JsonProperty("selected_project_name")
    private String selectedProjectName;

    @JsonProperty("current_node")
    private FlowNode currentNode = FlowNode.REQUIREMENT_GATHERING;

    @JsonProperty("next_redirection")
    private FlowNode nextRedirection;

    @JsonProperty("last_fallback_stage")
    private FallbackStage lastFallbackStage;

    @JsonProperty("recent_messages")
    private List<String> recentMessages = new ArrayList<>();

    @JsonProperty("turn_count")
    private int turnCount;

    public ConversationState(String sessionId) {
        this.sessionId = sessionId;
    }

    public void recordMessage(String message) {
        recentMessages.add(message);
        while (recentMessages.size() > MAX_RECENT_MESSAGES) {
            recentMessages.remove(0);
        }
    }

    /**
     * Swaps in a fresh ranked list and shows its first {@code initialWindow} entries.
     */
    public List<RankedProject> replaceResults(List<RankedProject> results, int initialWindow) {
        lastSearchResults = new ArrayList<>(results);
        int shown = Math.min(initialWindow, lastSearchResults.size());
        lastShownProjects = new ArrayList<>(lastSearchResults.subList(0, shown));
        paginationOffset = shown;
        return List.copyOf(lastShownProjects);
    }

    /**
     * Appends the next page to the shown window. Returns an empty list when nothing is left.
     */
    public List<RankedProject> nextPage(int pageSize) {
        int total = lastSearchResults.size();
        if (paginationOffset >= total) {
            paginationOffset = total;
            return List.of();
        }
        int end = Math.min(paginationOffset + pageSize, total);
        List<RankedProject> page = new ArrayList<>(lastSearchResults.subList(paginationOffset, end));
        lastShownProjects.addAll(page);
        paginationOffset = end;
        return page;
    }

    public void resetConversation() {
        requirements = new Requirements();
        refinements = FilterModel.EMPTY;
        lastSearchResults = new ArrayList<>();
        lastShownProjects = new ArrayList<>();
        paginationOffset = 0;
        selectedProjectName = null;
        lastFallbackStage = null;
        currentNode = FlowNode.REQUIREMENT_GATHERING;
        nextRedirection = null;
    }
}
