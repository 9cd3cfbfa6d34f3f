package com.pinclick.copilot.service;

import com.pinclick.copilot.model.FlowNode;
import com.pinclick.copilot.model.Intent;
import com.pinclick.copilot.model.Interceptor;
import com.pinclick.copilot.model.ResultWindowAction;
import com.pinclick.copilot.model.Transition;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Intent x node -> (next node, window action). Interceptor matches are resolved first.
 */
@Component
public class FlowTransitionTable {

    private final Map<FlowNode, Map<Intent, Transition>> table = new EnumMap<>(FlowNode.class);

    public FlowTransitionTable() {
        for (FlowNode node : FlowNode.values()) {
            Map<Intent, Transition> row = new EnumMap<>(Intent.class);
            row.put(Intent.PROPERTY_SEARCH, to(FlowNode.SEARCH_RESULTS, ResultWindowAction.REPLACE));
            row.put(Intent.PROJECT_DETAILS, to(FlowNode.PROJECT_DEEP_DIVE, ResultWindowAction.KEEP));
            row.put(Intent.MORE_INFO_REQUEST, to(FlowNode.PROJECT_DEEP_DIVE, ResultWindowAction.KEEP));
            row.put(Intent.COMPARISON, to(FlowNode.SEARCH_RESULTS, ResultWindowAction.KEEP));
            row.put(Intent.SALES_OBJECTION, to(FlowNode.OBJECTION_HANDLING, ResultWindowAction.KEEP));
            row.put(Intent.SITE_VISIT, to(FlowNode.SITE_VISIT_HANDOFF, ResultWindowAction.KEEP));
            row.put(Intent.CONTEXTUAL_QUERY, to(FlowNode.RADIUS_PIVOT, ResultWindowAction.REPLACE));
            // Small talk, scheduling and refusals leave the conversation where it was.
            row.put(Intent.GREETING, to(node, ResultWindowAction.KEEP));
            row.put(Intent.SCHEDULING, to(node, ResultWindowAction.KEEP));
            row.put(Intent.UNSUPPORTED, to(node, ResultWindowAction.KEEP));
            row.put(Intent.UNKNOWN, to(FlowNode.REQUIREMENT_GATHERING, ResultWindowAction.KEEP));
            table.put(node, row);
        }
        // Without anything on screen there is nothing to compare or pitch against.
        table.get(FlowNode.REQUIREMENT_GATHERING)
                .put(Intent.COMPARISON, to(FlowNode.REQUIREMENT_GATHERING, ResultWindowAction.KEEP));
        table.get(FlowNode.REQUIREMENT_GATHERING)
                .put(Intent.SALES_OBJECTION, to(FlowNode.REQUIREMENT_GATHERING, ResultWindowAction.KEEP));
    }

    public Transition resolve(FlowNode current, Intent intent, Interceptor interceptor) {
        FlowNode node = current == null ? FlowNode.REQUIREMENT_GATHERING : current;
        if (interceptor != null) {
            switch (interceptor) {
                case RESET:
                    return to(FlowNode.REQUIREMENT_GATHERING, ResultWindowAction.REPLACE);
                case SHOW_MORE:
                    return to(node == FlowNode.RADIUS_PIVOT ? FlowNode.RADIUS_PIVOT : FlowNode.SEARCH_RESULTS,
                            ResultWindowAction.PAGINATE);
                case NEARBY:
                    return to(FlowNode.RADIUS_PIVOT, ResultWindowAction.REPLACE);
                case SITE_VISIT:
                    return to(FlowNode.SITE_VISIT_HANDOFF, ResultWindowAction.KEEP);
                case PROJECT_MENTION:
                    return to(FlowNode.PROJECT_DEEP_DIVE, ResultWindowAction.KEEP);
                default:
                    break;
            }
        }
        Intent effective = intent == null ? Intent.UNKNOWN : intent;
        return table.get(node).get(effective);
    }

    private static Transition to(FlowNode next, ResultWindowAction action) {
        return new Transition(next, action);
    }
}
