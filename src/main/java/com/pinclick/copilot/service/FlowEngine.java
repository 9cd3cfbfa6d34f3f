package com.pinclick.copilot.service;

import com.pinclick.copilot.dto.QuickFilters;
import com.pinclick.copilot.dto.TurnRequest;
import com.pinclick.copilot.dto.TurnResponse;
import com.pinclick.copilot.model.ConfidenceTier;
import com.pinclick.copilot.model.ConversationState;
import com.pinclick.copilot.model.FallbackStage;
import com.pinclick.copilot.model.FilterModel;
import com.pinclick.copilot.model.FlowNode;
import com.pinclick.copilot.model.Intent;
import com.pinclick.copilot.model.IntentClassification;
import com.pinclick.copilot.model.Interceptor;
import com.pinclick.copilot.model.PossessionStatus;
import com.pinclick.copilot.model.ProjectSummary;
import com.pinclick.copilot.model.PropertyType;
import com.pinclick.copilot.model.RadiusPivotResult;
import com.pinclick.copilot.model.RankedProject;
import com.pinclick.copilot.model.RefusalDecision;
import com.pinclick.copilot.model.RefusalReason;
import com.pinclick.copilot.model.RequirementExtraction;
import com.pinclick.copilot.model.Requirements;
import com.pinclick.copilot.model.ResultWindowAction;
import com.pinclick.copilot.model.SearchOutcome;
import com.pinclick.copilot.model.Transition;
import com.pinclick.copilot.model.TurnOutcome;
import com.pinclick.copilot.model.Utterance;
import com.pinclick.copilot.util.ConfigurationParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Conversation state machine. Applies one turn to a {@link ConversationState} and returns the
 * structured response. Persisting the mutated state is the caller's responsibility.
 */
@Service
public class FlowEngine {

    private static final Logger log = LoggerFactory.getLogger(FlowEngine.class);

    public static final int INITIAL_WINDOW = 3;
    public static final int PAGE_SIZE = 5;
    public static final double DEFAULT_MIN_CLASSIFIER_CONFIDENCE = 0.40;
    private static final double STRETCH_MULTIPLIER = 1.1;

    private final UtteranceInterceptor utteranceInterceptor;
    private final FlowTransitionTable transitionTable;
    private final LanguageClassifier languageClassifier;
    private final RequirementExtractor requirementExtractor;
    private final ExternalCallGuard callGuard;
    private final PropertySearchService propertySearchService;
    private final CatalogQueryAdapter catalogQueryAdapter;
    private final BudgetRelaxationService budgetRelaxationService;
    private final ConfidenceScoringService confidenceScoringService;
    private final RefusalPolicyService refusalPolicyService;
    private final double minClassifierConfidence;

    public FlowEngine(UtteranceInterceptor utteranceInterceptor,
                      FlowTransitionTable transitionTable,
                      LanguageClassifier languageClassifier,
                      RequirementExtractor requirementExtractor,
                      ExternalCallGuard callGuard,
                      PropertySearchService propertySearchService,
                      CatalogQueryAdapter catalogQueryAdapter,
                      BudgetRelaxationService budgetRelaxationService,
                      ConfidenceScoringService confidenceScoringService,
                      RefusalPolicyService refusalPolicyService,
                      @Value("${copilot.classifier.min-confidence:0.40}") double minClassifierConfidence) {
        this.utteranceInterceptor = utteranceInterceptor;
        this.transitionTable = transitionTable;
        this.languageClassifier = languageClassifier;
        this.requirementExtractor = requirementExtractor;
        this.callGuard = callGuard;
        this.propertySearchService = propertySearchService;
        this.catalogQueryAdapter = catalogQueryAdapter;
        this.budgetRelaxationService = budgetRelaxationService;
        this.confidenceScoringService = confidenceScoringService;
        this.refusalPolicyService = refusalPolicyService;
        this.minClassifierConfidence = minClassifierConfidence;
    }

    /**
     * Runs one turn. {@link ThrottledException} propagates; the caller must then discard the
     * state instead of saving it.
     */
    public TurnResponse process(ConversationState state, TurnRequest request) {
        String message = request.getMessage().trim();
        FlowNode previousNode = state.getCurrentNode();
        state.setTurnCount(state.getTurnCount() + 1);

        Utterance utterance = utteranceInterceptor.intercept(message, knownProjectNames(state));
        IntentClassification classification = utterance.isIntercepted()
                ? new IntentClassification(utterance.interceptor().impliedIntent(), 1.0)
                : classify(message, state);
        Intent intent = classification.confidence() < minClassifierConfidence
                ? Intent.UNKNOWN
                : classification.intent();
        state.recordMessage(message);

        if (utterance.interceptor() == Interceptor.RESET) {
            state.resetConversation();
        }

        RequirementExtraction extraction = needsExtraction(intent, utterance)
                ? extract(message)
                : RequirementExtraction.empty();
        applyRequirements(state, extraction, request.getFilters(), utterance);

        Transition transition = transitionTable.resolve(previousNode, intent, utterance.interceptor());
        TurnResponse response;
        if (utterance.interceptor() == Interceptor.RESET) {
            response = TurnResponse.builder()
                    .outcome(TurnOutcome.RESET)
                    .node(FlowNode.REQUIREMENT_GATHERING)
                    .missingRequirements(state.getRequirements().missingSearchSlots())
                    .build();
        } else if (intent == Intent.COMPARISON) {
            response = compare(state, intent, message);
        } else {
            response = dispatch(state, transition, intent, utterance, extraction, message);
        }

        if (response.getNode() == null) {
            response.setNode(previousNode);
        }
        state.setLastIntent(intent);
        state.setCurrentNode(response.getNode());
        state.setNextRedirection(response.getNode().expectedFollowUp());

        response.setSessionId(state.getSessionId());
        response.setIntent(intent);
        response.setIntentConfidence(classification.confidence());
        response.setNextRedirection(state.getNextRedirection());
        response.setRequirements(state.getRequirements().copy());
        response.setSelectedProjectName(state.getSelectedProjectName());
        if (response.getPaginationOffset() == null) {
            response.setPaginationOffset(state.getPaginationOffset());
        }
        log.info("Session {} turn {}: intent={} interceptor={} node {} -> {} outcome={}",
                state.getSessionId(), state.getTurnCount(), intent, utterance.interceptor(),
                previousNode, response.getNode(), response.getOutcome());
        return response;
    }

    private TurnResponse dispatch(ConversationState state, Transition transition, Intent intent,
                                  Utterance utterance, RequirementExtraction extraction, String message) {
        if (intent == Intent.UNSUPPORTED) {
            RefusalDecision decision = refusalPolicyService.shouldRefuse(intent, List.of(), ConfidenceTier.NOT_AVAILABLE, message);
            return refusal(decision.reason(), state.getCurrentNode());
        }
        if (intent == Intent.GREETING || intent == Intent.SCHEDULING) {
            return TurnResponse.builder()
                    .outcome(TurnOutcome.ACKNOWLEDGED)
                    .node(transition.next())
                    .build();
        }
        switch (transition.next()) {
            case SEARCH_RESULTS:
                if (transition.windowAction() == ResultWindowAction.PAGINATE) {
                    return paginate(state, FlowNode.SEARCH_RESULTS);
                }
                return search(state, intent, message);
            case RADIUS_PIVOT:
                if (transition.windowAction() == ResultWindowAction.PAGINATE) {
                    return paginate(state, FlowNode.RADIUS_PIVOT);
                }
                return radiusPivot(state, intent, message);
            case PROJECT_DEEP_DIVE:
                return deepDive(state, intent, utterance, extraction, message);
            case OBJECTION_HANDLING:
                return objection(state);
            case SITE_VISIT_HANDOFF:
                return siteVisit(state, utterance, extraction);
            case REQUIREMENT_GATHERING:
            default:
                return gather(state);
        }
    }

    private TurnResponse search(ConversationState state, Intent intent, String message) {
        if (!state.getRequirements().hasAnySearchSlot() && state.getRefinements().isEmpty()) {
            return gather(state);
        }
        SearchOutcome outcome = propertySearchService.search(effectiveFilters(state));
        TurnResponse response = present(state, intent, message, outcome.matches(), FlowNode.SEARCH_RESULTS, outcome.stage());
        if (response.getOutcome() == TurnOutcome.RESULTS) {
            response.setRelaxationMultiplier(outcome.relaxationMultiplier());
            response.setRelaxationExplanation(outcome.relaxationExplanation());
        }
        return response;
    }

    private TurnResponse radiusPivot(ConversationState state, Intent intent, String message) {
        String anchor = state.getRequirements().getLocation();
        if (!StringUtils.hasText(anchor)) {
            return TurnResponse.builder()
                    .outcome(TurnOutcome.NO_ANCHOR)
                    .node(FlowNode.REQUIREMENT_GATHERING)
                    .missingRequirements(List.of("location"))
                    .build();
        }
        RadiusPivotResult pivot = propertySearchService.pivot(anchor, effectiveFilters(state));
        if (!pivot.anchorResolved()) {
            return TurnResponse.builder()
                    .outcome(TurnOutcome.NO_ANCHOR)
                    .node(FlowNode.REQUIREMENT_GATHERING)
                    .anchorLocation(anchor)
                    .missingRequirements(List.of("location"))
                    .build();
        }
        TurnResponse response = present(state, intent, message, pivot.projects(), FlowNode.RADIUS_PIVOT, FallbackStage.RADIUS_PIVOT);
        response.setAnchorLocation(anchor);
        response.setRadiusKm(pivot.radiusKm());
        return response;
    }

    /**
     * Gates a fresh result list through confidence and refusal, then replaces the window.
     */
    private TurnResponse present(ConversationState state, Intent intent, String message,
                                 List<RankedProject> matches, FlowNode node, FallbackStage stage) {
        ConfidenceTier confidence = confidenceScoringService.score(matches);
        RefusalDecision decision = refusalPolicyService.shouldRefuse(intent, matches, confidence, message);
        if (decision.refuse()) {
            TurnResponse refusal = refusal(decision.reason(), FlowNode.REQUIREMENT_GATHERING);
            refusal.setConfidence(confidence);
            refusal.setMissingRequirements(state.getRequirements().missingSearchSlots());
            return refusal;
        }
        log.debug("Session {}: {} match(es) at {}, tier {}, top two agree: {}", state.getSessionId(),
                matches.size(), stage, confidence, confidenceScoringService.hasAgreement(matches));
        List<RankedProject> shown = state.replaceResults(matches, INITIAL_WINDOW);
        state.setLastFallbackStage(stage);
        if (matches.size() == 1) {
            state.setSelectedProjectName(matches.get(0).name());
        }
        return TurnResponse.builder()
                .outcome(TurnOutcome.RESULTS)
                .node(node)
                .confidence(confidence)
                .confidenceNote(confidenceScoringService.explanation(confidence))
                .projects(shown)
                .fallbackStage(stage)
                .totalResults(matches.size())
                .hasMore(state.getPaginationOffset() < matches.size())
                .build();
    }

    private TurnResponse paginate(ConversationState state, FlowNode node) {
        List<RankedProject> page = state.nextPage(PAGE_SIZE);
        int total = state.getLastSearchResults().size();
        if (page.isEmpty()) {
            return TurnResponse.builder()
                    .outcome(TurnOutcome.NO_MORE_RESULTS)
                    .node(node)
                    .totalResults(total)
                    .hasMore(false)
                    .build();
        }
        return TurnResponse.builder()
                .outcome(TurnOutcome.RESULTS)
                .node(node)
                .confidence(confidenceScoringService.score(state.getLastSearchResults()))
                .projects(page)
                .fallbackStage(state.getLastFallbackStage())
                .totalResults(total)
                .hasMore(state.getPaginationOffset() < total)
                .build();
    }

    private TurnResponse deepDive(ConversationState state, Intent intent, Utterance utterance,
                                  RequirementExtraction extraction, String message) {
        String name = firstNonBlank(utterance.mentionedProject(), extraction.projectName(),
                state.getSelectedProjectName(), singleShownProject(state));
        if (name == null) {
            return TurnResponse.builder()
                    .outcome(TurnOutcome.CLARIFY_PROJECT)
                    .node(state.getCurrentNode())
                    .build();
        }
        List<ProjectSummary> records = catalogQueryAdapter.findByName(name);
        if (records.isEmpty()) {
            records = state.getLastSearchResults().stream()
                    .map(RankedProject::project)
                    .filter(p -> p.name() != null && p.name().equalsIgnoreCase(name))
                    .limit(1)
                    .collect(Collectors.toList());
        }
        if (records.isEmpty()) {
            return refusal(RefusalReason.NO_RELEVANT_INFO, state.getCurrentNode());
        }
        if (pricesDisagree(records)) {
            log.warn("Session {}: {} catalog rows named '{}' disagree on price", state.getSessionId(), records.size(), name);
            return refusal(RefusalReason.CONFLICTING_INFO, state.getCurrentNode());
        }
        ProjectSummary project = records.get(0);
        state.setSelectedProjectName(project.name());
        List<RankedProject> matches = List.of(new RankedProject(project, 1.0));
        ConfidenceTier confidence = confidenceScoringService.score(matches);
        RefusalDecision decision = refusalPolicyService.shouldRefuse(intent, matches, confidence, message);
        if (decision.refuse()) {
            return refusal(decision.reason(), state.getCurrentNode());
        }
        String feature = extraction.featureRequested() != null
                ? extraction.featureRequested()
                : state.getRequirements().getFeatureRequested();
        return TurnResponse.builder()
                .outcome(TurnOutcome.PROJECT_DETAILS)
                .node(FlowNode.PROJECT_DEEP_DIVE)
                .confidence(confidence)
                .projects(matches)
                .featureRequested(feature)
                .build();
    }

    private TurnResponse objection(ConversationState state) {
        TurnResponse response = TurnResponse.builder()
                .outcome(TurnOutcome.OBJECTION)
                .node(FlowNode.OBJECTION_HANDLING)
                .build();
        Long budget = state.getRequirements().getBudgetMax();
        if (budget != null) {
            response.setRelaxationMultiplier(STRETCH_MULTIPLIER);
            response.setSuggestedBudget(BudgetRelaxationService.relaxedBudget(budget, STRETCH_MULTIPLIER));
            response.setRelaxationExplanation(budgetRelaxationService.explainRelaxation(budget, STRETCH_MULTIPLIER));
        }
        return response;
    }

    private TurnResponse siteVisit(ConversationState state, Utterance utterance, RequirementExtraction extraction) {
        String name = firstNonBlank(utterance.mentionedProject(), extraction.projectName(),
                state.getSelectedProjectName(), singleShownProject(state));
        if (name == null) {
            return TurnResponse.builder()
                    .outcome(TurnOutcome.CLARIFY_PROJECT)
                    .node(state.getCurrentNode())
                    .build();
        }
        state.setSelectedProjectName(name);
        return TurnResponse.builder()
                .outcome(TurnOutcome.SITE_VISIT_HANDOFF)
                .node(FlowNode.SITE_VISIT_HANDOFF)
                .build();
    }

    private TurnResponse compare(ConversationState state, Intent intent, String message) {
        List<RankedProject> shown = state.getLastShownProjects();
        long distinct = shown.stream().map(RankedProject::name).filter(Objects::nonNull).distinct().count();
        if (confidenceScoringService.requiresMultipleSources(intent) && distinct < 2) {
            return refusal(RefusalReason.NO_RELEVANT_INFO, state.getCurrentNode());
        }
        ConfidenceTier confidence = confidenceScoringService.score(shown);
        RefusalDecision decision = refusalPolicyService.shouldRefuse(intent, shown, confidence, message);
        if (decision.refuse()) {
            return refusal(decision.reason(), state.getCurrentNode());
        }
        return TurnResponse.builder()
                .outcome(TurnOutcome.RESULTS)
                .node(FlowNode.SEARCH_RESULTS)
                .confidence(confidence)
                .projects(List.copyOf(shown))
                .build();
    }

    private TurnResponse gather(ConversationState state) {
        return TurnResponse.builder()
                .outcome(TurnOutcome.GATHERING_REQUIREMENTS)
                .node(FlowNode.REQUIREMENT_GATHERING)
                .missingRequirements(state.getRequirements().missingSearchSlots())
                .build();
    }

    private TurnResponse refusal(RefusalReason reason, FlowNode node) {
        return TurnResponse.builder()
                .outcome(TurnOutcome.REFUSED)
                .node(node)
                .refusalReason(reason)
                .message(reason.getMessage())
                .build();
    }

    FilterModel effectiveFilters(ConversationState state) {
        return FilterModel.merge(state.getRefinements(), FilterModel.fromRequirements(state.getRequirements()));
    }

    /**
     * Free-text extraction first, explicit caller filters last so they win within the turn.
     */
    private void applyRequirements(ConversationState state, RequirementExtraction extraction,
                                   QuickFilters explicit, Utterance utterance) {
        Requirements requirements = Requirements.merge(state.getRequirements(), extraction.toRequirements());
        FilterModel refinements = FilterModel.merge(state.getRefinements(), extraction.toRefinements());
        if (utterance.radiusKm() != null) {
            refinements = FilterModel.merge(refinements,
                    new FilterModel(null, null, null, null, null, null, null, utterance.radiusKm()));
        }
        if (explicit != null) {
            requirements = Requirements.merge(requirements, explicitRequirements(explicit));
            refinements = FilterModel.merge(refinements, explicitRefinements(explicit));
        }
        state.setRequirements(requirements);
        state.setRefinements(refinements);
    }

    private Requirements explicitRequirements(QuickFilters filters) {
        Set<Integer> bedrooms = new LinkedHashSet<>();
        if (filters.getBhk() != null) {
            filters.getBhk().forEach(label -> bedrooms.addAll(ConfigurationParser.bedrooms(label)));
        }
        Long budgetMax = filters.getPriceRange() != null && filters.getPriceRange().size() > 1
                ? filters.getPriceRange().get(1)
                : null;
        return Requirements.builder()
                .configuration(ConfigurationParser.label(bedrooms))
                .location(filters.getLocality())
                .budgetMax(budgetMax)
                .build();
    }

    private FilterModel explicitRefinements(QuickFilters filters) {
        Long budgetMin = filters.getPriceRange() != null && !filters.getPriceRange().isEmpty()
                ? filters.getPriceRange().get(0)
                : null;
        Set<PropertyType> types = parseAll(filters.getPropertyType(), PropertyType::fromLabel);
        Set<PossessionStatus> statuses = parseAll(filters.getStatus(), PossessionStatus::fromLabel);
        Set<String> amenities = filters.getAmenities() == null ? Set.of() : filters.getAmenities().stream()
                .filter(StringUtils::hasText)
                .map(a -> a.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return new FilterModel(null, null, budgetMin, null, types, statuses, amenities, filters.getRadiusKm());
    }

    private <T> Set<T> parseAll(List<String> labels, Function<String, Optional<T>> parser) {
        Set<T> out = new LinkedHashSet<>();
        if (labels != null) {
            labels.forEach(label -> parser.apply(label).ifPresent(out::add));
        }
        return out;
    }

    private boolean needsExtraction(Intent intent, Utterance utterance) {
        if (utterance.interceptor() == Interceptor.SHOW_MORE) {
            return false;
        }
        return intent != Intent.GREETING && intent != Intent.SCHEDULING && intent != Intent.UNSUPPORTED;
    }

    private IntentClassification classify(String message, ConversationState state) {
        try {
            return callGuard.call("intent classification", () -> languageClassifier.classify(message, state))
                    .orElseGet(IntentClassification::unknown);
        } catch (ThrottledException te) {
            throw te;
        } catch (RuntimeException e) {
            log.warn("Session {}: intent classification unavailable ({}); routing to requirement gathering",
                    state.getSessionId(), e.getMessage());
            return IntentClassification.unknown();
        }
    }

    private RequirementExtraction extract(String message) {
        try {
            return callGuard.call("requirement extraction", () -> requirementExtractor.extract(message))
                    .orElseGet(RequirementExtraction::empty);
        } catch (ThrottledException te) {
            throw te;
        } catch (RuntimeException e) {
            log.warn("Requirement extraction unavailable ({}); keeping previous requirements", e.getMessage());
            return RequirementExtraction.empty();
        }
    }

    private List<String> knownProjectNames(ConversationState state) {
        List<String> names = new ArrayList<>();
        state.getLastSearchResults().forEach(r -> names.add(r.name()));
        try {
            names.addAll(catalogQueryAdapter.knownProjectNames());
        } catch (CatalogUnavailableException | ExternalCallTimeoutException e) {
            log.warn("Project name list unavailable, matching against the current results only: {}", e.getMessage());
        }
        return names;
    }

    private boolean pricesDisagree(List<ProjectSummary> records) {
        return records.stream()
                .map(p -> p.budgetMin() + ":" + p.budgetMax())
                .distinct()
                .count() > 1;
    }

    private String singleShownProject(ConversationState state) {
        List<RankedProject> shown = state.getLastShownProjects();
        return shown.size() == 1 ? shown.get(0).name() : null;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }
}
