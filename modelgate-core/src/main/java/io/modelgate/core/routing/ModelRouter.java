package io.modelgate.core.routing;

import io.modelgate.core.backend.ModelDescriptor;
import io.modelgate.core.backend.Tier;
import io.modelgate.core.media.MediaReferences;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks a {@code backend/model} for a conversation from the registered candidates.
 *
 * <p>Decision order: fixed mode, then image media (vision models only), then performance-first,
 * then the complexity-derived tier. Routing never fails while at least one candidate exists; with
 * no candidates at all the requested model id is passed through untouched.
 *
 * <p>When several candidates tie, the first one in registration order wins.
 */
public final class ModelRouter {
    private static final Logger LOG = LoggerFactory.getLogger(ModelRouter.class);

    private final RouterSettings settings;
    private final List<ModelCandidate> candidates;
    private final ComplexityScorer scorer;
    private final RuleMatcher ruleMatcher;
    private final ToolNeedDetector toolNeedDetector;

    public ModelRouter(RouterSettings settings, List<ModelCandidate> candidates) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.candidates = candidates == null ? List.of() : List.copyOf(candidates);
        this.scorer = new ComplexityScorer(settings.routing());
        this.ruleMatcher = new RuleMatcher(settings.routing());
        this.toolNeedDetector = new ToolNeedDetector(settings.routing().toolKeywords());
    }

    public RouteResult route(RoutingRequest request) {
        RoutingMode mode = request.mode() == null ? settings.defaultMode() : request.mode();
        if (mode == RoutingMode.FIXED) {
            return routeTo(settings.chatModel(), 0, "fixed");
        }
        if (candidates.isEmpty()) {
            return passThrough(request.requestedModel());
        }

        boolean performanceFirst = mode == RoutingMode.PERFORMANCE_FIRST;
        String text = request.joinedContent();
        boolean requireTool = toolNeedDetector.needsTools(text);
        int score = scorer.score(request.messages(), text, text.length());
        Tier target = scorer.tierFor(score);

        if (MediaReferences.hasImage(request.media())) {
            Optional<RouteResult> vision = selectVision(score, target, performanceFirst);
            if (vision.isPresent()) {
                return logged(vision.get());
            }
            LOG.info("Image attached but no vision-capable model is registered; routing on the full model set");
        }

        if (performanceFirst) {
            Optional<ModelCandidate> strongest = select(Tier.ULTRA, false, requireTool, true);
            if (strongest.isPresent()) {
                return logged(toResult(strongest.get(), 100, "performance-first"));
            }
        }

        Optional<ModelCandidate> selected = select(target, false, requireTool, performanceFirst);
        if (selected.isPresent()) {
            ModelCandidate candidate = selected.get();
            String reason = candidate.tier() == target
                ? "complexity score " + score + " -> " + target.value()
                : "complexity score " + score + " -> " + target.value() + ", nearest tier " + candidate.tier().value();
            return logged(toResult(candidate, score, reason));
        }
        return passThrough(request.requestedModel());
    }

    /**
     * Route used when the intent model gave no usable answer: the first matching keyword rule,
     * then the complexity-derived tier, then the chat model.
     */
    public RouteResult fallbackRoute(RoutingRequest request) {
        String text = request.joinedContent();
        boolean hasImage = MediaReferences.hasImage(request.media());
        boolean requireTool = toolNeedDetector.needsTools(text);
        boolean performanceFirst = request.mode() == RoutingMode.PERFORMANCE_FIRST
            || (request.mode() == null && settings.performanceFirst());

        Optional<RoutingRule> rule = ruleMatcher.matchRule(text, text.length());
        if (rule.isPresent()) {
            Optional<ModelCandidate> byRule = select(rule.get().tier(), hasImage, requireTool, performanceFirst);
            if (byRule.isPresent()) {
                return toResult(byRule.get(), 0, "keyword rule -> " + rule.get().tier().value());
            }
        }

        int score = scorer.score(request.messages(), text, text.length());
        Optional<ModelCandidate> byScore = select(scorer.tierFor(score), hasImage, requireTool, performanceFirst);
        if (byScore.isPresent()) {
            return toResult(byScore.get(), score, "complexity score " + score);
        }
        return routeTo(settings.chatModel(), score, "default chat model");
    }

    public RouteResult selectByTaskType(TaskType type) {
        return switch (type) {
            case VISION -> settings.visionModel() != null
                ? routeTo(settings.visionModel(), 0, "vision model")
                : routeTo(settings.chatModel(), 0, "no vision model configured, using chat model");
            case CODER -> settings.coderModel() != null
                ? routeTo(settings.coderModel(), 0, "coder model")
                : routeTo(settings.chatModel(), 0, "no coder model configured, using chat model");
            case CHAT -> routeTo(settings.chatModel(), 0, "chat model");
        };
    }

    /**
     * Wraps a known {@code backend/model} id in a result, looking up its descriptor.
     */
    public RouteResult routeTo(String model, int score, String reason) {
        ModelRef ref = ModelRef.split(model);
        return new RouteResult(ref.backendName(), ref.modelId(), descriptorFor(model), score, reason);
    }

    public ModelDescriptor descriptorFor(String model) {
        ModelRef ref = ModelRef.split(model);
        if (ref.qualified()) {
            for (ModelCandidate candidate : candidates) {
                if (candidate.backendName().equals(ref.backendName()) && candidate.descriptor().id().equals(ref.modelId())) {
                    return candidate.descriptor();
                }
            }
        }
        String id = ref.modelId() != null ? ref.modelId() : model == null ? "" : model;
        return ModelDescriptor.defaults(id);
    }

    public List<ModelCandidate> candidates(boolean visionOnly) {
        if (!visionOnly) {
            return candidates;
        }
        return candidates.stream().filter(candidate -> candidate.descriptor().vision()).toList();
    }

    public RouterSettings settings() {
        return settings;
    }

    public RoutingMode defaultMode() {
        return settings.defaultMode();
    }

    public RouterStatus status() {
        return new RouterStatus(
            settings.auto(),
            settings.performanceFirst(),
            ruleMatcher.ruleCount(),
            candidates.size(),
            settings.chatModel(),
            settings.intentModel()
        );
    }

    private Optional<RouteResult> selectVision(int score, Tier target, boolean performanceFirst) {
        List<ModelCandidate> vision = new ArrayList<>(candidates(true));
        if (vision.isEmpty()) {
            return Optional.empty();
        }
        Comparator<ModelCandidate> byTier = Comparator.comparingInt(candidate -> candidate.tier().rank());
        vision.sort(performanceFirst ? byTier.reversed() : byTier);

        ModelCandidate best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (ModelCandidate candidate : vision) {
            int distance = Math.abs(candidate.tier().rank() - target.rank());
            if (distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return Optional.of(toResult(best, score, "vision route, complexity score " + score + " -> " + target.value()));
    }

    /**
     * Exact tier if present, otherwise the nearest tier on the mode's preferred side, otherwise
     * the globally cheapest (speed-first) or strongest (performance-first) candidate.
     */
    private Optional<ModelCandidate> select(Tier target, boolean visionOnly, boolean requireTool, boolean performanceFirst) {
        List<ModelCandidate> pool = pool(visionOnly, requireTool);
        if (pool.isEmpty()) {
            return Optional.empty();
        }

        for (ModelCandidate candidate : pool) {
            if (candidate.tier() == target) {
                return Optional.of(candidate);
            }
        }

        ModelCandidate nearest = null;
        int nearestDistance = Integer.MAX_VALUE;
        for (ModelCandidate candidate : pool) {
            int diff = candidate.tier().rank() - target.rank();
            boolean onPreferredSide = performanceFirst ? diff >= 0 : diff <= 0;
            if (onPreferredSide && Math.abs(diff) < nearestDistance) {
                nearest = candidate;
                nearestDistance = Math.abs(diff);
            }
        }
        if (nearest != null) {
            return Optional.of(nearest);
        }

        Comparator<ModelCandidate> byTier = Comparator.comparingInt(candidate -> candidate.tier().rank());
        return performanceFirst
            ? pool.stream().reduce((best, next) -> byTier.compare(next, best) > 0 ? next : best)
            : pool.stream().reduce((best, next) -> byTier.compare(next, best) < 0 ? next : best);
    }

    private List<ModelCandidate> pool(boolean visionOnly, boolean requireTool) {
        List<ModelCandidate> pool = candidates(visionOnly);
        if (!requireTool) {
            return pool;
        }
        List<ModelCandidate> toolCapable = pool.stream().filter(candidate -> candidate.descriptor().toolUse()).toList();
        // a tool-less model is still better than no route at all
        return toolCapable.isEmpty() ? pool : toolCapable;
    }

    private RouteResult passThrough(String requestedModel) {
        String model = requestedModel == null || requestedModel.isBlank() ? settings.chatModel() : requestedModel;
        return new RouteResult(null, model, descriptorFor(model), 0, "no routable models registered, passing through");
    }

    private RouteResult toResult(ModelCandidate candidate, int score, String reason) {
        return new RouteResult(candidate.backendName(), candidate.descriptor().id(), candidate.descriptor(), score, reason);
    }

    private RouteResult logged(RouteResult result) {
        LOG.info(
            "Routed to {} (tier {}, score {}): {}",
            result.qualifiedModel(),
            result.descriptor().tier().value(),
            result.complexityScore(),
            result.reason()
        );
        return result;
    }
}
