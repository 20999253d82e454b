package io.modelgate.core.routing;

import static org.assertj.core.api.Assertions.assertThat;

import io.modelgate.core.backend.ModelDescriptor;
import io.modelgate.core.backend.Tier;
import io.modelgate.core.model.ChatMessage;
import java.util.List;
import org.junit.jupiter.api.Test;

class ModelRouterTest {

    @Test
    void shouldPickExactTierForComplexityScore() {
        ModelRouter router = router(
            candidate("a", "tiny", Tier.FAST),
            candidate("a", "small", Tier.LOW),
            candidate("b", "big", Tier.ULTRA)
        );

        RouteResult result = router.route(request("hello"));

        assertThat(result.qualifiedModel()).isEqualTo("a/small");
        assertThat(result.complexityScore()).isEqualTo(30);
        assertThat(result.reason()).isEqualTo("complexity score 30 -> low");
    }

    @Test
    void shouldFallToNearestCheaperTierWhenSpeedFirst() {
        ModelRouter router = router(candidate("a", "tiny", Tier.FAST), candidate("a", "mid", Tier.MEDIUM));

        RouteResult result = router.route(request("hello"));

        assertThat(result.qualifiedModel()).isEqualTo("a/tiny");
        assertThat(result.reason()).endsWith("nearest tier fast");
    }

    @Test
    void shouldUseGlobalCheapestWhenNothingIsCheaperThanTarget() {
        ModelRouter router = router(candidate("b", "ultra", Tier.ULTRA), candidate("a", "high", Tier.HIGH));

        assertThat(router.route(request("hello")).qualifiedModel()).isEqualTo("a/high");
    }

    @Test
    void shouldPickStrongestModelInPerformanceFirstMode() {
        ModelRouter router = router(
            candidate("a", "tiny", Tier.FAST),
            candidate("b", "strong", Tier.HIGH),
            candidate("b", "mid", Tier.MEDIUM)
        );

        RouteResult result = router.route(RoutingRequest.of(
            List.of(ChatMessage.user("hello")),
            RoutingMode.PERFORMANCE_FIRST,
            null
        ));

        assertThat(result.qualifiedModel()).isEqualTo("b/strong");
        assertThat(result.complexityScore()).isEqualTo(100);
        assertThat(result.reason()).isEqualTo("performance-first");
    }

    @Test
    void shouldRouteImagesToClosestVisionModel() {
        ModelRouter router = router(
            candidate("a", "text", Tier.LOW),
            vision("b", "eye-big", Tier.ULTRA),
            vision("b", "eye-small", Tier.LOW)
        );

        RouteResult result = router.route(RoutingRequest.of(
            List.of(ChatMessage.user("what is this", List.of("https://example.com/cat.png")))
        ));

        assertThat(result.qualifiedModel()).isEqualTo("b/eye-small");
        assertThat(result.descriptor().vision()).isTrue();
        assertThat(result.reason()).startsWith("vision route");
    }

    @Test
    void shouldIgnoreImageWhenNoVisionModelExists() {
        ModelRouter router = router(candidate("a", "small", Tier.LOW), candidate("b", "big", Tier.ULTRA));

        RouteResult result = router.route(RoutingRequest.of(
            List.of(ChatMessage.user("what is this", List.of("https://example.com/cat.png")))
        ));

        assertThat(result.qualifiedModel()).isEqualTo("a/small");
    }

    @Test
    void shouldReturnChatModelInFixedMode() {
        RouterSettings fixed = new RouterSettings("a/small", null, null, null, false, false, RoutingConfig.defaults());
        ModelRouter router = new ModelRouter(fixed, List.of(candidate("a", "small", Tier.LOW), candidate("b", "big", Tier.ULTRA)));

        RouteResult result = router.route(request("please refactor the whole architecture"));

        assertThat(result.backendName()).isEqualTo("a");
        assertThat(result.modelId()).isEqualTo("small");
        assertThat(result.reason()).isEqualTo("fixed");
    }

    @Test
    void shouldPassRequestedModelThroughWhenNothingIsRegistered() {
        ModelRouter router = router();

        RouteResult result = router.route(RoutingRequest.of(List.of(ChatMessage.user("hello")), null, "gpt-x"));

        assertThat(result.backendName()).isNull();
        assertThat(result.modelId()).isEqualTo("gpt-x");
        assertThat(result.qualifiedModel()).isEqualTo("gpt-x");
        assertThat(result.reason()).isEqualTo("no routable models registered, passing through");
    }

    @Test
    void shouldPreferToolCapableModelsWhenPromptNeedsTools() {
        ModelRouter router = router(
            new ModelCandidate("a", new ModelDescriptor("plain", false, false, false, Tier.MEDIUM)),
            new ModelCandidate("b", new ModelDescriptor("agent", false, false, true, Tier.MEDIUM))
        );

        RouteResult result = router.route(request("check the disk space"));

        assertThat(result.complexityScore()).isEqualTo(45);
        assertThat(result.qualifiedModel()).isEqualTo("b/agent");
    }

    @Test
    void shouldBreakTiesByRegistrationOrder() {
        ModelRouter router = router(candidate("b", "second", Tier.LOW), candidate("a", "first", Tier.LOW));

        assertThat(router.route(request("hello")).qualifiedModel()).isEqualTo("b/second");
    }

    @Test
    void shouldApplyKeywordRulesInFallbackRoute() {
        ModelRouter router = router(candidate("a", "small", Tier.LOW), candidate("b", "big", Tier.ULTRA));

        RouteResult result = router.fallbackRoute(request("please refactor this"));

        assertThat(result.qualifiedModel()).isEqualTo("b/big");
        assertThat(result.reason()).isEqualTo("keyword rule -> ultra");
    }

    @Test
    void shouldUseScoreInFallbackRouteWithoutRuleMatch() {
        ModelRouter router = router(candidate("a", "small", Tier.LOW), candidate("b", "big", Tier.ULTRA));

        RouteResult result = router.fallbackRoute(request("what time is it"));

        assertThat(result.qualifiedModel()).isEqualTo("a/small");
        assertThat(result.reason()).isEqualTo("complexity score 30");
    }

    @Test
    void shouldFallBackToChatModelWithoutCandidates() {
        RouteResult result = router().fallbackRoute(request("please refactor this"));

        assertThat(result.qualifiedModel()).isEqualTo("a/chat");
        assertThat(result.reason()).isEqualTo("default chat model");
    }

    @Test
    void shouldSelectDesignatedModelsByTaskType() {
        RouterSettings settings = new RouterSettings("a/chat", null, null, "b/coder", true, false, RoutingConfig.defaults());
        ModelRouter router = new ModelRouter(settings, List.of(candidate("b", "coder", Tier.HIGH)));

        assertThat(router.selectByTaskType(TaskType.CODER).qualifiedModel()).isEqualTo("b/coder");
        assertThat(router.selectByTaskType(TaskType.CODER).descriptor().tier()).isEqualTo(Tier.HIGH);
        assertThat(router.selectByTaskType(TaskType.VISION).qualifiedModel()).isEqualTo("a/chat");
        assertThat(router.selectByTaskType(TaskType.CHAT).qualifiedModel()).isEqualTo("a/chat");
    }

    @Test
    void shouldReportStatus() {
        RouterStatus status = router(candidate("a", "small", Tier.LOW)).status();

        assertThat(status.auto()).isTrue();
        assertThat(status.performanceFirst()).isFalse();
        assertThat(status.rulesCount()).isEqualTo(RoutingConfig.defaultRules().size());
        assertThat(status.candidateCount()).isEqualTo(1);
        assertThat(status.intentModel()).isEqualTo("a/chat");
    }

    private static ModelRouter router(ModelCandidate... candidates) {
        return new ModelRouter(RouterSettings.auto("a/chat", RoutingConfig.defaults()), List.of(candidates));
    }

    private static RoutingRequest request(String text) {
        return RoutingRequest.of(List.of(ChatMessage.user(text)));
    }

    private static ModelCandidate candidate(String backend, String model, Tier tier) {
        return new ModelCandidate(backend, new ModelDescriptor(model, false, false, true, tier));
    }

    private static ModelCandidate vision(String backend, String model, Tier tier) {
        return new ModelCandidate(backend, new ModelDescriptor(model, true, false, true, tier));
    }
}
