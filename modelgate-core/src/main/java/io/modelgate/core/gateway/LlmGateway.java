package io.modelgate.core.gateway;

import io.modelgate.core.backend.Backend;
import io.modelgate.core.backend.GenerationConfig;
import io.modelgate.core.backend.LlmResponse;
import io.modelgate.core.backend.ModelDescriptor;
import io.modelgate.core.model.ChatMessage;
import io.modelgate.core.routing.ModelRef;
import io.modelgate.core.routing.ModelRouter;
import io.modelgate.core.routing.RouteResult;
import io.modelgate.core.routing.RoutingRequest;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aggregates the registered backends behind one {@link Backend} and recovers from failures.
 *
 * <p>When the resolved backend fails, recovery runs strictly in sequence: first the other
 * configured models of the same backend (if it still answers its model listing), then its default
 * model, then the default model of every other backend by ascending priority. The same
 * {@code backend/model} pair is never tried twice within one call.
 */
public final class LlmGateway implements Backend {
    private static final Logger LOG = LoggerFactory.getLogger(LlmGateway.class);
    private static final int MAX_MESSAGE = 300;

    private final BackendRegistry registry;
    private final GatewaySettings settings;
    private final ModelRouter router;
    private final Clock clock;

    public LlmGateway(BackendRegistry registry) {
        this(registry, GatewaySettings.defaults(), null, Clock.systemUTC());
    }

    public LlmGateway(BackendRegistry registry, GatewaySettings settings, ModelRouter router) {
        this(registry, settings, router, Clock.systemUTC());
    }

    /**
     * @param router consulted when a call names no model and auto-routing is on; may be {@code null}
     */
    public LlmGateway(BackendRegistry registry, GatewaySettings settings, ModelRouter router, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.settings = settings == null ? GatewaySettings.defaults() : settings;
        this.router = router;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public LlmResponse chat(
        List<ChatMessage> messages,
        List<Map<String, Object>> tools,
        String modelId,
        GenerationConfig config
    ) {
        if (registry.isEmpty()) {
            throw new UnknownBackendException("No backends registered");
        }

        String requested = modelId;
        if (isBlank(requested) && router != null) {
            if (router.settings().auto()) {
                RouteResult route = router.route(RoutingRequest.of(messages, router.defaultMode(), null));
                requested = route.qualifiedModel();
            } else {
                requested = router.settings().chatModel();
            }
        }

        ModelRef ref = parseModel(requested);
        BackendRegistration registration = registry.find(ref.backendName())
            .orElseThrow(() -> new UnknownBackendException("Unknown backend: " + ref.backendName()));
        String model = ref.modelId() != null ? ref.modelId() : registration.backend().defaultModel();

        FailoverRun run = new FailoverRun(messages, tools, config);
        Optional<LlmResponse> served = run.attempt(registration, model);
        if (served.isPresent()) {
            return served.get();
        }
        if (!settings.fallbackEnabled()) {
            throw new FailoverExhaustedException(run.attempts, false);
        }
        return run.failover(registration, model);
    }

    /**
     * Resolves a model reference to a backend: {@code backend/model} splits directly, a bare id
     * goes to the first backend that lists it (or accepts {@code *}), anything else goes to the
     * default backend with the id unchanged. A {@code null} model means the default backend's
     * default model.
     */
    public ModelRef parseModel(String model) {
        ModelRef ref = ModelRef.split(model);
        if (ref.qualified()) {
            return ref;
        }
        if (ref.modelId() != null) {
            for (BackendRegistration registration : registry.registrations()) {
                if (registration.serves(ref.modelId())) {
                    return new ModelRef(registration.name(), ref.modelId());
                }
            }
        }
        return new ModelRef(defaultBackendName(), ref.modelId());
    }

    @Override
    public String defaultModel() {
        String backendName = defaultBackendName();
        return registry.find(backendName)
            .map(registration -> backendName + ModelRef.SEPARATOR + registration.backend().defaultModel())
            .orElseThrow(() -> new UnknownBackendException("No backends registered"));
    }

    /**
     * Union of every reachable backend's live listing, each id prefixed with its backend name.
     * Empty only when no backend could be asked.
     */
    @Override
    public Optional<List<String>> listModels() {
        List<String> models = new ArrayList<>();
        boolean anyReachable = false;
        for (BackendRegistration registration : registry.registrations()) {
            Optional<List<String>> listing = registration.backend().listModels();
            if (listing.isPresent()) {
                anyReachable = true;
                listing.get().forEach(id -> models.add(registration.name() + ModelRef.SEPARATOR + id));
            }
        }
        return anyReachable ? Optional.of(List.copyOf(models)) : Optional.empty();
    }

    @Override
    public ModelDescriptor capabilitiesOf(String modelId) {
        ModelRef ref = parseModel(modelId);
        Optional<BackendRegistration> registration = registry.find(ref.backendName());
        if (registration.isEmpty() || ref.modelId() == null) {
            return ModelDescriptor.defaults(ref.modelId() == null ? String.valueOf(modelId) : ref.modelId());
        }
        return registration.get().descriptorFor(ref.modelId());
    }

    public BackendRegistry registry() {
        return registry;
    }

    private String defaultBackendName() {
        if (settings.defaultBackend() != null && registry.find(settings.defaultBackend()).isPresent()) {
            return settings.defaultBackend();
        }
        List<BackendRegistration> ordered = registry.byPriority();
        return ordered.isEmpty() ? settings.defaultBackend() : ordered.get(0).name();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }

    /**
     * State of one {@code chat} call: the attempts made so far and the pairs already tried.
     */
    private final class FailoverRun {
        private final List<ChatMessage> messages;
        private final List<Map<String, Object>> tools;
        private final GenerationConfig config;
        private final long startedAt;
        private final List<FailoverAttempt> attempts = new ArrayList<>();
        private final Set<String> tried = new HashSet<>();
        private boolean budgetExceeded;

        FailoverRun(List<ChatMessage> messages, List<Map<String, Object>> tools, GenerationConfig config) {
            this.messages = messages;
            this.tools = tools;
            this.config = config;
            this.startedAt = clock.millis();
        }

        LlmResponse failover(BackendRegistration failed, String failedModel) {
            LOG.info("Starting failover from {}/{}", failed.name(), failedModel);

            Optional<List<String>> live = failed.backend().listModels();
            if (live.isPresent() && !live.get().isEmpty()) {
                Optional<LlmResponse> sameBackend = trySameBackend(failed, failedModel, live.get());
                if (sameBackend.isPresent()) {
                    return sameBackend.get();
                }
            } else {
                LOG.info("Backend {} is unreachable, skipping same-backend recovery", failed.name());
            }

            for (BackendRegistration other : registry.byPriority()) {
                if (other.name().equals(failed.name())) {
                    continue;
                }
                Optional<LlmResponse> served = attempt(other, other.backend().defaultModel());
                if (served.isPresent()) {
                    LOG.info("Failed over to backend {}", other.name());
                    return served.get();
                }
            }

            throw new FailoverExhaustedException(attempts, budgetExceeded);
        }

        private Optional<LlmResponse> trySameBackend(BackendRegistration registration, String failedModel, List<String> live) {
            LOG.info("Backend {} still answers, trying its other models", registration.name());
            for (String modelId : registration.concreteModelIds()) {
                if (modelId.equals(failedModel) || !live.contains(modelId)) {
                    continue;
                }
                Optional<LlmResponse> served = attempt(registration, modelId);
                if (served.isPresent()) {
                    return served;
                }
            }

            String defaultModel = registration.backend().defaultModel();
            if (!defaultModel.equals(failedModel)) {
                Optional<LlmResponse> served = attempt(registration, defaultModel);
                if (served.isPresent()) {
                    return served;
                }
            }
            LOG.warn("Backend {} has no other working model", registration.name());
            return Optional.empty();
        }

        /**
         * One call against one backend/model. Returns empty on failure, on a pair already tried,
         * or once the failover budget is spent.
         */
        Optional<LlmResponse> attempt(BackendRegistration registration, String modelId) {
            String key = registration.name() + ModelRef.SEPARATOR + modelId;
            if (!tried.add(key)) {
                return Optional.empty();
            }
            if (!attempts.isEmpty() && overBudget()) {
                budgetExceeded = true;
                LOG.warn("Failover budget of {} spent, not trying {}", settings.failoverBudget(), key);
                return Optional.empty();
            }

            try {
                LlmResponse response = registration.backend().chat(messages, tools, modelId, config);
                LOG.debug("Served by {}", key);
                return Optional.of(response.withRoute(
                    registration.name(),
                    modelId,
                    registration.descriptorFor(modelId).tier()
                ));
            } catch (RuntimeException e) {
                String message = truncate(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), MAX_MESSAGE);
                attempts.add(new FailoverAttempt(registration.name(), modelId, message));
                LOG.warn("Backend call {} failed: {}", key, message);
                return Optional.empty();
            }
        }

        private boolean overBudget() {
            if (!settings.budgeted()) {
                return false;
            }
            Duration elapsed = Duration.ofMillis(clock.millis() - startedAt);
            return elapsed.compareTo(settings.failoverBudget()) >= 0;
        }
    }
}
