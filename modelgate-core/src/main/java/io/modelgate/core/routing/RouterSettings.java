package io.modelgate.core.routing;

/**
 * Designated models and mode flags for {@link ModelRouter}.
 *
 * @param chatModel {@code null} when unset; {@link io.modelgate.core.gateway.ModelValidationService} reports it
 * @param intentModel model asked for intent classification; defaults to the chat model
 * @param visionModel optional model for image tasks
 * @param coderModel optional model for coding tasks
 */
public record RouterSettings(
    String chatModel,
    String intentModel,
    String visionModel,
    String coderModel,
    boolean auto,
    boolean performanceFirst,
    RoutingConfig routing
) {

    public RouterSettings {
        chatModel = chatModel == null || chatModel.isBlank() ? null : chatModel;
        intentModel = intentModel == null || intentModel.isBlank() ? chatModel : intentModel;
        visionModel = visionModel == null || visionModel.isBlank() ? null : visionModel;
        coderModel = coderModel == null || coderModel.isBlank() ? null : coderModel;
        routing = routing == null ? RoutingConfig.defaults() : routing;
    }

    public static RouterSettings auto(String chatModel, RoutingConfig routing) {
        return new RouterSettings(chatModel, null, null, null, true, false, routing);
    }

    public RoutingMode defaultMode() {
        if (!auto) {
            return RoutingMode.FIXED;
        }
        return performanceFirst ? RoutingMode.PERFORMANCE_FIRST : RoutingMode.AUTO;
    }
}
