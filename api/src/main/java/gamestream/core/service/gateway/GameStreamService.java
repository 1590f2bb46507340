package gamestream.core.service.gateway;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.JsonNode;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gamestream.core.model.gateway.ApplicationSummary;
import gamestream.core.model.gateway.GatewayCredentials;
import gamestream.core.model.gateway.GatewayResponse;
import gamestream.core.model.gateway.GatewayResult;
import gamestream.core.model.gateway.GatewaySessionRequest;
import gamestream.core.model.gateway.GatewayUnavailableException;
import gamestream.core.port.in.GameCatalogUseCase;
import gamestream.core.port.in.SessionUseCase;
import gamestream.core.port.out.GatewayClient;
import gamestream.core.port.out.Metrics;

/**
 * Translates client requests into gateway calls and gateway responses into results.
 *
 * <p>Local checks run before any network call:
 * <ul>
 *   <li>gateway not configured: {@link GatewayResult.GatewayDisabled}</li>
 *   <li>missing or malformed input: {@link GatewayResult.InvalidInput}</li>
 * </ul>
 *
 * <p>Gateway responses that break the {@code status_code}/{@code metadata} contract become
 * {@link GatewayResult.UpstreamFailure}. They are not retried here; the client already
 * retried safe methods at the transport level.
 */
@ApplicationScoped
public class GameStreamService implements SessionUseCase, GameCatalogUseCase {

    private static final Logger LOG = Logger.getLogger(GameStreamService.class);

    static final String GATEWAY_DISABLED = "no gateway connected";
    static final String INVALID_INPUT = "invalid input";
    static final String INVALID_GAME = "invalid game selected";
    static final String SESSION_FAILED = "failed to create session";
    static final String COMMUNICATION_FAILED = "failed to communicate with gateway";
    static final String INVALID_RESPONSE = "received invalid response from gateway";
    static final String GATEWAY_UNAVAILABLE = "gateway unavailable";

    private static final String GAME_FIELD = "game";
    private static final int SESSION_CREATED = 201;
    private static final int APPLICATIONS_LISTED = 200;

    private final GatewayCredentials credentials;
    private final GatewayClient gatewayClient;
    private final Metrics metrics;

    @Inject
    public GameStreamService(GatewayCredentials credentials, GatewayClient gatewayClient, Metrics metrics) {
        this.credentials = credentials;
        this.gatewayClient = gatewayClient;
        this.metrics = metrics;
    }

    @Override
    public Uni<GatewayResult<JsonNode>> createSession(Optional<JsonNode> body) {
        if (!credentials.enabled()) {
            return complete("create_session", new GatewayResult.GatewayDisabled<>(GATEWAY_DISABLED));
        }

        if (body.isEmpty() || !body.get().isObject() || body.get().isEmpty()) {
            return complete("create_session", new GatewayResult.InvalidInput<>(INVALID_INPUT));
        }

        var game = body.get().get(GAME_FIELD);
        if (game == null || !game.isTextual() || game.asText().isEmpty()) {
            return complete("create_session", new GatewayResult.InvalidInput<>(INVALID_GAME));
        }

        var request = GatewaySessionRequest.forGame(game.asText());
        LOG.debugv("Creating session for {0}", request.app());

        return gatewayClient
                .createSession(request)
                .map(this::toSessionResult)
                .onFailure(GatewayUnavailableException.class)
                .recoverWithItem(this::unavailable)
                .invoke(result -> metrics.recordResult("create_session", result));
    }

    @Override
    public Uni<GatewayResult<List<ApplicationSummary>>> listGames() {
        if (!credentials.enabled()) {
            return complete("list_games", new GatewayResult.GatewayDisabled<>(GATEWAY_DISABLED));
        }

        return gatewayClient
                .listApplications()
                .map(this::toGameListResult)
                .onFailure(GatewayUnavailableException.class)
                .recoverWithItem(this::unavailable)
                .invoke(result -> metrics.recordResult("list_games", result));
    }

    private GatewayResult<JsonNode> toSessionResult(GatewayResponse response) {
        if (!response.hasStatus(SESSION_CREATED)) {
            LOG.warnv("Gateway refused session: status_code={0}", describeStatus(response));
            return new GatewayResult.UpstreamFailure<>(SESSION_FAILED);
        }

        if (response.metadata().isEmpty()) {
            LOG.warn("Gateway created a session but returned no metadata");
            return new GatewayResult.UpstreamFailure<>(INVALID_RESPONSE);
        }

        return new GatewayResult.Success<>(response.metadata().get());
    }

    private GatewayResult<List<ApplicationSummary>> toGameListResult(GatewayResponse response) {
        if (!response.hasStatus(APPLICATIONS_LISTED)) {
            LOG.warnv("Gateway refused application listing: status_code={0}", describeStatus(response));
            return new GatewayResult.UpstreamFailure<>(COMMUNICATION_FAILED);
        }

        var metadata = response.metadata();
        if (metadata.isEmpty() || !metadata.get().isArray()) {
            LOG.warn("Gateway application listing has no metadata array");
            return new GatewayResult.UpstreamFailure<>(INVALID_RESPONSE);
        }

        var applications = ApplicationSummary.fromMetadata(metadata.get());
        if (applications.size() < metadata.get().size()) {
            // Entries without a scalar name are dropped
            LOG.debugv("Skipped {0} applications without a name", metadata.get().size() - applications.size());
        }
        return new GatewayResult.Success<>(applications);
    }

    private <T> GatewayResult<T> unavailable(Throwable error) {
        LOG.warnv("Gateway unavailable: {0}", error.getMessage());
        return new GatewayResult.UpstreamUnavailable<>(GATEWAY_UNAVAILABLE);
    }

    private <T> Uni<GatewayResult<T>> complete(String operation, GatewayResult<T> result) {
        metrics.recordResult(operation, result);
        return Uni.createFrom().item(result);
    }

    private static String describeStatus(GatewayResponse response) {
        return response.statusCode().isPresent() ? String.valueOf(response.statusCode().getAsInt()) : "<missing>";
    }
}
