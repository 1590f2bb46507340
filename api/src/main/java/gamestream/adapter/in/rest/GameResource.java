package gamestream.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import gamestream.core.model.gateway.ApplicationSummary;
import gamestream.core.port.in.GameCatalogUseCase;

/**
 * Lists the games available for streaming.
 *
 * <p>{@code GET /1.0/games} answers with a JSON array of application names.
 */
@Path("/1.0/games")
@ApplicationScoped
public class GameResource {

    private final GameCatalogUseCase gameCatalogUseCase;

    @Inject
    public GameResource(GameCatalogUseCase gameCatalogUseCase) {
        this.gameCatalogUseCase = gameCatalogUseCase;
    }

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<Response> listGames() {
        return gameCatalogUseCase.listGames().map(result -> GatewayResults.toResponse(result, GameResource::names));
    }

    private static List<String> names(List<ApplicationSummary> applications) {
        return applications.stream().map(ApplicationSummary::name).toList();
    }
}
