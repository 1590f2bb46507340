package gamestream.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import gamestream.core.model.gateway.ApplicationSummary;
import gamestream.core.model.gateway.GatewayResult;

/**
 * Use case for listing the games that can be streamed.
 */
public interface GameCatalogUseCase {

    /**
     * List the applications registered on the gateway.
     *
     * @return the applications in gateway order, or the reason they could not be listed
     */
    Uni<GatewayResult<List<ApplicationSummary>>> listGames();
}
