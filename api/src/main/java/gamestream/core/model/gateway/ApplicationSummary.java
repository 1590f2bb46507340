package gamestream.core.model.gateway;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An application registered on the gateway, reduced to the name clients can launch.
 */
public record ApplicationSummary(String name) {

    private static final String NAME_FIELD = "name";

    /**
     * Extract applications from the {@code metadata} array of an application listing.
     *
     * <p>Entries without a scalar {@code name} are skipped. Order is preserved and
     * duplicates are kept.
     */
    public static List<ApplicationSummary> fromMetadata(JsonNode metadata) {
        var applications = new ArrayList<ApplicationSummary>();
        for (var entry : metadata) {
            var name = entry.isObject() ? entry.get(NAME_FIELD) : null;
            if (name != null && name.isValueNode() && !name.isNull()) {
                applications.add(new ApplicationSummary(name.asText()));
            }
        }
        return applications;
    }
}
