package gamestream.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.Function;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.smallrye.config.PropertiesConfigSource;
import org.eclipse.microprofile.config.spi.ConfigSource;
import org.eclipse.microprofile.config.spi.ConfigSourceProvider;

/**
 * Loads the appliance config file written by the snap configure hook.
 *
 * <p>The file is located through the environment:
 * <ol>
 *   <li>{@code CONFIG_PATH} if set, which must point to a readable file</li>
 *   <li>otherwise {@code $SNAP_COMMON/service/config.yaml}, skipped if it does not exist yet</li>
 * </ol>
 *
 * <p>The snap writes short keys ({@code gateway-url}, {@code gateway-token}); these are
 * translated to {@code gamestream.gateway.*}. Other keys are passed through, nested maps
 * flattened with dots and sequences joined with commas, so any application property can
 * be set from the file.
 *
 * <p>The source sits at ordinal {@value #ORDINAL}: above {@code application.properties},
 * below environment variables and system properties.
 */
public class GatewayConfigFileSource implements ConfigSourceProvider {

    static final String CONFIG_PATH_ENV = "CONFIG_PATH";
    static final String SNAP_COMMON_ENV = "SNAP_COMMON";
    static final int ORDINAL = 260;

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private static final Map<String, String> KEY_ALIASES = Map.of(
            "gateway-url", "gamestream.gateway.url",
            "gateway-token", "gamestream.gateway.token");

    private final Function<String, String> environment;

    public GatewayConfigFileSource() {
        this(System::getenv);
    }

    GatewayConfigFileSource(Function<String, String> environment) {
        this.environment = environment;
    }

    @Override
    public Iterable<ConfigSource> getConfigSources(ClassLoader forClassLoader) {
        return resolvePath().<Iterable<ConfigSource>>map(path -> List.of(load(path)))
                .orElse(List.of());
    }

    Optional<Path> resolvePath() {
        var explicit = environment.apply(CONFIG_PATH_ENV);
        if (explicit != null && !explicit.isBlank()) {
            return Optional.of(Path.of(explicit));
        }

        var snapCommon = environment.apply(SNAP_COMMON_ENV);
        if (snapCommon != null && !snapCommon.isBlank()) {
            var defaultPath = Path.of(snapCommon, "service", "config.yaml");
            // Not configured yet: the gateway simply stays disabled
            return Files.exists(defaultPath) ? Optional.of(defaultPath) : Optional.empty();
        }

        return Optional.empty();
    }

    ConfigSource load(Path path) {
        JsonNode document;
        try {
            document = YAML.readTree(path.toFile());
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read config file " + path + ": " + e.getMessage(), e);
        }

        var properties = new HashMap<String, String>();
        if (document != null && document.isObject()) {
            flatten("", document, properties);
        } else if (document != null && !document.isMissingNode() && !document.isNull()) {
            throw new IllegalStateException("Config file " + path + " must contain a YAML mapping");
        }

        return new PropertiesConfigSource(properties, "GatewayConfigFileSource[" + path + "]", ORDINAL);
    }

    private void flatten(String prefix, JsonNode node, Map<String, String> target) {
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            var key = prefix + entry.getKey();
            var value = entry.getValue();
            if (value.isObject()) {
                flatten(key + ".", value, target);
            } else if (!value.isNull()) {
                target.put(KEY_ALIASES.getOrDefault(key, key), render(value));
            }
        }
    }

    private static String render(JsonNode value) {
        if (!value.isArray()) {
            return value.asText();
        }
        var joined = new StringJoiner(",");
        value.forEach(element -> joined.add(element.asText()));
        return joined.toString();
    }
}
