package gamestream.adapter.out.telemetry;

/**
 * Constants for span attributes used in distributed tracing.
 *
 * <p>These follow OpenTelemetry semantic conventions where applicable.
 *
 * @see <a href="https://opentelemetry.io/docs/specs/semconv/">OpenTelemetry Semantic Conventions</a>
 */
public final class SpanAttributes {

    private SpanAttributes() {}

    /** HTTP method (GET, POST, etc.). */
    public static final String HTTP_METHOD = "http.method";

    /** Full URL of the HTTP request. */
    public static final String HTTP_URL = "http.url";

    /** HTTP response status code. */
    public static final String HTTP_STATUS_CODE = "http.status_code";
}
