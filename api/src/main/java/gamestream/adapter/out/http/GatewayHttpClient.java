package gamestream.adapter.out.http;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.context.propagation.TextMapSetter;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpMethod;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import gamestream.adapter.out.telemetry.SpanAttributes;
import gamestream.config.GatewayConfig;
import gamestream.core.model.gateway.GatewayCallResponse;
import gamestream.core.model.gateway.GatewayCredentials;
import gamestream.core.model.gateway.GatewayResponse;
import gamestream.core.model.gateway.GatewaySessionRequest;
import gamestream.core.model.gateway.GatewayUnavailableException;
import gamestream.core.port.out.GatewayClient;
import gamestream.core.port.out.Metrics;

/**
 * HTTP adapter for the upstream gateway using Vert.x WebClient.
 *
 * <p>One WebClient, and so one connection pool, is shared by all requests. Each attempt
 * is bounded by the configured request timeout; safe methods are retried according to
 * {@link GatewayRetryPolicy}.
 *
 * <p>Certificate verification follows {@code gamestream.gateway.tls.trust-all}, which
 * defaults to {@code true} for self-signed gateway certificates.
 *
 * <p>This adapter propagates W3C Trace Context headers (traceparent, tracestate)
 * to the gateway for distributed tracing.
 */
@ApplicationScoped
public class GatewayHttpClient implements GatewayClient {

    private static final Logger LOG = Logger.getLogger(GatewayHttpClient.class);

    static final String SESSIONS_PATH = "/1.0/sessions";
    static final String APPLICATIONS_PATH = "/1.0/applications/";

    private static final String AUTHORIZATION = "Authorization";
    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";

    private static final TextMapSetter<HttpRequest<Buffer>> HEADER_SETTER =
            (carrier, key, value) -> carrier.putHeader(key, value);

    private final WebClient webClient;
    private final GatewayCredentials credentials;
    private final GatewayRetryPolicy retryPolicy;
    private final long requestTimeoutMs;
    private final ObjectMapper objectMapper;
    private final Metrics metrics;
    private final Tracer tracer;
    private final TextMapPropagator propagator;

    @Inject
    public GatewayHttpClient(
            Vertx vertx,
            GatewayConfig config,
            GatewayCredentials credentials,
            GatewayRetryPolicy retryPolicy,
            ObjectMapper objectMapper,
            Metrics metrics,
            Tracer tracer,
            TextMapPropagator propagator) {
        this.webClient = WebClient.create(vertx, clientOptions(config));
        this.credentials = credentials;
        this.retryPolicy = retryPolicy;
        this.requestTimeoutMs = config.requestTimeout().toMillis();
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.tracer = tracer;
        this.propagator = propagator;
    }

    private static WebClientOptions clientOptions(GatewayConfig config) {
        var trustAll = config.tls().trustAll();
        var options = new WebClientOptions();
        options.setFollowRedirects(false);
        options.setConnectTimeout((int) config.connectTimeout().toMillis());
        options.setTrustAll(trustAll);
        options.setVerifyHost(!trustAll);
        return options;
    }

    @PreDestroy
    void close() {
        webClient.close();
    }

    @Override
    public Uni<GatewayResponse> createSession(GatewaySessionRequest request) {
        return makeRequest("POST", SESSIONS_PATH, Map.of(CONTENT_TYPE, APPLICATION_JSON), request)
                .map(this::decode);
    }

    @Override
    public Uni<GatewayResponse> listApplications() {
        return makeRequest("GET", APPLICATIONS_PATH, Map.of(), null).map(this::decode);
    }

    @Override
    public Uni<GatewayCallResponse> makeRequest(
            String method, String path, Map<String, String> headers, Object body) {
        var normalizedMethod = method.toUpperCase(Locale.ROOT);
        var targetUrl = credentials.resolve(path);

        final byte[] payload;
        try {
            payload = encode(body);
        } catch (JsonProcessingException e) {
            return Uni.createFrom().failure(new IllegalStateException("Gateway request body is not serializable", e));
        }

        var outboundHeaders = outboundHeaders(headers);

        return sendWithRetry(normalizedMethod, path, targetUrl, outboundHeaders, payload)
                .onFailure(error -> !(error instanceof GatewayUnavailableException))
                .transform(error -> {
                    LOG.warnv("Gateway call {0} {1} failed: {2}", normalizedMethod, path, error.toString());
                    metrics.recordFailure(normalizedMethod, path, error.getClass().getSimpleName());
                    return new GatewayUnavailableException(
                            "Gateway call %s %s failed: %s".formatted(normalizedMethod, path, error.getMessage()),
                            error);
                });
    }

    /**
     * Caller headers with {@code Authorization} and {@code Content-Type} replaced, whatever
     * case the caller used for them.
     */
    private Map<String, String> outboundHeaders(Map<String, String> headers) {
        var outbound = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        outbound.putAll(headers);
        outbound.remove(AUTHORIZATION);
        outbound.remove(CONTENT_TYPE);
        outbound.put(AUTHORIZATION, credentials.authorizationHeader());
        outbound.put(CONTENT_TYPE, APPLICATION_JSON);
        return outbound;
    }

    /**
     * Sends the request, retrying through Mutiny's retry operator.
     *
     * <p>A retryable status is turned into a {@link RetryableStatusException} so the operator
     * sees it. When no retry is left, that failure is turned back into the last response.
     */
    private Uni<GatewayCallResponse> sendWithRetry(
            String method, String path, String targetUrl, Map<String, String> headers, byte[] payload) {
        return send(method, path, targetUrl, headers, payload)
                .onItem()
                .transformToUni(response -> retryPolicy.isRetryable(method, response.statusCode())
                        ? Uni.createFrom().<GatewayCallResponse>failure(new RetryableStatusException(response))
                        : Uni.createFrom().item(response))
                .onFailure()
                .retry()
                .when(failures -> retryDelays(method, path, failures))
                .onFailure(RetryableStatusException.class)
                .recoverWithItem(error -> ((RetryableStatusException) error).response());
    }

    private Multi<Long> retryDelays(String method, String path, Multi<Throwable> failures) {
        var retriesDone = new AtomicInteger();
        return failures.onItem().transformToUniAndConcatenate(failure -> {
            var retryable = failure instanceof RetryableStatusException || retryPolicy.isRetryable(method, failure);
            if (!retryable || !retryPolicy.hasRetriesLeft(retriesDone.get())) {
                return Uni.createFrom().<Long>failure(failure);
            }

            var retry = retriesDone.incrementAndGet();
            var delay = retryPolicy.backoff(retry);
            LOG.debugv(
                    "Retrying gateway call {0} {1} ({2}/{3}) in {4}: {5}",
                    method,
                    path,
                    retry,
                    retryPolicy.maxRetries(),
                    delay,
                    failure.getMessage());
            metrics.recordRetry(method, path, retry);

            return Uni.createFrom().item((long) retry).onItem().delayIt().by(delay);
        });
    }

    private Uni<GatewayCallResponse> send(
            String method, String path, String targetUrl, Map<String, String> headers, byte[] payload) {
        return Uni.createFrom().deferred(() -> {
            var startTime = System.nanoTime();

            var span = tracer.spanBuilder("HTTP " + method)
                    .setSpanKind(SpanKind.CLIENT)
                    .setAttribute(SpanAttributes.HTTP_METHOD, method)
                    .setAttribute(SpanAttributes.HTTP_URL, targetUrl)
                    .startSpan();

            var request = webClient.requestAbs(HttpMethod.valueOf(method), targetUrl).timeout(requestTimeoutMs);
            headers.forEach(request::putHeader);

            // Propagate trace context (W3C Trace Context headers)
            propagator.inject(Context.current().with(span), request, HEADER_SETTER);

            var sent = payload != null ? request.sendBuffer(Buffer.buffer(payload)) : request.send();
            return sent.map(this::toCallResponse)
                    .invoke(response -> {
                        var latencyMs = (System.nanoTime() - startTime) / 1_000_000;
                        metrics.recordGatewayCall(method, path, response.statusCode(), latencyMs);
                        span.setAttribute(SpanAttributes.HTTP_STATUS_CODE, (long) response.statusCode());
                        if (response.statusCode() >= 400) {
                            span.setStatus(StatusCode.ERROR, "HTTP " + response.statusCode());
                        }
                        span.end();
                    })
                    .onFailure()
                    .invoke(error -> {
                        span.setStatus(StatusCode.ERROR, String.valueOf(error.getMessage()));
                        span.recordException(error);
                        span.end();
                    })
                    .onCancellation()
                    .invoke(span::end);
        });
    }

    private byte[] encode(Object body) throws JsonProcessingException {
        if (body == null) {
            return null;
        }
        if (body instanceof byte[] raw) {
            return raw;
        }
        return objectMapper.writeValueAsBytes(body);
    }

    private GatewayCallResponse toCallResponse(HttpResponse<Buffer> response) {
        Map<String, List<String>> headers = new HashMap<>();

        for (var name : response.headers().names()) {
            headers.computeIfAbsent(name, k -> new ArrayList<>())
                    .addAll(response.headers().getAll(name));
        }

        var responseBody = response.body() != null ? response.body().getBytes() : new byte[0];

        return new GatewayCallResponse(response.statusCode(), headers, responseBody);
    }

    private static final class RetryableStatusException extends RuntimeException {

        private final transient GatewayCallResponse response;

        RetryableStatusException(GatewayCallResponse response) {
            super("status " + response.statusCode(), null, false, false);
            this.response = response;
        }

        GatewayCallResponse response() {
            return response;
        }
    }

    private GatewayResponse decode(GatewayCallResponse response) {
        if (response.body().length == 0) {
            LOG.warnv("Gateway answered HTTP {0} with an empty body", response.statusCode());
            return GatewayResponse.empty();
        }

        try {
            return GatewayResponse.fromJson(objectMapper.readTree(response.body()));
        } catch (IOException e) {
            LOG.warnv("Gateway answered HTTP {0} with a body that is not JSON: {1}", response.statusCode(), e.getMessage());
            return GatewayResponse.empty();
        }
    }
}
