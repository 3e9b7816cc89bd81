// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.stx402.registry.probe;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.stx402.core.DebugLogger;
import sh.stx402.core.LogFormatter;
import sh.stx402.registry.store.ProbeData;

/**
 * {@link EndpointProber} over the JDK HTTP client.
 *
 * <p>
 * Sends {@code POST {}} first and falls back to {@code GET} when the POST is not
 * answered with 402. After a 402 to POST, an {@code OPTIONS} request reads the
 * {@code Allow} header into the supported methods. All requests share one deadline;
 * once it passes the probe reports a timeout and discards whatever was gathered.
 * Redirects are not followed.
 */
public final class HttpEndpointProber implements EndpointProber {

    private static final Logger log = LoggerFactory.getLogger(HttpEndpointProber.class);

    private static final int PAYMENT_REQUIRED = 402;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ProbeConfig config;
    private final HttpClient httpClient;
    private final Clock clock;

    public HttpEndpointProber(final ProbeConfig config) {
        this(config, Clock.systemUTC());
    }

    public HttpEndpointProber(final ProbeConfig config, final Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public ProbeResult probe(final String url) {
        return probe(url, config.timeout());
    }

    @Override
    public ProbeResult probe(final String url, final Duration timeout) {
        final long start = System.nanoTime();
        final Duration limit = timeout == null ? config.timeout() : timeout;
        final long deadline = start + limit.toNanos();

        final Optional<String> refused = config.blockPrivateTargets()
                ? ProbeTargetValidator.check(url)
                : schemeOnly(url);
        if (refused.isPresent()) {
            DebugLogger.logProbe(LogFormatter.formatProbeError(url, "INVALID_INPUT", refused.get(), micros(start)));
            return ProbeResult.rejected(refused.get());
        }

        try {
            final URI uri = URI.create(url);
            final HttpResponse<String> post = send(postRequest(uri, remaining(deadline)), deadline);
            final long responseTimeMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

            if (post.statusCode() != PAYMENT_REQUIRED) {
                final HttpResponse<String> get = send(getRequest(uri, remaining(deadline)), deadline);
                if (get.statusCode() != PAYMENT_REQUIRED) {
                    DebugLogger.logProbe(LogFormatter.formatProbe(url, post.statusCode(), false, micros(start)));
                    return ProbeResult.notX402(post.statusCode());
                }
                final ProbeResult result = ProbeResult.x402(toProbeData(get.body(), responseTimeMs, List.of("GET"), true));
                DebugLogger.logProbe(LogFormatter.formatProbe(url, get.statusCode(), true, micros(start)));
                return result;
            }

            final List<String> methods = discoverMethods(uri, deadline);
            final ProbeResult result = ProbeResult.x402(toProbeData(post.body(), responseTimeMs, methods, false));
            DebugLogger.logProbe(LogFormatter.formatProbe(url, post.statusCode(), true, micros(start)));
            return result;
        } catch (HttpTimeoutException | DeadlineExceeded e) {
            DebugLogger.logProbe(LogFormatter.formatProbeError(url, "PROBE_TIMEOUT", ProbeResult.TIMEOUT_MESSAGE, micros(start)));
            log.debug("Probe of {} timed out after {}", url, limit);
            return ProbeResult.timeout();
        } catch (ConnectException e) {
            return unreachable(url, "Connection refused", start);
        } catch (IOException e) {
            return unreachable(url, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), start);
        } catch (IllegalArgumentException e) {
            return ProbeResult.rejected("Invalid URL format");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return unreachable(url, "Probe interrupted", start);
        }
    }

    private List<String> discoverMethods(final URI uri, final long deadline)
            throws DeadlineExceeded, InterruptedException {
        try {
            final HttpResponse<String> options = send(HttpRequest.newBuilder(uri)
                    .timeout(remaining(deadline))
                    .header("User-Agent", config.userAgent())
                    .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
                    .build(), deadline);
            final Optional<String> allow = options.headers().firstValue("Allow");
            if (allow.isPresent() && !allow.get().isBlank()) {
                return Arrays.stream(allow.get().split(","))
                        .map(m -> m.trim().toUpperCase(Locale.ROOT))
                        .filter(m -> !m.isEmpty())
                        .toList();
            }
        } catch (DeadlineExceeded e) {
            throw e;
        } catch (IOException e) {
            log.debug("OPTIONS {} failed, assuming POST only: {}", uri, e.getMessage());
        }
        return List.of("POST");
    }

    private ProbeData toProbeData(
            final String body, final long responseTimeMs, final List<String> methods, final boolean keepBody) {
        final String probedAt = clock.instant().toString();
        final JsonNode json = parseBody(body);
        if (json == null) {
            return new ProbeData("", List.of(), Map.of(), responseTimeMs, methods, null, probedAt);
        }
        final Optional<PaymentRequirementsParser.PaymentRequirements> requirements = PaymentRequirementsParser.parse(json);
        JsonNode schema = null;
        if (json.isObject() && (keepBody || json.has("schema") || json.has("openapi") || json.has("swagger"))) {
            schema = json;
        }
        return new ProbeData(
                requirements.map(PaymentRequirementsParser.PaymentRequirements::paymentAddress).orElse(""),
                requirements.map(PaymentRequirementsParser.PaymentRequirements::acceptedTokens).orElse(List.of()),
                requirements.map(PaymentRequirementsParser.PaymentRequirements::prices).orElse(Map.of()),
                responseTimeMs,
                methods,
                schema,
                probedAt);
    }

    private static JsonNode parseBody(final String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("402 body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private HttpRequest postRequest(final URI uri, final Duration timeout) {
        return HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .header("User-Agent", config.userAgent())
                .POST(HttpRequest.BodyPublishers.ofString("{}"))
                .build();
    }

    private HttpRequest getRequest(final URI uri, final Duration timeout) {
        return HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("User-Agent", config.userAgent())
                .GET()
                .build();
    }

    /**
     * Sends a request and reads its body, both within the probe deadline. The
     * request's own timeout only bounds the wait for response headers.
     */
    private HttpResponse<String> send(final HttpRequest request, final long deadline)
            throws IOException, InterruptedException {
        final long waitNanos = remaining(deadline).toNanos();
        final CompletableFuture<HttpResponse<String>> response =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        try {
            return response.get(waitNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            response.cancel(true);
            throw new DeadlineExceeded();
        } catch (InterruptedException e) {
            response.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IOException(cause);
        }
    }

    private ProbeResult unreachable(final String url, final String message, final long start) {
        DebugLogger.logProbe(LogFormatter.formatProbeError(url, "PROBE_UNREACHABLE", message, micros(start)));
        log.debug("Probe of {} failed: {}", url, message);
        return ProbeResult.unreachable(message);
    }

    private static Duration remaining(final long deadline) throws DeadlineExceeded {
        final long left = deadline - System.nanoTime();
        if (left <= 0) {
            throw new DeadlineExceeded();
        }
        return Duration.ofNanos(left);
    }

    private static Optional<String> schemeOnly(final String url) {
        final Optional<String> result = ProbeTargetValidator.check(url);
        return result.filter(reason -> reason.startsWith("URL must") || reason.startsWith("Invalid URL"));
    }

    private static long micros(final long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000L;
    }

    /** The shared probe deadline passed between requests. */
    private static final class DeadlineExceeded extends IOException {
        private static final long serialVersionUID = 1L;

        DeadlineExceeded() {
            super("probe deadline exceeded");
        }
    }
}
