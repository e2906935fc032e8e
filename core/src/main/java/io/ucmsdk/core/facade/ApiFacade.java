package io.ucmsdk.core.facade;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ucmsdk.core.engine.NormalizedResponse;
import io.ucmsdk.core.engine.RequestPayload;
import io.ucmsdk.core.engine.ResponseNormalizer;
import io.ucmsdk.core.engine.SignatureVerifier;
import io.ucmsdk.core.error.ConnectionFailureException;
import io.ucmsdk.core.error.TransportException;
import io.ucmsdk.core.error.UcmSdkException;
import io.ucmsdk.core.model.Absent;
import io.ucmsdk.core.model.ApiVersion;
import io.ucmsdk.core.model.Backend;
import io.ucmsdk.core.model.OperationSchema;
import io.ucmsdk.core.schema.SchemaCatalog;
import io.ucmsdk.core.spi.ApiTransport;
import io.ucmsdk.core.spi.TelemetryListener;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for the per-backend facades. Binds a {@link SchemaCatalog}, an
 * {@link ApiTransport} and one API version, and runs every call through the
 * same pipeline: look up the schema, verify the arguments, send, normalize the
 * response.
 *
 * <p>
 * Validation failures are raised before the transport is touched. Transport
 * failures are rethrown as the same classified type with the operation and
 * version attached; calls are never retried. A transport that throws anything
 * other than a {@link TransportException} is reported as a
 * {@link ConnectionFailureException}.
 *
 * <p>
 * Thread-safe if the transport is.
 */
public abstract class ApiFacade {

    private static final Logger LOG = LoggerFactory.getLogger(ApiFacade.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final String SKIP = "skip";
    private static final String FIRST = "first";

    private final Backend backend;
    private final SchemaCatalog catalog;
    private final String apiVersion;
    private final ApiTransport transport;
    private final FacadeOptions options;
    private final TelemetryListener telemetryListener;
    private final SignatureVerifier verifier;
    private final ResponseNormalizer normalizer;

    /**
     * @param backend           the backend this facade talks to
     * @param catalog           schemas for the backend; must be bound to the
     *                          same backend
     * @param apiVersion        the server's API version, raw or normalized
     * @param transport         executes the calls
     * @param options           verification and normalization switches
     * @param telemetryListener call lifecycle listener, or {@code null}
     */
    protected ApiFacade(
            Backend backend,
            SchemaCatalog catalog,
            String apiVersion,
            ApiTransport transport,
            FacadeOptions options,
            TelemetryListener telemetryListener) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        if (catalog.backend() != backend) {
            throw new IllegalArgumentException("Catalog holds " + catalog.backend().displayName()
                    + " schemas, not " + backend.displayName());
        }
        this.apiVersion = ApiVersion.normalize(apiVersion);
        this.telemetryListener = telemetryListener;
        this.verifier = new SignatureVerifier();
        this.normalizer = new ResponseNormalizer(options.strictEnums());
    }

    public Backend backend() {
        return backend;
    }

    /** The normalized API version this facade is bound to. */
    public String apiVersion() {
        return apiVersion;
    }

    public FacadeOptions options() {
        return options;
    }

    /** Operation names the loaded schema defines for the bound version, sorted. */
    public Set<String> operations() {
        return catalog.current().operations(apiVersion);
    }

    /**
     * Returns the schema of an operation.
     *
     * @throws io.ucmsdk.core.error.UnknownOperationException if the operation
     *                                                        is not defined
     */
    public OperationSchema describe(String operation) {
        return catalog.lookup(operation, apiVersion);
    }

    /**
     * Calls an operation.
     *
     * @param operation the remote operation
     * @param args      field name to value; {@code null} for none
     * @return the normalized response
     * @throws io.ucmsdk.core.error.ArgumentValidationException if the arguments
     *                                                          do not fit the
     *                                                          schema
     * @throws TransportException                               if the call
     *                                                          fails
     */
    public NormalizedResponse call(String operation, Map<String, ?> args) {
        return execute(operation, schema -> options.verifyArguments()
                ? verifier.verify(schema, args).payloadOrThrow()
                : RequestPayload.unverified(operation, apiVersion, args));
    }

    /**
     * Calls an operation with arguments given as a JSON object.
     *
     * @see #call(String, Map)
     */
    public NormalizedResponse call(String operation, JsonNode args) {
        return execute(operation, schema -> {
            if (options.verifyArguments()) {
                return verifier.verify(schema, args).payloadOrThrow();
            }
            Map<String, Object> plain = args != null && args.isObject() ? MAPPER.convertValue(args, MAP_TYPE) : Map.of();
            return RequestPayload.unverified(operation, apiVersion, plain);
        });
    }

    /**
     * Calls a list operation page by page through its {@code skip} and
     * {@code first} arguments and joins the items found at {@code itemsPath}.
     * Stops at the first page with fewer than {@code pageSize} items. A failed
     * page fails the whole listing.
     *
     * @param operation a list operation with {@code skip} and {@code first}
     * @param args      the other arguments, e.g. {@code searchCriteria}
     * @param itemsPath dotted path to the repeated items, e.g.
     *                  {@code return.phone}
     * @param pageSize  items requested per call
     * @return every item, in server order
     * @throws IllegalArgumentException if the operation cannot be paged or
     *                                  {@code args} already sets {@code skip}
     *                                  or {@code first}
     */
    public List<Object> listAll(String operation, Map<String, ?> args, String itemsPath, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive, got " + pageSize);
        }
        OperationSchema schema = describe(operation);
        if (!schema.request().hasChild(SKIP) || !schema.request().hasChild(FIRST)) {
            throw new IllegalArgumentException(schema.key() + " cannot be paged: it takes no skip/first arguments");
        }
        Map<String, Object> pageArgs = new LinkedHashMap<>();
        if (args != null) {
            if (args.containsKey(SKIP) || args.containsKey(FIRST)) {
                throw new IllegalArgumentException("skip and first are set per page and must not be supplied");
            }
            pageArgs.putAll(args);
        }

        List<Object> items = new ArrayList<>();
        int skip = 0;
        while (true) {
            pageArgs.put(SKIP, skip);
            pageArgs.put(FIRST, pageSize);
            List<?> page = itemsOf(call(operation, pageArgs).find(itemsPath));
            items.addAll(page);
            LOG.debug(
                    "list.page backend={} operation={} version={} skip={} items={}",
                    backend.displayName(),
                    operation,
                    apiVersion,
                    skip,
                    page.size());
            if (page.size() < pageSize) {
                return Collections.unmodifiableList(items);
            }
            skip += pageSize;
        }
    }

    private static List<?> itemsOf(Object found) {
        if (found == null || Absent.is(found)) {
            return List.of();
        }
        return found instanceof List<?> list ? list : List.of(found);
    }

    private NormalizedResponse execute(String operation, Function<OperationSchema, RequestPayload> prepare) {
        long start = System.nanoTime();
        notifyStarted(operation);
        try {
            OperationSchema schema = describe(operation);
            RequestPayload payload = prepare.apply(schema);
            LOG.debug(
                    "call.sending backend={} operation={} version={} verified={}",
                    backend.displayName(),
                    operation,
                    apiVersion,
                    payload.isVerified());

            JsonNode raw;
            try {
                raw = transport.send(operation, apiVersion, payload);
            } catch (TransportException e) {
                throw e.withContext(operation, apiVersion);
            } catch (RuntimeException e) {
                throw new ConnectionFailureException("Transport failed unexpectedly: " + e, e, null)
                        .withContext(operation, apiVersion);
            }

            NormalizedResponse response = options.normalizeResponses()
                    ? normalizer.normalize(schema, raw)
                    : NormalizedResponse.unnormalized(operation, apiVersion, raw);
            long durationMs = elapsedMs(start);
            LOG.debug(
                    "call.completed backend={} operation={} version={} duration_ms={}",
                    backend.displayName(),
                    operation,
                    apiVersion,
                    durationMs);
            notifyCompleted(operation, durationMs);
            return response;
        } catch (UcmSdkException e) {
            long durationMs = elapsedMs(start);
            LOG.debug(
                    "call.failed backend={} operation={} version={} phase={} error={}",
                    backend.displayName(),
                    operation,
                    apiVersion,
                    e.phase(),
                    e.getMessage());
            notifyFailed(operation, durationMs, e.phase().name(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            long durationMs = elapsedMs(start);
            LOG.warn(
                    "call.failed backend={} operation={} version={} phase=INTERNAL",
                    backend.displayName(),
                    operation,
                    apiVersion,
                    e);
            notifyFailed(operation, durationMs, "INTERNAL", String.valueOf(e));
            throw e;
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    // --- Telemetry notification helpers ---
    // Listener exceptions are caught and logged; they never affect the call.

    private void notifyStarted(String operation) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onCallStarted(new TelemetryListener.CallStartedEvent(backend, operation, apiVersion));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onCallStarted failed", e);
        }
    }

    private void notifyCompleted(String operation, long durationMs) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onCallCompleted(
                    new TelemetryListener.CallCompletedEvent(backend, operation, apiVersion, durationMs));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onCallCompleted failed", e);
        }
    }

    private void notifyFailed(String operation, long durationMs, String phase, String detail) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onCallFailed(
                    new TelemetryListener.CallFailedEvent(backend, operation, apiVersion, durationMs, phase, detail));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onCallFailed failed", e);
        }
    }
}
