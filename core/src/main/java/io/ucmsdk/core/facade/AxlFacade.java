package io.ucmsdk.core.facade;

import io.ucmsdk.core.engine.NormalizedResponse;
import io.ucmsdk.core.engine.ReturnTagResolver;
import io.ucmsdk.core.model.Backend;
import io.ucmsdk.core.schema.SchemaCatalog;
import io.ucmsdk.core.spi.ApiTransport;
import io.ucmsdk.core.spi.TelemetryListener;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Named AXL operations over {@link #call}. Anything not covered here is
 * reachable through {@code call} directly, with the same checks.
 *
 * <p>
 * The {@code get} and {@code list} methods that take return tags resolve them
 * against the operation's {@code returnedTags} element first; an empty
 * collection asks for every tag.
 */
public final class AxlFacade extends ApiFacade {

    private final ReturnTagResolver returnTags = new ReturnTagResolver();

    public AxlFacade(SchemaCatalog catalog, String apiVersion, ApiTransport transport) {
        this(catalog, apiVersion, transport, FacadeOptions.DEFAULT, null);
    }

    public AxlFacade(
            SchemaCatalog catalog,
            String apiVersion,
            ApiTransport transport,
            FacadeOptions options,
            TelemetryListener telemetryListener) {
        super(Backend.AXL, catalog, apiVersion, transport, options, telemetryListener);
    }

    public NormalizedResponse getPhone(String name) {
        return call("getPhone", Map.of("name", Objects.requireNonNull(name, "name must not be null")));
    }

    public NormalizedResponse getPhone(String name, Collection<String> tags) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("name", Objects.requireNonNull(name, "name must not be null"));
        args.put(ReturnTagResolver.RETURNED_TAGS, returnTags.resolve(describe("getPhone"), tags));
        return call("getPhone", args);
    }

    /**
     * Lists phones matching the criteria, e.g. {@code {"name": "SEP%"}}.
     *
     * @param searchCriteria the {@code searchCriteria} element
     * @param tags           fields to return; empty for all
     */
    public NormalizedResponse listPhone(Map<String, ?> searchCriteria, Collection<String> tags) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("searchCriteria", Objects.requireNonNull(searchCriteria, "searchCriteria must not be null"));
        args.put(ReturnTagResolver.RETURNED_TAGS, returnTags.resolve(describe("listPhone"), tags));
        return call("listPhone", args);
    }

    /**
     * Lists every matching phone, {@code pageSize} at a time, so that large
     * clusters do not time out a single {@code listPhone} call.
     *
     * @param searchCriteria the {@code searchCriteria} element
     * @param tags           fields to return; empty for all
     * @param pageSize       phones requested per call
     * @return the {@code phone} items of every page, in order
     */
    public List<Object> listAllPhones(Map<String, ?> searchCriteria, Collection<String> tags, int pageSize) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("searchCriteria", Objects.requireNonNull(searchCriteria, "searchCriteria must not be null"));
        args.put(ReturnTagResolver.RETURNED_TAGS, returnTags.resolve(describe("listPhone"), tags));
        return listAll("listPhone", args, "return.phone", pageSize);
    }

    /** Adds a phone; {@code phone} is the {@code phone} element. */
    public NormalizedResponse addPhone(Map<String, ?> phone) {
        return call("addPhone", Map.of("phone", Objects.requireNonNull(phone, "phone must not be null")));
    }

    /** Updates a phone; {@code fields} are the top-level {@code updatePhone} arguments, including its key. */
    public NormalizedResponse updatePhone(Map<String, ?> fields) {
        return call("updatePhone", Objects.requireNonNull(fields, "fields must not be null"));
    }

    public NormalizedResponse removePhone(String name) {
        return call("removePhone", Map.of("name", Objects.requireNonNull(name, "name must not be null")));
    }

    public NormalizedResponse getUser(String userId) {
        return call("getUser", Map.of("userid", Objects.requireNonNull(userId, "userId must not be null")));
    }

    /**
     * @param pattern        the directory number
     * @param routePartition the route partition, or {@code null} to leave it
     *                       unset
     */
    public NormalizedResponse getLine(String pattern, String routePartition) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("pattern", Objects.requireNonNull(pattern, "pattern must not be null"));
        if (routePartition != null) {
            args.put("routePartitionName", routePartition);
        }
        return call("getLine", args);
    }

    /** Reads the server's full version string from {@code getCCMVersion}. */
    public NormalizedResponse getCcmVersion() {
        return call("getCCMVersion", Map.of());
    }

    /** Tags {@code getPhone} accepts for the bound version. */
    public List<String> phoneReturnTags() {
        return returnTags.validTags(describe("getPhone"));
    }
}
