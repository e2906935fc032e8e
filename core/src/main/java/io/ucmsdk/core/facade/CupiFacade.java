package io.ucmsdk.core.facade;

import io.ucmsdk.core.engine.NormalizedResponse;
import io.ucmsdk.core.model.Backend;
import io.ucmsdk.core.schema.SchemaCatalog;
import io.ucmsdk.core.spi.ApiTransport;
import io.ucmsdk.core.spi.TelemetryListener;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Unity Connection user administration over CUPI. Operation names map to REST
 * resources in the transport: {@code getUser} to {@code GET users?query=},
 * {@code updatePin} to {@code PUT users/{objectId}/credential/pin} and
 * {@code updateDtmfAccessId} to {@code PUT users/{objectId}}.
 */
public final class CupiFacade extends ApiFacade {

    public CupiFacade(SchemaCatalog catalog, String apiVersion, ApiTransport transport) {
        this(catalog, apiVersion, transport, FacadeOptions.DEFAULT, null);
    }

    public CupiFacade(
            SchemaCatalog catalog,
            String apiVersion,
            ApiTransport transport,
            FacadeOptions options,
            TelemetryListener telemetryListener) {
        super(Backend.CUPI, catalog, apiVersion, transport, options, telemetryListener);
    }

    public NormalizedResponse getUser(String alias) {
        return call("getUser", Map.of("alias", Objects.requireNonNull(alias, "alias must not be null").trim()));
    }

    public NormalizedResponse updatePin(String objectId, String pin, boolean mustChange) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("objectId", Objects.requireNonNull(objectId, "objectId must not be null"));
        args.put("Credentials", Objects.requireNonNull(pin, "pin must not be null"));
        args.put("CredMustChange", mustChange);
        return call("updatePin", args);
    }

    public NormalizedResponse updateDtmfAccessId(String objectId, String dtmfAccessId) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("objectId", Objects.requireNonNull(objectId, "objectId must not be null"));
        args.put("DtmfAccessId", Objects.requireNonNull(dtmfAccessId, "dtmfAccessId must not be null"));
        return call("updateDtmfAccessId", args);
    }
}
