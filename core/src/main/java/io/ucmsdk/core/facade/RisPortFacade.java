package io.ucmsdk.core.facade;

import io.ucmsdk.core.engine.NormalizedResponse;
import io.ucmsdk.core.model.Backend;
import io.ucmsdk.core.schema.SchemaCatalog;
import io.ucmsdk.core.spi.ApiTransport;
import io.ucmsdk.core.spi.TelemetryListener;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Real-time device status over RisPort70. */
public final class RisPortFacade extends ApiFacade {

    public RisPortFacade(SchemaCatalog catalog, String apiVersion, ApiTransport transport) {
        this(catalog, apiVersion, transport, FacadeOptions.DEFAULT, null);
    }

    public RisPortFacade(
            SchemaCatalog catalog,
            String apiVersion,
            ApiTransport transport,
            FacadeOptions options,
            TelemetryListener telemetryListener) {
        super(Backend.RISPORT, catalog, apiVersion, transport, options, telemetryListener);
    }

    /**
     * Queries device registration state.
     *
     * @param stateInfo opaque paging token from a previous response, or
     *                  {@code null} for the first page
     * @param criteria  the {@code CmSelectionCriteria} element
     * @return the normalized {@code selectCmDeviceReturn}
     */
    public NormalizedResponse selectCmDevice(String stateInfo, Map<String, ?> criteria) {
        Map<String, Object> args = new LinkedHashMap<>();
        if (stateInfo != null) {
            args.put("StateInfo", stateInfo);
        }
        args.put("CmSelectionCriteria", Objects.requireNonNull(criteria, "criteria must not be null"));
        return call("selectCmDevice", args);
    }
}
