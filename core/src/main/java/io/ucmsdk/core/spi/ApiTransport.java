package io.ucmsdk.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.ucmsdk.core.engine.RequestPayload;
import io.ucmsdk.core.error.TransportException;

/**
 * Executes a verified remote call. Implementations own the wire protocol
 * (SOAP envelopes for AXL and RisPort, REST for CUPI and UDS), the
 * {@link CredentialProvider} and every connection concern; the facades only
 * hand over a verified payload and normalize what comes back.
 *
 * <p>
 * Calls are synchronous. Failures must be reported as one of the concrete
 * {@link TransportException} types so that callers can tell connection,
 * authentication and remote faults apart.
 */
@FunctionalInterface
public interface ApiTransport {

    /**
     * Sends one call.
     *
     * @param operation  remote operation name
     * @param apiVersion normalized API version
     * @param payload    the verified request; see {@link RequestPayload#toJson()}
     * @return the raw response body as a JSON tree, or {@code null} for an
     *         empty response
     * @throws TransportException if the call could not be completed
     */
    JsonNode send(String operation, String apiVersion, RequestPayload payload) throws TransportException;
}
