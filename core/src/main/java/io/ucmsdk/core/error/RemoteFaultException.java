package io.ucmsdk.core.error;

/**
 * Thrown when the server answers with a SOAP fault or an HTTP error body.
 * Mirrors the fields of a SOAP 1.1 fault: code, string and detail.
 */
public final class RemoteFaultException extends TransportException {

    private static final long serialVersionUID = 1L;

    private final String faultCode;
    private final String faultString;
    private final String detail;

    public RemoteFaultException(String faultCode, String faultString, String detail) {
        super(faultString, null, null);
        this.faultCode = faultCode;
        this.faultString = faultString;
        this.detail = detail;
    }

    private RemoteFaultException(RemoteFaultException original, String operation, String apiVersion) {
        super(contextMessage(original.getMessage(), operation, apiVersion), original, operation, apiVersion);
        this.faultCode = original.faultCode;
        this.faultString = original.faultString;
        this.detail = original.detail;
    }

    /** The fault code, e.g. {@code soapenv:Server} or an HTTP status. */
    public String faultCode() {
        return faultCode;
    }

    /** The server's human-readable fault description. */
    public String faultString() {
        return faultString;
    }

    /** Raw fault detail, or {@code null}. */
    public String faultDetail() {
        return detail;
    }

    @Override
    public RemoteFaultException withContext(String operation, String apiVersion) {
        return new RemoteFaultException(this, operation, apiVersion);
    }
}
