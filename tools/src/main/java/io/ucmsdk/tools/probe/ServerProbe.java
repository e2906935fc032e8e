package io.ucmsdk.tools.probe;

import io.ucmsdk.core.model.ApiVersion;
import io.ucmsdk.core.spi.CredentialProvider;
import io.ucmsdk.tools.config.ToolsConfig;
import java.io.IOException;
import java.io.StringReader;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Connectivity and authentication diagnostics for a CUCM server, built on the
 * JDK {@link HttpClient}.
 *
 * <p>
 * Each check issues one GET and classifies the result as a
 * {@link ProbeException.Kind}. {@link #diagnose()} runs them in order and
 * never throws.
 */
public final class ServerProbe {

    private static final Logger LOG = LoggerFactory.getLogger(ServerProbe.class);

    static final String STEP_SERVER = "server";
    static final String STEP_AXL_AUTH = "axl-auth";
    static final String STEP_VERSION = "version";

    /** Text on the CUCM landing page. */
    static final String UCM_MARKER = "Cisco Unified Communications Manager";

    private final HttpClient httpClient;
    private final URI baseUri;
    private final Duration readTimeout;
    private final CredentialProvider credentials;

    /**
     * @param config server address, credentials and timeouts
     * @throws IllegalStateException if no host is configured
     */
    public ServerProbe(ToolsConfig config) {
        this.baseUri = config.baseUri();
        this.readTimeout = config.readTimeout();
        this.credentials = config.hasCredentials() ? CredentialProvider.of(config.username(), config.password()) : null;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(config.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        LOG.debug("ServerProbe initialized: server={}", baseUri);
    }

    /**
     * Checks that the address serves the CUCM landing page.
     *
     * @throws ProbeException {@code NOT_UCM}, {@code UNREACHABLE},
     *                        {@code TIMEOUT} or {@code UNEXPECTED_STATUS}
     */
    public void checkServer() throws ProbeException {
        URI url = baseUri.resolve("/");
        HttpResponse<String> response = get(url, null);
        if (response.statusCode() != 200) {
            throw unexpectedStatus(url, response.statusCode());
        }
        String body = response.body();
        if (body == null || !body.contains(UCM_MARKER)) {
            throw new ProbeException(
                    ProbeException.Kind.NOT_UCM, url + " answered but is not a CUCM server", url);
        }
    }

    /**
     * Checks that the AXL service accepts the configured credentials.
     *
     * @throws ProbeException {@code INVALID_CREDENTIALS},
     *                        {@code SERVICE_NOT_FOUND}, {@code UNREACHABLE},
     *                        {@code TIMEOUT} or {@code UNEXPECTED_STATUS}
     */
    public void checkAxlAuth() throws ProbeException {
        URI url = baseUri.resolve("/axl/");
        if (credentials == null) {
            throw new ProbeException(
                    ProbeException.Kind.INVALID_CREDENTIALS,
                    "No credentials configured (server.username/server.password)",
                    url);
        }
        CredentialProvider.Credentials account = credentials.credentials();
        String token = Base64.getEncoder()
                .encodeToString((account.username() + ":" + account.password()).getBytes(StandardCharsets.UTF_8));
        HttpResponse<String> response = get(url, "Basic " + token);
        switch (response.statusCode()) {
            case 200:
                return;
            case 401:
                throw new ProbeException(
                        ProbeException.Kind.INVALID_CREDENTIALS,
                        "AXL rejected the credentials of user '" + account.username() + "'",
                        url);
            case 404:
                throw new ProbeException(
                        ProbeException.Kind.SERVICE_NOT_FOUND,
                        "AXL service not found at " + url + "; is the AXL web service activated?",
                        url);
            default:
                throw unexpectedStatus(url, response.statusCode());
        }
    }

    /**
     * Reads the server version from the UDS version document.
     *
     * @return the normalized {@code major.minor} version
     * @throws ProbeException {@code VERSION_UNREADABLE}, {@code UNREACHABLE},
     *                        {@code TIMEOUT} or {@code UNEXPECTED_STATUS}
     */
    public String detectVersion() throws ProbeException {
        URI url = baseUri.resolve("/cucm-uds/version");
        HttpResponse<String> response = get(url, null);
        if (response.statusCode() != 200) {
            throw unexpectedStatus(url, response.statusCode());
        }
        String raw = versionAttribute(url, response.body());
        if (!ApiVersion.isValid(raw)) {
            throw new ProbeException(
                    ProbeException.Kind.VERSION_UNREADABLE, "Unrecognized version '" + raw + "' at " + url, url);
        }
        String version = ApiVersion.normalize(raw);
        LOG.debug("Detected server version: raw={}, normalized={}", raw, version);
        return version;
    }

    /** Runs every check, skipping the rest once the server check fails. */
    public ProbeReport diagnose() {
        List<ProbeReport.Step> steps = new ArrayList<>();
        try {
            checkServer();
            steps.add(ProbeReport.Step.ok(STEP_SERVER, baseUri.toString()));
        } catch (ProbeException e) {
            LOG.debug("Server check failed: {}", e.getMessage(), e);
            steps.add(ProbeReport.Step.failed(STEP_SERVER, e));
            steps.add(ProbeReport.Step.skipped(STEP_AXL_AUTH, "server check failed"));
            steps.add(ProbeReport.Step.skipped(STEP_VERSION, "server check failed"));
            return new ProbeReport(steps);
        }
        try {
            checkAxlAuth();
            steps.add(ProbeReport.Step.ok(STEP_AXL_AUTH, credentials.credentials().username()));
        } catch (ProbeException e) {
            LOG.debug("AXL auth check failed: {}", e.getMessage(), e);
            steps.add(ProbeReport.Step.failed(STEP_AXL_AUTH, e));
        }
        try {
            steps.add(ProbeReport.Step.ok(STEP_VERSION, detectVersion()));
        } catch (ProbeException e) {
            LOG.debug("Version detection failed: {}", e.getMessage(), e);
            steps.add(ProbeReport.Step.failed(STEP_VERSION, e));
        }
        return new ProbeReport(steps);
    }

    private HttpResponse<String> get(URI url, String authorization) throws ProbeException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(url).timeout(readTimeout).GET();
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }
        LOG.debug("GET {}", url);
        try {
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            LOG.debug("GET {} -> {}", url, response.statusCode());
            return response;
        } catch (HttpConnectTimeoutException e) {
            throw new ProbeException(ProbeException.Kind.TIMEOUT, "Connect timeout to " + url, url, e);
        } catch (HttpTimeoutException e) {
            throw new ProbeException(ProbeException.Kind.TIMEOUT, "Read timeout from " + url, url, e);
        } catch (ConnectException e) {
            throw new ProbeException(ProbeException.Kind.UNREACHABLE, "Connection refused by " + url, url, e);
        } catch (IOException e) {
            throw new ProbeException(ProbeException.Kind.UNREACHABLE, "Failed to connect to " + url, url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProbeException(ProbeException.Kind.UNREACHABLE, "Interrupted while calling " + url, url, e);
        }
    }

    private static String versionAttribute(URI url, String body) throws ProbeException {
        if (body == null || body.isBlank()) {
            throw new ProbeException(ProbeException.Kind.VERSION_UNREADABLE, "Empty version document at " + url, url);
        }
        Element root;
        try {
            root = newDocumentBuilder().parse(new InputSource(new StringReader(body))).getDocumentElement();
        } catch (SAXException | IOException e) {
            throw new ProbeException(
                    ProbeException.Kind.VERSION_UNREADABLE, "Malformed version document at " + url, url, e);
        }
        String version = root.getAttribute("version");
        if (version.isBlank()) {
            throw new ProbeException(
                    ProbeException.Kind.VERSION_UNREADABLE,
                    "Version document at " + url + " has no 'version' attribute",
                    url);
        }
        return version.trim();
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    private static ProbeException unexpectedStatus(URI url, int status) {
        return new ProbeException(
                ProbeException.Kind.UNEXPECTED_STATUS, "Unexpected HTTP " + status + " from " + url, url);
    }
}
