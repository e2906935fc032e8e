package io.ucmsdk.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.ucmsdk.core.engine.SignatureVerifier;
import io.ucmsdk.core.engine.ValidationResult;
import io.ucmsdk.core.error.UcmSdkException;
import io.ucmsdk.core.model.Backend;
import io.ucmsdk.core.schema.SchemaCatalog;
import io.ucmsdk.core.spi.DirectorySchemaSourceResolver;
import io.ucmsdk.tools.config.ConfigLoadException;
import io.ucmsdk.tools.config.ConfigLoader;
import io.ucmsdk.tools.config.ToolsConfig;
import io.ucmsdk.tools.probe.ProbeException;
import io.ucmsdk.tools.probe.ProbeReport;
import io.ucmsdk.tools.probe.ServerProbe;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one command of the diagnostic console.
 *
 * <p>
 * Commands:
 * <ul>
 * <li>{@code operations}: lists the operations of the configured version</li>
 * <li>{@code tree <operation>...}: prints request and response trees</li>
 * <li>{@code verify <operation> <payload.json|yaml>}: checks a payload
 * against the operation's request schema and prints the verified form</li>
 * <li>{@code probe}: checks connectivity, AXL credentials and the server
 * version</li>
 * </ul>
 *
 * <p>
 * Configuration comes from {@code --config <path>}, else from
 * {@code ucm-sdk.yaml} in the working directory if present, else from the
 * environment alone. When no API version is configured the schema commands
 * ask the server.
 *
 * <p>
 * This class is separate from {@link ToolsMain} so that tests can run commands
 * without going through {@code main()}.
 */
public final class ToolsApp {

    private static final Logger LOG = LoggerFactory.getLogger(ToolsApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(
            "\n",
            "Usage: ucm-sdk-tools [--config <path>] <command> [arguments]",
            "",
            "Commands:",
            "  operations                          list operations of the configured API version",
            "  tree <operation>...                 print request and response trees",
            "  verify <operation> <payload-file>   check a JSON or YAML payload against the request schema",
            "  probe                               check server, AXL credentials and version",
            "");

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final PrintStream out;
    private final PrintStream err;
    private final Function<String, String> envLookup;

    public ToolsApp() {
        this(System.out, System.err, System::getenv);
    }

    ToolsApp(PrintStream out, PrintStream err, Function<String, String> envLookup) {
        this.out = out;
        this.err = err;
        this.envLookup = envLookup;
    }

    /**
     * Runs a command.
     *
     * @param args command-line arguments
     * @return the process exit code: {@code 0} on success, {@code 1} on
     *         failure, {@code 2} on a usage error
     */
    public int run(String[] args) {
        List<String> command;
        ToolsConfig config;
        try {
            command = stripConfigOption(args);
            if (command.isEmpty()) {
                err.print(USAGE);
                return EXIT_USAGE;
            }
            config = loadConfig(args);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.print(USAGE);
            return EXIT_USAGE;
        } catch (ConfigLoadException e) {
            err.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.debug("Configuration: {}", config);

        String name = command.get(0);
        List<String> params = command.subList(1, command.size());
        try {
            switch (name) {
                case "operations":
                    return expectArgs(name, params, 0, 0) ? operations(config) : EXIT_USAGE;
                case "tree":
                    return expectArgs(name, params, 1, Integer.MAX_VALUE) ? tree(config, params) : EXIT_USAGE;
                case "verify":
                    return expectArgs(name, params, 2, 2) ? verify(config, params.get(0), Path.of(params.get(1)))
                            : EXIT_USAGE;
                case "probe":
                    return expectArgs(name, params, 0, 0) ? probe(config) : EXIT_USAGE;
                default:
                    err.println("error: unknown command '" + name + "'");
                    err.print(USAGE);
                    return EXIT_USAGE;
            }
        } catch (UcmSdkException | ProbeException | IllegalStateException e) {
            LOG.debug("Command {} failed", name, e);
            err.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int operations(ToolsConfig config) throws ProbeException {
        SchemaCatalog catalog = catalog(config);
        String version = catalog.ensureVersion(apiVersion(config));
        for (String operation : catalog.current().operations(version)) {
            out.println(operation);
        }
        return EXIT_OK;
    }

    private int tree(ToolsConfig config, List<String> operations) throws ProbeException {
        SchemaCatalog catalog = catalog(config);
        String version = catalog.ensureVersion(apiVersion(config));
        SchemaTreePrinter printer = new SchemaTreePrinter();
        for (String operation : operations) {
            out.print(printer.render(catalog.lookup(operation, version)));
        }
        return EXIT_OK;
    }

    private int verify(ToolsConfig config, String operation, Path payloadFile) throws ProbeException {
        JsonNode payload = readPayload(payloadFile);
        SchemaCatalog catalog = catalog(config);
        String version = catalog.ensureVersion(apiVersion(config));
        ValidationResult result = new SignatureVerifier().verify(catalog.lookup(operation, version), payload);
        if (!result.isValid()) {
            err.println("invalid: " + result.error().getMessage());
            return EXIT_FAILURE;
        }
        out.println(writeJson(result.payload().toJson()));
        return EXIT_OK;
    }

    private int probe(ToolsConfig config) {
        ProbeReport report = new ServerProbe(config).diagnose();
        for (ProbeReport.Step step : report.steps()) {
            out.printf(
                    Locale.ROOT,
                    "%-9s %-7s %s%n",
                    step.name(),
                    step.status(),
                    step.kind() != null ? step.kind() + ": " + step.detail() : step.detail());
        }
        return report.isHealthy() ? EXIT_OK : EXIT_FAILURE;
    }

    private SchemaCatalog catalog(ToolsConfig config) {
        Path schemaDir = Path.of(config.schemaDir());
        if (!Files.isDirectory(schemaDir)) {
            throw new IllegalStateException("Schema directory not found: " + schemaDir.toAbsolutePath());
        }
        return new SchemaCatalog(Backend.AXL, new DirectorySchemaSourceResolver(schemaDir));
    }

    /** The configured version, or the one the server reports. */
    private static String apiVersion(ToolsConfig config) throws ProbeException {
        if (config.apiVersion() != null && !config.apiVersion().isBlank()) {
            return config.apiVersion();
        }
        if (config.host() == null || config.host().isBlank()) {
            throw new IllegalStateException(
                    "No API version configured (server.api-version or UCM_API_VERSION) and no server to ask");
        }
        String version = new ServerProbe(config).detectVersion();
        LOG.info("Using server-reported API version {}", version);
        return version;
    }

    private static JsonNode readPayload(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalStateException("Payload file not found: " + file);
        }
        String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = fileName.endsWith(".json") ? JSON_MAPPER : YAML_MAPPER;
        try {
            JsonNode node = mapper.readTree(file.toFile());
            return node == null ? mapper.createObjectNode() : node;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read payload " + file + ": " + e.getMessage(), e);
        }
    }

    private static String writeJson(JsonNode node) {
        try {
            return JSON_MAPPER.writeValueAsString(node);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to render JSON: " + e.getMessage(), e);
        }
    }

    private boolean expectArgs(String command, List<String> params, int min, int max) {
        if (params.size() >= min && params.size() <= max) {
            return true;
        }
        err.println("error: wrong number of arguments for '" + command + "'");
        err.print(USAGE);
        return false;
    }

    private ToolsConfig loadConfig(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        if (!hasConfigOption(args) && !Files.exists(configPath)) {
            LOG.debug("No {} found, using environment only", configPath);
            return ConfigLoader.fromEnvironment(envLookup);
        }
        return ConfigLoader.load(configPath, envLookup);
    }

    private static boolean hasConfigOption(String[] args) {
        for (String arg : args) {
            if ("--config".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> stripConfigOption(String[] args) {
        List<String> command = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                i++;
            } else {
                command.add(args[i]);
            }
        }
        return command;
    }
}
