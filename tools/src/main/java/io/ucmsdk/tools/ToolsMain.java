package io.ucmsdk.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the diagnostic console.
 *
 * <p>
 * Delegates to {@link ToolsApp#run(String[])} and exits with its status code.
 * An unexpected failure is logged and exits with {@code 1}.
 */
public final class ToolsMain {

    private static final Logger LOG = LoggerFactory.getLogger(ToolsMain.class);

    private ToolsMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g.
     *             {@code --config ucm-sdk.yaml tree getPhone})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            status = new ToolsApp().run(args);
        } catch (Exception e) {
            LOG.error("Command failed: {}", e.getMessage(), e);
            status = 1;
        }
        System.exit(status);
    }
}
