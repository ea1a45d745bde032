package io.htmltpl.standalone;

import io.htmltpl.standalone.server.TemplateServerApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the standalone template server. Delegates to {@link
 * TemplateServerApp#start(String[])}; on failure logs the error and exits with status 1.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * @param args command-line arguments, e.g. {@code --config path/to/config.yaml}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            TemplateServerApp app = TemplateServerApp.start(args);
            Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "html-tpl-shutdown"));
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
