package io.streamwire.supervisor;

import io.streamwire.supervisor.config.SupervisorConfig;
import io.streamwire.supervisor.core.RelayController;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the stream relay.
 */
public class StreamRelay {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamRelay.class);

    public static void main(String[] args) {
        LOGGER.info("========================================");
        LOGGER.info("   Stream Relay Starting...");
        LOGGER.info("========================================");

        try {
            // Load configuration from environment variables
            SupervisorConfig config = SupervisorConfig.fromEnv();
            LOGGER.info("Configuration loaded:");
            LOGGER.info("  Stream: {}", config.streamName());
            LOGGER.info("  URL: {}", config.url());
            LOGGER.info("  Channels: {}", config.channels());
            LOGGER.info("  Max restarts: {}", config.maxRestarts());

            RelayController controller = new RelayController(config);
            controller.start();

            // Setup shutdown hooks for graceful termination
            ShutdownSignalBarrier shutdownBarrier = controller.getShutdownBarrier();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOGGER.info("Shutdown hook triggered");
                shutdownBarrier.signal();
            }));

            // Wait for shutdown signal
            controller.waitForShutdown();

            controller.close();

        } catch (Exception e) {
            LOGGER.error("Fatal error in Stream Relay", e);
            System.exit(1);
        }

        LOGGER.info("Stream Relay exited");
    }
}
