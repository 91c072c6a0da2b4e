package com.rostersync;

import com.rostersync.broker.BrokerConfig;
import com.rostersync.broker.ConnectionBroker;
import com.rostersync.monitor.PerformanceSummary;
import com.rostersync.server.RosterFeedServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Command line launcher.
 *
 * Usage:
 *   feed [port]   serve the roster feed (default port 8080)
 *   observe       follow a feed with a connection broker configured from
 *                 ROSTER_SYNC_* environment variables and log what arrives
 *
 * A bare port number is accepted as shorthand for {@code feed <port>}.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);
    private static final int DEFAULT_PORT = 8080;

    public static void main(String[] args) {
        String command = args.length > 0 ? args[0] : "feed";

        switch (command) {
            case "observe" -> observe();
            case "feed" -> serveFeed(parsePort(args.length > 1 ? args[1] : null));
            default -> serveFeed(parsePort(command));
        }
    }

    private static int parsePort(String arg) {
        if (arg == null) {
            return DEFAULT_PORT;
        }
        try {
            return Integer.parseInt(arg);
        } catch (NumberFormatException e) {
            logger.warn("Invalid port argument '{}', using default port {}", arg, DEFAULT_PORT);
            return DEFAULT_PORT;
        }
    }

    private static void serveFeed(int port) {
        logger.info("Starting roster feed on port {}", port);
        RosterFeedServer server = new RosterFeedServer(port);
        Runtime.getRuntime().addShutdownHook(new Thread(server::shutdown, "feed-shutdown"));

        try {
            server.start();
            server.blockUntilShutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.error("Roster feed failed to start on port {}", port, e);
            System.exit(1);
        }
    }

    private static void observe() {
        BrokerConfig config = BrokerConfig.fromEnvironment();
        ConnectionBroker broker = ConnectionBroker.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        broker.subscribe(event -> {
            switch (event.getType()) {
                case RESET -> logger.info("Roster reset: {} entities at version {}",
                        event.getSnapshot().size(), event.getSnapshot().getVersion());
                case UPDATE -> logger.info("Roster version {}: {}",
                        event.getResultingVersion(), event.getChanges());
                case CONNECTION_STATE -> logger.info("Upstream {}", event.getConnectionState());
            }
        });

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            PerformanceSummary summary = broker.getPerformanceMonitor().summary();
            logger.info("Observed {} updates, average compression {}, {} bytes saved",
                    summary.getSampleCount(),
                    String.format("%.3f", summary.getAverageCompressionRatio()),
                    summary.getTotalBytesSaved());
            broker.stop();
            stopped.countDown();
        }, "observer-shutdown"));

        broker.connect();
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
