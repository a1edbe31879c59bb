package admission.java.grpc;

import admission.core.clock.SystemClock;
import admission.core.model.AdmissionLimits;
import admission.java.engine.AdmissionController;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerInterceptors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Standalone gRPC server for the admission service.
 *
 * <p>Features:
 * <ul>
 *   <li>Configurable port (default: 9090)</li>
 *   <li>Graceful shutdown with timeout</li>
 *   <li>Default limits: 60 requests and 10,000 tokens per session per 60 seconds</li>
 *   <li>SystemClock for production</li>
 * </ul>
 *
 * <p>Limits can be overridden with system properties, one set per process:
 * {@code admission.rpm}, {@code admission.tpm}, {@code admission.window.seconds},
 * {@code admission.max.sessions}.
 *
 * <p>Usage:
 * <pre>
 * java -cp ... admission.java.grpc.AdmissionServer [port]
 * java -Dadmission.rpm=120 -Dadmission.tpm=50000 -cp ... admission.java.grpc.AdmissionServer 8080
 * </pre>
 */
public final class AdmissionServer {

    private static final Logger logger = LoggerFactory.getLogger(AdmissionServer.class);

    private static final int DEFAULT_PORT = 9090;
    private static final int DEFAULT_MAX_SESSIONS = 10_000;
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Server server;
    private final AdmissionController controller;

    /**
     * Creates a server on the specified port with limits from system properties.
     *
     * @param port Port to listen on
     */
    public AdmissionServer(int port) {
        this(port, createDefaultController());
    }

    /**
     * Creates a server with a custom controller (useful for testing).
     *
     * @param port Port to listen on
     * @param controller Admission controller
     */
    public AdmissionServer(int port, AdmissionController controller) {
        this.controller = controller;
        this.server = ServerBuilder.forPort(port)
            .addService(ServerInterceptors.intercept(
                new AdmissionServiceImpl(controller, new SimulatedModel()),
                new SessionInterceptor()))
            .build();
    }

    /**
     * Starts the server.
     *
     * @throws IOException if server fails to start
     */
    public void start() throws IOException {
        server.start();
        AdmissionLimits limits = controller.limits();
        logger.info("AdmissionServer started on port {} (rpm={}, tpm={}, window={}s, maxSessions={})",
            server.getPort(), limits.rpmLimit(), limits.tpmLimit(), limits.window().toSeconds(),
            controller.maxSessions());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down gRPC server (JVM shutdown hook)...");
            try {
                AdmissionServer.this.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.error("Shutdown interrupted", e);
            }
        }));
    }

    /**
     * Stops the server gracefully.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        if (server != null) {
            server.shutdown().awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            logger.info("AdmissionServer stopped.");
        }
    }

    /**
     * Blocks until server is terminated.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        if (server != null) {
            server.awaitTermination();
        }
    }

    /**
     * @return port number, or -1 if not started
     */
    public int getPort() {
        return server != null ? server.getPort() : -1;
    }

    static AdmissionLimits limitsFromSystemProperties() {
        int rpm = Integer.getInteger("admission.rpm", AdmissionLimits.DEFAULT_RPM_LIMIT);
        long tpm = Long.getLong("admission.tpm", AdmissionLimits.DEFAULT_TPM_LIMIT);
        long windowSeconds = Long.getLong("admission.window.seconds", AdmissionLimits.DEFAULT_WINDOW_SECONDS);
        return AdmissionLimits.of(rpm, tpm, Duration.ofSeconds(windowSeconds));
    }

    private static AdmissionController createDefaultController() {
        int maxSessions = Integer.getInteger("admission.max.sessions", DEFAULT_MAX_SESSIONS);
        return new AdmissionController(SystemClock.instance(), limitsFromSystemProperties(), maxSessions);
    }

    /**
     * Main entry point.
     *
     * @param args Optional: port number
     * @throws IOException if server fails to start
     * @throws InterruptedException if server is interrupted
     */
    public static void main(String[] args) throws IOException, InterruptedException {
        int port = DEFAULT_PORT;

        if (args.length > 0) {
            try {
                port = Integer.parseInt(args[0]);
            } catch (NumberFormatException e) {
                logger.error("Invalid port: {}", args[0]);
                System.exit(1);
            }
        }

        AdmissionServer server;
        try {
            server = new AdmissionServer(port);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }
        server.start();
        server.blockUntilShutdown();
    }
}
