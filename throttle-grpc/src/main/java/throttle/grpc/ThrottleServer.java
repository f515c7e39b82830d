package throttle.grpc;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import throttle.core.clock.SystemClock;
import throttle.engine.ThrottleConfig;
import throttle.engine.ThrottleModule;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Standalone gRPC server exposing the throttle engine.
 *
 * <p>Features:
 * <ul>
 *   <li>Configurable port (default: 9090)</li>
 *   <li>Store sizing from system properties ({@code throttle.partitions}, {@code throttle.gc-interval})</li>
 *   <li>Module loaded on start and unloaded on stop</li>
 *   <li>Graceful shutdown with timeout</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * java -Dthrottle.partitions=32 -cp ... throttle.grpc.ThrottleServer 8080
 * </pre>
 */
public final class ThrottleServer {

    private static final Logger log = LoggerFactory.getLogger(ThrottleServer.class);

    private static final int DEFAULT_PORT = 9090;
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Server server;
    private final ThrottleModule module;
    private boolean loaded;

    /**
     * Creates a server on the specified port with its own module.
     *
     * @param port Port to listen on
     * @param config Store configuration
     */
    public ThrottleServer(int port, ThrottleConfig config) {
        this(port, new ThrottleModule(config));
    }

    /**
     * Creates a server around an existing module (useful when the host shares it).
     *
     * @param port Port to listen on
     * @param module Throttle module
     */
    public ThrottleServer(int port, ThrottleModule module) {
        if (module == null) {
            throw new IllegalArgumentException("module cannot be null");
        }
        this.module = module;
        this.server = ServerBuilder.forPort(port)
            .addService(new ThrottleServiceImpl(module, SystemClock.instance()))
            .build();
    }

    /**
     * Loads the module and starts the server.
     *
     * @throws IOException if server fails to start
     */
    public synchronized void start() throws IOException {
        module.onLoad();
        loaded = true;
        try {
            server.start();
        } catch (IOException e) {
            releaseModule();
            throw e;
        }
        log.info("ThrottleServer started on port {}", server.getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down gRPC server (JVM shutdown hook)...");
            try {
                ThrottleServer.this.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted: {}", e.getMessage());
            }
        }));
    }

    /**
     * Stops the server gracefully, then unloads the module.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public synchronized void stop() throws InterruptedException {
        try {
            server.shutdown().awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } finally {
            releaseModule();
        }
        log.info("ThrottleServer stopped.");
    }

    private void releaseModule() {
        if (loaded) {
            loaded = false;
            module.onUnload();
        }
    }

    /**
     * Blocks until server is terminated.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        server.awaitTermination();
    }

    /**
     * Returns the port the server is listening on.
     *
     * @return port number, or -1 if not started
     */
    public int getPort() {
        return server.getPort();
    }

    /**
     * Parses the optional port argument.
     *
     * @throws IllegalArgumentException if the argument is not a valid port
     */
    static int parsePort(String[] args) {
        if (args.length == 0) {
            return DEFAULT_PORT;
        }
        try {
            int port = Integer.parseInt(args[0]);
            if (port < 0 || port > 65_535) {
                throw new IllegalArgumentException("port out of range: " + port);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + args[0], e);
        }
    }

    /**
     * Main entry point.
     *
     * @param args Optional: port number
     * @throws IOException if server fails to start
     * @throws InterruptedException if server is interrupted
     */
    public static void main(String[] args) throws IOException, InterruptedException {
        int port;
        ThrottleConfig config;
        try {
            port = parsePort(args);
            config = ThrottleConfig.fromProperties(System.getProperties());
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        ThrottleServer server = new ThrottleServer(port, config);
        server.start();
        server.blockUntilShutdown();
    }
}
