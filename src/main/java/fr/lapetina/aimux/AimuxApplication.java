package fr.lapetina.aimux;

import fr.lapetina.aimux.api.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the aimux dispatcher.
 */
public class AimuxApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AimuxApplication.class);

    private final DispatcherFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public AimuxApplication(String configPath) throws Exception {
        this(DispatcherFactory.create(configPath));
    }

    AimuxApplication(DispatcherFactory factory) throws Exception {
        log.info("Starting aimux dispatcher...");

        this.factory = factory.start();
        this.httpServer = new HttpServer(
                factory.getConfig().getServer(),
                factory.getDispatcher(),
                factory.getProviderRegistry(),
                factory.getFailoverManager(),
                factory.getLoadBalancer(),
                factory.getCache(),
                factory.getCacheWarmer(),
                factory.getBackoffPolicy(),
                factory.getMetricsRegistry()
        );

        log.info("aimux dispatcher initialized");
    }

    public void start() {
        httpServer.start();
        log.info("aimux dispatcher started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public DispatcherFactory getFactory() {
        return factory;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    @Override
    public void close() {
        log.info("Shutting down aimux dispatcher...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("aimux dispatcher shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            AimuxApplication app = new AimuxApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start aimux dispatcher", e);
            System.exit(1);
        }
    }
}
