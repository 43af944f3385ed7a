package com.seriessentinel.service.relay;

import com.seriessentinel.service.JsonSupport;
import com.seriessentinel.service.ServiceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Entry point of the webhook relay.
 *
 * <p>
 * The port comes from the first argument when given, otherwise from
 * {@code RELAY_PORT} (default 8080).
 * </p>
 *
 * @since 1.0.0
 */
public final class WebhookRelayApp {

    private static final Logger LOG = LoggerFactory.getLogger(WebhookRelayApp.class);

    private WebhookRelayApp() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        ServiceConfig config = ServiceConfig.fromEnvironment();
        int port = config.getRelayPort();
        if (args.length > 0) {
            try {
                port = Integer.parseInt(args[0]);
            } catch (NumberFormatException e) {
                LOG.error("Invalid port: {}", args[0]);
                System.exit(1);
            }
        }

        WebhookRelayServer relay = new WebhookRelayServer(
                new AlertBuffer(), JsonSupport.newObjectMapper(), Clock.systemUTC(), config.getWorkerThreads());
        try {
            relay.start(port);
        } catch (IllegalStateException | IllegalArgumentException e) {
            LOG.error("Webhook relay could not start: {}", e.getMessage(), e);
            System.exit(1);
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            relay.stop();
            shutdown.countDown();
        }, "relay-shutdown"));

        LOG.info("Waiting for alerts...");
        shutdown.await();
    }
}
