package com.switchboard.hub.infrastructure.lifecycle;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;
import sun.misc.Signal;

/**
 * Turns SIGINT and SIGTERM into an orderly context shutdown with exit status 0.
 * Disabled with {@code switchboard.shutdown.signals.enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "switchboard.shutdown.signals", name = "enabled", matchIfMissing = true)
public class ShutdownSignals implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(ShutdownSignals.class);

    static final List<String> SIGNALS = List.of("INT", "TERM");

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        ApplicationContext context = event.getApplicationContext();
        for (String name : SIGNALS) {
            try {
                Signal.handle(new Signal(name), signal -> {
                    log.info("received SIG{}, shutting down", signal.getName());
                    System.exit(SpringApplication.exit(context, () -> 0));
                });
            } catch (IllegalArgumentException e) {
                // signal unknown on this platform or reserved by the JVM
                log.warn("cannot handle SIG{}: {}", name, e.getMessage());
            }
        }
    }
}
