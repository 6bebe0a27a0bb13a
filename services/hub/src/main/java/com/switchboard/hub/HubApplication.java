package com.switchboard.hub;

import com.switchboard.hub.config.HubProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Switchboard hub: routes frames between authenticated terminals of the same tenant over
 * WebSocket.
 *
 * <p>Listens on {@code server.port} (8888 by default). Terminals connect to {@code /} with
 * {@code public_key}, {@code terminal_id} and {@code signature} query parameters.
 */
@SpringBootApplication
@EnableConfigurationProperties(HubProperties.class)
public class HubApplication {

    public static void main(String[] args) {
        SpringApplication.run(HubApplication.class, args);
    }
}
