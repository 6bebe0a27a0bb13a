package com.switchboard.hub.config;

import com.switchboard.security.ConnectionCredentials;
import com.switchboard.security.Ed25519Signatures;
import com.switchboard.security.SigningKeyPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Logs how to reach the admin host terminal once the server is listening. The full URL, which
 * includes a valid signature, is only logged for a generated key.
 */
@Component
public class AdminKeyAnnouncer implements ApplicationListener<WebServerInitializedEvent> {

    private static final Logger log = LoggerFactory.getLogger(AdminKeyAnnouncer.class);

    private final HubProperties properties;
    private final SigningKeyPair adminKeyPair;

    public AdminKeyAnnouncer(HubProperties properties, SigningKeyPair adminKeyPair) {
        this.properties = properties;
        this.adminKeyPair = adminKeyPair;
    }

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        if (properties.hasAdminPrivateKey()) {
            log.info("hub listening on port {}, admin public key {}", port, adminKeyPair.publicKey());
            return;
        }
        log.info("hub listening on port {}, admin host url {}", port, adminUrl(port));
    }

    String adminUrl(int port) {
        String signature = Ed25519Signatures.sign(Ed25519Signatures.CHALLENGE, adminKeyPair.privateKey());
        return "ws://localhost:" + port
                + "?" + ConnectionCredentials.PARAM_PUBLIC_KEY + "=" + adminKeyPair.publicKey()
                + "&" + ConnectionCredentials.PARAM_SIGNATURE + "=" + signature
                + "&" + ConnectionCredentials.PARAM_TERMINAL_ID + "=admin";
    }
}
