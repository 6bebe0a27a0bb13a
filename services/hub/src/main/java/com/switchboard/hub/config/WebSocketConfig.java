package com.switchboard.hub.config;

import com.switchboard.hub.domain.MessageRouter;
import com.switchboard.hub.domain.TenantRegistry;
import com.switchboard.hub.infrastructure.web.TerminalHandshakeInterceptor;
import com.switchboard.hub.infrastructure.web.TerminalWebSocketHandler;
import com.switchboard.observability.MetricFactory;
import com.switchboard.observability.SensitiveDataRedactor;
import com.switchboard.security.ConnectionAuthenticator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Exposes the terminal endpoint at {@code /}. Terminals are not browsers, so any origin is
 * accepted; the signature check is the access control.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String TERMINAL_ENDPOINT = "/";

    private final HubProperties properties;
    private final TerminalWebSocketHandler handler;
    private final TerminalHandshakeInterceptor interceptor;

    public WebSocketConfig(HubProperties properties, MessageRouter router, TenantRegistry registry,
            ConnectionAuthenticator authenticator, SensitiveDataRedactor redactor, MetricFactory metrics) {
        this.properties = properties;
        this.handler = new TerminalWebSocketHandler(router, properties, metrics);
        this.interceptor = new TerminalHandshakeInterceptor(authenticator, registry, redactor, metrics,
                properties.hostTerminalId());
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, TERMINAL_ENDPOINT)
                .addInterceptors(interceptor)
                .setAllowedOrigins("*");
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(properties.maxFrameSize());
        container.setMaxBinaryMessageBufferSize(properties.maxFrameSize());
        return container;
    }
}
