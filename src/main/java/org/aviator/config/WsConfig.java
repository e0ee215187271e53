package org.aviator.config;

import org.aviator.security.JwtChannelInterceptor;
import org.aviator.security.JwtHandshakeInterceptor;
import org.aviator.service.crash.util.CrashBroadcaster;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.*;

/**
 * STOMP du jeu : {@link CrashBroadcaster#TOPIC} pour les événements de round,
 * /user{@link CrashBroadcaster#ERRORS_QUEUE} pour les refus adressés à un joueur.
 * Le broker ne relaie que ces destinations.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WsConfig implements WebSocketMessageBrokerConfigurer {

    static final String[] BROKER_PREFIXES = {"/topic/crash", "/queue/crash"};
    static final long HEARTBEAT_MS = 10_000;

    private final JwtChannelInterceptor jwtChannelInterceptor;
    private final JwtHandshakeInterceptor jwtHandshakeInterceptor;

    @Value("${app.cors.allowed-origins:http://localhost:4200}")
    private String allowedOrigins;

    public WsConfig(JwtChannelInterceptor ch, JwtHandshakeInterceptor hs) {
        this.jwtChannelInterceptor = ch;
        this.jwtHandshakeInterceptor = hs;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        String[] patterns = allowedOrigins.split("\\s*,\\s*");
        registry.addEndpoint("/ws")
                .addInterceptors(jwtHandshakeInterceptor)
                .setAllowedOriginPatterns(patterns)
                .withSockJS();
    }

    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registry) {
        // 10 ticks/s par client : petits messages, tampon d'envoi généreux
        registry.setMessageSizeLimit(64 * 1024)
                .setSendBufferSizeLimit(512 * 1024)
                .setSendTimeLimit(15_000);
    }

    private ThreadPoolTaskScheduler heartbeatScheduler() {
        ThreadPoolTaskScheduler ts = new ThreadPoolTaskScheduler();
        ts.setPoolSize(1);
        ts.setThreadNamePrefix("crash-ws-heartbeat-");
        ts.setDaemon(true);
        ts.initialize();
        return ts;
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        var simple = registry.enableSimpleBroker(BROKER_PREFIXES);
        simple.setTaskScheduler(heartbeatScheduler());
        simple.setHeartbeatValue(new long[]{HEARTBEAT_MS, HEARTBEAT_MS});
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(jwtChannelInterceptor);
    }
}
