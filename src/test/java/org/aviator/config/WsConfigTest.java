package org.aviator.config;

import org.aviator.security.JwtChannelInterceptor;
import org.aviator.security.JwtHandshakeInterceptor;
import org.aviator.service.crash.util.CrashBroadcaster;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.messaging.simp.config.SimpleBrokerRegistration;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WsConfigTest {

    @Mock JwtChannelInterceptor channelInterceptor;
    @Mock JwtHandshakeInterceptor handshakeInterceptor;
    @Mock MessageBrokerRegistry registry;
    @Mock SimpleBrokerRegistration simple;

    @Test
    void configureMessageBroker_shouldOnlyRelayCrashDestinations() {
        when(registry.enableSimpleBroker(any(String[].class))).thenReturn(simple);

        new WsConfig(channelInterceptor, handshakeInterceptor).configureMessageBroker(registry);

        verify(registry).enableSimpleBroker("/topic/crash", "/queue/crash");
        verify(simple).setHeartbeatValue(new long[]{10_000, 10_000});
        verify(registry).setApplicationDestinationPrefixes("/app");
        verify(registry).setUserDestinationPrefix("/user");
    }

    @Test
    void brokerPrefixes_shouldCoverEveryBroadcastDestination() {
        assertThat(Arrays.stream(WsConfig.BROKER_PREFIXES).anyMatch(CrashBroadcaster.TOPIC::startsWith)).isTrue();
        assertThat(Arrays.stream(WsConfig.BROKER_PREFIXES).anyMatch(CrashBroadcaster.ERRORS_QUEUE::startsWith)).isTrue();
        assertThat(Arrays.stream(WsConfig.BROKER_PREFIXES).noneMatch("/topic/wallet"::startsWith)).isTrue();
    }
}
