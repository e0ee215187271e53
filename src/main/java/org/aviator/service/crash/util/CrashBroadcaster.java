package org.aviator.service.crash.util;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aviator.dto.CrashEvent;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class CrashBroadcaster {
    public static final String TOPIC = "/topic/crash";
    public static final String ERRORS_QUEUE = "/queue/crash/errors";

    private final SimpMessagingTemplate broker;

    public void broadcast(String type, Object payload) {
        try {
            broker.convertAndSend(TOPIC, CrashEvent.builder().type(type).payload(payload).build());
        } catch (RuntimeException ex) {
            // un client lent ne bloque pas le moteur
            log.warn("Diffusion {} impossible: {}", type, ex.getMessage());
        }
    }

    public void sendError(String email, String reason, String message) {
        broker.convertAndSendToUser(email, ERRORS_QUEUE, Map.of("error", reason, "message", message));
    }
}
