package org.aviator.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

// Push du solde vers le navigateur après chaque mouvement validé
@Slf4j
@Component
public class WalletSseService {
    private static final long TIMEOUT_MS = 6L * 60 * 60 * 1000L;

    private final Map<String, List<SseEmitter>> emitters = new ConcurrentHashMap<>();

    public SseEmitter register(String email) {
        SseEmitter emitter = new SseEmitter(TIMEOUT_MS);
        emitters.computeIfAbsent(email, k -> new CopyOnWriteArrayList<>()).add(emitter);

        emitter.onCompletion(() -> removeEmitter(email, emitter));
        emitter.onTimeout(() -> removeEmitter(email, emitter));
        emitter.onError((e) -> removeEmitter(email, emitter));

        try {
            emitter.send(SseEmitter.event().name("connected").data("ok"));
        } catch (IOException e) {
            removeEmitter(email, emitter);
        }
        return emitter;
    }

    private void removeEmitter(String email, SseEmitter emitter) {
        List<SseEmitter> list = emitters.get(email);
        if (list != null) {
            list.remove(emitter);
            if (list.isEmpty()) emitters.remove(email);
        }
    }

    public void sendBalanceUpdate(String email, BigDecimal solde) {
        List<SseEmitter> list = emitters.get(email);
        if (list == null) return;

        for (SseEmitter emitter : list.toArray(new SseEmitter[0])) {
            try {
                emitter.send(SseEmitter.event()
                        .name("wallet-update")
                        .data(Map.of("solde", solde)));
            } catch (IOException e) {
                log.debug("SSE fermé pour {}: {}", email, e.getMessage());
                removeEmitter(email, emitter);
            }
        }
    }

    // Heartbeat toutes les 15s pour garder le flux ouvert derrière Nginx/proxies
    @Scheduled(fixedDelay = 15000)
    public void heartbeat() {
        for (var entry : emitters.entrySet()) {
            String email = entry.getKey();
            for (SseEmitter emitter : entry.getValue().toArray(new SseEmitter[0])) {
                try {
                    emitter.send(SseEmitter.event().name("ping").data("keepalive"));
                } catch (IOException e) {
                    removeEmitter(email, emitter);
                }
            }
        }
    }
}
