package org.aviator.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aviator.model.AuditLog;
import org.aviator.repo.AuditLogRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Journal d'audit du moteur (début de round, vol, crash, règlements, erreurs).
 * Écrit dans sa propre transaction : une erreur d'audit ne fait jamais échouer le round.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLogService {

    public static final String ROUND_START = "ROUND_START";
    public static final String FLYING_START = "FLYING_START";
    public static final String CRASH = "CRASH";
    public static final String FORCE_CRASH = "FORCE_CRASH";
    public static final String SETTLEMENT = "SETTLEMENT";
    public static final String ENGINE_START = "ENGINE_START";
    public static final String ENGINE_STOP = "ENGINE_STOP";
    public static final String SETTINGS_UPDATE = "SETTINGS_UPDATE";
    public static final String ERROR = "ERROR";

    private static final int MAX_MESSAGE = 1024;

    private final AuditLogRepository repo;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(String eventType, Long roundNumber, String message) {
        String msg = message != null && message.length() > MAX_MESSAGE ? message.substring(0, MAX_MESSAGE) : message;
        try {
            repo.save(AuditLog.builder()
                    .eventType(eventType)
                    .roundNumber(roundNumber)
                    .message(msg)
                    .build());
        } catch (RuntimeException ex) {
            log.warn("Audit non enregistré ({} round={}): {}", eventType, roundNumber, ex.getMessage());
        }
    }

    @Transactional(readOnly = true)
    public List<AuditLog> recent(String eventType, int limit) {
        PageRequest page = PageRequest.of(0, limit <= 0 ? 50 : Math.min(limit, 500));
        return eventType == null || eventType.isBlank()
                ? repo.findByOrderByCreatedAtDesc(page)
                : repo.findByEventTypeOrderByCreatedAtDesc(eventType, page);
    }
}
