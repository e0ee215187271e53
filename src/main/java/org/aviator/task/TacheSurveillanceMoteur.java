package org.aviator.task;

import org.aviator.service.crash.engine.RoundScheduler;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class TacheSurveillanceMoteur {
    @Autowired
    private RoundScheduler scheduler;

    @Value("${crash.watchdog.grace-seconds:5}")
    private long graceSeconds;

    // rounds bloqués (vol dépassé, règlement interrompu) ou boucle arrêtée sans raison
    @Scheduled(fixedDelayString = "${crash.watchdog.interval-ms:10000}")
    public void surveiller() {
        scheduler.watchdog(Duration.ofSeconds(graceSeconds));
    }
}
