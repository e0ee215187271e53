package org.aviator.service.crash.util;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.*;

/**
 * Minuteries nommées du moteur (fenêtre de mise, ticks, pause entre rounds).
 * Un seul thread : les étapes d'un round ne se chevauchent jamais.
 */
@Slf4j
@Component
public class RoundTimers {
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "crash-round-loop");
        t.setDaemon(true);
        return t;
    });
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    /** Remplace la minuterie du même nom : au plus une tâche vivante par nom. */
    public void schedule(String name, long delayMs, Runnable task) {
        tasks.compute(name, (k, old) -> {
            if (old != null) old.cancel(false);
            return scheduler.schedule(guarded(name, task), Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
        });
    }

    public void cancel(String name) {
        ScheduledFuture<?> f = tasks.remove(name);
        if (f != null) f.cancel(false);
    }

    public void cancelAll() {
        tasks.keySet().forEach(this::cancel);
    }

    public boolean isScheduled(String name) {
        ScheduledFuture<?> f = tasks.get(name);
        return f != null && !f.isDone();
    }

    @PreDestroy
    public void shutdown() {
        cancelAll();
        scheduler.shutdownNow();
    }

    // une exception dans une tâche ne doit pas tuer la boucle
    private Runnable guarded(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException ex) {
                log.error("Minuterie '{}' en échec", name, ex);
            }
        };
    }
}
