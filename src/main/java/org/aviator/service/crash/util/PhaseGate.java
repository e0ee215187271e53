package org.aviator.service.crash.util;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Les mises tiennent le verrou de lecture jusqu'au commit ; la fermeture de la fenêtre de mise
 * prend le verrou d'écriture. Aucune mise ne peut donc être validée après le passage en FLYING.
 */
@Component
public class PhaseGate {
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    public <T> T shared(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T exclusive(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
