package org.aviator.service.crash.registry;

import org.aviator.model.CrashRound;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

// Un seul écrivain (le scheduler), lecteurs multiples : chacun prend un snapshot en début d'opération
@Component
public class CurrentRoundRegistry {
    private final AtomicReference<RoundSnapshot> current = new AtomicReference<>();
    private final AtomicLong versions = new AtomicLong();

    public RoundSnapshot publish(CrashRound round) {
        RoundSnapshot snap = RoundSnapshot.of(round, versions.incrementAndGet());
        current.set(snap);
        return snap;
    }

    public Optional<RoundSnapshot> current() {
        return Optional.ofNullable(current.get());
    }

    public void clear() {
        current.set(null);
    }
}
