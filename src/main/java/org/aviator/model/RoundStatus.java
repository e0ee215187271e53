package org.aviator.model;

// Ordre strict : un round n'avance que vers la droite
public enum RoundStatus {
    WAITING, BETTING, FLYING, CRASHED, COMPLETED;

    public boolean isLive() {
        return this == WAITING || this == BETTING || this == FLYING;
    }

    public boolean isBefore(RoundStatus other) {
        return ordinal() < other.ordinal();
    }
}
