package org.aviator.model;

public enum BetStatus {
    ACTIVE, WON, LOST, CASHED_OUT;

    public boolean isWin() {
        return this == WON || this == CASHED_OUT;
    }
}
