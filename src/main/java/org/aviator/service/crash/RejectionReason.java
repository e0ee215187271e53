package org.aviator.service.crash;

/**
 * Raisons de refus renvoyées telles quelles au client ({@code {"error": "<REASON>"}}).
 */
public enum RejectionReason {
    // validation
    INVALID_AMOUNT,
    INVALID_MULTIPLIER,
    ROUND_NOT_ACCEPTING_BETS,
    ROUND_NOT_FLYING,
    NO_ACTIVE_ROUND,
    ACCOUNT_DISABLED,
    // ressources
    INSUFFICIENT_FUNDS,
    BET_NOT_FOUND,
    // courses perdues : bénignes
    DUPLICATE_BET,
    BET_NOT_ACTIVE,
    ROUND_ALREADY_CRASHED,
    MULTIPLIER_EXCEEDS_CRASH
}
