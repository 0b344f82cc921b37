package com.relayhub.turnservice.engine.offering;

/**
 * 触发 offerNext 的原因（日志与排查用）
 */
public enum OfferReason {
    GAME_CREATED,
    TURN_COMPLETED,
    TURN_SKIPPED,
    CLAIM_TIMEOUT,
    PLAYER_DISMISSED,
    MANUAL_RECHECK
}
