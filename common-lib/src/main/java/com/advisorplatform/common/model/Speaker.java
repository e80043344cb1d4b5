package com.advisorplatform.common.model;

/**
 * Party to the debate. Only the critic adjudicates, so every recorded {@link DebateTurn}
 * and every {@code debate_turn} event carries {@link #CRITIC}. The proposer answers a
 * refutation with {@link SegmentPhase#REBUTTAL} reasoning segments rather than with a turn
 * of its own; {@link #PROPOSER} names that side of the exchange in the wire vocabulary.
 */
public enum Speaker {
    PROPOSER,
    CRITIC
}
