package com.tradejournal.domain.enums;

/**
 * Events emitted by the position matcher for each execution.
 *
 * <p>A reversal executes as SCALE_OUT (closing leg) + CLOSE + FLIP (opening leg). FLIP is kept
 * distinct from OPEN so a reversal is always visible in the event stream.
 */
public enum MatchEventType {
    OPEN,
    SCALE_IN,
    SCALE_OUT,
    CLOSE,
    FLIP
}
