package com.tradejournal.exception;

import java.util.Map;

/** A rebuild for the same user is already running; concurrent rebuilds are rejected, never interleaved. */
public class RebuildInProgressException extends BaseException {

    public RebuildInProgressException(String userId) {
        super(
                ErrorCode.REBUILD_IN_PROGRESS,
                String.format("Trade rebuild already in progress for user: %s", userId),
                Map.of("userId", userId));
    }
}
