package com.tradejournal.exception;

import java.util.Map;

/**
 * Raised when a trade-set commit fails partway. The surrounding transaction is rolled back,
 * so affected orders stay untagged and the rebuild can be retried safely.
 */
public class AtomicityFailureException extends BaseException {

    public AtomicityFailureException(String message) {
        super(ErrorCode.ATOMICITY_FAILURE, message);
    }

    public AtomicityFailureException(String message, Throwable cause) {
        super(ErrorCode.ATOMICITY_FAILURE, message, Map.of(), cause);
    }
}
