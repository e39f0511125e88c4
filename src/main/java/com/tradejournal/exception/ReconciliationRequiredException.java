package com.tradejournal.exception;

import com.tradejournal.domain.vo.PositionKey;
import java.util.HashMap;
import java.util.Map;

/**
 * Raised when a group's executions cannot be explained by any position history, for example
 * when the running open quantity would go negative or a persisted open trade cannot be resumed.
 *
 * <p>Fatal for the group: no trade is produced for it, since guessing would corrupt P&L.
 */
public class ReconciliationRequiredException extends BaseException {

    public ReconciliationRequiredException(PositionKey positionKey, String orderId, String message) {
        super(ErrorCode.RECONCILIATION_REQUIRED, message, details(positionKey, orderId));
    }

    public String getOrderId() {
        return detail("orderId");
    }

    private static Map<String, Object> details(PositionKey positionKey, String orderId) {
        Map<String, Object> details = new HashMap<>();
        if (positionKey != null) {
            if (positionKey.accountId() != null) {
                details.put("accountId", positionKey.accountId());
            }
            details.put("symbol", positionKey.symbol());
        }
        if (orderId != null) {
            details.put("orderId", orderId);
        }
        return details;
    }
}
