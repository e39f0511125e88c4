package com.tradejournal.event;

import com.tradejournal.domain.model.RebuildResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every completed user rebuild (incremental or full), including runs that
 * reported group problems. Not published when the rebuild was rejected outright.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>RebuildProblemAlertHandler: logs groups that need reconciliation or a retry</li>
 * </ul>
 */
public class TradesRebuiltEvent extends ApplicationEvent {

    private final RebuildResult result;

    public TradesRebuiltEvent(Object source, RebuildResult result) {
        super(source);
        this.result = result;
    }

    public RebuildResult getResult() {
        return result;
    }

    public String getUserId() {
        return result.getUserId();
    }
}
