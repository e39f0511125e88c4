package com.tradejournal.tradebuilder;

import com.tradejournal.config.TradeBuilderConfig;
import com.tradejournal.domain.enums.HoldingPeriodClass;
import com.tradejournal.domain.enums.HoldingPeriodPolicy;
import com.tradejournal.domain.enums.MarketSession;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import org.springframework.stereotype.Component;

/**
 * Derives the holding-period class and market session of a trade from its timestamps.
 * All timestamps are exchange-local.
 */
@Component
public class TradeClassifier {

    private final TradeBuilderConfig tradeBuilderConfig;

    public TradeClassifier(TradeBuilderConfig tradeBuilderConfig) {
        this.tradeBuilderConfig = tradeBuilderConfig;
    }

    /** Open trades have no exit yet and stay INTRADAY until they close. */
    public HoldingPeriodClass holdingPeriod(LocalDateTime entryAt, LocalDateTime exitAt) {
        if (exitAt == null) {
            return HoldingPeriodClass.INTRADAY;
        }
        boolean intraday;
        if (tradeBuilderConfig.getHoldingPeriodPolicy() == HoldingPeriodPolicy.ELAPSED_HOURS) {
            intraday = Duration.between(entryAt, exitAt)
                            .compareTo(Duration.ofHours(tradeBuilderConfig.getIntradayMaxHours()))
                    <= 0;
        } else {
            intraday = entryAt.toLocalDate().equals(exitAt.toLocalDate());
        }
        return intraday ? HoldingPeriodClass.INTRADAY : HoldingPeriodClass.MULTIDAY;
    }

    public MarketSession marketSession(LocalDateTime entryAt) {
        LocalTime time = entryAt.toLocalTime();
        if (time.isBefore(tradeBuilderConfig.regularSessionOpenTime())) {
            return MarketSession.PRE_MARKET;
        }
        if (time.isBefore(tradeBuilderConfig.regularSessionCloseTime())) {
            return MarketSession.REGULAR;
        }
        return MarketSession.AFTER_HOURS;
    }
}
