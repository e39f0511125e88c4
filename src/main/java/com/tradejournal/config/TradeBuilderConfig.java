package com.tradejournal.config;

import com.tradejournal.domain.enums.HoldingPeriodPolicy;
import java.time.LocalTime;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for trade construction.
 *
 * <p>Controls the holding-period rule, the regular-session window used to tag a trade's
 * market session, and the scales applied when trades are materialized. Internal arithmetic
 * runs at full decimal precision; scales apply only to the published fields.
 * Properties are read from the {@code tradejournal.trade-builder} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "tradejournal.trade-builder")
@Getter
@Setter
public class TradeBuilderConfig {

    /** Rule deciding INTRADAY vs MULTIDAY for closed trades. */
    private HoldingPeriodPolicy holdingPeriodPolicy = HoldingPeriodPolicy.SAME_CALENDAR_DAY;

    /** Upper bound for INTRADAY under the ELAPSED_HOURS policy. */
    private int intradayMaxHours = 24;

    /** Exchange-local regular session start, HH:mm. */
    private String regularSessionOpen = "09:30";

    /** Exchange-local regular session end (exclusive), HH:mm. */
    private String regularSessionClose = "16:00";

    /** Scale of published quantities. */
    private int quantityScale = 8;

    /** Scale of published prices (average entry/exit). */
    private int priceScale = 6;

    /** Scale of published amounts (P&L, commissions, fees, notionals). */
    private int amountScale = 4;

    public LocalTime regularSessionOpenTime() {
        return LocalTime.parse(regularSessionOpen);
    }

    public LocalTime regularSessionCloseTime() {
        return LocalTime.parse(regularSessionClose);
    }
}
