package com.backtestplatform.backtest.producer;

import com.backtestplatform.common.model.SignalContext;
import com.backtestplatform.common.model.SignalDirection;
import com.backtestplatform.common.model.TradeSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fades stretched moves: oversold (RSI &lt; 30 or z-score &lt; −2) is bullish,
 * overbought (RSI &gt; 70 or z-score &gt; 2) is bearish.
 */
@Component
public class MeanReversionProducer implements SignalProducer {

    private static final Logger log = LoggerFactory.getLogger(MeanReversionProducer.class);

    public static final String ID = "mean_reversion";

    static final int RSI_PERIOD    = 14;
    static final int ZSCORE_PERIOD = 20;
    static final int MIN_HISTORY   = RSI_PERIOD + 1;

    @Override
    public String id() { return ID; }

    @Override
    public TradeSignal produce(SignalContext context) {
        List<Double> closes = context.closes();
        if (closes.size() < MIN_HISTORY) {
            return TradeSignal.of(ID, context.ticker(), SignalDirection.NEUTRAL, 0.0,
                "Insufficient history: " + closes.size() + " closes");
        }

        double rsi = TechnicalIndicators.rsi(closes, RSI_PERIOD);
        double z   = TechnicalIndicators.zScore(closes, Math.min(ZSCORE_PERIOD, closes.size()));

        SignalDirection direction;
        double confidence;
        if (rsi < 30 || z < -2.0) {
            direction  = SignalDirection.BULLISH;
            confidence = Math.max(30.0 - rsi, 0.0) * 2.0 + Math.max(-z - 2.0, 0.0) * 20.0 + 50.0;
        } else if (rsi > 70 || z > 2.0) {
            direction  = SignalDirection.BEARISH;
            confidence = Math.max(rsi - 70.0, 0.0) * 2.0 + Math.max(z - 2.0, 0.0) * 20.0 + 50.0;
        } else {
            direction  = SignalDirection.NEUTRAL;
            confidence = 50.0 - Math.abs(rsi - 50.0);
        }

        String reasoning = String.format("RSI%d=%.1f z%d=%.2f", RSI_PERIOD, rsi, ZSCORE_PERIOD, z);
        log.debug("[MeanReversion] ticker={} date={} direction={} {}", context.ticker(), context.date(), direction, reasoning);
        return TradeSignal.of(ID, context.ticker(), direction, confidence, reasoning);
    }
}
