package com.backtestplatform.backtest.producer;

import com.backtestplatform.common.model.SignalContext;
import com.backtestplatform.common.model.SignalDirection;
import com.backtestplatform.common.model.TradeSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Three-vote trend producer (score range −3 to +3).
 *
 * <ol>
 *   <li>Price vs slow SMA  : above → +1, below → −1</li>
 *   <li>Fast EMA vs slow SMA: above → +1, below → −1</li>
 *   <li>Momentum           : close now vs {@value #MOMENTUM_LAG} bars ago</li>
 * </ol>
 * |score| ≥ 2 sets the direction; confidence grows with the score.
 */
@Component
public class TrendFollowingProducer implements SignalProducer {

    private static final Logger log = LoggerFactory.getLogger(TrendFollowingProducer.class);

    public static final String ID = "trend_following";

    static final int FAST_PERIOD   = 5;
    static final int SLOW_PERIOD   = 10;
    static final int MOMENTUM_LAG  = 4;

    @Override
    public String id() { return ID; }

    @Override
    public TradeSignal produce(SignalContext context) {
        List<Double> closes = context.closes();
        if (closes.size() < SLOW_PERIOD) {
            return TradeSignal.of(ID, context.ticker(), SignalDirection.NEUTRAL, 0.0,
                "Insufficient history: " + closes.size() + " closes");
        }

        double price    = closes.get(0);
        double fast     = TechnicalIndicators.ema(closes.subList(0, SLOW_PERIOD), FAST_PERIOD);
        double slow     = TechnicalIndicators.sma(closes, SLOW_PERIOD);
        double momentum = TechnicalIndicators.momentum(closes, MOMENTUM_LAG);

        int score = vote(price, slow) + vote(fast, slow) + (Double.isNaN(momentum) ? 0 : (int) Math.signum(momentum));

        SignalDirection direction = score >= 2 ? SignalDirection.BULLISH
                                  : score <= -2 ? SignalDirection.BEARISH
                                  : SignalDirection.NEUTRAL;
        double confidence = direction == SignalDirection.NEUTRAL ? 30.0 : 40.0 + 20.0 * Math.abs(score);

        String reasoning = String.format("Price=%.2f EMA%d=%.2f SMA%d=%.2f momentum=%.4f score=%d",
            price, FAST_PERIOD, fast, SLOW_PERIOD, slow, momentum, score);
        log.debug("[TrendFollowing] ticker={} date={} direction={} {}", context.ticker(), context.date(), direction, reasoning);
        return TradeSignal.of(ID, context.ticker(), direction, confidence, reasoning);
    }

    private static int vote(double a, double b) {
        if (Double.isNaN(a) || Double.isNaN(b)) return 0;
        return a > b ? 1 : a < b ? -1 : 0;
    }
}
