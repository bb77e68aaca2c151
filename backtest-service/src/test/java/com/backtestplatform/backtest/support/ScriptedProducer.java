package com.backtestplatform.backtest.support;

import com.backtestplatform.backtest.producer.SignalProducer;
import com.backtestplatform.common.model.SignalContext;
import com.backtestplatform.common.model.SignalDirection;
import com.backtestplatform.common.model.TradeSignal;

import java.util.function.Function;

/** Test producer whose signal is a function of the context. */
public class ScriptedProducer implements SignalProducer {

    private final String id;
    private final Function<SignalContext, TradeSignal> script;

    private ScriptedProducer(String id, Function<SignalContext, TradeSignal> script) {
        this.id     = id;
        this.script = script;
    }

    public static ScriptedProducer of(String id, Function<SignalContext, TradeSignal> script) {
        return new ScriptedProducer(id, script);
    }

    public static ScriptedProducer constant(String id, SignalDirection direction, double confidence) {
        return new ScriptedProducer(id, ctx -> TradeSignal.of(id, ctx.ticker(), direction, confidence, "scripted"));
    }

    /** Bullish on even days of month, bearish on odd ones. */
    public static ScriptedProducer alternating(String id) {
        return new ScriptedProducer(id, ctx -> TradeSignal.of(id, ctx.ticker(),
            ctx.date().getDayOfMonth() % 2 == 0 ? SignalDirection.BULLISH : SignalDirection.BEARISH, 70, "alternating"));
    }

    public static ScriptedProducer failing(String id) {
        return new ScriptedProducer(id, ctx -> {
            throw new IllegalStateException("producer " + id + " exploded");
        });
    }

    public static ScriptedProducer sleeping(String id, long millis, SignalDirection direction) {
        return new ScriptedProducer(id, ctx -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
            return TradeSignal.of(id, ctx.ticker(), direction, 60, "slow");
        });
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public TradeSignal produce(SignalContext context) {
        return script.apply(context);
    }
}
