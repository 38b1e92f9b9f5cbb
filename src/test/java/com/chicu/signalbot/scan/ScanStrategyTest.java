package com.chicu.signalbot.scan;

import com.chicu.signalbot.engine.IntervalSpec;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ScanStrategyTest {

    private ScanStrategy strategy(String channel) {
        return new ScanStrategy("swing", "Aggressive Swing Trader", channel,
                IntervalSpec.ofHours(4), Duration.ofHours(4), 300,
                StrategyParams.builder().build(), (asset, candles) -> Optional.empty(),
                List.of("MATIC-USD", "qnt-usd"));
    }

    @Test
    void products_shouldBeNormalized_andEditable() {
        ScanStrategy s = strategy("swing-trade");

        assertEquals(List.of("MATIC-USD", "QNT-USD"), s.getProducts());
        assertTrue(s.addProduct(" btc-usd "));
        assertFalse(s.addProduct("BTC-USD"), "дубликат не добавляется");
        assertTrue(s.removeProduct("matic-usd"));
        assertFalse(s.removeProduct("MATIC-USD"));
        assertEquals(List.of("QNT-USD", "BTC-USD"), s.getProducts());
    }

    @Test
    void blankChannel_shouldMeanDisabled() {
        assertFalse(strategy(" ").isEnabled());
        assertFalse(strategy(null).isEnabled());
        assertTrue(strategy("swing-trade").isEnabled());
    }

    @Test
    void catalog_shouldSplitEnabledAndDisabled() {
        ScanStrategy on = strategy("swing-trade");
        ScanStrategy off = new ScanStrategy("long", "Long-Term Investor", "",
                IntervalSpec.ofHours(24), Duration.ofDays(1), 300,
                StrategyParams.builder().build(), (asset, candles) -> Optional.empty(), List.of());

        StrategyCatalog catalog = new StrategyCatalog(List.of(on, off));

        assertEquals(List.of(on), catalog.enabled());
        assertEquals(List.of("long"), catalog.disabledIds());
        assertTrue(catalog.isKnown("LONG"));
        assertTrue(catalog.find("day").isEmpty());
    }
}
