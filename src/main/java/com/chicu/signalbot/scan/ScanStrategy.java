package com.chicu.signalbot.scan;

import com.chicu.signalbot.engine.IntervalSpec;
import lombok.Getter;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Одна стратегия сканирования (day / swing / long) в рантайме.
 * Список монет можно менять командами, в конфиг изменения не пишутся.
 */
@Getter
public class ScanStrategy {

    private final String id;
    private final String displayName;
    /** пусто → стратегия выключена */
    private final String channelName;
    private final IntervalSpec interval;
    private final Duration granularity;
    private final int lookback;
    private final StrategyParams params;
    private final SignalEvaluator evaluator;

    private final List<String> products = new CopyOnWriteArrayList<>();

    public ScanStrategy(String id,
                        String displayName,
                        String channelName,
                        IntervalSpec interval,
                        Duration granularity,
                        int lookback,
                        StrategyParams params,
                        SignalEvaluator evaluator,
                        Collection<String> products) {
        this.id = id;
        this.displayName = displayName;
        this.channelName = channelName == null ? "" : channelName.trim();
        this.interval = interval;
        this.granularity = granularity;
        this.lookback = lookback;
        this.params = params;
        this.evaluator = evaluator;
        for (String p : products) {
            addProduct(p);
        }
    }

    public boolean isEnabled() {
        return !channelName.isEmpty();
    }

    public List<String> getProducts() {
        return List.copyOf(products);
    }

    /** @return false, если уже есть */
    public synchronized boolean addProduct(String productId) {
        String p = normalize(productId);
        if (p.isEmpty() || products.contains(p)) {
            return false;
        }
        products.add(p);
        return true;
    }

    /** @return false, если не было */
    public synchronized boolean removeProduct(String productId) {
        return products.remove(normalize(productId));
    }

    public static String normalize(String productId) {
        return productId == null ? "" : productId.trim().toUpperCase(Locale.ROOT);
    }
}
