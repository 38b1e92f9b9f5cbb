package com.chicu.signalbot.config;

import com.chicu.signalbot.debrid.AllDebridClient;
import com.chicu.signalbot.engine.IntervalSpec;
import com.chicu.signalbot.market.CandleProvider;
import com.chicu.signalbot.market.CoinbaseCandleProvider;
import com.chicu.signalbot.scan.RsiEmaSignalEvaluator;
import com.chicu.signalbot.scan.ScanStrategy;
import com.chicu.signalbot.scan.StrategyCatalog;
import com.chicu.signalbot.scan.StrategyParams;
import com.chicu.signalbot.scan.StrategyPreset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Configuration
public class ScanConfig {

    @Bean
    public CandleProvider candleProvider(RestTemplate restTemplate, BotProperties props) {
        return new CoinbaseCandleProvider(restTemplate, props.getScan().getBaseUrl());
    }

    @Bean
    public AllDebridClient allDebridClient(RestTemplate restTemplate, BotProperties props) {
        return new AllDebridClient(restTemplate, props.getDebrid().getBaseUrl(), props.getDebrid().getApiKey());
    }

    @Bean
    public StrategyCatalog strategyCatalog(BotProperties props) {
        List<ScanStrategy> strategies = new ArrayList<>();
        for (StrategyPreset preset : StrategyPreset.all()) {
            BotProperties.StrategySettings s = props.getScan().getStrategies().get(preset.id());
            strategies.add(buildStrategy(preset, s, props.getScan().getLookback()));
        }
        StrategyCatalog catalog = new StrategyCatalog(strategies);
        log.info("📚 Strategies enabled={} disabled={}",
                catalog.enabled().stream().map(ScanStrategy::getId).toList(), catalog.disabledIds());
        return catalog;
    }

    // ================================================================
    // Пресет + переопределения
    // ================================================================
    static ScanStrategy buildStrategy(StrategyPreset preset, BotProperties.StrategySettings s, int lookback) {
        if (s == null) {
            s = new BotProperties.StrategySettings();
        }

        String channel = s.getChannelName() != null ? s.getChannelName() : preset.defaultChannel();
        Duration interval = s.getInterval() != null ? s.getInterval() : preset.defaultInterval();
        if (interval.isNegative()) {
            log.warn("⚠ Strategy '{}': negative interval {}, auto scan disabled", preset.id(), interval);
            interval = Duration.ZERO;
        }

        List<String> products = StrategyPreset.parseProducts(s.getProducts());
        if (products.isEmpty()) {
            products = preset.defaultProducts();
        }

        StrategyParams params = applyOverrides(preset.params(), s);

        return new ScanStrategy(
                preset.id(),
                preset.displayName(),
                channel,
                new IntervalSpec(interval),
                preset.granularity(),
                Math.max(lookback, params.requiredCandles()),
                params,
                new RsiEmaSignalEvaluator(params),
                products
        );
    }

    private static StrategyParams applyOverrides(StrategyParams base, BotProperties.StrategySettings s) {
        StrategyParams.StrategyParamsBuilder b = base.toBuilder();
        if (s.getTrendIndicator() != null) b.trendIndicator(s.getTrendIndicator());
        if (s.getTrendPeriod() != null) b.trendPeriod(s.getTrendPeriod());
        if (s.getSignalIndicator() != null) b.signalIndicator(s.getSignalIndicator());
        if (s.getShortPeriod() != null) b.shortPeriod(s.getShortPeriod());
        if (s.getLongPeriod() != null) b.longPeriod(s.getLongPeriod());
        if (s.getVolumeSpikeMultiplier() != null) b.volumeSpikeMultiplier(s.getVolumeSpikeMultiplier());
        if (s.getVolumeFilterEnabled() != null) b.volumeFilterEnabled(s.getVolumeFilterEnabled());
        if (s.getAtrStopLossMultiplier() != null) b.atrStopLossMultiplier(s.getAtrStopLossMultiplier());
        if (s.getRiskPerTradePercent() != null) b.riskPerTradePercent(s.getRiskPerTradePercent());
        if (s.getPortfolioSize() != null) b.portfolioSize(s.getPortfolioSize());
        return b.build();
    }
}
