package com.chicu.signalbot.config;

import com.chicu.signalbot.common.enums.MovingAverageType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "bot")
public class BotProperties {

    private Discord discord = new Discord();
    private Schedule schedule = new Schedule();
    private Purge purge = new Purge();
    private Scan scan = new Scan();
    private Debrid debrid = new Debrid();

    @Data
    public static class Discord {
        /** пусто → клиент Discord не поднимается */
        private String token;
        private String prefix = "!";
        private String ownerId;
    }

    @Data
    public static class Schedule {
        /** Фиксированное смещение опорного пояса, DST не учитывается. */
        private String referenceOffset = "-07:00";
        private int poolSize = 4;
        private Duration reminderTolerance = Duration.ofMinutes(1);
        private Duration confirmationWindow = Duration.ofSeconds(15);
    }

    @Data
    public static class Purge {
        private String channelName;
        /**
         * Сырое значение из окружения, валидируется на старте.
         * Строка, чтобы мусор не ронял биндинг всего конфига.
         */
        private String intervalHours = "6";
    }

    @Data
    public static class Scan {
        private String baseUrl = "https://api.exchange.coinbase.com";
        private int lookback = 300;
        /** day / swing / long → переопределения пресета */
        private Map<String, StrategySettings> strategies = new LinkedHashMap<>();
    }

    /**
     * Любое null-поле берётся из пресета стратегии.
     * channelName = "" выключает стратегию.
     */
    @Data
    public static class StrategySettings {
        private String channelName;
        private Duration interval;
        private String products;

        private MovingAverageType trendIndicator;
        private Integer trendPeriod;
        private MovingAverageType signalIndicator;
        private Integer shortPeriod;
        private Integer longPeriod;
        private Double volumeSpikeMultiplier;
        private Boolean volumeFilterEnabled;
        private Double atrStopLossMultiplier;
        private Double riskPerTradePercent;
        private Double portfolioSize;
    }

    @Data
    public static class Debrid {
        private String apiKey;
        private String baseUrl = "https://api.alldebrid.com";
    }
}
