package com.chicu.signalbot.market;

import lombok.extern.slf4j.Slf4j;
import org.json.JSONArray;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Свечи с публичного REST Coinbase Exchange.
 *
 * GET /products/{id}/candles?granularity=N →
 * [[time(sec), low, high, open, close, volume], ...] от новых к старым, не больше 300 штук.
 * Неподдерживаемые размеры (4h и т.п.) собираются из ближайшего меньшего делителя.
 */
@Slf4j
public class CoinbaseCandleProvider implements CandleProvider {

    static final long[] SUPPORTED_SECONDS = {86400, 21600, 3600, 900, 300, 60};

    private final RestTemplate rest;
    private final String baseUrl;

    public CoinbaseCandleProvider(RestTemplate rest, String baseUrl) {
        this.rest = rest;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public List<Candle> getRecentCandles(String productId, Duration granularity, int limit) {
        long step = granularity.getSeconds();
        long base = baseGranularity(step);

        String raw = fetch(productId, base);
        List<Candle> candles = parse(raw);
        log.debug("📈 Coinbase {} granularity={}s → {} candles", productId, base, candles.size());

        if (base == step) {
            int from = Math.max(0, candles.size() - limit);
            return candles.subList(from, candles.size());
        }
        return CandleResampler.resample(candles, step, limit);
    }

    /** Самый крупный поддерживаемый размер, на который делится запрошенный. */
    static long baseGranularity(long stepSeconds) {
        for (long s : SUPPORTED_SECONDS) {
            if (s <= stepSeconds && stepSeconds % s == 0) {
                return s;
            }
        }
        throw new IllegalArgumentException("granularity " + stepSeconds + "s is not supported");
    }

    private String fetch(String productId, long granularitySec) {
        String url = baseUrl + "/products/" + productId + "/candles?granularity=" + granularitySec;

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.USER_AGENT, "signal-bot");

        ResponseEntity<String> resp = rest.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), String.class);
        if (!resp.getStatusCode().is2xxSuccessful() || resp.getBody() == null) {
            throw new IllegalStateException("Coinbase candles " + productId + ": HTTP " + resp.getStatusCode().value());
        }
        return resp.getBody();
    }

    static List<Candle> parse(String rawJson) {
        JSONArray arr = new JSONArray(rawJson);
        List<Candle> out = new ArrayList<>(arr.length());

        for (int i = 0; i < arr.length(); i++) {
            JSONArray row = arr.getJSONArray(i);
            out.add(new Candle(
                    row.getLong(0) * 1000L,
                    row.getDouble(3),   // open
                    row.getDouble(2),   // high
                    row.getDouble(1),   // low
                    row.getDouble(4),   // close
                    row.getDouble(5)    // volume
            ));
        }

        out.sort(Comparator.comparingLong(Candle::time));
        return out;
    }
}
