package com.chicu.signalbot.market;

import com.chicu.signalbot.market.CandleProvider.Candle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class CoinbaseCandleProviderTest {

    private static final String BASE = "https://api.exchange.coinbase.com";

    private MockRestServiceServer server;
    private CoinbaseCandleProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate rest = new RestTemplate();
        server = MockRestServiceServer.bindTo(rest).build();
        provider = new CoinbaseCandleProvider(rest, BASE + "/");
    }

    @Test
    void parse_shouldMapColumnsAndSortAscending() {
        // [time, low, high, open, close, volume], новые первыми
        String json = "[[1700000300, 9.5, 11.0, 10.0, 10.5, 120.0],"
                + "[1700000000, 8.0, 10.2, 9.0, 10.0, 80.0]]";

        List<Candle> candles = CoinbaseCandleProvider.parse(json);

        assertEquals(2, candles.size());
        Candle first = candles.get(0);
        assertEquals(1700000000_000L, first.time());
        assertEquals(9.0, first.open(), 1e-9);
        assertEquals(10.2, first.high(), 1e-9);
        assertEquals(8.0, first.low(), 1e-9);
        assertEquals(10.0, first.close(), 1e-9);
        assertEquals(80.0, first.volume(), 1e-9);
        assertEquals(10.5, candles.get(1).close(), 1e-9);
    }

    @Test
    void baseGranularity_shouldPickLargestSupportedDivisor() {
        assertEquals(300, CoinbaseCandleProvider.baseGranularity(300));
        assertEquals(3600, CoinbaseCandleProvider.baseGranularity(4 * 3600));
        assertEquals(86400, CoinbaseCandleProvider.baseGranularity(86400));
        assertEquals(21600, CoinbaseCandleProvider.baseGranularity(12 * 3600));
        assertThrows(IllegalArgumentException.class, () -> CoinbaseCandleProvider.baseGranularity(30));
    }

    @Test
    void supportedGranularity_shouldRequestDirectly_andTrimToLimit() {
        server.expect(requestTo(BASE + "/products/AVAX-USD/candles?granularity=300"))
                .andExpect(header(HttpHeaders.USER_AGENT, "signal-bot"))
                .andRespond(withSuccess("[[600,1,2,1,2,5],[300,1,2,1,1.5,5],[0,1,2,1,1,5]]",
                        MediaType.APPLICATION_JSON));

        List<Candle> candles = provider.getRecentCandles("AVAX-USD", Duration.ofMinutes(5), 2);

        server.verify();
        assertEquals(2, candles.size());
        assertEquals(300_000L, candles.get(0).time());
        assertEquals(2.0, candles.get(1).close(), 1e-9);
    }

    @Test
    void fourHours_shouldBeResampledFromHourly() {
        StringBuilder json = new StringBuilder("[");
        for (int i = 7; i >= 0; i--) {
            json.append("[").append(i * 3600).append(",1,2,1,").append(i).append(",1]");
            if (i > 0) json.append(',');
        }
        json.append(']');

        server.expect(requestTo(BASE + "/products/QNT-USD/candles?granularity=3600"))
                .andRespond(withSuccess(json.toString(), MediaType.APPLICATION_JSON));

        List<Candle> candles = provider.getRecentCandles("QNT-USD", Duration.ofHours(4), 10);

        server.verify();
        assertEquals(2, candles.size());
        assertEquals(3.0, candles.get(0).close(), 1e-9);
        assertEquals(4.0, candles.get(0).volume(), 1e-9);
    }

    @Test
    void httpError_shouldPropagate() {
        server.expect(requestTo(BASE + "/products/NOPE-USD/candles?granularity=300"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThrows(HttpClientErrorException.class,
                () -> provider.getRecentCandles("NOPE-USD", Duration.ofMinutes(5), 10));
    }
}
