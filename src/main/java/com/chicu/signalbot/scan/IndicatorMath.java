package com.chicu.signalbot.scan;

import com.chicu.signalbot.market.CandleProvider;

import java.util.List;

/**
 * Индикаторы над массивами цен. Все ряды той же длины, что и вход.
 */
final class IndicatorMath {

    private IndicatorMath() {
    }

    static double[] closes(List<CandleProvider.Candle> candles) {
        double[] out = new double[candles.size()];
        for (int i = 0; i < out.length; i++) out[i] = candles.get(i).close();
        return out;
    }

    static double[] volumes(List<CandleProvider.Candle> candles) {
        double[] out = new double[candles.size()];
        for (int i = 0; i < out.length; i++) out[i] = candles.get(i).volume();
        return out;
    }

    static double[] ema(double[] arr, int p) {
        double[] out = new double[arr.length];
        if (arr.length == 0) return out;
        double k = 2.0 / (p + 1);
        double v = arr[0];
        out[0] = v;
        for (int i = 1; i < arr.length; i++) {
            v = arr[i] * k + v * (1 - k);
            out[i] = v;
        }
        return out;
    }

    /** Скользящее среднее; первые p-1 значений: среднее по доступной части. */
    static double[] sma(double[] arr, int p) {
        double[] out = new double[arr.length];
        double sum = 0;
        for (int i = 0; i < arr.length; i++) {
            sum += arr[i];
            if (i >= p) sum -= arr[i - p];
            out[i] = sum / Math.min(i + 1, p);
        }
        return out;
    }

    static double rsi(double[] arr, int p) {
        double gain = 0, loss = 0;
        for (int i = arr.length - p; i < arr.length; i++) {
            double d = arr[i] - arr[i - 1];
            if (d > 0) gain += d;
            else loss -= d;
        }
        if (loss == 0) return 100;
        return 100 - (100 / (1 + gain / loss));
    }

    /** Гистограмма MACD на последнем баре: (ema fast - ema slow) - signal. */
    static double macdHistogram(double[] arr, int fast, int slow, int signal) {
        double[] f = ema(arr, fast);
        double[] s = ema(arr, slow);
        double[] macd = new double[arr.length];
        for (int i = 0; i < arr.length; i++) macd[i] = f[i] - s[i];
        double[] sig = ema(macd, signal);
        int last = arr.length - 1;
        return macd[last] - sig[last];
    }

    /** Средний истинный диапазон по последним p барам. */
    static double atr(List<CandleProvider.Candle> candles, int p) {
        int n = candles.size();
        double sum = 0;
        for (int i = n - p; i < n; i++) {
            CandleProvider.Candle c = candles.get(i);
            double prevClose = candles.get(i - 1).close();
            double tr = Math.max(c.high() - c.low(),
                    Math.max(Math.abs(c.high() - prevClose), Math.abs(c.low() - prevClose)));
            sum += tr;
        }
        return sum / p;
    }
}
