package com.advisorplatform.specialist.indicator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Price-series math behind the quant and forecast specialists.
 *
 * <p>Every series arrives as the market data port returns it: newest close at index 0.
 * Each calculation answers {@code NaN} (or {@code null} for the trendline) rather than
 * throwing when the series is too short, so a thin snapshot lowers specialist confidence
 * instead of failing the turn.
 */
public final class TechnicalIndicators {

    private static final String INSUFFICIENT = "INSUFFICIENT_DATA";

    private static final int MACD_FAST = 12;
    private static final int MACD_SLOW = 26;

    private TechnicalIndicators() {}

    // ── Momentum ────────────────────────────────────────────────────────────

    /**
     * Relative strength index with Wilder smoothing. A series without a single down move
     * reads as 100.
     */
    public static double rsi(List<Double> prices, int period) {
        if (prices == null || prices.size() <= period) return Double.NaN;

        double[] moves = closeToClose(oldestFirst(prices));
        double up = 0;
        double down = 0;
        for (int i = 0; i < moves.length; i++) {
            double gain = Math.max(moves[i], 0);
            double loss = Math.max(-moves[i], 0);
            if (i < period) {
                up += gain / period;
                down += loss / period;
            } else {
                up = (up * (period - 1) + gain) / period;
                down = (down * (period - 1) + loss) / period;
            }
        }
        return down == 0 ? 100.0 : 100.0 - 100.0 / (1.0 + up / down);
    }

    /** Fast minus slow EMA of the closes. */
    public static double macd(List<Double> prices) {
        double fast = ema(prices, MACD_FAST);
        double slow = ema(prices, MACD_SLOW);
        return Double.isNaN(fast) || Double.isNaN(slow) ? Double.NaN : fast - slow;
    }

    // ── Averages and dispersion ─────────────────────────────────────────────

    public static double sma(List<Double> prices, int period) {
        if (!covers(prices, period)) return Double.NaN;
        return sum(prices, period) / period;
    }

    /** EMA seeded with the oldest close and run forward over the whole series. */
    public static double ema(List<Double> prices, int period) {
        if (!covers(prices, period)) return Double.NaN;
        double alpha = 2.0 / (period + 1);
        double value = prices.get(prices.size() - 1);
        for (int i = prices.size() - 2; i >= 0; i--) {
            value += alpha * (prices.get(i) - value);
        }
        return value;
    }

    /** Population standard deviation of the newest {@code period} closes. */
    public static double stdDev(List<Double> prices, int period) {
        if (!covers(prices, period)) return Double.NaN;
        double mean = sum(prices, period) / period;
        double squares = 0;
        for (double p : prices.subList(0, period)) {
            squares += (p - mean) * (p - mean);
        }
        return Math.sqrt(squares / period);
    }

    // ── Least-squares trendline ─────────────────────────────────────────────

    /**
     * Ordinary least-squares fit over the newest {@code window} closes, x = 0 for the oldest
     * point in the window. Returns {@code null} when fewer than 3 points are available.
     */
    public static Trendline trendline(List<Double> prices, int window) {
        if (prices == null) return null;
        int n = Math.min(window, prices.size());
        if (n < 3) return null;

        List<Double> ys = oldestFirst(prices.subList(0, n));
        double meanX = (n - 1) / 2.0;
        double meanY = sum(ys, n) / n;

        double sxy = 0, sxx = 0, syy = 0;
        for (int x = 0; x < n; x++) {
            double dx = x - meanX;
            double dy = ys.get(x) - meanY;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        double slope     = sxy / sxx;
        double intercept = meanY - slope * meanX;
        double rSquared  = syy == 0 ? 1.0 : (sxy * sxy) / (sxx * syy);
        return new Trendline(slope, intercept, rSquared, n);
    }

    // ── Labels carried in the quant payload ─────────────────────────────────

    public static String rsiSignal(double rsi) {
        if (Double.isNaN(rsi)) return INSUFFICIENT;
        return rsi > 70 ? "OVERBOUGHT" : rsi < 30 ? "OVERSOLD" : "NEUTRAL";
    }

    /** UPTREND needs price above SMA20 above SMA50; DOWNTREND the mirror image. */
    public static String trendSignal(double sma20, double sma50, double lastClose) {
        if (Double.isNaN(sma20) || Double.isNaN(sma50)) return INSUFFICIENT;
        if (lastClose > sma20 && sma20 > sma50) return "UPTREND";
        if (lastClose < sma20 && sma20 < sma50) return "DOWNTREND";
        return "SIDEWAYS";
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    private static boolean covers(List<Double> prices, int period) {
        return prices != null && period > 0 && prices.size() >= period;
    }

    private static double sum(List<Double> values, int count) {
        double total = 0;
        for (int i = 0; i < count; i++) total += values.get(i);
        return total;
    }

    private static double[] closeToClose(List<Double> oldestFirst) {
        double[] moves = new double[oldestFirst.size() - 1];
        for (int i = 1; i < oldestFirst.size(); i++) {
            moves[i - 1] = oldestFirst.get(i) - oldestFirst.get(i - 1);
        }
        return moves;
    }

    private static List<Double> oldestFirst(List<Double> newestFirst) {
        List<Double> copy = new ArrayList<>(newestFirst);
        Collections.reverse(copy);
        return copy;
    }
}
