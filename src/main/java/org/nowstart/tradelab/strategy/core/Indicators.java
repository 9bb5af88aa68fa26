package org.nowstart.tradelab.strategy.core;

import java.util.Arrays;
import java.util.List;
import org.nowstart.tradelab.data.dto.Bar;

/**
 * Array-based indicator helpers. Undefined leading values are {@code NaN}.
 */
public final class Indicators {

    private Indicators() {
    }

    public static double[] closes(List<Bar> bars) {
        double[] close = new double[bars.size()];
        for (int i = 0; i < bars.size(); i++) {
            close[i] = bars.get(i).close();
        }
        return close;
    }

    public static double[] simpleMovingAverage(double[] values, int period) {
        requirePeriod(period);
        double[] out = new double[values.length];
        Arrays.fill(out, Double.NaN);
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= period) {
                sum -= values[i - period];
            }
            if (i >= period - 1) {
                out[i] = sum / period;
            }
        }
        return out;
    }

    /**
     * Recursive EMA with {@code alpha = 2 / (period + 1)}, seeded with the first value.
     */
    public static double[] exponentialMovingAverage(double[] values, int period) {
        requirePeriod(period);
        double[] out = new double[values.length];
        if (values.length == 0) {
            return out;
        }
        double alpha = 2.0 / (period + 1.0);
        out[0] = values[0];
        for (int i = 1; i < values.length; i++) {
            out[i] = alpha * values[i] + (1.0 - alpha) * out[i - 1];
        }
        return out;
    }

    /**
     * RSI from simple rolling means of gains and losses over a {@code period}-bar window. The first bar has no
     * price change and contributes a zero gain and loss, so the first defined value is at {@code period - 1}.
     *
     * <p>100 when the average loss is 0 and the average gain is positive; {@code NaN} when both are 0.
     */
    public static double[] relativeStrengthIndex(double[] values, int period) {
        requirePeriod(period);
        double[] out = new double[values.length];
        Arrays.fill(out, Double.NaN);

        double[] gain = new double[values.length];
        double[] loss = new double[values.length];
        for (int i = 1; i < values.length; i++) {
            double delta = values[i] - values[i - 1];
            gain[i] = Math.max(delta, 0.0);
            loss[i] = Math.max(-delta, 0.0);
        }

        double gainSum = 0.0;
        double lossSum = 0.0;
        for (int i = 0; i < values.length; i++) {
            gainSum += gain[i];
            lossSum += loss[i];
            if (i >= period) {
                gainSum -= gain[i - period];
                lossSum -= loss[i - period];
            }
            if (i >= period - 1) {
                out[i] = rsi(gainSum / period, lossSum / period);
            }
        }
        return out;
    }

    public static boolean crossedAbove(double[] fast, double[] slow, int index) {
        if (!definedAt(fast, slow, index)) {
            return false;
        }
        return fast[index - 1] <= slow[index - 1] && fast[index] > slow[index];
    }

    public static boolean crossedBelow(double[] fast, double[] slow, int index) {
        if (!definedAt(fast, slow, index)) {
            return false;
        }
        return fast[index - 1] >= slow[index - 1] && fast[index] < slow[index];
    }

    private static boolean definedAt(double[] a, double[] b, int index) {
        if (index < 1) {
            return false;
        }
        return Double.isFinite(a[index]) && Double.isFinite(a[index - 1])
                && Double.isFinite(b[index]) && Double.isFinite(b[index - 1]);
    }

    private static double rsi(double averageGain, double averageLoss) {
        // tiny negative sums from rolling subtraction
        double gain = Math.max(averageGain, 0.0);
        double loss = Math.max(averageLoss, 0.0);
        if (loss <= 1e-12) {
            return gain <= 1e-12 ? Double.NaN : 100.0;
        }
        double rs = gain / loss;
        return 100.0 - 100.0 / (1.0 + rs);
    }

    private static void requirePeriod(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("period must be > 0");
        }
    }
}
