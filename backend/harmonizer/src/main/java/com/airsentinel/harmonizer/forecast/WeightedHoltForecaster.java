package com.airsentinel.harmonizer.forecast;

import com.airsentinel.core.error.ForecastException;
import com.airsentinel.core.error.ForecastReason;
import com.airsentinel.core.model.ForecastPoint;
import com.airsentinel.core.model.ForecastResult;
import com.airsentinel.core.model.JointSample;
import com.airsentinel.core.model.JointSeries;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Holt's linear-trend exponential smoothing over the bucket index.
 * <p>
 * Missing buckets are stepped over: the level is carried across the gap along the trend. Imputed
 * buckets update the state with both gains scaled by {@link ForecastSettings#imputedWeight()} and
 * never contribute residuals, so a run of interpolated values cannot tighten the band or dominate
 * the fit. Observed outliers (Tukey fences) are left out of the fit entirely, along with
 * any imputed bucket interpolated from one. Level and trend start from the first two observed buckets.
 * <p>
 * The band half-width {@code h} steps past the last fitted bucket is
 * {@code z σ sqrt(1 + Σ_{j<h} α²(1 + jβ)²)}, with {@code σ} the RMS of the one-step-ahead residuals
 * on observed buckets. Near zero the band is shifted up rather than cut, so its width stays {@code 2·hw}.
 */
public final class WeightedHoltForecaster implements Forecaster {
    public static final String MODEL_TYPE = "weighted-holt";

    private final ForecastSettings settings;

    public WeightedHoltForecaster(ForecastSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
    }

    @Override
    public String modelType() {
        return MODEL_TYPE;
    }

    @Override
    public ForecastResult forecast(JointSeries series, int horizonSteps) {
        Objects.requireNonNull(series, "series is required");
        if (horizonSteps < 1) {
            throw new IllegalArgumentException("horizonSteps must be >= 1: " + horizonSteps);
        }
        List<JointSample> samples = series.samples();
        long present = series.presentCount();
        if (present < settings.minHistory()) {
            throw new ForecastException(
                    ForecastReason.INSUFFICIENT_HISTORY,
                    present + " non-missing samples for " + series.pollutant().code() + ", need " + settings.minHistory()
            );
        }

        OutlierFilter outliers = OutlierFilter.fit(observedValues(samples));
        boolean[] rejected = new boolean[samples.size()];
        int discarded = 0;
        for (int i = 0; i < samples.size(); i++) {
            JointSample sample = samples.get(i);
            if (isObserved(sample) && outliers.isOutlier(sample.value())) {
                rejected[i] = true;
                discarded++;
            }
        }
        List<Integer> fitted = new ArrayList<>();
        int observed = 0;
        int imputed = 0;
        for (int i = 0; i < samples.size(); i++) {
            JointSample sample = samples.get(i);
            if (sample.isMissing() || rejected[i]) {
                continue;
            }
            if (sample.isImputed()) {
                if (interpolatedFromRejected(samples, rejected, i)) {
                    continue;
                }
                imputed++;
            } else {
                observed++;
            }
            fitted.add(i);
        }
        if (observed < 2) {
            throw new ForecastException(
                    ForecastReason.INVALID_HISTORY,
                    observed + " observed samples left for " + series.pollutant().code() + " after screening, need 2"
            );
        }

        Fit fit = fit(samples, fitted);
        double sigma = fit.sigma();
        double z = settings.zScore();
        double alpha = settings.levelSmoothing();
        double beta = settings.trendSmoothing();

        int lastBucket = samples.size() - 1;
        Instant lastBucketStart = series.window().start().plus(series.bucketWidth().multipliedBy(lastBucket));
        List<ForecastPoint> points = new ArrayList<>(horizonSteps);
        double varianceSum = 1.0;
        int distance = 0;
        for (int step = 1; step <= horizonSteps; step++) {
            int target = lastBucket - fit.lastIndex() + step;
            while (distance < target - 1) {
                distance++;
                double gain = alpha * (1.0 + distance * beta);
                varianceSum += gain * gain;
            }
            double halfWidth = z * sigma * Math.sqrt(varianceSum);
            double raw = fit.level() + target * fit.trend();
            double estimate = Math.max(0.0, raw);
            double lower = Math.max(0.0, estimate - halfWidth);
            double upper = Math.max(estimate, lower + 2.0 * halfWidth);
            points.add(new ForecastPoint(
                    lastBucketStart.plus(series.bucketWidth().multipliedBy(step)),
                    estimate,
                    lower,
                    upper
            ));
        }

        return new ForecastResult(
                series.pollutant(),
                MODEL_TYPE,
                settings.confidenceLevel(),
                fitted.size(),
                imputed,
                discarded,
                points
        );
    }

    // Level and trend start from the first two observed buckets; imputed buckets before them are skipped.
    private Fit fit(List<JointSample> samples, List<Integer> fitted) {
        int start = -1;
        int second = -1;
        for (int k = 0; k < fitted.size() && second < 0; k++) {
            if (!samples.get(fitted.get(k)).isImputed()) {
                if (start < 0) {
                    start = k;
                } else {
                    second = fitted.get(k);
                }
            }
        }
        int first = fitted.get(start);
        double level = samples.get(first).value();
        double trend = (samples.get(second).value() - level) / (second - first);
        int lastIndex = first;
        double squaredErrors = 0.0;
        int residuals = 0;

        for (int k = start + 1; k < fitted.size(); k++) {
            int index = fitted.get(k);
            JointSample sample = samples.get(index);
            int gap = index - lastIndex;
            double predicted = level + gap * trend;
            boolean imputed = sample.isImputed();
            if (!imputed && index != second) {
                double error = sample.value() - predicted;
                squaredErrors += error * error;
                residuals++;
            }
            double weight = imputed ? settings.imputedWeight() : 1.0;
            double alpha = settings.levelSmoothing() * weight;
            double beta = settings.trendSmoothing() * weight;
            double nextLevel = alpha * sample.value() + (1.0 - alpha) * predicted;
            trend = beta * (nextLevel - level) / gap + (1.0 - beta) * trend;
            level = nextLevel;
            lastIndex = index;
        }

        double sigma = residuals > 0 ? Math.sqrt(squaredErrors / residuals) : spread(samples, fitted);
        return new Fit(level, trend, lastIndex, sigma);
    }

    // An imputed bucket is tainted when the observed bucket it was interpolated from on either side was rejected.
    private static boolean interpolatedFromRejected(List<JointSample> samples, boolean[] rejected, int index) {
        for (int i = index - 1; i >= 0; i--) {
            if (isObserved(samples.get(i))) {
                if (rejected[i]) {
                    return true;
                }
                break;
            }
        }
        for (int i = index + 1; i < samples.size(); i++) {
            if (isObserved(samples.get(i))) {
                return rejected[i];
            }
        }
        return false;
    }

    private static boolean isObserved(JointSample sample) {
        return !sample.isMissing() && !sample.isImputed();
    }

    // Sample standard deviation of the fitted values, used when too few residuals exist.
    private static double spread(List<JointSample> samples, List<Integer> fitted) {
        double mean = 0.0;
        for (int index : fitted) {
            mean += samples.get(index).value();
        }
        mean /= fitted.size();
        double sum = 0.0;
        for (int index : fitted) {
            double d = samples.get(index).value() - mean;
            sum += d * d;
        }
        return Math.sqrt(sum / (fitted.size() - 1));
    }

    private static double[] observedValues(List<JointSample> samples) {
        return samples.stream()
                .filter(WeightedHoltForecaster::isObserved)
                .mapToDouble(JointSample::value)
                .toArray();
    }

    private record Fit(double level, double trend, int lastIndex, double sigma) {
    }
}
