/*
 * Copyright (c) 2026 The spindler Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.spindler.modules.spindledetection;

import io.github.spindler.modules.dataprocessing.baseline.ThresholdPolicy;
import io.github.spindler.modules.dataprocessing.baseline.ThresholdPolicy.MeanEnergyMultiplier;
import io.github.spindler.modules.dataprocessing.baseline.ThresholdPolicy.PercentileOfRms;
import io.github.spindler.modules.dataprocessing.baseline.ThresholdPolicy.StdMultiplier;
import io.github.spindler.modules.dataprocessing.eventdet.BoundaryConvention;
import io.github.spindler.modules.dataprocessing.eventdet.DurationConvention;
import io.github.spindler.modules.dataprocessing.eventdet.LowerBound;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureSpec;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureSpec.FixedRms;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureSpec.SlidingRms;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureSpec.WaveletEnergy;
import io.github.spindler.modules.dataprocessing.filter_fir.FilterSpec;
import io.github.spindler.modules.dataprocessing.filter_fir.FilterSpec.EquirippleFir;
import io.github.spindler.modules.dataprocessing.filter_fir.FilterSpec.WindowedFir;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Complete configuration of a detection run.
 * <p>
 * Recognized property keys, all optional, applied on top of the preset named by {@code method}:
 * <ul>
 *   <li>{@code method}: MARTIN, MOLLE or WAMSLEY (default MARTIN)</li>
 *   <li>{@code filter.order}, {@code filter.lowHz}, {@code filter.highHz}: windowed FIR</li>
 *   <li>{@code filter.stopLowHz}, {@code filter.passLowHz}, {@code filter.passHighHz},
 *   {@code filter.stopHighHz}, {@code filter.stopAttenDb}, {@code filter.passRippleDb}:
 *   equiripple FIR</li>
 *   <li>{@code windowLengthSec}: RMS window, {@code hopSamples}: sliding RMS hop</li>
 *   <li>{@code wavelet.bandwidth}, {@code wavelet.centerFrequency}, {@code targetHz},
 *   {@code smoothingSec}: wavelet energy</li>
 *   <li>{@code percentile}: rank selector of the percentile threshold, {@code k}: multiplier of
 *   the std or mean threshold</li>
 *   <li>{@code minDurSec}, {@code maxDurSec}: accepted event durations</li>
 *   <li>{@code minGapSamples}: end-to-end distance at which events fuse, 0 disables merging</li>
 *   <li>{@code parallelBaseline}: filter baseline segments in parallel</li>
 * </ul>
 * A key that does not apply to the method's filter, feature or threshold is ignored with a
 * warning.
 *
 * @param minGapSamples 0 disables merging
 */
public record SpindleDetectionParameters(@NotNull FilterSpec filter, @NotNull FeatureSpec feature,
                                         @NotNull ThresholdPolicy threshold, double minDurSec,
                                         double maxDurSec,
                                         @NotNull DurationConvention durationConvention,
                                         @NotNull LowerBound lowerBound,
                                         @NotNull BoundaryConvention boundaryConvention,
                                         int minGapSamples, boolean parallelBaseline) {

  private static final Logger logger = Logger.getLogger(
      SpindleDetectionParameters.class.getName());

  public static final String DEFAULTS_RESOURCE = "/spindler-defaults.properties";

  public SpindleDetectionParameters {
    Objects.requireNonNull(filter, "filter");
    Objects.requireNonNull(feature, "feature");
    Objects.requireNonNull(threshold, "threshold");
    Objects.requireNonNull(durationConvention, "durationConvention");
    Objects.requireNonNull(lowerBound, "lowerBound");
    Objects.requireNonNull(boundaryConvention, "boundaryConvention");
    if (minDurSec < 0d || !(maxDurSec >= minDurSec)) {
      throw new IllegalArgumentException(
          "Invalid duration bounds [" + minDurSec + ", " + maxDurSec + "] s");
    }
    if (minGapSamples < 0) {
      throw new IllegalArgumentException("Minimum gap must not be negative: " + minGapSamples);
    }
  }

  public boolean isMergingEnabled() {
    return minGapSamples > 0;
  }

  public @NotNull SpindleDetectionParameters withThreshold(@NotNull ThresholdPolicy threshold) {
    return new SpindleDetectionParameters(filter, feature, threshold, minDurSec, maxDurSec,
        durationConvention, lowerBound, boundaryConvention, minGapSamples, parallelBaseline);
  }

  public @NotNull SpindleDetectionParameters withFilter(@NotNull FilterSpec filter) {
    return new SpindleDetectionParameters(filter, feature, threshold, minDurSec, maxDurSec,
        durationConvention, lowerBound, boundaryConvention, minGapSamples, parallelBaseline);
  }

  public @NotNull SpindleDetectionParameters withFeature(@NotNull FeatureSpec feature) {
    return new SpindleDetectionParameters(filter, feature, threshold, minDurSec, maxDurSec,
        durationConvention, lowerBound, boundaryConvention, minGapSamples, parallelBaseline);
  }

  public @NotNull SpindleDetectionParameters withDurationBounds(double minDurSec,
      double maxDurSec) {
    return new SpindleDetectionParameters(filter, feature, threshold, minDurSec, maxDurSec,
        durationConvention, lowerBound, boundaryConvention, minGapSamples, parallelBaseline);
  }

  public @NotNull SpindleDetectionParameters withBoundaryConvention(
      @NotNull BoundaryConvention boundaryConvention) {
    return new SpindleDetectionParameters(filter, feature, threshold, minDurSec, maxDurSec,
        durationConvention, lowerBound, boundaryConvention, minGapSamples, parallelBaseline);
  }

  public @NotNull SpindleDetectionParameters withMinGapSamples(int minGapSamples) {
    return new SpindleDetectionParameters(filter, feature, threshold, minDurSec, maxDurSec,
        durationConvention, lowerBound, boundaryConvention, minGapSamples, parallelBaseline);
  }

  public @NotNull SpindleDetectionParameters withParallelBaseline(boolean parallelBaseline) {
    return new SpindleDetectionParameters(filter, feature, threshold, minDurSec, maxDurSec,
        durationConvention, lowerBound, boundaryConvention, minGapSamples, parallelBaseline);
  }

  /**
   * Loads a properties file from the classpath and applies it, see {@link #fromProperties}.
   *
   * @throws IOException if the resource is missing or unreadable
   */
  public static @NotNull SpindleDetectionParameters fromResource(@NotNull String resource)
      throws IOException {
    try (InputStream in = SpindleDetectionParameters.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IOException("Resource not found: " + resource);
      }
      final Properties properties = new Properties();
      properties.load(in);
      return fromProperties(properties);
    }
  }

  /**
   * @throws IllegalArgumentException on an unknown method or a malformed number
   */
  public static @NotNull SpindleDetectionParameters fromProperties(
      @NotNull Properties properties) {
    Objects.requireNonNull(properties, "properties");
    final String methodName = properties.getProperty("method", SpindleMethod.MARTIN.name())
        .trim().toUpperCase(Locale.ROOT);
    final SpindleMethod method;
    try {
      method = SpindleMethod.valueOf(methodName);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown spindle detection method: " + methodName, e);
    }
    final SpindleDetectionParameters defaults = method.getParameters();

    final FilterSpec filter = readFilter(properties, defaults.filter());
    final FeatureSpec feature = readFeature(properties, defaults.feature());
    final ThresholdPolicy threshold = readThreshold(properties, defaults.threshold());
    final double minDurSec = number(properties, "minDurSec", defaults.minDurSec());
    final double maxDurSec = number(properties, "maxDurSec", defaults.maxDurSec());
    final int minGapSamples = integer(properties, "minGapSamples", defaults.minGapSamples());
    final boolean parallel = Boolean.parseBoolean(
        properties.getProperty("parallelBaseline", String.valueOf(defaults.parallelBaseline()))
            .trim());

    final SpindleDetectionParameters parameters = new SpindleDetectionParameters(filter, feature,
        threshold, minDurSec, maxDurSec, defaults.durationConvention(), defaults.lowerBound(),
        defaults.boundaryConvention(), minGapSamples, parallel);
    logger.fine(() -> "Configured " + method + ": " + parameters);
    return parameters;
  }

  private static FilterSpec readFilter(Properties p, FilterSpec defaults) {
    if (defaults instanceof WindowedFir w) {
      ignore(p, "filter.stopLowHz", "filter.passLowHz", "filter.passHighHz", "filter.stopHighHz",
          "filter.stopAttenDb", "filter.passRippleDb");
      return new WindowedFir(integer(p, "filter.order", w.order()),
          number(p, "filter.lowHz", w.lowHz()), number(p, "filter.highHz", w.highHz()));
    }
    if (defaults instanceof EquirippleFir e) {
      ignore(p, "filter.order", "filter.lowHz", "filter.highHz");
      return new EquirippleFir(number(p, "filter.stopLowHz", e.stopLowHz()),
          number(p, "filter.passLowHz", e.passLowHz()),
          number(p, "filter.passHighHz", e.passHighHz()),
          number(p, "filter.stopHighHz", e.stopHighHz()),
          number(p, "filter.stopAttenDb", e.stopAttenDb()),
          number(p, "filter.passRippleDb", e.passRippleDb()));
    }
    return defaults;
  }

  private static FeatureSpec readFeature(Properties p, FeatureSpec defaults) {
    if (defaults instanceof FixedRms f) {
      ignore(p, "hopSamples", "wavelet.bandwidth", "wavelet.centerFrequency", "targetHz",
          "smoothingSec");
      return new FixedRms(number(p, "windowLengthSec", f.windowLengthSec()));
    }
    if (defaults instanceof SlidingRms s) {
      ignore(p, "wavelet.bandwidth", "wavelet.centerFrequency", "targetHz", "smoothingSec");
      return new SlidingRms(number(p, "windowLengthSec", s.windowLengthSec()),
          integer(p, "hopSamples", s.hopSamples()));
    }
    if (defaults instanceof WaveletEnergy w) {
      ignore(p, "windowLengthSec", "hopSamples");
      return new WaveletEnergy(number(p, "wavelet.bandwidth", w.bandwidth()),
          number(p, "wavelet.centerFrequency", w.centerFrequency()),
          number(p, "targetHz", w.targetHz()), number(p, "smoothingSec", w.smoothingSec()));
    }
    return defaults;
  }

  private static ThresholdPolicy readThreshold(Properties p, ThresholdPolicy defaults) {
    if (defaults instanceof PercentileOfRms r) {
      ignore(p, "k");
      return new PercentileOfRms(number(p, "percentile", r.percentile()));
    }
    ignore(p, "percentile");
    if (defaults instanceof StdMultiplier s) {
      return new StdMultiplier(number(p, "k", s.k()));
    }
    if (defaults instanceof MeanEnergyMultiplier m) {
      return new MeanEnergyMultiplier(number(p, "k", m.k()));
    }
    return defaults;
  }

  private static void ignore(Properties p, String... keys) {
    for (String key : keys) {
      if (p.getProperty(key) != null) {
        logger.warning(() -> "Property " + key + " does not apply to the configured method");
      }
    }
  }

  private static double number(Properties p, String key, double defaultValue) {
    final String value = p.getProperty(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + key + " is not a number: " + value, e);
    }
  }

  private static int integer(Properties p, String key, int defaultValue) {
    final String value = p.getProperty(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + key + " is not an integer: " + value, e);
    }
  }
}
