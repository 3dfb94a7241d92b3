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

package io.github.spindler.modules.dataprocessing.baseline;

import io.github.spindler.modules.dataprocessing.baseline.ThresholdPolicy.MeanEnergyMultiplier;
import io.github.spindler.modules.dataprocessing.baseline.ThresholdPolicy.PercentileOfRms;
import io.github.spindler.modules.dataprocessing.baseline.ThresholdPolicy.StdMultiplier;
import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Logger;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.jetbrains.annotations.NotNull;

/**
 * Turns baseline data into a scalar threshold.
 */
public final class BaselineEstimator {

  private static final Logger logger = Logger.getLogger(BaselineEstimator.class.getName());

  private BaselineEstimator() {
  }

  public static double estimate(@NotNull BaselineData baseline, @NotNull ThresholdPolicy policy)
      throws EmptyBaselineException {
    Objects.requireNonNull(baseline, "baseline");
    Objects.requireNonNull(policy, "policy");

    final double threshold;
    if (policy instanceof PercentileOfRms p) {
      threshold = percentile(requireValues(baseline.features(), baseline), p.percentile());
    } else if (policy instanceof StdMultiplier s) {
      // bias corrected, n - 1
      threshold = s.k() * new StandardDeviation(true).evaluate(
          requireValues(baseline.amplitude(), baseline));
    } else if (policy instanceof MeanEnergyMultiplier m) {
      threshold = m.k() * new Mean().evaluate(requireValues(baseline.features(), baseline));
    } else {
      throw new IllegalArgumentException("Unsupported threshold policy " + policy);
    }
    logger.fine(() -> "Threshold " + threshold + " from " + policy);
    return threshold;
  }

  /**
   * Value at 0-based index {@code ceil(p/100 * N)} of the sorted values, clamped to the maximum.
   */
  public static double percentile(double @NotNull [] values, double percentile) {
    if (values.length == 0) {
      throw new IllegalArgumentException("No values");
    }
    final double[] sorted = values.clone();
    Arrays.sort(sorted);
    final int index = (int) Math.ceil(percentile / 100d * sorted.length);
    return sorted[Math.min(index, sorted.length - 1)];
  }

  private static double[] requireValues(double[] values, BaselineData baseline)
      throws EmptyBaselineException {
    if (values.length == 0) {
      throw new EmptyBaselineException(
          "No baseline values left out of " + baseline.totalSegments() + " segments",
          baseline.excludedSamples());
    }
    return values;
  }
}
