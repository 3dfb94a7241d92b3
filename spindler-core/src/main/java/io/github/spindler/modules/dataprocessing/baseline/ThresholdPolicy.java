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

/**
 * How the baseline statistic becomes a detection threshold.
 */
public interface ThresholdPolicy {

  /**
   * Sorted baseline feature values, 1-indexed rank {@code ceil(p/100 * N) + 1}. The extra rank
   * above the exact percentile belongs to the published method.
   */
  record PercentileOfRms(double percentile) implements ThresholdPolicy {

    public PercentileOfRms {
      if (!(percentile > 0d && percentile <= 100d)) {
        throw new IllegalArgumentException("Percentile must be in (0, 100], was " + percentile);
      }
    }
  }

  /**
   * {@code k} times the standard deviation of the filtered baseline amplitude (not the feature).
   */
  record StdMultiplier(double k) implements ThresholdPolicy {

    public StdMultiplier {
      if (!(k > 0d)) {
        throw new IllegalArgumentException("Multiplier must be positive, was " + k);
      }
    }
  }

  /**
   * {@code k} times the mean of the baseline feature (energy) curve.
   */
  record MeanEnergyMultiplier(double k) implements ThresholdPolicy {

    public MeanEnergyMultiplier {
      if (!(k > 0d)) {
        throw new IllegalArgumentException("Multiplier must be positive, was " + k);
      }
    }
  }
}
