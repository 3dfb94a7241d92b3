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

package io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.rms;

import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureCurve;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureExtractor;
import org.jetbrains.annotations.NotNull;

/**
 * RMS over consecutive non-overlapping windows, broadcast to every sample of the window.
 * <p>
 * A trailing partial window longer than half a window gets its own RMS. A shorter one repeats
 * the RMS of the previous window instead of computing a statistic over a handful of samples.
 */
public class FixedWindowRmsExtractor implements FeatureExtractor {

  private final double resolutionSeconds;

  public FixedWindowRmsExtractor(double resolutionSeconds) {
    if (!(resolutionSeconds > 0d)) {
      throw new IllegalArgumentException("RMS window must be positive, was " + resolutionSeconds);
    }
    this.resolutionSeconds = resolutionSeconds;
  }

  public double getResolutionSeconds() {
    return resolutionSeconds;
  }

  public static int windowLength(double resolutionSeconds, double sampleRate) {
    return Math.max(1, (int) Math.round(resolutionSeconds * sampleRate));
  }

  @Override
  public @NotNull FeatureCurve extract(double @NotNull [] filtered, double sampleRate) {
    final int n = filtered.length;
    final int w = windowLength(resolutionSeconds, sampleRate);
    final double[] curve = new double[n];
    final int fullWindows = n / w;

    double previous = Double.NaN;
    for (int win = 0; win < fullWindows; win++) {
      final int from = win * w;
      previous = rms(filtered, from, from + w);
      fill(curve, from, from + w, previous);
    }

    final int tailStart = fullWindows * w;
    final int tail = n - tailStart;
    if (tail > 0) {
      final boolean ownStatistic = tail > Math.round(w / 2d) || fullWindows == 0;
      final double value = ownStatistic ? rms(filtered, tailStart, n) : previous;
      fill(curve, tailStart, n, value);
    }
    return FeatureCurve.fullyValid(curve);
  }

  static double rms(double[] x, int from, int to) {
    double sum = 0d;
    for (int i = from; i < to; i++) {
      sum += x[i] * x[i];
    }
    return Math.sqrt(sum / (to - from));
  }

  private static void fill(double[] curve, int from, int to, double value) {
    for (int i = from; i < to; i++) {
      curve[i] = value;
    }
  }

  @Override
  public @NotNull String getName() {
    return "Fixed window RMS (" + resolutionSeconds + " s)";
  }
}
