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
 * RMS of a centered window evaluated every {@code hopSamples} samples. Centers closer than half a
 * window to either end of the signal are not evaluated, there is no extrapolation; those margins
 * fall outside the valid region of the curve.
 */
public class SlidingWindowRmsExtractor implements FeatureExtractor {

  private final double windowSeconds;
  private final int hopSamples;

  public SlidingWindowRmsExtractor(double windowSeconds, int hopSamples) {
    if (!(windowSeconds > 0d)) {
      throw new IllegalArgumentException("RMS window must be positive, was " + windowSeconds);
    }
    if (hopSamples < 1) {
      throw new IllegalArgumentException("Hop must be at least one sample, was " + hopSamples);
    }
    this.windowSeconds = windowSeconds;
    this.hopSamples = hopSamples;
  }

  public double getWindowSeconds() {
    return windowSeconds;
  }

  public int getHopSamples() {
    return hopSamples;
  }

  @Override
  public @NotNull FeatureCurve extract(double @NotNull [] filtered, double sampleRate) {
    final int n = filtered.length;
    final int w = Math.max(1, (int) Math.round(windowSeconds * sampleRate));
    final int half = w / 2;
    if (hopSamples >= half) {
      throw new IllegalArgumentException(
          "Hop of " + hopSamples + " samples must be below the half window of " + half
              + " samples");
    }
    final double[] curve = new double[n];
    final int validTo = n - half;
    if (validTo <= half) {
      // signal shorter than one window, nothing can be evaluated
      return new FeatureCurve(curve, 0, 0);
    }

    final double[] cumSquares = new double[n + 1];
    for (int i = 0; i < n; i++) {
      cumSquares[i + 1] = cumSquares[i] + filtered[i] * filtered[i];
    }
    final int span = 2 * half + 1;
    for (int c = half; c < validTo; c += hopSamples) {
      final double sum = cumSquares[c + half + 1] - cumSquares[c - half];
      final double value = Math.sqrt(Math.max(0d, sum) / span);
      final int to = Math.min(c + hopSamples, validTo);
      for (int i = c; i < to; i++) {
        curve[i] = value;
      }
    }
    return new FeatureCurve(curve, half, validTo);
  }

  @Override
  public @NotNull String getName() {
    return "Sliding window RMS (" + windowSeconds + " s, hop " + hopSamples + ")";
  }
}
