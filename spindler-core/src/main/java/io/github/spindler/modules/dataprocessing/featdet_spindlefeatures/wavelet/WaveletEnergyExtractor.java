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

package io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.wavelet;

import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureCurve;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureExtractor;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.wavelet.ContinuousWaveletTransform.WaveletCoefficients;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * Wavelet energy at one scale, smoothed by a centered moving average.
 * <p>
 * Energy is {@code Re(c^2)^2 = (re^2 - im^2)^2}, not the squared magnitude. Detections of the
 * wavelet method depend on exactly this value, so it must not be replaced by {@code |c|^2}.
 */
public class WaveletEnergyExtractor implements FeatureExtractor {

  private final ContinuousWaveletTransform transform;
  private final double targetFrequencyHz;
  private final double smoothingSeconds;

  public WaveletEnergyExtractor(@NotNull ContinuousWaveletTransform transform,
      double targetFrequencyHz, double smoothingSeconds) {
    this.transform = Objects.requireNonNull(transform, "transform");
    if (!(targetFrequencyHz > 0d) || !(smoothingSeconds > 0d)) {
      throw new IllegalArgumentException(
          "Target frequency and smoothing window must be positive: " + targetFrequencyHz + ", "
              + smoothingSeconds);
    }
    this.targetFrequencyHz = targetFrequencyHz;
    this.smoothingSeconds = smoothingSeconds;
  }

  public double getTargetFrequencyHz() {
    return targetFrequencyHz;
  }

  public double getSmoothingSeconds() {
    return smoothingSeconds;
  }

  @Override
  public @NotNull FeatureCurve extract(double @NotNull [] filtered, double sampleRate) {
    final double scale = transform.scaleForFrequency(targetFrequencyHz, sampleRate);
    final WaveletCoefficients coefficients = transform.transform(filtered, scale);
    final double[] energy = energy(coefficients);
    final int window = Math.max(1, (int) Math.round(smoothingSeconds * sampleRate));
    return FeatureCurve.fullyValid(movingAverage(energy, window));
  }

  static double[] energy(WaveletCoefficients c) {
    final double[] re = c.real();
    final double[] im = c.imaginary();
    final double[] e = new double[re.length];
    for (int i = 0; i < e.length; i++) {
      // real part of the squared coefficient, squared
      final double realOfSquare = re[i] * re[i] - im[i] * im[i];
      e[i] = realOfSquare * realOfSquare;
    }
    return e;
  }

  /**
   * Same-length convolution with a box of {@code window} samples. Output {@code i} averages
   * {@code [i + window/2 - window + 1, i + window/2]}; samples outside the signal count as 0.
   */
  static double[] movingAverage(double[] x, int window) {
    final int n = x.length;
    final double[] cum = new double[n + 1];
    for (int i = 0; i < n; i++) {
      cum[i + 1] = cum[i] + x[i];
    }
    final int lead = window / 2;
    final double[] out = new double[n];
    for (int i = 0; i < n; i++) {
      final int hi = Math.min(n - 1, i + lead);
      final int lo = Math.max(0, i + lead - window + 1);
      out[i] = hi >= lo ? (cum[hi + 1] - cum[lo]) / window : 0d;
    }
    return out;
  }

  @Override
  public @NotNull String getName() {
    return "Wavelet energy (" + transform + " @ " + targetFrequencyHz + " Hz, "
        + smoothingSeconds + " s smoothing)";
  }
}
