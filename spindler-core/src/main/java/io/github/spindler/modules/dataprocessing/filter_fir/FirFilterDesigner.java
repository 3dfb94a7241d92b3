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

package io.github.spindler.modules.dataprocessing.filter_fir;

import org.jetbrains.annotations.NotNull;

/**
 * Window method FIR design.
 */
public final class FirFilterDesigner {

  private FirFilterDesigner() {
  }

  /**
   * Bandpass with a rectangular window. Cutoffs are normalized by the Nyquist frequency and the
   * taps are scaled to unit gain at the center of the passband.
   *
   * @return order + 1 symmetric taps
   */
  public static double @NotNull [] bandpass(int order, double lowHz, double highHz,
      double sampleRate) {
    final double nyquist = sampleRate / 2d;
    if (highHz >= nyquist) {
      throw new IllegalArgumentException(
          "Upper cutoff " + highHz + " Hz must be below Nyquist " + nyquist + " Hz");
    }
    final double f1 = lowHz / nyquist;
    final double f2 = highHz / nyquist;
    final int numTaps = order + 1;
    final double alpha = order / 2d;

    final double[] taps = new double[numTaps];
    for (int n = 0; n < numTaps; n++) {
      final double m = n - alpha;
      taps[n] = f2 * sinc(f2 * m) - f1 * sinc(f1 * m);
    }

    // unit gain at the passband center
    final double center = Math.PI * (f1 + f2) / 2d;
    double gain = 0d;
    for (int n = 0; n < numTaps; n++) {
      gain += taps[n] * Math.cos(center * (n - alpha));
    }
    gain = Math.abs(gain);
    for (int n = 0; n < numTaps; n++) {
      taps[n] /= gain;
    }
    return taps;
  }

  static double sinc(double x) {
    if (x == 0d) {
      return 1d;
    }
    final double px = Math.PI * x;
    return Math.sin(px) / px;
  }

  /**
   * Magnitude response of the taps at the given frequency.
   */
  public static double magnitudeAt(double @NotNull [] taps, double frequencyHz,
      double sampleRate) {
    final double w = 2d * Math.PI * frequencyHz / sampleRate;
    double re = 0d, im = 0d;
    for (int n = 0; n < taps.length; n++) {
      re += taps[n] * Math.cos(w * n);
      im -= taps[n] * Math.sin(w * n);
    }
    return Math.hypot(re, im);
  }
}
