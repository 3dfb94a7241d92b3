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

import io.github.spindler.modules.dataprocessing.filter_fir.FilterSpec.EquirippleFir;
import io.github.spindler.modules.dataprocessing.filter_fir.FilterSpec.WindowedFir;
import java.util.Objects;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Linear-phase FIR filter applied forward and then time-reversed, which cancels the phase delay.
 * The signal is extended at both ends by an odd reflection of {@code 3 * order} samples and both
 * passes start from the steady state of the first sample, so the input has to be longer than
 * that transient.
 */
public final class ZeroPhaseFirFilter {

  private static final Logger logger = Logger.getLogger(ZeroPhaseFirFilter.class.getName());

  private final double[] taps;
  private final double[] initialState;

  public ZeroPhaseFirFilter(double @NotNull [] taps) {
    Objects.requireNonNull(taps, "taps");
    if (taps.length < 2) {
      throw new IllegalArgumentException("A filter needs at least two taps");
    }
    this.taps = taps.clone();
    this.initialState = steadyState(this.taps);
  }

  /**
   * Designs the taps described by the {@link FilterSpec} for the given sampling rate.
   */
  public static @NotNull ZeroPhaseFirFilter design(@NotNull FilterSpec spec, double sampleRate) {
    Objects.requireNonNull(spec, "spec");
    final double[] taps;
    if (spec instanceof WindowedFir w) {
      taps = FirFilterDesigner.bandpass(w.order(), w.lowHz(), w.highHz(), sampleRate);
    } else if (spec instanceof EquirippleFir e) {
      taps = RemezFirDesigner.bandpass(e, sampleRate);
    } else {
      throw new IllegalArgumentException("Unsupported filter " + spec);
    }
    logger.fine(() -> "Designed " + spec + " at " + sampleRate + " Hz with " + taps.length
        + " taps");
    return new ZeroPhaseFirFilter(taps);
  }

  public int getOrder() {
    return taps.length - 1;
  }

  public double @NotNull [] getTaps() {
    return taps.clone();
  }

  /**
   * @return edge transient length; inputs must be strictly longer
   */
  public int getEdgeLength() {
    return 3 * getOrder();
  }

  /**
   * @return the zero-phase filtered signal, same length as the input
   * @throws InsufficientDataForFilterException if the signal is not longer than
   *                                            {@link #getEdgeLength()}
   */
  public double @NotNull [] apply(double @NotNull [] signal)
      throws InsufficientDataForFilterException {
    final int n = signal.length;
    final int edge = getEdgeLength();
    if (n <= edge) {
      throw new InsufficientDataForFilterException(n, edge);
    }

    final double[] padded = new double[n + 2 * edge];
    final double first = signal[0];
    final double last = signal[n - 1];
    for (int k = 0; k < edge; k++) {
      padded[k] = 2d * first - signal[edge - k];
      padded[edge + n + k] = 2d * last - signal[n - 2 - k];
    }
    System.arraycopy(signal, 0, padded, edge, n);

    double[] y = filter(padded);
    reverse(y);
    y = filter(y);
    reverse(y);

    final double[] out = new double[n];
    System.arraycopy(y, edge, out, 0, n);
    return out;
  }

  /**
   * Single causal pass, state initialized for a constant input equal to the first sample.
   */
  private double[] filter(double[] x) {
    final int n = x.length;
    final int numTaps = taps.length;
    final double x0 = x[0];
    final double[] y = new double[n];
    for (int i = 0; i < n; i++) {
      double acc = 0d;
      final int kMax = Math.min(i, numTaps - 1);
      for (int k = 0; k <= kMax; k++) {
        acc += taps[k] * x[i - k];
      }
      if (i < numTaps - 1) {
        acc += initialState[i] * x0;
      }
      y[i] = acc;
    }
    return y;
  }

  /**
   * Transposed direct form state reached after a unit step: {@code z[i] = sum(b[i+1..])}.
   */
  private static double[] steadyState(double[] taps) {
    final double[] z = new double[taps.length - 1];
    double sum = 0d;
    for (int i = taps.length - 1; i >= 1; i--) {
      sum += taps[i];
      z[i - 1] = sum;
    }
    return z;
  }

  private static void reverse(double[] a) {
    for (int i = 0, j = a.length - 1; i < j; i++, j--) {
      final double tmp = a[i];
      a[i] = a[j];
      a[j] = tmp;
    }
  }
}
