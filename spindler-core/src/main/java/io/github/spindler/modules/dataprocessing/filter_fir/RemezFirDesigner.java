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
import java.util.Arrays;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Equiripple linear-phase FIR design with the Parks-McClellan (Remez exchange) algorithm. Band
 * edges are given in cycles per sample, [0, 0.5]. Only odd tap counts (type I filters) are
 * produced, which is all the bandpass methods need.
 */
public final class RemezFirDesigner {

  private static final Logger logger = Logger.getLogger(RemezFirDesigner.class.getName());

  static final int GRID_DENSITY = 16;
  static final int MAX_ITERATIONS = 100;
  static final double CONVERGENCE_TOLERANCE = 1e-4;

  private RemezFirDesigner() {
  }

  /**
   * Taps and the largest weighted error on the dense grid.
   */
  public record Result(double @NotNull [] taps, double deviation) {

  }

  /**
   * Designs a bandpass that meets both deviations of the {@link EquirippleFir}. The order starts at
   * {@link #estimateOrder} and grows by two until the weighted error is within tolerance, the
   * estimate alone tends to come out a few taps short.
   *
   * @throws IllegalStateException if no order up to twice the estimate meets the tolerances
   */
  public static double @NotNull [] bandpass(@NotNull EquirippleFir spec, double sampleRate) {
    final double nyquist = sampleRate / 2d;
    if (spec.stopHighHz() >= nyquist) {
      throw new IllegalArgumentException(
          "Upper stopband edge " + spec.stopHighHz() + " Hz must be below Nyquist " + nyquist
              + " Hz");
    }
    final double dp = spec.passbandDeviation();
    final double ds = spec.stopbandDeviation();
    final double maxDev = Math.max(dp, ds);

    final double[] bands = {0d, spec.stopLowHz() / sampleRate, spec.passLowHz() / sampleRate,
        spec.passHighHz() / sampleRate, spec.stopHighHz() / sampleRate, 0.5d};
    final double[] desired = {0d, 1d, 0d};
    // weighted error of maxDev in every band means both deviations are met
    final double[] weights = {maxDev / ds, maxDev / dp, maxDev / ds};

    final int estimated = estimateOrder(spec, sampleRate);
    for (int order = estimated; order <= 2 * estimated; order += 2) {
      final Result result = design(order + 1, bands, desired, weights);
      if (result.deviation() <= maxDev) {
        final int finalOrder = order;
        logger.fine(() -> "Equiripple order " + finalOrder + " (estimated " + estimated + ") for "
            + spec + " at " + sampleRate + " Hz");
        return result.taps();
      }
    }
    throw new IllegalStateException(
        "No equiripple filter up to order " + 2 * estimated + " meets " + spec + " at "
            + sampleRate + " Hz");
  }

  /**
   * Herrmann, Rabiner and Chan estimate of the order needed to meet the tolerances, taking the
   * narrower of the two transition bands. Rounded up to an even order.
   */
  public static int estimateOrder(@NotNull EquirippleFir spec, double sampleRate) {
    final double dp = spec.passbandDeviation();
    final double ds = spec.stopbandDeviation();
    final double lower = transitionLength(spec.stopLowHz() / sampleRate,
        spec.passLowHz() / sampleRate, dp, ds);
    final double upper = transitionLength(spec.passHighHz() / sampleRate,
        spec.stopHighHz() / sampleRate, dp, ds);
    int order = (int) Math.ceil(Math.max(lower, upper)) - 1;
    if (order % 2 != 0) {
      order++;
    }
    return Math.max(order, 2);
  }

  private static double transitionLength(double f1, double f2, double dp, double ds) {
    final double d1 = Math.log10(dp);
    final double d2 = Math.log10(ds);
    final double dInf = (-4.278e-01 - 5.941e-01 * d1 - 2.660e-03 * d1 * d1)
        + d2 * (-4.761e-01 + 7.114e-02 * d1 + 5.309e-03 * d1 * d1);
    final double fK = 11.01217 + 0.51244 * (d1 - d2);
    final double df = Math.abs(f2 - f1);
    return dInf / df - fK * df + 1d;
  }

  /**
   * @param numTaps odd number of taps
   * @param bands   pairs of band edges in cycles per sample, strictly ascending
   * @param desired desired amplitude per band
   * @param weights error weight per band
   * @return symmetric impulse response and the weighted minimax error
   * @throws IllegalStateException if the exchange loses alternation or does not converge
   */
  public static @NotNull Result design(int numTaps, double @NotNull [] bands,
      double @NotNull [] desired, double @NotNull [] weights) {
    if (numTaps < 3 || numTaps % 2 == 0) {
      throw new IllegalArgumentException("Need an odd number of taps >= 3, got " + numTaps);
    }
    final int numBands = desired.length;
    if (bands.length != 2 * numBands || weights.length != numBands) {
      throw new IllegalArgumentException("Expected two edges and one weight per band");
    }
    if (bands[0] < 0d || bands[bands.length - 1] > 0.5d) {
      throw new IllegalArgumentException("Band edges must lie within [0, 0.5]");
    }
    for (int i = 1; i < bands.length; i++) {
      if (bands[i] <= bands[i - 1]) {
        throw new IllegalArgumentException("Band edges must strictly ascend");
      }
    }

    final int r = numTaps / 2 + 1;
    final Grid grid = Grid.create(r, bands, desired, weights);
    if (grid.size() <= r + 1) {
      throw new IllegalArgumentException("Dense grid too small for " + numTaps + " taps");
    }

    int[] ext = new int[r + 1];
    for (int i = 0; i <= r; i++) {
      ext[i] = (int) ((long) i * (grid.size() - 1) / r);
    }

    final Interpolant interpolant = new Interpolant(r);
    final double[] error = new double[grid.size()];
    double deviation = 0d;
    boolean converged = false;
    int iter = 0;
    while (!converged) {
      if (iter == MAX_ITERATIONS) {
        throw new IllegalStateException(
            "Remez exchange did not converge in " + MAX_ITERATIONS + " iterations for "
                + numTaps + " taps, the transition bands may be too narrow");
      }
      interpolant.fit(ext, grid);
      deviation = 0d;
      for (int i = 0; i < grid.size(); i++) {
        error[i] = grid.weight()[i] * (grid.desired()[i] - interpolant.evaluate(grid.x()[i]));
        deviation = Math.max(deviation, Math.abs(error[i]));
      }
      final int[] extrema = alternatingExtrema(grid, error);
      if (extrema.length < r + 1) {
        throw new IllegalStateException(
            "Remez exchange lost alternation in iteration " + iter + " for " + numTaps
                + " taps: " + extrema.length + " extrema for " + (r + 1) + " points");
      }
      ext = reduce(extrema, r + 1, error);
      converged = isDone(ext, error);
      iter++;
    }
    final int iterations = iter;
    logger.finest(() -> "Remez exchange converged after " + iterations + " iterations for "
        + numTaps + " taps");
    interpolant.fit(ext, grid);

    final int half = numTaps / 2;
    final double[] amplitude = new double[half + 1];
    for (int i = 0; i <= half; i++) {
      amplitude[i] = interpolant.evaluate(Math.cos(2d * Math.PI * i / numTaps));
    }
    return new Result(frequencySample(numTaps, amplitude), deviation);
  }

  /**
   * Local extrema of |E| within each band, band edges included, reduced to one per run of equal
   * signs so that consecutive entries alternate.
   */
  static int @NotNull [] alternatingExtrema(@NotNull Grid grid, double @NotNull [] e) {
    final int[] found = new int[grid.size()];
    int k = 0;
    for (int b = 0; b < grid.bandStart().length; b++) {
      final int first = grid.bandStart()[b];
      final int last = grid.bandEnd()[b];
      for (int i = first; i <= last; i++) {
        final double a = Math.abs(e[i]);
        if (a == 0d) {
          continue;
        }
        if (i > first && sameSign(e[i - 1], e[i]) && Math.abs(e[i - 1]) > a) {
          continue;
        }
        if (i < last && sameSign(e[i + 1], e[i]) && Math.abs(e[i + 1]) >= a) {
          continue;
        }
        if (k > 0 && sameSign(e[found[k - 1]], e[i])) {
          if (a > Math.abs(e[found[k - 1]])) {
            found[k - 1] = i;
          }
        } else {
          found[k++] = i;
        }
      }
    }
    return Arrays.copyOf(found, k);
  }

  /**
   * Drops the weakest extrema until {@code size} remain without breaking the alternation. An
   * interior extremum goes together with its smaller neighbour, an end one goes alone.
   */
  static int @NotNull [] reduce(int @NotNull [] extrema, int size, double @NotNull [] e) {
    final int[] kept = extrema.clone();
    int k = kept.length;
    while (k > size) {
      int smallest = 0;
      for (int j = 1; j < k; j++) {
        if (Math.abs(e[kept[j]]) < Math.abs(e[kept[smallest]])) {
          smallest = j;
        }
      }
      if (smallest == 0 || smallest == k - 1) {
        k = remove(kept, k, smallest);
      } else if (k - size == 1) {
        k = remove(kept, k, Math.abs(e[kept[k - 1]]) < Math.abs(e[kept[0]]) ? k - 1 : 0);
      } else {
        final int neighbour =
            Math.abs(e[kept[smallest - 1]]) < Math.abs(e[kept[smallest + 1]]) ? smallest - 1
                : smallest + 1;
        k = remove(kept, k, Math.max(smallest, neighbour));
        k = remove(kept, k, Math.min(smallest, neighbour));
      }
    }
    return Arrays.copyOf(kept, size);
  }

  private static int remove(int[] values, int count, int index) {
    System.arraycopy(values, index + 1, values, index, count - index - 1);
    return count - 1;
  }

  private static boolean sameSign(double a, double b) {
    return (a > 0d && b > 0d) || (a < 0d && b < 0d);
  }

  private static boolean isDone(int[] ext, double[] e) {
    double min = Math.abs(e[ext[0]]);
    double max = min;
    for (int i = 1; i < ext.length; i++) {
      final double current = Math.abs(e[ext[i]]);
      min = Math.min(min, current);
      max = Math.max(max, current);
    }
    return max == 0d || (max - min) / max < CONVERGENCE_TOLERANCE;
  }

  private static double[] frequencySample(int numTaps, double[] amplitude) {
    final double m = (numTaps - 1) / 2d;
    final double[] h = new double[numTaps];
    for (int n = 0; n < numTaps; n++) {
      double val = amplitude[0];
      final double x = 2d * Math.PI * (n - m) / numTaps;
      for (int k = 1; k <= m; k++) {
        val += 2d * amplitude[k] * Math.cos(x * k);
      }
      h[n] = val / numTaps;
    }
    return h;
  }

  /**
   * Dense frequency grid with desired response and weight per point. {@code x} holds
   * {@code cos(2 pi f)}, the abscissa of the interpolation.
   */
  record Grid(double[] x, double[] desired, double[] weight, int[] bandStart, int[] bandEnd) {

    static Grid create(int r, double[] bands, double[] desired, double[] weights) {
      final double delf = 0.5d / (GRID_DENSITY * r);
      final int numBands = desired.length;
      final int[] pointsPerBand = new int[numBands];
      int size = 0;
      for (int b = 0; b < numBands; b++) {
        final int spacings = (int) ((bands[2 * b + 1] - bands[2 * b]) / delf + 0.5);
        pointsPerBand[b] = Math.max(2, spacings + 1);
        size += pointsPerBand[b];
      }
      final double[] x = new double[size];
      final double[] des = new double[size];
      final double[] wt = new double[size];
      final int[] start = new int[numBands];
      final int[] end = new int[numBands];
      int j = 0;
      for (int b = 0; b < numBands; b++) {
        final double low = bands[2 * b];
        final double high = bands[2 * b + 1];
        final int points = pointsPerBand[b];
        start[b] = j;
        for (int i = 0; i < points; i++) {
          x[j] = Math.cos(2d * Math.PI * (low + (high - low) * i / (points - 1)));
          des[j] = desired[b];
          wt[j] = weights[b];
          j++;
        }
        end[b] = j - 1;
      }
      return new Grid(x, des, wt, start, end);
    }

    int size() {
      return x.length;
    }
  }

  /**
   * Barycentric Lagrange form of the current best approximation on the extremal set.
   */
  private static final class Interpolant {

    private final int r;
    private final double[] x;
    private final double[] y;
    private final double[] ad;
    private final double[] logDenom;

    Interpolant(int r) {
      this.r = r;
      this.x = new double[r + 1];
      this.y = new double[r + 1];
      this.ad = new double[r + 1];
      this.logDenom = new double[r + 1];
    }

    void fit(int[] ext, Grid grid) {
      for (int i = 0; i <= r; i++) {
        x[i] = grid.x()[ext[i]];
      }
      // the weights only matter up to a common factor, so they are scaled in log space to keep
      // long filters away from overflow and underflow
      double minLog = Double.POSITIVE_INFINITY;
      for (int i = 0; i <= r; i++) {
        double sum = 0d;
        boolean negative = false;
        for (int k = 0; k <= r; k++) {
          if (k != i) {
            final double d = x[i] - x[k];
            if (d < 0d) {
              negative = !negative;
            }
            sum += Math.log(Math.abs(d));
          }
        }
        logDenom[i] = sum;
        ad[i] = negative ? -1d : 1d;
        minLog = Math.min(minLog, sum);
      }
      for (int i = 0; i <= r; i++) {
        ad[i] *= Math.exp(minLog - logDenom[i]);
      }

      double numer = 0d;
      double denom = 0d;
      int sign = 1;
      for (int i = 0; i <= r; i++) {
        numer += ad[i] * grid.desired()[ext[i]];
        denom += sign * ad[i] / grid.weight()[ext[i]];
        sign = -sign;
      }
      final double delta = numer / denom;
      sign = 1;
      for (int i = 0; i <= r; i++) {
        y[i] = grid.desired()[ext[i]] - sign * delta / grid.weight()[ext[i]];
        sign = -sign;
      }
    }

    double evaluate(double xc) {
      double numer = 0d;
      double denom = 0d;
      for (int i = 0; i <= r; i++) {
        double c = xc - x[i];
        if (c == 0d) {
          return y[i];
        }
        c = ad[i] / c;
        denom += c;
        numer += c * y[i];
      }
      return numer / denom;
    }
  }
}
