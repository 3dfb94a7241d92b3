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

/**
 * Band-limiting filter configuration of a detection method. The numbers are published constants
 * of each method and are stored as given.
 */
public interface FilterSpec {

  /**
   * Fixed order bandpass with a rectangular window.
   *
   * @param order  filter order, taps = order + 1
   * @param lowHz  lower cutoff
   * @param highHz upper cutoff
   */
  record WindowedFir(int order, double lowHz, double highHz) implements FilterSpec {

    public WindowedFir {
      if (order < 2) {
        throw new IllegalArgumentException("Filter order must be at least 2, was " + order);
      }
      if (!(lowHz > 0d) || !(highHz > lowHz)) {
        throw new IllegalArgumentException(
            "Invalid passband [" + lowHz + ", " + highHz + "] Hz");
      }
    }
  }

  /**
   * Minimax (Parks-McClellan) bandpass, order derived from the edges and tolerances.
   *
   * @param stopAttenDb  minimum stopband attenuation
   * @param passRippleDb peak-to-peak passband ripple
   */
  record EquirippleFir(double stopLowHz, double passLowHz, double passHighHz, double stopHighHz,
                       double stopAttenDb, double passRippleDb) implements FilterSpec {

    public EquirippleFir {
      if (!(stopLowHz > 0d && passLowHz > stopLowHz && passHighHz > passLowHz
          && stopHighHz > passHighHz)) {
        throw new IllegalArgumentException(
            "Band edges must increase: " + stopLowHz + ", " + passLowHz + ", " + passHighHz + ", "
                + stopHighHz);
      }
      if (!(stopAttenDb > 0d) || !(passRippleDb > 0d)) {
        throw new IllegalArgumentException("Attenuation and ripple must be positive");
      }
    }

    public double passbandDeviation() {
      final double g = Math.pow(10d, passRippleDb / 20d);
      return (g - 1d) / (g + 1d);
    }

    public double stopbandDeviation() {
      return Math.pow(10d, -stopAttenDb / 20d);
    }
  }
}
