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

import org.jetbrains.annotations.NotNull;

/**
 * Single-scale continuous wavelet transform of a real signal.
 */
public interface ContinuousWaveletTransform {

  /**
   * @param signal real input, not modified
   * @param scale  wavelet scale in samples
   * @return complex coefficients, one per input sample
   */
  @NotNull WaveletCoefficients transform(double @NotNull [] signal, double scale);

  /**
   * @return center frequency of the mother wavelet in cycles per unit of wavelet time
   */
  double getCenterFrequency();

  /**
   * Scale at which the wavelet's center frequency maps to the given physical frequency.
   */
  default double scaleForFrequency(double frequencyHz, double sampleRate) {
    return getCenterFrequency() * sampleRate / frequencyHz;
  }

  record WaveletCoefficients(double @NotNull [] real, double @NotNull [] imaginary) {

    public WaveletCoefficients {
      if (real.length != imaginary.length) {
        throw new IllegalArgumentException("Real and imaginary parts differ in length");
      }
    }

    public int length() {
      return real.length;
    }
  }
}
