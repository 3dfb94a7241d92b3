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

import java.util.Arrays;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.jetbrains.annotations.NotNull;

/**
 * Complex Morlet wavelet {@code cmor<bandwidth>-<center>}:
 * <pre>
 *   psi(t) = (pi * Fb)^-1/2 * exp(2 i pi Fc t) * exp(-t^2 / Fb)
 * </pre>
 * evaluated on its effective support [-8, 8]. Coefficients are
 * {@code C(b) = a^-1/2 * sum_t x(t) * conj(psi((t - b) / a))}, computed as an FFT overlap-add
 * convolution and aligned so that {@code C} has the length of the input.
 */
public class ComplexMorletTransform implements ContinuousWaveletTransform {

  static final double SUPPORT = 8d;
  private static final int MIN_FFT_SIZE = 1024;

  private final double bandwidth;
  private final double centerFrequency;

  public ComplexMorletTransform(double bandwidth, double centerFrequency) {
    if (!(bandwidth > 0d) || !(centerFrequency > 0d)) {
      throw new IllegalArgumentException(
          "Morlet bandwidth and center frequency must be positive: " + bandwidth + ", "
              + centerFrequency);
    }
    this.bandwidth = bandwidth;
    this.centerFrequency = centerFrequency;
  }

  public double getBandwidth() {
    return bandwidth;
  }

  @Override
  public double getCenterFrequency() {
    return centerFrequency;
  }

  /**
   * Kernel {@code k(m) = psi(m / a) / sqrt(a)} for {@code m = -half..half}, real and imaginary
   * part. Convolving the signal with it yields the coefficients.
   */
  double[][] kernel(double scale) {
    final int half = (int) Math.ceil(SUPPORT * scale);
    final int length = 2 * half + 1;
    final double[][] k = new double[2][length];
    final double norm = 1d / Math.sqrt(Math.PI * bandwidth) / Math.sqrt(scale);
    for (int j = 0; j < length; j++) {
      final double u = (j - half) / scale;
      final double envelope = norm * Math.exp(-u * u / bandwidth);
      final double phase = 2d * Math.PI * centerFrequency * u;
      k[0][j] = envelope * Math.cos(phase);
      k[1][j] = envelope * Math.sin(phase);
    }
    return k;
  }

  @Override
  public @NotNull WaveletCoefficients transform(double @NotNull [] signal, double scale) {
    if (!(scale > 0d)) {
      throw new IllegalArgumentException("Scale must be positive, was " + scale);
    }
    final int n = signal.length;
    final double[] outRe = new double[n];
    final double[] outIm = new double[n];
    if (n == 0) {
      return new WaveletCoefficients(outRe, outIm);
    }

    final double[][] kernel = kernel(scale);
    final int kernelLength = kernel[0].length;
    final int half = kernelLength / 2;
    final int fftSize = Math.max(MIN_FFT_SIZE, Integer.highestOneBit(kernelLength - 1) << 2);
    final int blockLength = fftSize - kernelLength + 1;

    final double[][] kernelSpectrum = new double[2][fftSize];
    System.arraycopy(kernel[0], 0, kernelSpectrum[0], 0, kernelLength);
    System.arraycopy(kernel[1], 0, kernelSpectrum[1], 0, kernelLength);
    FastFourierTransformer.transformInPlace(kernelSpectrum, DftNormalization.STANDARD,
        TransformType.FORWARD);

    final double[][] block = new double[2][fftSize];
    for (int start = 0; start < n; start += blockLength) {
      final int len = Math.min(blockLength, n - start);
      Arrays.fill(block[0], 0d);
      Arrays.fill(block[1], 0d);
      System.arraycopy(signal, start, block[0], 0, len);
      FastFourierTransformer.transformInPlace(block, DftNormalization.STANDARD,
          TransformType.FORWARD);

      for (int f = 0; f < fftSize; f++) {
        final double re = block[0][f] * kernelSpectrum[0][f] - block[1][f] * kernelSpectrum[1][f];
        final double im = block[0][f] * kernelSpectrum[1][f] + block[1][f] * kernelSpectrum[0][f];
        block[0][f] = re;
        block[1][f] = im;
      }
      FastFourierTransformer.transformInPlace(block, DftNormalization.STANDARD,
          TransformType.INVERSE);

      // full convolution index start + t maps to output sample start + t - half
      final int outputs = len + kernelLength - 1;
      for (int t = 0; t < outputs; t++) {
        final int b = start + t - half;
        if (b >= 0 && b < n) {
          outRe[b] += block[0][t];
          outIm[b] += block[1][t];
        }
      }
    }
    return new WaveletCoefficients(outRe, outIm);
  }

  @Override
  public String toString() {
    return "cmor" + bandwidth + "-" + centerFrequency;
  }
}
