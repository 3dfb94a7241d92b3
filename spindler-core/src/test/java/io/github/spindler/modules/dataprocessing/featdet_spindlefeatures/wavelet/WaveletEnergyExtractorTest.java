/*
 * Copyright (c) 2026 The spindler Development Team
 */

package io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.wavelet;

import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureCurve;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.wavelet.ContinuousWaveletTransform.WaveletCoefficients;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class WaveletEnergyExtractorTest {

  @Test
  void testEnergyIsSquaredRealPartOfSquare() {
    final double[] e = WaveletEnergyExtractor.energy(
        new WaveletCoefficients(new double[]{2d, 1d}, new double[]{1d, 1d}));
    Assertions.assertArrayEquals(new double[]{9d, 0d}, e, 1e-12);
  }

  @Test
  void testMovingAverageIsCentered() {
    final double[] x = {1d, 2d, 3d, 4d, 5d};
    Assertions.assertArrayEquals(new double[]{1d, 2d, 3d, 4d, 3d},
        WaveletEnergyExtractor.movingAverage(x, 3), 1e-12);
    Assertions.assertArrayEquals(new double[]{1.5d, 2.5d, 3.5d, 3d, 2.25d},
        WaveletEnergyExtractor.movingAverage(x, 4), 1e-12);
  }

  @Test
  void testTargetFrequencyDominates() {
    final double fs = 100d;
    final WaveletEnergyExtractor extractor = new WaveletEnergyExtractor(
        new ComplexMorletTransform(1d, 1.5d), 13.5d, 0.1d);
    final double inBand = meanMiddle(extractor.extract(sine(13.5d, fs), fs));
    final double offBand = meanMiddle(extractor.extract(sine(5d, fs), fs));
    Assertions.assertTrue(inBand > 100d * offBand, inBand + " vs " + offBand);
  }

  private static double[] sine(double freq, double fs) {
    final double[] x = new double[2000];
    for (int i = 0; i < x.length; i++) {
      x[i] = Math.sin(2d * Math.PI * freq * i / fs);
    }
    return x;
  }

  private static double meanMiddle(FeatureCurve curve) {
    double sum = 0d;
    for (int i = 500; i < 1500; i++) {
      sum += curve.values()[i];
    }
    return sum / 1000d;
  }
}
