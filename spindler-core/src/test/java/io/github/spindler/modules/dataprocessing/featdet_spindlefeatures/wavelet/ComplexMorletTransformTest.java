/*
 * Copyright (c) 2026 The spindler Development Team
 */

package io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.wavelet;

import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.wavelet.ContinuousWaveletTransform.WaveletCoefficients;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ComplexMorletTransformTest {

  private final ComplexMorletTransform transform = new ComplexMorletTransform(1d, 1.5d);

  @Test
  void testOverlapAddMatchesDirectConvolution() {
    final Random random = new Random(42);
    final double[] x = new double[3000];
    for (int i = 0; i < x.length; i++) {
      x[i] = random.nextGaussian();
    }
    final double scale = 2d;
    final WaveletCoefficients c = transform.transform(x, scale);
    final double[][] kernel = transform.kernel(scale);
    final int half = kernel[0].length / 2;

    for (int b = 0; b < x.length; b += 7) {
      double re = 0d, im = 0d;
      for (int j = 0; j < kernel[0].length; j++) {
        final int t = b + half - j;
        if (t >= 0 && t < x.length) {
          re += x[t] * kernel[0][j];
          im += x[t] * kernel[1][j];
        }
      }
      Assertions.assertEquals(re, c.real()[b], 1e-9, "real at " + b);
      Assertions.assertEquals(im, c.imaginary()[b], 1e-9, "imaginary at " + b);
    }
  }

  @Test
  void testScaleMapsCenterFrequencyToTarget() {
    Assertions.assertEquals(1.5d * 200d / 13.5d, transform.scaleForFrequency(13.5d, 200d), 1e-12);
  }

  @Test
  void testOutputHasInputLength() {
    Assertions.assertEquals(17, transform.transform(new double[17], 11d).length());
    Assertions.assertEquals(0, transform.transform(new double[0], 11d).length());
  }

  @Test
  void testInvalidParametersAreRejected() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new ComplexMorletTransform(0d, 1.5d));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> transform.transform(new double[4], 0d));
  }
}
