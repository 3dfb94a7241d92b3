/*
 * Copyright (c) 2026 The spindler Development Team
 */

package io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.rms;

import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureCurve;
import java.util.Arrays;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SlidingWindowRmsExtractorTest {

  @Test
  void testHalfWindowMarginsAreExcluded() {
    // 1 s at 10 Hz: half window of 5 samples
    final double[] x = new double[30];
    Arrays.fill(x, -2d);
    final FeatureCurve curve = new SlidingWindowRmsExtractor(1d, 1).extract(x, 10d);
    Assertions.assertEquals(5, curve.validFrom());
    Assertions.assertEquals(25, curve.validTo());
    for (int i = 0; i < x.length; i++) {
      Assertions.assertEquals(curve.isValid(i) ? 2d : 0d, curve.values()[i], 1e-12, "at " + i);
    }
  }

  @Test
  void testHopBroadcastsCenterValue() {
    final double[] x = new double[40];
    for (int i = 20; i < 40; i++) {
      x[i] = 1d;
    }
    final FeatureCurve curve = new SlidingWindowRmsExtractor(1d, 2).extract(x, 10d);
    Assertions.assertEquals(curve.values()[15], curve.values()[16], 1e-12);
    Assertions.assertEquals(Math.sqrt(1d / 11d), curve.values()[15], 1e-12);
    Assertions.assertEquals(Math.sqrt(3d / 11d), curve.values()[17], 1e-12);
  }

  @Test
  void testSignalShorterThanWindowHasNoValidSamples() {
    final FeatureCurve curve = new SlidingWindowRmsExtractor(1d, 1).extract(new double[10], 10d);
    Assertions.assertEquals(0, curve.validValues().length);
  }

  @Test
  void testHopMustStayBelowHalfWindow() {
    final SlidingWindowRmsExtractor extractor = new SlidingWindowRmsExtractor(1d, 5);
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> extractor.extract(new double[50], 10d));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new SlidingWindowRmsExtractor(1d, 0));
  }
}
