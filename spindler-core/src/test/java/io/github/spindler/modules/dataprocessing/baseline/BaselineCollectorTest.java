/*
 * Copyright (c) 2026 The spindler Development Team
 */

package io.github.spindler.modules.dataprocessing.baseline;

import io.github.spindler.datamodel.BaselineSegment;
import io.github.spindler.datamodel.TimeSeries;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.rms.FixedWindowRmsExtractor;
import io.github.spindler.modules.dataprocessing.filter_fir.FirFilterDesigner;
import io.github.spindler.modules.dataprocessing.filter_fir.InsufficientDataForFilterException;
import io.github.spindler.modules.dataprocessing.filter_fir.ZeroPhaseFirFilter;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BaselineCollectorTest {

  private static final double FS = 100d;
  // order 10, segments need more than 30 samples
  private final ZeroPhaseFirFilter filter = new ZeroPhaseFirFilter(
      FirFilterDesigner.bandpass(10, 10d, 20d, FS));
  private final FixedWindowRmsExtractor extractor = new FixedWindowRmsExtractor(0.1d);

  private static TimeSeries noise(int n) {
    final Random random = new Random(7);
    final double[] x = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = random.nextGaussian();
    }
    return new TimeSeries(x, FS);
  }

  @Test
  void testShortSegmentIsExcludedAndCounted() throws InsufficientDataForFilterException {
    final TimeSeries series = noise(500);
    final List<BaselineSegment> segments = List.of(new BaselineSegment(0, 100),
        new BaselineSegment(200, 220), new BaselineSegment(300, 400));

    final BaselineData data = BaselineCollector.collect(series, segments, filter, extractor,
        false);
    Assertions.assertEquals(20, data.excludedSamples());
    Assertions.assertEquals(2, data.usedSegments());
    Assertions.assertEquals(1, data.excludedSegments());
    Assertions.assertEquals(200, data.amplitude().length);
    Assertions.assertEquals(200, data.features().length);

    // chronological concatenation of the individually filtered segments
    final double[] first = filter.apply(series.slice(0, 100));
    final double[] second = filter.apply(series.slice(300, 400));
    Assertions.assertArrayEquals(first, Arrays.copyOfRange(data.amplitude(), 0, 100));
    Assertions.assertArrayEquals(second,
        Arrays.copyOfRange(data.amplitude(), 100, 200));
  }

  @Test
  void testParallelCollectionKeepsOrder() {
    final TimeSeries series = noise(2000);
    final List<BaselineSegment> segments = List.of(new BaselineSegment(0, 300),
        new BaselineSegment(400, 700), new BaselineSegment(800, 820),
        new BaselineSegment(900, 1500), new BaselineSegment(1600, 2000));
    final BaselineData sequential = BaselineCollector.collect(series, segments, filter,
        extractor, false);
    final BaselineData parallel = BaselineCollector.collect(series, segments, filter, extractor,
        true);
    Assertions.assertArrayEquals(sequential.amplitude(), parallel.amplitude());
    Assertions.assertArrayEquals(sequential.features(), parallel.features());
    Assertions.assertEquals(sequential.excludedSamples(), parallel.excludedSamples());
  }

  @Test
  void testOnlyShortSegmentsLeaveNothingToEstimate() {
    final BaselineData data = BaselineCollector.collect(noise(500),
        List.of(new BaselineSegment(0, 30), new BaselineSegment(100, 120)), filter, extractor,
        false);
    Assertions.assertTrue(data.isEmpty());
    Assertions.assertEquals(50, data.excludedSamples());
    Assertions.assertThrows(EmptyBaselineException.class,
        () -> BaselineEstimator.estimate(data, new ThresholdPolicy.PercentileOfRms(95d)));
  }
}
