/*
 * Copyright (c) 2026 The spindler Development Team
 */

package io.github.spindler.modules.spindledetection;

import io.github.spindler.datamodel.BaselineSegment;
import io.github.spindler.datamodel.Hypnogram;
import io.github.spindler.datamodel.SleepStage;
import io.github.spindler.datamodel.SpindleEvent;
import io.github.spindler.datamodel.TimeSeries;
import io.github.spindler.modules.SpindleDetectionException;
import io.github.spindler.modules.dataprocessing.baseline.EmptyBaselineException;
import io.github.spindler.modules.dataprocessing.baseline.ThresholdPolicy.PercentileOfRms;
import io.github.spindler.modules.dataprocessing.eventdet.BoundaryConvention;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SpindleDetectorTest {

  private static final double FS = 100d;
  private static final int LENGTH = 12000;
  private static final int[] BURST_STARTS = {3000, 6000, 9000};
  private static final int BURST_LENGTH = 100;

  /**
   * Two minutes of noise with three one second 13 Hz bursts.
   */
  private static TimeSeries syntheticNight() {
    return syntheticNight(BURST_STARTS);
  }

  private static TimeSeries syntheticNight(int... burstStarts) {
    final Random random = new Random(1234);
    final double[] x = new double[LENGTH];
    for (int i = 0; i < LENGTH; i++) {
      x[i] = 2d * random.nextGaussian();
    }
    for (int start : burstStarts) {
      for (int i = start; i < start + BURST_LENGTH; i++) {
        x[i] += 10d * Math.sin(2d * Math.PI * 13d * i / FS);
      }
    }
    return new TimeSeries(x, FS);
  }

  private static void assertBurstsDetected(SpindleDetectionResult result,
      SpindleDetectionParameters parameters) {
    Assertions.assertEquals(LENGTH, result.detections().length());
    for (int start : BURST_STARTS) {
      final int center = start + BURST_LENGTH / 2;
      Assertions.assertTrue(result.detections().get(center), "burst at " + start);
      Assertions.assertTrue(result.distinctEvents().stream()
          .anyMatch(e -> e.start() <= center && center <= e.end()), "event at " + start);
    }
    for (SpindleEvent event : result.distinctEvents()) {
      final int d = parameters.durationConvention().samples(event);
      Assertions.assertTrue(d >= parameters.minDurSec() * FS && d <= parameters.maxDurSec() * FS,
          event.toString());
    }
    Assertions.assertTrue(result.spindleCount() >= BURST_STARTS.length);
    Assertions.assertTrue(result.detections().countDetected() < LENGTH / 5);
  }

  @Test
  void testMartinDetectsBursts() throws SpindleDetectionException {
    final SpindleDetector detector = SpindleDetector.forMethod(SpindleMethod.MARTIN);
    final SpindleDetectionResult result = detector.detect(syntheticNight(),
        List.of(new BaselineSegment(0, LENGTH)));
    assertBurstsDetected(result, detector.getParameters());
    Assertions.assertTrue(result.threshold() > 0d && result.threshold() < 5d,
        "threshold " + result.threshold());
    Assertions.assertEquals(0, result.excludedBaselineSamples());
    Assertions.assertEquals(120d, result.baselineSeconds(), 1e-9);
  }

  @Test
  void testMolleDetectsBursts() throws SpindleDetectionException {
    final SpindleDetector detector = SpindleDetector.forMethod(SpindleMethod.MOLLE);
    final SpindleDetectionResult result = detector.detect(syntheticNight(),
        List.of(new BaselineSegment(0, LENGTH)));
    assertBurstsDetected(result, detector.getParameters());
  }

  @Test
  void testMolleBoundaryConventionIsInertBehindRmsMargin() throws SpindleDetectionException {
    // starts inside a burst, a feature defined at sample 0 would switch the mask on there
    final TimeSeries night = syntheticNight(0, 3000, 6000, 9000);
    final List<BaselineSegment> baseline = List.of(new BaselineSegment(0, LENGTH));
    final SpindleDetectionParameters molle = SpindleMethod.MOLLE.getParameters();
    Assertions.assertEquals(BoundaryConvention.B, molle.boundaryConvention());

    final SpindleDetectionResult withB = new SpindleDetector(molle).detect(night, baseline);
    final SpindleDetectionResult withA = new SpindleDetector(
        molle.withBoundaryConvention(BoundaryConvention.A)).detect(night, baseline);
    Assertions.assertFalse(withB.detections().get(0));
    Assertions.assertEquals(withA.events(), withB.events());
    Assertions.assertEquals(withA.detections(), withB.detections());
  }

  @Test
  void testWamsleyDetectsExactlyTheBursts() throws SpindleDetectionException {
    final SpindleDetector detector = SpindleDetector.forMethod(SpindleMethod.WAMSLEY);
    final SpindleDetectionResult result = detector.detect(syntheticNight(),
        List.of(new BaselineSegment(0, LENGTH)));
    assertBurstsDetected(result, detector.getParameters());
    Assertions.assertEquals(3, result.spindleCount());
    Assertions.assertEquals(1.5d, result.spindleDensityPerMinute(), 1e-9);
  }

  @Test
  void testHypnogramBaselineSkipsShortNremRun() throws SpindleDetectionException {
    final SleepStage[] stages = new SleepStage[LENGTH];
    Arrays.fill(stages, 0, 1000, SleepStage.WAKE);
    Arrays.fill(stages, 1000, 6000, SleepStage.N2);
    Arrays.fill(stages, 6000, 6100, SleepStage.REM);
    // shorter than the filter transient of the 200th order filter
    Arrays.fill(stages, 6100, 6200, SleepStage.N3);
    Arrays.fill(stages, 6200, 6300, SleepStage.REM);
    Arrays.fill(stages, 6300, LENGTH, SleepStage.N2);

    final SpindleDetector detector = new SpindleDetector(
        SpindleMethod.MARTIN.getParameters().withParallelBaseline(true));
    final SpindleDetectionResult result = detector.detect(syntheticNight(),
        new Hypnogram(stages));
    Assertions.assertEquals(100, result.excludedBaselineSamples());
    Assertions.assertEquals(2, result.usedBaselineSegments());
    Assertions.assertEquals(1, result.excludedBaselineSegments());
    Assertions.assertEquals(107d, result.baselineSeconds(), 1e-9);
    assertBurstsDetected(result, detector.getParameters());
  }

  @Test
  void testHigherThresholdNeverDetectsMore() throws SpindleDetectionException {
    final TimeSeries night = syntheticNight();
    final List<BaselineSegment> baseline = List.of(new BaselineSegment(0, LENGTH));
    final SpindleDetectionParameters base = SpindleMethod.MARTIN.getParameters()
        .withDurationBounds(0d, 120d);
    int previous = Integer.MAX_VALUE;
    for (double p : new double[]{50d, 75d, 90d, 95d, 99d}) {
      final SpindleDetectionResult result = new SpindleDetector(
          base.withThreshold(new PercentileOfRms(p))).detect(night, baseline);
      final int detected = result.detections().countDetected();
      Assertions.assertTrue(detected <= previous, "percentile " + p);
      previous = detected;
    }
  }

  @Test
  void testTooShortBaselineAborts() {
    final TimeSeries shortNight = new TimeSeries(new double[500], FS);
    Assertions.assertThrows(EmptyBaselineException.class,
        () -> SpindleDetector.forMethod(SpindleMethod.MARTIN).detect(shortNight,
            List.of(new BaselineSegment(0, 500))));
  }

  @Test
  void testInvalidInputsAreRejected() {
    final SpindleDetector detector = SpindleDetector.forMethod(SpindleMethod.MARTIN);
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> detector.detect(new TimeSeries(new double[0], FS), List.of()));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> detector.detect(syntheticNight(), Hypnogram.fromCodes(new int[]{2, 2, 2})));
  }
}
