/*
 * Copyright (c) 2026 The spindler Development Team
 */

package io.github.spindler.modules.dataprocessing.baseline;

import io.github.spindler.modules.dataprocessing.baseline.ThresholdPolicy.MeanEnergyMultiplier;
import io.github.spindler.modules.dataprocessing.baseline.ThresholdPolicy.PercentileOfRms;
import io.github.spindler.modules.dataprocessing.baseline.ThresholdPolicy.StdMultiplier;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BaselineEstimatorTest {

  private static BaselineData data(double[] features, double[] amplitude) {
    return new BaselineData(features, amplitude, 0, 1, 0);
  }

  @Test
  void testPercentileTakesRankAboveExactPercentile() throws EmptyBaselineException {
    final double[] features = new double[100];
    for (int i = 0; i < features.length; i++) {
      // shuffled order, the estimator sorts
      features[i] = ((i * 37) % 100) + 1;
    }
    Assertions.assertEquals(96d,
        BaselineEstimator.estimate(data(features, new double[1]), new PercentileOfRms(95d)));
  }

  @Test
  void testPercentileIsClampedToMaximum() {
    Assertions.assertEquals(5d, BaselineEstimator.percentile(new double[]{5d, 1d, 3d}, 100d));
    Assertions.assertEquals(3d, BaselineEstimator.percentile(new double[]{5d, 1d, 3d}, 30d));
  }

  @Test
  void testStdMultiplierUsesFilteredAmplitude() throws EmptyBaselineException {
    final BaselineData baseline = data(new double[]{100d, 200d}, new double[]{1d, 2d, 3d, 4d});
    // sample standard deviation of 1..4 is sqrt(5/3)
    Assertions.assertEquals(2d * Math.sqrt(5d / 3d),
        BaselineEstimator.estimate(baseline, new StdMultiplier(2d)), 1e-12);
  }

  @Test
  void testMeanEnergyMultiplierUsesFeature() throws EmptyBaselineException {
    final BaselineData baseline = data(new double[]{1d, 2d, 3d}, new double[]{50d});
    Assertions.assertEquals(9d,
        BaselineEstimator.estimate(baseline, new MeanEnergyMultiplier(4.5d)), 1e-12);
  }

  @Test
  void testEmptyBaselineIsReported() {
    final BaselineData empty = new BaselineData(new double[0], new double[0], 120, 0, 2);
    final EmptyBaselineException e = Assertions.assertThrows(EmptyBaselineException.class,
        () -> BaselineEstimator.estimate(empty, new StdMultiplier(1.5d)));
    Assertions.assertEquals(120, e.getExcludedSamples());
    Assertions.assertThrows(EmptyBaselineException.class,
        () -> BaselineEstimator.estimate(empty, new PercentileOfRms(95d)));
  }

  @Test
  void testPolicyParametersAreValidated() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new PercentileOfRms(0d));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new PercentileOfRms(101d));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new StdMultiplier(-1d));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new MeanEnergyMultiplier(0d));
  }
}
