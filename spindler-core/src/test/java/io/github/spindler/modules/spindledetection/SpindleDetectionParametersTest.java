/*
 * Copyright (c) 2026 The spindler Development Team
 */

package io.github.spindler.modules.spindledetection;

import io.github.spindler.modules.dataprocessing.baseline.ThresholdPolicy.MeanEnergyMultiplier;
import io.github.spindler.modules.dataprocessing.baseline.ThresholdPolicy.StdMultiplier;
import io.github.spindler.modules.dataprocessing.eventdet.BoundaryConvention;
import io.github.spindler.modules.dataprocessing.eventdet.DurationConvention;
import io.github.spindler.modules.dataprocessing.eventdet.LowerBound;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureSpec.FixedRms;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureSpec.WaveletEnergy;
import io.github.spindler.modules.dataprocessing.filter_fir.FilterSpec.WindowedFir;
import java.io.IOException;
import java.util.Properties;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SpindleDetectionParametersTest {

  @Test
  void testEmptyPropertiesGiveMartinPreset() {
    Assertions.assertEquals(SpindleMethod.MARTIN.getParameters(),
        SpindleDetectionParameters.fromProperties(new Properties()));
  }

  @Test
  void testBundledDefaultsMatchPreset() throws IOException {
    Assertions.assertEquals(SpindleMethod.MARTIN.getParameters(),
        SpindleDetectionParameters.fromResource(SpindleDetectionParameters.DEFAULTS_RESOURCE));
  }

  @Test
  void testOverridesApplyOnTopOfPreset() {
    final Properties properties = new Properties();
    properties.setProperty("method", "molle");
    properties.setProperty("k", "2");
    properties.setProperty("maxDurSec", "2.5");
    // not used by the equiripple filter, ignored
    properties.setProperty("filter.order", "12");

    final SpindleDetectionParameters parameters = SpindleDetectionParameters.fromProperties(
        properties);
    final SpindleDetectionParameters molle = SpindleMethod.MOLLE.getParameters();
    Assertions.assertEquals(new StdMultiplier(2d), parameters.threshold());
    Assertions.assertEquals(2.5d, parameters.maxDurSec());
    Assertions.assertEquals(molle.filter(), parameters.filter());
    Assertions.assertEquals(molle.feature(), parameters.feature());
    Assertions.assertEquals(BoundaryConvention.B, parameters.boundaryConvention());
    Assertions.assertEquals(DurationConvention.SAMPLE_INTERVALS,
        parameters.durationConvention());
    Assertions.assertEquals(LowerBound.EXCLUSIVE, parameters.lowerBound());
  }

  @Test
  void testResourceOverrides() throws IOException {
    final SpindleDetectionParameters parameters = SpindleDetectionParameters.fromResource(
        "/wamsley-override.properties");
    Assertions.assertEquals(new MeanEnergyMultiplier(3d), parameters.threshold());
    Assertions.assertEquals(new WaveletEnergy(1d, 1.5d, 12.5d, 0.1d), parameters.feature());
    Assertions.assertEquals(20, parameters.minGapSamples());
    Assertions.assertTrue(parameters.parallelBaseline());
    Assertions.assertEquals(new WindowedFir(100, 0.5d, 30d), parameters.filter());
  }

  @Test
  void testMartinWindowOverride() {
    final Properties properties = new Properties();
    properties.setProperty("windowLengthSec", "0.5");
    properties.setProperty("filter.highHz", "16");
    final SpindleDetectionParameters parameters = SpindleDetectionParameters.fromProperties(
        properties);
    Assertions.assertEquals(new FixedRms(0.5d), parameters.feature());
    Assertions.assertEquals(new WindowedFir(200, 11d, 16d), parameters.filter());
  }

  @Test
  void testInvalidConfigurationIsRejected() {
    final Properties unknown = new Properties();
    unknown.setProperty("method", "ferrarelli");
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> SpindleDetectionParameters.fromProperties(unknown));

    final Properties malformed = new Properties();
    malformed.setProperty("minDurSec", "half a second");
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> SpindleDetectionParameters.fromProperties(malformed));

    Assertions.assertThrows(IOException.class,
        () -> SpindleDetectionParameters.fromResource("/missing.properties"));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> SpindleMethod.MARTIN.getParameters().withMinGapSamples(-1));
  }

  @Test
  void testOnlyWaveletMethodMerges() {
    Assertions.assertFalse(SpindleMethod.MARTIN.getParameters().isMergingEnabled());
    Assertions.assertFalse(SpindleMethod.MOLLE.getParameters().isMergingEnabled());
    Assertions.assertEquals(10, SpindleMethod.WAMSLEY.getParameters().minGapSamples());
  }
}
