/*
 * Copyright (c) 2026 The spindler Development Team
 */

package io.github.spindler.modules.dataprocessing.featdet_spindlefeatures;

import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureSpec.FixedRms;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureSpec.SlidingRms;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureSpec.WaveletEnergy;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.rms.FixedWindowRmsExtractor;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.rms.SlidingWindowRmsExtractor;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.wavelet.WaveletEnergyExtractor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class FeatureSpecTest {

  @Test
  void testSpecsCreateMatchingExtractors() {
    Assertions.assertInstanceOf(FixedWindowRmsExtractor.class,
        new FixedRms(0.25d).createExtractor());
    final FeatureExtractor sliding = new SlidingRms(0.2d, 1).createExtractor();
    Assertions.assertInstanceOf(SlidingWindowRmsExtractor.class, sliding);
    Assertions.assertEquals(1, ((SlidingWindowRmsExtractor) sliding).getHopSamples());
    final FeatureExtractor wavelet = new WaveletEnergy(1d, 1.5d, 13.5d, 0.1d).createExtractor();
    Assertions.assertInstanceOf(WaveletEnergyExtractor.class, wavelet);
    Assertions.assertEquals(13.5d, ((WaveletEnergyExtractor) wavelet).getTargetFrequencyHz());
  }
}
