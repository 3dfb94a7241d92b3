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

package io.github.spindler.modules.dataprocessing.featdet_spindlefeatures;

import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.rms.FixedWindowRmsExtractor;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.rms.SlidingWindowRmsExtractor;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.wavelet.ComplexMorletTransform;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.wavelet.WaveletEnergyExtractor;
import org.jetbrains.annotations.NotNull;

/**
 * Feature configuration of a detection method.
 */
public interface FeatureSpec {

  @NotNull FeatureExtractor createExtractor();

  /**
   * @param windowLengthSec length of the non-overlapping RMS windows
   */
  record FixedRms(double windowLengthSec) implements FeatureSpec {

    @Override
    public @NotNull FeatureExtractor createExtractor() {
      return new FixedWindowRmsExtractor(windowLengthSec);
    }
  }

  /**
   * @param windowLengthSec RMS window around each center
   * @param hopSamples      distance between evaluated centers
   */
  record SlidingRms(double windowLengthSec, int hopSamples) implements FeatureSpec {

    @Override
    public @NotNull FeatureExtractor createExtractor() {
      return new SlidingWindowRmsExtractor(windowLengthSec, hopSamples);
    }
  }

  /**
   * Complex Morlet {@code cmor<bandwidth>-<centerFrequency>} evaluated at the scale of
   * {@code targetHz}.
   */
  record WaveletEnergy(double bandwidth, double centerFrequency, double targetHz,
                       double smoothingSec) implements FeatureSpec {

    @Override
    public @NotNull FeatureExtractor createExtractor() {
      return new WaveletEnergyExtractor(new ComplexMorletTransform(bandwidth, centerFrequency),
          targetHz, smoothingSec);
    }
  }
}
