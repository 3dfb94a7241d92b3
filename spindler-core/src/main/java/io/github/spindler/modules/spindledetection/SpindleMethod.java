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

package io.github.spindler.modules.spindledetection;

import io.github.spindler.modules.dataprocessing.baseline.ThresholdPolicy.MeanEnergyMultiplier;
import io.github.spindler.modules.dataprocessing.baseline.ThresholdPolicy.PercentileOfRms;
import io.github.spindler.modules.dataprocessing.baseline.ThresholdPolicy.StdMultiplier;
import io.github.spindler.modules.dataprocessing.eventdet.BoundaryConvention;
import io.github.spindler.modules.dataprocessing.eventdet.DurationConvention;
import io.github.spindler.modules.dataprocessing.eventdet.LowerBound;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureSpec.FixedRms;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureSpec.SlidingRms;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureSpec.WaveletEnergy;
import io.github.spindler.modules.dataprocessing.filter_fir.FilterSpec.EquirippleFir;
import io.github.spindler.modules.dataprocessing.filter_fir.FilterSpec.WindowedFir;
import org.jetbrains.annotations.NotNull;

/**
 * Published detector variants with their constants.
 */
public enum SpindleMethod {

  /**
   * 11-15 Hz windowed FIR, RMS over 0.25 s blocks, 95th percentile of the baseline RMS.
   */
  MARTIN(new SpindleDetectionParameters(new WindowedFir(200, 11d, 15d), new FixedRms(0.25d),
      new PercentileOfRms(95d), 0.5d, 3.0d, DurationConvention.INCLUSIVE_SAMPLES,
      LowerBound.INCLUSIVE, BoundaryConvention.A, 0, false)),

  /**
   * 12-15 Hz equiripple FIR, sliding 0.2 s RMS, 1.5 standard deviations of the filtered
   * baseline. Boundary convention B has no effect here: the RMS margin keeps the first mask
   * sample off, so segmentation matches convention A.
   */
  MOLLE(new SpindleDetectionParameters(new EquirippleFir(11d, 12d, 15d, 16d, 40d, 3d),
      new SlidingRms(0.2d, 1), new StdMultiplier(1.5d), 0.5d, 3.0d,
      DurationConvention.SAMPLE_INTERVALS, LowerBound.EXCLUSIVE, BoundaryConvention.B, 0,
      false)),

  /**
   * Broadband prefilter, complex Morlet energy at 13.5 Hz smoothed over 0.1 s, 4.5 times the
   * mean baseline energy. Events closer than 10 samples are fused.
   */
  WAMSLEY(new SpindleDetectionParameters(new WindowedFir(100, 0.5d, 30d),
      new WaveletEnergy(1.0d, 1.5d, 13.5d, 0.1d), new MeanEnergyMultiplier(4.5d), 0.3d, 3.0d,
      DurationConvention.INCLUSIVE_SAMPLES, LowerBound.INCLUSIVE, BoundaryConvention.A, 10,
      false));

  private final SpindleDetectionParameters parameters;

  SpindleMethod(SpindleDetectionParameters parameters) {
    this.parameters = parameters;
  }

  public @NotNull SpindleDetectionParameters getParameters() {
    return parameters;
  }
}
