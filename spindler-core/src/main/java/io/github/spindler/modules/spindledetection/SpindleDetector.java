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

import io.github.spindler.datamodel.BaselineSegment;
import io.github.spindler.datamodel.Hypnogram;
import io.github.spindler.datamodel.SpindleEvent;
import io.github.spindler.datamodel.TimeSeries;
import io.github.spindler.modules.SpindleDetectionException;
import io.github.spindler.modules.dataprocessing.baseline.BaselineCollector;
import io.github.spindler.modules.dataprocessing.baseline.BaselineData;
import io.github.spindler.modules.dataprocessing.baseline.BaselineEstimator;
import io.github.spindler.modules.dataprocessing.baseline.BaselineSelector;
import io.github.spindler.modules.dataprocessing.eventdet.DetectionVector;
import io.github.spindler.modules.dataprocessing.eventdet.DetectionVectorBuilder;
import io.github.spindler.modules.dataprocessing.eventdet.DurationFilter;
import io.github.spindler.modules.dataprocessing.eventdet.EventMerger;
import io.github.spindler.modules.dataprocessing.eventdet.EventSegmenter;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureCurve;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureExtractor;
import io.github.spindler.modules.dataprocessing.filter_fir.ZeroPhaseFirFilter;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Runs one detection method over a whole night.
 * <p>
 * The threshold is calibrated on the baseline segments, each filtered on its own. The whole
 * night is then filtered in one pass, thresholded, segmented into events, filtered by duration,
 * optionally merged and rendered into a {@link DetectionVector}.
 */
public class SpindleDetector {

  private static final Logger logger = Logger.getLogger(SpindleDetector.class.getName());

  private final SpindleDetectionParameters parameters;

  public SpindleDetector(@NotNull SpindleDetectionParameters parameters) {
    this.parameters = Objects.requireNonNull(parameters, "parameters");
  }

  public static @NotNull SpindleDetector forMethod(@NotNull SpindleMethod method) {
    return new SpindleDetector(method.getParameters());
  }

  public @NotNull SpindleDetectionParameters getParameters() {
    return parameters;
  }

  /**
   * Uses every maximal N2/N3/N4 run of the hypnogram as baseline.
   *
   * @param hypnogram one stage label per sample
   */
  public @NotNull SpindleDetectionResult detect(@NotNull TimeSeries eeg,
      @NotNull Hypnogram hypnogram) throws SpindleDetectionException {
    Objects.requireNonNull(eeg, "eeg");
    Objects.requireNonNull(hypnogram, "hypnogram");
    if (hypnogram.length() != eeg.length()) {
      throw new IllegalArgumentException(
          "Hypnogram has " + hypnogram.length() + " labels for " + eeg.length() + " samples");
    }
    return detect(eeg, BaselineSelector.fromHypnogram(hypnogram));
  }

  public @NotNull SpindleDetectionResult detect(@NotNull TimeSeries eeg,
      @NotNull List<BaselineSegment> baselineSegments) throws SpindleDetectionException {
    Objects.requireNonNull(eeg, "eeg");
    if (eeg.isEmpty()) {
      throw new IllegalArgumentException("EEG series is empty");
    }
    final List<BaselineSegment> segments = BaselineSelector.fromSegments(baselineSegments,
        eeg.length());
    final double fs = eeg.getSampleRate();

    final ZeroPhaseFirFilter filter = ZeroPhaseFirFilter.design(parameters.filter(), fs);
    final FeatureExtractor extractor = parameters.feature().createExtractor();

    final BaselineData baseline = BaselineCollector.collect(eeg, segments, filter, extractor,
        parameters.parallelBaseline());
    final double threshold = BaselineEstimator.estimate(baseline, parameters.threshold());

    final double[] filtered = filter.apply(eeg.toArray());
    final FeatureCurve feature = extractor.extract(filtered, fs);
    final int[] mask = feature.thresholdMask(threshold);

    List<SpindleEvent> events = EventSegmenter.segment(mask, parameters.boundaryConvention());
    final int candidates = events.size();
    events = DurationFilter.filter(events, parameters.minDurSec(), parameters.maxDurSec(), fs,
        parameters.durationConvention(), parameters.lowerBound());
    if (parameters.isMergingEnabled()) {
      events = EventMerger.merge(events, parameters.minGapSamples());
    }
    final List<SpindleEvent> distinct = EventMerger.distinct(events);
    final DetectionVector detections = DetectionVectorBuilder.build(distinct, eeg.length());

    final SpindleDetectionResult result = new SpindleDetectionResult(detections, events, distinct,
        threshold, baseline.excludedSamples(), baseline.usedSegments(),
        baseline.excludedSegments(), baseline.amplitude().length / fs);
    logger.info(() -> String.format(
        "%s: threshold %.6g, %d candidate events, %d spindles (%.2f/min baseline)",
        extractor.getName(), threshold, candidates, result.spindleCount(),
        result.spindleDensityPerMinute()));
    return result;
  }
}
