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

package io.github.spindler.modules.dataprocessing.baseline;

import io.github.spindler.datamodel.BaselineSegment;
import io.github.spindler.datamodel.TimeSeries;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureCurve;
import io.github.spindler.modules.dataprocessing.featdet_spindlefeatures.FeatureExtractor;
import io.github.spindler.modules.dataprocessing.filter_fir.InsufficientDataForFilterException;
import io.github.spindler.modules.dataprocessing.filter_fir.ZeroPhaseFirFilter;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Stream;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Filters every baseline segment on its own, concatenates the filtered segments in chronological
 * order and extracts the feature from the concatenation. A segment too short for the filter is
 * left out and counted, it never aborts the run.
 */
public final class BaselineCollector {

  private static final Logger logger = Logger.getLogger(BaselineCollector.class.getName());

  private BaselineCollector() {
  }

  public static @NotNull BaselineData collect(@NotNull TimeSeries series,
      @NotNull List<BaselineSegment> segments, @NotNull ZeroPhaseFirFilter filter,
      @NotNull FeatureExtractor extractor, boolean parallel) {
    Objects.requireNonNull(series, "series");
    Objects.requireNonNull(filter, "filter");
    Objects.requireNonNull(extractor, "extractor");
    BaselineSegment.validate(segments, series.length());

    Stream<BaselineSegment> stream = segments.stream();
    if (parallel) {
      stream = stream.parallel();
    }
    // encounter order is kept by toList(), so concatenation stays chronological
    final List<double[]> filtered = stream.map(s -> filterSegment(series, s, filter)).toList();

    int excludedSamples = 0;
    int excludedSegments = 0;
    int total = 0;
    for (int i = 0; i < filtered.size(); i++) {
      if (filtered.get(i) == null) {
        excludedSamples += segments.get(i).length();
        excludedSegments++;
      } else {
        total += filtered.get(i).length;
      }
    }

    final double[] amplitude = new double[total];
    int offset = 0;
    for (double[] part : filtered) {
      if (part != null) {
        System.arraycopy(part, 0, amplitude, offset, part.length);
        offset += part.length;
      }
    }

    final double[] features;
    if (amplitude.length == 0) {
      features = new double[0];
    } else {
      final FeatureCurve curve = extractor.extract(amplitude, series.getSampleRate());
      features = curve.validValues();
    }

    final int used = segments.size() - excludedSegments;
    if (excludedSegments > 0) {
      final int samples = excludedSamples;
      final int skipped = excludedSegments;
      logger.info(() -> "Excluded " + skipped + " of " + segments.size()
          + " baseline segments (" + samples + " samples) that are too short to filter");
    }
    return new BaselineData(features, amplitude, excludedSamples, used, excludedSegments);
  }

  private static double @Nullable [] filterSegment(TimeSeries series, BaselineSegment segment,
      ZeroPhaseFirFilter filter) {
    try {
      return filter.apply(series.slice(segment.start(), segment.endExclusive()));
    } catch (InsufficientDataForFilterException e) {
      logger.fine(() -> "Skipping baseline segment " + segment + ": " + e.getMessage());
      return null;
    }
  }
}
