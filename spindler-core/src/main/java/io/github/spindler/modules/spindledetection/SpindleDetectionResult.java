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

import io.github.spindler.datamodel.SpindleEvent;
import io.github.spindler.modules.dataprocessing.eventdet.DetectionVector;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * Outcome of one detection run.
 *
 * @param detections               one bit per input sample
 * @param events                   accepted events, fused entries repeated when merging is on
 * @param distinctEvents           accepted events without repeats
 * @param threshold                feature threshold derived from the baseline
 * @param excludedBaselineSamples  baseline samples in segments too short to filter
 * @param usedBaselineSegments     segments that contributed to the threshold
 * @param excludedBaselineSegments segments left out
 * @param baselineSeconds          baseline time that contributed to the threshold
 */
public record SpindleDetectionResult(@NotNull DetectionVector detections,
                                     @NotNull List<SpindleEvent> events,
                                     @NotNull List<SpindleEvent> distinctEvents, double threshold,
                                     int excludedBaselineSamples, int usedBaselineSegments,
                                     int excludedBaselineSegments, double baselineSeconds) {

  public SpindleDetectionResult {
    events = List.copyOf(events);
    distinctEvents = List.copyOf(distinctEvents);
  }

  public int spindleCount() {
    return distinctEvents.size();
  }

  /**
   * @return distinct spindles per minute of usable baseline, 0 without baseline time
   */
  public double spindleDensityPerMinute() {
    if (!(baselineSeconds > 0d)) {
      return 0d;
    }
    return distinctEvents.size() / (baselineSeconds / 60d);
  }
}
