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

package io.github.spindler.modules.dataprocessing.eventdet;

import com.google.common.collect.ImmutableList;
import io.github.spindler.datamodel.SpindleEvent;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Keeps events with {@code minDurSec * fs <= duration <= maxDurSec * fs}. The lower comparison
 * may be strict, the upper one never is. Rejected events are dropped, not clipped.
 */
public final class DurationFilter {

  private static final Logger logger = Logger.getLogger(DurationFilter.class.getName());

  private DurationFilter() {
  }

  public static @NotNull List<SpindleEvent> filter(@NotNull List<SpindleEvent> events,
      double minDurSec, double maxDurSec, double sampleRate,
      @NotNull DurationConvention convention, @NotNull LowerBound lowerBound) {
    Objects.requireNonNull(events, "events");
    Objects.requireNonNull(convention, "convention");
    Objects.requireNonNull(lowerBound, "lowerBound");
    if (!(sampleRate > 0d)) {
      throw new IllegalArgumentException("Sample rate must be positive, was " + sampleRate);
    }
    if (minDurSec < 0d || maxDurSec < minDurSec) {
      throw new IllegalArgumentException(
          "Invalid duration bounds [" + minDurSec + ", " + maxDurSec + "] s");
    }

    final double minSamples = minDurSec * sampleRate;
    final double maxSamples = maxDurSec * sampleRate;
    final List<SpindleEvent> kept = events.stream().filter(e -> {
      final int duration = convention.samples(e);
      return lowerBound.accepts(duration, minSamples) && duration <= maxSamples;
    }).collect(ImmutableList.toImmutableList());

    logger.finest(() -> "Duration filter kept " + kept.size() + " of " + events.size()
        + " events");
    return kept;
  }
}
