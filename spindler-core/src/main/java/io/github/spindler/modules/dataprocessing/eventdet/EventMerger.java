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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * Fuses events whose ends lie close together.
 * <p>
 * The gap is measured end to end against the preceding, possibly already fused, entry. A fused
 * pair is written into both slots so the list keeps its size; {@link #distinct(List)} collapses
 * the repeated entries afterwards.
 */
public final class EventMerger {

  private EventMerger() {
  }

  public static @NotNull List<SpindleEvent> merge(@NotNull List<SpindleEvent> events,
      int minGapSamples) {
    Objects.requireNonNull(events, "events");
    if (minGapSamples < 0) {
      throw new IllegalArgumentException("Minimum gap must not be negative: " + minGapSamples);
    }
    final List<SpindleEvent> merged = new ArrayList<>(events);
    for (int i = 1; i < merged.size(); i++) {
      final SpindleEvent previous = merged.get(i - 1);
      final SpindleEvent current = merged.get(i);
      if (current.end() - previous.end() <= minGapSamples) {
        final SpindleEvent fused = new SpindleEvent(previous.start(),
            Math.max(previous.end(), current.end()));
        // earlier slots holding the same span follow the fusion
        for (int j = i - 1; j >= 0 && merged.get(j).equals(previous); j--) {
          merged.set(j, fused);
        }
        merged.set(i, fused);
      }
    }
    return ImmutableList.copyOf(merged);
  }

  /**
   * @return the events with adjacent duplicates removed
   */
  public static @NotNull List<SpindleEvent> distinct(@NotNull List<SpindleEvent> events) {
    final ImmutableList.Builder<SpindleEvent> result = ImmutableList.builder();
    SpindleEvent last = null;
    for (SpindleEvent event : events) {
      if (!event.equals(last)) {
        result.add(event);
        last = event;
      }
    }
    return result.build();
  }
}
