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

import io.github.spindler.datamodel.SpindleEvent;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * Renders events back into a sample-aligned mask. Inverse of {@link EventSegmenter} for lists
 * that were not merged.
 */
public final class DetectionVectorBuilder {

  private DetectionVectorBuilder() {
  }

  public static @NotNull DetectionVector build(@NotNull List<SpindleEvent> events,
      int totalLength) {
    Objects.requireNonNull(events, "events");
    if (totalLength < 0) {
      throw new IllegalArgumentException("Negative length " + totalLength);
    }
    final BitSet bits = new BitSet(totalLength);
    for (SpindleEvent event : events) {
      if (event.end() >= totalLength) {
        throw new IllegalArgumentException(
            "Event " + event + " exceeds a vector of " + totalLength + " samples");
      }
      bits.set(event.start(), event.end() + 1);
    }
    return new DetectionVector(bits, totalLength);
  }
}
