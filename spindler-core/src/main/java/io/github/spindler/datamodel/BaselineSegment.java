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

package io.github.spindler.datamodel;

import com.google.common.collect.Range;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * Contiguous sample range {@code [start, endExclusive)} known to be a non-REM baseline epoch.
 */
public record BaselineSegment(int start, int endExclusive) {

  public BaselineSegment {
    if (start < 0 || endExclusive <= start) {
      throw new IllegalArgumentException(
          "Invalid baseline segment [" + start + ", " + endExclusive + ")");
    }
  }

  public int length() {
    return endExclusive - start;
  }

  public @NotNull Range<Integer> asRange() {
    return Range.closedOpen(start, endExclusive);
  }

  /**
   * Checks that the segments are chronologically ordered, mutually disjoint and inside a series
   * of the given length.
   *
   * @throws IllegalArgumentException if any of the conditions is violated
   */
  public static void validate(@NotNull List<BaselineSegment> segments, int seriesLength) {
    BaselineSegment previous = null;
    for (BaselineSegment segment : segments) {
      if (segment.endExclusive > seriesLength) {
        throw new IllegalArgumentException(
            "Baseline segment " + segment + " exceeds series length " + seriesLength);
      }
      if (previous != null && segment.start < previous.endExclusive) {
        throw new IllegalArgumentException(
            "Baseline segments must be disjoint and ordered: " + previous + " before " + segment);
      }
      previous = segment;
    }
  }
}
