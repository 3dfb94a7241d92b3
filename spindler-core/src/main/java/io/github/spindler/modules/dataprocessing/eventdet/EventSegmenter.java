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
import org.jetbrains.annotations.Nullable;

/**
 * Run-length segmentation of a binary threshold mask into inclusive {@code [start, end]} events.
 * <p>
 * Transitions are read from {@code d[i] = mask[i + 1] - mask[i]}: a rise at {@code i} starts an
 * event at {@code i + 1}, a fall at {@code i} ends one at {@code i}. A mask that is on at either
 * border gets an implicit start at 0 or end at the last index.
 */
public final class EventSegmenter {

  private EventSegmenter() {
  }

  public static @NotNull List<SpindleEvent> segment(int @Nullable [] mask,
      @NotNull BoundaryConvention convention) {
    Objects.requireNonNull(convention, "convention");
    if (mask == null || mask.length == 0) {
      throw new MalformedMaskException("Mask must be a non-empty one-dimensional vector");
    }
    for (int i = 0; i < mask.length; i++) {
      if (mask[i] != 0 && mask[i] != 1) {
        throw new MalformedMaskException(
            "Mask value at index " + i + " is " + mask[i] + ", expected 0 or 1");
      }
    }

    final int last = mask.length - 1;
    final List<Integer> begins = new ArrayList<>();
    final List<Integer> ends = new ArrayList<>();
    for (int i = 0; i < last; i++) {
      final int d = mask[i + 1] - mask[i];
      if (d == 1) {
        begins.add(i + 1);
      } else if (d == -1) {
        ends.add(i);
      }
    }

    if (mask[0] == 1) {
      if (convention == BoundaryConvention.B && !begins.isEmpty()) {
        begins.set(0, begins.get(0) - 1);
      }
      begins.add(0, 0);
    }
    if (mask[last] == 1) {
      ends.add(last);
    }

    if (begins.size() != ends.size()) {
      // cannot happen for a binary mask, every rise has a fall after the border fix-ups
      throw new IllegalStateException(
          "Unbalanced transitions: " + begins.size() + " starts, " + ends.size() + " ends");
    }
    if (begins.isEmpty()) {
      return ImmutableList.of();
    }
    final ImmutableList.Builder<SpindleEvent> events = ImmutableList.builder();
    for (int i = 0; i < begins.size(); i++) {
      events.add(new SpindleEvent(begins.get(i), ends.get(i)));
    }
    return events.build();
  }

  public static @NotNull List<SpindleEvent> segment(boolean @Nullable [] mask,
      @NotNull BoundaryConvention convention) {
    if (mask == null) {
      throw new MalformedMaskException("Mask must be a non-empty one-dimensional vector");
    }
    final int[] values = new int[mask.length];
    for (int i = 0; i < mask.length; i++) {
      values[i] = mask[i] ? 1 : 0;
    }
    return segment(values, convention);
  }
}
