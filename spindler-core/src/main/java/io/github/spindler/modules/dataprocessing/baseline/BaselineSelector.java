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

import com.google.common.collect.ImmutableList;
import io.github.spindler.datamodel.BaselineSegment;
import io.github.spindler.datamodel.Hypnogram;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * Determines which samples calibrate the threshold: either explicit episodes or every maximal run
 * of N2/N3/N4 labels.
 */
public final class BaselineSelector {

  private BaselineSelector() {
  }

  public static @NotNull List<BaselineSegment> fromHypnogram(@NotNull Hypnogram hypnogram) {
    Objects.requireNonNull(hypnogram, "hypnogram");
    final ImmutableList.Builder<BaselineSegment> segments = ImmutableList.builder();
    int runStart = -1;
    for (int i = 0; i < hypnogram.length(); i++) {
      final boolean nrem = hypnogram.get(i).isBaselineNrem();
      if (nrem && runStart < 0) {
        runStart = i;
      } else if (!nrem && runStart >= 0) {
        segments.add(new BaselineSegment(runStart, i));
        runStart = -1;
      }
    }
    if (runStart >= 0) {
      segments.add(new BaselineSegment(runStart, hypnogram.length()));
    }
    return segments.build();
  }

  /**
   * @throws IllegalArgumentException if the episodes overlap, are unordered or exceed the series
   */
  public static @NotNull List<BaselineSegment> fromSegments(
      @NotNull List<BaselineSegment> segments, int seriesLength) {
    BaselineSegment.validate(Objects.requireNonNull(segments, "segments"), seriesLength);
    return ImmutableList.copyOf(segments);
  }
}
