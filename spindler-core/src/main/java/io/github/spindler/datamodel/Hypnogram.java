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

import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * Per-sample stage labels running parallel to a {@link TimeSeries}.
 */
public final class Hypnogram {

  private final SleepStage[] stages;

  public Hypnogram(@NotNull final SleepStage[] stages) {
    Objects.requireNonNull(stages, "stages");
    for (int i = 0; i < stages.length; i++) {
      if (stages[i] == null) {
        throw new IllegalArgumentException("Missing stage label at sample " + i);
      }
    }
    this.stages = stages.clone();
  }

  /**
   * Builds a hypnogram from integer stage codes, see {@link SleepStage#fromCode(int)}.
   */
  public static Hypnogram fromCodes(final int @NotNull [] codes) {
    final SleepStage[] stages = new SleepStage[codes.length];
    for (int i = 0; i < codes.length; i++) {
      stages[i] = SleepStage.fromCode(codes[i]);
    }
    return new Hypnogram(stages);
  }

  public int length() {
    return stages.length;
  }

  public SleepStage get(int index) {
    return stages[index];
  }
}
