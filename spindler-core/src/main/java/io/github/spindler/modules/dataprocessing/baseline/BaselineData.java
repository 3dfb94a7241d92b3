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

import org.jetbrains.annotations.NotNull;

/**
 * Baseline material of one run, concatenated in chronological segment order.
 *
 * @param features         valid feature values of the filtered baseline
 * @param amplitude        filtered baseline signal
 * @param excludedSamples  raw samples of segments that were too short to filter
 * @param usedSegments     segments that contributed
 * @param excludedSegments segments left out
 */
public record BaselineData(double @NotNull [] features, double @NotNull [] amplitude,
                           int excludedSamples, int usedSegments, int excludedSegments) {

  public boolean isEmpty() {
    return amplitude.length == 0;
  }

  public int totalSegments() {
    return usedSegments + excludedSegments;
  }
}
