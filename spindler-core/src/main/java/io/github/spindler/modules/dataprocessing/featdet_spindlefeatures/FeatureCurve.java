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

package io.github.spindler.modules.dataprocessing.featdet_spindlefeatures;

import java.util.Arrays;
import org.jetbrains.annotations.NotNull;

/**
 * Per-sample feature values. Only samples in {@code [validFrom, validTo)} carry a value; the
 * others are 0 and take part neither in thresholding nor in baseline statistics.
 */
public record FeatureCurve(double @NotNull [] values, int validFrom, int validTo) {

  public FeatureCurve {
    if (validFrom < 0 || validTo > values.length || validFrom > validTo) {
      throw new IllegalArgumentException(
          "Valid region [" + validFrom + ", " + validTo + ") outside of " + values.length
              + " values");
    }
  }

  public static @NotNull FeatureCurve fullyValid(double @NotNull [] values) {
    return new FeatureCurve(values, 0, values.length);
  }

  public int length() {
    return values.length;
  }

  public boolean isValid(int index) {
    return index >= validFrom && index < validTo;
  }

  public double @NotNull [] validValues() {
    return Arrays.copyOfRange(values, validFrom, validTo);
  }

  /**
   * @return 1 where the value is defined and strictly above the threshold, 0 elsewhere
   */
  public int @NotNull [] thresholdMask(double threshold) {
    final int[] mask = new int[values.length];
    for (int i = validFrom; i < validTo; i++) {
      if (values[i] > threshold) {
        mask[i] = 1;
      }
    }
    return mask;
  }
}
