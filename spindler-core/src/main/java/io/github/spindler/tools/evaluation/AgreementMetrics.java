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

package io.github.spindler.tools.evaluation;

/**
 * Confusion counts of a detector against a reference scoring. {@code tn} is only meaningful for
 * sample-wise agreement and is 0 for event matching.
 */
public record AgreementMetrics(int tp, int fp, int fn, int tn) {

  public double precision() {
    return tp + fp == 0 ? 0d : ((double) tp) / (tp + fp);
  }

  public double recall() {
    return tp + fn == 0 ? 0d : ((double) tp) / (tp + fn);
  }

  public double f1() {
    final double p = precision();
    final double r = recall();
    return p + r == 0d ? 0d : 2d * p * r / (p + r);
  }
}
