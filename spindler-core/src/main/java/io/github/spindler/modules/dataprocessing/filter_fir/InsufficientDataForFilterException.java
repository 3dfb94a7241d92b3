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

package io.github.spindler.modules.dataprocessing.filter_fir;

import io.github.spindler.modules.SpindleDetectionException;

/**
 * Thrown when a signal is too short for zero-phase filtering. The signal has to be left out of
 * any statistic; it is never zero-filled.
 */
public class InsufficientDataForFilterException extends SpindleDetectionException {

  private final int length;
  private final int requiredLength;

  public InsufficientDataForFilterException(int length, int requiredLength) {
    super("Zero-phase filtering needs more than " + requiredLength + " samples, got " + length);
    this.length = length;
    this.requiredLength = requiredLength;
  }

  public int getLength() {
    return length;
  }

  /**
   * @return edge transient length, the input has to be strictly longer
   */
  public int getRequiredLength() {
    return requiredLength;
  }
}
