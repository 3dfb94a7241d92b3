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

/**
 * Sleep stages as delivered by an external stage classifier. Codes follow the usual
 * Rechtschaffen &amp; Kales numbering with REM scored as 5.
 */
public enum SleepStage {

  WAKE(0), N1(1), N2(2), N3(3), N4(4), REM(5);

  private final int code;

  SleepStage(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  /**
   * N2, N3 and N4 epochs calibrate the detection threshold.
   */
  public boolean isBaselineNrem() {
    return this == N2 || this == N3 || this == N4;
  }

  public static SleepStage fromCode(int code) {
    for (SleepStage stage : values()) {
      if (stage.code == code) {
        return stage;
      }
    }
    throw new IllegalArgumentException("Unknown sleep stage code " + code);
  }
}
