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

import java.util.Arrays;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * Immutable sequence of EEG samples recorded at a fixed sampling rate. Samples are copied on
 * construction and on every bulk read, so stages of a detection run only ever borrow the data.
 */
public final class TimeSeries {

  private final double[] samples;
  private final double sampleRate;

  public TimeSeries(@NotNull final double[] samples, final double sampleRate) {
    Objects.requireNonNull(samples, "samples");
    if (!(sampleRate > 0d) || Double.isInfinite(sampleRate)) {
      throw new IllegalArgumentException("Sampling rate must be positive, was " + sampleRate);
    }
    this.samples = samples.clone();
    this.sampleRate = sampleRate;
  }

  public int length() {
    return samples.length;
  }

  public boolean isEmpty() {
    return samples.length == 0;
  }

  public double get(int index) {
    return samples[index];
  }

  public double getSampleRate() {
    return sampleRate;
  }

  public double durationSeconds() {
    return samples.length / sampleRate;
  }

  /**
   * @return a copy of the samples in {@code [from, toExclusive)}
   */
  public double @NotNull [] slice(int from, int toExclusive) {
    if (from < 0 || toExclusive > samples.length || from > toExclusive) {
      throw new IndexOutOfBoundsException(
          "Slice [" + from + ", " + toExclusive + ") outside of series of length "
              + samples.length);
    }
    return Arrays.copyOfRange(samples, from, toExclusive);
  }

  public double @NotNull [] toArray() {
    return samples.clone();
  }

  @Override
  public String toString() {
    return "TimeSeries{" + samples.length + " samples @ " + sampleRate + " Hz}";
  }
}
