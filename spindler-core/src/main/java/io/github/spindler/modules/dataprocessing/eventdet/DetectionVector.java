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

import java.util.BitSet;
import org.jetbrains.annotations.NotNull;

/**
 * Terminal output of a detection run: one bit per input sample, set iff the sample belongs to an
 * accepted event. Only {@link DetectionVectorBuilder} creates instances.
 */
public final class DetectionVector {

  private final BitSet bits;
  private final int length;

  DetectionVector(@NotNull BitSet bits, int length) {
    if (length < 0 || bits.length() > length) {
      throw new IllegalArgumentException(
          "Bits up to " + bits.length() + " do not fit a vector of length " + length);
    }
    this.bits = (BitSet) bits.clone();
    this.length = length;
  }

  public int length() {
    return length;
  }

  public boolean get(int index) {
    if (index < 0 || index >= length) {
      throw new IndexOutOfBoundsException(index);
    }
    return bits.get(index);
  }

  public int countDetected() {
    return bits.cardinality();
  }

  public int @NotNull [] toIntArray() {
    final int[] out = new int[length];
    for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
      out[i] = 1;
    }
    return out;
  }

  public boolean @NotNull [] toBooleanArray() {
    final boolean[] out = new boolean[length];
    for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
      out[i] = true;
    }
    return out;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DetectionVector other)) {
      return false;
    }
    return length == other.length && bits.equals(other.bits);
  }

  @Override
  public int hashCode() {
    return 31 * bits.hashCode() + length;
  }

  @Override
  public String toString() {
    return "DetectionVector{" + countDetected() + "/" + length + " samples detected}";
  }
}
