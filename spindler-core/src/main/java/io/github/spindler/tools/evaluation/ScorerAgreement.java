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

import com.google.common.collect.Range;
import io.github.spindler.datamodel.SpindleEvent;
import io.github.spindler.modules.dataprocessing.eventdet.DetectionVector;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * Agreement between automatic detections and an expert scoring of the same recording.
 */
public final class ScorerAgreement {

  private ScorerAgreement() {
  }

  public static @NotNull AgreementMetrics bySample(@NotNull DetectionVector detected,
      @NotNull DetectionVector reference) {
    Objects.requireNonNull(detected, "detected");
    Objects.requireNonNull(reference, "reference");
    if (detected.length() != reference.length()) {
      throw new IllegalArgumentException(
          "Vectors differ in length: " + detected.length() + " vs " + reference.length());
    }
    int tp = 0, fp = 0, fn = 0, tn = 0;
    for (int i = 0; i < detected.length(); i++) {
      final boolean d = detected.get(i);
      final boolean r = reference.get(i);
      if (d && r) {
        tp++;
      } else if (d) {
        fp++;
      } else if (r) {
        fn++;
      } else {
        tn++;
      }
    }
    return new AgreementMetrics(tp, fp, fn, tn);
  }

  /**
   * Greedy one-to-one matching: each detection takes the unused reference event with the highest
   * intersection over union, and counts as a hit if that value reaches {@code minOverlap}.
   */
  public static @NotNull AgreementMetrics byEvent(@NotNull List<SpindleEvent> detected,
      @NotNull List<SpindleEvent> reference, double minOverlap) {
    Objects.requireNonNull(detected, "detected");
    Objects.requireNonNull(reference, "reference");
    if (!(minOverlap > 0d && minOverlap <= 1d)) {
      throw new IllegalArgumentException("Minimum overlap must be in (0, 1], was " + minOverlap);
    }
    final boolean[] referenceUsed = new boolean[reference.size()];
    int tp = 0, fp = 0;
    for (SpindleEvent event : detected) {
      int bestIdx = -1;
      double bestIoU = 0d;
      for (int i = 0; i < reference.size(); i++) {
        if (referenceUsed[i]) {
          continue;
        }
        final double iou = intersectionOverUnion(event, reference.get(i));
        if (iou > bestIoU) {
          bestIoU = iou;
          bestIdx = i;
        }
      }
      if (bestIdx >= 0 && bestIoU >= minOverlap) {
        tp++;
        referenceUsed[bestIdx] = true;
      } else {
        fp++;
      }
    }
    int fn = 0;
    for (boolean used : referenceUsed) {
      if (!used) {
        fn++;
      }
    }
    return new AgreementMetrics(tp, fp, fn, 0);
  }

  /**
   * Overlap in samples, both bounds inclusive.
   */
  static double intersectionOverUnion(@NotNull SpindleEvent a, @NotNull SpindleEvent b) {
    final Range<Integer> ra = a.asRange();
    final Range<Integer> rb = b.asRange();
    if (!ra.isConnected(rb)) {
      return 0d;
    }
    final Range<Integer> overlap = ra.intersection(rb);
    final int inter = overlap.upperEndpoint() - overlap.lowerEndpoint() + 1;
    final int union = a.length() + b.length() - inter;
    return ((double) inter) / union;
  }
}
