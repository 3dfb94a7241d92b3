/*
 * Copyright (c) 2026 The spindler Development Team
 */

package io.github.spindler.modules.dataprocessing.eventdet;

import io.github.spindler.datamodel.SpindleEvent;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class DurationFilterTest {

  // 10 Hz, 0.5 - 1.0 s: 5 to 10 samples
  private static final double FS = 10d;

  @Test
  void testInclusiveSampleCount() {
    final List<SpindleEvent> events = List.of(new SpindleEvent(0, 3), new SpindleEvent(10, 14),
        new SpindleEvent(20, 29), new SpindleEvent(40, 50));
    Assertions.assertEquals(List.of(new SpindleEvent(10, 14), new SpindleEvent(20, 29)),
        DurationFilter.filter(events, 0.5d, 1.0d, FS, DurationConvention.INCLUSIVE_SAMPLES,
            LowerBound.INCLUSIVE));
  }

  @Test
  void testStrictLowerBound() {
    final List<SpindleEvent> events = List.of(new SpindleEvent(10, 14), new SpindleEvent(20, 25));
    Assertions.assertEquals(List.of(new SpindleEvent(20, 25)),
        DurationFilter.filter(events, 0.5d, 1.0d, FS, DurationConvention.INCLUSIVE_SAMPLES,
            LowerBound.EXCLUSIVE));
  }

  @Test
  void testLowerBoundComparesSampleCounts() {
    // 0.5 s at 10 Hz
    final double minSamples = 0.5d * FS;
    Assertions.assertTrue(LowerBound.INCLUSIVE.accepts(5, minSamples));
    Assertions.assertFalse(LowerBound.EXCLUSIVE.accepts(5, minSamples));
    Assertions.assertTrue(LowerBound.EXCLUSIVE.accepts(6, minSamples));
    Assertions.assertFalse(LowerBound.INCLUSIVE.accepts(4, minSamples));
  }

  @Test
  void testSampleIntervals() {
    final List<SpindleEvent> events = List.of(new SpindleEvent(0, 4), new SpindleEvent(10, 15),
        new SpindleEvent(20, 30), new SpindleEvent(40, 51));
    Assertions.assertEquals(List.of(new SpindleEvent(10, 15), new SpindleEvent(20, 30)),
        DurationFilter.filter(events, 0.5d, 1.0d, FS, DurationConvention.SAMPLE_INTERVALS,
            LowerBound.INCLUSIVE));
  }

  @Test
  void testSurvivorsRespectBounds() {
    final List<SpindleEvent> events = List.of(new SpindleEvent(0, 2), new SpindleEvent(5, 9),
        new SpindleEvent(12, 30), new SpindleEvent(40, 47));
    for (DurationConvention convention : DurationConvention.values()) {
      for (SpindleEvent e : DurationFilter.filter(events, 0.5d, 1.0d, FS, convention,
          LowerBound.INCLUSIVE)) {
        final int d = convention.samples(e);
        Assertions.assertTrue(d >= 5 && d <= 10, e + " under " + convention);
      }
    }
  }

  @Test
  void testInvalidBoundsAreRejected() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> DurationFilter.filter(List.of(), 2d, 1d, FS, DurationConvention.INCLUSIVE_SAMPLES,
            LowerBound.INCLUSIVE));
  }
}
