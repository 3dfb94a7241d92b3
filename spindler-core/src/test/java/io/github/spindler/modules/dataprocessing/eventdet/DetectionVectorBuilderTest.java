/*
 * Copyright (c) 2026 The spindler Development Team
 */

package io.github.spindler.modules.dataprocessing.eventdet;

import io.github.spindler.datamodel.SpindleEvent;
import java.util.BitSet;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class DetectionVectorBuilderTest {

  @Test
  void testRebuildsSegmentedMask() {
    final int[][] masks = {{0, 0, 1, 1, 1, 0, 0, 1, 0}, {1, 1, 0, 1}, {1, 1, 1}, {0, 0, 0},
        {1}, {0, 1, 0, 1, 0, 1}};
    for (int[] mask : masks) {
      final List<SpindleEvent> events = EventSegmenter.segment(mask, BoundaryConvention.A);
      final DetectionVector vector = DetectionVectorBuilder.build(events, mask.length);
      Assertions.assertArrayEquals(mask, vector.toIntArray());
    }
  }

  @Test
  void testEventBoundsAreInclusive() {
    final DetectionVector vector = DetectionVectorBuilder.build(
        List.of(new SpindleEvent(1, 3), new SpindleEvent(6, 6)), 8);
    Assertions.assertEquals(4, vector.countDetected());
    Assertions.assertTrue(vector.get(3));
    Assertions.assertFalse(vector.get(4));
    Assertions.assertTrue(vector.get(6));
  }

  @Test
  void testEventBeyondLengthIsRejected() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> DetectionVectorBuilder.build(List.of(new SpindleEvent(5, 8)), 8));
  }

  @Test
  void testVectorRejectsBitsBeyondLength() {
    final BitSet bits = new BitSet();
    bits.set(5);
    Assertions.assertThrows(IllegalArgumentException.class, () -> new DetectionVector(bits, 5));
    Assertions.assertEquals(1, new DetectionVector(bits, 6).countDetected());
  }
}
