/*
 * Copyright (c) 2026 The spindler Development Team
 */

package io.github.spindler.datamodel;

import com.google.common.collect.Range;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SpindleEventTest {

  @Test
  void testInclusiveLengthAndDuration() {
    final SpindleEvent event = new SpindleEvent(100, 149);
    Assertions.assertEquals(50, event.length());
    Assertions.assertEquals(0.5d, event.durationSeconds(100d), 1e-12);
    Assertions.assertEquals(Range.closed(100, 149), event.asRange());
  }

  @Test
  void testInvalidBoundsAreRejected() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new SpindleEvent(5, 4));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new SpindleEvent(-1, 4));
  }
}
