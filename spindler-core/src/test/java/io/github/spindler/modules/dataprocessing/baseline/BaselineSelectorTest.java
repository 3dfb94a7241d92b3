/*
 * Copyright (c) 2026 The spindler Development Team
 */

package io.github.spindler.modules.dataprocessing.baseline;

import io.github.spindler.datamodel.BaselineSegment;
import io.github.spindler.datamodel.Hypnogram;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BaselineSelectorTest {

  @Test
  void testMaximalNremRunsBecomeSegments() {
    // WAKE N2 N2 REM N3 N4 N1 N2
    final Hypnogram hypnogram = Hypnogram.fromCodes(new int[]{0, 2, 2, 5, 3, 4, 1, 2});
    Assertions.assertEquals(List.of(new BaselineSegment(1, 3), new BaselineSegment(4, 6),
        new BaselineSegment(7, 8)), BaselineSelector.fromHypnogram(hypnogram));
  }

  @Test
  void testNoNremGivesNoSegments() {
    Assertions.assertTrue(
        BaselineSelector.fromHypnogram(Hypnogram.fromCodes(new int[]{0, 1, 5})).isEmpty());
  }

  @Test
  void testExplicitSegmentsAreValidated() {
    final List<BaselineSegment> ok = List.of(new BaselineSegment(0, 10),
        new BaselineSegment(10, 20));
    Assertions.assertEquals(ok, BaselineSelector.fromSegments(ok, 20));

    Assertions.assertThrows(IllegalArgumentException.class, () -> BaselineSelector.fromSegments(
        List.of(new BaselineSegment(0, 10), new BaselineSegment(5, 20)), 20));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> BaselineSelector.fromSegments(List.of(new BaselineSegment(0, 30)), 20));
  }
}
