/*
 * Copyright (c) 2026 The spindler Development Team
 */

package io.github.spindler.modules.dataprocessing.eventdet;

import io.github.spindler.datamodel.SpindleEvent;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class EventMergerTest {

  @Test
  void testCloseEndsAreFusedAndCountIsKept() {
    final List<SpindleEvent> events = List.of(new SpindleEvent(10, 40), new SpindleEvent(41, 41),
        new SpindleEvent(60, 100));
    final List<SpindleEvent> merged = EventMerger.merge(events, 5);
    Assertions.assertEquals(3, merged.size());
    Assertions.assertEquals(List.of(new SpindleEvent(10, 41), new SpindleEvent(10, 41),
        new SpindleEvent(60, 100)), merged);

    final List<SpindleEvent> distinct = EventMerger.distinct(merged);
    Assertions.assertEquals(2, distinct.size());
    Assertions.assertEquals(41, distinct.get(0).end());
    Assertions.assertEquals(100, distinct.get(1).end());
  }

  @Test
  void testChainOfCloseEventsCollapsesToOne() {
    final List<SpindleEvent> merged = EventMerger.merge(List.of(new SpindleEvent(0, 10),
        new SpindleEvent(12, 12), new SpindleEvent(14, 14)), 3);
    Assertions.assertEquals(List.of(new SpindleEvent(0, 14), new SpindleEvent(0, 14),
        new SpindleEvent(0, 14)), merged);
    Assertions.assertEquals(List.of(new SpindleEvent(0, 14)), EventMerger.distinct(merged));
  }

  @Test
  void testDistantEventsAreUntouched() {
    final List<SpindleEvent> events = List.of(new SpindleEvent(0, 10), new SpindleEvent(30, 40));
    Assertions.assertEquals(events, EventMerger.merge(events, 10));
    Assertions.assertTrue(EventMerger.merge(List.of(), 10).isEmpty());
  }
}
