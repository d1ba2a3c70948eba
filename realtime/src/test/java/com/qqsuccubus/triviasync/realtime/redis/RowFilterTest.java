package com.qqsuccubus.triviasync.realtime.redis;

import com.qqsuccubus.triviasync.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RowFilterTest {

    @Test
    void testParse_EqualityMatchesColumn() {
        RowFilter filter = RowFilter.parse("room_id=eq.r1");

        assertTrue(filter.matches(JsonUtils.objectNode().put("room_id", "r1")));
        assertFalse(filter.matches(JsonUtils.objectNode().put("room_id", "r2")));
        assertFalse(filter.matches(JsonUtils.objectNode().put("team_id", "r1")));
        assertFalse(filter.matches(null));
    }

    @Test
    void testParse_NumericColumnComparedAsText() {
        assertTrue(RowFilter.parse("round=eq.3").matches(JsonUtils.objectNode().put("round", 3)));
    }

    @Test
    void testParse_BlankMatchesEverything() {
        assertTrue(RowFilter.parse(null).matches(null));
        assertTrue(RowFilter.parse("  ").matches(JsonUtils.objectNode()));
    }

    @Test
    void testParse_UnsupportedOperatorRejected() {
        assertThrows(IllegalArgumentException.class, () -> RowFilter.parse("score=gt.10"));
        assertThrows(IllegalArgumentException.class, () -> RowFilter.parse("=eq.1"));
    }
}
