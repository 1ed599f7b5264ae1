package com.channelcast.common.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChannelIdListTest {

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "   " })
    void parse_blank_returnsEmpty(String raw) {
        assertTrue(ChannelIdList.parse(raw).isEmpty());
    }

    @Test
    void parse_jsonArray() {
        assertEquals(List.of("@chan1", "-100123"), ChannelIdList.parse("[\"@chan1\", -100123]"));
    }

    @Test
    void parse_commaSeparated_trimsAndDropsBlanks() {
        assertEquals(List.of("@chan1", "@chan2"), ChannelIdList.parse(" @chan1 ,, @chan2 ,"));
    }

    @Test
    void parse_singleId() {
        assertEquals(List.of("@only"), ChannelIdList.parse("@only"));
    }

    @Test
    void parse_malformedJson_returnsEmpty() {
        assertTrue(ChannelIdList.parse("[\"@a\",").isEmpty());
    }

    @Test
    void normalize_removesDuplicatesKeepingOrder() {
        assertEquals(List.of("b", "a"), ChannelIdList.normalize(Arrays.asList("b", null, "a", " b ")));
    }
}
