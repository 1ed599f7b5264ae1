package com.channelcast.app.commands;

import com.channelcast.gateway.job.JobPayload;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandArgsTest {

    @Test
    void splitParts_trimsEachPart() {
        assertEquals(List.of("Morning", "0 9 * * *", "greeting", "hello"),
                CommandArgs.splitParts(" Morning ||0 9 * * *|| greeting || hello"));
    }

    @Test
    void splitParts_keepsEmptyPositions() {
        assertEquals(List.of("a", "", "c"), CommandArgs.splitParts("a || || c"));
    }

    @Test
    void splitParts_blank_returnsEmpty() {
        assertTrue(CommandArgs.splitParts("   ").isEmpty());
        assertTrue(CommandArgs.splitParts(null).isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
            "'', 24",
            "12, 12",
            "'48 digest', 48",
            "abc, 24",
            "0, 24",
            "-5, 24"
    })
    void leadingInt_fallsBackOnMissingOrInvalid(String args, int expected) {
        assertEquals(expected, CommandArgs.leadingInt(args, 24));
    }

    @Test
    void secondToken_returnsTypeFilter() {
        assertEquals("digest", CommandArgs.secondToken("6 digest"));
        assertNull(CommandArgs.secondToken("6"));
        assertNull(CommandArgs.secondToken(""));
    }

    @Test
    void parsePayload_plainText_isStatic() {
        assertEquals("hi there",
                ((JobPayload.StaticContent) JobCommands.parsePayload("hi there")).text());
    }

    @Test
    void parsePayload_emptyPrompt_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> JobCommands.parsePayload("gemini:  "));
    }
}
