package com.channelcast.channel.telegram;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TelegramTargets} chat id normalization.
 */
class TelegramTargetsTest {

    @Test
    void normalizeChatId_atUsername() {
        assertEquals("@chan1", TelegramTargets.normalizeChatId("@chan1"));
    }

    @Test
    void normalizeChatId_tmeUrl() {
        assertEquals("@testchannel", TelegramTargets.normalizeChatId("https://t.me/testchannel"));
    }

    @Test
    void normalizeChatId_tmeUrlWithPath() {
        assertEquals("@testchannel", TelegramTargets.normalizeChatId("https://t.me/testchannel/123"));
    }

    @Test
    void normalizeChatId_supergroupId() {
        assertEquals("-100123456789", TelegramTargets.normalizeChatId("-100123456789"));
    }

    @Test
    void normalizeChatId_internalPrefix() {
        assertEquals("-100123", TelegramTargets.normalizeChatId("telegram:tg:-100123"));
    }

    @Test
    void normalizeChatId_bareUsername() {
        assertEquals("@mychannel", TelegramTargets.normalizeChatId("mychannel"));
    }

    @Test
    void normalizeChatId_blank_throws() {
        assertThrows(IllegalArgumentException.class, () -> TelegramTargets.normalizeChatId("  "));
        assertThrows(IllegalArgumentException.class, () -> TelegramTargets.normalizeChatId(null));
    }
}
