package com.channelcast.app.commands;

import com.channelcast.common.config.ChannelCastConfig;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandAuthorizationTest {

    private static ChannelCastConfig allowing(String... ids) {
        ChannelCastConfig config = new ChannelCastConfig();
        config.getAdmin().setAllowFrom(Arrays.asList(ids));
        return config;
    }

    @Test
    void emptyAllowList_authorizesEveryone() {
        assertTrue(CommandAuthorization.isAuthorizedSender("anyone", allowing()));
        assertTrue(CommandAuthorization.isAuthorizedSender(null, allowing()));
    }

    @Test
    void wildcard_authorizesEveryone() {
        assertTrue(CommandAuthorization.isAuthorizedSender("anyone", allowing("42", " * ")));
    }

    @Test
    void listedSender_isAuthorized_afterTrimming() {
        assertTrue(CommandAuthorization.isAuthorizedSender(" 42 ", allowing("42")));
    }

    @Test
    void unlistedOrMissingSender_isDenied() {
        assertFalse(CommandAuthorization.isAuthorizedSender("7", allowing("42")));
        assertFalse(CommandAuthorization.isAuthorizedSender(null, allowing("42")));
        assertFalse(CommandAuthorization.isAuthorizedSender("  ", allowing("42")));
    }

    @Test
    void resolveAllowList_dropsBlanksAndDuplicates() {
        assertEquals(List.of("42", "7"), CommandAuthorization.resolveAllowList(allowing("42", "", "7", " 42", null)));
    }

    @Test
    void nullConfig_authorizesEveryone() {
        assertTrue(CommandAuthorization.isAuthorizedSender("x", null));
    }
}
