package com.channelcast.common.infra;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorUtilsTest {

    @Test
    void formatErrorMessage_nullMessage_usesClassName() {
        assertEquals("IllegalStateException", ErrorUtils.formatErrorMessage(new IllegalStateException()));
        assertEquals("Error", ErrorUtils.formatErrorMessage(null));
    }

    @Test
    void formatErrorChain_joinsCauses() {
        Exception err = new RuntimeException("outer", new IllegalStateException("inner"));
        assertEquals("outer → inner", ErrorUtils.formatErrorChain(err));
        assertEquals("unknown error", ErrorUtils.formatErrorChain(null));
    }
}
