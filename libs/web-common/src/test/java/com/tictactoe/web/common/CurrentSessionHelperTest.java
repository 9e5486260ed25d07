package com.tictactoe.web.common;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpSession;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class CurrentSessionHelperTest {

    @Test
    void getSessionIdCreatesSession() {
        MockHttpServletRequest request = new MockHttpServletRequest();

        String id = CurrentSessionHelper.getSessionId(request);

        assertNotNull(id);
        assertEquals(id, CurrentSessionHelper.getSessionId(request));
        assertEquals(id, CurrentSessionHelper.findSessionId(request));
    }

    @Test
    void findSessionIdDoesNotCreateSession() {
        MockHttpServletRequest request = new MockHttpServletRequest();

        assertNull(CurrentSessionHelper.findSessionId(request));
        assertNull(request.getSession(false));
    }

    @Test
    void existingSessionIsReused() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        MockHttpSession session = new MockHttpSession(null, "abc");
        request.setSession(session);

        assertEquals("abc", CurrentSessionHelper.getSessionId(request));
    }
}
