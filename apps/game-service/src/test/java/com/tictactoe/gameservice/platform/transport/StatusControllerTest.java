package com.tictactoe.gameservice.platform.transport;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class StatusControllerTest {

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        StatusController controller = new StatusController();
        ReflectionTestUtils.setField(controller, "serviceName", "tictactoe-game-service");
        ReflectionTestUtils.setField(controller, "version", "1.0.0");
        mvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void healthIsAlwaysOk() throws Exception {
        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("healthy"));
    }

    @Test
    void statusListsDifficulties() throws Exception {
        mvc.perform(get("/api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.service").value("tictactoe-game-service"))
                .andExpect(jsonPath("$.data.version").value("1.0.0"))
                .andExpect(jsonPath("$.data.difficulties[0]").value("easy"))
                .andExpect(jsonPath("$.data.difficulties[2]").value("hard"));
    }
}
