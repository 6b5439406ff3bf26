package com.optionengine.unit.controller;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.optionengine.api.controller.SessionController;
import com.optionengine.config.ApiResponseAdvice;
import com.optionengine.session.SessionLifecycle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class SessionControllerTest {

    private MockMvc mockMvc;

    @Mock
    private SessionLifecycle sessionLifecycle;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SessionController(sessionLifecycle))
                .setControllerAdvice(new ApiResponseAdvice("PAPER"))
                .build();
    }

    @Test
    @DisplayName("POST /api/session/close-all returns the number of exits started")
    void closeAll() throws Exception {
        when(sessionLifecycle.closeAll()).thenReturn(2);

        mockMvc.perform(post("/api/session/close-all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.closed").value(2));
        verify(sessionLifecycle).closeAll();
    }
}
