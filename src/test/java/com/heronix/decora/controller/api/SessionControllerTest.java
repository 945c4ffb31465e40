package com.heronix.decora.controller.api;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.heronix.decora.exception.AuthException;
import com.heronix.decora.service.DecoraSessionService;
import com.heronix.decora.session.AuthenticationResult;
import com.heronix.decora.session.SessionState;

@WebMvcTest(SessionController.class)
class SessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DecoraSessionService sessionService;

    @Test
    void reportsStatus() throws Exception {
        when(sessionService.getStatus()).thenReturn(new DecoraSessionService.SessionStatus(
                SessionState.AUTHENTICATED, Instant.parse("2024-05-01T13:00:00Z"), false, true, true));

        mockMvc.perform(get("/api/v1/decora/session/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("AUTHENTICATED"))
                .andExpect(jsonPath("$.credentialsConfigured").value(true));
    }

    @Test
    void loginDoesNotExposeToken() throws Exception {
        when(sessionService.login()).thenReturn(
                new AuthenticationResult("abc123", 3600, Instant.parse("2024-05-01T13:00:00Z")));

        mockMvc.perform(post("/api/v1/decora/session/login"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticated").value(true))
                .andExpect(jsonPath("$.expiresIn").value(3600))
                .andExpect(content().string(not(containsString("abc123"))));
    }

    @Test
    void failedLoginIsUnauthorized() throws Exception {
        when(sessionService.login()).thenThrow(new AuthException("Authentication failed with status 401: nope"));

        mockMvc.perform(post("/api/v1/decora/session/login"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void storesCredentials() throws Exception {
        mockMvc.perform(put("/api/v1/decora/session/credentials")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"alice\",\"password\":\"s3cret\"}"))
                .andExpect(status().isOk());

        verify(sessionService).updateCredentials("alice", "s3cret");
    }

    @Test
    void blankPasswordIsBadRequest() throws Exception {
        mockMvc.perform(put("/api/v1/decora/session/credentials")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"alice\",\"password\":\"\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(sessionService);
    }
}
