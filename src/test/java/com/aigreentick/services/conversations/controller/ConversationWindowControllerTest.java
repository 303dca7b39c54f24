package com.aigreentick.services.conversations.controller;

import com.aigreentick.services.conversations.constants.WindowStatus;
import com.aigreentick.services.conversations.entity.ConversationWindow;
import com.aigreentick.services.conversations.exception.GlobalExceptionHandler;
import com.aigreentick.services.conversations.service.ConversationWindowService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConversationWindowController Tests")
class ConversationWindowControllerTest {

    @Mock
    private ConversationWindowService windowService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ConversationWindowController(windowService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Window status is reported with remaining hours")
    void reportsStatus() throws Exception {
        when(windowService.status(10L, "919800000001")).thenReturn(WindowStatus.ACTIVE);
        when(windowService.hoursRemaining(10L, "919800000001")).thenReturn(12.5);

        mockMvc.perform(get("/api/v1/conversations/10/919800000001/window"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.status").value("ACTIVE"))
                .andExpect(jsonPath("$.data.hoursRemaining").value(12.5))
                .andExpect(jsonPath("$.data.canSendFreeMessage").value(true));
    }

    @Test
    @DisplayName("Unknown contact cannot receive free-form messages")
    void unknownContact() throws Exception {
        when(windowService.status(10L, "919800000009")).thenReturn(WindowStatus.UNKNOWN);
        when(windowService.hoursRemaining(10L, "919800000009")).thenReturn(0.0);

        mockMvc.perform(get("/api/v1/conversations/10/919800000009/window"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.canSendFreeMessage").value(false));
    }

    @Test
    @DisplayName("Extension returns the new window")
    void extendsWindow() throws Exception {
        ConversationWindow window = ConversationWindow.builder()
                .organizationId(10L).contactPhone("919800000001")
                .startedAt(LocalDateTime.of(2026, 3, 1, 10, 0))
                .endsAt(LocalDateTime.of(2026, 3, 3, 10, 0))
                .status(WindowStatus.MANUALLY_EXTENDED)
                .build();
        when(windowService.extend(10L, "919800000001", 48)).thenReturn(window);
        when(windowService.status(10L, "919800000001")).thenReturn(WindowStatus.MANUALLY_EXTENDED);
        when(windowService.hoursRemaining(10L, "919800000001")).thenReturn(48.0);

        mockMvc.perform(post("/api/v1/conversations/10/919800000001/window/extend")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hours\":48}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("MANUALLY_EXTENDED"))
                .andExpect(jsonPath("$.data.endsAt").exists());
    }

    @Test
    @DisplayName("Extension beyond a week is rejected")
    void extensionTooLong() throws Exception {
        mockMvc.perform(post("/api/v1/conversations/10/919800000001/window/extend")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hours\":500}"))
                .andExpect(status().isBadRequest());

        verify(windowService, never()).extend(anyLong(), anyString(), anyInt());
    }
}
