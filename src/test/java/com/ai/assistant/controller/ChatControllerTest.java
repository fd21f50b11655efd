package com.ai.assistant.controller;

import com.ai.assistant.dto.ChatResponse;
import com.ai.assistant.dto.TranscriptMessageDto;
import com.ai.assistant.dto.TurnDto;
import com.ai.assistant.service.ChatService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ChatController.class)
class ChatControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ChatService chatService;

    @Test
    void chat_returnsTurnResult() throws Exception {
        when(chatService.chat("s1", "check complaint ABC-999", false)).thenReturn(ChatResponse.builder()
                .sessionId("s1")
                .reply("**Complaint ID**: ABC-999")
                .action("FETCH_COMPLAINT")
                .intent("RETRIEVE_COMPLAINT")
                .confidence(1.0)
                .state("IDLE")
                .build());

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s1\",\"message\":\"check complaint ABC-999\",\"refineQuery\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("s1"))
                .andExpect(jsonPath("$.action").value("FETCH_COMPLAINT"))
                .andExpect(jsonPath("$.intent").value("RETRIEVE_COMPLAINT"))
                .andExpect(jsonPath("$.state").value("IDLE"));
    }

    @Test
    void chat_blankMessage_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s1\",\"message\":\"  \"}"))
                .andExpect(status().isBadRequest());

        verify(chatService, never()).chat(anyString(), anyString(), any());
    }

    @Test
    void reset_returnsIdle() throws Exception {
        mockMvc.perform(post("/api/chat/s1/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("IDLE"));

        verify(chatService).reset("s1");
    }

    @Test
    void endSession_unknownIsNotFound() throws Exception {
        when(chatService.endSession("s1")).thenReturn(true);

        mockMvc.perform(delete("/api/chat/s1")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/chat/nope")).andExpect(status().isNotFound());
    }

    @Test
    void history_listsTurns() throws Exception {
        when(chatService.history("s1")).thenReturn(List.of(new TurnDto("how long do they take?", "About a week.",
                "DOCUMENT_QUERY", "how long do returns take?", Instant.parse("2024-05-01T10:15:30Z"))));

        mockMvc.perform(get("/api/chat/s1/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].retrievalQuery").value("how long do returns take?"))
                .andExpect(jsonPath("$[0].intent").value("DOCUMENT_QUERY"));
    }

    @Test
    void transcript_listsPersistedMessages() throws Exception {
        Instant at = Instant.parse("2024-05-01T10:15:30Z");
        when(chatService.transcript("s1")).thenReturn(List.of(
                new TranscriptMessageDto("user", "I want to file a complaint", "FILE_COMPLAINT", at),
                new TranscriptMessageDto("assistant", "Please describe the issue.", "FILE_COMPLAINT", at)));

        mockMvc.perform(get("/api/chat/s1/transcript"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].role").value("user"))
                .andExpect(jsonPath("$[1].content").value("Please describe the issue."));
    }
}
