package com.ai.assistant.service;

import com.ai.assistant.conversation.IntentLabel;
import com.ai.assistant.dto.ChatResponse;
import com.ai.assistant.dto.ComplaintRecord;
import com.ai.assistant.dto.RetrievedDocument;
import com.ai.assistant.dto.TranscriptMessageDto;
import com.ai.assistant.dto.TurnDto;
import com.ai.assistant.entity.ConversationMessage;
import com.ai.assistant.exception.BackendFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ChatServiceTest {

    private final EngineFixture engine = new EngineFixture();
    private ComplaintBackendClient complaintClient;
    private DocumentRetriever retriever;
    private AnswerGenerator answerGenerator;
    private TranscriptService transcript;
    private ChatService chat;

    @BeforeEach
    void setUp() {
        complaintClient = mock(ComplaintBackendClient.class);
        retriever = mock(DocumentRetriever.class);
        answerGenerator = mock(AnswerGenerator.class);
        transcript = mock(TranscriptService.class);
        chat = new ChatService(engine.orchestrator, engine.store, complaintClient, retriever, answerGenerator, transcript, 2);
    }

    private static List<RetrievedDocument> docs(String content) {
        return List.of(RetrievedDocument.builder().content(content).source("manual.pdf").score(0.9).build());
    }

    @Test
    void fileComplaint_endToEnd() {
        when(complaintClient.submit(any())).thenReturn("ABC-999");

        assertEquals("COLLECTING_COMPLAINT(0)", chat.chat("s1", "I want to file a complaint", null).getState());
        chat.chat("s1", "The delivery was late", null);
        chat.chat("s1", "Jane Doe", null);
        chat.chat("s1", "555-123-4567", null);
        ChatResponse confirm = chat.chat("s1", "jane@example.com", null);
        assertEquals("CONFIRM_PENDING", confirm.getState());
        assertTrue(confirm.getReply().endsWith("(yes/no)"));

        ChatResponse done = chat.chat("s1", "yes", null);

        assertEquals(engine.phrases.complaintRegistered("ABC-999"), done.getReply());
        assertEquals("SUBMIT_COMPLAINT", done.getAction());
        assertEquals("IDLE", done.getState());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> fields = ArgumentCaptor.forClass(Map.class);
        verify(complaintClient).submit(fields.capture());
        assertEquals(List.of("details", "name", "phone", "email"), List.copyOf(fields.getValue().keySet()));
        assertEquals("5551234567", fields.getValue().get("phone"));
        assertEquals("The delivery was late", fields.getValue().get("details"));
    }

    @Test
    void submitFailure_keepsDraftForRetry() {
        when(complaintClient.submit(any()))
                .thenThrow(new BackendFailureException("HTTP 503"))
                .thenReturn("ABC-999");
        for (String msg : List.of("I want to file a complaint", "The delivery was late", "Jane Doe",
                "555-123-4567", "jane@example.com")) {
            chat.chat("s1", msg, null);
        }

        ChatResponse failed = chat.chat("s1", "yes", null);
        assertEquals(engine.phrases.submitFailed(), failed.getReply());
        assertEquals("CONFIRM_PENDING", failed.getState());

        ChatResponse retried = chat.chat("s1", "yes", null);
        assertEquals(engine.phrases.complaintRegistered("ABC-999"), retried.getReply());
        verify(complaintClient, times(2)).submit(any());
    }

    @Test
    void fetchComplaint_foundAndMissing() {
        ComplaintRecord record = ComplaintRecord.builder().complaintId("ABC-999").name("Jane Doe")
                .complaintDetails("Late delivery").createdAt("2024-05-01T10:15:30Z").build();
        when(complaintClient.fetch("ABC-999")).thenReturn(Optional.of(record));
        when(complaintClient.fetch("XYZ-123")).thenReturn(Optional.empty());

        ChatResponse found = chat.chat("s1", "check complaint ABC-999", null);
        assertEquals(engine.phrases.complaintDetails(record), found.getReply());
        assertEquals("RETRIEVE_COMPLAINT", found.getIntent());

        ChatResponse missing = chat.chat("s1", "check complaint XYZ-123", null);
        assertEquals(engine.phrases.complaintNotFound("XYZ-123"), missing.getReply());
        assertEquals("IDLE", missing.getState());
    }

    @Test
    void fetchFailure_isReportedNotThrown() {
        when(complaintClient.fetch(anyString())).thenThrow(new BackendFailureException("timeout"));

        ChatResponse r = chat.chat("s1", "check complaint ABC-999", null);

        assertEquals(engine.phrases.fetchFailed(), r.getReply());
        verify(transcript).recordAssistant("s1", engine.phrases.fetchFailed(), IntentLabel.RETRIEVE_COMPLAINT);
    }

    @Test
    void documentFollowUp_isRefinedBeforeRetrieval() {
        when(retriever.search(anyString(), anyInt())).thenReturn(docs("Returns are accepted within 30 days."));
        when(answerGenerator.generate(anyString(), anyList(), anyList())).thenReturn("Within 30 days.", "About a week.");

        ChatResponse first = chat.chat("s1", "what does the manual say about returns?", null);
        assertEquals("Within 30 days.", first.getReply());
        assertEquals("DOCUMENT_QUERY", first.getIntent());

        ChatResponse second = chat.chat("s1", "how long do they take?", null);
        assertEquals("About a week.", second.getReply());
        assertEquals("how long do returns take?", second.getRetrievalQuery());
        verify(retriever).search("how long do returns take?", 2);

        List<TurnDto> history = chat.history("s1");
        assertEquals(2, history.size());
        assertEquals("how long do returns take?", history.get(1).getRetrievalQuery());
    }

    @Test
    void refinementOff_passesUtteranceThrough() {
        when(retriever.search(anyString(), anyInt())).thenReturn(docs("Returns are accepted within 30 days."));
        when(answerGenerator.generate(anyString(), anyList(), anyList())).thenReturn("ok");

        chat.chat("s1", "what does the manual say about returns?", null);
        ChatResponse r = chat.chat("s1", "how long do they take?", false);

        assertEquals("how long do they take?", r.getRetrievalQuery());
        verify(retriever).search("how long do they take?", 2);
    }

    @Test
    void noDocuments_skipsGeneration() {
        when(retriever.search(anyString(), anyInt())).thenReturn(List.of());

        ChatResponse r = chat.chat("s1", "what is the warranty period?", null);

        assertEquals(engine.phrases.noRelevantDocuments(), r.getReply());
        verifyNoInteractions(answerGenerator);
    }

    @Test
    void generationFailure_isReported() {
        when(retriever.search(anyString(), anyInt())).thenReturn(docs("Warranty lasts one year."));
        when(answerGenerator.generate(anyString(), anyList(), anyList())).thenThrow(new BackendFailureException("no key"));

        ChatResponse r = chat.chat("s1", "what is the warranty period?", null);

        assertEquals(engine.phrases.retrievalFailed(), r.getReply());
    }

    @Test
    void abandonedFiling_noticePrefixesAnswer() {
        when(retriever.search(anyString(), anyInt())).thenReturn(docs("Returns are accepted within 30 days."));
        when(answerGenerator.generate(anyString(), anyList(), anyList())).thenReturn("Within 30 days.");
        chat.chat("s1", "I want to file a complaint", null);

        ChatResponse r = chat.chat("s1", "what does the manual say about returns?", null);

        assertEquals(engine.phrases.flowAbandoned(IntentLabel.FILE_COMPLAINT) + " Within 30 days.", r.getReply());
        assertEquals("IDLE", r.getState());
    }

    @Test
    void blankSessionId_getsGeneratedOne() {
        ChatResponse r = chat.chat("", "I want to file a complaint", null);

        assertNotNull(r.getSessionId());
        assertFalse(r.getSessionId().isBlank());
        assertTrue(engine.store.contains(r.getSessionId()));
    }

    @Test
    void everyTurnIsTranscribed() {
        chat.chat("s1", "I want to file a complaint", null);

        verify(transcript).recordUser("s1", "I want to file a complaint", IntentLabel.FILE_COMPLAINT);
        verify(transcript).recordAssistant(eq("s1"), anyString(), eq(IntentLabel.FILE_COMPLAINT));
    }

    @Test
    void transcript_outlivesEndedSession() {
        Instant at = Instant.parse("2024-05-01T10:15:30Z");
        when(transcript.transcript("s1")).thenReturn(List.of(
                ConversationMessage.builder().id(1L).sessionId("s1").role("user").content("hi").intent("UNKNOWN").createdAt(at).build(),
                ConversationMessage.builder().id(2L).sessionId("s1").role("assistant").content("Hello!").intent("UNKNOWN").createdAt(at).build()));
        chat.endSession("s1");

        List<TranscriptMessageDto> messages = chat.transcript("s1");
        assertEquals(2, messages.size());
        assertEquals("user", messages.get(0).getRole());
        assertEquals("Hello!", messages.get(1).getContent());
        assertEquals(at, messages.get(1).getCreatedAt());
    }
}
