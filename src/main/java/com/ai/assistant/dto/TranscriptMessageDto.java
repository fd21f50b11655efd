package com.ai.assistant.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * One persisted chat message. Unlike {@link TurnDto} this covers the whole session, not just the window.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptMessageDto {
    private String role;
    private String content;
    private String intent;
    private Instant createdAt;
}
