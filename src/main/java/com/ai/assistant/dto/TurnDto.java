package com.ai.assistant.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * One exchange of the in-memory history window as exposed over HTTP.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class TurnDto {
    private String utterance;
    private String response;
    private String intent;
    private String retrievalQuery;
    private Instant timestamp;
}
