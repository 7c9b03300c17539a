package com.walkerbrain.portal.modules.transcripts.presentation.dto;

public record TranscriptResponse(String sourceTranscriptId, String transcript) {
}
