package com.atasa.audio.processor.api;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Request for transcribing the audio of a video.
 *
 * <p>{@code apiKey} belongs to the caller's account at the chosen provider and is only used for this
 * job. {@code language} is optional.
 */
public record TranscribeRequest(
    @JsonAlias("sourceId") String videoId, String provider, String apiKey, String language) {}
