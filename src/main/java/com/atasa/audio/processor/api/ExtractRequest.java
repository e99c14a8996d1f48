package com.atasa.audio.processor.api;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Request for extracting the audio of a video.
 *
 * <p>Either a bare video ID or a YouTube URL; the ID wins when both are given.
 */
public record ExtractRequest(
    @JsonAlias("sourceId") String videoId, @JsonAlias("url") String youtubeUrl) {

  String sourceIdOrUrl() {
    return videoId != null && !videoId.isBlank() ? videoId : youtubeUrl;
  }
}
