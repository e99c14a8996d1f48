package com.atasa.audio.processor.api;

/** Error body returned for every rejected request. */
public record ErrorResponse(String error) {}
