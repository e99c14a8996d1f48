package com.atasa.audio.processor.extraction;

import java.nio.file.Path;

/** A successfully extracted audio file and its size in bytes. */
public record ExtractedAudio(Path path, long sizeBytes) {}
