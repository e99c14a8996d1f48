package com.atasa.audio.processor.transcription;

import java.time.Duration;

/** Blocking pause between polling attempts. Tests substitute a no-op. */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
