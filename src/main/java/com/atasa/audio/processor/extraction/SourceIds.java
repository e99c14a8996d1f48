package com.atasa.audio.processor.extraction;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Recognizes YouTube video IDs, bare or embedded in a watch/share URL. */
public final class SourceIds {

  private static final Pattern BARE_ID = Pattern.compile("[A-Za-z0-9_-]{11}");

  // Matches watch?v=<id>, youtu.be/<id>, /embed/<id> and /shorts/<id>
  private static final Pattern ID_IN_URL = Pattern.compile("(?:v=|/)([A-Za-z0-9_-]{11})");

  private SourceIds() {}

  public static boolean isValid(String sourceId) {
    return sourceId != null && BARE_ID.matcher(sourceId).matches();
  }

  /**
   * Resolve a source ID from either a bare ID or a URL containing one.
   *
   * @return the ID, or empty if none can be found
   */
  public static Optional<String> resolve(String sourceIdOrUrl) {
    if (sourceIdOrUrl == null || sourceIdOrUrl.isBlank()) {
      return Optional.empty();
    }

    String candidate = sourceIdOrUrl.trim();
    if (isValid(candidate)) {
      return Optional.of(candidate);
    }

    Matcher matcher = ID_IN_URL.matcher(candidate);
    return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
  }
}
