package com.atasa.audio.processor.artifact;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Local cache of extracted audio files, keyed by source ID.
 *
 * <p>There is at most one live artifact per source ID. Artifacts are shared between jobs: a
 * transcription request reuses the file left behind by an earlier extraction of the same source.
 * The store never looks inside files; validity is decided when the file is produced.
 *
 * <p>New files are written to a staging path first and then placed with {@link #commit(Path,
 * String)}, so a reader never sees a partially written artifact.
 */
public interface ArtifactStore {

  /**
   * The deterministic location of the artifact for a source ID, whether or not it exists.
   *
   * @throws IllegalArgumentException if the source ID is not a safe file name
   */
  Path pathFor(String sourceId);

  boolean exists(String sourceId);

  /**
   * Size of the artifact in bytes.
   *
   * @throws ArtifactNotFoundException if there is no artifact for the source ID
   */
  long sizeOf(String sourceId);

  /**
   * A fresh, unique path in the store's directory for an in-progress write.
   *
   * <p>The file is not created. Concurrent callers for the same source ID get different paths.
   */
  Path stagingPathFor(String sourceId);

  /**
   * Atomically move a staged file onto the artifact path, replacing any existing artifact.
   *
   * @return the artifact path
   * @throws ArtifactStoreException if the move fails
   */
  Path commit(Path stagedFile, String sourceId);

  /** Delete the artifact for a source ID. Does nothing if there is none. */
  void remove(String sourceId);

  /**
   * Delete every file in the store whose last modification is older than {@code maxAge}.
   *
   * <p>Failures on individual files are logged and skipped.
   *
   * @return the number of files deleted
   */
  int sweep(Duration maxAge);
}
