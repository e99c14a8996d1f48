package com.atasa.audio.processor.artifact;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filesystem implementation of {@link ArtifactStore}.
 *
 * <p>All files live flat in one scratch directory as {@code <sourceId>.mp3}. Staged writes use
 * {@code <sourceId>.<uuid>.staging.mp3} in the same directory so the final rename stays on one
 * filesystem and can be atomic. Stale staging files left by a crash are picked up by the sweep like
 * any other old file.
 */
public class LocalArtifactStore implements ArtifactStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalArtifactStore.class);

  static final String EXTENSION = ".mp3";

  // Source IDs become file names, so nothing that could escape the directory is accepted.
  private static final Pattern SAFE_SOURCE_ID = Pattern.compile("[A-Za-z0-9_-]+");

  private final Path directory;
  private final Clock clock;

  public LocalArtifactStore(Path directory, Clock clock) {
    this.directory = directory;
    this.clock = clock;

    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new ArtifactStoreException("Failed to create artifact directory: " + directory, e);
    }

    LOGGER.info("Initialized artifact store: directory={}", directory);
  }

  @Override
  public Path pathFor(String sourceId) {
    return directory.resolve(checkedId(sourceId) + EXTENSION);
  }

  @Override
  public boolean exists(String sourceId) {
    return Files.isRegularFile(pathFor(sourceId));
  }

  @Override
  public long sizeOf(String sourceId) {
    try {
      return Files.size(pathFor(sourceId));
    } catch (NoSuchFileException e) {
      throw new ArtifactNotFoundException(sourceId);
    } catch (IOException e) {
      throw new ArtifactStoreException("Failed to read size of artifact " + sourceId, e);
    }
  }

  @Override
  public Path stagingPathFor(String sourceId) {
    return directory.resolve(checkedId(sourceId) + "." + UUID.randomUUID() + ".staging" + EXTENSION);
  }

  @Override
  public Path commit(Path stagedFile, String sourceId) {
    Path target = pathFor(sourceId);
    try {
      try {
        Files.move(
            stagedFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        LOGGER.warn("Atomic move not supported in {}, falling back to plain replace", directory);
        Files.move(stagedFile, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new ArtifactStoreException("Failed to place artifact for " + sourceId, e);
    }

    LOGGER.debug("Committed artifact: sourceId={}, path={}", sourceId, target);
    return target;
  }

  @Override
  public void remove(String sourceId) {
    try {
      if (Files.deleteIfExists(pathFor(sourceId))) {
        LOGGER.info("Removed artifact: sourceId={}", sourceId);
      }
    } catch (IOException e) {
      throw new ArtifactStoreException("Failed to remove artifact " + sourceId, e);
    }
  }

  @Override
  public int sweep(Duration maxAge) {
    Instant cutoff = clock.instant().minus(maxAge);
    int deleted = 0;

    try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
      for (Path file : files) {
        try {
          if (deleteIfExpired(file, cutoff)) {
            deleted++;
          }
        } catch (IOException e) {
          LOGGER.warn("Failed to sweep {}: {}", file.getFileName(), e.getMessage());
        }
      }
    } catch (IOException e) {
      throw new ArtifactStoreException("Failed to list artifact directory " + directory, e);
    }

    return deleted;
  }

  /**
   * Delete one directory entry if it is a regular file last modified before {@code cutoff}.
   *
   * @return true if the file was deleted by this call
   */
  boolean deleteIfExpired(Path file, Instant cutoff) throws IOException {
    if (!Files.isRegularFile(file)) {
      return false;
    }
    Instant modified = Files.getLastModifiedTime(file).toInstant();
    if (!modified.isBefore(cutoff) || !Files.deleteIfExists(file)) {
      return false;
    }
    LOGGER.info("Deleted expired artifact: {}", file.getFileName());
    return true;
  }

  public Path getDirectory() {
    return directory;
  }

  private static String checkedId(String sourceId) {
    if (sourceId == null || !SAFE_SOURCE_ID.matcher(sourceId).matches()) {
      throw new IllegalArgumentException("Invalid source id: " + sourceId);
    }
    return sourceId;
  }
}
