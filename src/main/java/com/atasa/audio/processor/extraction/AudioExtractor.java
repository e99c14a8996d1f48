package com.atasa.audio.processor.extraction;

import com.atasa.audio.processor.artifact.ArtifactStore;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Extracts the audio track of a video into the artifact store using yt-dlp.
 *
 * <p>The tool writes to a staging file which is only moved onto the artifact path after the process
 * exited cleanly and the file exists. A failed or timed-out run therefore never leaves anything at
 * the artifact path, and two concurrent extractions of the same source cannot corrupt each other:
 * the last one to finish wins.
 *
 * <p>There is no retry. One failed attempt fails the owning job.
 */
@Component
public class AudioExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioExtractor.class);

  private static final Duration KILL_WAIT = Duration.ofSeconds(5);

  private final ExtractionProperties properties;
  private final ArtifactStore artifactStore;
  private final ProcessFactory processFactory;

  @Autowired
  public AudioExtractor(ExtractionProperties properties, ArtifactStore artifactStore) {
    this(properties, artifactStore, new DefaultProcessFactory());
  }

  AudioExtractor(
      ExtractionProperties properties, ArtifactStore artifactStore, ProcessFactory processFactory) {
    this.properties = properties;
    this.artifactStore = artifactStore;
    this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
  }

  /**
   * Download the best available audio for a source and convert it to the configured format.
   *
   * @param sourceId the video ID
   * @return the artifact path and its size
   * @throws ToolInvocationException if the tool cannot start, exits nonzero or times out
   * @throws ExtractionException if the tool produced no file
   */
  public ExtractedAudio extract(String sourceId) {
    String url = String.format(properties.sourceUrlTemplate(), sourceId);
    Path staging = artifactStore.stagingPathFor(sourceId);

    LOGGER.info("Extracting audio: sourceId={}, url={}", sourceId, url);
    long startTime = System.currentTimeMillis();

    try {
      runTool(buildCommand(url, staging));

      if (!Files.isRegularFile(staging)) {
        throw new ExtractionException(
            String.format("%s file not created", properties.audioFormat().toUpperCase()));
      }

      Path artifact = artifactStore.commit(staging, sourceId);
      long size = artifactStore.sizeOf(sourceId);

      LOGGER.info(
          "Audio extracted: sourceId={}, size={} bytes ({} MB), took={}ms",
          sourceId,
          size,
          String.format("%.2f", size / 1024.0 / 1024.0),
          System.currentTimeMillis() - startTime);

      return new ExtractedAudio(artifact, size);

    } finally {
      deleteStaging(staging);
    }
  }

  /**
   * Build the yt-dlp command line:
   *
   * <pre>
   * yt-dlp -f bestaudio -x --audio-format mp3 --audio-quality 128K -o &lt;staging&gt; &lt;url&gt;
   * </pre>
   */
  List<String> buildCommand(String url, Path output) {
    return List.of(
        properties.command(),
        "-f",
        "bestaudio",
        "-x",
        "--audio-format",
        properties.audioFormat(),
        "--audio-quality",
        properties.audioQuality(),
        "-o",
        output.toString(),
        url);
  }

  private void runTool(List<String> command) {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Process process;
    try {
      process = processFactory.start(command);
    } catch (IOException e) {
      throw new ToolInvocationException(
          "Failed to start " + properties.command() + ": " + e.getMessage(), e);
    }

    // Drain output concurrently so a chatty tool never blocks on a full pipe.
    OutputTail tail = new OutputTail(properties.maxOutputChars());
    Thread gobbler = startGobbler(process, tail);

    try {
      boolean finished =
          process.waitFor(properties.timeout().toMillis(), TimeUnit.MILLISECONDS);
      if (!finished) {
        destroyTree(process);
        throw new ToolInvocationException(
            String.format(
                "%s timed out after %ds", properties.command(), properties.timeout().toSeconds()));
      }

      // The pipe closes once the tool has exited, so this returns after the last line is read.
      gobbler.join();

      int exitCode = process.exitValue();
      if (exitCode != 0) {
        throw new ToolInvocationException(
            String.format(
                "%s exited with code %d: %s", properties.command(), exitCode, tail.text().trim()));
      }
    } catch (InterruptedException e) {
      destroyTree(process);
      Thread.currentThread().interrupt();
      throw new ToolInvocationException("Extraction interrupted", e);
    }
  }

  /**
   * Kill the tool and every process it started (yt-dlp runs ffmpeg for the conversion), then wait
   * briefly so nothing writes into the staging area after cleanup.
   */
  private void destroyTree(Process process) {
    try {
      process.descendants().forEach(ProcessHandle::destroyForcibly);
    } catch (UnsupportedOperationException e) {
      LOGGER.debug("Cannot list child processes of {}: {}", properties.command(), e.getMessage());
    }
    process.destroyForcibly();

    try {
      if (!process.waitFor(KILL_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
        LOGGER.warn("{} still running {}ms after kill", properties.command(), KILL_WAIT.toMillis());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private Thread startGobbler(Process process, OutputTail tail) {
    Thread thread =
        new Thread(
            () -> {
              try (BufferedReader reader =
                  new BufferedReader(
                      new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                  tail.append(line);
                  LOGGER.trace("{}: {}", properties.command(), line);
                }
              } catch (IOException e) {
                LOGGER.debug("Stopped reading {} output: {}", properties.command(), e.getMessage());
              }
            },
            "extraction-output");
    thread.setDaemon(true);
    thread.start();
    return thread;
  }

  private void deleteStaging(Path staging) {
    try {
      Files.deleteIfExists(staging);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete staging file {}: {}", staging, e.getMessage());
    }
  }

  /** Keeps only the last {@code limit} characters of the tool's output. */
  private static final class OutputTail {

    private final int limit;
    private final StringBuilder buffer = new StringBuilder();

    OutputTail(int limit) {
      this.limit = limit;
    }

    synchronized void append(String line) {
      buffer.append(line).append('\n');
      if (buffer.length() > limit) {
        buffer.delete(0, buffer.length() - limit);
      }
    }

    synchronized String text() {
      return buffer.toString();
    }
  }
}
