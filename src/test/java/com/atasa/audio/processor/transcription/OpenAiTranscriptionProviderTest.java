package com.atasa.audio.processor.transcription;

import static com.atasa.audio.processor.transcription.HttpTestDoubles.bodyOf;
import static com.atasa.audio.processor.transcription.HttpTestDoubles.response;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import com.atasa.audio.processor.transcription.TranscriptionProperties.AssemblyAiProperties;
import com.atasa.audio.processor.transcription.TranscriptionProperties.OpenAiProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OpenAiTranscriptionProviderTest {

  @Mock private HttpClient httpClient;

  @TempDir Path tempDir;

  private OpenAiTranscriptionProvider provider;
  private Path audioFile;

  @BeforeEach
  void setUp() throws IOException {
    TranscriptionProperties properties =
        new TranscriptionProperties(
            "tr",
            2,
            10,
            Duration.ofSeconds(5),
            new OpenAiProperties("https://openai.test", "whisper-1", Duration.ofMinutes(5)),
            new AssemblyAiProperties(
                "https://assemblyai.test", Duration.ofSeconds(5), 120, Duration.ofMinutes(1)));
    provider = new OpenAiTranscriptionProvider(httpClient, properties, new ObjectMapper());

    audioFile = tempDir.resolve("abc12345678.mp3");
    Files.writeString(audioFile, "fake-mp3-bytes");
  }

  @Test
  void returnsResponseBodyVerbatim() throws Exception {
    doReturn(response(200, "Merhaba dünya.\n")).when(httpClient).send(any(), any());

    String transcript = provider.transcribe(audioFile, "tr", "sk-test");

    assertThat(transcript).isEqualTo("Merhaba dünya.\n");
  }

  @Test
  void sendsMultipartRequestWithBearerKey() throws Exception {
    doReturn(response(200, "text")).when(httpClient).send(any(), any());

    provider.transcribe(audioFile, "en", "sk-test");

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any());
    HttpRequest request = captor.getValue();

    assertThat(request.method()).isEqualTo("POST");
    assertThat(request.uri().toString()).isEqualTo("https://openai.test/v1/audio/transcriptions");
    assertThat(request.headers().firstValue("Authorization")).contains("Bearer sk-test");
    assertThat(request.headers().firstValue("Content-Type").orElseThrow())
        .startsWith("multipart/form-data; boundary=");

    String body = bodyOf(request);
    assertThat(body)
        .contains("name=\"file\"; filename=\"abc12345678.mp3\"")
        .contains("Content-Type: audio/mpeg")
        .contains("fake-mp3-bytes")
        .contains("name=\"model\"\r\n\r\nwhisper-1")
        .contains("name=\"language\"\r\n\r\nen")
        .contains("name=\"response_format\"\r\n\r\ntext");
  }

  @Test
  void structuredErrorBodyBecomesProviderError() throws Exception {
    doReturn(
            response(
                401,
                "{\"error\":{\"message\":\"Incorrect API key provided\","
                    + "\"type\":\"invalid_request_error\"}}"))
        .when(httpClient)
        .send(any(), any());

    assertThatThrownBy(() -> provider.transcribe(audioFile, "tr", "bad"))
        .isInstanceOf(ProviderException.class)
        .hasMessage("Incorrect API key provided");
  }

  @Test
  void unstructuredErrorBodyIsUsedAsIs() throws Exception {
    doReturn(response(502, "Bad Gateway")).when(httpClient).send(any(), any());

    assertThatThrownBy(() -> provider.transcribe(audioFile, "tr", "sk-test"))
        .isInstanceOf(ProviderException.class)
        .hasMessage("Bad Gateway");
  }

  @Test
  void networkFailureIsTranscriptionError() throws Exception {
    doThrow(new IOException("Connection reset")).when(httpClient).send(any(), any());

    assertThatThrownBy(() -> provider.transcribe(audioFile, "tr", "sk-test"))
        .isInstanceOf(TranscriptionException.class)
        .hasMessage("OpenAI request failed: Connection reset");
  }
}
