package com.cario.docintel.app.service.ocr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.docintel.app.exception.OcrAuthenticationException;
import com.cario.docintel.app.exception.OcrProcessingException;
import com.cario.docintel.app.exception.OcrRateLimitException;
import com.cario.docintel.app.exception.OcrTimeoutException;
import com.cario.docintel.app.exception.OcrTransportException;
import com.cario.docintel.app.exception.OcrValidationException;
import com.cario.docintel.app.model.JobHandle;
import com.cario.docintel.app.model.OcrRequest;
import com.cario.docintel.app.model.PollOutcome;
import com.cario.docintel.app.model.Point;
import com.cario.docintel.app.model.RecognitionOptions;
import com.cario.docintel.app.model.RecognitionResult;
import com.cario.docintel.app.model.TextLine;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.ConnectException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.WebClientRequestException;

class DatalabOcrClientTest {

  private static final String BASE = "https://ocr.test/api/v1";
  private static final String CHECK_URL = BASE + "/ocr/req-1";
  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  private final Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
  private StubExchange exchange;
  private DatalabOcrClient client;

  @BeforeEach
  void setUp() {
    exchange = new StubExchange();
    DatalabTransport transport =
        new DatalabTransport(
            DatalabOcrClient.NAME, exchange.builder(), BASE, "secret", new ObjectMapper(), clock);
    client = new DatalabOcrClient(transport, 1024, TIMEOUT, clock);
  }

  private static OcrRequest pdf() {
    return new OcrRequest(
        "%PDF-1.4".getBytes(), "bol.pdf", "application/pdf", RecognitionOptions.defaults());
  }

  private static JobHandle handle() {
    return new JobHandle(
        DatalabOcrClient.NAME, "req-1", CHECK_URL, Instant.parse("2025-03-01T11:59:50Z"));
  }

  // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
  // Submit
  // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

  @Test
  @DisplayName("Submit posts to /ocr with the API key and returns the check URL")
  void submit_returnsHandle() {
    exchange.ok(
        "{\"success\":true,\"request_id\":\"req-1\",\"request_check_url\":\"" + CHECK_URL + "\"}");

    JobHandle handle = client.submit(pdf(), TIMEOUT);

    assertEquals("req-1", handle.getRequestId());
    assertEquals(CHECK_URL, handle.getCheckUrl());
    assertEquals(clock.instant(), handle.getSubmittedAt());

    ClientRequest sent = exchange.requests.get(0);
    assertEquals(HttpMethod.POST, sent.method());
    assertEquals(URI.create(BASE + "/ocr"), sent.url());
    assertEquals("secret", sent.headers().getFirst("X-Api-Key"));
  }

  @Test
  @DisplayName("HTTP 401 on submit is an authentication error")
  void submit_unauthorized() {
    exchange.json(HttpStatus.UNAUTHORIZED, "{\"detail\":\"bad key\"}");
    assertThrows(OcrAuthenticationException.class, () -> client.submit(pdf(), TIMEOUT));
  }

  @Test
  @DisplayName("HTTP 429 on submit is a rate-limit error")
  void submit_rateLimited() {
    exchange.json(HttpStatus.TOO_MANY_REQUESTS, "{}");
    assertThrows(OcrRateLimitException.class, () -> client.submit(pdf(), TIMEOUT));
  }

  @Test
  @DisplayName("Other non-2xx statuses are processing errors carrying the status")
  void submit_serverError() {
    exchange.json(HttpStatus.INTERNAL_SERVER_ERROR, "boom");
    OcrProcessingException ex =
        assertThrows(OcrProcessingException.class, () -> client.submit(pdf(), TIMEOUT));
    assertTrue(ex.getMessage().contains("500"));
  }

  @Test
  @DisplayName("An acknowledgement with success=false is a processing error")
  void submit_rejected() {
    exchange.ok("{\"success\":false,\"error\":\"unsupported file\"}");
    OcrProcessingException ex =
        assertThrows(OcrProcessingException.class, () -> client.submit(pdf(), TIMEOUT));
    assertTrue(ex.getMessage().contains("unsupported file"));
  }

  @Test
  @DisplayName("An acknowledgement without a check URL is a processing error")
  void submit_missingCheckUrl() {
    exchange.ok("{\"success\":true,\"request_id\":\"req-1\"}");
    assertThrows(OcrProcessingException.class, () -> client.submit(pdf(), TIMEOUT));
  }

  @Test
  @DisplayName("A check URL that is malformed or not http(s) is rejected at submit")
  void submit_invalidCheckUrl() {
    exchange.ok("{\"success\":true,\"request_id\":\"req-1\",\"request_check_url\":\"not a url\"}");
    exchange.ok(
        "{\"success\":true,\"request_id\":\"req-1\",\"request_check_url\":\"ftp://ocr.test/x\"}");

    OcrProcessingException malformed =
        assertThrows(OcrProcessingException.class, () -> client.submit(pdf(), TIMEOUT));
    assertTrue(malformed.getMessage().contains("malformed request_check_url"));
    assertThrows(OcrProcessingException.class, () -> client.submit(pdf(), TIMEOUT));
  }

  @Test
  @DisplayName("Malformed JSON is a processing error")
  void submit_malformedJson() {
    exchange.ok("{not json");
    assertThrows(OcrProcessingException.class, () -> client.submit(pdf(), TIMEOUT));
  }

  @Test
  @DisplayName("Connection failures surface as transport errors")
  void submit_transportFailure() {
    exchange.error(
        new WebClientRequestException(
            new ConnectException("refused"),
            HttpMethod.POST,
            URI.create(BASE + "/ocr"),
            new HttpHeaders()));
    assertThrows(OcrTransportException.class, () -> client.submit(pdf(), TIMEOUT));
  }

  @Test
  @DisplayName("A call that outlives its timeout is cancelled with a timeout error")
  void submit_timesOut() {
    exchange.never();
    assertThrows(OcrTimeoutException.class, () -> client.submit(pdf(), Duration.ofMillis(50)));
  }

  // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
  // Validation
  // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

  @Test
  @DisplayName("Empty, oversized and unsupported files are rejected without a network call")
  void validate_rejectsBadFiles() {
    RecognitionOptions defaults = RecognitionOptions.defaults();
    OcrRequest empty = new OcrRequest(new byte[0], "a.pdf", "application/pdf", defaults);
    OcrRequest big = new OcrRequest(new byte[2048], "a.pdf", "application/pdf", defaults);
    OcrRequest text = new OcrRequest(new byte[10], "a.txt", "text/plain", defaults);

    assertThrows(OcrValidationException.class, () -> client.submit(empty, TIMEOUT));
    assertThrows(OcrValidationException.class, () -> client.submit(big, TIMEOUT));
    assertThrows(OcrValidationException.class, () -> client.submit(text, TIMEOUT));
    assertTrue(exchange.requests.isEmpty());
  }

  @Test
  @DisplayName("More than four language hints are rejected")
  void validate_rejectsTooManyLanguages() {
    RecognitionOptions options =
        RecognitionOptions.builder().languages(List.of("en", "es", "fr", "de", "it")).build();
    OcrRequest request = new OcrRequest(new byte[10], "a.png", "image/png", options);

    assertThrows(OcrValidationException.class, () -> client.validate(request));
  }

  @Test
  @DisplayName("Mime types are compared without case or parameters")
  void validate_normalizesMimeType() {
    OcrRequest request =
        new OcrRequest(new byte[10], "a.png", "Image/PNG; q=1", RecognitionOptions.defaults());
    client.validate(request);
  }

  // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
  // Poll
  // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

  @Test
  @DisplayName("A processing status is not complete")
  void poll_processing() {
    exchange.ok("{\"status\":\"processing\"}");

    PollOutcome outcome = client.poll(handle(), TIMEOUT);

    assertFalse(outcome.isComplete());
    assertEquals(HttpMethod.GET, exchange.requests.get(0).method());
    assertEquals(URI.create(CHECK_URL), exchange.requests.get(0).url());
  }

  @Test
  @DisplayName("A completed job is normalized into pages and lines")
  void poll_completeNormalizesLines() {
    exchange.ok(
        "{\"status\":\"complete\",\"success\":true,\"page_count\":1,\"pages\":[{\"page\":1,"
            + "\"languages\":[\"en\"],\"text_lines\":["
            + "{\"text\":\" BILL OF LADING \",\"confidence\":0.9,\"bbox\":[10,20,110,40]},"
            + "{\"text\":\"   \",\"confidence\":0.1,\"bbox\":[0,0,1,1]},"
            + "{\"text\":\"Shipper: Acme\",\"confidence\":1.4,\"bbox\":[10,50,90,70],"
            + "\"polygon\":[[10,50],[90,50],[90,70],[10,70]]}]}]}");

    PollOutcome outcome = client.poll(handle(), TIMEOUT);

    assertTrue(outcome.isComplete());
    RecognitionResult result = outcome.getResult();
    assertEquals(DatalabOcrClient.NAME, result.getProviderName());
    assertEquals(1, result.getPageCount());
    assertEquals(2, result.getLineCount());
    assertEquals("BILL OF LADING\nShipper: Acme", result.getFullText());
    assertEquals(List.of("en"), result.getPages().get(0).getLanguages());
    assertEquals(0.95, result.getAverageConfidence(), 1e-9);
    assertEquals(Duration.ofSeconds(10), result.getProcessingTime());

    TextLine first = result.getPages().get(0).getLines().get(0);
    assertEquals(
        List.of(new Point(10, 20), new Point(110, 20), new Point(110, 40), new Point(10, 40)),
        first.getPolygon());
    assertEquals(1.0, result.getPages().get(0).getLines().get(1).getConfidence(), 1e-9);
  }

  @Test
  @DisplayName("A completed job with success=false is a processing error")
  void poll_jobFailed() {
    exchange.ok("{\"status\":\"complete\",\"success\":false,\"error\":\"corrupt pdf\"}");
    OcrProcessingException ex =
        assertThrows(OcrProcessingException.class, () -> client.poll(handle(), TIMEOUT));
    assertTrue(ex.getMessage().contains("corrupt pdf"));
  }

  @Test
  @DisplayName("A status payload over the buffer limit is a processing error")
  void poll_bufferLimitExceeded() {
    exchange.error(new DataBufferLimitException("Exceeded limit on max bytes to buffer"));

    OcrProcessingException ex =
        assertThrows(OcrProcessingException.class, () -> client.poll(handle(), TIMEOUT));
    assertEquals(DatalabOcrClient.NAME, ex.getProvider());
    assertTrue(ex.getCause() instanceof DataBufferLimitException);
  }

  @Test
  @DisplayName("A malformed check URL on the handle fails before any request is sent")
  void poll_malformedCheckUrl() {
    JobHandle bad =
        new JobHandle(DatalabOcrClient.NAME, "req-1", "http://bad host/x", clock.instant());

    assertThrows(OcrProcessingException.class, () -> client.poll(bad, TIMEOUT));
    assertTrue(exchange.requests.isEmpty());
  }

  @Test
  @DisplayName("An unknown status is a processing error")
  void poll_unknownStatus() {
    exchange.ok("{\"status\":\"exploded\"}");
    assertThrows(OcrProcessingException.class, () -> client.poll(handle(), TIMEOUT));
  }

  @Test
  @DisplayName("Credential id is stable per key and hides the key")
  void credentialId_derivedFromKey() {
    DatalabTransport other =
        new DatalabTransport(
            MarkerOcrClient.NAME, exchange.builder(), BASE, "secret", new ObjectMapper(), clock);
    assertEquals(client.credentialId(), other.credentialId());
    assertFalse(client.credentialId().contains("secret"));
  }
}
