package com.cario.docintel.app.service.ocr;

import com.cario.docintel.app.exception.OcrAuthenticationException;
import com.cario.docintel.app.exception.OcrException;
import com.cario.docintel.app.exception.OcrProcessingException;
import com.cario.docintel.app.exception.OcrRateLimitException;
import com.cario.docintel.app.exception.OcrTimeoutException;
import com.cario.docintel.app.exception.OcrTransportException;
import com.cario.docintel.app.model.JobHandle;
import com.cario.docintel.app.model.OcrRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

/**
 * HTTP plumbing shared by the Datalab endpoints: multipart submit, status GET, {@code
 * X-Api-Key} auth, and translation of HTTP outcomes into the OCR error taxonomy.
 *
 * <p>Each call is bounded by the timeout it is given; on expiry the exchange is cancelled and an
 * {@link OcrTimeoutException} is raised.
 */
@Log4j2
public class DatalabTransport {

  static final String API_KEY_HEADER = "X-Api-Key";
  private static final int MAX_ERROR_BODY = 300;

  private final String provider;
  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final String credentialId;
  private final Clock clock;

  public DatalabTransport(
      String provider,
      WebClient.Builder builder,
      String baseUrl,
      String apiKey,
      ObjectMapper objectMapper,
      Clock clock) {
    this.provider = Objects.requireNonNull(provider);
    this.objectMapper = Objects.requireNonNull(objectMapper);
    this.clock = Objects.requireNonNull(clock);
    String key = apiKey == null ? "" : apiKey;
    this.credentialId = "datalab-" + Integer.toHexString(key.hashCode());
    this.webClient =
        builder
            .clone()
            .baseUrl(Objects.requireNonNull(baseUrl))
            .defaultHeader(API_KEY_HEADER, key)
            .build();
  }

  public String credentialId() {
    return credentialId;
  }

  /**
   * Starts a multipart form for a submit: the file part plus the language and page hints every
   * Datalab endpoint understands.
   */
  public MultipartBodyBuilder baseForm(OcrRequest request) {
    MultipartBodyBuilder form = new MultipartBodyBuilder();
    form.part("file", new ByteArrayResource(request.getContent()))
        .filename(request.getFilename() == null ? "document" : request.getFilename())
        .contentType(
            MediaType.parseMediaType(OcrProviderClient.normalizeMimeType(request.getMimeType())));
    if (request.getOptions() != null) {
      if (request.getOptions().getLanguages() != null
          && !request.getOptions().getLanguages().isEmpty()) {
        form.part("langs", String.join(",", request.getOptions().getLanguages()));
      }
      if (request.getOptions().getMaxPages() != null) {
        form.part("max_pages", String.valueOf(request.getOptions().getMaxPages()));
      }
    }
    return form;
  }

  /** POSTs the form and converts the acknowledgement into a {@link JobHandle}. */
  public JobHandle submit(String path, MultipartBodyBuilder form, Duration timeout) {
    Mono<JsonNode> call =
        webClient
            .post()
            .uri(path)
            .contentType(MediaType.MULTIPART_FORM_DATA)
            .body(BodyInserters.fromMultipartData(form.build()))
            .exchangeToMono(
                resp ->
                    resp.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> classify(resp.statusCode(), body)));
    JsonNode ack = block(call, timeout, "submit");

    if (!ack.path("success").asBoolean(false)) {
      throw new OcrProcessingException(provider, "submit rejected: " + errorText(ack));
    }
    String checkUrl = ack.path("request_check_url").asText(null);
    if (checkUrl == null || checkUrl.isBlank()) {
      throw new OcrProcessingException(provider, "submit response has no request_check_url");
    }
    checkUri(checkUrl);
    String requestId = ack.path("request_id").asText(null);
    log.info("ocr.submit.ok provider={} requestId={}", provider, requestId);
    return new JobHandle(provider, requestId, checkUrl, clock.instant());
  }

  /** GETs the job status document. */
  public JsonNode fetchStatus(JobHandle handle, Duration timeout) {
    Mono<JsonNode> call =
        webClient
            .get()
            .uri(checkUri(handle.getCheckUrl()))
            .exchangeToMono(
                resp ->
                    resp.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> classify(resp.statusCode(), body)));
    return block(call, timeout, "poll");
  }

  private JsonNode block(Mono<JsonNode> call, Duration timeout, String op) {
    return call.timeout(timeout)
        .onErrorMap(
            TimeoutException.class,
            e -> new OcrTimeoutException(provider, op + " timed out after " + timeout, e))
        .onErrorMap(
            WebClientRequestException.class,
            e -> new OcrTransportException(provider, op + " failed: " + e.getMessage(), e))
        .onErrorMap(
            e -> !(e instanceof OcrException),
            e -> new OcrProcessingException(provider, op + " failed: " + e, e))
        .block();
  }

  /** The provider's status URL; must be absolute http(s). */
  private URI checkUri(String checkUrl) {
    URI uri;
    try {
      uri = URI.create(checkUrl);
    } catch (IllegalArgumentException e) {
      throw new OcrProcessingException(provider, "malformed request_check_url: " + checkUrl, e);
    }
    String scheme = uri.getScheme();
    if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
      throw new OcrProcessingException(provider, "request_check_url is not http(s): " + checkUrl);
    }
    return uri;
  }

  private JsonNode classify(HttpStatusCode status, String body) {
    if (status.value() == 401) {
      throw new OcrAuthenticationException(provider, "invalid API key (HTTP 401)");
    }
    if (status.value() == 429) {
      throw new OcrRateLimitException(provider, "rate limit exceeded (HTTP 429)");
    }
    if (!status.is2xxSuccessful()) {
      throw new OcrProcessingException(
          provider, "HTTP " + status.value() + ": " + abbreviate(body));
    }
    try {
      return objectMapper.readTree(body.isEmpty() ? "{}" : body);
    } catch (JsonProcessingException e) {
      throw new OcrProcessingException(provider, "malformed JSON response", e);
    }
  }

  static String errorText(JsonNode node) {
    String error = node.path("error").asText("");
    return error.isBlank() ? "unknown error" : error;
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
  }
}
