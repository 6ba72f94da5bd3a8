package br.rio.confere.infrastructure.extraction;

import br.rio.confere.application.error.ExtractionMalformedResponseException;
import br.rio.confere.application.error.ExtractionRateLimitedException;
import br.rio.confere.application.error.ExtractionUnavailableException;
import br.rio.confere.application.extraction.ExtractionRequest;
import br.rio.confere.application.extraction.ExtractionSchema;
import br.rio.confere.application.port.ExtractionPort;
import br.rio.confere.logging.Logs;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ExtractionPort} speaking the OpenAI-compatible chat-completions protocol.
 * <p><strong>Why:</strong> Contract and gazette texts are free-form Portuguese; a language model returns the
 * schema fields as a JSON object which the pipeline validates downstream.</p>
 * <p><strong>Failure mapping:</strong> HTTP 429 raises {@link ExtractionRateLimitedException} carrying
 * {@code Retry-After}; 5xx, other error statuses, and transport failures raise
 * {@link ExtractionUnavailableException}; an answer that is not a JSON object raises
 * {@link ExtractionMalformedResponseException}. This adapter never retries.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; {@link HttpClient} is thread-safe.</p>
 *
 * @implNote Answers are parsed leniently: Markdown code fences, comments, single quotes, and trailing
 *     commas are accepted.
 */
public final class HttpExtractionAdapter implements ExtractionPort {
  private static final Logger log = LoggerFactory.getLogger(HttpExtractionAdapter.class);
  private static final int MAX_DOCUMENT_CHARS = 24_000;
  private static final int LOG_BODY_BYTES = 512;

  private static final ObjectMapper WIRE = new ObjectMapper();
  private static final ObjectMapper LENIENT = JsonMapper.builder()
      .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
      .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
      .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
      .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
      .build();

  private final HttpClient client;
  private final URI endpoint;
  private final String model;
  private final String apiKey;
  private final Duration timeout;

  /**
   * Creates an adapter with a default HTTP client.
   *
   * @param endpoint chat-completions URL
   * @param model model name
   * @param apiKey bearer token; {@code null} sends no authorization header
   * @param timeout per-request timeout
   */
  public HttpExtractionAdapter(URI endpoint, String model, String apiKey, Duration timeout) {
    this(HttpClient.newBuilder().connectTimeout(timeout).build(), endpoint, model, apiKey, timeout);
  }

  HttpExtractionAdapter(HttpClient client, URI endpoint, String model, String apiKey, Duration timeout) {
    this.client = Objects.requireNonNull(client, "client");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.model = Objects.requireNonNull(model, "model");
    this.apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey.trim();
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public Map<String, String> extract(ExtractionRequest request) {
    Objects.requireNonNull(request, "request");
    HttpRequest.Builder builder = HttpRequest.newBuilder(endpoint)
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(requestBody(request), StandardCharsets.UTF_8));
    if (apiKey != null) {
      builder.header("Authorization", "Bearer " + apiKey);
    }

    HttpResponse<String> response;
    try {
      response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IOException ex) {
      throw new ExtractionUnavailableException("extraction service unreachable: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ExtractionUnavailableException("extraction call interrupted", ex);
    }

    int status = response.statusCode();
    if (status == 429) {
      Duration retryAfter = response.headers().firstValue("Retry-After")
          .flatMap(HttpExtractionAdapter::parseRetryAfter)
          .orElse(null);
      throw new ExtractionRateLimitedException("extraction service rate limited (429)", retryAfter);
    }
    if (status < 200 || status >= 300) {
      log.warn("Extraction service answered {}: {}", status, Logs.truncate(response.body(), LOG_BODY_BYTES));
      throw new ExtractionUnavailableException("extraction service answered HTTP " + status);
    }
    return parseAnswer(messageContent(response.body()), request.schema());
  }

  String requestBody(ExtractionRequest request) {
    ObjectNode body = WIRE.createObjectNode();
    body.put("model", model);
    body.put("temperature", 0);
    if (request.strict()) {
      body.putObject("response_format").put("type", "json_object");
    }
    ArrayNode messages = body.putArray("messages");
    messages.addObject().put("role", "system").put("content", instructions(request));
    messages.addObject().put("role", "user").put("content", clip(request.text()));
    try {
      return WIRE.writeValueAsString(body);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("unable to encode extraction request", ex);
    }
  }

  static String instructions(ExtractionRequest request) {
    ExtractionSchema schema = request.schema();
    StringBuilder text = new StringBuilder()
        .append("Você extrai dados de um ").append(schema.documentKind()).append(". ")
        .append("Responda com um objeto JSON contendo as chaves: ")
        .append(String.join(", ", schema.fields()))
        .append(". Use null quando a informação não constar do texto. ")
        .append("Datas no formato dd/mm/aaaa; valores monetários como aparecem no texto.");
    if (request.strict()) {
      text.append(" Responda APENAS com o objeto JSON, sem texto adicional, sem markdown e sem comentários.");
    }
    return text.toString();
  }

  static String messageContent(String body) {
    JsonNode root;
    try {
      root = WIRE.readTree(body);
    } catch (JsonProcessingException ex) {
      throw new ExtractionMalformedResponseException("extraction envelope is not JSON", ex);
    }
    JsonNode content = root == null ? null : root.path("choices").path(0).path("message").path("content");
    if (content == null || !content.isTextual()) {
      throw new ExtractionMalformedResponseException("extraction envelope has no message content");
    }
    return content.asText();
  }

  static Map<String, String> parseAnswer(String content, ExtractionSchema schema) {
    String json = stripFences(content);
    JsonNode node;
    try {
      node = LENIENT.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new ExtractionMalformedResponseException(
          "extraction answer is not JSON: " + Logs.truncate(json, LOG_BODY_BYTES), ex);
    }
    if (node == null || !node.isObject()) {
      throw new ExtractionMalformedResponseException("extraction answer is not a JSON object");
    }
    Map<String, String> flat = new LinkedHashMap<>();
    flatten(node, flat);
    Map<String, String> fields = new LinkedHashMap<>();
    for (String field : schema.fields()) {
      String value = flat.get(field);
      if (value != null && !value.isBlank()) {
        fields.put(field, value.trim());
      }
    }
    return fields;
  }

  private static void flatten(JsonNode node, Map<String, String> target) {
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> entry = fields.next();
      JsonNode value = entry.getValue();
      if (value.isObject()) {
        // partes: {contratante, contratada}, prazo: {data_inicio, data_fim}
        flatten(value, target);
      } else if (value.isValueNode() && !value.isNull()) {
        target.putIfAbsent(entry.getKey(), value.asText());
      }
    }
  }

  static String stripFences(String content) {
    String trimmed = content == null ? "" : content.strip();
    if (trimmed.startsWith("```")) {
      int firstNewline = trimmed.indexOf('\n');
      int closing = trimmed.lastIndexOf("```");
      if (firstNewline > 0 && closing > firstNewline) {
        return trimmed.substring(firstNewline + 1, closing).strip();
      }
    }
    int open = trimmed.indexOf('{');
    int close = trimmed.lastIndexOf('}');
    if (open > 0 && close > open) {
      return trimmed.substring(open, close + 1);
    }
    return trimmed;
  }

  static Optional<Duration> parseRetryAfter(String raw) {
    try {
      long seconds = Long.parseLong(raw.trim());
      return seconds < 0 ? Optional.empty() : Optional.of(Duration.ofSeconds(seconds));
    } catch (NumberFormatException ex) {
      // HTTP-date form is not used by the supported providers
      return Optional.empty();
    }
  }

  private static String clip(String text) {
    return text.length() <= MAX_DOCUMENT_CHARS ? text : text.substring(0, MAX_DOCUMENT_CHARS);
  }
}
