package br.rio.confere.infrastructure.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.rio.confere.application.error.ExtractionMalformedResponseException;
import br.rio.confere.application.error.ExtractionRateLimitedException;
import br.rio.confere.application.error.ExtractionUnavailableException;
import br.rio.confere.application.extraction.ExtractionRequest;
import br.rio.confere.application.extraction.ExtractionSchema;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class HttpExtractionAdapterTest {
  private static final String ENVELOPE = "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":%s}}]}";

  private HttpServer server;
  private final List<String> authorizations = new ArrayList<>();
  private final List<String> bodies = new ArrayList<>();

  @AfterEach
  void stopServer() {
    if (server != null) {
      server.stop(0);
    }
  }

  @Test
  void extractsSchemaFieldsFromSuccessfulAnswer() throws IOException {
    String answer = "```json\n{\"processo\": \"SMS-PRO-2025/00001\", \"valor_contrato\": \"R$ 1.000,00\","
        + " \"partes\": {\"contratante\": \"SMS\", \"contratada\": \"ACME\"}, \"extra\": 1, \"objeto\": null}\n```";
    HttpExtractionAdapter adapter = adapterAnswering(200, Map.of(), String.format(ENVELOPE, quote(answer)));

    Map<String, String> fields = adapter.extract(
        new ExtractionRequest("texto do contrato", ExtractionSchema.CONTRACT, true));

    assertEquals(Map.of(
        "processo", "SMS-PRO-2025/00001",
        "valor_contrato", "R$ 1.000,00",
        "contratante", "SMS",
        "contratada", "ACME"), fields);
    assertEquals(List.of("Bearer secret-key"), authorizations);
    JsonNode sent = new ObjectMapper().readTree(bodies.get(0));
    assertEquals("test-model", sent.get("model").asText());
    assertEquals("json_object", sent.path("response_format").path("type").asText());
    assertEquals("texto do contrato", sent.path("messages").path(1).path("content").asText());
  }

  @Test
  void rateLimitCarriesRetryAfter() throws IOException {
    HttpExtractionAdapter adapter = adapterAnswering(429, Map.of("Retry-After", "7"), "{}");

    ExtractionRateLimitedException ex = assertThrows(ExtractionRateLimitedException.class,
        () -> adapter.extract(new ExtractionRequest("x", ExtractionSchema.PUBLICATION, false)));

    assertEquals(Optional.of(Duration.ofSeconds(7)), ex.retryAfter());
  }

  @Test
  void serverErrorIsUnavailable() throws IOException {
    HttpExtractionAdapter adapter = adapterAnswering(503, Map.of(), "maintenance");

    assertThrows(ExtractionUnavailableException.class,
        () -> adapter.extract(new ExtractionRequest("x", ExtractionSchema.PUBLICATION, false)));
  }

  @Test
  void nonStrictRequestOmitsResponseFormat() throws IOException {
    HttpExtractionAdapter adapter = adapterAnswering(200, Map.of(), String.format(ENVELOPE, quote("{}")));

    adapter.extract(new ExtractionRequest("x", ExtractionSchema.PUBLICATION, false));

    assertFalse(new ObjectMapper().readTree(bodies.get(0)).has("response_format"));
  }

  @Test
  void envelopeWithoutContentIsMalformed() {
    assertThrows(ExtractionMalformedResponseException.class,
        () -> HttpExtractionAdapter.messageContent("{\"choices\":[]}"));
    assertThrows(ExtractionMalformedResponseException.class,
        () -> HttpExtractionAdapter.messageContent("<html>"));
  }

  @Test
  void answerThatIsNotAnObjectIsMalformed() {
    assertThrows(ExtractionMalformedResponseException.class,
        () -> HttpExtractionAdapter.parseAnswer("[1, 2]", ExtractionSchema.CONTRACT));
    assertThrows(ExtractionMalformedResponseException.class,
        () -> HttpExtractionAdapter.parseAnswer("não encontrei o contrato", ExtractionSchema.CONTRACT));
  }

  @Test
  void lenientAnswersAreAccepted() {
    Map<String, String> fields = HttpExtractionAdapter.parseAnswer(
        "Segue o resultado: {numero_contrato: '045/2025', // número\n 'data_assinatura': '01/03/2025',}",
        ExtractionSchema.PUBLICATION);

    assertEquals("045/2025", fields.get("numero_contrato"));
    assertEquals("01/03/2025", fields.get("data_assinatura"));
  }

  @Test
  void stripsFencesAndSurroundingProse() {
    assertEquals("{\"a\":1}", HttpExtractionAdapter.stripFences("```json\n{\"a\":1}\n```"));
    assertEquals("{\"a\":1}", HttpExtractionAdapter.stripFences("Resposta: {\"a\":1} fim"));
    assertEquals("{\"a\":1}", HttpExtractionAdapter.stripFences("  {\"a\":1}  "));
  }

  @Test
  void parsesRetryAfterSeconds() {
    assertEquals(Optional.of(Duration.ofSeconds(30)), HttpExtractionAdapter.parseRetryAfter(" 30 "));
    assertEquals(Optional.empty(), HttpExtractionAdapter.parseRetryAfter("-1"));
    assertEquals(Optional.empty(), HttpExtractionAdapter.parseRetryAfter("Wed, 21 Oct 2025 07:28:00 GMT"));
  }

  @Test
  void strictInstructionsForbidExtraText() {
    String relaxed = HttpExtractionAdapter.instructions(
        new ExtractionRequest("x", ExtractionSchema.CONTRACT, false));
    String strict = HttpExtractionAdapter.instructions(
        new ExtractionRequest("x", ExtractionSchema.CONTRACT, true));

    assertTrue(relaxed.contains("numero_contrato"));
    assertFalse(relaxed.contains("APENAS"));
    assertTrue(strict.contains("APENAS"));
  }

  private HttpExtractionAdapter adapterAnswering(int status, Map<String, String> headers, String body)
      throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/v1/chat/completions", exchange -> {
      authorizations.add(exchange.getRequestHeaders().getFirst("Authorization"));
      bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
      headers.forEach((name, value) -> exchange.getResponseHeaders().add(name, value));
      byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
      exchange.sendResponseHeaders(status, bytes.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(bytes);
      }
    });
    server.start();
    URI endpoint = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/v1/chat/completions");
    return new HttpExtractionAdapter(endpoint, "test-model", "secret-key", Duration.ofSeconds(5));
  }

  private static String quote(String text) throws IOException {
    return new ObjectMapper().writeValueAsString(text);
  }
}
