package com.scholary.acquisition.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Runs the client against an in-process HTTP stub of the gateway. */
class SlskdTransferClientTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final Map<String, Stub> stubs = new ConcurrentHashMap<>();
  private final Map<String, String> lastBodies = new ConcurrentHashMap<>();
  private final Map<String, String> lastApiKeys = new ConcurrentHashMap<>();

  private HttpServer server;
  private SlskdTransferClient client;

  private record Stub(int status, String body) {}

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/", this::handle);
    server.start();

    GatewayProperties properties =
        new GatewayProperties(
            "http://127.0.0.1:" + server.getAddress().getPort() + "/",
            "secret",
            2,
            5,
            35,
            220,
            10);
    client =
        new SlskdTransferClient(
            properties,
            objectMapper,
            new SearchRateLimiter(35, Duration.ofSeconds(220), Clock.systemUTC()));
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void submitSearch_postsQueryAndReturnsId() throws Exception {
    stub("POST /api/v0/searches", 200, "{\"id\":\"abc-123\",\"state\":\"InProgress\"}");

    String searchId = client.submitSearch("Boards of Canada Geogaddi", Duration.ofSeconds(120));

    assertThat(searchId).isEqualTo("abc-123");
    JsonNode sent = objectMapper.readTree(lastBodies.get("POST /api/v0/searches"));
    assertThat(sent.path("searchText").asText()).isEqualTo("Boards of Canada Geogaddi");
    assertThat(sent.path("timeout").asLong()).isEqualTo(120_000L);
    assertThat(sent.path("filterResponses").asBoolean()).isTrue();
    assertThat(sent.path("minimumPeerUploadSpeed").asInt()).isEqualTo(10);
    assertThat(lastApiKeys.get("POST /api/v0/searches")).isEqualTo("secret");
  }

  @Test
  void submitSearch_withoutId_fails() {
    stub("POST /api/v0/searches", 200, "{}");

    assertThatThrownBy(() -> client.submitSearch("x", Duration.ofSeconds(1)))
        .isInstanceOf(GatewayException.class)
        .hasMessageContaining("no id");
  }

  @Test
  void pollSearchResponses_mapsPeersAndFiles() {
    stub(
        "GET /api/v0/searches/abc/responses",
        200,
        "[{\"username\":\"alice\",\"hasFreeUploadSlot\":true,\"uploadSpeed\":900,"
            + "\"queueLength\":2,\"fileCount\":1,\"files\":[{\"filename\":\"A\\\\01.flac\","
            + "\"size\":123,\"bitRate\":null,\"length\":200,\"extension\":\"flac\"}]}]");

    List<PeerResponse> responses = client.pollSearchResponses("abc");

    assertThat(responses).hasSize(1);
    PeerResponse peer = responses.get(0);
    assertThat(peer.username()).isEqualTo("alice");
    assertThat(peer.hasFreeUploadSlot()).isTrue();
    assertThat(peer.uploadSpeed()).isEqualTo(900);
    assertThat(peer.files()).containsExactly(new PeerFile("A\\01.flac", 123L, null, 200));
  }

  @Test
  void pollSearchResponses_notFound_carriesStatus() {
    stub("GET /api/v0/searches/gone/responses", 404, "");

    assertThatThrownBy(() -> client.pollSearchResponses("gone"))
        .isInstanceOfSatisfying(
            GatewayException.class, e -> assertThat(e.isNotFound()).isTrue());
  }

  @Test
  void deleteSearch_toleratesMissingSearch() {
    stub("DELETE /api/v0/searches/gone", 404, "");

    client.deleteSearch("gone");
  }

  @Test
  void submitDownloads_encodesPeerNameAndParsesBody() throws Exception {
    stub("POST /api/v0/transfers/downloads/dj shadow", 201, "");
    List<RequestedFile> files = List.of(new RequestedFile("A\\01.flac", 123L));

    List<SubmittedFile> results = client.submitDownloads("dj shadow", files);

    assertThat(results).containsExactly(SubmittedFile.accepted("A\\01.flac", 123L));
    JsonNode sent =
        objectMapper.readTree(lastBodies.get("POST /api/v0/transfers/downloads/dj shadow"));
    assertThat(sent.get(0).path("filename").asText()).isEqualTo("A\\01.flac");
    assertThat(sent.get(0).path("size").asLong()).isEqualTo(123L);
  }

  @Test
  void submitDownloads_serverError_isRetryable() {
    stub("POST /api/v0/transfers/downloads/alice", 503, "busy");

    assertThatThrownBy(
            () -> client.submitDownloads("alice", List.of(new RequestedFile("a.flac", 1L))))
        .isInstanceOfSatisfying(
            GatewayException.class,
            e -> {
              assertThat(e.getStatusCode()).isEqualTo(503);
              assertThat(e.isRetryable()).isTrue();
              assertThat(e.getMessage()).isEqualTo("busy");
            });
  }

  @Test
  void listAllTransfers_flattensListing() {
    stub(
        "GET /api/v0/transfers/downloads",
        200,
        "[{\"username\":\"alice\",\"directories\":[{\"directory\":\"A\",\"files\":["
            + "{\"id\":\"t1\",\"filename\":\"A\\\\01.flac\",\"size\":5,"
            + "\"state\":\"Completed, Succeeded\"}]}]}]");

    List<TransferRecord> transfers = client.listAllTransfers();

    assertThat(transfers).hasSize(1);
    assertThat(transfers.get(0).isSuccessful()).isTrue();
  }

  @Test
  void checkConnectivity_reportsFailureWithoutThrowing() {
    stub("GET /api/v0/session", 401, "Unauthorized");

    assertThat(client.checkConnectivity()).isFalse();

    stub("GET /api/v0/session", 200, "{\"username\":\"me\"}");

    assertThat(client.checkConnectivity()).isTrue();
  }

  @Test
  void constructor_rejectsBlankBaseUrl() {
    GatewayProperties properties = new GatewayProperties(" ", null, 1, 1, 1, 1, 0);

    assertThatThrownBy(
            () ->
                new SlskdTransferClient(
                    properties,
                    objectMapper,
                    new SearchRateLimiter(1, Duration.ofSeconds(1), Clock.systemUTC())))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private void stub(String key, int status, String body) {
    stubs.put(key, new Stub(status, body));
  }

  private void handle(HttpExchange exchange) throws IOException {
    String key = exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath();
    byte[] requestBody = exchange.getRequestBody().readAllBytes();
    lastBodies.put(key, new String(requestBody, StandardCharsets.UTF_8));
    String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
    if (apiKey != null) {
      lastApiKeys.put(key, apiKey);
    }

    Stub stub = stubs.getOrDefault(key, new Stub(404, "No stub for " + key));
    byte[] bytes = stub.body().getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(stub.status(), bytes.length == 0 ? -1 : bytes.length);
    if (bytes.length > 0) {
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(bytes);
      }
    }
    exchange.close();
  }
}
