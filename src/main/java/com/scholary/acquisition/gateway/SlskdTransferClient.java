package com.scholary.acquisition.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the slskd REST API ({@code /api/v0}).
 *
 * <p>Every call carries the {@code X-API-Key} header and a per-request timeout. Non-2xx answers
 * and unreadable bodies become {@link GatewayException}s carrying the status and raw text. An
 * empty 2xx body means "no data", which the gateway uses for successful no-content operations.
 *
 * <p>Only {@link #submitSearch} goes through the {@link SearchRateLimiter}; it is the call the
 * network polices.
 */
@Component
public class SlskdTransferClient implements TransferClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(SlskdTransferClient.class);

  private static final String API_PREFIX = "/api/v0/";
  private static final String API_KEY_HEADER = "X-API-Key";

  private final HttpClient httpClient;
  private final GatewayProperties properties;
  private final ObjectMapper objectMapper;
  private final SearchRateLimiter rateLimiter;
  private final String apiRoot;

  public SlskdTransferClient(
      GatewayProperties properties, ObjectMapper objectMapper, SearchRateLimiter rateLimiter) {
    if (properties.baseUrl() == null || properties.baseUrl().isBlank()) {
      throw new IllegalArgumentException("Gateway base URL is not configured");
    }
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.rateLimiter = rateLimiter;
    this.apiRoot = properties.baseUrl().trim().replaceAll("/+$", "") + API_PREFIX;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeoutSeconds()))
            .build();

    LOGGER.info("Initialized slskd client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public String id() {
    return "slskd";
  }

  @Override
  public String name() {
    return "Soulseek (slskd)";
  }

  @Override
  public String submitSearch(String query, Duration timeout) {
    rateLimiter.acquire();

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("searchText", query);
    body.put("timeout", timeout.toMillis());
    body.put("filterResponses", true);
    body.put("minimumPeerUploadSpeed", properties.minimumPeerUploadSpeed());

    LOGGER.info("Starting search for '{}' with timeout {}ms", query, timeout.toMillis());
    JsonNode response =
        send("POST", "searches", body)
            .orElseThrow(() -> new GatewayException(200, "Search response carried no body"));
    String searchId = response.path("id").asText(null);
    if (searchId == null || searchId.isBlank()) {
      throw new GatewayException(200, "Search response carried no id: " + response);
    }
    LOGGER.info("Search initiated with id {}", searchId);
    return searchId;
  }

  @Override
  public List<PeerResponse> pollSearchResponses(String searchId) {
    Optional<JsonNode> response = send("GET", "searches/" + encode(searchId) + "/responses", null);
    if (response.isEmpty() || !response.get().isArray()) {
      return List.of();
    }
    try {
      return objectMapper.convertValue(response.get(), new TypeReference<List<PeerResponse>>() {});
    } catch (IllegalArgumentException e) {
      throw new GatewayException(200, "Unreadable search responses: " + e.getMessage(), e);
    }
  }

  @Override
  public void deleteSearch(String searchId) {
    LOGGER.debug("Deleting search {}", searchId);
    try {
      send("DELETE", "searches/" + encode(searchId), null);
    } catch (GatewayException e) {
      if (!e.isNotFound()) {
        throw e;
      }
      LOGGER.debug("Search {} already gone", searchId);
    }
  }

  @Override
  public List<SubmittedFile> submitDownloads(String username, List<RequestedFile> files) {
    LOGGER.info("Requesting {} files from peer {}", files.size(), username);
    String body = sendForText("POST", "transfers/downloads/" + encode(username), files);
    return BatchResponseParser.parse(body, files, objectMapper);
  }

  @Override
  public List<TransferRecord> listAllTransfers() {
    return send("GET", "transfers/downloads", null)
        .map(TransferListParser::parse)
        .orElseGet(List::of);
  }

  @Override
  public void cancelTransfer(String username, String transferId, boolean remove) {
    LOGGER.info("Cancelling transfer {} from {} (remove={})", transferId, username, remove);
    send(
        "DELETE",
        "transfers/downloads/" + encode(username) + "/" + encode(transferId) + "?remove=" + remove,
        null);
  }

  @Override
  public void clearCompletedTransfers() {
    LOGGER.info("Clearing all completed transfers");
    send("DELETE", "transfers/downloads/all/completed", null);
  }

  @Override
  public boolean checkConnectivity() {
    try {
      send("GET", "session", null);
      return true;
    } catch (GatewayException e) {
      LOGGER.warn(
          "Gateway connectivity check failed: status={}, {}", e.getStatusCode(), e.getMessage());
      return false;
    }
  }

  private Optional<JsonNode> send(String method, String endpoint, Object body) {
    String text = sendForText(method, endpoint, body);
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readTree(text));
    } catch (JsonProcessingException e) {
      throw new GatewayException(200, "JSON parse error: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * Perform one request and return the raw body of a 2xx answer.
   *
   * @throws GatewayException on transport failure, timeout, interruption or non-2xx status
   */
  private String sendForText(String method, String endpoint, Object body) {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(URI.create(apiRoot + endpoint))
            .timeout(Duration.ofSeconds(properties.requestTimeoutSeconds()))
            .header("Accept", "application/json");
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder.header(API_KEY_HEADER, properties.apiKey());
    }
    if (body != null) {
      try {
        builder
            .header("Content-Type", "application/json")
            .method(method, BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
      } catch (JsonProcessingException e) {
        throw new IllegalStateException("Could not serialise request body for " + endpoint, e);
      }
    } else {
      builder.method(method, BodyPublishers.noBody());
    }
    HttpRequest request = builder.build();

    LOGGER.debug("Request: {} {}", method, request.uri());
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new GatewayException(
          0, String.format("%s %s failed: %s", method, endpoint, e.getMessage()), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GatewayException(0, String.format("%s %s interrupted", method, endpoint), e);
    }

    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      String text = response.body();
      throw new GatewayException(
          status, text == null || text.isBlank() ? "HTTP " + status : text);
    }
    return response.body();
  }

  private static String encode(String segment) {
    return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
