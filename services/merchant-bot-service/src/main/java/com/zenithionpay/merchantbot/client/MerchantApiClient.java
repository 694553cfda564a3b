package com.zenithionpay.merchantbot.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.zenithionpay.merchantbot.config.MerchantApiProperties;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Authenticated calls to the merchant payments API.
 *
 * <p>2xx answers return the decoded body (raw text when it is not JSON). Anything else throws
 * {@link MerchantApiStatusException}; a call that got no response throws {@link
 * MerchantApiTransportException}. Calls are never retried.
 */
@Component
@Slf4j
public class MerchantApiClient {

  static final String API_KEY_HEADER = "X-API-Key";

  private final RestClient.Builder builder;
  private final HttpClient httpClient;
  private final MerchantApiProperties properties;
  private final ObjectMapper mapper;
  private final ConcurrentMap<Duration, RestClient> clientsByTimeout = new ConcurrentHashMap<>();

  public MerchantApiClient(
      RestClient.Builder builder,
      HttpClient merchantHttpClient,
      MerchantApiProperties properties,
      ObjectMapper mapper) {
    this.builder = builder;
    this.httpClient = merchantHttpClient;
    this.properties = properties;
    this.mapper = mapper;
  }

  public JsonNode get(String path, String credential, MultiValueMap<String, String> query) {
    return get(path, credential, query, properties.timeout());
  }

  public JsonNode get(
      String path, String credential, MultiValueMap<String, String> query, Duration timeout) {
    return call(HttpMethod.GET, path, Map.of(), credential, query, null, timeout);
  }

  /**
   * GET on a path template such as {@code payments/{id}}. Each variable is encoded strictly, so a
   * value containing {@code /}, {@code ?} or {@code #} stays inside its own path segment.
   */
  public JsonNode get(String pathTemplate, Map<String, ?> pathVariables, String credential) {
    return call(
        HttpMethod.GET, pathTemplate, pathVariables, credential, null, null, properties.timeout());
  }

  public JsonNode post(String path, String credential, Map<String, ?> body) {
    return post(path, credential, body, properties.timeout());
  }

  public JsonNode post(String path, String credential, Map<String, ?> body, Duration timeout) {
    return call(HttpMethod.POST, path, Map.of(), credential, null, body, timeout);
  }

  private JsonNode call(
      HttpMethod method,
      String path,
      Map<String, ?> pathVariables,
      String credential,
      MultiValueMap<String, String> query,
      Map<String, ?> body,
      Duration timeout) {
    URI uri = buildUri(properties.baseUrl(), path, pathVariables, query);
    long started = System.nanoTime();

    RawResponse response;
    try {
      RestClient.RequestBodySpec spec =
          client(timeout).method(method).uri(uri).header(API_KEY_HEADER, credential);
      if (body != null) {
        spec = spec.contentType(MediaType.APPLICATION_JSON).body(body);
      }
      response =
          spec.exchange(
              (req, res) ->
                  new RawResponse(
                      res.getStatusCode().value(),
                      StreamUtils.copyToString(res.getBody(), StandardCharsets.UTF_8)));
    } catch (ResourceAccessException e) {
      log.error("{} {} failed ({} ms)", method, uri, elapsedMs(started), e);
      throw new MerchantApiTransportException(uri.toString(), e);
    }

    long elapsed = elapsedMs(started);
    JsonNode payload = decode(response.body());
    if (response.status() >= 200 && response.status() <= 299) {
      log.info("{} {} -> {} ({} ms)", method, uri, response.status(), elapsed);
      return payload;
    }
    log.warn(
        "{} {} -> {} ({} ms), payload={}", method, uri, response.status(), elapsed, payload);
    throw new MerchantApiStatusException(response.status(), payload, uri.toString());
  }

  private RestClient client(Duration timeout) {
    Duration actual = timeout == null ? properties.timeout() : timeout;
    return clientsByTimeout.computeIfAbsent(
        actual,
        t -> {
          JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
          factory.setReadTimeout(t);
          return builder.clone().requestFactory(factory).build();
        });
  }

  private JsonNode decode(String body) {
    if (body == null || body.isBlank()) {
      return TextNode.valueOf(body == null ? "" : body);
    }
    try {
      return mapper.readTree(body);
    } catch (JsonProcessingException e) {
      return TextNode.valueOf(body);
    }
  }

  static URI buildUri(String baseUrl, String path, MultiValueMap<String, String> query) {
    return buildUri(baseUrl, path, Map.of(), query);
  }

  static URI buildUri(
      String baseUrl,
      String path,
      Map<String, ?> pathVariables,
      MultiValueMap<String, String> query) {
    String base = baseUrl == null ? "" : baseUrl;
    while (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    String endpoint = path == null ? "" : path;
    while (endpoint.startsWith("/")) {
      endpoint = endpoint.substring(1);
    }
    UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(base + "/" + endpoint);
    if (query != null && !query.isEmpty()) {
      uri.queryParams(query);
    }
    return uri.encode().buildAndExpand(pathVariables == null ? Map.of() : pathVariables).toUri();
  }

  private static long elapsedMs(long startedNanos) {
    return (System.nanoTime() - startedNanos) / 1_000_000;
  }

  private record RawResponse(int status, String body) {}
}
