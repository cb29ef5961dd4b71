package io.b2mash.yahrzeit.integration.messaging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.b2mash.yahrzeit.integration.SendResult;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Posts group messages to an HTTP gateway. Responses 400, 403, 404 and 410 mean the group cannot be
 * reached with this handle and are permanent; 408, 429, 5xx and I/O failures are retryable.
 */
@Component
@ConditionalOnProperty(name = "yahrzeit.channels.group-message.base-url")
@EnableConfigurationProperties(GroupMessageProperties.class)
public class HttpGroupMessageProvider implements GroupMessageProvider {

  private static final Logger log = LoggerFactory.getLogger(HttpGroupMessageProvider.class);

  private static final Set<Integer> PERMANENT_STATUSES = Set.of(400, 403, 404, 410);

  private final RestClient restClient;
  private final String path;

  public HttpGroupMessageProvider(
      GroupMessageProperties properties, RestClient.Builder restClientBuilder) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.timeout());
    requestFactory.setReadTimeout(properties.timeout());
    var builder =
        restClientBuilder
            .clone()
            .baseUrl(properties.baseUrl())
            .requestFactory(requestFactory)
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
    if (properties.token() != null && !properties.token().isBlank()) {
      builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.token());
    }
    this.restClient = builder.build();
    this.path = properties.path();
  }

  HttpGroupMessageProvider(RestClient restClient, String path) {
    this.restClient = restClient;
    this.path = path;
  }

  @Override
  public String providerId() {
    return "http-gateway";
  }

  @Override
  public SendResult send(String groupHandle, String text) {
    try {
      var response =
          restClient
              .post()
              .uri(path)
              .contentType(MediaType.APPLICATION_JSON)
              .body(new OutgoingMessage(groupHandle, text))
              .retrieve()
              .body(MessageAccepted.class);
      String messageId = response != null ? response.id() : null;
      log.debug("Group message posted to {} with id {}", groupHandle, messageId);
      return SendResult.sent(messageId);
    } catch (RestClientResponseException e) {
      int status = e.getStatusCode().value();
      String error = "Gateway responded " + status + ": " + e.getStatusText();
      if (isPermanent(status)) {
        log.warn("Group {} rejected by gateway: {}", groupHandle, error);
        return SendResult.rejected(error);
      }
      log.warn("Group message to {} failed, will retry: {}", groupHandle, error);
      return SendResult.retryable(error);
    } catch (ResourceAccessException e) {
      log.warn("Group message gateway unreachable: {}", e.getMessage());
      return SendResult.retryable(e.getMessage());
    } catch (RestClientException e) {
      log.error("Group message to {} failed: {}", groupHandle, e.getMessage(), e);
      return SendResult.retryable(e.getMessage());
    }
  }

  static boolean isPermanent(int status) {
    return PERMANENT_STATUSES.contains(status);
  }

  record OutgoingMessage(String to, String text) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record MessageAccepted(String id) {}
}
