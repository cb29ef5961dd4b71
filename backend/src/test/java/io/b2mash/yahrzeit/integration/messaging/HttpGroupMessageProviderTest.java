package io.b2mash.yahrzeit.integration.messaging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class HttpGroupMessageProviderTest {

  private MockRestServiceServer server;
  private HttpGroupMessageProvider provider;

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder().baseUrl("https://gateway.example.com");
    server = MockRestServiceServer.bindTo(builder).build();
    provider = new HttpGroupMessageProvider(builder.build(), "/v1/messages");
  }

  @Test
  void send_postsMessageAndReturnsGatewayId() {
    server
        .expect(requestTo("https://gateway.example.com/v1/messages"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(content().json("{\"to\":\"family-group\",\"text\":\"hello\"}"))
        .andRespond(withSuccess("{\"id\":\"m-42\",\"queued\":true}", MediaType.APPLICATION_JSON));

    var result = provider.send("family-group", "hello");

    assertThat(result.success()).isTrue();
    assertThat(result.providerMessageId()).isEqualTo("m-42");
    server.verify();
  }

  @Test
  void send_goneGroupIsPermanent() {
    server
        .expect(requestTo("https://gateway.example.com/v1/messages"))
        .andRespond(withStatus(HttpStatus.GONE));

    var result = provider.send("old-group", "hello");

    assertThat(result.success()).isFalse();
    assertThat(result.permanent()).isTrue();
    assertThat(result.errorMessage()).startsWith("Gateway responded 410");
  }

  @Test
  void send_serverErrorIsRetryable() {
    server
        .expect(requestTo("https://gateway.example.com/v1/messages"))
        .andRespond(withServerError());

    var result = provider.send("family-group", "hello");

    assertThat(result.success()).isFalse();
    assertThat(result.permanent()).isFalse();
  }

  @Test
  void send_throttledIsRetryable() {
    server
        .expect(requestTo("https://gateway.example.com/v1/messages"))
        .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

    var result = provider.send("family-group", "hello");

    assertThat(result.permanent()).isFalse();
  }

  @Test
  void isPermanent_onlyForUnreachableGroupStatuses() {
    assertThat(HttpGroupMessageProvider.isPermanent(400)).isTrue();
    assertThat(HttpGroupMessageProvider.isPermanent(403)).isTrue();
    assertThat(HttpGroupMessageProvider.isPermanent(404)).isTrue();
    assertThat(HttpGroupMessageProvider.isPermanent(410)).isTrue();
    assertThat(HttpGroupMessageProvider.isPermanent(401)).isFalse();
    assertThat(HttpGroupMessageProvider.isPermanent(408)).isFalse();
    assertThat(HttpGroupMessageProvider.isPermanent(429)).isFalse();
    assertThat(HttpGroupMessageProvider.isPermanent(503)).isFalse();
  }
}
