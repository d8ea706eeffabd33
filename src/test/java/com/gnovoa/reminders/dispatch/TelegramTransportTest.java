package com.gnovoa.reminders.dispatch;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class TelegramTransportTest {

  private final RestTemplate rest = new RestTemplate();
  private final MockRestServiceServer server = MockRestServiceServer.bindTo(rest).build();
  private final TelegramTransport transport = new TelegramTransport(rest, "https://tg.test", "123:abc");

  @Test
  void postsSendMessage() {
    server.expect(requestTo("https://tg.test/bot123:abc/sendMessage"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.chat_id").value(42))
        .andExpect(jsonPath("$.text").value("hi"))
        .andRespond(withSuccess("{\"ok\":true}", MediaType.APPLICATION_JSON));

    transport.deliver(42, "hi");

    server.verify();
  }

  @Test
  void rejectedSendBecomesDeliveryException() {
    server.expect(requestTo("https://tg.test/bot123:abc/sendMessage"))
        .andRespond(withStatus(HttpStatus.FORBIDDEN));

    assertThatThrownBy(() -> transport.deliver(42, "hi"))
        .isInstanceOf(DeliveryException.class)
        .hasMessageStartingWith("[42]");
  }
}
