package com.gnovoa.reminders.dispatch;

import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.Map;

/** Telegram Bot API {@code sendMessage}. */
public final class TelegramTransport implements MessageTransport {

    private final RestTemplate restTemplate;
    private final URI sendMessageUri;

    public TelegramTransport(RestTemplate restTemplate, String baseUrl, String botToken) {
        this.restTemplate = restTemplate;
        this.sendMessageUri = URI.create(baseUrl + "/bot" + botToken + "/sendMessage");
    }

    @Override
    public void deliver(long destination, String text) {
        var request = RequestEntity.post(sendMessageUri)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("chat_id", destination, "text", text));
        try {
            restTemplate.exchange(request, String.class);
        } catch (RestClientException e) {
            throw new DeliveryException(destination, "sendMessage failed: " + e.getMessage(), e);
        }
    }
}
