package com.sandy.aiot.vision.sentinel.notify.impl;

import com.sandy.aiot.vision.sentinel.notify.DeliveryResult;
import com.sandy.aiot.vision.sentinel.notify.NotificationChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class MailWebhookNotificationDispatcherTest {

    private MockRestServiceServer server;
    private MailWebhookNotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        dispatcher = new MailWebhookNotificationDispatcher(
                new StaticListableBeanFactory().getBeanProvider(JavaMailSender.class), restTemplate);
    }

    @Test
    void webhookPostsJsonBody() {
        server.expect(requestTo("http://hooks.local/alerts"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(content().json("{\"alert_id\":7}"))
                .andRespond(withSuccess());

        DeliveryResult result = dispatcher.sendWebhook("http://hooks.local/alerts", "{\"alert_id\":7,\"alert_name\":\"x\"}");

        assertTrue(result.success());
        assertEquals(NotificationChannel.WEBHOOK, result.channel());
        server.verify();
    }

    @Test
    void webhookServerErrorIsReportedNotThrown() {
        server.expect(requestTo("http://hooks.local/alerts")).andRespond(withServerError());

        DeliveryResult result = dispatcher.sendWebhook("http://hooks.local/alerts", "{}");

        assertFalse(result.success());
        assertEquals("http://hooks.local/alerts", result.destination());
        assertNotNull(result.reason());
    }

    @Test
    void emailWithoutMailSenderFails() {
        DeliveryResult result = dispatcher.sendEmail(List.of("a@example.com", "b@example.com"), "subject", "body");

        assertFalse(result.success());
        assertEquals(NotificationChannel.EMAIL, result.channel());
        assertEquals("mail not configured", result.reason());
    }
}
