package com.sandy.aiot.vision.sentinel.notify.impl;

import com.sandy.aiot.vision.sentinel.notify.DeliveryResult;
import com.sandy.aiot.vision.sentinel.notify.NotificationChannel;
import com.sandy.aiot.vision.sentinel.notify.NotificationDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Sends alert mails through Spring's {@link JavaMailSender} (when {@code spring.mail.host} is set)
 * and webhooks as JSON POSTs through a timeout-bound {@link RestTemplate}.
 */
@Service
@Slf4j
public class MailWebhookNotificationDispatcher implements NotificationDispatcher {

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final RestTemplate restTemplate;

    @Value("${monitor.notify.mail-from:}")
    private String mailFrom;

    public MailWebhookNotificationDispatcher(ObjectProvider<JavaMailSender> mailSenderProvider,
                                             @Qualifier("webhookRestTemplate") RestTemplate restTemplate) {
        this.mailSenderProvider = mailSenderProvider;
        this.restTemplate = restTemplate;
    }

    @Override
    public DeliveryResult sendEmail(List<String> addresses, String subject, String body) {
        String to = String.join(", ", addresses);
        JavaMailSender sender = mailSenderProvider.getIfAvailable();
        if (sender == null) {
            log.warn("Mail not configured, skipping email notification to={}", to);
            return DeliveryResult.failure(NotificationChannel.EMAIL, to, "mail not configured");
        }
        try {
            SimpleMailMessage msg = new SimpleMailMessage();
            if (mailFrom != null && !mailFrom.isBlank()) msg.setFrom(mailFrom);
            msg.setTo(addresses.toArray(new String[0]));
            msg.setSubject(subject);
            msg.setText(body);
            sender.send(msg);
            log.info("Email notification sent to={} subject={}", to, subject);
            return DeliveryResult.ok(NotificationChannel.EMAIL, to);
        } catch (MailException e) {
            log.warn("Failed to send email notification to={} error={}", to, e.getMessage());
            return DeliveryResult.failure(NotificationChannel.EMAIL, to, e.getMessage());
        }
    }

    @Override
    public DeliveryResult sendWebhook(String url, String jsonPayload) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            ResponseEntity<String> resp = restTemplate.postForEntity(url, new HttpEntity<>(jsonPayload, headers), String.class);
            if (!resp.getStatusCode().is2xxSuccessful()) {
                log.warn("Webhook returned non-2xx url={} status={}", url, resp.getStatusCode());
                return DeliveryResult.failure(NotificationChannel.WEBHOOK, url, "status " + resp.getStatusCode().value());
            }
            log.info("Webhook notification sent url={} status={}", url, resp.getStatusCode());
            return DeliveryResult.ok(NotificationChannel.WEBHOOK, url);
        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("Failed to send webhook notification url={} error={}", url, e.getMessage());
            return DeliveryResult.failure(NotificationChannel.WEBHOOK, url, e.getMessage());
        }
    }
}
