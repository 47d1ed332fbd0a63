package com.dating.discovery.notification;

import com.dating.discovery.config.DiscoveryProperties;
import com.dating.discovery.utils.basic.Constant;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * POSTs match notifications to the delivery service behind a circuit breaker.
 */
@Slf4j
@Component
@ConditionalOnExpression("!'${discovery.notifications.webhook-url:}'.isEmpty()")
public class WebhookNotificationGateway implements NotificationGateway {
    private final RestTemplate restTemplate;
    private final String webhookUrl;
    private final MeterRegistry meterRegistry;

    public WebhookNotificationGateway(RestTemplateBuilder restTemplateBuilder,
                                      DiscoveryProperties properties,
                                      MeterRegistry meterRegistry) {
        DiscoveryProperties.Notifications notifications = properties.getNotifications();
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(notifications.getWebhookTimeout())
                .setReadTimeout(notifications.getWebhookTimeout())
                .build();
        this.webhookUrl = notifications.getWebhookUrl();
        this.meterRegistry = meterRegistry;
    }

    @Override
    @CircuitBreaker(name = "notificationGateway", fallbackMethod = "notifyMatchFallback")
    public void notifyMatch(String matchId, long userA, long userB) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        restTemplate.postForEntity(webhookUrl,
                new HttpEntity<>(new MatchNotificationPayload(matchId, userA, userB), headers), Void.class);
        log.debug("Delivered match notification matchId={}", matchId);
    }

    public void notifyMatchFallback(String matchId, long userA, long userB, Throwable t) {
        log.warn("Match notification not delivered for matchId={} ({}<->{}): {}", matchId, userA, userB, t.getMessage());
        meterRegistry.counter(Constant.NOTIFICATIONS_FAILED_TOTAL, "reason", "webhook").increment();
    }
}
