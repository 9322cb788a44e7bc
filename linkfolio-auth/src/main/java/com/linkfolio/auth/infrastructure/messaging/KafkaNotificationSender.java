package com.linkfolio.auth.infrastructure.messaging;

import com.linkfolio.auth.domain.port.NotificationSender;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes notification requests to Kafka. A separate mailer renders and delivers them.
 * Sending is asynchronous; broker failures are only logged.
 */
@Component
@Slf4j
public class KafkaNotificationSender implements NotificationSender {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;
    private final Clock clock;

    public KafkaNotificationSender(KafkaTemplate<String, Object> kafkaTemplate,
                                   @Value("${linkfolio.auth.notifications.topic:auth.notifications}") String topic,
                                   Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
        this.clock = clock;
    }

    @Override
    public void send(List<String> recipients, String subject, String templateName, Map<String, Object> data) {
        log.info("[EVENT_PUBLISH_START] Publishing notification | template={} | topic={}", templateName, topic);

        Map<String, Object> eventData = new HashMap<>();
        eventData.put("recipients", recipients);
        eventData.put("subject", subject);
        eventData.put("template", templateName);
        eventData.put("data", data);
        eventData.put("timestamp", clock.millis());

        String key = data.containsKey("userId") ? String.valueOf(data.get("userId")) : templateName;

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, eventData);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("[EVENT_PUBLISHED] Notification published | template={} | topic={} | partition={} | offset={}",
                    templateName, topic,
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());
            } else {
                log.warn("[EVENT_PUBLISH_FAILED] Failed to publish notification | template={} | topic={} | error={}",
                    templateName, topic, ex.getMessage(), ex);
            }
        });
    }
}
