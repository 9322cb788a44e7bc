package com.linkfolio.auth.infrastructure.messaging;

import com.linkfolio.auth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("KafkaNotificationSender Tests")
class KafkaNotificationSenderTest {

    @Mock private KafkaTemplate<String, Object> kafkaTemplate;

    private KafkaNotificationSender sender;

    @BeforeEach
    void setUp() {
        sender = new KafkaNotificationSender(kafkaTemplate, "auth.notifications",
                MutableClock.atEpochSecond(1_700_000_000L));
    }

    @Test
    @DisplayName("send() publishes the request keyed by user id")
    @SuppressWarnings("unchecked")
    void publishes() {
        // Given
        given(kafkaTemplate.send(anyString(), anyString(), any())).willReturn(new CompletableFuture<>());

        // When
        sender.send(List.of("ada@example.com"), "Verify your email address", "email-verification",
                Map.of("userId", "user-1", "verificationToken", "tok"));

        // Then
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("auth.notifications"), eq("user-1"), payload.capture());
        Map<String, Object> event = (Map<String, Object>) payload.getValue();
        assertThat(event)
                .containsEntry("template", "email-verification")
                .containsEntry("recipients", List.of("ada@example.com"))
                .containsEntry("timestamp", 1_700_000_000_000L);
    }

    @Test
    @DisplayName("A failed publish is only logged")
    void publishFailureLogged() {
        CompletableFuture<SendResult<String, Object>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("broker down"));
        given(kafkaTemplate.send(anyString(), anyString(), any())).willReturn(failed);

        assertDoesNotThrow(() -> sender.send(List.of("ada@example.com"), "s", "password-changed", Map.of()));
    }
}
