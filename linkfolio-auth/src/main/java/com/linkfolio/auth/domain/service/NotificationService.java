package com.linkfolio.auth.domain.service;

import com.linkfolio.auth.domain.model.EventType;
import com.linkfolio.auth.domain.port.NotificationSender;
import com.linkfolio.auth.infrastructure.entity.UserEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Best-effort notifications for the auth flows.
 * A failing sender never fails the calling operation.
 */
@Service
@Slf4j
public class NotificationService {

    private final NotificationSender sender;

    public NotificationService(NotificationSender sender) {
        this.sender = sender;
    }

    public void sendEmailVerification(UserEntity user, String verificationToken) {
        Map<String, Object> data = baseData(user);
        data.put("verificationToken", verificationToken);
        dispatch(user, "Verify your email address", EventType.EMAIL_VERIFICATION, data);
    }

    public void sendPasswordReset(UserEntity user, String resetToken, Instant expiresAt) {
        Map<String, Object> data = baseData(user);
        data.put("resetToken", resetToken);
        data.put("expiresAt", expiresAt.toString());
        dispatch(user, "Reset your password", EventType.PASSWORD_RESET, data);
    }

    public void sendPasswordChanged(UserEntity user) {
        dispatch(user, "Your password was changed", EventType.PASSWORD_CHANGED, baseData(user));
    }

    public void sendAccountLocked(UserEntity user, Instant lockedUntil) {
        Map<String, Object> data = baseData(user);
        data.put("lockedUntil", lockedUntil.toString());
        dispatch(user, "Your account has been locked", EventType.ACCOUNT_LOCKED, data);
    }

    private Map<String, Object> baseData(UserEntity user) {
        Map<String, Object> data = new HashMap<>();
        data.put("userId", user.getId().toString());
        data.put("username", user.getUsername());
        data.put("firstName", user.getFirstName());
        return data;
    }

    private void dispatch(UserEntity user, String subject, EventType template, Map<String, Object> data) {
        try {
            sender.send(List.of(user.getEmail()), subject, template.toString(), data);
        } catch (RuntimeException e) {
            // Continue - the caller's operation already succeeded
            log.error("[NOTIFICATION_FAILED] Failed to send notification | template={} | userId={} | error={}",
                    template, user.getId(), e.getMessage(), e);
        }
    }
}
