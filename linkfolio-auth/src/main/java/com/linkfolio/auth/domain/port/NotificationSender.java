package com.linkfolio.auth.domain.port;

import java.util.List;
import java.util.Map;

/**
 * Outbound notifications (email). Rendering and delivery happen elsewhere.
 */
public interface NotificationSender {

    void send(List<String> recipients, String subject, String templateName, Map<String, Object> data);
}
