package com.linkfolio.auth.support;

import com.linkfolio.auth.domain.port.NotificationSender;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class RecordingNotificationSender implements NotificationSender {

    private final List<Sent> sent = new ArrayList<>();
    private boolean failing;

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public List<Sent> getSent() {
        return sent;
    }

    public List<Sent> withTemplate(String templateName) {
        List<Sent> matches = new ArrayList<>();
        for (Sent s : sent) {
            if (s.templateName.equals(templateName)) {
                matches.add(s);
            }
        }
        return matches;
    }

    @Override
    public void send(List<String> recipients, String subject, String templateName, Map<String, Object> data) {
        if (failing) {
            throw new IllegalStateException("broker unavailable");
        }
        sent.add(new Sent(recipients, subject, templateName, data));
    }

    public static class Sent {
        public final List<String> recipients;
        public final String subject;
        public final String templateName;
        public final Map<String, Object> data;

        Sent(List<String> recipients, String subject, String templateName, Map<String, Object> data) {
            this.recipients = recipients;
            this.subject = subject;
            this.templateName = templateName;
            this.data = data;
        }
    }
}
