package com.linkfolio.auth.domain.model;

import lombok.Value;

@Value
public class ClientInfo {
    String userAgent;
    String ip;

    public static ClientInfo unknown() {
        return new ClientInfo("unknown", "unknown");
    }
}
