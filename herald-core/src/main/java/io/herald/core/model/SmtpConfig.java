package io.herald.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SmtpConfig(
    String host,
    int port,
    String username,
    String password,
    String from,
    String fromName,
    boolean useTls
) {

    public boolean configured() {
        return host != null && !host.isBlank() && from != null && !from.isBlank();
    }
}
