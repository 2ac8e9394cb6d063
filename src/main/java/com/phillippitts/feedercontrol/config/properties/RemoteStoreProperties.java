package com.phillippitts.feedercontrol.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the key-value remote store (a Firebase Realtime Database style
 * REST endpoint). Binds to properties prefixed with "remote-store".
 *
 * <p>Example application.properties:
 * <pre>
 * remote-store.base-url=https://feeder-default-rtdb.firebaseio.com
 * remote-store.auth-token=${FEEDER_DB_TOKEN:}
 * remote-store.timeout=5s
 * </pre>
 *
 * @param baseUrl database root URL; blank keeps all data in memory
 * @param authToken optional token appended as the {@code auth} query parameter
 * @param timeout connect and read timeout for each request
 */
@ConfigurationProperties(prefix = "remote-store")
@Validated
public record RemoteStoreProperties(
        String baseUrl,
        String authToken,
        @NotNull Duration timeout
) {
    public RemoteStoreProperties {
        if (baseUrl == null) {
            baseUrl = "";
        }
        if (authToken == null) {
            authToken = "";
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(5);
        }
    }

    public boolean isRemote() {
        return !baseUrl.isBlank();
    }
}
