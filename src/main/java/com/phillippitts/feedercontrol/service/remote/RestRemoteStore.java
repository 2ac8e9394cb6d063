package com.phillippitts.feedercontrol.service.remote;

import com.phillippitts.feedercontrol.exception.ConfigUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RemoteStore} over a Realtime-Database style REST API: {@code GET/PUT/POST
 * <base>/<path>.json}. A POST answers {@code {"name": "<generated key>"}}.
 *
 * <p>Any transport or HTTP error surfaces as {@link ConfigUnavailableException}.
 */
public class RestRemoteStore implements RemoteStore {

    private static final Logger LOG = LogManager.getLogger(RestRemoteStore.class);

    private final RestClient client;
    private final String authToken;

    public RestRemoteStore(RestClient client, String authToken) {
        this.client = Objects.requireNonNull(client, "client");
        this.authToken = authToken == null ? "" : authToken;
    }

    @Override
    public Optional<Object> get(String path) {
        try {
            Object body = client.get()
                    .uri(b -> uri(b, path))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(Object.class);
            return Optional.ofNullable(body);
        } catch (RestClientException e) {
            throw new ConfigUnavailableException(path, e);
        }
    }

    @Override
    public void set(String path, Object value) {
        try {
            if (value == null) {
                client.delete().uri(b -> uri(b, path)).retrieve().toBodilessEntity();
                return;
            }
            client.put()
                    .uri(b -> uri(b, path))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(value)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException e) {
            throw new ConfigUnavailableException(path, e);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public String push(String path, Map<String, Object> value) {
        try {
            Map<String, Object> reply = client.post()
                    .uri(b -> uri(b, path))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(value)
                    .retrieve()
                    .body(Map.class);
            Object name = reply == null ? null : reply.get("name");
            if (name == null) {
                throw new ConfigUnavailableException(path, "push returned no key");
            }
            LOG.debug("Pushed child {} under {}", name, path);
            return name.toString();
        } catch (RestClientException e) {
            throw new ConfigUnavailableException(path, e);
        }
    }

    private URI uri(UriBuilder builder, String path) {
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        UriBuilder b = builder.path("/" + trimmed + ".json");
        if (!authToken.isBlank()) {
            b = b.queryParam("auth", authToken);
        }
        return b.build();
    }
}
