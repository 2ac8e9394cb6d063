package com.phillippitts.feedercontrol.service.remote;

import com.phillippitts.feedercontrol.config.properties.RemoteStoreProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Chooses the {@link RemoteStore} implementation: REST when {@code remote-store.base-url} is set,
 * otherwise an in-memory store so the controller keeps working fully offline.
 */
@Configuration
public class RemoteStoreConfig {

    private static final Logger LOG = LogManager.getLogger(RemoteStoreConfig.class);

    @Bean
    public RemoteStore remoteStore(RemoteStoreProperties props, RestClient.Builder builder) {
        if (!props.isRemote()) {
            LOG.warn("remote-store.base-url not set; using in-memory remote store");
            return new InMemoryRemoteStore();
        }
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) props.timeout().toMillis());
        factory.setReadTimeout((int) props.timeout().toMillis());
        RestClient client = builder
                .baseUrl(props.baseUrl())
                .requestFactory(factory)
                .build();
        LOG.info("Remote store at {}", props.baseUrl());
        return new RestRemoteStore(client, props.authToken());
    }
}
