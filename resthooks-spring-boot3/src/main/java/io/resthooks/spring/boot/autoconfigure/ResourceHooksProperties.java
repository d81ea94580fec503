package io.resthooks.spring.boot.autoconfigure;

import io.resthooks.core.ResourceHooksConfiguration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Resource hook properties bound from {@code resthooks.*}.
 */
@Data
@ConfigurationProperties("resthooks")
public class ResourceHooksProperties {
    private boolean enabled = true;
    private boolean loadDatabaseValues = false;

    /**
     * Resource types registered in addition to the types of the resource definition beans.
     */
    private List<Class<?>> resources = new ArrayList<>();

    /**
     * Creates the immutable hook configuration from these bound properties.
     *
     * @return resource hooks configuration
     */
    public ResourceHooksConfiguration toConfiguration() {
        return ResourceHooksConfiguration.builder()
                .enableResourceHooks(enabled)
                .loadDatabaseValues(loadDatabaseValues)
                .build();
    }
}
