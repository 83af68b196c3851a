package com.openforge.dnd.bootstrap;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

/**
 * dnd:
 *   bootstrap:
 *     descriptor-path: ./config/root.toml
 *     delete-descriptor-after-use: false
 */
@ConfigurationProperties(prefix = "dnd.bootstrap")
public record BootstrapProperties(
        @DefaultValue("./config/root.toml") Path    descriptorPath,
        @DefaultValue("false")              boolean deleteDescriptorAfterUse
) {}
