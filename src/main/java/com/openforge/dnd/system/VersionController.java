package com.openforge.dnd.system;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /v1/version: server name and version, no authentication.
 */
@RestController
public class VersionController {

    public record VersionResponse(String name, String version) {}

    private final VersionResponse version;

    public VersionController(
            @Value("${spring.application.name}") String name,
            @Value("${dnd.version}") String version) {
        this.version = new VersionResponse(name, version);
    }

    @GetMapping("/v1/version")
    public VersionResponse version() {
        return version;
    }
}
