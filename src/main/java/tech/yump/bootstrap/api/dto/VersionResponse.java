package tech.yump.bootstrap.api.dto;

public record VersionResponse(
        String apiVersion,
        String version,
        String serviceName
) {}
