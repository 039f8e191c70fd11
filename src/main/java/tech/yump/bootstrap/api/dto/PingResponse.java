package tech.yump.bootstrap.api.dto;

public record PingResponse(
        String apiVersion,
        String timestamp,
        String serviceName
) {}
