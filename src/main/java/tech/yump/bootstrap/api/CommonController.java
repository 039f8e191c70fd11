package tech.yump.bootstrap.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.bootstrap.api.dto.BaseResponse;
import tech.yump.bootstrap.api.dto.PingResponse;
import tech.yump.bootstrap.api.dto.VersionResponse;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

@RestController
@RequestMapping("/api/" + BaseResponse.API_VERSION)
@Tag(name = "System", description = "Common service routes")
public class CommonController {

  private final String serviceName;
  private final String version;
  private final Clock clock;

  @Autowired
  public CommonController(
          @Value("${spring.application.name:secret-bootstrap}") String serviceName,
          @Value("${bootstrap.version:0.1.0-SNAPSHOT}") String version) {
    this(serviceName, version, Clock.systemDefaultZone());
  }

  CommonController(String serviceName, String version, Clock clock) {
    this.serviceName = serviceName;
    this.version = version;
    this.clock = clock;
  }

  @GetMapping("/ping")
  @Operation(summary = "Ping", description = "Liveness check. Does not require authentication.", security = {})
  @ApiResponse(responseCode = "200", description = "Service is up.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = PingResponse.class)))
  public PingResponse ping() {
    String timestamp = ZonedDateTime.now(clock).format(DateTimeFormatter.RFC_1123_DATE_TIME);
    return new PingResponse(BaseResponse.API_VERSION, timestamp, serviceName);
  }

  @GetMapping("/version")
  @Operation(summary = "Version", description = "Returns the service version. Does not require authentication.", security = {})
  @ApiResponse(responseCode = "200", description = "Service version.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = VersionResponse.class)))
  public VersionResponse version() {
    return new VersionResponse(BaseResponse.API_VERSION, version, serviceName);
  }
}
