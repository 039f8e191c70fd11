package tech.yump.bootstrap.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import tech.yump.bootstrap.api.dto.PingResponse;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CommonControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("GET /api/v3/ping is open and names the service")
    void ping() throws Exception {
        mockMvc.perform(get("/api/v3/ping"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.apiVersion").value("v3"))
                .andExpect(jsonPath("$.serviceName").value("secret-bootstrap"))
                .andExpect(jsonPath("$.timestamp").isNotEmpty());
    }

    @Test
    @DisplayName("GET /api/v3/version returns the configured version")
    void version() throws Exception {
        mockMvc.perform(get("/api/v3/version"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.apiVersion").value("v3"))
                .andExpect(jsonPath("$.version").value("9.9.9-test"))
                .andExpect(jsonPath("$.serviceName").value("secret-bootstrap"));
    }

    @Test
    @DisplayName("ping timestamp is RFC 1123 formatted")
    void ping_timestampFormat() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);
        CommonController controller = new CommonController("core-data", "3.1.0", clock);

        PingResponse response = controller.ping();

        assertThat(response.timestamp()).isEqualTo("Wed, 1 May 2024 10:15:30 GMT");
        assertThat(response.serviceName()).isEqualTo("core-data");
    }
}
