package tech.yump.bootstrap.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.security.test.context.support.WithAnonymousUser;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import tech.yump.bootstrap.audit.AuditBackend;
import tech.yump.bootstrap.audit.AuditEvent;
import tech.yump.bootstrap.audit.AuditHelper;
import tech.yump.bootstrap.config.SecretStoreInfo;
import tech.yump.bootstrap.provider.CancellationSignal;
import tech.yump.bootstrap.provider.TokenProvider;
import tech.yump.bootstrap.provider.TokenProviderConfigurationException;
import tech.yump.bootstrap.provider.TokenProviderExitException;
import tech.yump.bootstrap.provider.TokenProviderFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test") // Load application-test.yml
class TokenControllerTest {

    private static final String REGEN_URL = "/api/v3/token/entityId/{entityId}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TokenProviderFactory tokenProviderFactory;

    @MockBean
    private AuditBackend auditBackend;

    private TokenProvider tokenProvider;

    @BeforeEach
    void setUp() {
        tokenProvider = mock(TokenProvider.class);
        when(tokenProviderFactory.newSignal()).thenReturn(new CancellationSignal());
        when(tokenProviderFactory.create(any(CancellationSignal.class))).thenReturn(tokenProvider);
    }

    @Test
    @DisplayName("PUT regenerates the token through a freshly configured provider")
    void regenToken_success() throws Exception {
        mockMvc.perform(put(REGEN_URL, "abc-123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.apiVersion").value("v3"))
                .andExpect(jsonPath("$.requestId").value(""))
                .andExpect(jsonPath("$.message").value(""))
                .andExpect(jsonPath("$.statusCode").value(200));

        InOrder order = inOrder(tokenProvider);
        order.verify(tokenProvider).setConfiguration(any(SecretStoreInfo.class));
        order.verify(tokenProvider).launchRegenToken("abc-123");

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditBackend).logEvent(captor.capture());
        assertThat(captor.getValue().type()).isEqualTo("token_operation");
        assertThat(captor.getValue().action()).isEqualTo("regenerate_token");
        assertThat(captor.getValue().outcome()).isEqualTo("success");
        assertThat(captor.getValue().data()).containsEntry("entity_id", "abc-123");
    }

    @Test
    @DisplayName("The request id stays empty even when the caller sends a correlation id")
    void regenToken_requestIdAlwaysEmpty() throws Exception {
        mockMvc.perform(put(REGEN_URL, "abc-123").header(AuditHelper.CORRELATION_ID_HEADER, "corr-42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requestId").value(""))
                .andExpect(jsonPath("$.statusCode").value(200));
    }

    @Test
    @DisplayName("Anonymous callers may regenerate tokens and are audited as anonymous")
    @WithAnonymousUser
    void regenToken_anonymousCaller() throws Exception {
        mockMvc.perform(put(REGEN_URL, "abc-123"))
                .andExpect(status().isOk());

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditBackend).logEvent(captor.capture());
        assertThat(captor.getValue().authInfo().principal()).isEqualTo("anonymous");
    }

    @Test
    @DisplayName("Authenticated callers get the same result and are audited by name")
    void regenToken_authenticatedCaller() throws Exception {
        mockMvc.perform(put(REGEN_URL, "abc-123").with(user("gateway")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.statusCode").value(200));

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditBackend).logEvent(captor.capture());
        assertThat(captor.getValue().authInfo().principal()).isEqualTo("gateway");
    }

    @Test
    @DisplayName("Provider exit failure is returned as a 500 envelope carrying the message")
    void regenToken_providerFails() throws Exception {
        doThrow(new TokenProviderExitException("/usr/local/bin/security-file-token-provider", 7))
                .when(tokenProvider).launchRegenToken("abc-123");

        mockMvc.perform(put(REGEN_URL, "abc-123").header(AuditHelper.CORRELATION_ID_HEADER, "corr-42"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.apiVersion").value("v3"))
                .andExpect(jsonPath("$.requestId").value(""))
                .andExpect(jsonPath("$.statusCode").value(500))
                .andExpect(jsonPath("$.message").value(
                        "/usr/local/bin/security-file-token-provider terminated with non-zero exit code 7"));

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditBackend).logEvent(captor.capture());
        assertThat(captor.getValue().outcome()).isEqualTo("failure");
        assertThat(captor.getValue().responseInfo().statusCode()).isEqualTo(500);
    }

    @Test
    @DisplayName("Configuration failure is returned as a 500 and nothing is launched")
    void regenToken_configurationFails() throws Exception {
        doThrow(new TokenProviderConfigurationException("vault-provider is not a supported TokenProviderType"))
                .when(tokenProvider).setConfiguration(any(SecretStoreInfo.class));

        mockMvc.perform(put(REGEN_URL, "abc-123"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("vault-provider is not a supported TokenProviderType"));

        verify(tokenProvider, never()).launchRegenToken(any());
    }

    @Test
    @DisplayName("Routes outside the service API are denied")
    void otherRoutes_denied() throws Exception {
        mockMvc.perform(get("/api/v3/config"))
                .andExpect(status().isForbidden());
    }
}
