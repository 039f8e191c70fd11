package tech.yump.bootstrap.provider;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.bootstrap.config.SecretStoreInfo;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenProviderTest {

    private static final Path PROVIDER_PATH = Path.of("/usr/local/bin/security-file-token-provider");

    private ScriptedExecRunner execRunner;
    private TokenProvider tokenProvider;

    @BeforeEach
    void setUp() {
        execRunner = new ScriptedExecRunner().withExecutable("security-file-token-provider", PROVIDER_PATH);
        tokenProvider = new TokenProvider(new CancellationSignal(), execRunner);
    }

    private static SecretStoreInfo providerInfo(String type, String provider, List<String> args) {
        return new SecretStoreInfo("localhost", 8200, "/v1", "https", null, null, null, provider, type, args);
    }

    @Test
    @DisplayName("setConfiguration: oneshot type with a resolvable executable configures the provider")
    void setConfiguration_oneshot() {
        tokenProvider.setConfiguration(providerInfo("oneshot", "security-file-token-provider", List.of()));

        assertThat(tokenProvider.getState()).isEqualTo(TokenProvider.State.CONFIGURED);
    }

    @Test
    @DisplayName("setConfiguration: other provider types are rejected and the state is unchanged")
    void setConfiguration_unsupportedType() {
        assertThatThrownBy(() -> tokenProvider.setConfiguration(
                providerInfo("vault-provider", "security-file-token-provider", List.of())))
                .isInstanceOf(TokenProviderConfigurationException.class)
                .hasMessage("vault-provider is not a supported TokenProviderType");

        assertThat(tokenProvider.getState()).isEqualTo(TokenProvider.State.UNINITIALIZED);
    }

    @Test
    @DisplayName("setConfiguration: executable missing from PATH is a configuration error")
    void setConfiguration_executableNotFound() {
        assertThatThrownBy(() -> tokenProvider.setConfiguration(providerInfo("oneshot", "no-such-provider", List.of())))
                .isInstanceOf(TokenProviderConfigurationException.class)
                .hasMessageStartingWith("failed to locate no-such-provider on PATH")
                .hasCauseInstanceOf(ExecutableNotFoundException.class);

        assertThat(tokenProvider.getState()).isEqualTo(TokenProvider.State.UNINITIALIZED);
    }

    @Test
    @DisplayName("launch: refused before configuration, and nothing is spawned")
    void launch_uninitialized() {
        assertThatThrownBy(() -> tokenProvider.launch())
                .isInstanceOf(TokenProviderNotInitializedException.class)
                .hasMessage("TokenProvider object not initialized; call SetConfiguration() first");
        assertThatThrownBy(() -> tokenProvider.launchRegenToken("abc-123"))
                .isInstanceOf(TokenProviderNotInitializedException.class);

        assertThat(execRunner.launches()).isEmpty();
    }

    @Test
    @DisplayName("launch: runs the resolved executable with the configured arguments")
    void launch_usesConfiguredArgs() {
        tokenProvider.setConfiguration(providerInfo("oneshot", "security-file-token-provider",
                List.of("-confdir", "res-file-token-provider")));

        tokenProvider.launch();

        assertThat(execRunner.launches()).containsExactly(
                new ScriptedExecRunner.Launch(PROVIDER_PATH, List.of("-confdir", "res-file-token-provider")));
        assertThat(tokenProvider.getState()).isEqualTo(TokenProvider.State.CONFIGURED);
    }

    @Test
    @DisplayName("launchRegenToken: creates a token for exactly the given entity id")
    void launchRegenToken_args() {
        tokenProvider.setConfiguration(providerInfo("oneshot", "security-file-token-provider", List.of("ignored")));

        tokenProvider.launchRegenToken("abc-123");

        assertThat(execRunner.launches()).hasSize(1);
        List<String> args = execRunner.launches().get(0).args();
        assertThat(args).containsExactly("-configDir", "res-file-token-provider", "createToken", "-entityId", "abc-123");
        assertThat(args.indexOf("-entityId") + 1).isEqualTo(args.indexOf("abc-123"));
        assertThat(args).containsOnlyOnce("createToken");
    }

    @Test
    @DisplayName("launch: non-zero exit code is reported with the code")
    void launch_nonZeroExit() {
        execRunner.endingWith(ProcessOutcome.exited(7));
        tokenProvider.setConfiguration(providerInfo("oneshot", "security-file-token-provider", List.of()));

        assertThatThrownBy(() -> tokenProvider.launchRegenToken("abc-123"))
                .isInstanceOfSatisfying(TokenProviderExitException.class, e -> assertThat(e.exitCode()).isEqualTo(7))
                .hasMessage(PROVIDER_PATH + " terminated with non-zero exit code 7");
    }

    @Test
    @DisplayName("launch: start-up launch reports a non-zero exit code too")
    void launch_startupNonZeroExit() {
        execRunner.endingWith(ProcessOutcome.exited(7));
        tokenProvider.setConfiguration(providerInfo("oneshot", "security-file-token-provider",
                List.of("-confdir", "res-file-token-provider")));

        assertThatThrownBy(() -> tokenProvider.launch())
                .isInstanceOfSatisfying(TokenProviderExitException.class, e -> assertThat(e.exitCode()).isEqualTo(7))
                .hasMessageContaining("7")
                .hasMessage(PROVIDER_PATH + " terminated with non-zero exit code 7");
        assertThat(execRunner.launches()).hasSize(1);
    }

    @Test
    @DisplayName("launch: spawn failure is a launch error")
    void launch_spawnFailure() {
        execRunner.failingStart(new IOException("error=13, Permission denied"));
        tokenProvider.setConfiguration(providerInfo("oneshot", "security-file-token-provider", List.of()));

        assertThatThrownBy(() -> tokenProvider.launch())
                .isInstanceOf(TokenProviderLaunchException.class)
                .hasMessage(PROVIDER_PATH + " failed to launch: error=13, Permission denied");
    }

    @Test
    @DisplayName("launch: a failed wait is an unexpected error")
    void launch_unexpectedError() {
        execRunner.endingWith(ProcessOutcome.failed(new CancellationException("process killed after cancellation")));
        tokenProvider.setConfiguration(providerInfo("oneshot", "security-file-token-provider", List.of()));

        assertThatThrownBy(() -> tokenProvider.launch())
                .isExactlyInstanceOf(TokenProviderException.class)
                .hasMessage(PROVIDER_PATH + " failed with unexpected error: process killed after cancellation");
    }

    @Test
    @DisplayName("launch: a configured provider can be launched repeatedly")
    void launch_repeatable() {
        tokenProvider.setConfiguration(providerInfo("oneshot", "security-file-token-provider", List.of()));

        tokenProvider.launchRegenToken("a");
        tokenProvider.launchRegenToken("b");

        assertThat(execRunner.launches()).hasSize(2);
    }
}
