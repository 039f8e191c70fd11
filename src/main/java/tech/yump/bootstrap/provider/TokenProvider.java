package tech.yump.bootstrap.provider;

import lombok.extern.slf4j.Slf4j;
import tech.yump.bootstrap.config.SecretStoreInfo;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives the external one-shot token provider executable.
 *
 * <p>A provider starts {@link State#UNINITIALIZED}; only a successful {@link #setConfiguration(SecretStoreInfo)}
 * moves it to {@link State#CONFIGURED}, and it never goes back. Launches are synchronous and leave the
 * state untouched. Instances are not thread-safe and must not be shared: create one per operation.
 */
@Slf4j
public class TokenProvider {

    public static final String ONESHOT_PROVIDER_TYPE = "oneshot";

    // Arguments preceding the entity id when regenerating a single identity's token.
    static final List<String> REGEN_TOKEN_ARGS = List.of(
            "-configDir", "res-file-token-provider", "createToken", "-entityId");

    public enum State {
        UNINITIALIZED,
        CONFIGURED
    }

    private final CancellationSignal cancellationSignal;
    private final ExecRunner execRunner;

    private State state = State.UNINITIALIZED;
    private Path resolvedPath;
    private SecretStoreInfo secretStoreInfo;

    public TokenProvider(CancellationSignal cancellationSignal, ExecRunner execRunner) {
        this.cancellationSignal = cancellationSignal;
        this.execRunner = execRunner;
    }

    /**
     * Validates the provider type and resolves the provider executable.
     *
     * @throws TokenProviderConfigurationException If the type is not {@value #ONESHOT_PROVIDER_TYPE} or the
     *                                             executable is not on PATH. The state is left unchanged.
     */
    public void setConfiguration(SecretStoreInfo secretStoreInfo) throws TokenProviderConfigurationException {
        String providerType = secretStoreInfo.tokenProviderType();
        if (!ONESHOT_PROVIDER_TYPE.equals(providerType)) {
            throw new TokenProviderConfigurationException(providerType + " is not a supported TokenProviderType");
        }

        String providerName = secretStoreInfo.tokenProvider();
        Path executable;
        try {
            executable = execRunner.lookPath(providerName);
        } catch (ExecutableNotFoundException e) {
            throw new TokenProviderConfigurationException(
                    "failed to locate " + providerName + " on PATH: " + e.getMessage(), e);
        }

        this.resolvedPath = executable;
        this.secretStoreInfo = secretStoreInfo;
        this.state = State.CONFIGURED;
        log.debug("Token provider configured: {} -> {}", providerName, executable);
    }

    /**
     * Runs the provider with its configured arguments, for the provider's own start-up bootstrap.
     */
    public void launch() throws TokenProviderException {
        requireConfigured();
        log.info("Launching token provider {} with arguments {}", resolvedPath, secretStoreInfo.tokenProviderArgs());
        run(secretStoreInfo.tokenProviderArgs());
        log.info("token provider {} completed", resolvedPath);
    }

    /**
     * Runs the provider to create a fresh token for a single entity.
     *
     * @param entityId Identity whose token is regenerated.
     */
    public void launchRegenToken(String entityId) throws TokenProviderException {
        requireConfigured();
        List<String> args = new ArrayList<>(REGEN_TOKEN_ARGS);
        args.add(entityId);

        log.info("Launching token provider {} to regenerate the token of entity id '{}'", resolvedPath, entityId);
        run(args);
        log.info("token provider {} regenerated the token of entity id '{}'", resolvedPath, entityId);
    }

    public State getState() {
        return state;
    }

    private void requireConfigured() {
        if (state != State.CONFIGURED) {
            throw new TokenProviderNotInitializedException();
        }
    }

    private void run(List<String> args) {
        ProcessCommand command = execRunner.commandContext(cancellationSignal, resolvedPath, List.copyOf(args));

        try {
            command.start();
        } catch (IOException e) {
            throw new TokenProviderLaunchException(resolvedPath + " failed to launch: " + e.getMessage(), e);
        }

        ProcessOutcome outcome = command.await();
        switch (outcome.status()) {
            case EXITED -> {
                if (outcome.exitCode() != 0) {
                    throw new TokenProviderExitException(resolvedPath.toString(), outcome.exitCode());
                }
            }
            case FAILED -> throw new TokenProviderException(
                    resolvedPath + " failed with unexpected error: " + describe(outcome.error()), outcome.error());
        }
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.toString();
    }
}
