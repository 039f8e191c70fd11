package tech.yump.bootstrap.provider;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Creates a fresh {@link TokenProvider} for every operation.
 * All signals handed out are children of an application-scoped root that is cancelled on shutdown,
 * which kills any provider process still running.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TokenProviderFactory {

    private final ExecRunner execRunner;
    private final CancellationSignal rootSignal = new CancellationSignal();

    public CancellationSignal newSignal() {
        return rootSignal.child();
    }

    public TokenProvider create(CancellationSignal signal) {
        return new TokenProvider(signal, execRunner);
    }

    @PreDestroy
    public void shutdown() {
        log.debug("Cancelling outstanding token provider launches.");
        rootSignal.cancel();
    }
}
