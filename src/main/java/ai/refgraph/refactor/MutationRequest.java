package ai.refgraph.refactor;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * A pending mutation awaiting a human decision. Each request owns its own one-shot decision, so any number of
 * requests can be pending at once without one answer reaching the wrong request.
 *
 * <p>Typical use: compute a dry-run preview, hand the request to whoever decides, then call {@link #execute} from the
 * thread that performs the write.
 *
 * @param <P> the dry-run preview shown to the decider
 */
public final class MutationRequest<P> {
    private static final Logger logger = LogManager.getLogger(MutationRequest.class);

    public enum Decision {
        APPROVED,
        REJECTED
    }

    private final String description;
    private final P preview;
    private final CompletableFuture<Decision> decision = new CompletableFuture<>();
    private volatile @Nullable String rejectionReason;

    public MutationRequest(String description, P preview) {
        this.description = description;
        this.preview = preview;
    }

    public String description() {
        return description;
    }

    public P preview() {
        return preview;
    }

    /** @return false if a decision had already been made */
    public synchronized boolean approve() {
        return decision.complete(Decision.APPROVED);
    }

    /** @return false if a decision had already been made */
    public synchronized boolean reject(String reason) {
        if (decision.isDone()) {
            return false;
        }
        rejectionReason = reason;
        return decision.complete(Decision.REJECTED);
    }

    public boolean isDecided() {
        return decision.isDone();
    }

    public Optional<String> rejectionReason() {
        return Optional.ofNullable(rejectionReason);
    }

    /**
     * Blocks until decided. A request nobody answers within {@code timeout} counts as rejected and stays rejected.
     */
    public Decision awaitDecision(Duration timeout) throws InterruptedException {
        try {
            return decision.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            reject("No decision within " + timeout);
            return decision.getNow(Decision.REJECTED);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Decision future cannot fail", e);
        }
    }

    /**
     * Runs {@code applier} only if the request is approved within {@code timeout}.
     *
     * @return the applier's result, or empty when rejected
     */
    public <R> Optional<R> execute(Duration timeout, Supplier<R> applier) throws InterruptedException {
        if (awaitDecision(timeout) != Decision.APPROVED) {
            logger.info("Mutation rejected: {} ({})", description, rejectionReason().orElse("no reason given"));
            return Optional.empty();
        }
        logger.debug("Mutation approved: {}", description);
        return Optional.of(applier.get());
    }
}
