package ae.teletronics.custody.application.util;

import ae.teletronics.custody.application.exceptions.ConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Re-subscribes a unit of work when the store rejects a freshly generated id as a
 * duplicate. The unit must generate its id on subscription (wrap it in
 * {@code Mono.defer}) and should be the whole transaction, because a failed write
 * aborts the enclosing Mongo transaction.
 */
public final class IdCollisionRetry {

    private static final Logger log = LoggerFactory.getLogger(IdCollisionRetry.class);

    public static final int MAX_ATTEMPTS = 5;

    private IdCollisionRetry() {}

    public static <T> Mono<T> withFreshIds(Mono<T> unit, String what) {
        return unit.retryWhen(Retry.max(MAX_ATTEMPTS - 1)
                .filter(DuplicateKeyException.class::isInstance)
                .doBeforeRetry(sig -> log.warn("{} id collision, retrying (attempt {})", what, sig.totalRetries() + 2))
                .onRetryExhaustedThrow((retrySpec, signal) ->
                        new ConflictException("Could not allocate a unique " + what + " id", signal.failure())));
    }
}
