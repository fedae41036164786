package ae.teletronics.custody.application;

import ae.teletronics.custody.application.dto.ShareExpiry;
import ae.teletronics.custody.application.exceptions.ConflictException;
import ae.teletronics.custody.application.exceptions.ForbiddenOperationException;
import ae.teletronics.custody.application.exceptions.NotFoundException;
import ae.teletronics.custody.application.exceptions.ValidationException;
import ae.teletronics.custody.application.util.WriteConflicts;
import ae.teletronics.custody.ports.ClockProvider;
import ae.teletronics.custody.ports.FileRecordQueryPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

@Service
public class ShareExpiryService {

    private static final Logger log = LoggerFactory.getLogger(ShareExpiryService.class);

    /** 100 years. Keeps {@code now + duration} within what a Mongo date can hold. */
    public static final long MAX_DURATION_SECONDS = Duration.ofDays(36_525).getSeconds();

    private final FileRecordQueryPort files;
    private final ClockProvider clock;
    private final TransactionalOperator tx;

    public ShareExpiryService(FileRecordQueryPort files, ClockProvider clock, TransactionalOperator tx) {
        this.files = files;
        this.clock = clock;
        this.tx = tx;
    }

    /**
     * Owner-only. {@code durationSeconds == 0} makes the share permanent, a positive
     * value up to {@link #MAX_DURATION_SECONDS} sets the expiry to now + duration.
     * The record must still be visible: an expired share cannot be revived through this call.
     */
    public Mono<ShareExpiry> setShareExpiry(String id, String requesterId, long durationSeconds) {
        if (durationSeconds < 0) {
            return Mono.error(new ValidationException("durationSeconds must not be negative"));
        }
        if (durationSeconds > MAX_DURATION_SECONDS) {
            return Mono.error(new ValidationException("durationSeconds must not exceed " + MAX_DURATION_SECONDS
                    + " (100 years)"));
        }
        return Mono.defer(() -> {
            Instant now = clock.now();
            Instant expiresAt = durationSeconds == 0 ? null : now.plusSeconds(durationSeconds);
            return tx.transactional(files.findById(id)
                    .filter(r -> r.isVisibleAt(now))
                    .switchIfEmpty(Mono.error(new NotFoundException("File not found")))
                    .flatMap(r -> {
                        if (!r.getOwnerId().equals(requesterId)) {
                            return Mono.error(new ForbiddenOperationException("Only the owner can change the share expiry"));
                        }
                        return files.updateShareExpiry(id, requesterId, expiresAt, now);
                    })
                    .flatMap(updated -> updated
                            ? Mono.just(new ShareExpiry(id, expiresAt))
                            : Mono.error(new ConflictException("File changed while updating its expiry, please retry"))));
        })
                .onErrorMap(WriteConflicts::isWriteConflict,
                        e -> new ConflictException("Concurrent update on the same file, please retry", e))
                .doOnNext(se -> log.info("Share expiry of file {} set to {}", id,
                        se.isPermanent() ? "permanent" : se.expiresAt()));
    }
}
