package ae.teletronics.custody.application;

import ae.teletronics.custody.application.exceptions.ConflictException;
import ae.teletronics.custody.application.exceptions.ForbiddenOperationException;
import ae.teletronics.custody.application.exceptions.NotFoundException;
import ae.teletronics.custody.application.exceptions.ValidationException;
import ae.teletronics.custody.application.util.WriteConflicts;
import ae.teletronics.custody.config.CustodyProperties;
import ae.teletronics.custody.domain.model.UserRecord;
import ae.teletronics.custody.ports.ClockProvider;
import ae.teletronics.custody.ports.UserRecordQueryPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

@Service
public class UserAccountService {

    private static final Logger log = LoggerFactory.getLogger(UserAccountService.class);
    private static final int STORAGE_RETRIES = 3;

    private final UserRecordQueryPort users;
    private final ClockProvider clock;
    private final TransactionalOperator tx;
    private final CustodyProperties props;

    public UserAccountService(UserRecordQueryPort users,
                              ClockProvider clock,
                              TransactionalOperator tx,
                              CustodyProperties props) {
        this.users = users;
        this.clock = clock;
        this.tx = tx;
        this.props = props;
    }

    /**
     * Atomic get-or-create. Profile fields are taken from the first call only.
     * Ids listed in {@code custody.admin-ids} come back flagged as admin.
     */
    public Mono<UserRecord> getOrCreateUser(String id, @Nullable String username, @Nullable String displayName) {
        if (!StringUtils.hasText(id)) {
            return Mono.error(new ValidationException("user id is required"));
        }
        return Mono.defer(() -> users.upsert(id, username, displayName, clock.now()))
                .map(this::withConfiguredAdmin);
    }

    /** Same as {@link #getOrCreateUser} but rejects banned users. */
    public Mono<UserRecord> requireActiveUser(String id, @Nullable String username, @Nullable String displayName) {
        return getOrCreateUser(id, username, displayName)
                .flatMap(u -> u.isBanned()
                        ? Mono.error(new ForbiddenOperationException("User is banned"))
                        : Mono.just(u));
    }

    public Mono<UserRecord> findUser(String id) {
        return users.findById(id)
                .map(this::withConfiguredAdmin)
                .switchIfEmpty(Mono.error(new NotFoundException("User not found")));
    }

    /**
     * Adds {@code deltaBytes} to the user's storage counter; negative deltas never
     * take it below zero. Write conflicts with a concurrent adjustment are retried
     * a few times before surfacing as a conflict.
     */
    public Mono<UserRecord> adjustStorage(String id, long deltaBytes) {
        return Mono.defer(() -> tx.transactional(users.adjustStorageUsed(id, deltaBytes)))
                .retryWhen(Retry.backoff(STORAGE_RETRIES, Duration.ofMillis(20))
                        .filter(WriteConflicts::isWriteConflict)
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                .onErrorMap(WriteConflicts::isWriteConflict,
                        e -> new ConflictException("Concurrent update on the same user, please retry", e))
                .switchIfEmpty(Mono.error(new NotFoundException("User not found")));
    }

    public Mono<Void> setBanned(String actorId, String targetId, boolean banned) {
        if (!props.isAdmin(actorId)) {
            return users.findById(actorId)
                    .filter(UserRecord::isAdmin)
                    .switchIfEmpty(Mono.error(new ForbiddenOperationException("Admin rights required")))
                    .then(applyBan(actorId, targetId, banned));
        }
        return applyBan(actorId, targetId, banned);
    }

    // ---- helpers ----

    private Mono<Void> applyBan(String actorId, String targetId, boolean banned) {
        return Mono.defer(() -> tx.transactional(users.setBanned(targetId, banned)))
                .flatMap(matched -> matched
                        ? Mono.<Void>empty()
                        : Mono.error(new NotFoundException("User not found")))
                .doOnSuccess(v -> log.info("User {} {} by {}", targetId, banned ? "banned" : "unbanned", actorId));
    }

    private UserRecord withConfiguredAdmin(UserRecord u) {
        if (props.isAdmin(u.getId())) {
            u.setAdmin(true);
        }
        return u;
    }
}
