package ae.teletronics.custody.ports;

import ae.teletronics.custody.domain.model.UserRecord;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.time.Instant;

public interface UserRecordQueryPort {

    Mono<UserRecord> findById(String id);

    /**
     * Atomic get-or-create. Profile fields are only written when the document is
     * created; an existing user is returned unchanged.
     */
    Mono<UserRecord> upsert(String id, @Nullable String username, @Nullable String displayName, Instant now);

    /**
     * Adds {@code deltaBytes} (may be negative) to the storage counter and clamps the
     * result at zero. Empty if the user does not exist.
     */
    Mono<UserRecord> adjustStorageUsed(String id, long deltaBytes);

    Mono<Boolean> setBanned(String id, boolean banned);
}
