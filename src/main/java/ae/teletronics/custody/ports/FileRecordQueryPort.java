package ae.teletronics.custody.ports;

import ae.teletronics.custody.domain.model.FileRecord;
import ae.teletronics.custody.domain.model.TransportLocation;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Access to the {@code files} collection.
 * Conditional writes report whether a document matched, so callers can tell a
 * missing or hidden record apart from a successful update without re-reading.
 */
public interface FileRecordQueryPort {

    /** Raw lookup, ignores visibility. Empty if no record has this id. */
    Mono<FileRecord> findById(String id);

    /** Inserts a new record; fails with a DuplicateKeyException if the id is taken. */
    Mono<FileRecord> insert(FileRecord record);

    // Atomic counter increments, applied only to records visible at `now`
    Mono<Boolean> incrementViewCount(String id, Instant now);
    Mono<Boolean> incrementDownloadCount(String id, Instant now);

    /** Sets or clears the share expiry of a record visible at {@code now} and owned by {@code ownerId}. */
    Mono<Boolean> updateShareExpiry(String id, String ownerId, @Nullable Instant expiresAt, Instant now);

    /** Soft delete: flips {@code active} to false if the record is still active and owned by {@code ownerId}. */
    Mono<Boolean> deactivate(String id, String ownerId);

    /** Active records of an owner, newest first. */
    Flux<FileRecord> findActiveByOwner(String ownerId, int limit);

    /** Whether any active record other than {@code excludingId} points at the same transport message. */
    Mono<Boolean> existsOtherActiveAt(TransportLocation location, String excludingId);
}
