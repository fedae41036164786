package ae.teletronics.custody.support;

import ae.teletronics.custody.domain.model.FileRecord;
import ae.teletronics.custody.domain.model.TransportLocation;
import ae.teletronics.custody.ports.FileRecordQueryPort;
import org.springframework.dao.DuplicateKeyException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * {@code files} collection kept in a map. Every write is atomic per id and callers
 * only ever see copies, like documents read from Mongo.
 */
public class InMemoryFileRecordPort implements FileRecordQueryPort {

    private final Map<String, FileRecord> docs = new ConcurrentHashMap<>();

    /** Raw stored state, bypassing visibility. */
    public FileRecord raw(String id) {
        FileRecord r = docs.get(id);
        return r == null ? null : copy(r);
    }

    public int size() {
        return docs.size();
    }

    public void put(FileRecord r) {
        docs.put(r.getId(), copy(r));
    }

    @Override
    public Mono<FileRecord> findById(String id) {
        return Mono.fromSupplier(() -> raw(id));
    }

    @Override
    public Mono<FileRecord> insert(FileRecord record) {
        return Mono.fromCallable(() -> {
            FileRecord stored = copy(record);
            stored.setVersion(0L);
            if (docs.putIfAbsent(stored.getId(), stored) != null) {
                throw new DuplicateKeyException("E11000 duplicate key error collection: files index: _id_");
            }
            return copy(stored);
        });
    }

    @Override
    public Mono<Boolean> incrementViewCount(String id, Instant now) {
        return update(id, r -> r.isVisibleAt(now), r -> r.setViewCount(r.getViewCount() + 1));
    }

    @Override
    public Mono<Boolean> incrementDownloadCount(String id, Instant now) {
        return update(id, r -> r.isVisibleAt(now), r -> r.setDownloadCount(r.getDownloadCount() + 1));
    }

    @Override
    public Mono<Boolean> updateShareExpiry(String id, String ownerId, Instant expiresAt, Instant now) {
        return update(id, r -> r.isVisibleAt(now) && ownerId.equals(r.getOwnerId()),
                r -> r.setShareExpiresAt(expiresAt));
    }

    @Override
    public Mono<Boolean> deactivate(String id, String ownerId) {
        return update(id, r -> r.isActive() && ownerId.equals(r.getOwnerId()), r -> r.setActive(false));
    }

    @Override
    public Flux<FileRecord> findActiveByOwner(String ownerId, int limit) {
        return Flux.defer(() -> {
            List<FileRecord> rows = docs.values().stream()
                    .filter(r -> ownerId.equals(r.getOwnerId()) && r.isActive())
                    .sorted(Comparator.comparing(FileRecord::getCreatedAt).reversed())
                    .limit(limit)
                    .map(InMemoryFileRecordPort::copy)
                    .toList();
            return Flux.fromIterable(rows);
        });
    }

    @Override
    public Mono<Boolean> existsOtherActiveAt(TransportLocation location, String excludingId) {
        return Mono.fromSupplier(() -> docs.values().stream()
                .anyMatch(r -> r.isActive()
                        && location.equals(r.getTransportLocation())
                        && !r.getId().equals(excludingId)));
    }

    // ---- helpers ----

    private Mono<Boolean> update(String id,
                                 Predicate<FileRecord> filter,
                                 Consumer<FileRecord> change) {
        return Mono.fromSupplier(() -> {
            boolean[] matched = {false};
            docs.computeIfPresent(id, (k, r) -> {
                if (filter.test(r)) {
                    change.accept(r);
                    r.setVersion(r.getVersion() == null ? 1L : r.getVersion() + 1);
                    matched[0] = true;
                }
                return r;
            });
            return matched[0];
        });
    }

    static FileRecord copy(FileRecord r) {
        FileRecord c = new FileRecord();
        c.setId(r.getId());
        c.setBlobRef(r.getBlobRef());
        c.setBlobUniqueRef(r.getBlobUniqueRef());
        c.setName(r.getName());
        c.setMimeType(r.getMimeType());
        c.setExtension(r.getExtension());
        c.setKind(r.getKind());
        c.setSizeBytes(r.getSizeBytes());
        c.setDurationSeconds(r.getDurationSeconds());
        c.setWidth(r.getWidth());
        c.setHeight(r.getHeight());
        c.setTransportLocation(r.getTransportLocation());
        c.setOwnerId(r.getOwnerId());
        c.setOwnerDisplayName(r.getOwnerDisplayName());
        c.setDownloadCount(r.getDownloadCount());
        c.setViewCount(r.getViewCount());
        c.setActive(r.isActive());
        c.setShareExpiresAt(r.getShareExpiresAt());
        c.setCreatedAt(r.getCreatedAt());
        c.setVersion(r.getVersion());
        return c;
    }
}
