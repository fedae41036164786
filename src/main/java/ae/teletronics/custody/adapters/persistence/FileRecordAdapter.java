package ae.teletronics.custody.adapters.persistence;

import ae.teletronics.custody.adapters.persistence.repo.FileRecordReactiveRepository;
import ae.teletronics.custody.domain.model.FileRecord;
import ae.teletronics.custody.domain.model.TransportLocation;
import ae.teletronics.custody.ports.FileRecordQueryPort;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Component
public class FileRecordAdapter implements FileRecordQueryPort {

    private final FileRecordReactiveRepository repo;
    private final ReactiveMongoTemplate mongo;

    public FileRecordAdapter(FileRecordReactiveRepository repo,
                             ReactiveMongoTemplate mongo) {
        this.repo = repo;
        this.mongo = mongo;
    }

    @Override
    public Mono<FileRecord> findById(String id) {
        return repo.findById(id);
    }

    @Override
    public Mono<FileRecord> insert(FileRecord record) {
        // insert, not save: an existing id must fail instead of being overwritten
        return mongo.insert(record);
    }

    @Override
    public Mono<Boolean> incrementViewCount(String id, Instant now) {
        return mongo.updateFirst(visible(id, now), new Update().inc("viewCount", 1), FileRecord.class)
                .map(r -> r.getMatchedCount() > 0);
    }

    @Override
    public Mono<Boolean> incrementDownloadCount(String id, Instant now) {
        return mongo.updateFirst(visible(id, now), new Update().inc("downloadCount", 1), FileRecord.class)
                .map(r -> r.getMatchedCount() > 0);
    }

    @Override
    public Mono<Boolean> updateShareExpiry(String id, String ownerId, @Nullable Instant expiresAt, Instant now) {
        Query q = visible(id, now);
        q.addCriteria(Criteria.where("ownerId").is(ownerId));
        Update u = expiresAt == null
                ? new Update().unset("shareExpiresAt")
                : new Update().set("shareExpiresAt", expiresAt);
        return mongo.updateFirst(q, u, FileRecord.class)
                .map(r -> r.getMatchedCount() > 0);
    }

    @Override
    public Mono<Boolean> deactivate(String id, String ownerId) {
        Query q = Query.query(Criteria.where("_id").is(id)
                .and("ownerId").is(ownerId)
                .and("active").is(true));
        return mongo.updateFirst(q, Update.update("active", false), FileRecord.class)
                .map(r -> r.getMatchedCount() > 0);
    }

    @Override
    public Flux<FileRecord> findActiveByOwner(String ownerId, int limit) {
        Query q = Query.query(Criteria.where("ownerId").is(ownerId).and("active").is(true))
                .with(Sort.by(Sort.Direction.DESC, "createdAt"))
                .limit(limit);
        return mongo.find(q, FileRecord.class);
    }

    @Override
    public Mono<Boolean> existsOtherActiveAt(TransportLocation location, String excludingId) {
        Query q = Query.query(Criteria.where("transportLocation.channelId").is(location.channelId())
                .and("transportLocation.messageId").is(location.messageId())
                .and("active").is(true)
                .and("_id").ne(excludingId));
        return mongo.exists(q, FileRecord.class);
    }

    // ---- helpers ----

    /** Visibility at {@code now} expressed as a filter, matching {@link FileRecord#isVisibleAt(Instant)}. */
    static Query visible(String id, Instant now) {
        return Query.query(Criteria.where("_id").is(id)
                .and("active").is(true)
                .orOperator(
                        Criteria.where("shareExpiresAt").is(null),
                        Criteria.where("shareExpiresAt").gt(now)));
    }
}
