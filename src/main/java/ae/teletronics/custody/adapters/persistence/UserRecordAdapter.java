package ae.teletronics.custody.adapters.persistence;

import ae.teletronics.custody.adapters.persistence.repo.UserRecordReactiveRepository;
import ae.teletronics.custody.domain.model.UserRecord;
import ae.teletronics.custody.ports.UserRecordQueryPort;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Instant;

@Component
public class UserRecordAdapter implements UserRecordQueryPort {

    private static final FindAndModifyOptions RETURN_NEW = FindAndModifyOptions.options().returnNew(true);

    private final UserRecordReactiveRepository repo;
    private final ReactiveMongoTemplate mongo;

    public UserRecordAdapter(UserRecordReactiveRepository repo, ReactiveMongoTemplate mongo) {
        this.repo = repo;
        this.mongo = mongo;
    }

    @Override
    public Mono<UserRecord> findById(String id) {
        return repo.findById(id);
    }

    @Override
    public Mono<UserRecord> upsert(String id, @Nullable String username, @Nullable String displayName, Instant now) {
        Update u = new Update()
                .setOnInsert("username", username)
                .setOnInsert("displayName", displayName)
                .setOnInsert("admin", false)
                .setOnInsert("banned", false)
                .setOnInsert("storageUsedBytes", 0L)
                .setOnInsert("createdAt", now);
        return mongo.findAndModify(byId(id), u,
                        FindAndModifyOptions.options().upsert(true).returnNew(true), UserRecord.class)
                // two first-time upserts can race on _id; the loser just reads the winner's document
                .retryWhen(Retry.max(1).filter(DuplicateKeyException.class::isInstance));
    }

    @Override
    public Mono<UserRecord> adjustStorageUsed(String id, long deltaBytes) {
        return mongo.findAndModify(byId(id), new Update().inc("storageUsedBytes", deltaBytes), RETURN_NEW, UserRecord.class)
                .flatMap(u -> {
                    if (u.getStorageUsedBytes() >= 0) {
                        return Mono.just(u);
                    }
                    Query negative = Query.query(Criteria.where("_id").is(id).and("storageUsedBytes").lt(0));
                    return mongo.findAndModify(negative, Update.update("storageUsedBytes", 0L), RETURN_NEW, UserRecord.class)
                            .switchIfEmpty(repo.findById(id));
                });
    }

    @Override
    public Mono<Boolean> setBanned(String id, boolean banned) {
        return mongo.updateFirst(byId(id), Update.update("banned", banned), UserRecord.class)
                .map(r -> r.getMatchedCount() > 0);
    }

    private static Query byId(String id) {
        return Query.query(Criteria.where("_id").is(id));
    }
}
