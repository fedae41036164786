package ae.teletronics.custody.adapters.persistence;

import ae.teletronics.custody.adapters.persistence.repo.ShareLinkReactiveRepository;
import ae.teletronics.custody.domain.model.ShareLink;
import ae.teletronics.custody.ports.ShareLinkQueryPort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
public class ShareLinkAdapter implements ShareLinkQueryPort {
    private final ShareLinkReactiveRepository repo;
    private final ReactiveMongoTemplate mongo;

    public ShareLinkAdapter(ShareLinkReactiveRepository repo, ReactiveMongoTemplate mongo) {
        this.repo = repo;
        this.mongo = mongo;
    }

    @Override
    public Mono<ShareLink> findByCode(String code) {
        return repo.findByCode(code);
    }

    @Override
    public Mono<ShareLink> insert(ShareLink link) {
        return mongo.insert(link);
    }

    @Override
    public Mono<Void> incrementDownloadCountByCode(String code) {
        return mongo.updateFirst(
                Query.query(Criteria.where("code").is(code)),
                new Update().inc("downloadCount", 1),
                ShareLink.class
        ).then();
    }
}
