package ae.teletronics.custody.adapters.persistence.repo;

import ae.teletronics.custody.domain.model.ShareLink;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import reactor.core.publisher.Mono;

public interface ShareLinkReactiveRepository extends ReactiveMongoRepository<ShareLink, String> {
    Mono<ShareLink> findByCode(String code);
}
