package ae.teletronics.custody.ports;

import ae.teletronics.custody.domain.model.ShareLink;
import reactor.core.publisher.Mono;

public interface ShareLinkQueryPort {
    Mono<ShareLink> findByCode(String code);
    Mono<ShareLink> insert(ShareLink link);
    Mono<Void> incrementDownloadCountByCode(String code);
}
