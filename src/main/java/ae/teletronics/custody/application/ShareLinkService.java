package ae.teletronics.custody.application;

import ae.teletronics.custody.application.exceptions.ConflictException;
import ae.teletronics.custody.application.exceptions.ForbiddenOperationException;
import ae.teletronics.custody.application.exceptions.NotFoundException;
import ae.teletronics.custody.application.exceptions.ValidationException;
import ae.teletronics.custody.application.util.IdCollisionRetry;
import ae.teletronics.custody.application.util.TokenGenerator;
import ae.teletronics.custody.application.util.WriteConflicts;
import ae.teletronics.custody.domain.model.ShareLink;
import ae.teletronics.custody.ports.ClockProvider;
import ae.teletronics.custody.ports.FileRecordQueryPort;
import ae.teletronics.custody.ports.ShareLinkQueryPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Issues short share codes in the old format. Links created before file ids became
 * public references use this table; new shares hand out the file id instead.
 */
@Service
public class ShareLinkService {

    private static final Logger log = LoggerFactory.getLogger(ShareLinkService.class);

    private final FileRecordQueryPort files;
    private final ShareLinkQueryPort links;
    private final ClockProvider clock;
    private final TransactionalOperator tx;

    public ShareLinkService(FileRecordQueryPort files,
                            ShareLinkQueryPort links,
                            ClockProvider clock,
                            TransactionalOperator tx) {
        this.files = files;
        this.links = links;
        this.clock = clock;
        this.tx = tx;
    }

    /**
     * @param days optional lifetime of the code; null or 0 means no expiry
     */
    public Mono<ShareLink> issueLegacyShareLink(String fileId, String creatorId, @Nullable Integer days) {
        if (days != null && days < 0) {
            return Mono.error(new ValidationException("days must not be negative"));
        }
        Mono<ShareLink> unit = Mono.defer(() -> {
            Instant now = clock.now();
            Instant expiresAt = (days == null || days == 0) ? null : now.plus(Duration.ofDays(days));
            return tx.transactional(files.findById(fileId)
                    .filter(r -> r.isVisibleAt(now))
                    .switchIfEmpty(Mono.error(new NotFoundException("File not found")))
                    .flatMap(r -> {
                        if (!r.getOwnerId().equals(creatorId)) {
                            return Mono.error(new ForbiddenOperationException("Only the owner can share this file"));
                        }
                        return links.insert(new ShareLink(TokenGenerator.newShareCode(), fileId, creatorId, expiresAt, now));
                    }));
        });
        return IdCollisionRetry.withFreshIds(unit, "share code")
                .onErrorMap(WriteConflicts::isWriteConflict,
                        e -> new ConflictException("Concurrent update on the same file, please retry", e))
                .doOnNext(link -> log.info("Issued share code {} for file {}", link.getCode(), fileId));
    }
}
