package ae.teletronics.custody.application;

import ae.teletronics.custody.application.exceptions.ConflictException;
import ae.teletronics.custody.application.exceptions.NotFoundException;
import ae.teletronics.custody.application.exceptions.ValidationException;
import ae.teletronics.custody.application.util.IdCollisionRetry;
import ae.teletronics.custody.application.util.TokenGenerator;
import ae.teletronics.custody.application.util.WriteConflicts;
import ae.teletronics.custody.domain.model.FileRecord;
import ae.teletronics.custody.domain.model.ShareLink;
import ae.teletronics.custody.ports.ClockProvider;
import ae.teletronics.custody.ports.FileRecordQueryPort;
import ae.teletronics.custody.ports.ShareLinkQueryPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Read side of the custody engine: reference resolution, counters and
 * clone-on-access.
 */
@Service
public class FileAccessService {

    private static final Logger log = LoggerFactory.getLogger(FileAccessService.class);

    private final FileRecordQueryPort files;
    private final ShareLinkQueryPort links;
    private final ClockProvider clock;
    private final TransactionalOperator tx;

    public FileAccessService(FileRecordQueryPort files,
                             ShareLinkQueryPort links,
                             ClockProvider clock,
                             TransactionalOperator tx) {
        this.files = files;
        this.links = links;
        this.clock = clock;
        this.tx = tx;
    }

    /**
     * Resolve a public reference to a visible record.
     * The reference is tried as a file id first, then as a legacy share code.
     * Only the legacy path has a side effect: it counts one download on the
     * record and on the link.
     */
    public Mono<FileRecord> resolve(String reference) {
        if (!StringUtils.hasText(reference)) {
            return Mono.error(new NotFoundException("File not found"));
        }
        return Mono.defer(() -> {
            Instant now = clock.now();
            return byFileId(reference, now)
                    .switchIfEmpty(Mono.defer(() -> byLegacyCode(reference, now)))
                    .switchIfEmpty(Mono.error(new NotFoundException("File not found")));
        });
    }

    // single-document $inc, atomic on its own
    public Mono<Void> recordView(String id) {
        return Mono.defer(() -> files.incrementViewCount(id, clock.now()))
                .onErrorMap(WriteConflicts::isWriteConflict, FileAccessService::conflict)
                .flatMap(matched -> matched ? Mono.<Void>empty() : Mono.error(new NotFoundException("File not found")));
    }

    public Mono<Void> recordDownload(String id) {
        return Mono.defer(() -> files.incrementDownloadCount(id, clock.now()))
                .onErrorMap(WriteConflicts::isWriteConflict, FileAccessService::conflict)
                .flatMap(matched -> matched ? Mono.<Void>empty() : Mono.error(new NotFoundException("File not found")));
    }

    /**
     * Gives the requester a record of their own for a shared file.
     * The owner gets {@code id} back unchanged; anyone else gets a fresh clone
     * pointing at the same stored payload. The source record is never modified.
     */
    public Mono<String> transferOnAccess(String id, String requesterId, String requesterDisplayName) {
        if (!StringUtils.hasText(requesterId)) {
            return Mono.error(new ValidationException("requesterId is required"));
        }
        Mono<String> unit = Mono.defer(() -> {
            Instant now = clock.now();
            return tx.transactional(files.findById(id)
                    .filter(src -> src.isVisibleAt(now))
                    .switchIfEmpty(Mono.error(new NotFoundException("File not found")))
                    .flatMap(src -> {
                        if (requesterId.equals(src.getOwnerId())) {
                            return Mono.just(src.getId());
                        }
                        FileRecord clone = src.cloneFor(TokenGenerator.newFileId(), requesterId, requesterDisplayName, now);
                        return files.insert(clone)
                                .doOnNext(saved -> log.info("Cloned file {} as {} for user {}",
                                        src.getId(), saved.getId(), requesterId))
                                .map(FileRecord::getId);
                    }));
        });
        return IdCollisionRetry.withFreshIds(unit, "file")
                .onErrorMap(WriteConflicts::isWriteConflict, FileAccessService::conflict);
    }

    /**
     * What following a share link does: resolve the reference, count a view on
     * the resolved record, then hand the requester their own record.
     */
    public Mono<FileRecord> openShared(String reference, String requesterId, String requesterDisplayName) {
        return resolve(reference)
                .flatMap(shared -> recordView(shared.getId())
                        .then(transferOnAccess(shared.getId(), requesterId, requesterDisplayName)))
                .flatMap(ownId -> files.findById(ownId)
                        .switchIfEmpty(Mono.error(new NotFoundException("File not found"))));
    }

    // ---- lookup strategies ----

    private Mono<FileRecord> byFileId(String id, Instant now) {
        return files.findById(id).filter(r -> r.isVisibleAt(now));
    }

    private Mono<FileRecord> byLegacyCode(String code, Instant now) {
        return links.findByCode(code)
                .filter(link -> link.isUsableAt(now))
                .flatMap(link -> tx.transactional(countLegacyDownload(link, now)))
                .onErrorMap(WriteConflicts::isWriteConflict, FileAccessService::conflict);
    }

    private Mono<FileRecord> countLegacyDownload(ShareLink link, Instant now) {
        return files.incrementDownloadCount(link.getFileId(), now)
                .filter(Boolean::booleanValue)
                .flatMap(counted -> links.incrementDownloadCountByCode(link.getCode())
                        .then(files.findById(link.getFileId())));
    }

    private static ConflictException conflict(Throwable e) {
        return new ConflictException("Concurrent update on the same file, please retry", e);
    }
}
