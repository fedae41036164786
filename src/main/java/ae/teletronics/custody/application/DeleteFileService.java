package ae.teletronics.custody.application;

import ae.teletronics.custody.application.dto.DeleteResult;
import ae.teletronics.custody.application.exceptions.ConflictException;
import ae.teletronics.custody.application.exceptions.ForbiddenOperationException;
import ae.teletronics.custody.application.exceptions.NotFoundException;
import ae.teletronics.custody.application.util.WriteConflicts;
import ae.teletronics.custody.config.CustodyProperties;
import ae.teletronics.custody.domain.model.FileRecord;
import ae.teletronics.custody.ports.BlobTransportPort;
import ae.teletronics.custody.ports.FileRecordQueryPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

@Service
public class DeleteFileService {

    private static final Logger log = LoggerFactory.getLogger(DeleteFileService.class);

    private final FileRecordQueryPort files;
    private final BlobTransportPort transport;
    private final TransactionalOperator tx;
    private final CustodyProperties props;

    public DeleteFileService(FileRecordQueryPort files,
                             BlobTransportPort transport,
                             TransactionalOperator tx,
                             CustodyProperties props) {
        this.files = files;
        this.transport = transport;
        this.tx = tx;
        this.props = props;
    }

    /**
     * Deletes a file owned by {@code requesterId}:
     * 1) Verify ownership (non-owners get Forbidden, the record stays as is)
     * 2) Soft delete: flip {@code active} in one transaction
     * 3) Best-effort removal of the remote payload, after commit
     * <p>
     * The caller is responsible for crediting the owner's storage with
     * {@link DeleteResult#sizeBytes()}.
     */
    public Mono<DeleteResult> delete(String id, String requesterId) {
        Mono<FileRecord> softDelete = Mono.defer(() -> tx.transactional(files.findById(id)
                .filter(FileRecord::isActive)
                .switchIfEmpty(Mono.error(new NotFoundException("File not found")))
                .flatMap(fr -> {
                    if (!fr.getOwnerId().equals(requesterId)) {
                        return Mono.error(new ForbiddenOperationException("Only the owner can delete this file"));
                    }
                    // active=true in the filter: of two racing deletes only one matches
                    return files.deactivate(id, requesterId)
                            .flatMap(done -> done
                                    ? Mono.just(fr)
                                    : Mono.error(new NotFoundException("File not found")));
                })));

        return softDelete
                .onErrorMap(WriteConflicts::isWriteConflict,
                        e -> new ConflictException("Concurrent update on the same file, please retry", e))
                .doOnNext(fr -> log.info("Soft-deleted file {} of owner {}", fr.getId(), fr.getOwnerId()))
                .flatMap(fr -> removeRemote(fr)
                        .map(removed -> new DeleteResult(fr.getId(), fr.getOwnerId(), fr.getSizeBytes(), removed)));
    }

    // Never fails: the record is already gone for clients, the payload is only garbage now.
    private Mono<Boolean> removeRemote(FileRecord fr) {
        if (fr.getTransportLocation() == null) {
            return Mono.just(false);
        }
        Mono<Boolean> shared = props.transport().deletePolicy() == CustodyProperties.DeletePolicy.ALWAYS
                ? Mono.just(false)
                : files.existsOtherActiveAt(fr.getTransportLocation(), fr.getId());

        return shared
                .flatMap(inUse -> {
                    if (inUse) {
                        log.info("Keeping remote payload {} of file {}: still referenced by another record",
                                fr.getTransportLocation(), fr.getId());
                        return Mono.just(false);
                    }
                    return transport.delete(fr.getTransportLocation())
                            .timeout(props.transport().timeout())
                            .defaultIfEmpty(false)
                            .doOnNext(ok -> {
                                if (!ok) {
                                    log.warn("Remote delete of {} for file {} was refused",
                                            fr.getTransportLocation(), fr.getId());
                                }
                            });
                })
                .onErrorResume(e -> {
                    log.warn("Remote delete of {} for file {} failed: {}",
                            fr.getTransportLocation(), fr.getId(), e.toString());
                    return Mono.just(false);
                });
    }
}
