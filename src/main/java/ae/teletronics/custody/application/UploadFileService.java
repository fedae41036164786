package ae.teletronics.custody.application;

import ae.teletronics.custody.application.dto.FileMeta;
import ae.teletronics.custody.application.dto.UploadFileCommand;
import ae.teletronics.custody.application.exceptions.ConflictException;
import ae.teletronics.custody.application.exceptions.TransportException;
import ae.teletronics.custody.application.exceptions.TransportTimeoutException;
import ae.teletronics.custody.application.exceptions.ValidationException;
import ae.teletronics.custody.application.util.IdCollisionRetry;
import ae.teletronics.custody.application.util.TokenGenerator;
import ae.teletronics.custody.application.util.WriteConflicts;
import ae.teletronics.custody.config.CustodyProperties;
import ae.teletronics.custody.domain.FileKind;
import ae.teletronics.custody.domain.model.FileRecord;
import ae.teletronics.custody.domain.model.TransportLocation;
import ae.teletronics.custody.ports.BlobTransportPort;
import ae.teletronics.custody.ports.ClockProvider;
import ae.teletronics.custody.ports.FileRecordQueryPort;
import ae.teletronics.custody.ports.FileTypeDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

@Service
public class UploadFileService {

    private static final Logger log = LoggerFactory.getLogger(UploadFileService.class);

    private final FileRecordQueryPort files;
    private final BlobTransportPort transport;
    private final FileTypeDetector typeDetector;
    private final ClockProvider clock;
    private final TransactionalOperator tx;
    private final CustodyProperties props;

    public UploadFileService(FileRecordQueryPort files,
                             BlobTransportPort transport,
                             FileTypeDetector typeDetector,
                             ClockProvider clock,
                             TransactionalOperator tx,
                             CustodyProperties props) {
        this.files = files;
        this.transport = transport;
        this.typeDetector = typeDetector;
        this.clock = clock;
        this.tx = tx;
        this.props = props;
    }

    /**
     * Re-hosts the payload through the blob transport, then records it.
     * Transport failures are surfaced as-is and never retried: after a timeout the
     * payload may or may not exist remotely. No record is written unless the
     * transport call succeeded.
     */
    public Mono<FileRecord> upload(UploadFileCommand cmd) {
        return Mono.defer(() -> {
            validate(cmd);
            final String name = StringUtils.hasText(cmd.name()) ? cmd.name().trim() : defaultName(cmd.kind());
            final String mimeType = StringUtils.hasText(cmd.mimeType())
                    ? cmd.mimeType()
                    : typeDetector.detectMimeType(name).orElse(null);
            final String extension = extensionOf(name, mimeType);

            return transport.store(cmd.kind(), cmd.rawHandle(), caption(cmd, name))
                    .timeout(props.transport().timeout())
                    .onErrorMap(TimeoutException.class,
                            e -> new TransportTimeoutException("Blob transport did not answer within "
                                    + props.transport().timeout(), e))
                    .onErrorMap(e -> !(e instanceof TransportException),
                            e -> new TransportException("Blob transport failed: " + e.getMessage(), e))
                    .switchIfEmpty(Mono.error(new TransportException("Blob transport returned no reference")))
                    .flatMap(stored -> insert(new FileMeta(
                                    stored.blobRef(),
                                    stored.blobUniqueRef(),
                                    name,
                                    mimeType,
                                    extension,
                                    cmd.kind(),
                                    cmd.sizeBytes(),
                                    cmd.durationSeconds(),
                                    cmd.width(),
                                    cmd.height()),
                            stored.location(), cmd.ownerId(), cmd.ownerDisplayName()));
        });
    }

    /**
     * Records a payload that is already stored remotely. Each call creates a new
     * record with a fresh id; it is not idempotent.
     */
    public Mono<String> registerUpload(FileMeta meta,
                                       TransportLocation location,
                                       String ownerId,
                                       @Nullable String ownerDisplayName) {
        return Mono.defer(() -> insert(meta, location, ownerId, ownerDisplayName)).map(FileRecord::getId);
    }

    private Mono<FileRecord> insert(FileMeta meta, TransportLocation location, String ownerId, String ownerDisplayName) {
        validate(meta, location, ownerId);
        Mono<FileRecord> unit = Mono.defer(() -> {
            FileRecord r = toRecord(meta, location, ownerId, ownerDisplayName, clock.now());
            r.setId(TokenGenerator.newFileId());
            return tx.transactional(files.insert(r));
        });
        return IdCollisionRetry.withFreshIds(unit, "file")
                .onErrorMap(WriteConflicts::isWriteConflict,
                        e -> new ConflictException("Upload collided with a concurrent write, please retry", e))
                .doOnNext(saved -> log.info("Registered file {} ({}, {} bytes) for owner {}",
                        saved.getId(), saved.getKind(), saved.getSizeBytes(), saved.getOwnerId()));
    }

    // ---- helpers ----

    private void validate(UploadFileCommand cmd) {
        if (cmd == null || !StringUtils.hasText(cmd.ownerId())) {
            throw new ValidationException("ownerId is required");
        }
        if (!StringUtils.hasText(cmd.rawHandle())) {
            throw new ValidationException("rawHandle is required");
        }
        if (cmd.kind() == null) {
            throw new ValidationException("kind is required");
        }
        if (cmd.sizeBytes() < 0) {
            throw new ValidationException("sizeBytes must not be negative");
        }
        CustodyProperties.Upload limits = props.upload();
        if (cmd.sizeBytes() > limits.maxFileSizeBytes()) {
            throw new ValidationException("File too large, maximum is " + limits.maxFileSizeMb() + " MB");
        }
        if (!limits.allowedKinds().contains(cmd.kind())) {
            throw new ValidationException("Files of kind " + cmd.kind() + " are not accepted");
        }
    }

    private static void validate(FileMeta meta, TransportLocation location, String ownerId) {
        if (meta == null) {
            throw new ValidationException("file metadata is required");
        }
        if (!StringUtils.hasText(meta.blobRef())) {
            throw new ValidationException("blobRef is required");
        }
        if (!StringUtils.hasText(meta.name())) {
            throw new ValidationException("name is required");
        }
        if (meta.kind() == null) {
            throw new ValidationException("kind is required");
        }
        if (meta.sizeBytes() < 0) {
            throw new ValidationException("sizeBytes must not be negative");
        }
        if (location == null) {
            throw new ValidationException("transportLocation is required");
        }
        if (!StringUtils.hasText(ownerId)) {
            throw new ValidationException("ownerId is required");
        }
    }

    private static FileRecord toRecord(FileMeta meta, TransportLocation location,
                                       String ownerId, String ownerDisplayName, Instant now) {
        FileRecord r = new FileRecord();
        r.setBlobRef(meta.blobRef());
        r.setBlobUniqueRef(meta.blobUniqueRef() == null ? "" : meta.blobUniqueRef());
        r.setName(meta.name());
        r.setMimeType(meta.mimeType());
        r.setExtension(meta.extension());
        r.setKind(meta.kind());
        r.setSizeBytes(meta.sizeBytes());
        if (meta.kind().isMedia()) {
            r.setDurationSeconds(meta.durationSeconds());
            r.setWidth(meta.width());
            r.setHeight(meta.height());
        }
        r.setTransportLocation(location);
        r.setOwnerId(ownerId);
        r.setOwnerDisplayName(ownerDisplayName);
        r.setActive(true);
        r.setCreatedAt(now);
        return r;
    }

    private String extensionOf(String name, @Nullable String mimeType) {
        int dot = name.lastIndexOf('.');
        if (dot >= 0 && dot < name.length() - 1) {
            return name.substring(dot + 1).toLowerCase(Locale.ROOT);
        }
        if (mimeType != null) {
            return typeDetector.extensionFor(mimeType).orElse("");
        }
        return "";
    }

    private static String defaultName(FileKind kind) {
        return switch (kind) {
            case PHOTO -> "photo.jpg";
            case VIDEO -> "video.mp4";
            case AUDIO -> "audio.mp3";
            case VOICE -> "voice.ogg";
            default -> "unnamed";
        };
    }

    private static String caption(UploadFileCommand cmd, String name) {
        String uploader = StringUtils.hasText(cmd.ownerDisplayName())
                ? cmd.ownerDisplayName()
                : "User_" + cmd.ownerId();
        return name + "\n\nUploader: " + uploader + " (ID: " + cmd.ownerId() + ")";
    }
}
