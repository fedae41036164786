package ae.teletronics.custody.adapters.web;

import ae.teletronics.custody.adapters.web.dto.*;
import ae.teletronics.custody.application.DeleteFileService;
import ae.teletronics.custody.application.FileAccessService;
import ae.teletronics.custody.application.ListFilesService;
import ae.teletronics.custody.application.ShareExpiryService;
import ae.teletronics.custody.application.ShareLinkService;
import ae.teletronics.custody.application.UploadFileService;
import ae.teletronics.custody.application.UserAccountService;
import ae.teletronics.custody.application.dto.UploadFileCommand;
import ae.teletronics.custody.application.exceptions.ValidationException;
import ae.teletronics.custody.domain.FileKind;
import ae.teletronics.custody.domain.model.UserRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * HTTP front-end of the custody engine. The caller is already authenticated
 * upstream and identified by {@code X-User-Id}; every request registers the
 * caller and rejects banned users before touching any file.
 */
@RestController
@RequestMapping
public class FilesController {

    private static final Logger log = LoggerFactory.getLogger(FilesController.class);

    static final String USER_ID = "X-User-Id";
    static final String USER_NAME = "X-User-Name";

    private final UploadFileService uploadSvc;
    private final FileAccessService accessSvc;
    private final ShareExpiryService expirySvc;
    private final DeleteFileService deleteSvc;
    private final ListFilesService listSvc;
    private final ShareLinkService legacyLinkSvc;
    private final UserAccountService users;
    private final ShareLinkBuilder linkBuilder;

    public FilesController(UploadFileService uploadSvc,
                           FileAccessService accessSvc,
                           ShareExpiryService expirySvc,
                           DeleteFileService deleteSvc,
                           ListFilesService listSvc,
                           ShareLinkService legacyLinkSvc,
                           UserAccountService users,
                           ShareLinkBuilder linkBuilder) {
        this.uploadSvc = uploadSvc;
        this.accessSvc = accessSvc;
        this.expirySvc = expirySvc;
        this.deleteSvc = deleteSvc;
        this.listSvc = listSvc;
        this.legacyLinkSvc = legacyLinkSvc;
        this.users = users;
        this.linkBuilder = linkBuilder;
    }

    // ---- Upload (credits the owner's storage) ----
    // The record is committed before the credit; a failed credit is logged and the upload still succeeds.
    @PostMapping(path = "/files",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<FileRecordDto> upload(@RequestHeader(USER_ID) String userId,
                                      @RequestHeader(value = USER_NAME, required = false) String userName,
                                      @RequestBody UploadRequest body) {
        return caller(userId, userName)
                .flatMap(user -> uploadSvc.upload(toCommand(user, body)))
                .flatMap(saved -> users.adjustStorage(userId, saved.getSizeBytes())
                        .thenReturn(saved)
                        .onErrorResume(e -> {
                            log.warn("Storage credit of {} bytes for user {} failed after upload of {}: {}",
                                    saved.getSizeBytes(), userId, saved.getId(), e.toString());
                            return Mono.just(saved);
                        }))
                .map(saved -> FileRecordDto.from(saved, linkBuilder.build(saved.getId())));
    }

    // ---- List "my files" ----
    @GetMapping(path = "/files/me", produces = MediaType.APPLICATION_JSON_VALUE)
    public Flux<FileSummaryDto> listMine(@RequestHeader(USER_ID) String userId,
                                         @RequestHeader(value = USER_NAME, required = false) String userName,
                                         @RequestParam(defaultValue = "0") int limit) {
        return caller(userId, userName)
                .flatMapMany(user -> listSvc.listOwned(user.getId(), limit))
                .map(s -> FileSummaryDto.from(s, linkBuilder.build(s.id())));
    }

    // ---- Follow a share link: resolve, count a view, hand over a personal copy ----
    @GetMapping(path = "/s/{reference}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<FileRecordDto> openShared(@RequestHeader(USER_ID) String userId,
                                          @RequestHeader(value = USER_NAME, required = false) String userName,
                                          @PathVariable String reference) {
        return caller(userId, userName)
                .flatMap(user -> accessSvc.openShared(reference, user.getId(), user.preferredName()))
                .map(r -> FileRecordDto.from(r, linkBuilder.build(r.getId())));
    }

    @GetMapping(path = "/files/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<FileRecordDto> get(@RequestHeader(USER_ID) String userId,
                                   @RequestHeader(value = USER_NAME, required = false) String userName,
                                   @PathVariable String id) {
        return caller(userId, userName)
                .then(accessSvc.resolve(id))
                .map(r -> FileRecordDto.from(r, linkBuilder.build(r.getId())));
    }

    @PostMapping("/files/{id}/downloads")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> recordDownload(@RequestHeader(USER_ID) String userId,
                                     @RequestHeader(value = USER_NAME, required = false) String userName,
                                     @PathVariable String id) {
        return caller(userId, userName).then(accessSvc.recordDownload(id));
    }

    @PutMapping(path = "/files/{id}/share-expiry",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ShareExpiryResponse> setShareExpiry(@RequestHeader(USER_ID) String userId,
                                                    @RequestHeader(value = USER_NAME, required = false) String userName,
                                                    @PathVariable String id,
                                                    @RequestBody ShareExpiryRequest body) {
        if (body == null || body.durationSeconds() == null) {
            return Mono.error(new ValidationException("durationSeconds is required"));
        }
        return caller(userId, userName)
                .flatMap(user -> expirySvc.setShareExpiry(id, user.getId(), body.durationSeconds()))
                .map(ShareExpiryResponse::from);
    }

    // ---- Delete (debits the owner's storage) ----
    @DeleteMapping(path = "/files/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<DeleteResponse> delete(@RequestHeader(USER_ID) String userId,
                                       @RequestHeader(value = USER_NAME, required = false) String userName,
                                       @PathVariable String id) {
        return caller(userId, userName)
                .flatMap(user -> deleteSvc.delete(id, user.getId()))
                .flatMap(res -> users.adjustStorage(res.ownerId(), -res.sizeBytes())
                        .map(u -> new DeleteResponse(res.fileId(), res.sizeBytes(), res.remoteDeleted(),
                                u.getStorageUsedBytes())));
    }

    @PostMapping(path = "/files/{id}/legacy-links", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<LegacyLinkResponse> issueLegacyLink(@RequestHeader(USER_ID) String userId,
                                                    @RequestHeader(value = USER_NAME, required = false) String userName,
                                                    @PathVariable String id,
                                                    @RequestBody(required = false) LegacyLinkRequest body) {
        Integer days = body == null ? null : body.days();
        return caller(userId, userName)
                .flatMap(user -> legacyLinkSvc.issueLegacyShareLink(id, user.getId(), days))
                .map(link -> new LegacyLinkResponse(link.getCode(), link.getFileId(), link.getExpiresAt(),
                        linkBuilder.build(link.getCode())));
    }

    // ---- helpers ----

    private Mono<UserRecord> caller(String userId, String userName) {
        return users.requireActiveUser(userId, null, userName);
    }

    private static UploadFileCommand toCommand(UserRecord user, UploadRequest body) {
        if (body == null) {
            throw new ValidationException("request body is required");
        }
        FileKind kind = StringUtils.hasText(body.kind())
                ? FileKind.parse(body.kind())
                : FileKind.fromFilename(body.name());
        if (kind == null) {
            throw new ValidationException("unknown kind: " + body.kind());
        }
        if (body.sizeBytes() == null) {
            throw new ValidationException("sizeBytes is required");
        }
        return new UploadFileCommand(
                user.getId(),
                user.preferredName(),
                kind,
                body.rawHandle(),
                body.name(),
                body.mimeType(),
                body.sizeBytes(),
                body.durationSeconds(),
                body.width(),
                body.height()
        );
    }
}
