package ae.teletronics.custody.application;

import ae.teletronics.custody.IntegrationTestBase;
import ae.teletronics.custody.application.dto.DeleteResult;
import ae.teletronics.custody.application.dto.UploadFileCommand;
import ae.teletronics.custody.application.exceptions.NotFoundException;
import ae.teletronics.custody.domain.FileKind;
import ae.teletronics.custody.domain.model.FileRecord;
import ae.teletronics.custody.domain.model.ShareLink;
import ae.teletronics.custody.domain.model.UserRecord;
import ae.teletronics.custody.ports.FileRecordQueryPort;
import ae.teletronics.custody.support.MutableClock;
import ae.teletronics.custody.support.RecordingBlobTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Engine operations end to end against MongoDB with real transactions.
 */
class CustodyFlowIT extends IntegrationTestBase {

    static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired UploadFileService uploads;
    @Autowired FileAccessService access;
    @Autowired ShareExpiryService expiry;
    @Autowired DeleteFileService deletes;
    @Autowired ShareLinkService legacyLinks;
    @Autowired UserAccountService accounts;
    @Autowired FileRecordQueryPort files;
    @Autowired RecordingBlobTransport transport;
    @Autowired MutableClock clock;
    @Autowired ReactiveMongoTemplate mongo;

    @BeforeEach
    void cleanState() {
        clock.set(T0);
        mongo.remove(new Query(), FileRecord.class).block();
        mongo.remove(new Query(), ShareLink.class).block();
        mongo.remove(new Query(), UserRecord.class).block();
    }

    private FileRecord upload(String owner, String name) {
        return uploads.upload(new UploadFileCommand(owner, "Name " + owner, FileKind.DOCUMENT,
                "raw-" + name, name, null, 2048, null, null, null)).block();
    }

    @Test
    void upload_persistsPointerWithDetectedType() {
        FileRecord r = upload("u1", "report.pdf");

        FileRecord stored = files.findById(r.getId()).block();
        assertThat(stored.getMimeType()).isEqualTo("application/pdf");
        assertThat(stored.getBlobRef()).isEqualTo("stored-raw-report.pdf");
        assertThat(stored.getTransportLocation().channelId()).isEqualTo(RecordingBlobTransport.CHANNEL_ID);
        assertThat(stored.isActive()).isTrue();
    }

    @Test
    void openShared_clonesForStranger_andCountsTheView() {
        FileRecord src = upload("u1", "a.pdf");

        FileRecord mine = access.openShared(src.getId(), "u2", "Bea").block();

        assertThat(mine.getId()).isNotEqualTo(src.getId());
        assertThat(mine.getOwnerId()).isEqualTo("u2");
        assertThat(mine.getTransportLocation()).isEqualTo(src.getTransportLocation());
        assertThat(files.findById(src.getId()).block().getViewCount()).isEqualTo(1);

        FileRecord ownerView = access.openShared(src.getId(), "u1", "Ana").block();
        assertThat(ownerView.getId()).isEqualTo(src.getId());
    }

    @Test
    void concurrentDownloads_areAllCounted() {
        FileRecord src = upload("u1", "a.pdf");

        Flux.range(0, 50)
                .parallel(8)
                .runOn(Schedulers.boundedElastic())
                .flatMap(i -> access.recordDownload(src.getId()).thenReturn(i))
                .sequential()
                .blockLast();

        assertThat(files.findById(src.getId()).block().getDownloadCount()).isEqualTo(50);
    }

    @Test
    void expiredShare_hidesRecord_untilCleared() {
        FileRecord src = upload("u1", "a.pdf");
        expiry.setShareExpiry(src.getId(), "u1", 60).block();

        clock.advance(Duration.ofSeconds(61));

        StepVerifier.create(access.resolve(src.getId()))
                .expectError(NotFoundException.class)
                .verify();
    }

    @Test
    void legacyCode_resolves_andCountsOnRecordAndLink() {
        FileRecord src = upload("u1", "a.pdf");
        ShareLink link = legacyLinks.issueLegacyShareLink(src.getId(), "u1", 7).block();

        FileRecord resolved = access.resolve(link.getCode()).block();

        assertThat(resolved.getId()).isEqualTo(src.getId());
        assertThat(resolved.getDownloadCount()).isEqualTo(1);
        ShareLink after = mongo.findOne(Query.query(Criteria.where("code").is(link.getCode())), ShareLink.class).block();
        assertThat(after.getDownloadCount()).isEqualTo(1);
    }

    @Test
    void delete_keepsPayloadWhileACloneIsAlive_thenRemovesIt() {
        FileRecord src = upload("u1", "a.pdf");
        FileRecord clone = access.openShared(src.getId(), "u2", "Bea").block();

        DeleteResult first = deletes.delete(src.getId(), "u1").block();
        assertThat(first.remoteDeleted()).isFalse();
        assertThat(transport.deleted()).isEmpty();

        DeleteResult second = deletes.delete(clone.getId(), "u2").block();
        assertThat(second.remoteDeleted()).isTrue();
        assertThat(transport.deleted()).containsExactly(src.getTransportLocation());
    }

    @Test
    void concurrentDeletes_onlyOneSucceeds() {
        FileRecord src = upload("u1", "a.pdf");

        List<Boolean> outcomes = Flux.range(0, 5)
                .parallel(5)
                .runOn(Schedulers.boundedElastic())
                .flatMap(i -> deletes.delete(src.getId(), "u1")
                        .map(r -> true)
                        .onErrorResume(e -> Mono.just(false)))
                .sequential()
                .collectList()
                .block();

        assertThat(outcomes).containsOnlyOnce(true);
        assertThat(files.findById(src.getId()).block().isActive()).isFalse();
    }

    @Test
    void storageUsage_followsUploadsAndDeletes() {
        accounts.getOrCreateUser("u1", "ana", "Ana").block();
        FileRecord r = upload("u1", "a.pdf");
        accounts.adjustStorage("u1", r.getSizeBytes()).block();

        DeleteResult res = deletes.delete(r.getId(), "u1").block();
        UserRecord after = accounts.adjustStorage("u1", -res.sizeBytes()).block();

        assertThat(after.getStorageUsedBytes()).isZero();
    }
}
