package ae.teletronics.custody.application;

import ae.teletronics.custody.adapters.detection.TikaFileTypeDetector;
import ae.teletronics.custody.application.dto.DeleteResult;
import ae.teletronics.custody.application.dto.FileMeta;
import ae.teletronics.custody.application.dto.FileSummary;
import ae.teletronics.custody.application.dto.UploadFileCommand;
import ae.teletronics.custody.application.exceptions.ForbiddenOperationException;
import ae.teletronics.custody.application.exceptions.NotFoundException;
import ae.teletronics.custody.config.CustodyProperties;
import ae.teletronics.custody.domain.FileKind;
import ae.teletronics.custody.domain.model.FileRecord;
import ae.teletronics.custody.domain.model.ShareLink;
import ae.teletronics.custody.domain.model.TransportLocation;
import ae.teletronics.custody.support.InMemoryFileRecordPort;
import ae.teletronics.custody.support.InMemoryShareLinkPort;
import ae.teletronics.custody.support.MutableClock;
import ae.teletronics.custody.support.RecordingBlobTransport;
import ae.teletronics.custody.support.TestTransactions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Engine services wired together over in-memory stores, exercised through the
 * scenarios the service has to support end to end.
 */
class CustodyEngineScenarioTest {

    static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    MutableClock clock;
    InMemoryFileRecordPort files;
    InMemoryShareLinkPort links;
    RecordingBlobTransport transport;
    TransactionalOperator tx;

    UploadFileService uploads;
    FileAccessService access;
    ShareExpiryService expiry;
    DeleteFileService deletes;
    ListFilesService listing;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        files = new InMemoryFileRecordPort();
        links = new InMemoryShareLinkPort();
        transport = new RecordingBlobTransport();
        tx = TestTransactions.passThrough();
        wire(CustodyProperties.defaults());
    }

    private void wire(CustodyProperties props) {
        uploads = new UploadFileService(files, transport, new TikaFileTypeDetector(), clock, tx, props);
        access = new FileAccessService(files, links, clock, tx);
        expiry = new ShareExpiryService(files, clock, tx);
        deletes = new DeleteFileService(files, transport, tx, props);
        listing = new ListFilesService(files, props);
    }

    private static FileMeta meta(String name, long size) {
        return new FileMeta("blob-" + name, "uniq-" + name, name, "application/pdf", "pdf",
                FileKind.DOCUMENT, size, null, null, null);
    }

    private String register(String owner, String name, long size, long messageId) {
        return uploads.registerUpload(meta(name, size),
                new TransportLocation(RecordingBlobTransport.CHANNEL_ID, messageId), owner, "Name " + owner).block();
    }

    // -- properties ---------------------------------------------------------------

    @Test
    void register_thenResolve_returnsSameMetadata_zeroCounters_active() {
        String id = register("A", "report.pdf", 1234, 10);

        FileRecord r = access.resolve(id).block();

        assertThat(r).isNotNull();
        assertThat(r.getId()).isEqualTo(id).hasSize(16);
        assertThat(r.getName()).isEqualTo("report.pdf");
        assertThat(r.getSizeBytes()).isEqualTo(1234);
        assertThat(r.getKind()).isEqualTo(FileKind.DOCUMENT);
        assertThat(r.getOwnerId()).isEqualTo("A");
        assertThat(r.getDownloadCount()).isZero();
        assertThat(r.getViewCount()).isZero();
        assertThat(r.isActive()).isTrue();
        assertThat(r.getShareExpiresAt()).isNull();
        assertThat(r.getCreatedAt()).isEqualTo(T0);
    }

    @Test
    void ownerDelete_hidesRecord_butStoreStillHoldsIt() {
        String id = register("A", "a.pdf", 10, 11);

        DeleteResult res = deletes.delete(id, "A").block();

        assertThat(res).isNotNull();
        assertThat(res.sizeBytes()).isEqualTo(10);
        assertThatThrownBy(() -> access.resolve(id).block()).isInstanceOf(NotFoundException.class);
        assertThat(files.raw(id)).isNotNull();
        assertThat(files.raw(id).isActive()).isFalse();
    }

    @Test
    void shareExpiry_ofOneSecond_hidesRecordOnceTheInstantPasses() {
        String id = register("A", "a.pdf", 10, 12);

        var se = expiry.setShareExpiry(id, "A", 1).block();
        assertThat(se.expiresAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(access.resolve(id).block()).isNotNull();

        clock.advance(Duration.ofSeconds(1));

        assertThatThrownBy(() -> access.resolve(id).block()).isInstanceOf(NotFoundException.class);
        // hidden, not deleted
        assertThat(files.raw(id).isActive()).isTrue();
    }

    @Test
    void shareExpiry_zero_clearsAPreviousExpiry() {
        String id = register("A", "a.pdf", 10, 13);
        expiry.setShareExpiry(id, "A", 60).block();

        var se = expiry.setShareExpiry(id, "A", 0).block();

        assertThat(se.isPermanent()).isTrue();
        clock.advance(Duration.ofDays(365));
        assertThat(access.resolve(id).block()).isNotNull();
    }

    @Test
    void transferOnAccess_byNonOwner_createsIndependentClone() {
        String f1 = register("A", "photo-album.zip", 999, 14);

        String f2 = access.transferOnAccess(f1, "B", "Bea").block();

        assertThat(f2).isNotEqualTo(f1);
        FileRecord clone = files.raw(f2);
        FileRecord original = files.raw(f1);
        assertThat(clone.getOwnerId()).isEqualTo("B");
        assertThat(clone.getOwnerDisplayName()).isEqualTo("Bea");
        assertThat(clone.getName()).isEqualTo(original.getName());
        assertThat(clone.getSizeBytes()).isEqualTo(original.getSizeBytes());
        assertThat(clone.getKind()).isEqualTo(original.getKind());
        assertThat(clone.getTransportLocation()).isEqualTo(original.getTransportLocation());
        assertThat(original.getOwnerId()).isEqualTo("A");

        // deleting the clone leaves the original alone
        deletes.delete(f2, "B").block();
        assertThat(access.resolve(f1).block()).isNotNull();
    }

    @Test
    void transferOnAccess_byOwner_returnsSameId_withoutCopy() {
        String f1 = register("A", "a.pdf", 10, 15);

        assertThat(access.transferOnAccess(f1, "A", "Ann").block()).isEqualTo(f1);
        assertThat(files.size()).isEqualTo(1);
    }

    @Test
    void nonOwnerDelete_isForbidden_andRecordUnchanged() {
        String id = register("A", "a.pdf", 10, 16);
        FileRecord before = files.raw(id);

        assertThatThrownBy(() -> deletes.delete(id, "B").block())
                .isInstanceOf(ForbiddenOperationException.class);

        FileRecord after = files.raw(id);
        assertThat(after.isActive()).isTrue();
        assertThat(after.getVersion()).isEqualTo(before.getVersion());
        assertThat(transport.deleted()).isEmpty();
    }

    @Test
    void ownerDeletesOriginal_afterTransfer_cloneSurvives_andPayloadIsKept() {
        String f1 = register("A", "movie.mp4", 5000, 17);
        String f2 = access.transferOnAccess(f1, "B", "Bea").block();

        DeleteResult res = deletes.delete(f1, "A").block();

        assertThatThrownBy(() -> access.resolve(f1).block()).isInstanceOf(NotFoundException.class);
        assertThat(access.resolve(f2).block().getOwnerId()).isEqualTo("B");
        // the clone still points at the message, so it is not removed remotely
        assertThat(res.remoteDeleted()).isFalse();
        assertThat(transport.deleted()).isEmpty();

        DeleteResult last = deletes.delete(f2, "B").block();
        assertThat(last.remoteDeleted()).isTrue();
        assertThat(transport.deleted())
                .containsExactly(new TransportLocation(RecordingBlobTransport.CHANNEL_ID, 17));
    }

    @Test
    void alwaysPolicy_removesPayload_evenWhileACloneReferencesIt() {
        wire(new CustodyProperties(
                new CustodyProperties.Transport(null, null, 0, null, CustodyProperties.DeletePolicy.ALWAYS),
                null, null, null, null));
        String f1 = register("A", "movie.mp4", 5000, 18);
        access.transferOnAccess(f1, "B", "Bea").block();

        DeleteResult res = deletes.delete(f1, "A").block();

        assertThat(res.remoteDeleted()).isTrue();
        assertThat(transport.deleted()).hasSize(1);
    }

    @Test
    void remoteDeleteFailure_isSwallowed_softDeleteStands() {
        String id = register("A", "a.pdf", 10, 19);
        transport.failDeletesWith(new IllegalStateException("channel unreachable"));

        DeleteResult res = deletes.delete(id, "A").block();

        assertThat(res.remoteDeleted()).isFalse();
        assertThat(files.raw(id).isActive()).isFalse();
    }

    @Test
    void legacyCode_resolvesToTarget_andCountsOneDownloadPerResolve() {
        String f3 = register("A", "old.pdf", 10, 20);
        links.insert(new ShareLink("ab12cd34", f3, "A", null, T0)).block();

        FileRecord first = access.resolve("ab12cd34").block();
        FileRecord second = access.resolve("ab12cd34").block();

        assertThat(first.getId()).isEqualTo(f3);
        assertThat(first.getDownloadCount()).isEqualTo(1);
        assertThat(second.getDownloadCount()).isEqualTo(2);
        assertThat(files.raw(f3).getDownloadCount()).isEqualTo(2);
        assertThat(links.raw("ab12cd34").getDownloadCount()).isEqualTo(2);
    }

    @Test
    void legacyCode_pointingAtDeletedFile_isNotFound_andCountsNothing() {
        String f3 = register("A", "old.pdf", 10, 21);
        links.insert(new ShareLink("zz99yy88", f3, "A", null, T0)).block();
        deletes.delete(f3, "A").block();

        assertThatThrownBy(() -> access.resolve("zz99yy88").block()).isInstanceOf(NotFoundException.class);
        assertThat(files.raw(f3).getDownloadCount()).isZero();
        assertThat(links.raw("zz99yy88").getDownloadCount()).isZero();
    }

    @Test
    void directResolve_hasNoSideEffects() {
        String id = register("A", "a.pdf", 10, 22);

        access.resolve(id).block();
        access.resolve(id).block();

        assertThat(files.raw(id).getDownloadCount()).isZero();
        assertThat(files.raw(id).getViewCount()).isZero();
    }

    @Test
    void concurrentViews_areNeverLost() {
        String id = register("A", "a.pdf", 10, 23);
        int n = 200;

        Flux.range(0, n)
                .parallel(8)
                .runOn(Schedulers.parallel())
                .flatMap(i -> access.recordView(id))
                .sequential()
                .blockLast();

        assertThat(files.raw(id).getViewCount()).isEqualTo(n);
    }

    @Test
    void recordDownload_onExpiredRecord_isNotFound() {
        String id = register("A", "a.pdf", 10, 24);
        expiry.setShareExpiry(id, "A", 5).block();
        clock.advance(Duration.ofSeconds(6));

        StepVerifier.create(access.recordDownload(id))
                .expectError(NotFoundException.class)
                .verify();
        assertThat(files.raw(id).getDownloadCount()).isZero();
    }

    @Test
    void openShared_byOtherUser_countsViewOnSource_andReturnsOwnCopy() {
        String f1 = register("A", "a.pdf", 10, 25);

        FileRecord mine = access.openShared(f1, "B", "Bea").block();

        assertThat(mine.getId()).isNotEqualTo(f1);
        assertThat(mine.getOwnerId()).isEqualTo("B");
        assertThat(mine.getViewCount()).isZero();
        assertThat(files.raw(f1).getViewCount()).isEqualTo(1);
    }

    @Test
    void openShared_byOwner_returnsOwnRecordWithViewCounted() {
        String f1 = register("A", "a.pdf", 10, 26);

        FileRecord mine = access.openShared(f1, "A", "Ann").block();

        assertThat(mine.getId()).isEqualTo(f1);
        assertThat(mine.getViewCount()).isEqualTo(1);
    }

    @Test
    void listOwned_newestFirst_skipsDeleted_andHonoursLimit() {
        String a = register("A", "1.pdf", 1, 30);
        clock.advance(Duration.ofMinutes(1));
        String b = register("A", "2.pdf", 2, 31);
        clock.advance(Duration.ofMinutes(1));
        String c = register("A", "3.pdf", 3, 32);
        register("B", "other.pdf", 4, 33);
        deletes.delete(b, "A").block();

        List<String> all = listing.listOwned("A", 0).map(FileSummary::id).collectList().block();
        List<String> top = listing.listOwned("A", 1).map(FileSummary::id).collectList().block();

        assertThat(all).containsExactly(c, a);
        assertThat(top).containsExactly(c);
    }

    @Test
    void upload_storesThroughTransport_thenRegisters() {
        var cmd = new UploadFileCommand(
                "A", "Ann", FileKind.PHOTO, "raw-1", null, null, 2048, 3, 640, 480);

        FileRecord saved = uploads.upload(cmd).block();

        assertThat(transport.storedHandles()).containsExactly("raw-1");
        assertThat(saved.getBlobRef()).isEqualTo("stored-raw-1");
        assertThat(saved.getName()).isEqualTo("photo.jpg");
        assertThat(saved.getMimeType()).isEqualTo("image/jpeg");
        assertThat(saved.getExtension()).isEqualTo("jpg");
        assertThat(saved.getWidth()).isEqualTo(640);
        assertThat(access.resolve(saved.getId()).block()).isNotNull();
    }
}
