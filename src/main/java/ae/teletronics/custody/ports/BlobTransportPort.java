package ae.teletronics.custody.ports;

import ae.teletronics.custody.domain.FileKind;
import ae.teletronics.custody.domain.model.TransportLocation;

import java.util.Objects;

import reactor.core.publisher.Mono;

/**
 * Remote store that keeps the payloads (a messaging channel used as blob storage).
 * The service only ever hands it opaque handles; bytes never flow through here.
 */
public interface BlobTransportPort {

    /**
     * Re-hosts the payload behind {@code rawHandle} in the custody store.
     * Errors with a TransportException when delivery fails.
     */
    Mono<StoredBlob> store(FileKind kind, String rawHandle, String caption);

    /**
     * Removes the payload at {@code location}. Emits false when the remote side
     * refused (for example because the message is already gone).
     */
    Mono<Boolean> delete(TransportLocation location);

    /**
     * Stable reference to a stored payload plus the message that carries it.
     */
    record StoredBlob(String blobRef, String blobUniqueRef, TransportLocation location) {
        public StoredBlob {
            Objects.requireNonNull(blobRef, "blobRef");
            Objects.requireNonNull(location, "location");
            blobUniqueRef = blobUniqueRef == null ? "" : blobUniqueRef;
        }
    }
}
