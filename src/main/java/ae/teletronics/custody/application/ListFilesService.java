package ae.teletronics.custody.application;

import ae.teletronics.custody.application.dto.FileSummary;
import ae.teletronics.custody.config.CustodyProperties;
import ae.teletronics.custody.ports.FileRecordQueryPort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

@Service
public class ListFilesService {

    private final FileRecordQueryPort files;
    private final CustodyProperties props;

    public ListFilesService(FileRecordQueryPort files, CustodyProperties props) {
        this.files = files;
        this.props = props;
    }

    /**
     * Active files of {@code ownerId}, newest first. Expired shares are still
     * listed: expiry hides a file from others, not from its owner.
     */
    public Flux<FileSummary> listOwned(String ownerId, int limit) {
        return files.findActiveByOwner(ownerId, effectiveLimit(limit))
                .map(FileSummary::from);
    }

    // ---- helpers ----

    int effectiveLimit(int requested) {
        CustodyProperties.Listing listing = props.listing();
        if (requested <= 0) return listing.defaultLimit();
        return Math.min(requested, listing.maxLimit());
    }
}
