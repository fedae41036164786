package ae.teletronics.custody.application.dto;

import ae.teletronics.custody.domain.FileKind;
import ae.teletronics.custody.domain.model.FileRecord;

import java.time.Instant;

public record FileSummary(
        String id,
        String name,
        FileKind kind,
        long sizeBytes,
        long downloadCount,
        Instant createdAt
) {
    public static FileSummary from(FileRecord r) {
        return new FileSummary(r.getId(), r.getName(), r.getKind(), r.getSizeBytes(),
                r.getDownloadCount(), r.getCreatedAt());
    }
}
