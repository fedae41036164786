package ae.teletronics.custody.adapters.web.dto;

import ae.teletronics.custody.application.dto.FileSummary;
import ae.teletronics.custody.domain.FileKind;

import java.time.Instant;

public record FileSummaryDto(
        String id,
        String name,
        FileKind kind,
        long sizeBytes,
        long downloadCount,
        Instant createdAt,
        String shareUrl
) {
    public static FileSummaryDto from(FileSummary s, String shareUrl) {
        return new FileSummaryDto(s.id(), s.name(), s.kind(), s.sizeBytes(), s.downloadCount(), s.createdAt(), shareUrl);
    }
}
