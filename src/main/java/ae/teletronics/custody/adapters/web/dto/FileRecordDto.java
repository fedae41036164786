package ae.teletronics.custody.adapters.web.dto;

import ae.teletronics.custody.domain.FileKind;
import ae.teletronics.custody.domain.model.FileRecord;

import java.time.Instant;

public record FileRecordDto(
        String id,
        String name,
        String mimeType,
        String extension,
        FileKind kind,
        long sizeBytes,
        Integer durationSeconds,
        Integer width,
        Integer height,
        String ownerId,
        String ownerDisplayName,
        long downloadCount,
        long viewCount,
        Instant shareExpiresAt,
        Instant createdAt,
        String shareUrl
) {
    public static FileRecordDto from(FileRecord r, String shareUrl) {
        return new FileRecordDto(
                r.getId(),
                r.getName(),
                r.getMimeType(),
                r.getExtension(),
                r.getKind(),
                r.getSizeBytes(),
                r.getDurationSeconds(),
                r.getWidth(),
                r.getHeight(),
                r.getOwnerId(),
                r.getOwnerDisplayName(),
                r.getDownloadCount(),
                r.getViewCount(),
                r.getShareExpiresAt(),
                r.getCreatedAt(),
                shareUrl
        );
    }
}
