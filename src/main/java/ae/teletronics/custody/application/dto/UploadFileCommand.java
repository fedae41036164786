package ae.teletronics.custody.application.dto;

import ae.teletronics.custody.domain.FileKind;

/**
 * A payload received by the front-end, identified by the handle the messaging
 * backend gave it. Nothing has been stored in custody yet.
 */
public record UploadFileCommand(
        String ownerId,
        String ownerDisplayName,
        FileKind kind,
        String rawHandle,
        String name,          // may be null, a default per kind is used
        String mimeType,      // may be null, detected from the name
        long sizeBytes,
        Integer durationSeconds,
        Integer width,
        Integer height
) {}
