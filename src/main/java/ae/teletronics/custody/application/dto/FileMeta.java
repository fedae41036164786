package ae.teletronics.custody.application.dto;

import ae.teletronics.custody.domain.FileKind;

/**
 * Description of a payload that is already held by the blob transport.
 * Media attributes are optional and ignored for non-media kinds.
 */
public record FileMeta(
        String blobRef,
        String blobUniqueRef,
        String name,
        String mimeType,
        String extension,
        FileKind kind,
        long sizeBytes,
        Integer durationSeconds,
        Integer width,
        Integer height
) {}
