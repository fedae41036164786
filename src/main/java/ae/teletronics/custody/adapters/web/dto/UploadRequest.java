package ae.teletronics.custody.adapters.web.dto;

/**
 * Payload already received by the messaging front-end; {@code rawHandle} is the
 * handle it was given there. {@code kind} may be omitted, it is then derived from the name.
 */
public record UploadRequest(
        String kind,
        String rawHandle,
        String name,
        String mimeType,
        Long sizeBytes,
        Integer durationSeconds,
        Integer width,
        Integer height
) {}
