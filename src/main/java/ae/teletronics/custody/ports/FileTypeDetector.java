package ae.teletronics.custody.ports;

import java.util.Optional;

/**
 * Fills in media type and extension when the front-end could not supply them.
 */
public interface FileTypeDetector {

    /**
     * @param filenameHint  file name as shown to the user (extension is what matters)
     * @return Optional content type (RFC 2046, e.g., "application/pdf")
     */
    Optional<String> detectMimeType(String filenameHint);

    /**
     * Preferred extension (without dot) for a media type, e.g. "pdf" for "application/pdf".
     */
    Optional<String> extensionFor(String mimeType);
}
