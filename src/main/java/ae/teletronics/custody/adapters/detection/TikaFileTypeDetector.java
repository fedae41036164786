package ae.teletronics.custody.adapters.detection;

import ae.teletronics.custody.ports.FileTypeDetector;
import org.apache.tika.Tika;
import org.apache.tika.mime.MimeType;
import org.apache.tika.mime.MimeTypeException;
import org.apache.tika.mime.MimeTypes;

import java.util.Optional;

/**
 * Apache Tika-based file type detector. Works from the file name only: the
 * payload stays in the blob transport and is never read here.
 */
public class TikaFileTypeDetector implements FileTypeDetector {

    private static final String UNKNOWN = "application/octet-stream";

    private final Tika tika;
    private final MimeTypes mimeTypes;

    public TikaFileTypeDetector() {
        this.tika = new Tika();
        this.mimeTypes = MimeTypes.getDefaultMimeTypes();
    }

    @Override
    public Optional<String> detectMimeType(String filenameHint) {
        if (filenameHint == null || filenameHint.isBlank()) {
            return Optional.empty();
        }
        String detected = tika.detect(filenameHint);
        // Tika falls back to octet-stream for names it does not know
        if (detected == null || UNKNOWN.equals(detected)) {
            return Optional.empty();
        }
        return Optional.of(detected);
    }

    @Override
    public Optional<String> extensionFor(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return Optional.empty();
        }
        try {
            MimeType type = mimeTypes.forName(mimeType);
            String ext = type.getExtension();
            if (ext == null || ext.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(ext.startsWith(".") ? ext.substring(1) : ext);
        } catch (MimeTypeException e) {
            return Optional.empty();
        }
    }
}
