package ae.teletronics.custody.domain;

import java.util.Locale;
import java.util.Set;

/**
 * Coarse payload category. Drives which transport call is used to re-host a blob
 * and whether media attributes (duration, dimensions) are meaningful.
 */
public enum FileKind {
    DOCUMENT, PHOTO, VIDEO, AUDIO, VOICE, ARCHIVE, OTHER;

    private static final Set<String> VIDEO_EXTS = Set.of("mp4", "avi", "mkv", "mov", "wmv", "flv", "webm", "m4v");
    private static final Set<String> AUDIO_EXTS = Set.of("mp3", "wav", "ogg", "flac", "aac", "m4a", "wma");
    private static final Set<String> IMAGE_EXTS = Set.of("jpg", "jpeg", "png", "gif", "bmp", "webp", "svg");
    private static final Set<String> DOC_EXTS = Set.of("pdf", "doc", "docx", "xls", "xlsx", "ppt", "pptx", "txt");
    private static final Set<String> ARCHIVE_EXTS = Set.of("zip", "rar", "7z", "tar", "gz");

    /** True for kinds that may carry duration/width/height. */
    public boolean isMedia() {
        return this == PHOTO || this == VIDEO || this == AUDIO || this == VOICE;
    }

    /**
     * Classifies a file by the extension of its name. Unknown or missing
     * extensions map to {@link #OTHER}.
     */
    public static FileKind fromFilename(String filename) {
        if (filename == null || filename.isBlank()) return OTHER;
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) return OTHER;
        String ext = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (VIDEO_EXTS.contains(ext)) return VIDEO;
        if (AUDIO_EXTS.contains(ext)) return AUDIO;
        if (IMAGE_EXTS.contains(ext)) return PHOTO;
        if (DOC_EXTS.contains(ext)) return DOCUMENT;
        if (ARCHIVE_EXTS.contains(ext)) return ARCHIVE;
        return OTHER;
    }

    /** Lenient parse used at the HTTP boundary; null for unknown values. */
    public static FileKind parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return FileKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException iae) {
            return null;
        }
    }
}
