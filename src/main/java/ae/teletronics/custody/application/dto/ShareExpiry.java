package ae.teletronics.custody.application.dto;

import java.time.Instant;

/** Effective share expiry after an update; {@code expiresAt == null} means permanent. */
public record ShareExpiry(String fileId, Instant expiresAt) {
    public boolean isPermanent() {
        return expiresAt == null;
    }
}
