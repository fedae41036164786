package ae.teletronics.custody.adapters.web.dto;

import ae.teletronics.custody.application.dto.ShareExpiry;

import java.time.Instant;

public record ShareExpiryResponse(String fileId, Instant expiresAt, boolean permanent) {
    public static ShareExpiryResponse from(ShareExpiry e) {
        return new ShareExpiryResponse(e.fileId(), e.expiresAt(), e.isPermanent());
    }
}
