package ae.teletronics.custody.adapters.web.dto;

import java.time.Instant;

public record LegacyLinkResponse(String code, String fileId, Instant expiresAt, String shareUrl) {}
