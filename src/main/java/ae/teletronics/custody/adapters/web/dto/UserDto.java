package ae.teletronics.custody.adapters.web.dto;

import ae.teletronics.custody.domain.model.UserRecord;

import java.time.Instant;

public record UserDto(
        String id,
        String username,
        String displayName,
        boolean admin,
        boolean banned,
        long storageUsedBytes,
        Instant createdAt
) {
    public static UserDto from(UserRecord u) {
        return new UserDto(u.getId(), u.getUsername(), u.getDisplayName(), u.isAdmin(), u.isBanned(),
                u.getStorageUsedBytes(), u.getCreatedAt());
    }
}
