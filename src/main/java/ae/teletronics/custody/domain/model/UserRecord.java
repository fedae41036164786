package ae.teletronics.custody.domain.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Objects;

/**
 * Account known to the service. Created lazily on first interaction; the id is the
 * external identity of the account.
 */
@Document(collection = "users")
public class UserRecord {

    @Id
    private String id;

    private String username;
    private String displayName;

    private boolean admin;
    private boolean banned;

    /** Aggregate bytes of the user's active uploads. Never negative. */
    private long storageUsedBytes;

    private Instant createdAt;

    public UserRecord() {}

    public UserRecord(String id, String username, String displayName) {
        this.id = id;
        this.username = username;
        this.displayName = displayName;
    }

    /** Name shown to other users: display name, then username, then a synthetic label. */
    public String preferredName() {
        if (displayName != null && !displayName.isBlank()) return displayName;
        if (username != null && !username.isBlank()) return username;
        return "User_" + id;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    public boolean isAdmin() { return admin; }
    public void setAdmin(boolean admin) { this.admin = admin; }

    public boolean isBanned() { return banned; }
    public void setBanned(boolean banned) { this.banned = banned; }

    public long getStorageUsedBytes() { return storageUsedBytes; }
    public void setStorageUsedBytes(long storageUsedBytes) { this.storageUsedBytes = storageUsedBytes; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserRecord)) return false;
        UserRecord that = (UserRecord) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() { return Objects.hash(id); }

    @Override
    public String toString() {
        return "UserRecord{" +
                "id='" + id + '\'' +
                ", username='" + username + '\'' +
                ", admin=" + admin +
                ", banned=" + banned +
                ", storageUsedBytes=" + storageUsedBytes +
                '}';
    }
}
