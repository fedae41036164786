package ae.teletronics.custody.domain.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Objects;

/**
 * Old-style share code mapping to a {@link FileRecord} id.
 * New shares use the record id directly; these codes must keep resolving.
 * Expiry is checked on read, there is no TTL index.
 */
@Document(collection = "share_links")
public class ShareLink {

    @Id
    private String id;

    /** Short public code (8 lowercase alphanumerics). */
    @Indexed(name = "uniq_code", unique = true)
    private String code;

    @Indexed(name = "idx_file")
    private String fileId;

    private String creatorId;

    /** Resolutions through this code. */
    private long downloadCount;

    private boolean active = true;

    /** Optional expiry; null means the code never expires. */
    private Instant expiresAt;

    private Instant createdAt;

    public ShareLink() {}

    public ShareLink(String code, String fileId, String creatorId, Instant expiresAt, Instant createdAt) {
        this.code = code;
        this.fileId = fileId;
        this.creatorId = creatorId;
        this.expiresAt = expiresAt;
        this.createdAt = createdAt;
    }

    public boolean isUsableAt(Instant now) {
        return active && (expiresAt == null || expiresAt.isAfter(now));
    }

    // Getters/setters

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }

    public String getFileId() { return fileId; }
    public void setFileId(String fileId) { this.fileId = fileId; }

    public String getCreatorId() { return creatorId; }
    public void setCreatorId(String creatorId) { this.creatorId = creatorId; }

    public long getDownloadCount() { return downloadCount; }
    public void setDownloadCount(long downloadCount) { this.downloadCount = downloadCount; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShareLink)) return false;
        ShareLink that = (ShareLink) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() { return Objects.hash(id); }

    @Override
    public String toString() {
        return "ShareLink{" +
                "code='" + code + '\'' +
                ", fileId='" + fileId + '\'' +
                ", creatorId='" + creatorId + '\'' +
                ", active=" + active +
                ", expiresAt=" + expiresAt +
                ", downloadCount=" + downloadCount +
                '}';
    }
}
