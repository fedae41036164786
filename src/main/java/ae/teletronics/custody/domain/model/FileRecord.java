package ae.teletronics.custody.domain.model;

import ae.teletronics.custody.domain.FileKind;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Objects;

/**
 * Mongo document describing one pointer to a blob held by the transport.
 * The bytes themselves never pass through this service.
 *
 * Records are never removed: deletion flips {@code active} and expiry is only
 * evaluated when reading (see {@link #isVisibleAt(Instant)}).
 * Several records may reference the same blob; each one has its own owner.
 */
@Document(collection = "files")
@CompoundIndexes({
        @CompoundIndex(name = "idx_owner_active_created", def = "{'ownerId': 1, 'active': 1, 'createdAt': -1}"),
        @CompoundIndex(name = "idx_transport_location",
                def = "{'transportLocation.channelId': 1, 'transportLocation.messageId': 1}")
})
public class FileRecord {

    /** Public opaque id (16 hex chars), embedded in share URLs. */
    @Id
    private String id;

    /** Transport handle used to re-send the payload. */
    private String blobRef;

    /** Content-stable transport identity; informational, not unique. */
    private String blobUniqueRef;

    private String name;
    private String mimeType;
    private String extension;
    private FileKind kind;

    private long sizeBytes;

    // media attributes, null for non-media kinds
    private Integer durationSeconds;
    private Integer width;
    private Integer height;

    private TransportLocation transportLocation;

    @Indexed(name = "idx_owner")
    private String ownerId;
    private String ownerDisplayName;

    private long downloadCount;
    private long viewCount;

    @Indexed(name = "idx_active")
    private boolean active = true;

    /** Null means the share never expires. */
    private Instant shareExpiresAt;

    private Instant createdAt;

    @Version
    private Long version;

    public FileRecord() { }

    /**
     * Visibility predicate shared by every read path: the record must be active and
     * its share must not have expired at {@code now}.
     */
    public boolean isVisibleAt(Instant now) {
        return active && (shareExpiresAt == null || shareExpiresAt.isAfter(now));
    }

    /**
     * Copy of this pointer for another owner: same transport and media metadata,
     * fresh identity, counters, expiry and creation time.
     */
    public FileRecord cloneFor(String newId, String newOwnerId, String newOwnerDisplayName, Instant now) {
        FileRecord c = new FileRecord();
        c.id = newId;
        c.blobRef = blobRef;
        c.blobUniqueRef = blobUniqueRef;
        c.name = name;
        c.mimeType = mimeType;
        c.extension = extension;
        c.kind = kind;
        c.sizeBytes = sizeBytes;
        c.durationSeconds = durationSeconds;
        c.width = width;
        c.height = height;
        c.transportLocation = transportLocation;
        c.ownerId = newOwnerId;
        c.ownerDisplayName = newOwnerDisplayName;
        c.active = true;
        c.createdAt = now;
        return c;
    }

    /* -------------------- Getters & setters -------------------- */

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getBlobRef() { return blobRef; }
    public void setBlobRef(String blobRef) { this.blobRef = blobRef; }

    public String getBlobUniqueRef() { return blobUniqueRef; }
    public void setBlobUniqueRef(String blobUniqueRef) { this.blobUniqueRef = blobUniqueRef; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getMimeType() { return mimeType; }
    public void setMimeType(String mimeType) { this.mimeType = mimeType; }

    public String getExtension() { return extension; }
    public void setExtension(String extension) { this.extension = extension; }

    public FileKind getKind() { return kind; }
    public void setKind(FileKind kind) { this.kind = kind; }

    public long getSizeBytes() { return sizeBytes; }
    public void setSizeBytes(long sizeBytes) { this.sizeBytes = sizeBytes; }

    public Integer getDurationSeconds() { return durationSeconds; }
    public void setDurationSeconds(Integer durationSeconds) { this.durationSeconds = durationSeconds; }

    public Integer getWidth() { return width; }
    public void setWidth(Integer width) { this.width = width; }

    public Integer getHeight() { return height; }
    public void setHeight(Integer height) { this.height = height; }

    public TransportLocation getTransportLocation() { return transportLocation; }
    public void setTransportLocation(TransportLocation transportLocation) { this.transportLocation = transportLocation; }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public String getOwnerDisplayName() { return ownerDisplayName; }
    public void setOwnerDisplayName(String ownerDisplayName) { this.ownerDisplayName = ownerDisplayName; }

    public long getDownloadCount() { return downloadCount; }
    public void setDownloadCount(long downloadCount) { this.downloadCount = downloadCount; }

    public long getViewCount() { return viewCount; }
    public void setViewCount(long viewCount) { this.viewCount = viewCount; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public Instant getShareExpiresAt() { return shareExpiresAt; }
    public void setShareExpiresAt(Instant shareExpiresAt) { this.shareExpiresAt = shareExpiresAt; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }

    /* -------------------- Equality by id -------------------- */

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileRecord)) return false;
        FileRecord that = (FileRecord) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() { return Objects.hash(id); }

    @Override
    public String toString() {
        return "FileRecord{" +
                "id='" + id + '\'' +
                ", ownerId='" + ownerId + '\'' +
                ", name='" + name + '\'' +
                ", kind=" + kind +
                ", sizeBytes=" + sizeBytes +
                ", active=" + active +
                ", shareExpiresAt=" + shareExpiresAt +
                ", transportLocation=" + transportLocation +
                '}';
    }
}
