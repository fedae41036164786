package ae.teletronics.custody.config;

import ae.teletronics.custody.domain.FileKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Settings under the {@code custody} prefix. Bound once at startup and passed to
 * the components that need them.
 */
@ConfigurationProperties(prefix = "custody")
public record CustodyProperties(
        Transport transport,
        Upload upload,
        Listing listing,
        Share share,
        Set<String> adminIds
) {

    public CustodyProperties {
        transport = transport == null ? new Transport(null, null, 0L, null, null) : transport;
        upload = upload == null ? new Upload(0L, null) : upload;
        listing = listing == null ? new Listing(0, 0) : listing;
        share = share == null ? new Share(null) : share;
        adminIds = adminIds == null ? Set.of() : Set.copyOf(adminIds);
    }

    /** All defaults; handy for tests and tools. */
    public static CustodyProperties defaults() {
        return new CustodyProperties(null, null, null, null, null);
    }

    public boolean isAdmin(String userId) {
        return userId != null && adminIds.contains(userId);
    }

    /**
     * What to do with the remote payload when a record is deleted while other
     * records still point at the same transport message.
     */
    public enum DeletePolicy {
        /** Keep the payload while another active record references it. */
        SHARED_AWARE,
        /** Always delete the payload, even if clones still reference it. */
        ALWAYS
    }

    public record Transport(
            String botToken,
            String apiBaseUrl,
            long channelId,
            Duration timeout,
            DeletePolicy deletePolicy
    ) {
        public Transport {
            apiBaseUrl = (apiBaseUrl == null || apiBaseUrl.isBlank()) ? "https://api.telegram.org" : apiBaseUrl;
            timeout = (timeout == null || timeout.isZero() || timeout.isNegative()) ? Duration.ofSeconds(30) : timeout;
            deletePolicy = deletePolicy == null ? DeletePolicy.SHARED_AWARE : deletePolicy;
        }
    }

    public record Upload(long maxFileSizeMb, Set<FileKind> allowedKinds) {
        public Upload {
            maxFileSizeMb = maxFileSizeMb <= 0 ? 2000 : maxFileSizeMb;
            allowedKinds = (allowedKinds == null || allowedKinds.isEmpty())
                    ? EnumSet.allOf(FileKind.class)
                    : EnumSet.copyOf(allowedKinds);
        }

        public long maxFileSizeBytes() {
            return maxFileSizeMb * 1024L * 1024L;
        }
    }

    public record Listing(int defaultLimit, int maxLimit) {
        public Listing {
            defaultLimit = defaultLimit <= 0 ? 30 : defaultLimit;
            maxLimit = maxLimit <= 0 ? 200 : maxLimit;
        }
    }

    /** {@code baseUrl} is prefixed to a file id or legacy code to form a public share URL. */
    public record Share(String baseUrl) {
        public Share {
            baseUrl = (baseUrl == null || baseUrl.isBlank()) ? "/s/" : baseUrl;
        }
    }
}
