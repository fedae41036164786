package ae.teletronics.custody.adapters.web.dto;

/** {@code 0} makes the share permanent. */
public record ShareExpiryRequest(Long durationSeconds) {}
