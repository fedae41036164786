package ae.teletronics.custody.application.dto;

/**
 * Outcome of a delete. {@code sizeBytes} is what the caller should debit from the
 * owner's storage usage; {@code remoteDeleted} tells whether the payload itself was removed.
 */
public record DeleteResult(String fileId, String ownerId, long sizeBytes, boolean remoteDeleted) {}
