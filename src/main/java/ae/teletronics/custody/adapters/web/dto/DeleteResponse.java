package ae.teletronics.custody.adapters.web.dto;

public record DeleteResponse(String fileId, long freedBytes, boolean remoteDeleted, long storageUsedBytes) {}
