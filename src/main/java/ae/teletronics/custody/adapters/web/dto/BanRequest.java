package ae.teletronics.custody.adapters.web.dto;

public record BanRequest(Boolean banned) {}
