package ae.teletronics.custody.adapters.web.dto;

public record LegacyLinkRequest(Integer days) {}
