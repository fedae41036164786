package ae.teletronics.custody.adapters.web.dto;

public record ErrorResponse(String code, String message) {}
