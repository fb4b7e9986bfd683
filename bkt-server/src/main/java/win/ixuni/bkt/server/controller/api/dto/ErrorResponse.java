package win.ixuni.bkt.server.controller.api.dto;

public record ErrorResponse(String error, String message) {
}
