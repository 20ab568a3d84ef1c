package ai.pipestream.uploadstatus.http;

public record ErrorResponse(String code, String message) {
}
