package ai.pipestream.uploadstatus.http;

/**
 * Body of {@code POST /uploads}. A missing or blank key asks the service to generate one.
 */
public record UploadRequest(String objectKey) {
}
