package ai.pipestream.uploadstatus.authorization;

import java.net.URL;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A time-bounded, operation-scoped authorization to upload one object.
 * Opaque to this service apart from its expiry.
 *
 * @param url           pre-signed URL the client sends the bytes to
 * @param method        HTTP method the signature covers
 * @param signedHeaders headers the client must send unchanged
 * @param expiresAt     instant after which the store rejects the credential
 */
public record UploadCredential(URL url, String method, Map<String, List<String>> signedHeaders, Instant expiresAt) {

    public UploadCredential {
        signedHeaders = signedHeaders == null ? Map.of() : Map.copyOf(signedHeaders);
    }
}
