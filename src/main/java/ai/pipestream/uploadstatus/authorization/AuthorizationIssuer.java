package ai.pipestream.uploadstatus.authorization;

import java.time.Duration;

/**
 * Issues upload credentials. Signing happens locally; the object store is not contacted.
 */
public interface AuthorizationIssuer {

    /**
     * @param objectKey target key in the configured bucket
     * @param operation the operation the credential is scoped to
     * @param ttl       how long the credential stays valid
     */
    UploadCredential issueCredential(String objectKey, UploadOperation operation, Duration ttl);
}
