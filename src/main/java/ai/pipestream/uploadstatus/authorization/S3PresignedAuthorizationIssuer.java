package ai.pipestream.uploadstatus.authorization;

import ai.pipestream.uploadstatus.s3.S3Config;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.PresignedPutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;

import java.time.Duration;

/**
 * Issues pre-signed S3 PUT URLs for the configured bucket.
 */
@ApplicationScoped
public class S3PresignedAuthorizationIssuer implements AuthorizationIssuer {

    private static final Logger LOG = Logger.getLogger(S3PresignedAuthorizationIssuer.class);

    @Inject
    S3Presigner presigner;

    @Inject
    S3Config s3Config;

    @Override
    public UploadCredential issueCredential(String objectKey, UploadOperation operation, Duration ttl) {
        if (operation != UploadOperation.PUT_OBJECT) {
            throw new IllegalArgumentException("Unsupported upload operation: " + operation);
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }

        PutObjectPresignRequest request = PutObjectPresignRequest.builder()
                .signatureDuration(ttl)
                .putObjectRequest(PutObjectRequest.builder()
                        .bucket(s3Config.bucket())
                        .key(objectKey)
                        .build())
                .build();

        PresignedPutObjectRequest presigned = presigner.presignPutObject(request);

        LOG.debugf("Issued PUT credential for s3://%s/%s (expires=%s)",
                s3Config.bucket(), objectKey, presigned.expiration());

        return new UploadCredential(
                presigned.url(),
                presigned.httpRequest().method().name(),
                presigned.signedHeaders(),
                presigned.expiration());
    }
}
