package ai.pipestream.uploadstatus.s3;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

/**
 * Object store settings used to sign upload credentials.
 * <p>
 * The service never moves bytes itself; clients upload straight to the bucket.
 */
@ConfigMapping(prefix = "object-store")
public interface S3Config {

    /**
     * Endpoint override for S3-compatible stores such as MinIO. Unset uses AWS.
     */
    Optional<String> endpoint();

    @WithDefault("us-east-1")
    String region();

    String accessKey();

    String secretKey();

    String bucket();

    /**
     * Whether to use path-style access (required for most MinIO setups).
     */
    @WithDefault("true")
    boolean pathStyleAccess();
}
