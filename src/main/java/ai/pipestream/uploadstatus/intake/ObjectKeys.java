package ai.pipestream.uploadstatus.intake;

import ai.pipestream.uploadstatus.exception.InvalidUploadKeyException;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Resolves and validates upload object keys.
 */
final class ObjectKeys {

    /** S3 limit on key length, in UTF-8 bytes. */
    static final int MAX_KEY_BYTES = 1024;

    private ObjectKeys() {
    }

    /**
     * Returns the caller's key normalized, or a generated {@code <prefix>/<uuid>} key when none was given.
     *
     * @throws InvalidUploadKeyException if the key cannot be used as an upload target
     */
    static String resolve(String desiredKey, String keyPrefix) {
        if (desiredKey == null || desiredKey.isBlank()) {
            return generate(keyPrefix);
        }

        String key = desiredKey.trim();
        while (key.startsWith("/")) {
            key = key.substring(1);
        }
        if (key.isEmpty()) {
            throw new InvalidUploadKeyException(desiredKey, "key is empty");
        }
        if (key.indexOf('\\') >= 0) {
            throw new InvalidUploadKeyException(desiredKey, "backslashes are not allowed");
        }
        for (int i = 0; i < key.length(); i++) {
            if (Character.isISOControl(key.charAt(i))) {
                throw new InvalidUploadKeyException(desiredKey, "control characters are not allowed");
            }
        }
        for (String segment : key.split("/", -1)) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                throw new InvalidUploadKeyException(desiredKey, "empty or relative path segment");
            }
        }
        if (key.getBytes(StandardCharsets.UTF_8).length > MAX_KEY_BYTES) {
            throw new InvalidUploadKeyException(desiredKey, "longer than " + MAX_KEY_BYTES + " bytes");
        }
        return key;
    }

    private static String generate(String keyPrefix) {
        String prefix = keyPrefix == null ? "" : keyPrefix.trim();
        while (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        String id = UUID.randomUUID().toString();
        return prefix.isEmpty() ? id : prefix + "/" + id;
    }
}
