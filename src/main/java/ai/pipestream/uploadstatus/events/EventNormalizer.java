package ai.pipestream.uploadstatus.events;

import ai.pipestream.uploadstatus.config.KeyScope;
import ai.pipestream.uploadstatus.config.UploadConfiguration;
import ai.pipestream.uploadstatus.exception.MalformedEventException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns raw storage notifications into {@link NormalizedEvent}s.
 * <p>
 * Understands three payload shapes:
 * <ul>
 *   <li>S3 event notifications ({@code {"Records": [...]}}), as sent by S3 and MinIO</li>
 *   <li>the S3 test event ({@code "Event": "s3:TestEvent"}), always discarded</li>
 *   <li>EventBridge envelopes ({@code "detail-type": "Object Created"})</li>
 * </ul>
 * An empty result means the message carried nothing to reconcile.
 * Holds no state between calls.
 */
@ApplicationScoped
public class EventNormalizer {

    private static final Logger LOG = Logger.getLogger(EventNormalizer.class);

    private static final String TEST_EVENT = "s3:TestEvent";
    private static final String EVENTBRIDGE_CREATED = "Object Created";
    private static final String EVENTBRIDGE_DELETED = "Object Deleted";

    @Inject
    ObjectMapper objectMapper;

    @Inject
    UploadConfiguration config;

    @Inject
    MeterRegistry registry;

    private Counter malformedRecordsSkipped;

    @PostConstruct
    void init() {
        malformedRecordsSkipped = Counter.builder("storage_notification_records_skipped_total")
                .description("Malformed records skipped inside otherwise valid notification batches")
                .register(registry);
    }

    /**
     * @param rawMessage notification payload as received from the queue
     * @return zero or more events to reconcile, in payload order
     * @throws MalformedEventException if the payload can never be parsed
     */
    public List<NormalizedEvent> normalize(String rawMessage) {
        if (rawMessage == null || rawMessage.isBlank()) {
            throw new MalformedEventException("empty notification payload");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(rawMessage);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("notification is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEventException("notification is not a JSON object");
        }

        if (TEST_EVENT.equals(root.path("Event").asText(null))) {
            LOG.debugf("Discarding S3 test event for bucket %s", root.path("Bucket").asText("?"));
            return List.of();
        }

        JsonNode records = root.get("Records");
        if (records != null) {
            if (!records.isArray()) {
                throw new MalformedEventException("'Records' is not an array");
            }
            return fromS3Records(records);
        }

        if (root.hasNonNull("detail-type")) {
            return fromEventBridge(root);
        }

        throw new MalformedEventException("unrecognised notification shape");
    }

    /**
     * A malformed record is skipped as long as another record in the batch parses;
     * a batch with nothing parseable fails as a whole.
     */
    private List<NormalizedEvent> fromS3Records(JsonNode records) {
        List<NormalizedEvent> events = new ArrayList<>(records.size());
        MalformedEventException firstFailure = null;
        int skipped = 0;
        for (JsonNode record : records) {
            try {
                fromS3Record(record).ifPresent(events::add);
            } catch (MalformedEventException e) {
                if (firstFailure == null) {
                    firstFailure = e;
                }
                skipped++;
            }
        }
        if (firstFailure != null) {
            if (skipped == records.size()) {
                throw firstFailure;
            }
            malformedRecordsSkipped.increment(skipped);
            LOG.warnf("Skipped %d of %d malformed records in notification batch, first: %s",
                    skipped, records.size(), firstFailure.getMessage());
        }
        return events;
    }

    private Optional<NormalizedEvent> fromS3Record(JsonNode record) {
        String eventName = record.path("eventName").asText(null);
        if (eventName == null) {
            throw new MalformedEventException("record without eventName");
        }

        JsonNode s3 = record.path("s3");
        String bucket = s3.path("bucket").path("name").asText(null);
        JsonNode object = s3.path("object");
        String encodedKey = object.path("key").asText(null);
        if (encodedKey == null || encodedKey.isEmpty()) {
            throw new MalformedEventException("record '" + eventName + "' has no s3.object.key");
        }
        String key = decodeKey(encodedKey);

        EventType type = classifyS3EventName(eventName);
        if (!accepts(type, bucket, key, eventName)) {
            return Optional.empty();
        }

        String sequencer = object.path("sequencer").asText(null);
        String rawEventId;
        if (sequencer != null && !sequencer.isBlank()) {
            rawEventId = bucket + "/" + key + "/" + sequencer;
        } else {
            String requestId = record.path("responseElements").path("x-amz-request-id").asText(null);
            rawEventId = requestId != null
                    ? requestId + ":" + eventName + ":" + key
                    : digest(record.toString());
        }

        return Optional.of(new NormalizedEvent(
                key,
                type,
                parseTime(record.path("eventTime").asText(null)),
                rawEventId,
                bucket,
                object.hasNonNull("size") ? object.get("size").asLong() : null,
                object.path("eTag").asText(null)));
    }

    private List<NormalizedEvent> fromEventBridge(JsonNode root) {
        String detailType = root.get("detail-type").asText();
        JsonNode detail = root.path("detail");
        String bucket = detail.path("bucket").path("name").asText(null);
        JsonNode object = detail.path("object");
        String key = object.path("key").asText(null);
        if (key == null || key.isEmpty()) {
            throw new MalformedEventException("EventBridge '" + detailType + "' event has no detail.object.key");
        }

        EventType type = switch (detailType) {
            case EVENTBRIDGE_CREATED -> EventType.CREATED;
            case EVENTBRIDGE_DELETED -> EventType.REMOVED;
            default -> EventType.UNKNOWN;
        };
        if (!accepts(type, bucket, key, detailType)) {
            return List.of();
        }

        String rawEventId = root.path("id").asText(null);
        if (rawEventId == null || rawEventId.isBlank()) {
            rawEventId = digest(root.toString());
        }

        return List.of(new NormalizedEvent(
                key,
                type,
                parseTime(root.path("time").asText(null)),
                rawEventId,
                bucket,
                object.hasNonNull("size") ? object.get("size").asLong() : null,
                object.path("etag").asText(null)));
    }

    private boolean accepts(EventType type, String bucket, String key, String eventName) {
        if (type == EventType.UNKNOWN) {
            LOG.debugf("Discarding non-upload event %s for key %s", eventName, key);
            return false;
        }
        Optional<String> expectedBucket = config.events().bucket();
        if (expectedBucket.isPresent() && !expectedBucket.get().equals(bucket)) {
            LOG.debugf("Discarding %s for foreign bucket %s", eventName, bucket);
            return false;
        }
        if (!KeyScope.covers(config.events(), key)) {
            LOG.debugf("Discarding %s for key %s outside configured prefixes", eventName, key);
            return false;
        }
        return true;
    }

    /**
     * S3 names look like {@code ObjectCreated:Put}; MinIO prefixes them with {@code s3:}.
     */
    static EventType classifyS3EventName(String eventName) {
        String name = eventName.startsWith("s3:") ? eventName.substring(3) : eventName;
        if (name.startsWith("ObjectCreated:")) {
            return EventType.CREATED;
        }
        if (name.startsWith("ObjectRemoved:")) {
            return EventType.REMOVED;
        }
        return EventType.UNKNOWN;
    }

    /**
     * S3 notification keys are form-encoded: spaces arrive as '+'.
     */
    static String decodeKey(String encodedKey) {
        try {
            return URLDecoder.decode(encodedKey, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new MalformedEventException("object key is not URL-encoded: " + encodedKey, e);
        }
    }

    private static Instant parseTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            LOG.debugf("Ignoring unparseable provider timestamp '%s'", value);
            return null;
        }
    }

    private static String digest(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 32);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is always available
            return UUID.nameUUIDFromBytes(input.getBytes(StandardCharsets.UTF_8)).toString();
        }
    }
}
