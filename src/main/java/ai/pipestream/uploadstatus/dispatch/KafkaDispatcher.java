package ai.pipestream.uploadstatus.dispatch;

import ai.pipestream.uploadstatus.config.UploadConfiguration;
import ai.pipestream.uploadstatus.exception.DispatchException;
import ai.pipestream.uploadstatus.model.UploadRecord;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.MutinyEmitter;
import io.smallrye.reactive.messaging.kafka.api.OutgoingKafkaRecordMetadata;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;

/**
 * Publishes downstream actions to Kafka, one topic per action.
 * <p>
 * Messages are keyed by record id so every action for an upload lands on one partition.
 * The returned {@link Uni} completes when the broker acknowledges the write.
 */
@ApplicationScoped
public class KafkaDispatcher implements Dispatcher {

    private static final Logger LOG = Logger.getLogger(KafkaDispatcher.class);

    @Inject
    @Channel("upload-actions-out")
    MutinyEmitter<DownstreamActionMessage> emitter;

    @Inject
    UploadConfiguration config;

    @Override
    public Uni<Void> dispatch(String action, UploadRecord record) {
        DownstreamActionMessage payload = new DownstreamActionMessage(
                Dispatcher.dispatchId(record.id(), action),
                action,
                record.id(),
                record.objectKey(),
                record.uploadedAt(),
                record.sizeBytes());

        String topic = config.dispatch().topicPrefix() + action;
        OutgoingKafkaRecordMetadata<String> metadata = OutgoingKafkaRecordMetadata.<String>builder()
                .withKey(record.id().toString())
                .withTopic(topic)
                .build();

        LOG.debugf("Dispatching action=%s for recordId=%s to topic %s", action, record.id(), topic);

        return emitter.sendMessage(Message.of(payload).addMetadata(metadata))
                .ifNoItem().after(config.dispatch().timeout())
                .failWith(() -> DispatchException.timedOut(action, record.id()))
                .onFailure(e -> !(e instanceof DispatchException))
                .transform(e -> new DispatchException(action, record.id(), e));
    }
}
