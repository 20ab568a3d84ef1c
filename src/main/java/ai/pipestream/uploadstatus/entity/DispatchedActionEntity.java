package ai.pipestream.uploadstatus.entity;

import io.quarkus.hibernate.reactive.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One acknowledged downstream action for an upload record.
 * The (record, action) pair is unique, so a repeated acknowledgement never adds a row.
 */
@Entity
@Table(name = "upload_dispatched_actions",
        uniqueConstraints = @UniqueConstraint(name = "uk_dispatched_record_action", columnNames = {"record_id", "action"}))
public class DispatchedActionEntity extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    public Long id;

    @Column(name = "record_id", nullable = false)
    public UUID recordId;

    @Column(nullable = false, length = 64)
    public String action;

    @Column(name = "dispatched_at", nullable = false)
    public Instant dispatchedAt;
}
