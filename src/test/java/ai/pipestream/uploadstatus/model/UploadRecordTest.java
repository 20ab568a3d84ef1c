package ai.pipestream.uploadstatus.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UploadRecordTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private UploadRecord pending() {
        return UploadRecord.pending(UUID.randomUUID(), "uploads/42", T0.plusSeconds(900), T0);
    }

    @Test
    @DisplayName("Only PENDING may transition, and only to a terminal status")
    void transitionsAreMonotonic() {
        for (UploadStatus from : UploadStatus.values()) {
            for (UploadStatus to : UploadStatus.values()) {
                boolean expected = from == UploadStatus.PENDING && to != UploadStatus.PENDING;
                assertThat(from.canTransitionTo(to))
                        .as("%s -> %s", from, to)
                        .isEqualTo(expected);
            }
        }
        assertThat(UploadStatus.PENDING.canTransitionTo(null)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = UploadStatus.class, names = {"UPLOADED", "FAILED", "EXPIRED"})
    void terminalStatuses(UploadStatus status) {
        assertThat(status.isTerminal()).isTrue();
        assertThat(status.isLive()).isEqualTo(status == UploadStatus.UPLOADED);
    }

    @Test
    void pendingRecordHasNoCompletionData() {
        UploadRecord record = pending();

        assertThat(record.status()).isEqualTo(UploadStatus.PENDING);
        assertThat(record.createdAt()).isEqualTo(T0);
        assertThat(record.updatedAt()).isEqualTo(T0);
        assertThat(record.uploadedAt()).isNull();
        assertThat(record.dispatchedActions()).isEmpty();
    }

    @Test
    void applyUploadedCopiesProviderData() {
        Instant providerTime = T0.plusSeconds(30);
        UploadRecord uploaded = pending().apply(StatusChange.uploaded(T0.plusSeconds(31), providerTime, 512L, "abc"));

        assertThat(uploaded.status()).isEqualTo(UploadStatus.UPLOADED);
        assertThat(uploaded.uploadedAt()).isEqualTo(providerTime);
        assertThat(uploaded.updatedAt()).isEqualTo(T0.plusSeconds(31));
        assertThat(uploaded.sizeBytes()).isEqualTo(512L);
        assertThat(uploaded.etag()).isEqualTo("abc");
        assertThat(uploaded.createdAt()).isEqualTo(T0);
    }

    @Test
    void uploadedAtFallsBackToTransitionTime() {
        StatusChange change = StatusChange.uploaded(T0, null, null, null);
        assertThat(change.uploadedAt()).isEqualTo(T0);
    }

    @Test
    void terminalRecordRejectsFurtherTransitions() {
        UploadRecord uploaded = pending().apply(StatusChange.uploaded(T0, T0, null, null));

        assertThatThrownBy(() -> uploaded.apply(StatusChange.expired(T0.plusSeconds(1))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("UPLOADED -> EXPIRED");
    }

    @Test
    void statusChangeCannotTargetPending() {
        assertThatThrownBy(() -> new StatusChange(UploadStatus.PENDING, T0, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingActionsKeepConfiguredOrder() {
        UploadRecord record = pending()
                .apply(StatusChange.uploaded(T0, T0, null, null))
                .withDispatchedAction("audit");

        assertThat(record.missingActions(List.of("scan", "audit", "quota")))
                .containsExactly("scan", "quota");
        assertThat(record.withDispatchedAction("scan").withDispatchedAction("quota")
                .missingActions(List.of("scan", "audit", "quota")))
                .isEmpty();
    }

    @Test
    void dispatchedActionsAreImmutable() {
        UploadRecord record = pending().withDispatchedAction("scan");
        assertThatThrownBy(() -> record.dispatchedActions().add("audit"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void credentialExpiryIsInclusive() {
        UploadRecord record = pending();
        assertThat(record.isCredentialExpired(T0)).isFalse();
        assertThat(record.isCredentialExpired(T0.plusSeconds(900))).isTrue();
    }
}
