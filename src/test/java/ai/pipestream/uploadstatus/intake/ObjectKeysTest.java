package ai.pipestream.uploadstatus.intake;

import ai.pipestream.uploadstatus.exception.InvalidUploadKeyException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ObjectKeysTest {

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void blankKeyIsGenerated(String desired) {
        String key = ObjectKeys.resolve(desired, "uploads/");

        assertThat(key).matches("uploads/[0-9a-f\\-]{36}");
    }

    @Test
    void generatedKeysAreUnique() {
        assertThat(ObjectKeys.resolve(null, "uploads")).isNotEqualTo(ObjectKeys.resolve(null, "uploads"));
    }

    @Test
    void emptyPrefixGeneratesBareId() {
        assertThat(ObjectKeys.resolve(null, "")).matches("[0-9a-f\\-]{36}");
    }

    @Test
    void suppliedKeyIsTrimmedAndMadeRelative() {
        assertThat(ObjectKeys.resolve("  //uploads/42 ", "ignored")).isEqualTo("uploads/42");
    }

    @ParameterizedTest
    @ValueSource(strings = {"/", "uploads/../secret", "uploads//42", "uploads/./42", "uploads\\42", "uploads/4\t2",
            "uploads/"})
    void unsafeKeysAreRejected(String desired) {
        assertThatThrownBy(() -> ObjectKeys.resolve(desired, "uploads"))
                .isInstanceOf(InvalidUploadKeyException.class)
                .extracting(e -> ((InvalidUploadKeyException) e).getErrorCode())
                .isEqualTo("INVALID_UPLOAD_KEY");
    }

    @Test
    void overlongKeyIsRejected() {
        String key = "k".repeat(ObjectKeys.MAX_KEY_BYTES + 1);
        assertThatThrownBy(() -> ObjectKeys.resolve(key, "uploads"))
                .isInstanceOf(InvalidUploadKeyException.class)
                .hasMessageContaining("longer than");
        assertThat(ObjectKeys.resolve("k".repeat(ObjectKeys.MAX_KEY_BYTES), "uploads")).hasSize(ObjectKeys.MAX_KEY_BYTES);
    }
}
