package io.github.hongjungwan.actionlog.core.internal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExceptionFormatter")
class ExceptionFormatterTest {

    @Test
    @DisplayName("typeName should be the fully qualified class name")
    void typeNameIsQualified() {
        assertThat(ExceptionFormatter.typeName(new IllegalArgumentException()))
                .isEqualTo("java.lang.IllegalArgumentException");
        assertThat(ExceptionFormatter.typeName(new CustomFailure()))
                .isEqualTo(CustomFailure.class.getName());
    }

    @Test
    @DisplayName("reason should use the message when present")
    void reasonUsesMessage() {
        assertThat(ExceptionFormatter.reason(new IllegalStateException("boom"))).isEqualTo("boom");
    }

    @Test
    @DisplayName("reason should fall back to toString() when message is null")
    void reasonFallsBackToString() {
        assertThat(ExceptionFormatter.reason(new NullPointerException()))
                .isEqualTo("java.lang.NullPointerException");
    }

    @Test
    @DisplayName("reason should use the placeholder when the exception cannot describe itself")
    void reasonUsesPlaceholder() {
        assertThat(ExceptionFormatter.reason(new HostileFailure()))
                .isEqualTo(ExceptionFormatter.UNREPRESENTABLE_REASON);
    }

    @Test
    @DisplayName("reason should replace unpaired surrogates")
    void reasonReplacesLoneSurrogates() {
        String broken = "bad \uD800 value";
        String pair = "emoji 😀";

        assertThat(ExceptionFormatter.reason(new RuntimeException(broken))).isEqualTo("bad � value");
        assertThat(ExceptionFormatter.reason(new RuntimeException(pair))).isEqualTo(pair);
        assertThat(ExceptionFormatter.replaceLoneSurrogates("\uDE00x\uD83D")).isEqualTo("�x�");
    }

    static class CustomFailure extends RuntimeException {
    }

    static class HostileFailure extends RuntimeException {
        @Override
        public String getMessage() {
            throw new IllegalStateException("no message for you");
        }
    }
}
