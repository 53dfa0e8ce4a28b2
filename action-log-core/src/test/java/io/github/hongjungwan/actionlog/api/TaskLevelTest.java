package io.github.hongjungwan.actionlog.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TaskLevel")
class TaskLevelTest {

    @Test
    @DisplayName("root should render as /")
    void rootRendersAsSlash() {
        assertThat(TaskLevel.root().toPath()).isEqualTo("/");
        assertThat(TaskLevel.root().isRoot()).isTrue();
        assertThat(TaskLevel.root().parent()).isEmpty();
    }

    @Test
    @DisplayName("child should append the index segment")
    void childAppendsSegment() {
        TaskLevel level = TaskLevel.root().child(2).child(1);

        assertThat(level.toPath()).isEqualTo("/2/1/");
        assertThat(level.depth()).isEqualTo(2);
        assertThat(level.segments()).containsExactly(2, 1);
        assertThat(level.parent()).contains(TaskLevel.root().child(2));
    }

    @Test
    @DisplayName("parse should round trip rendered paths")
    void parseMatchesRenderedPath() {
        assertThat(TaskLevel.parse("/3/12/1/")).isEqualTo(TaskLevel.root().child(3).child(12).child(1));
        assertThat(TaskLevel.parse("/")).isSameAs(TaskLevel.root());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1/", "/1", "//", "/0/", "/a/", "/1//2/", "/-1/"})
    @DisplayName("parse should reject malformed paths")
    void parseRejectsMalformed(String path) {
        assertThatThrownBy(() -> TaskLevel.parse(path)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("child index must be positive")
    void childIndexMustBePositive() {
        assertThatThrownBy(() -> TaskLevel.root().child(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
