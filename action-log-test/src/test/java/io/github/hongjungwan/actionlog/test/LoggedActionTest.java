package io.github.hongjungwan.actionlog.test;

import io.github.hongjungwan.actionlog.api.Action;
import io.github.hongjungwan.actionlog.api.Actions;
import io.github.hongjungwan.actionlog.api.Message;
import io.github.hongjungwan.actionlog.api.TaskLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;

/**
 * Rebuilds action trees from MemoryLogger output
 */
@DisplayName("LoggedAction")
class LoggedActionTest {

    private MemoryLogger logger;

    @BeforeEach
    void setUp() {
        logger = new MemoryLogger();
    }

    @Test
    @DisplayName("should rebuild the call tree with outcomes")
    void shouldRebuildTree() {
        Action root = Actions.startAction(logger, "payroll:run", Map.of("month", "2024-05"));
        root.execute(() -> {
            Actions.startAction(logger, "payroll:load").execute(() -> {
                Message.create(Map.of("message_type", "payroll:rows", "count", 3)).write(logger);
                return null;
            });
            try {
                Actions.startAction(logger, "payroll:calculate").execute(() -> {
                    throw new ArithmeticException("division by zero");
                });
            } catch (ArithmeticException expected) {
                // recorded as a failed child; the run carries on
            }
            return null;
        });

        LoggedAction run = LoggedAction.ofType(logger.getMessages(), "payroll:run").get(0);

        assertThat(run.isSucceeded()).isTrue();
        assertThat(run.getStartMessage()).containsEntry("month", "2024-05");
        assertThat(run.getChildren())
                .extracting(LoggedAction::getActionType)
                .containsExactly("payroll:load", "payroll:calculate");

        LoggedAction load = run.getChildren().get(0);
        assertThat(load.getTaskLevel()).isEqualTo(TaskLevel.parse("/1/"));
        assertThat(load.getMessages()).singleElement()
                .satisfies(m -> assertThat(m).containsEntry("count", 3));

        LoggedAction calculate = run.getChildren().get(1);
        assertThat(calculate.isSucceeded()).isFalse();
        assertThat(calculate.getEndMessage()).hasValueSatisfying(end ->
                assertThat(end).containsEntry("exception", "java.lang.ArithmeticException"));
    }

    @Test
    @DisplayName("should report an unfinished deferred action until its future completes")
    void shouldTrackDeferredAction() {
        CompletableFuture<String> response = new CompletableFuture<>();
        Action request = Actions.startTask(logger, "http:request");
        request.finishAfter(response);

        assertThat(LoggedAction.ofType(logger.getMessages(), "http:request").get(0).isFinished()).isFalse();

        response.complete("200");

        assertThat(LoggedAction.ofType(logger.getMessages(), "http:request").get(0).isSucceeded()).isTrue();
    }

    @Test
    @DisplayName("should order children by level, not by finish order")
    void shouldOrderChildrenByLevel() {
        Action root = Actions.startTask(logger, "batch:run");
        Action[] children = new Action[11];
        for (int i = 0; i < children.length; i++) {
            children[i] = Actions.startChild(root, logger, "batch:item");
        }
        for (int i = children.length - 1; i >= 0; i--) {
            children[i].finish();
        }
        root.finish();

        List<LoggedAction> items = LoggedAction.ofType(logger.getMessages(), "batch:run").get(0).getChildren();

        assertThat(items).hasSize(11);
        assertThat(items.get(1).getTaskLevel().toPath()).isEqualTo("/2/");
        assertThat(items.get(10).getTaskLevel().toPath()).isEqualTo("/11/");
        assertThat(items).allMatch(LoggedAction::isSucceeded);
    }

    @Test
    @DisplayName("should reject a level with no start message")
    void shouldRejectMissingStart() {
        Action root = Actions.startTask(logger, "batch:run");

        assertThatThrownBy(() -> LoggedAction.fromMessages(root.getTaskUuid(), TaskLevel.parse("/5/"), logger.getMessages()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
