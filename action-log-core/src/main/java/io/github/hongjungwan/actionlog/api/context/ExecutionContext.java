package io.github.hongjungwan.actionlog.api.context;

import io.github.hongjungwan.actionlog.api.Action;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-thread stack of the actions currently running.
 *
 * The top of the stack is the implicit parent for {@code Actions.startAction}.
 * Each thread owns its own stack; nothing here is shared or locked, so an
 * action pushed on one thread is invisible to every other thread.
 *
 * Push and pop must be strictly nested. Prefer {@link #enter(Action)} with
 * try-with-resources over calling them directly.
 */
public final class ExecutionContext {

    private static final ThreadLocal<Deque<Action>> STACK = new ThreadLocal<>();

    private ExecutionContext() {}

    /**
     * Make the given action the current one for this thread.
     */
    public static void push(Action action) {
        Objects.requireNonNull(action, "action");
        Deque<Action> stack = STACK.get();
        if (stack == null) {
            stack = new ArrayDeque<>();
            STACK.set(stack);
        }
        stack.push(action);
    }

    /**
     * Remove the current action.
     *
     * @throws IllegalStateException if no action is on this thread's stack
     */
    public static void pop() {
        Deque<Action> stack = STACK.get();
        if (stack == null || stack.isEmpty()) {
            throw new IllegalStateException("ExecutionContext.pop() called with no current action");
        }
        stack.pop();
        if (stack.isEmpty()) {
            STACK.remove();
        }
    }

    /**
     * Get the current action of this thread.
     */
    public static Optional<Action> current() {
        Deque<Action> stack = STACK.get();
        if (stack == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(stack.peek());
    }

    public static int depth() {
        Deque<Action> stack = STACK.get();
        return stack == null ? 0 : stack.size();
    }

    /**
     * Push the action and return a Scope that pops it again.
     */
    public static Scope enter(Action action) {
        push(action);
        return new PoppingScope();
    }

    /**
     * Scope for context management (AutoCloseable)
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close(); // No exception
    }

    private static final class PoppingScope implements Scope {

        private boolean closed;

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            pop();
        }
    }
}
