/**
 * Public API of the Action Log SDK.
 *
 * <p>An {@link io.github.hongjungwan.actionlog.api.Action} marks a unit of work. Actions
 * nest: each one records its task uuid and its level in the task's tree, so the log
 * consumer can rebuild the call tree and see which parts succeeded or failed.</p>
 *
 * <ul>
 *   <li>{@link io.github.hongjungwan.actionlog.api.Actions} - startAction / startTask entry points</li>
 *   <li>{@link io.github.hongjungwan.actionlog.api.context.ExecutionContext} - per-thread current action</li>
 *   <li>{@link io.github.hongjungwan.actionlog.api.ActionLogger} - message destination</li>
 *   <li>{@link io.github.hongjungwan.actionlog.api.serialization.FieldSerializer} - validation / transformation hook</li>
 * </ul>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * ActionLogger logger = ActionLoggerFactory.getLogger("payroll");
 * Action action = Actions.startAction(logger, "payroll:run", Map.of("month", "2024-05"));
 * action.execute(() -> payroll.run());
 * }</pre>
 */
package io.github.hongjungwan.actionlog.api;
