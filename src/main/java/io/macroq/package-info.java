/**
 * MacroQ source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.macroq.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.macroq.world.WorldPartitioner} splits the universe into sub-worlds.</li>
 *   <li>{@code io.macroq.scheduler.MacroTaskQueue} drives submission, the worker loop and result collection.</li>
 *   <li>{@code io.macroq.scheduler.Coordinator} is the single owner of task status.</li>
 *   <li>{@code io.macroq.stage.StagedChannel} moves task state between process groups.</li>
 * </ul>
 */
package io.macroq;
