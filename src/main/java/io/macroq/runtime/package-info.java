/**
 * Runtime wiring package.
 *
 * <p>{@link io.macroq.runtime.MacroQRuntime} resolves configuration and settings, opens the
 * staged record store and event log, and launches a universe whose ranks share them.
 */
package io.macroq.runtime;
