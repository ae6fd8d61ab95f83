/**
 * Pipeline orchestration.
 *
 * <p>{@link io.xaio.runtime.StageRunner} drives one stage over its eligible items under per-item leases;
 * {@link io.xaio.runtime.PipelineScheduler} runs all stages in order under the global sweep lease;
 * {@link io.xaio.runtime.PipelineRuntime} wires both to storage and adapters for the CLI.
 */
package io.xaio.runtime;
