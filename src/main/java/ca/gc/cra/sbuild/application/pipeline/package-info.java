/**
 * Multi-file lint runs: semaphore-gated dispatch to a worker pool, per-job time budgets and a single
 * console writer fed through a queue.
 */
package ca.gc.cra.sbuild.application.pipeline;
