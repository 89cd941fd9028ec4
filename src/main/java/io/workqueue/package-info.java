/**
 * WorkQueue source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.workqueue.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.workqueue.WorkQueue} wires one queue file to its store, executors and sweeper.</li>
 *   <li>{@code io.workqueue.storage.TaskStore} is the authoritative persistence layer.</li>
 *   <li>{@code io.workqueue.worker.WorkerRuntime} runs the claim, execute and report loop.</li>
 * </ul>
 */
package io.workqueue;
