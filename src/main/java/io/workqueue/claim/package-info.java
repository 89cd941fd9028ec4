/**
 * Claim strategies.
 *
 * <p>Every strategy only chooses a candidate row; the claim itself is the guarded update in
 * {@link io.workqueue.storage.TaskStore#claim}, which is what prevents double claims.
 */
package io.workqueue.claim;
