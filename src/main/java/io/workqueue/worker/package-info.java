/**
 * Worker loop, idle backoff and in-process worker pools.
 */
package io.workqueue.worker;
