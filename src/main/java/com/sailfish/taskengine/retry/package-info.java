/**
 * Contains the retry layer that every mutating call goes through: the
 * {@link com.sailfish.taskengine.retry.RetryStrategy} abstraction, the default
 * {@link com.sailfish.taskengine.retry.ExponentialBackoffRetryStrategy} and the
 * {@link com.sailfish.taskengine.retry.RetryExecutor} that applies them.
 */
package com.sailfish.taskengine.retry;
