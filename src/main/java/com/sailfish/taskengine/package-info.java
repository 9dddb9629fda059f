/**
 * Provides the client-resident task engine: rule-based derivation of follow-up
 * tasks from content state, the daily scheduler that drives it, and the retry and
 * offline-queue layer all mutating calls go through.
 * {@link com.sailfish.taskengine.TaskEngine} assembles the pieces.
 */
package com.sailfish.taskengine;
