/**
 * Connectivity-aware deferral of mutating operations: the in-memory
 * {@link com.sailfish.taskengine.offline.OfflineQueue} and the
 * {@link com.sailfish.taskengine.offline.ResilientOperations} gateway in front of it.
 */
package com.sailfish.taskengine.offline;
