/**
 * Service interfaces of the task engine. Implementations live in
 * {@code com.sailfish.taskengine.service.impl}.
 */
package com.sailfish.taskengine.service;
