/**
 * Task derivation rules and their registry, including the built-in
 * {@link com.sailfish.taskengine.rules.FeedbackRules}.
 */
package com.sailfish.taskengine.rules;
