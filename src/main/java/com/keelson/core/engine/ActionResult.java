package com.keelson.core.engine;

import com.keelson.core.model.TaskKey;

/**
 * Outcome of an accepted action.
 *
 * @param rev  revision committed by the action
 * @param task task the action created or addressed, may be {@code null}
 */
public record ActionResult(long rev, TaskKey task) {}
