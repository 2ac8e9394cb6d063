/**
 * Immutable domain values shared by the scheduler, the device link and the alert evaluator.
 *
 * <p>{@code toMap()} methods produce the field names used in the remote store.
 */
package com.phillippitts.feedercontrol.domain;
