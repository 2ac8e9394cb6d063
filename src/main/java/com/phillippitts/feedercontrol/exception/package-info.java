/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.feedercontrol.exception.FeederControlException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.feedercontrol.exception.DeviceConnectionException} - serial link
 *       cannot be opened; recovered by the device reader</li>
 *   <li>{@link com.phillippitts.feedercontrol.exception.CommandTimeoutException} - device did not
 *       answer a command in time</li>
 *   <li>{@link com.phillippitts.feedercontrol.exception.ConfigUnavailableException} - remote store
 *       unreachable; settings fall back to the local cache</li>
 *   <li>{@link com.phillippitts.feedercontrol.exception.SettingsValidationException} - rejected
 *       manual settings update</li>
 *   <li>{@link com.phillippitts.feedercontrol.exception.TransientJobException} - failure inside a
 *       scheduled job body</li>
 * </ul>
 *
 * <p>Only {@code SettingsValidationException} is meant to reach an external caller as a
 * rejection; the others are absorbed into degraded-but-running states or mapped to 5xx responses
 * by {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.feedercontrol.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.feedercontrol.exception;
