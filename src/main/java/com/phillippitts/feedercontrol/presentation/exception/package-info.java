/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.feedercontrol.exception.SettingsValidationException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.feedercontrol.exception.DeviceConnectionException} → 503 Service Unavailable</li>
 *   <li>{@link com.phillippitts.feedercontrol.exception.CommandTimeoutException} → 504 Gateway Timeout</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "CommandTimeoutException",
 *   "message": "Feeder device did not respond",
 *   "details": "No complete response within 3000ms",
 *   "timestamp": "2026-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.feedercontrol.presentation.exception;
