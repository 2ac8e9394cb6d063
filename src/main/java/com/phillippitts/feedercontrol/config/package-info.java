/**
 * Application-wide configuration beans and properties.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code scheduler.*}, {@code device.*} and
 *       {@code remote-store.*} settings</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 */
package com.phillippitts.feedercontrol.config;
