/**
 * Serial link to the feeder microcontroller.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.feedercontrol.service.device.DeviceLink} - connection lifecycle,
 *       reader thread, reconnect with bounded retry and cooldown</li>
 *   <li>{@link com.phillippitts.feedercontrol.service.device.SerialPortProvider} - seam over the
 *       serial library so tests can script ports and lines</li>
 *   <li>{@code PendingCommandTable} - correlates info lines with commands awaiting a response</li>
 *   <li>{@link com.phillippitts.feedercontrol.service.device.SensorReadingStore} - latest reading
 *       per sensor, published as immutable snapshots</li>
 * </ul>
 *
 * <p>Wire format: outbound {@code [control]:<body>\n}; inbound data frames carry a JSON payload
 * after the data prefix, info lines after the info prefix.
 */
package com.phillippitts.feedercontrol.service.device;
