/**
 * Logging infrastructure: request correlation through Log4j2's ThreadContext.
 */
package com.phillippitts.feedercontrol.config.logging;
