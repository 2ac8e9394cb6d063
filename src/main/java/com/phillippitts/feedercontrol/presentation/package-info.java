/**
 * Presentation layer: the thin REST facade and its exception mapping. Presentation depends on
 * service, never the reverse.
 */
package com.phillippitts.feedercontrol.presentation;
