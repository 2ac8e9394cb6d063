/**
 * REST controllers. Thin adapters: they delegate to the services and let
 * {@link com.phillippitts.feedercontrol.presentation.exception.GlobalExceptionHandler} map failures.
 */
package com.phillippitts.feedercontrol.presentation.controller;
