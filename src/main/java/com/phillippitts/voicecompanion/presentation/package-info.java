/**
 * Presentation layer (owner control surface, gateway ingress and exception handling).
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers delegating to services</li>
 *   <li>{@code presentation.dto} - request/response records</li>
 *   <li>{@code presentation.security} - owner check for control endpoints</li>
 *   <li>{@code presentation.exception} - domain exception to HTTP status mapping</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; they never throw HTTP-specific exceptions.
 *
 * @see com.phillippitts.voicecompanion.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.voicecompanion.presentation;
