/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.voicecompanion.exception.VoiceCompanionException}
 * so the presentation layer can map them in one place.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voicecompanion.exception.ConnectionTimeoutException} - ready signal
 *       (or connect acceptance) not received in time; retried by the supervisor</li>
 *   <li>{@link com.phillippitts.voicecompanion.exception.ConnectionRejectedException} - transport-level
 *       connect failure; retried by the supervisor</li>
 *   <li>{@link com.phillippitts.voicecompanion.exception.RetriesExhaustedException} - surfaced to
 *       join/move callers after the retry budget is spent</li>
 *   <li>{@link com.phillippitts.voicecompanion.exception.SynthesisException} and
 *       {@link com.phillippitts.voicecompanion.exception.ResourceBuildException} - contained to a
 *       single playback item</li>
 *   <li>{@link com.phillippitts.voicecompanion.exception.RateLimitedException} and
 *       {@link com.phillippitts.voicecompanion.exception.EmptyInputException} - synchronous
 *       rejections from enqueue</li>
 *   <li>{@link com.phillippitts.voicecompanion.exception.OwnerOnlyException} - control surface
 *       access by anyone but the owner</li>
 * </ul>
 *
 * @see com.phillippitts.voicecompanion.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.voicecompanion.exception;
