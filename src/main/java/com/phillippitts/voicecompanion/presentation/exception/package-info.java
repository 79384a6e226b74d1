/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.voicecompanion.exception.RateLimitedException} → 429 Too Many Requests</li>
 *   <li>{@link com.phillippitts.voicecompanion.exception.EmptyInputException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.voicecompanion.exception.RetriesExhaustedException} → 503 Service Unavailable (retry)</li>
 *   <li>{@link com.phillippitts.voicecompanion.exception.OwnerOnlyException} → 403 Forbidden</li>
 *   <li>invalid or unreadable request body → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "RateLimitedException",
 *   "message": "Too many requests",
 *   "details": "Rate limit: please wait before sending another request (guild: 42)",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @see com.phillippitts.voicecompanion.exception
 * @since 1.0
 */
package com.phillippitts.voicecompanion.presentation.exception;
