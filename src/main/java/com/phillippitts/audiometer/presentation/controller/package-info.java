/**
 * REST controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@link com.phillippitts.audiometer.presentation.controller.HealthController}
 *       - liveness check ({@code GET /health}) returning {@code {"status":"ok"}}</li>
 * </ul>
 *
 * <p>Audio and control traffic does not go through controllers; see
 * {@link com.phillippitts.audiometer.presentation.websocket}.
 */
package com.phillippitts.audiometer.presentation.controller;
