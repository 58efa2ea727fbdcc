/**
 * Presentation layer: the WebSocket audio endpoint and the small HTTP surface.
 *
 * <p>Presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.websocket} - per-session WebSocket protocol (control JSON in,
 *       PCM in, metering JSON out)</li>
 *   <li>{@code presentation.controller} - REST controllers</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Handlers are thin adapters - processing logic lives in services</li>
 *   <li>Domain exceptions are mapped to close codes or logged diagnostics here</li>
 * </ul>
 */
package com.phillippitts.audiometer.presentation;
