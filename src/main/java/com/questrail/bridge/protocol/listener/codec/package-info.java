/**
 * Listener Protocol Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>framing layer</strong> of the daemon's
 * event-listener protocol, spoken over the listener's standard input and
 * standard output:</p>
 *
 * <ul>
 *   <li>{@code READY\n} written when the listener can accept an event</li>
 *   <li>a header line of {@code key:value} tokens ending in {@code \n}</li>
 *   <li>exactly {@code len} payload bytes, which may contain newlines</li>
 *   <li>{@code RESULT 2\nOK} or {@code RESULT 4\nFAIL}, with no trailing newline</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   stdin bytes
 *        → ListenerChannel        (framing rules applied here)
 *            → ListenerHeader + payload bytes
 *                → SupervisorEventDecoder
 *                    → SupervisorEvent
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Nothing in this package interprets event names or payload fields.</li>
 *   <li>Any framing failure is fatal to the listener; there is no resync.</li>
 *   <li>Standard output belongs to this layer. Nothing else may write to it.</li>
 * </ul>
 */
package com.questrail.bridge.protocol.listener.codec;
