/**
 * Control Transport Port
 * =============================================================================
 *
 * {@link com.questrail.bridge.control.transport.RpcTransport} is the
 * framework-agnostic boundary between the control client and a concrete HTTP
 * implementation (Netty in production, a scripted fake in tests).
 *
 * <p>Everything above the port sees only request and response bodies as
 * {@code byte[]}. Implementations MUST:</p>
 * <ul>
 *   <li>Perform transport I/O only (no XML-RPC encoding or decoding)</li>
 *   <li>Honour the per-call timeout they are given</li>
 *   <li>Not retry</li>
 * </ul>
 */
package com.questrail.bridge.control.transport;
