/**
 * Shepherd Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between the Unix-domain-socket implementation
 * and the shepherd daemon, client and session manager.
 *
 * <h2>Why these ports exist</h2>
 * Netty's native domain-socket transports do the I/O in production. These
 * ports keep Netty types out of everything above the adapter, which sees only:
 * <ul>
 *   <li>Socket locations as {@link java.nio.file.Path}</li>
 *   <li>Raw stream chunks as {@code byte[]}</li>
 *   <li>Open and close notifications</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Not decode frames or messages</li>
 *   <li>Deliver callbacks serially per connection</li>
 * </ul>
 *
 * <p>Tests substitute in-memory connectors for these ports.</p>
 */
package com.questrail.shepherd.transport;
