package com.questrail.shepherd.protocol.model;

/**
 * Canonical semantic representation of a shepherd protocol message.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code ShepherdMessage} is the fully decoded form of a frame. The daemon and
 * the client reason only about these types and never about type bytes, length
 * prefixes or JSON field names.
 * </p>
 *
 * <h2>Directionality</h2>
 * <p>
 * The protocol is directional and this is enforced structurally:
 * </p>
 * <ul>
 *   <li>{@link ClientMessage}: controller to shepherd</li>
 *   <li>{@link ServerMessage}: shepherd to controller</li>
 * </ul>
 */
public sealed interface ShepherdMessage
        permits ClientMessage, ServerMessage {
}
