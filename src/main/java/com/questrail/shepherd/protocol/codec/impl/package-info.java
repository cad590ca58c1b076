/**
 * Shepherd Codec (Wire-Level Implementation)
 * =============================================================================
 *
 * <p>Concrete byte-level codec for the shepherd Unix-socket protocol.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] chunk (socket read)
 *        → DefaultShepherdFrameDecoder
 *        → ShepherdFrame
 *        → ShepherdMessageDecoder
 *        → ClientMessage / ServerMessage
 * </pre>
 *
 * <p>This codec layer is transport-agnostic and semantics-free. A framing
 * failure poisons the decoder and the owning connection is closed.</p>
 */
package com.questrail.shepherd.protocol.codec.impl;
