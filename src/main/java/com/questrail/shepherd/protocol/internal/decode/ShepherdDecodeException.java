package com.questrail.shepherd.protocol.internal.decode;

/**
 * Indicates that a well-framed shepherd frame could not be translated into a
 * valid semantic message.
 *
 * This typically reflects:
 * <ul>
 *   <li>A control payload that is not JSON</li>
 *   <li>A required field that is missing or of the wrong type</li>
 *   <li>A value outside its legal range (non-positive terminal size)</li>
 * </ul>
 */
public final class ShepherdDecodeException extends RuntimeException
{
    public ShepherdDecodeException(String message) {
        super(message);
    }

    public ShepherdDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
