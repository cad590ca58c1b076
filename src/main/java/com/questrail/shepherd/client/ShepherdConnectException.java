package com.questrail.shepherd.client;

import java.io.IOException;

/**
 * A connection attempt to a shepherd did not reach CONNECTED: the socket was
 * refused or closed, the WELCOME was unusable, or too much arrived before it.
 */
public class ShepherdConnectException extends IOException
{
    public ShepherdConnectException(String message)
    {
        super(message);
    }

    public ShepherdConnectException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
