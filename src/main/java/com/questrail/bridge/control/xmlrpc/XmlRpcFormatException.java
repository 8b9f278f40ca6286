package com.questrail.bridge.control.xmlrpc;

import java.io.IOException;

/**
 * The response body is not a well-formed XML-RPC {@code methodResponse}.
 */
public final class XmlRpcFormatException extends IOException
{
    public XmlRpcFormatException(String message) {
        super(message);
    }

    public XmlRpcFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
