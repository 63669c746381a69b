package com.example.striprequest.clients;

import com.example.striprequest.model.ProbeTarget;

/**
 * Sends one raw request over a fresh connection and returns the response header block.
 */
public interface Transport {

    /**
     * @param target     where to connect and whether to use TLS
     * @param rawRequest the request text, written as-is
     * @return the response status line and headers, up to and including the blank terminator line
     * @throws TransportException if the connection cannot be made, times out, or is reset
     */
    String exchange(ProbeTarget target, String rawRequest) throws TransportException;
}
