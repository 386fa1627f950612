package com.novelsource.api;

import com.novelsource.common.error.FetchException;

import java.util.Map;

/**
 * HTTP GET abstraction used by every parser. Implementations do not retry.
 */
public interface Transport {

    /**
     * @param headers extra request headers, may be empty
     * @throws FetchException when no response could be obtained (DNS, connect, timeout)
     */
    FetchResponse fetch(String url, Map<String, String> headers) throws FetchException;
}
