package com.manheim.hmac;

import org.apache.http.client.methods.HttpUriRequest;

/**
 * Utility for signing outgoing HTTP requests with a shared secret.
 */
public interface RequestSigner {

   /**
    * Adds the following headers:
    * <ul>
    *    <li>x-api-key: the key identifying the caller's secret</li>
    *    <li>date: current timestamp, if not already present</li>
    *    <li>content-type: the entity's content type, if the request has a body and no such header yet</li>
    * </ul>
    *
    * Then signs the request by adding the 'authorization' header. The specific signature is determined by
    * implementations of this interface.
    */
   void signRequest(HttpUriRequest request);
}
