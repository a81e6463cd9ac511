package com.manheim.hmac;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.http.HttpException;
import org.apache.http.HttpRequest;
import org.apache.http.HttpResponse;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.protocol.HttpContext;
import org.apache.http.protocol.HttpRequestHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Collections;
import java.util.concurrent.ExecutionException;

/**
 * Guards an {@link HttpRequestHandler}: requests are authenticated first, and only authenticated requests reach the
 * wrapped handler. Rejected requests get the error's status code and a JSON body
 * {@code {"error": {"message": ..., "code": ...}}}.
 * <p>
 * The request body is drained and buffered during authentication, so the wrapped handler can still read it. The
 * authentication outcome is available from the {@link HttpContext} under the {@link RequestAuthenticator}
 * attribute names.
 */
public class HmacAuthenticationHandler implements HttpRequestHandler {
   private static final Logger LOG = LoggerFactory.getLogger(HmacAuthenticationHandler.class);
   private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

   private final RequestAuthenticator authenticator;
   private final HttpRequestHandler handler;

   public HmacAuthenticationHandler(RequestAuthenticator authenticator, HttpRequestHandler handler) {
      this.authenticator = authenticator;
      this.handler = handler;
   }

   @Override
   public void handle(HttpRequest request, HttpResponse response, HttpContext context)
         throws HttpException, IOException {
      try {
         authenticator.authenticate(request, context).get();
      } catch (InterruptedException e) {
         Thread.currentThread().interrupt();
         throw new InterruptedIOException("Interrupted while authenticating " + request.getRequestLine());
      } catch (ExecutionException e) {
         AuthenticationException failure = AuthenticationException.unwrap(e);
         if (failure == null) {
            throw new HttpException("Unexpected failure authenticating " + request.getRequestLine(), e.getCause());
         }
         reject(request, response, failure);
         return;
      }
      handler.handle(request, response, context);
   }

   void reject(HttpRequest request, HttpResponse response, AuthenticationException failure) throws IOException {
      if (failure.getError().isInternal()) {
         LOG.warn("Authentication failed for {}: {}", request.getRequestLine(), failure.toString(), failure.getCause());
      } else {
         LOG.info("Authentication failed for {}: {}", request.getRequestLine(), failure.toString());
      }
      response.setStatusCode(failure.getError().getStatusCode());
      byte[] body = OBJECT_MAPPER.writeValueAsBytes(Collections.singletonMap("error", failure.toMap()));
      response.setEntity(new ByteArrayEntity(body, ContentType.APPLICATION_JSON));
   }
}
