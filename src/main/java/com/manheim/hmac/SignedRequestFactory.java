package com.manheim.hmac;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.methods.RequestBuilder;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;

/**
 * Builds signed requests against one service. The requests are ready to hand to an {@code HttpClient}; sending
 * them is up to the caller.
 *
 * <pre>{@code
 * SignedRequestFactory bears = new SignedRequestFactory("localhost", 8000, false,
 *       new HmacRequestSigner("API_KEY", "SECRET"));
 * HttpUriRequest request = bears.createJson("POST", "/bears/", null, bear);
 * }</pre>
 */
public class SignedRequestFactory {
   private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

   private final String scheme;
   private final String host;
   private final int port;
   private final RequestSigner signer;

   public SignedRequestFactory(String host, int port, boolean ssl, RequestSigner signer) {
      this.scheme = ssl ? "https" : "http";
      this.host = host;
      this.port = port;
      this.signer = signer;
   }

   /**
    * Creates and signs a request.
    *
    * @param method HTTP verb
    * @param path raw path starting with {@code /}; segments must already be percent-encoded
    * @param query query parameters, flattened with {@link QueryFlattener}; may be null
    * @param body raw body; null or empty for none
    * @param contentType content type of the body; ignored without a body
    */
   public HttpUriRequest create(String method, String path, Map<String, ?> query, byte[] body,
         ContentType contentType) {
      RequestBuilder builder = RequestBuilder.create(method).setUri(uri(path, query));
      if (body != null && body.length > 0) {
         builder.setEntity(new ByteArrayEntity(body, contentType));
      }
      HttpUriRequest request = builder.build();
      signer.signRequest(request);
      return request;
   }

   /**
    * Creates and signs a request whose body is {@code data} serialized as JSON. A null {@code data} sends no body.
    */
   public HttpUriRequest createJson(String method, String path, Map<String, ?> query, Object data) {
      byte[] body = null;
      if (data != null) {
         try {
            body = OBJECT_MAPPER.writeValueAsBytes(data);
         } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize request data as JSON", e);
         }
      }
      return create(method, path, query, body, ContentType.APPLICATION_JSON);
   }

   URI uri(String path, Map<String, ?> query) {
      if (path == null || !path.startsWith("/")) {
         throw new IllegalArgumentException("Path must start with '/': " + path);
      }
      try {
         URIBuilder builder = new URIBuilder(new URI(scheme + "://" + host + ":" + port + path));
         if (query != null && !query.isEmpty()) {
            builder.addParameters(QueryFlattener.flatten(query));
         }
         return builder.build();
      } catch (URISyntaxException e) {
         throw new IllegalArgumentException("Invalid request path: " + path, e);
      }
   }
}
