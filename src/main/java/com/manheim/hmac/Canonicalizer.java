package com.manheim.hmac;

import org.apache.http.Header;
import org.apache.http.HttpRequest;
import org.apache.http.NameValuePair;
import org.apache.http.client.utils.URLEncodedUtils;

import java.io.UnsupportedEncodingException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Builds the canonical form of a request: the exact string that gets signed by the client and re-signed by the
 * server. The form is five newline separated sections:
 *
 * <pre>
 * METHOD
 * PATH
 * QUERY
 * HEADER_LINES
 * BODY_HASH
 * </pre>
 *
 * Only the headers in {@link #SIGNED_HEADERS} take part, and {@code content-length} / {@code content-type} only
 * when there is a body. Client and server must produce byte-identical output for the same request, so every rule
 * here is part of the wire contract.
 */
public final class Canonicalizer {
   public static final String ENCODING = "UTF8";
   public static final String API_KEY_HEADER_NAME = "x-api-key";
   public static final String DATE_HEADER_NAME = "date";
   public static final String CONTENT_LENGTH_HEADER_NAME = "content-length";
   public static final String CONTENT_TYPE_HEADER_NAME = "content-type";
   public static final List<String> SIGNED_HEADERS = Collections.unmodifiableList(Arrays.asList(
         API_KEY_HEADER_NAME, DATE_HEADER_NAME, CONTENT_LENGTH_HEADER_NAME, CONTENT_TYPE_HEADER_NAME));

   private static final List<String> BODY_HEADERS = Arrays.asList(CONTENT_LENGTH_HEADER_NAME, CONTENT_TYPE_HEADER_NAME);
   private static final byte[] EMPTY_BODY = new byte[0];

   private Canonicalizer() {
   }

   /**
    * Canonicalizes a request from its parts.
    *
    * @param method HTTP verb, any case
    * @param path raw request path, as sent on the request line
    * @param query decoded query parameters, in wire order; may be empty
    * @param headers header values keyed by name; names in any case
    * @param body raw body, or null for none
    */
   public static String canonicalize(String method, String path, List<? extends NameValuePair> query,
         Map<String, String> headers, byte[] body) {
      byte[] payload = body != null ? body : EMPTY_BODY;
      StringBuilder result = new StringBuilder();
      result.append(method.toUpperCase(Locale.ROOT)).append('\n');
      result.append(path).append('\n');
      addCanonicalQueryString(query, result).append('\n');
      addCanonicalHeaders(sortedSignedHeaders(headers, payload.length > 0), result).append('\n');
      return addHashedPayload(payload, result).toString();
   }

   /**
    * Canonicalizes a request as the server sees it: method and target from the request line, the request's own
    * headers, and the given body.
    */
   public static String canonicalize(HttpRequest request, byte[] body) {
      return canonicalize(request, headerMap(request.getAllHeaders()), body);
   }

   static String canonicalize(HttpRequest request, Map<String, String> headers, byte[] body) {
      return canonicalize(request.getRequestLine().getMethod(), request.getRequestLine().getUri(), headers, body);
   }

   /**
    * Canonicalizes a request given its raw request target, origin-form or absolute-form.
    */
   static String canonicalize(String method, String target, Map<String, String> headers, byte[] body) {
      return canonicalize(method, requestPath(target), parseQuery(requestQuery(target)), headers, body);
   }

   /**
    * Collects header values keyed by lower-cased name. The first occurrence of a repeated header wins.
    */
   static Map<String, String> headerMap(Header[] headers) {
      Map<String, String> result = new HashMap<>();
      for (Header header : headers) {
         String name = header.getName().toLowerCase(Locale.ROOT);
         if (!result.containsKey(name)) {
            result.put(name, header.getValue());
         }
      }
      return result;
   }

   /**
    * The raw path of a request target. Origin-form and absolute-form targets are both accepted; an empty path is
    * {@code /}.
    */
   static String requestPath(String target) {
      String path = stripFragment(target);
      int queryStart = path.indexOf('?');
      if (queryStart >= 0) {
         path = path.substring(0, queryStart);
      }
      int schemeEnd = path.indexOf("://");
      if (schemeEnd >= 0) {
         int pathStart = path.indexOf('/', schemeEnd + 3);
         path = pathStart >= 0 ? path.substring(pathStart) : "";
      }
      return path.isEmpty() ? "/" : path;
   }

   /**
    * The raw query of a request target, without the leading {@code ?}; empty when there is none.
    */
   static String requestQuery(String target) {
      String withoutFragment = stripFragment(target);
      int queryStart = withoutFragment.indexOf('?');
      return queryStart >= 0 ? withoutFragment.substring(queryStart + 1) : "";
   }

   private static String stripFragment(String target) {
      int fragmentStart = target.indexOf('#');
      return fragmentStart >= 0 ? target.substring(0, fragmentStart) : target;
   }

   /**
    * Decodes a raw query string into parameters, keeping wire order. Only {@code &} separates pairs.
    */
   static List<NameValuePair> parseQuery(String rawQuery) {
      if (rawQuery == null || rawQuery.isEmpty()) {
         return Collections.emptyList();
      }
      return URLEncodedUtils.parse(rawQuery, StandardCharsets.UTF_8, '&');
   }

   /**
    * Appends {@code key=value} pairs joined by {@code &}, encoded and ordered by encoded key. The sort is stable,
    * so repeated keys keep their relative order.
    */
   static StringBuilder addCanonicalQueryString(List<? extends NameValuePair> query, StringBuilder builder) {
      List<String[]> encodedParams = new ArrayList<>();
      for (NameValuePair param : query) {
         String value = param.getValue() != null ? param.getValue() : "";
         encodedParams.add(new String[] { encodeQueryStringValue(param.getName()), encodeQueryStringValue(value) });
      }
      Collections.sort(encodedParams, (left, right) -> left[0].compareTo(right[0]));
      boolean first = true;
      for (String[] param : encodedParams) {
         if (!first) {
            builder.append('&');
         }
         builder.append(param[0]).append('=').append(param[1]);
         first = false;
      }
      return builder;
   }

   /**
    * Picks the signed headers out of the given ones, lower-casing names and trimming values.
    */
   static SortedMap<String, String> sortedSignedHeaders(Map<String, String> headers, boolean hasBody) {
      SortedMap<String, String> sortedHeaders = new TreeMap<>();
      for (Map.Entry<String, String> header : headers.entrySet()) {
         String name = header.getKey().toLowerCase(Locale.ROOT);
         if (!SIGNED_HEADERS.contains(name) || header.getValue() == null) {
            continue;
         }
         if (!hasBody && BODY_HEADERS.contains(name)) {
            continue;
         }
         if (!sortedHeaders.containsKey(name)) {
            sortedHeaders.put(name, header.getValue().trim());
         }
      }
      return sortedHeaders;
   }

   static StringBuilder addCanonicalHeaders(SortedMap<String, String> sortedHeaders, StringBuilder builder) {
      boolean first = true;
      for (Map.Entry<String, String> entry : sortedHeaders.entrySet()) {
         if (!first) {
            builder.append('\n');
         }
         builder.append(entry.getKey()).append(':').append(entry.getValue());
         first = false;
      }
      return builder;
   }

   static StringBuilder addHashedPayload(byte[] payload, StringBuilder builder) {
      return builder.append(Signer.toHexString(Signer.sha256(payload)));
   }

   /**
    * RFC 3986 URI encoding of UTF-8 text.
    */
   static String encodeQueryStringValue(String s) {
      try {
         return URLEncoder.encode(s, ENCODING)
               .replace("+", "%20")
               .replace("*", "%2A")
               .replace("%7E", "~");
      } catch (UnsupportedEncodingException e) {
         // Will never happen with "UTF8" hardcoded.
         throw new IllegalStateException(e);
      }
   }
}
