package com.manheim.hmac;

import com.amazonaws.auth.AWSCredentials;
import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpEntityEnclosingRequest;
import org.apache.http.HttpRequest;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.Configurable;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.utils.DateUtils;
import org.apache.http.client.utils.URIUtils;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.util.EntityUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Calendar;
import java.util.Date;
import java.util.Map;

import static com.manheim.hmac.Canonicalizer.API_KEY_HEADER_NAME;
import static com.manheim.hmac.Canonicalizer.CONTENT_LENGTH_HEADER_NAME;
import static com.manheim.hmac.Canonicalizer.CONTENT_TYPE_HEADER_NAME;
import static com.manheim.hmac.Canonicalizer.DATE_HEADER_NAME;

/**
 * Signs requests for verification by {@link RequestAuthenticator}.
 * <p>
 * The API key and secret come from an {@link AWSCredentialsProvider}: the access key id is sent as the API key and
 * the secret key is the HMAC secret. Credentials are fetched for every request, so rotating providers work.
 * <p>
 * {@code content-length} is signed but not added as a header; the transport derives it from the entity, which is
 * buffered here so its length is known.
 */
public class HmacRequestSigner implements RequestSigner {
   public static final String AUTH_HEADER_NAME = RequestAuthenticator.AUTH_HEADER_NAME;
   public static final String AUTH_HEADER_FORMAT = RequestAuthenticator.SIGNATURE_LABEL + " %s %s";

   private final AWSCredentialsProvider credentialsProvider;
   private final HmacAlgorithm algorithm;
   private final Date currentTime;

   public HmacRequestSigner(String apiKey, String secret) {
      this(new AWSStaticCredentialsProvider(new BasicAWSCredentials(apiKey, secret)), HmacAlgorithm.SHA256);
   }

   public HmacRequestSigner(AWSCredentialsProvider credentialsProvider, HmacAlgorithm algorithm) {
      this(credentialsProvider, algorithm, null);
   }

   /**
    * Test constructor with overriden date
    */
   HmacRequestSigner(AWSCredentialsProvider credentialsProvider, HmacAlgorithm algorithm, Date currentTime) {
      this.credentialsProvider = credentialsProvider;
      this.algorithm = algorithm;
      this.currentTime = currentTime;
   }

   @Override
   public void signRequest(HttpUriRequest request) {
      AWSCredentials credentials = credentialsProvider.getCredentials();
      request.setHeader(API_KEY_HEADER_NAME, credentials.getAWSAccessKeyId());
      if (!request.containsHeader(DATE_HEADER_NAME)) {
         request.addHeader(DATE_HEADER_NAME, timestamp());
      }

      byte[] body = bufferedBody(request);
      String canonicalRequest = createCanonicalRequest(request, body);
      String signature = createSignature(canonicalRequest, credentials.getAWSSecretKey());

      request.setHeader(AUTH_HEADER_NAME, String.format(AUTH_HEADER_FORMAT, algorithm.getName(), signature));
   }

   String createSignature(String canonicalRequest, String secret) {
      return Signer.sign(canonicalRequest, secret, algorithm);
   }

   /**
    * The canonical form of the request as the server will see it once the transport has added the entity headers.
    */
   String createCanonicalRequest(HttpRequest request, byte[] body) {
      Map<String, String> headers = Canonicalizer.headerMap(request.getAllHeaders());
      if (body.length > 0 && !headers.containsKey(CONTENT_LENGTH_HEADER_NAME)) {
         headers.put(CONTENT_LENGTH_HEADER_NAME, String.valueOf(body.length));
      }
      String target = request instanceof HttpUriRequest
            ? transmittedTarget((HttpUriRequest) request) : request.getRequestLine().getUri();
      return Canonicalizer.canonicalize(request.getRequestLine().getMethod(), target, headers, body);
   }

   /**
    * The request target HttpClient puts on the request line: origin-form, fragment dropped, and the path normalized
    * unless the request's {@link RequestConfig} turns normalization off. A client-wide default config is not visible
    * here, so disable normalization on the request itself.
    */
   static String transmittedTarget(HttpUriRequest request) {
      boolean normalize = true;
      if (request instanceof Configurable && ((Configurable) request).getConfig() != null) {
         normalize = ((Configurable) request).getConfig().isNormalizeUri();
      }
      try {
         URI target = URIUtils.rewriteURI(request.getURI(), null,
               normalize ? URIUtils.DROP_FRAGMENT_AND_NORMALIZE : URIUtils.DROP_FRAGMENT);
         return target.toASCIIString();
      } catch (URISyntaxException e) {
         throw new IllegalArgumentException("Invalid request URI " + request.getURI(), e);
      }
   }

   /**
    * Reads the request entity, replacing it with a buffered copy when it could not be read twice or has no known
    * length. Adds the entity's content type as a header so the signed value is the one sent.
    */
   byte[] bufferedBody(HttpRequest request) {
      if (!(request instanceof HttpEntityEnclosingRequest)) {
         return new byte[0];
      }
      HttpEntityEnclosingRequest enclosingRequest = (HttpEntityEnclosingRequest) request;
      HttpEntity entity = enclosingRequest.getEntity();
      if (entity == null) {
         return new byte[0];
      }

      byte[] body;
      try {
         body = EntityUtils.toByteArray(entity);
      } catch (IOException e) {
         throw new UncheckedIOException("Could not read entity " + entity, e);
      }
      if (body == null) {
         body = new byte[0];
      }
      if (!entity.isRepeatable() || entity.isChunked() || entity.getContentLength() < 0) {
         ByteArrayEntity buffered = new ByteArrayEntity(body);
         buffered.setContentType(entity.getContentType());
         buffered.setContentEncoding(entity.getContentEncoding());
         enclosingRequest.setEntity(buffered);
      }

      Header contentType = entity.getContentType();
      if (body.length > 0 && contentType != null && !request.containsHeader(CONTENT_TYPE_HEADER_NAME)) {
         request.addHeader(contentType);
      }
      return body;
   }

   String timestamp() {
      Date date = currentTime != null ? currentTime : Calendar.getInstance().getTime();
      return DateUtils.formatDate(date);
   }
}
