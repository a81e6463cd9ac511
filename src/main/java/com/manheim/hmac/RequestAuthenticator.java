package com.manheim.hmac;

import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpEntityEnclosingRequest;
import org.apache.http.HttpRequest;
import org.apache.http.NameValuePair;
import org.apache.http.client.utils.DateUtils;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.protocol.HttpContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Verifies requests signed by {@link HmacRequestSigner}.
 * <p>
 * Each call runs the same steps and stops at the first failure: find the API key, resolve its secret, check the
 * {@code authorization} and {@code date} headers are present, check the date is within the permitted skew, parse
 * the {@code authorization} header, then recompute the signature over the server's view of the request and compare.
 * The returned future completes with an {@link AuthenticationResult}, or exceptionally with an
 * {@link AuthenticationException}.
 * <p>
 * The outcome is also recorded on the request's {@link HttpContext} under the {@code *_ATTRIBUTE} names, for
 * handlers further down the chain. Nothing is shared between calls, so one instance serves concurrent requests.
 */
public class RequestAuthenticator implements Closeable {
   public static final String API_KEY_HEADER_NAME = Canonicalizer.API_KEY_HEADER_NAME;
   public static final String API_KEY_QUERY_PARAMETER = "apiKey";
   public static final String AUTH_HEADER_NAME = "authorization";
   public static final String DATE_HEADER_NAME = Canonicalizer.DATE_HEADER_NAME;
   public static final String SIGNATURE_LABEL = "signature";

   public static final String API_KEY_ATTRIBUTE = "hmac.apiKey";
   public static final String SECRET_ATTRIBUTE = "hmac.secret";
   public static final String AUTHENTICATED_ATTRIBUTE = "hmac.authenticated";
   public static final String SIGNATURE_ATTRIBUTE = "hmac.signature";
   public static final String SIGNATURE_EXPECTED_ATTRIBUTE = "hmac.signatureExpected";

   private static final Logger LOG = LoggerFactory.getLogger(RequestAuthenticator.class);
   private static final String AUTH_HEADER_EXAMPLE =
         "signature sha256 a42d7b09a929b997aa8e6973bdbd5ca94326cbffc3d06a557d9ed36c6b80d4ff";

   private final SecretResolver secretResolver;
   private final AuthenticatorSettings settings;
   private final ScheduledExecutorService timeoutScheduler;
   private final boolean ownsScheduler;
   private final Clock clock;

   public RequestAuthenticator(SecretResolver secretResolver) {
      this(secretResolver, AuthenticatorSettings.defaults());
   }

   public RequestAuthenticator(SecretResolver secretResolver, AuthenticatorSettings settings) {
      this(secretResolver, settings, newTimeoutScheduler(), true, Clock.systemUTC());
   }

   /**
    * Uses a caller-owned scheduler for secret lookup timeouts; {@link #close()} leaves it running.
    */
   public RequestAuthenticator(SecretResolver secretResolver, AuthenticatorSettings settings,
         ScheduledExecutorService timeoutScheduler) {
      this(secretResolver, settings, timeoutScheduler, false, Clock.systemUTC());
   }

   /**
    * Test constructor with overridden clock
    */
   RequestAuthenticator(SecretResolver secretResolver, AuthenticatorSettings settings,
         ScheduledExecutorService timeoutScheduler, boolean ownsScheduler, Clock clock) {
      if (secretResolver == null) {
         throw new IllegalStateException("Missing secret resolver: a SecretResolver must be supplied to look up "
               + "the secret for each API key");
      }
      this.secretResolver = secretResolver;
      this.settings = Objects.requireNonNull(settings, "settings");
      this.timeoutScheduler = Objects.requireNonNull(timeoutScheduler, "timeoutScheduler");
      this.ownsScheduler = ownsScheduler;
      this.clock = Objects.requireNonNull(clock, "clock");
   }

   public AuthenticatorSettings getSettings() {
      return settings;
   }

   /**
    * Authenticates a request whose body has not been read yet. The body is drained from the request entity, up to
    * {@link AuthenticatorSettings#getBodySizeLimit()} bytes, and the entity is replaced with a buffered copy so it
    * can be read again.
    */
   public CompletableFuture<AuthenticationResult> authenticate(HttpRequest request, HttpContext context) {
      context.setAttribute(AUTHENTICATED_ATTRIBUTE, Boolean.FALSE);
      byte[] body;
      try {
         body = drainBody(request);
      } catch (AuthenticationException e) {
         log("Could not read body of {}: {}", request.getRequestLine(), e.getMessage());
         return failed(e);
      }
      return authenticate(request, context, body);
   }

   /**
    * Authenticates a request whose body the caller already holds.
    *
    * @param body the raw body; null or empty for none
    */
   public CompletableFuture<AuthenticationResult> authenticate(final HttpRequest request, final HttpContext context,
         final byte[] body) {
      context.setAttribute(AUTHENTICATED_ATTRIBUTE, Boolean.FALSE);

      final String apiKey = apiKey(request);
      if (apiKey == null) {
         log("Rejecting {}: no API key", request.getRequestLine());
         return failed(new AuthenticationException(AuthenticationError.API_KEY_MISSING, "Missing API key"));
      }
      context.setAttribute(API_KEY_ATTRIBUTE, apiKey);

      return resolveSecret(apiKey).thenCompose(secret -> {
         try {
            return CompletableFuture.completedFuture(verify(request, context, body, apiKey, secret));
         } catch (AuthenticationException e) {
            log("Rejecting {} for API key \"{}\": {} {}", request.getRequestLine(), apiKey, e.getCode(),
                  e.getMessage());
            return RequestAuthenticator.<AuthenticationResult>failed(e);
         }
      });
   }

   AuthenticationResult verify(HttpRequest request, HttpContext context, byte[] body, String apiKey, String secret)
         throws AuthenticationException {
      context.setAttribute(SECRET_ATTRIBUTE, secret);

      Header authorization = request.getFirstHeader(AUTH_HEADER_NAME);
      if (authorization == null) {
         throw new AuthenticationException(AuthenticationError.AUTHORIZATION_HEADER_MISSING,
               "Missing authorization. Please sign all incoming requests with the 'authorization' header.");
      }
      Header date = request.getFirstHeader(DATE_HEADER_NAME);
      if (date == null) {
         throw new AuthenticationException(AuthenticationError.DATE_HEADER_MISSING,
               "Missing timestamp. Please timestamp all incoming requests by including the 'date' header.");
      }

      checkTimestamp(date.getValue());

      String[] components = parseAuthorization(authorization.getValue());
      HmacAlgorithm algorithm;
      try {
         algorithm = HmacAlgorithm.forName(components[1]);
      } catch (UnsupportedAlgorithmException e) {
         throw new AuthenticationException(AuthenticationError.HMAC_ALGORITHM_INVALID,
               "Authorization header sent invalid algorithm: \"" + components[1]
                     + "\". The only supported hmac algorithms are: " + HmacAlgorithm.supportedNames(), e);
      }
      String signature = components[2];

      String canonical = Canonicalizer.canonicalize(request, body);
      String expectedSignature = Signer.sign(canonical, secret, algorithm);

      context.setAttribute(SIGNATURE_ATTRIBUTE, signature);
      context.setAttribute(SIGNATURE_EXPECTED_ATTRIBUTE, expectedSignature);

      if (!MessageDigest.isEqual(expectedSignature.getBytes(StandardCharsets.UTF_8),
            signature.getBytes(StandardCharsets.UTF_8))) {
         throw new AuthenticationException(AuthenticationError.SIGNATURE_INVALID, "Signature is invalid.");
      }

      context.setAttribute(AUTHENTICATED_ATTRIBUTE, Boolean.TRUE);
      log("Authenticated {} for API key \"{}\"", request.getRequestLine(), apiKey);
      return new AuthenticationResult(apiKey, secret, signature);
   }

   /**
    * The API key from the {@code x-api-key} header, falling back to the {@code apiKey} query parameter.
    */
   String apiKey(HttpRequest request) {
      Header header = request.getFirstHeader(API_KEY_HEADER_NAME);
      if (header != null) {
         return header.getValue();
      }
      String query = Canonicalizer.requestQuery(request.getRequestLine().getUri());
      for (NameValuePair param : Canonicalizer.parseQuery(query)) {
         if (API_KEY_QUERY_PARAMETER.equals(param.getName()) && param.getValue() != null) {
            return param.getValue();
         }
      }
      return null;
   }

   /**
    * Asks the resolver for the secret, racing it against the timeout. Whichever settles first decides the outcome;
    * later settlements are ignored.
    */
   CompletableFuture<String> resolveSecret(final String apiKey) {
      final CompletableFuture<String> outcome = new CompletableFuture<>();
      final long timeoutMs = settings.getSecretForKeyTimeoutMs();
      final ScheduledFuture<?> timer;
      try {
         timer = timeoutScheduler.schedule(() -> {
            boolean timedOut = outcome.completeExceptionally(new AuthenticationException(
                  AuthenticationError.INTERNAL_ERROR_SECRET_TIMEOUT,
                  "Internal failure while attempting to locate secret for API key \"" + apiKey
                        + "\": secret lookup has timed out after " + timeoutMs + " ms"));
            if (timedOut) {
               LOG.warn("Secret lookup for API key \"{}\" timed out after {} ms", apiKey, timeoutMs);
            }
         }, timeoutMs, TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException e) {
         LOG.warn("Cannot schedule secret lookup timeout for API key \"{}\"; the scheduler is shut down", apiKey);
         return failed(new AuthenticationException(AuthenticationError.INTERNAL_ERROR_SECRET_DISCOVERY,
               "Internal failure while attempting to locate secret for API key \"" + apiKey
                     + "\": the authenticator is closed", e));
      }

      CompletableFuture<String> pending;
      try {
         pending = secretResolver.secretForKey(apiKey);
      } catch (RuntimeException e) {
         pending = failed(e);
      }
      if (pending == null) {
         pending = failed(new IllegalStateException("Secret resolver returned no future"));
      }

      pending.whenComplete((secret, error) -> {
         timer.cancel(false);
         boolean settled;
         if (error != null) {
            settled = outcome.completeExceptionally(discoveryFailure(apiKey, error));
         } else if (secret == null) {
            settled = outcome.completeExceptionally(new AuthenticationException(
                  AuthenticationError.API_KEY_UNRECOGNIZED, "Unrecognized API key: " + apiKey));
         } else {
            settled = outcome.complete(secret);
         }
         if (!settled) {
            log("Ignoring late secret lookup result for API key \"{}\"", apiKey);
         }
      });
      return outcome;
   }

   private AuthenticationException discoveryFailure(String apiKey, Throwable error) {
      AuthenticationException reported = AuthenticationException.unwrap(error);
      if (reported != null) {
         return reported;
      }
      LOG.warn("Failed to load secret for API key \"{}\"", apiKey, error);
      return new AuthenticationException(AuthenticationError.INTERNAL_ERROR_SECRET_DISCOVERY,
            "Internal failure while attempting to locate secret for API key \"" + apiKey + "\"", error);
   }

   void checkTimestamp(String dateHeader) throws AuthenticationException {
      Date now = new Date(clock.millis());
      Date requestTime = DateUtils.parseDate(dateHeader);
      if (requestTime == null) {
         throw new AuthenticationException(AuthenticationError.DATE_HEADER_INVALID,
               "Timestamp could not be parsed. Received: \"" + dateHeader + "\"",
               timestampDetails(dateHeader, now));
      }
      if (Math.abs(now.getTime() - requestTime.getTime()) > settings.getPermittedTimestampSkewMs()) {
         throw new AuthenticationException(AuthenticationError.DATE_HEADER_INVALID,
               "Timestamp is outside the permitted window. Received: \"" + dateHeader + "\" current time: \""
                     + DateUtils.formatDate(now) + "\"",
               timestampDetails(dateHeader, now));
      }
   }

   private static Map<String, String> timestampDetails(String dateHeader, Date now) {
      Map<String, String> details = new LinkedHashMap<>();
      details.put("received", dateHeader);
      details.put("time", DateUtils.formatDate(now));
      return details;
   }

   /**
    * Splits {@code signature <algorithm> <hex digest>} into its three tokens.
    */
   static String[] parseAuthorization(String authorization) throws AuthenticationException {
      String[] components = authorization.trim().split("\\s+");
      if (components.length != 3 || !SIGNATURE_LABEL.equals(components[0])) {
         throw new AuthenticationException(AuthenticationError.AUTHORIZATION_HEADER_INVALID,
               "Authorization header is improperly formatted: \"" + authorization + "\"",
               Collections.singletonMap("details", "It should look like: \"" + AUTH_HEADER_EXAMPLE + "\""));
      }
      return components;
   }

   byte[] drainBody(HttpRequest request) throws AuthenticationException {
      if (!(request instanceof HttpEntityEnclosingRequest)) {
         return new byte[0];
      }
      HttpEntityEnclosingRequest enclosingRequest = (HttpEntityEnclosingRequest) request;
      HttpEntity entity = enclosingRequest.getEntity();
      if (entity == null) {
         return new byte[0];
      }
      long limit = settings.getBodySizeLimit();
      if (entity.getContentLength() > limit) {
         throw bodyTooLarge(limit);
      }
      byte[] body;
      try (InputStream content = entity.getContent()) {
         ByteArrayOutputStream buffer = new ByteArrayOutputStream();
         byte[] chunk = new byte[16384];
         int bytesRead;
         while ((bytesRead = content.read(chunk, 0, chunk.length)) != -1) {
            if (buffer.size() + (long) bytesRead > limit) {
               throw bodyTooLarge(limit);
            }
            buffer.write(chunk, 0, bytesRead);
         }
         body = buffer.toByteArray();
      } catch (IOException e) {
         throw new AuthenticationException(AuthenticationError.INTERNAL_ERROR_BODY_READ,
               "Internal failure while reading the request body", e);
      }

      ByteArrayEntity buffered = new ByteArrayEntity(body);
      buffered.setContentType(entity.getContentType());
      buffered.setContentEncoding(entity.getContentEncoding());
      enclosingRequest.setEntity(buffered);
      return body;
   }

   private static AuthenticationException bodyTooLarge(long limit) {
      return new AuthenticationException(AuthenticationError.BODY_SIZE_LIMIT_EXCEEDED,
            "Request body exceeds the limit of " + limit + " bytes");
   }

   private void log(String format, Object... arguments) {
      if (settings.isVerbose()) {
         LOG.info(format, arguments);
      } else {
         LOG.debug(format, arguments);
      }
   }

   @Override
   public void close() {
      if (ownsScheduler) {
         timeoutScheduler.shutdownNow();
      }
   }

   private static ScheduledExecutorService newTimeoutScheduler() {
      ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, runnable -> {
         Thread thread = new Thread(runnable, "hmac-secret-timeout");
         thread.setDaemon(true);
         return thread;
      });
      scheduler.setRemoveOnCancelPolicy(true);
      return scheduler;
   }

   static <T> CompletableFuture<T> failed(Throwable error) {
      CompletableFuture<T> future = new CompletableFuture<>();
      future.completeExceptionally(error);
      return future;
   }
}
