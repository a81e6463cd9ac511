package com.manheim.hmac;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * A request failed to authenticate. Carries a stable {@link AuthenticationError} code, a human-readable message,
 * and optional extra context, e.g. the server time for a stale {@code date} header.
 */
public class AuthenticationException extends Exception {
   private static final long serialVersionUID = 1L;

   private final AuthenticationError error;
   private final Map<String, String> details;

   public AuthenticationException(AuthenticationError error, String message) {
      this(error, message, Collections.<String, String>emptyMap(), null);
   }

   public AuthenticationException(AuthenticationError error, String message, Throwable cause) {
      this(error, message, Collections.<String, String>emptyMap(), cause);
   }

   public AuthenticationException(AuthenticationError error, String message, Map<String, String> details) {
      this(error, message, details, null);
   }

   public AuthenticationException(AuthenticationError error, String message, Map<String, String> details,
         Throwable cause) {
      super(message, cause);
      this.error = error;
      this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
   }

   public AuthenticationError getError() {
      return error;
   }

   public String getCode() {
      return error.getCode();
   }

   public Map<String, String> getDetails() {
      return details;
   }

   /**
    * The error as reported to callers: {@code message}, {@code code}, then any details.
    */
   public Map<String, String> toMap() {
      Map<String, String> result = new LinkedHashMap<>();
      result.put("message", getMessage());
      result.put("code", getCode());
      result.putAll(details);
      return result;
   }

   /**
    * Finds the authentication failure behind a future's exceptional completion, or null if the failure was
    * something else.
    */
   public static AuthenticationException unwrap(Throwable failure) {
      Throwable cause = failure;
      while ((cause instanceof CompletionException || cause instanceof ExecutionException)
            && cause.getCause() != null) {
         cause = cause.getCause();
      }
      return cause instanceof AuthenticationException ? (AuthenticationException) cause : null;
   }

   @Override
   public String toString() {
      return getClass().getSimpleName() + "[" + getCode() + "]: " + getMessage();
   }
}
