package com.manheim.hmac;

/**
 * Tunables for {@link RequestAuthenticator}. Immutable; create with {@link #builder()}.
 */
public final class AuthenticatorSettings {
   public static final long DEFAULT_SECRET_FOR_KEY_TIMEOUT_MS = 10 * 1000;
   public static final long DEFAULT_PERMITTED_TIMESTAMP_SKEW_MS = 60 * 1000;
   public static final long DEFAULT_BODY_SIZE_LIMIT = 5 * 1024 * 1024;

   private static final AuthenticatorSettings DEFAULTS = builder().build();

   private final long secretForKeyTimeoutMs;
   private final long permittedTimestampSkewMs;
   private final long bodySizeLimit;
   private final boolean verbose;

   private AuthenticatorSettings(Builder builder) {
      this.secretForKeyTimeoutMs = builder.secretForKeyTimeoutMs;
      this.permittedTimestampSkewMs = builder.permittedTimestampSkewMs;
      this.bodySizeLimit = builder.bodySizeLimit;
      this.verbose = builder.verbose;
   }

   public static AuthenticatorSettings defaults() {
      return DEFAULTS;
   }

   public static Builder builder() {
      return new Builder();
   }

   /**
    * How long to wait for a {@link SecretResolver} before failing with
    * {@link AuthenticationError#INTERNAL_ERROR_SECRET_TIMEOUT}.
    */
   public long getSecretForKeyTimeoutMs() {
      return secretForKeyTimeoutMs;
   }

   /**
    * Largest accepted distance, in either direction, between the {@code date} header and the server clock.
    */
   public long getPermittedTimestampSkewMs() {
      return permittedTimestampSkewMs;
   }

   /**
    * Largest body, in bytes, the authenticator reads when asked to drain a request body itself.
    */
   public long getBodySizeLimit() {
      return bodySizeLimit;
   }

   /**
    * Log each verification step at INFO instead of DEBUG.
    */
   public boolean isVerbose() {
      return verbose;
   }

   @Override
   public String toString() {
      return "AuthenticatorSettings[secretForKeyTimeoutMs=" + secretForKeyTimeoutMs
            + ", permittedTimestampSkewMs=" + permittedTimestampSkewMs
            + ", bodySizeLimit=" + bodySizeLimit
            + ", verbose=" + verbose + "]";
   }

   public static final class Builder {
      private long secretForKeyTimeoutMs = DEFAULT_SECRET_FOR_KEY_TIMEOUT_MS;
      private long permittedTimestampSkewMs = DEFAULT_PERMITTED_TIMESTAMP_SKEW_MS;
      private long bodySizeLimit = DEFAULT_BODY_SIZE_LIMIT;
      private boolean verbose;

      private Builder() {
      }

      public Builder secretForKeyTimeoutMs(long secretForKeyTimeoutMs) {
         if (secretForKeyTimeoutMs < 0) {
            throw new IllegalArgumentException("secretForKeyTimeoutMs must not be negative: " + secretForKeyTimeoutMs);
         }
         this.secretForKeyTimeoutMs = secretForKeyTimeoutMs;
         return this;
      }

      public Builder permittedTimestampSkewMs(long permittedTimestampSkewMs) {
         if (permittedTimestampSkewMs < 0) {
            throw new IllegalArgumentException(
                  "permittedTimestampSkewMs must not be negative: " + permittedTimestampSkewMs);
         }
         this.permittedTimestampSkewMs = permittedTimestampSkewMs;
         return this;
      }

      public Builder bodySizeLimit(long bodySizeLimit) {
         if (bodySizeLimit <= 0) {
            throw new IllegalArgumentException("bodySizeLimit must be positive: " + bodySizeLimit);
         }
         this.bodySizeLimit = bodySizeLimit;
         return this;
      }

      public Builder verbose(boolean verbose) {
         this.verbose = verbose;
         return this;
      }

      public AuthenticatorSettings build() {
         return new AuthenticatorSettings(this);
      }
   }
}
