package com.manheim.hmac;

/**
 * Why a request failed to authenticate. The constant name is the stable, machine-readable error code reported to
 * callers.
 */
public enum AuthenticationError {
   API_KEY_MISSING(401),
   API_KEY_UNRECOGNIZED(401),
   AUTHORIZATION_HEADER_MISSING(401),
   AUTHORIZATION_HEADER_INVALID(401),
   DATE_HEADER_MISSING(401),
   DATE_HEADER_INVALID(401),
   HMAC_ALGORITHM_INVALID(401),
   SIGNATURE_INVALID(401),
   BODY_SIZE_LIMIT_EXCEEDED(413),
   INTERNAL_ERROR_BODY_READ(500),
   INTERNAL_ERROR_SECRET_DISCOVERY(500),
   INTERNAL_ERROR_SECRET_TIMEOUT(500);

   private final int statusCode;

   AuthenticationError(int statusCode) {
      this.statusCode = statusCode;
   }

   public String getCode() {
      return name();
   }

   /**
    * The HTTP status a server should answer with.
    */
   public int getStatusCode() {
      return statusCode;
   }

   /**
    * True for infrastructure failures on the server side, false when the caller sent a bad request.
    */
   public boolean isInternal() {
      return statusCode >= 500;
   }
}
