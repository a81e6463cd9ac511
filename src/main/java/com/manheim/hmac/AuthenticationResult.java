package com.manheim.hmac;

/**
 * A successfully authenticated request: who sent it and the signature it carried.
 */
public final class AuthenticationResult {
   private final String apiKey;
   private final String secret;
   private final String signature;

   public AuthenticationResult(String apiKey, String secret, String signature) {
      this.apiKey = apiKey;
      this.secret = secret;
      this.signature = signature;
   }

   public String getApiKey() {
      return apiKey;
   }

   public String getSecret() {
      return secret;
   }

   public String getSignature() {
      return signature;
   }

   @Override
   public String toString() {
      return "AuthenticationResult[apiKey=" + apiKey + ", signature=" + signature + "]";
   }
}
