package com.manheim.hmac;

/**
 * Thrown when a signature is requested for an algorithm name that is not one of {@link HmacAlgorithm}.
 */
public class UnsupportedAlgorithmException extends IllegalArgumentException {
   private static final long serialVersionUID = 1L;

   private final String algorithm;

   public UnsupportedAlgorithmException(String algorithm) {
      super("Unsupported HMAC algorithm \"" + algorithm + "\"; supported algorithms are: "
            + HmacAlgorithm.supportedNames());
      this.algorithm = algorithm;
   }

   public String getAlgorithm() {
      return algorithm;
   }
}
