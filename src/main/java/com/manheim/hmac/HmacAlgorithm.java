package com.manheim.hmac;

/**
 * The HMAC variants a request may be signed with. The wire name is the token that appears in the
 * {@code authorization} header, e.g. {@code signature sha256 <hex>}.
 */
public enum HmacAlgorithm {
   SHA1("sha1", "HmacSHA1"),
   SHA256("sha256", "HmacSHA256"),
   SHA512("sha512", "HmacSHA512");

   private final String name;
   private final String jcaName;

   HmacAlgorithm(String name, String jcaName) {
      this.name = name;
      this.jcaName = jcaName;
   }

   /**
    * The name used on the wire.
    */
   public String getName() {
      return name;
   }

   String getJcaName() {
      return jcaName;
   }

   /**
    * Looks up an algorithm by its wire name. Names are case sensitive.
    *
    * @throws UnsupportedAlgorithmException if no supported algorithm has that name
    */
   public static HmacAlgorithm forName(String name) {
      for (HmacAlgorithm algorithm : values()) {
         if (algorithm.name.equals(name)) {
            return algorithm;
         }
      }
      throw new UnsupportedAlgorithmException(name);
   }

   /**
    * The wire names of all supported algorithms, comma separated, for error messages.
    */
   static String supportedNames() {
      StringBuilder result = new StringBuilder();
      for (HmacAlgorithm algorithm : values()) {
         if (result.length() > 0) {
            result.append(", ");
         }
         result.append(algorithm.name);
      }
      return result.toString();
   }

   @Override
   public String toString() {
      return name;
   }
}
