package com.manheim.hmac;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Computes the HMAC of a canonical request string. Stateless; every call computes the digest from scratch.
 */
public final class Signer {
   public static final String PAYLOAD_HASHING_ALGORITHM = "SHA-256";

   private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();

   private Signer() {
   }

   /**
    * Signs the canonical string with the secret, returning the lower-case hex digest.
    */
   public static String sign(String canonicalString, String secret, HmacAlgorithm algorithm) {
      return toHexString(hmac(canonicalString, getBytes(secret), algorithm));
   }

   /**
    * Same as {@link #sign(String, String, HmacAlgorithm)}, naming the algorithm as it appears on the wire.
    *
    * @throws UnsupportedAlgorithmException if the name is not a supported algorithm
    */
   public static String sign(String canonicalString, String secret, String algorithm) {
      return sign(canonicalString, secret, HmacAlgorithm.forName(algorithm));
   }

   static byte[] hmac(String data, byte[] key, HmacAlgorithm algorithm) {
      try {
         Mac mac = Mac.getInstance(algorithm.getJcaName());
         mac.init(new SecretKeySpec(key, algorithm.getJcaName()));
         return mac.doFinal(getBytes(data));
      } catch (NoSuchAlgorithmException | InvalidKeyException e) {
         throw new IllegalStateException("Could not compute " + algorithm.getJcaName(), e);
      }
   }

   static byte[] sha256(byte[] data) {
      try {
         return MessageDigest.getInstance(PAYLOAD_HASHING_ALGORITHM).digest(data);
      } catch (NoSuchAlgorithmException e) {
         throw new IllegalStateException(e);
      }
   }

   static String toHexString(byte[] data) {
      char[] result = new char[data.length * 2];
      for (int i = 0; i < data.length; i++) {
         int v = data[i] & 0xFF;
         result[i * 2] = HEX_CHARS[v >>> 4];
         result[i * 2 + 1] = HEX_CHARS[v & 0x0F];
      }
      return new String(result);
   }

   static byte[] getBytes(String value) {
      return value.getBytes(StandardCharsets.UTF_8);
   }
}
