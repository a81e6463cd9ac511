package com.manheim.hmac;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Looks up the shared secret for an API key. Supplied by the application; the authenticator never stores secrets.
 * <p>
 * Complete the future with {@code null} when the key is unknown, and exceptionally when the lookup itself failed.
 * Completing exceptionally with an {@link AuthenticationException} reports that exception to the caller as is.
 */
@FunctionalInterface
public interface SecretResolver {

   CompletableFuture<String> secretForKey(String apiKey);

   /**
    * Resolves secrets from a fixed map.
    */
   static SecretResolver fromMap(Map<String, String> secretsForKeys) {
      final Map<String, String> secrets = Collections.unmodifiableMap(new HashMap<>(secretsForKeys));
      return apiKey -> CompletableFuture.completedFuture(secrets.get(apiKey));
   }

   /**
    * Runs a blocking lookup, e.g. a database query, on the given executor. The lookup returns null for unknown keys.
    */
   static SecretResolver blocking(Function<String, String> lookup, Executor executor) {
      Objects.requireNonNull(lookup, "lookup");
      Objects.requireNonNull(executor, "executor");
      return apiKey -> CompletableFuture.supplyAsync(() -> lookup.apply(apiKey), executor);
   }
}
