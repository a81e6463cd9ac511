package com.manheim.hmac;

import org.apache.http.NameValuePair;
import org.apache.http.message.BasicNameValuePair;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Turns structured query parameters into flat name/value pairs, using bracket notation for nesting:
 *
 * <pre>
 * {a: 1, b: {c: true}, d: [x, y], e: null}  =&gt;  a=1, b[c]=true, d[0]=x, d[1]=y, e=
 * </pre>
 *
 * Object arrays are treated like lists. Scalars are rendered with {@link String#valueOf(Object)}, null becomes the
 * empty string, and empty maps, arrays and collections produce no pairs. Map entries and elements keep their
 * iteration order.
 */
public final class QueryFlattener {

   private QueryFlattener() {
   }

   public static List<NameValuePair> flatten(Map<String, ?> query) {
      List<NameValuePair> result = new ArrayList<>();
      if (query == null) {
         return result;
      }
      for (Map.Entry<String, ?> entry : query.entrySet()) {
         flatten(entry.getKey(), entry.getValue(), result);
      }
      return result;
   }

   private static void flatten(String name, Object value, List<NameValuePair> result) {
      if (value instanceof Map) {
         for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            flatten(name + '[' + entry.getKey() + ']', entry.getValue(), result);
         }
      } else if (value instanceof Iterable) {
         int index = 0;
         for (Object element : (Iterable<?>) value) {
            flatten(name + '[' + index++ + ']', element, result);
         }
      } else if (value instanceof Object[]) {
         flatten(name, Arrays.asList((Object[]) value), result);
      } else {
         result.add(new BasicNameValuePair(name, value != null ? String.valueOf(value) : ""));
      }
   }
}
