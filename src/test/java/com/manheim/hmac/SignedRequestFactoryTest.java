package com.manheim.hmac;

import org.apache.http.HttpEntity;
import org.apache.http.HttpEntityEnclosingRequest;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ContentType;
import org.apache.http.util.EntityUtils;
import org.junit.Before;
import org.junit.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

public class SignedRequestFactoryTest {
   private RequestSigner signer;
   private SignedRequestFactory testObject;

   @Before
   public final void before() {
      signer = mock(RequestSigner.class);
      testObject = new SignedRequestFactory("localhost", 8000, false, signer);
   }

   @Test
   public final void buildsUriFromHostPortAndPath() {
      assertEquals(URI.create("http://localhost:8000/items/"), testObject.uri("/items/", null));
      assertEquals(URI.create("https://example.com:8443/items/"),
            new SignedRequestFactory("example.com", 8443, true, signer).uri("/items/", null));
   }

   @Test
   public final void flattensQueryIntoUri() {
      Map<String, Object> query = new LinkedHashMap<>();
      query.put("name", "value B");
      query.put("array", Arrays.asList(1, 2));

      URI uri = testObject.uri("/items/", query);

      assertEquals("/items/", uri.getRawPath());
      assertEquals("name=value+B&array%5B0%5D=1&array%5B1%5D=2", uri.getRawQuery());
   }

   @Test(expected = IllegalArgumentException.class)
   public final void rejectsRelativePath() {
      testObject.uri("items/", null);
   }

   @Test
   public final void signsCreatedRequest() {
      HttpUriRequest request = testObject.create("GET", "/items/", null, null, null);

      verify(signer).signRequest(request);
      assertEquals("GET", request.getMethod());
      assertFalse(request instanceof HttpEntityEnclosingRequest
            && ((HttpEntityEnclosingRequest) request).getEntity() != null);
   }

   @Test
   public final void serializesJsonBody() throws Exception {
      Map<String, Object> bear = new LinkedHashMap<>();
      bear.put("name", "Paddington");
      bear.put("tags", Collections.singletonList("marmalade"));

      HttpUriRequest request = testObject.createJson("POST", "/bears/", null, bear);

      HttpEntity entity = ((HttpEntityEnclosingRequest) request).getEntity();
      assertEquals("{\"name\":\"Paddington\",\"tags\":[\"marmalade\"]}", EntityUtils.toString(entity));
      assertEquals(ContentType.APPLICATION_JSON.toString(), entity.getContentType().getValue());
      assertTrue(entity.isRepeatable());
   }

   @Test
   public final void jsonWithoutDataHasNoBody() {
      HttpUriRequest request = testObject.createJson("DELETE", "/bears/1", null, null);
      assertFalse(request instanceof HttpEntityEnclosingRequest
            && ((HttpEntityEnclosingRequest) request).getEntity() != null);
   }

   @Test
   public final void signsWithRealSigner() {
      testObject = new SignedRequestFactory("localhost", 8000, false, new HmacRequestSigner("API_KEY", "SECRET"));

      HttpUriRequest request = testObject.create("PUT", "/bears/1", null,
            "{}".getBytes(StandardCharsets.UTF_8), ContentType.APPLICATION_JSON);

      assertEquals("API_KEY", request.getFirstHeader("x-api-key").getValue());
      assertTrue(request.getFirstHeader("authorization").getValue().startsWith("signature sha256 "));
      assertEquals(ContentType.APPLICATION_JSON.toString(), request.getFirstHeader("content-type").getValue());
      assertNull(request.getFirstHeader("content-length"));
   }
}
