package com.manheim.hmac;

import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.utils.DateUtils;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.InputStreamEntity;
import org.apache.http.util.EntityUtils;
import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Calendar;
import java.util.Date;
import java.util.TimeZone;

import static com.manheim.hmac.CanonicalizerTest.EMPTY_BODY_HASH;
import static com.manheim.hmac.CanonicalizerTest.SCENARIO_BODY;
import static com.manheim.hmac.CanonicalizerTest.SCENARIO_CANONICAL;
import static com.manheim.hmac.CanonicalizerTest.SCENARIO_DATE;
import static com.manheim.hmac.CanonicalizerTest.scenarioBody;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Test the client side signing process against the documented scenario request.
 */
public class HmacRequestSignerTest {
   public static final String API_KEY = "12345";
   public static final String SECRET = "SECRET";
   public static final String SCENARIO_ENDPOINT = "http://localhost:8000/items/test?paramA=valueA&paramB=value%20B";
   private Date currentDate;
   private HmacRequestSigner testObject;

   @Before
   public final void before() {
      Calendar calendar = Calendar.getInstance(TimeZone.getTimeZone("GMT"));
      calendar.set(2016, Calendar.APRIL, 20, 18, 48, 24);
      calendar.set(Calendar.MILLISECOND, 0);
      currentDate = calendar.getTime();
      AWSCredentialsProvider credentialsProvider =
            new AWSStaticCredentialsProvider(new BasicAWSCredentials(API_KEY, SECRET));
      testObject = new HmacRequestSigner(credentialsProvider, HmacAlgorithm.SHA256, currentDate);
   }

   @Test
   public final void addsApiKeyAndDateHeaders() {
      HttpGet request = new HttpGet("http://localhost:8000/items/");
      testObject.signRequest(request);

      assertEquals(API_KEY, request.getFirstHeader("x-api-key").getValue());
      assertEquals(DateUtils.formatDate(currentDate), request.getFirstHeader("date").getValue());
      assertEquals(1, request.getHeaders("date").length);
   }

   @Test
   public final void timestampIsRfc1123Formatted() {
      assertEquals("Wed, 20 Apr 2016 18:48:24 GMT", testObject.timestamp());
   }

   @Test
   public final void keepsExistingDateHeader() {
      HttpGet request = new HttpGet("http://localhost:8000/items/");
      request.addHeader("Date", SCENARIO_DATE);
      testObject.signRequest(request);

      Header[] dates = request.getHeaders("date");
      assertEquals(1, dates.length);
      assertEquals(SCENARIO_DATE, dates[0].getValue());
   }

   @Test
   public final void encodesScenarioRequest() {
      HttpPost request = createScenarioRequest();
      request.addHeader("x-api-key", API_KEY);

      assertEquals(SCENARIO_CANONICAL, testObject.createCanonicalRequest(request, scenarioBody()));
   }

   @Test
   public final void addsAuthorizationHeader() {
      HttpPost request = createScenarioRequest();
      String expected = "signature sha256 75d68aedebc886b5f2d76d9f59e57bdced92fbc8f0666201ac104943905ee61d";

      testObject.signRequest(request);

      Header[] authorizations = request.getHeaders("authorization");
      assertEquals(1, authorizations.length);
      assertEquals(expected, authorizations[0].getValue());
   }

   @Test
   public final void signsEntityContentType() {
      HttpPost request = createScenarioRequest();
      request.setEntity(new ByteArrayEntity(scenarioBody(), ContentType.create("application/json")));
      String expected = "signature sha256 7526497cf430e94f0fa6162bca3daad9f31aad9a59acfa1962cb9302f0b903ed";

      testObject.signRequest(request);

      assertEquals("application/json", request.getFirstHeader("content-type").getValue());
      assertEquals(expected, request.getFirstHeader("authorization").getValue());
   }

   @Test
   public final void doesNotAddContentLengthHeader() {
      HttpPost request = createScenarioRequest();
      testObject.signRequest(request);
      assertFalse(request.containsHeader("content-length"));
   }

   @Test
   public final void requestWithoutBodySignsEmptyHash() {
      HttpGet request = new HttpGet("http://localhost:8000/items/");
      request.addHeader("Content-Type", "text/plain");
      request.addHeader("x-api-key", API_KEY);

      String canonical = testObject.createCanonicalRequest(request, new byte[0]);
      assertTrue(canonical.endsWith("\n" + EMPTY_BODY_HASH));
      assertFalse(canonical.contains("content-type"));
   }

   @Test
   public final void signsTargetAsHttpClientSendsIt() {
      HttpGet request = new HttpGet("http://localhost:8000/a//b?x=1#top");

      String[] canonical = testObject.createCanonicalRequest(request, new byte[0]).split("\n");

      assertEquals("/a/b", canonical[1]);
      assertEquals("x=1", canonical[2]);
      assertEquals("/a/b?x=1", HmacRequestSigner.transmittedTarget(request));
   }

   @Test
   public final void keepsTrailingSlashWhenNormalizing() {
      assertEquals("/items/", HmacRequestSigner.transmittedTarget(new HttpGet("http://localhost:8000/items/")));
   }

   @Test
   public final void keepsPathWhenNormalizationIsDisabled() {
      HttpGet request = new HttpGet("http://localhost:8000/a//b");
      request.setConfig(RequestConfig.custom().setNormalizeUri(false).build());

      assertEquals("/a//b", HmacRequestSigner.transmittedTarget(request));
   }

   @Test
   public final void usesConfiguredAlgorithm() {
      AWSCredentialsProvider credentialsProvider =
            new AWSStaticCredentialsProvider(new BasicAWSCredentials(API_KEY, SECRET));
      testObject = new HmacRequestSigner(credentialsProvider, HmacAlgorithm.SHA1, currentDate);
      HttpPost request = createScenarioRequest();

      testObject.signRequest(request);

      assertEquals("signature sha1 67bd5da554eea08b36bd621eb56ff3761bd6cc02",
            request.getFirstHeader("authorization").getValue());
   }

   @Test
   public final void buffersNonRepeatableEntity() throws IOException {
      HttpPost request = createScenarioRequest();
      request.setEntity(new InputStreamEntity(new ByteArrayInputStream(scenarioBody())));

      testObject.signRequest(request);

      HttpEntity entity = request.getEntity();
      assertTrue(entity.isRepeatable());
      assertEquals(15, entity.getContentLength());
      assertEquals(SCENARIO_BODY, EntityUtils.toString(entity));
      assertEquals("signature sha256 75d68aedebc886b5f2d76d9f59e57bdced92fbc8f0666201ac104943905ee61d",
            request.getFirstHeader("authorization").getValue());
   }

   @Test
   public final void keepsRepeatableEntity() {
      HttpPost request = createScenarioRequest();
      HttpEntity entity = request.getEntity();

      byte[] body = testObject.bufferedBody(request);

      assertSame(entity, request.getEntity());
      assertArrayEquals(scenarioBody(), body);
   }

   @Test
   public final void fetchesCredentialsForEveryRequest() {
      AWSCredentialsProvider credentialsProvider = mock(AWSCredentialsProvider.class);
      when(credentialsProvider.getCredentials())
            .thenReturn(new BasicAWSCredentials(API_KEY, SECRET))
            .thenReturn(new BasicAWSCredentials("67890", "ROTATED"));
      testObject = new HmacRequestSigner(credentialsProvider, HmacAlgorithm.SHA256, currentDate);

      HttpPost first = createScenarioRequest();
      HttpPost second = createScenarioRequest();
      testObject.signRequest(first);
      testObject.signRequest(second);

      verify(credentialsProvider, times(2)).getCredentials();
      assertEquals("67890", second.getFirstHeader("x-api-key").getValue());
      assertNotEquals(first.getFirstHeader("authorization").getValue(), second.getFirstHeader("authorization").getValue());
   }

   private static HttpPost createScenarioRequest() {
      HttpPost request = new HttpPost(SCENARIO_ENDPOINT);
      request.addHeader("date", SCENARIO_DATE);
      request.setEntity(new ByteArrayEntity(scenarioBody()));
      return request;
   }
}
