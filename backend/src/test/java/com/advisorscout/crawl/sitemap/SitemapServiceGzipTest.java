package com.advisorscout.crawl.sitemap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.advisorscout.config.ScoutProperties;
import com.advisorscout.crawl.http.PoliteHttpClient;
import com.advisorscout.crawl.http.PoliteHttpClientFactory;
import com.advisorscout.crawl.model.HttpFetchResult;
import com.advisorscout.crawl.model.SitemapExpansionResult;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.zip.GZIPOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SitemapServiceGzipTest {

  @Mock private PoliteHttpClientFactory clientFactory;
  @Mock private PoliteHttpClient httpClient;

  @Test
  void extractsUrlsFromGzippedSitemapWhenUrlEndsWithGz() throws Exception {
    SitemapExpansionResult result =
        expandWithResponse(
            "https://example.com/sitemap.xml.gz", "https://example.com/sitemap.xml.gz", null, gzip());
    assertExtracted(result);
  }

  @Test
  void extractsUrlsFromGzippedSitemapWhenContentEncodingIsGzip() throws Exception {
    SitemapExpansionResult result =
        expandWithResponse(
            "https://example.com/sitemap.xml", "https://example.com/sitemap.xml", "gzip", gzip());
    assertExtracted(result);
  }

  @Test
  void readsPlainBodyWhenGzUrlWasServedInflated() throws Exception {
    SitemapExpansionResult result =
        expandWithResponse(
            "https://example.com/sitemap.xml.gz",
            "https://example.com/sitemap.xml.gz",
            null,
            urlset().getBytes(StandardCharsets.UTF_8));
    assertExtracted(result);
  }

  @Test
  void countsCorruptGzipAsDecodeError() throws Exception {
    byte[] corrupt = {0x1f, (byte) 0x8b, 0x00, 0x01, 0x02};
    SitemapExpansionResult result =
        expandWithResponse(
            "https://example.com/sitemap.xml.gz", "https://example.com/sitemap.xml.gz", null, corrupt);
    assertTrue(result.profileUrls().isEmpty());
    assertEquals(1, result.errors().get("gzip_decode_error"));
  }

  private SitemapExpansionResult expandWithResponse(
      String seedUrl, String finalUrl, String contentEncoding, byte[] body) {
    HttpFetchResult fetchResult =
        new HttpFetchResult(
            seedUrl,
            URI.create(finalUrl),
            200,
            body,
            "application/xml",
            contentEncoding,
            Instant.now(),
            Duration.ofMillis(20),
            null,
            null);

    when(clientFactory.create()).thenReturn(httpClient);
    when(httpClient.get(eq(seedUrl), eq(PoliteHttpClient.XML_ACCEPT), any(Duration.class)))
        .thenReturn(fetchResult);

    SitemapService service =
        new SitemapService(clientFactory, new SitemapLocParser(), new ScoutProperties());
    return service.expand(List.of(seedUrl));
  }

  private static String urlset() {
    return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
        + "<urlset xmlns=\"http://www.sitemaps.org/schemas/sitemap/0.9\">"
        + "<url><loc>https://example.com/vermoegensberater/alpha</loc></url>"
        + "<url><loc>https://example.com/vermoegensberater/beta</loc></url>"
        + "<url><loc>https://example.com/kontakt</loc></url>"
        + "</urlset>";
  }

  private static byte[] gzip() throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (GZIPOutputStream out = new GZIPOutputStream(bytes)) {
      out.write(urlset().getBytes(StandardCharsets.UTF_8));
    }
    return bytes.toByteArray();
  }

  private void assertExtracted(SitemapExpansionResult result) {
    assertEquals(2, result.profileUrls().size());
    assertTrue(result.profileUrls().contains("https://example.com/vermoegensberater/alpha"));
    assertTrue(result.profileUrls().contains("https://example.com/vermoegensberater/beta"));
  }
}
