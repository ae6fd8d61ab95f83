package io.xaio.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class UrlCanonicalizerTest {

    @Test
    void canonicalizeDropsTrackingParamsDefaultPortAndFragment() {
        String canonical = UrlCanonicalizer.canonicalize(
                "  HTTPS://News.Example.COM:443/a/b?utm_source=x&id=7&fbclid=abc#top ");
        Assertions.assertEquals("https://news.example.com/a/b?id=7", canonical);
    }

    @Test
    void canonicalizeKeepsNonDefaultPortAndAddsRootPath() {
        Assertions.assertEquals("http://example.com:8080/", UrlCanonicalizer.canonicalize("http://example.com:8080"));
    }

    @Test
    void equivalentUrlsShareItemId() {
        String a = UrlCanonicalizer.canonicalize("https://example.com/post?utm_campaign=spring");
        String b = UrlCanonicalizer.canonicalize("https://EXAMPLE.com/post");
        Assertions.assertEquals(a, b);
        String id = UrlCanonicalizer.itemIdFor(a);
        Assertions.assertEquals(16, id.length());
        Assertions.assertEquals(id, UrlCanonicalizer.itemIdFor(b));
        Assertions.assertNotEquals(id, UrlCanonicalizer.itemIdFor("https://example.com/other"));
    }

    @Test
    void rejectsBlankRelativeAndUnparsable() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> UrlCanonicalizer.canonicalize(" "));
        Assertions.assertThrows(IllegalArgumentException.class, () -> UrlCanonicalizer.canonicalize("/just/a/path"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> UrlCanonicalizer.canonicalize("http://exa mple.com/"));
    }

    @Test
    void cleanIsLenient() {
        Assertions.assertEquals("", UrlCanonicalizer.clean(null));
        Assertions.assertEquals("not a url", UrlCanonicalizer.clean("  not a url "));
        Assertions.assertEquals("https://example.com/x", UrlCanonicalizer.clean("https://example.com/x?gclid=1"));
        Assertions.assertEquals("example.com", UrlCanonicalizer.domainOf("https://Example.com/x"));
        Assertions.assertEquals("", UrlCanonicalizer.domainOf("::::"));
    }
}
