package com.williamcallahan.boxhunt.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UrlUtilsTest {

    @Test
    void resolvesRelativeReferencesAndDropsFragments() {
        assertThat(UrlUtils.resolveReference("https://a.test/gallery/", "../img/x.jpg#top"))
            .isEqualTo("https://a.test/img/x.jpg");
        assertThat(UrlUtils.resolveReference("https://a.test/gallery", "//cdn.a.test/p.png"))
            .isEqualTo("https://cdn.a.test/p.png");
    }

    @Test
    void escapesCharactersThatUriRejects() {
        assertThat(UrlUtils.resolveReference("https://a.test/", "/img/box.jpg?fit=crop|center"))
            .isEqualTo("https://a.test/img/box.jpg?fit=crop%7Ccenter");
        assertThat(UrlUtils.resolveReference("https://a.test/", "/list?tags={a}"))
            .isEqualTo("https://a.test/list?tags=%7Ba%7D");
        assertThat(UrlUtils.resolveReference("https://a.test/", "/my photos/box 1.jpg"))
            .isEqualTo("https://a.test/my%20photos/box%201.jpg");
        assertThat(UrlUtils.resolveReference("https://a.test/", "/img/already%20encoded.jpg"))
            .isEqualTo("https://a.test/img/already%20encoded.jpg");

        String resolved = UrlUtils.resolveReference("https://a.test/", "/images/box.jpg?fit=crop|center");
        assertThat(UrlUtils.isLikelyImageUrl(resolved)).isTrue();
        assertThat(UrlUtils.isSameSite("https://a.test/", resolved)).isTrue();
    }

    @Test
    void rejectsUnusableReferences() {
        assertThat(UrlUtils.resolveReference("https://a.test/", "data:image/png;base64,AAAA")).isNull();
        assertThat(UrlUtils.resolveReference("https://a.test/", "/files/catalog.PDF")).isNull();
        assertThat(UrlUtils.resolveReference("https://a.test/", "ftp://a.test/x.jpg")).isNull();
        assertThat(UrlUtils.resolveReference("https://a.test/", "#section")).isNull();
        assertThat(UrlUtils.resolveReference("https://a.test/", "  ")).isNull();
    }

    @Test
    void recognisesImageUrlsByExtensionOrPathKeyword() {
        assertThat(UrlUtils.isLikelyImageUrl("https://a.test/x/box.JPG")).isTrue();
        assertThat(UrlUtils.isLikelyImageUrl("https://a.test/photos/123")).isTrue();
        assertThat(UrlUtils.isLikelyImageUrl("https://a.test/about")).isFalse();
    }

    @Test
    void sameSiteRequiresHostAndPort() {
        assertThat(UrlUtils.isSameSite("https://a.test/x", "http://A.test/y")).isTrue();
        assertThat(UrlUtils.isSameSite("https://a.test/x", "https://a.test:8443/y")).isFalse();
        assertThat(UrlUtils.isSameSite("https://a.test/x", "https://b.test/x")).isFalse();
    }

    @Test
    void domainLabelStripsWwwAndPort() {
        assertThat(UrlUtils.domainLabel("https://www.deprintedbox.com/gallery")).isEqualTo("deprintedbox");
        assertThat(UrlUtils.domainLabel("http://shop.example.test:8080/")).isEqualTo("shop");
        assertThat(UrlUtils.domainLabel("not a url")).isEqualTo("website");
    }

    @Test
    void originKeepsSchemeHostAndExplicitPort() {
        assertThat(UrlUtils.origin("https://Example.test/a/b?c")).isEqualTo("https://example.test");
        assertThat(UrlUtils.origin("http://example.test:8080/a")).isEqualTo("http://example.test:8080");
    }
}
