package com.williamcallahan.boxhunt.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ImageFileNamesTest {

    @Test
    void combinesSourceTimestampAndUrlHash() {
        String name = ImageFileNames.generate("pexels", 1700000000L, "https://images.test/a.jpg");

        assertThat(name).matches("pexels_1700000000_[0-9a-f]{12}\\.jpg");
    }

    @Test
    void differentUrlsInTheSameSecondGetDifferentNames() {
        String first = ImageFileNames.generate("site", 1L, "https://images.test/a.jpg");
        String second = ImageFileNames.generate("site", 1L, "https://images.test/b.jpg");

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void knownMd5Prefix() {
        // md5("") = d41d8cd98f00b204e9800998ecf8427e
        assertThat(ImageFileNames.urlHash("")).isEqualTo("d41d8cd98f00");
    }

    @Test
    void sanitizesSourceTags() {
        assertThat(ImageFileNames.sanitizeSource("My Site/../x")).isEqualTo("my_site_x");
        assertThat(ImageFileNames.sanitizeSource(" ")).isEqualTo("image");
    }
}
