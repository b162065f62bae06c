/**
 * Basic application context load test for BoxHunt
 *
 * @author William Callahan
 *
 * Features:
 * - Verifies that the Spring application context loads with the test profile
 * - Confirms that keyword sources without API keys are left out of the source manager
 * - Runs the command-line runner with no options, which only logs usage
 */

package com.williamcallahan.boxhunt;

import com.williamcallahan.boxhunt.config.HarvestProperties;
import com.williamcallahan.boxhunt.service.HarvestOrchestrator;
import com.williamcallahan.boxhunt.service.crawler.WebsiteCrawler;
import com.williamcallahan.boxhunt.service.source.SourceManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
class BoxHuntApplicationTests {

    @Autowired
    private HarvestOrchestrator orchestrator;

    @Autowired
    private SourceManager keywordSourceManager;

    @Autowired
    private WebsiteCrawler websiteCrawler;

    @Autowired
    private HarvestProperties properties;

    /**
     * Verifies that the Spring application context loads successfully
     */
    @Test
    void contextLoads() {
        assertNotNull(orchestrator);
        assertNotNull(websiteCrawler);
    }

    @Test
    void sourcesWithoutKeysAreNotRegistered() {
        assertTrue(keywordSourceManager.getClients().isEmpty());
        assertTrue(keywordSourceManager.availableSources().isEmpty());
    }

    @Test
    void bindsTestProperties() {
        assertEquals(Duration.ZERO, properties.getHttp().getRequestDelay());
        assertEquals(256, properties.getImages().getMinWidth());
        assertTrue(properties.getDataDir().endsWith("boxhunt-test"));
    }

    @Test
    void parsesCommaSeparatedOptions() {
        assertEquals(List.of("pexels", "unsplash"), BoxHuntApplication.parseList(" pexels, ,unsplash "));
        assertTrue(BoxHuntApplication.parseList(null).isEmpty());
    }
}
