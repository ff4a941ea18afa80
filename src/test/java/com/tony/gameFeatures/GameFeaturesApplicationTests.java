package com.tony.gameFeatures;

import com.tony.gameFeatures.config.FeatureProperties;
import com.tony.gameFeatures.service.FeatureAssemblerService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class GameFeaturesApplicationTests {

    @Autowired
    private FeatureProperties properties;

    @Autowired
    private FeatureAssemblerService assemblerService;

    @Test
    void contextLoads() {
        assertThat(assemblerService).isNotNull();
        assertThat(properties.getWindowSize()).isEqualTo(10);
        assertThat(properties.getPipeline().getInput()).isNullOrEmpty();
    }
}
