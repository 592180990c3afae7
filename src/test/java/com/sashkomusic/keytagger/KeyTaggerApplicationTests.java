package com.sashkomusic.keytagger;

import com.sashkomusic.keytagger.cli.AnalyzeFolderRunner;
import com.sashkomusic.keytagger.domain.port.FeatureProviderPort;
import com.sashkomusic.keytagger.domain.port.TagStorePort;
import com.sashkomusic.keytagger.domain.service.BatchOrchestrator;
import com.sashkomusic.keytagger.infrastructure.feature.AnalysisJsonFeatureProvider;
import com.sashkomusic.keytagger.infrastructure.tag.JaudiotaggerTagStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class KeyTaggerApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoadsWithAdaptersWired() {
        assertThat(context.getBean(BatchOrchestrator.class)).isNotNull();
        assertThat(context.getBean(FeatureProviderPort.class)).isInstanceOf(AnalysisJsonFeatureProvider.class);
        assertThat(context.getBean(TagStorePort.class)).isInstanceOf(JaudiotaggerTagStore.class);
    }

    @Test
    void runnerIsDisabledInTests() {
        assertThat(context.getBeansOfType(AnalyzeFolderRunner.class)).isEmpty();
    }
}
