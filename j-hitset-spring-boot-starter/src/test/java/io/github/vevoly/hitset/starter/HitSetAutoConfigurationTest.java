package io.github.vevoly.hitset.starter;

import io.github.vevoly.hitset.api.constants.HitSetType;
import io.github.vevoly.hitset.api.exception.InitializationException;
import io.github.vevoly.hitset.core.HitSet;
import io.github.vevoly.hitset.core.HitSetFactory;
import io.github.vevoly.hitset.core.archive.HitSetArchive;
import io.github.vevoly.hitset.core.metrics.HitSetMetrics;
import io.github.vevoly.hitset.core.params.BloomParams;
import io.github.vevoly.hitset.core.params.ExplicitHashParams;
import io.github.vevoly.hitset.core.params.HitSetParams;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HitSetAutoConfiguration Tests")
class HitSetAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(HitSetAutoConfiguration.class));

    @TempDir
    Path baseDir;

    @Test
    @DisplayName("Should build bloom params from defaults")
    void testDefaults_BloomParams() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(HitSetParams.class);
            assertThat(context).hasSingleBean(HitSetFactory.class);
            assertThat(context).doesNotHaveBean(HitSetArchive.class);
            assertThat(context).doesNotHaveBean(HitSetMetrics.class);
            BloomParams params = context.getBean(HitSetParams.class).getAsType(BloomParams.class).orElseThrow();
            assertThat(params.getFalsePositive()).isEqualTo(0.05);
            assertThat(params.getTargetSize()).isEqualTo(1000L);
        });
    }

    @Test
    @DisplayName("Should bind the bloom settings")
    void testBloomProperties() {
        contextRunner
                .withPropertyValues("j-hitset.bloom.false-positive=0.01",
                        "j-hitset.bloom.target-size=50",
                        "j-hitset.bloom.seed=7")
                .run(context -> {
                    HitSetParams params = context.getBean(HitSetParams.class);
                    assertThat(params).isEqualTo(new BloomParams(0.01, 50, 7));
                    HitSet hitSet = context.getBean(HitSetFactory.class).create();
                    assertThat(hitSet.getType()).isEqualTo(HitSetType.BLOOM);
                });
    }

    @Test
    @DisplayName("Should honour the configured type")
    void testExplicitType() {
        contextRunner
                .withPropertyValues("j-hitset.type=explicit_hash")
                .run(context -> assertThat(context.getBean(HitSetParams.class)).isInstanceOf(ExplicitHashParams.class));
    }

    @Test
    @DisplayName("Should fail startup on an invalid bloom rate")
    void testInvalidRate_FailsStartup() {
        contextRunner
                .withPropertyValues("j-hitset.bloom.false-positive=1.5")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(InitializationException.class);
                    assertThat(context.getStartupFailure()).rootCause()
                            .hasMessageStartingWith("j-hitset.bloom.false-positive=1.5: ");
                });
    }

    @Test
    @DisplayName("Should create archive and metrics beans when configured")
    void testArchiveAndMetrics() {
        contextRunner
                .withUserConfiguration(RegistryConfiguration.class)
                .withPropertyValues("j-hitset.archive.base-dir=" + baseDir, "j-hitset.metrics-prefix=custom")
                .run(context -> {
                    assertThat(context).hasSingleBean(HitSetArchive.class);
                    assertThat(context).hasSingleBean(HitSetMetrics.class);
                    assertThat(context.getBean(HitSetMetrics.class).getInsertCountName()).isEqualTo("custom.insert.count");
                    assertThat(context.getBean(HitSetArchive.class).getArchiveDir()).startsWithRaw(baseDir);
                });
    }

    @Test
    @DisplayName("Should back off when the user defines params")
    void testUserParams_Win() {
        contextRunner
                .withUserConfiguration(UserParamsConfiguration.class)
                .run(context -> assertThat(context.getBean(HitSetParams.class)).isInstanceOf(ExplicitHashParams.class));
    }

    @Configuration(proxyBeanMethods = false)
    static class RegistryConfiguration {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class UserParamsConfiguration {
        @Bean
        HitSetParams userParams() {
            return new ExplicitHashParams();
        }
    }
}
