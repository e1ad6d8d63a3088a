package org.example.dxf;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class DxfConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(DxfConfiguration.class));

    @Test
    void defaults_matchLibraryDefaults() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(DxfReader.class).hasSingleBean(DxfWriter.class);
            assertThat(context.getBean(DxfOptions.class)).isEqualTo(DxfOptions.defaults());
        });
    }

    @Test
    void properties_areBoundIntoOptions() {
        runner.withPropertyValues(
                        "app.dxf.default-version=R2000",
                        "app.dxf.version-policy=RAISE",
                        "app.dxf.duplicate-block-policy=LAST_WINS",
                        "app.dxf.default-encoding=UTF-8",
                        "app.dxf.hatch-pattern-scale=2.5",
                        "app.dxf.measurement=IMPERIAL")
                .run(context -> {
                    DxfOptions options = context.getBean(DxfOptions.class);
                    assertThat(options.defaultVersion()).isEqualTo(DxfVersion.R2000);
                    assertThat(options.versionPolicy()).isEqualTo(VersionConflictPolicy.RAISE);
                    assertThat(options.duplicateBlockPolicy()).isEqualTo(DuplicateNamePolicy.LAST_WINS);
                    assertThat(options.duplicateTableEntryPolicy()).isEqualTo(DuplicateNamePolicy.FIRST_WINS);
                    assertThat(options.defaultEncoding()).isEqualTo(StandardCharsets.UTF_8);
                    assertThat(options.hatchPatternScale()).isEqualTo(2.5);
                    assertThat(options.measurement()).isEqualTo(Measurement.IMPERIAL);
                    assertThat(context.getBean(DxfReader.class).options()).isSameAs(options);
                });
    }

    @Test
    void invalidProperties_failStartup() {
        runner.withPropertyValues("app.dxf.hatch-pattern-scale=0")
                .run(context -> assertThat(context).hasFailed());
        runner.withPropertyValues("app.dxf.default-encoding=")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void userOptions_replaceDefaults() {
        runner.withUserConfiguration(CustomOptions.class)
                .run(context -> assertThat(context.getBean(DxfReader.class).options().versionPolicy())
                        .isEqualTo(VersionConflictPolicy.UPGRADE));
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomOptions {

        @Bean
        DxfOptions dxfOptions() {
            return DxfOptions.defaults().withVersionPolicy(VersionConflictPolicy.UPGRADE);
        }
    }
}
