package io.aim.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.aim.core.AimEnvironment;
import io.aim.core.exception.RegistryValidationException;
import io.aim.core.execution.SchedulingPolicy;
import io.aim.core.metric.MetricRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AimEnvironmentProducerTest {

    private AimEnvironmentProducer producer;
    private Config config;

    @BeforeEach
    void setUp() {
        producer = new AimEnvironmentProducer();
        config = mock(Config.class);
        producer.config = config;
    }

    @Nested
    class ExtractProperties {

        @Test
        void shouldExtractOnlyAimProperties() {
            when(config.getPropertyNames())
                    .thenReturn(List.of("aim.task-timeout-ms", "aim.scheduling-policy", "quarkus.http.port"));
            when(config.getOptionalValue("aim.task-timeout-ms", String.class)).thenReturn(Optional.of("1500"));
            when(config.getOptionalValue("aim.scheduling-policy", String.class))
                    .thenReturn(Optional.of("registration-order"));

            Properties properties = producer.extractAimProperties();

            assertThat(properties)
                    .containsEntry("aim.task-timeout-ms", "1500")
                    .containsEntry("aim.scheduling-policy", "registration-order")
                    .doesNotContainKey("quarkus.http.port");
        }

        @Test
        void shouldSkipPropertiesWithoutValue() {
            when(config.getPropertyNames()).thenReturn(List.of("aim.artifact-root"));
            when(config.getOptionalValue("aim.artifact-root", String.class)).thenReturn(Optional.empty());

            assertThat(producer.extractAimProperties()).isEmpty();
        }
    }

    @Nested
    class ProduceEnvironment {

        @Test
        void shouldProduceEnvironmentWithBuiltinMetrics() {
            when(config.getPropertyNames()).thenReturn(List.of());

            AimEnvironment environment = producer.aimEnvironment();
            try {
                assertThat(environment.getMetricRegistry().size()).isEqualTo(7);
                assertThat(environment.getEvaluatorRegistry().getMetricIds())
                        .contains("m1", "m2", "m3", "m13", "m15", "m16", "m23");
                assertThat(environment.getConfig().getTaskTimeout().toMillis()).isEqualTo(60_000);
            } finally {
                producer.close(environment);
            }
        }

        @Test
        void shouldApplyConfiguredValues() {
            // Given
            when(config.getPropertyNames())
                    .thenReturn(List.of("aim.worker-pool-size", "aim.scheduling-policy", "aim.artifact-root"));
            when(config.getOptionalValue("aim.worker-pool-size", String.class)).thenReturn(Optional.of("2"));
            when(config.getOptionalValue("aim.scheduling-policy", String.class))
                    .thenReturn(Optional.of("registration-order"));
            when(config.getOptionalValue("aim.artifact-root", String.class))
                    .thenReturn(Optional.of("/srv/shots"));

            // When
            AimEnvironment environment = producer.aimEnvironment();

            // Then
            try {
                assertThat(environment.getConfig().getWorkerPoolSize()).isEqualTo(2);
                assertThat(environment.getConfig().getSchedulingPolicy())
                        .isEqualTo(SchedulingPolicy.REGISTRATION_ORDER);
                assertThat(environment.getConfig().getArtifactRoot()).isEqualTo(Path.of("/srv/shots"));
            } finally {
                producer.close(environment);
            }
        }
    }

    @Nested
    class LoadRegistry {

        @Test
        void shouldLoadRegistryFromConfiguredPath(@TempDir Path dir) throws IOException {
            Path document = dir.resolve("metrics.json");
            Files.writeString(
                    document,
                    """
                    {
                      "m1": {
                        "id": "m1", "category": "cp", "name": "PNG File Size",
                        "evidence": 3, "relevance": 2, "speed": 2,
                        "results": [
                          {"id": "m1_0", "index": 0, "type": "int", "name": "Size", "scores": []}
                        ]
                      }
                    }
                    """);
            Properties properties = new Properties();
            properties.setProperty(AimEnvironmentProducer.REGISTRY_PATH, document.toString());

            MetricRegistry registry = AimEnvironmentProducer.loadRegistry(properties);

            assertThat(registry.size()).isEqualTo(1);
            assertThat(registry.contains("m1")).isTrue();
        }

        @Test
        void shouldFailOnUnreadableRegistryPath(@TempDir Path dir) {
            Properties properties = new Properties();
            properties.setProperty(AimEnvironmentProducer.REGISTRY_PATH, dir.resolve("none.json").toString());

            assertThatThrownBy(() -> AimEnvironmentProducer.loadRegistry(properties))
                    .isInstanceOf(UncheckedIOException.class)
                    .hasMessageContaining("none.json");
        }

        @Test
        void shouldFailOnInvalidRegistryDocument(@TempDir Path dir) throws IOException {
            Path document = dir.resolve("broken.json");
            Files.writeString(document, "{ \"m1\": { \"id\": \"m1\" } }");
            Properties properties = new Properties();
            properties.setProperty(AimEnvironmentProducer.REGISTRY_PATH, document.toString());

            assertThatThrownBy(() -> AimEnvironmentProducer.loadRegistry(properties))
                    .isInstanceOf(RegistryValidationException.class);
        }
    }
}
