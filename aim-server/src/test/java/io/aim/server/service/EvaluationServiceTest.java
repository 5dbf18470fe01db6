package io.aim.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.aim.core.AimConfig;
import io.aim.core.AimEnvironment;
import io.aim.core.AimFactory;
import io.aim.core.evaluator.ResultValue;
import io.aim.core.execution.EvaluationDispatcher;
import io.aim.core.metric.model.MetricDescriptor;
import io.aim.core.session.EvaluationEvent;
import io.aim.metrics.BuiltinEvaluatorProvider;
import io.aim.serialization.MetricRegistryLoader;
import io.aim.server.streaming.EvaluationEventBroadcaster;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.helpers.test.AssertSubscriber;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EvaluationServiceTest {

    private static final long MAX_ARTIFACT_BYTES = 4096;

    private static String pngBase64() throws IOException {
        BufferedImage image = new BufferedImage(16, 16, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 16; y++) {
            for (int x = 0; x < 16; x++) {
                image.setRGB(x, y, x < 8 ? 0x336699 : 0xFFFFFF);
            }
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return Base64.getEncoder().encodeToString(out.toByteArray());
    }

    private static AssertSubscriber<EvaluationEvent> subscribe(
            Multi<EvaluationEvent> events) {
        return events.subscribe().withSubscriber(AssertSubscriber.create(Long.MAX_VALUE));
    }

    private static String messageOf(EvaluationEvent event) {
        assertThat(event).isInstanceOf(EvaluationEvent.ValidationError.class);
        return ((EvaluationEvent.ValidationError) event).message();
    }

    @Nested
    class WithBuiltinMetrics {

        private AimEnvironment environment;
        private EvaluationEventBroadcaster broadcaster;
        private EvaluationService service;

        @BeforeEach
        void setUp() {
            environment =
                    AimFactory.builder()
                            .config(
                                    AimConfig.builder()
                                            .workerPoolSize(2)
                                            .maxArtifactBytes(MAX_ARTIFACT_BYTES)
                                            .build())
                            .metricRegistry(MetricRegistryLoader.loadDefault())
                            .evaluatorProviders(List.of(new BuiltinEvaluatorProvider()))
                            .build();
            broadcaster = new EvaluationEventBroadcaster();
            service = new EvaluationService(environment, broadcaster);
        }

        @AfterEach
        void tearDown() {
            environment.close();
        }

        @Test
        void shouldStreamResultsThenCompletion() throws IOException {
            // Given
            String png = pngBase64();

            // When
            AssertSubscriber<EvaluationEvent> subscriber =
                    subscribe(
                            service.evaluate(
                                    EvaluationCommand.inline(
                                            "session-1", png, "image/png", List.of("m1", "m13"))));

            // Then
            subscriber.awaitCompletion();
            List<EvaluationEvent> events = subscriber.getItems();
            assertThat(events).hasSize(3);
            assertThat(events).allSatisfy(e -> assertThat(e.sessionId()).isEqualTo("session-1"));
            assertThat(events.get(2)).isInstanceOf(EvaluationEvent.SessionComplete.class);

            EvaluationEvent.MetricResult size =
                    events.stream()
                            .filter(EvaluationEvent.MetricResult.class::isInstance)
                            .map(EvaluationEvent.MetricResult.class::cast)
                            .filter(r -> r.metricId().equals("m1"))
                            .findFirst()
                            .orElseThrow();
            assertThat(size.results().get(0).value())
                    .isEqualTo(ResultValue.of((long) Base64.getDecoder().decode(png).length));
            assertThat(size.results().get(0).findJudgment())
                    .hasValueSatisfying(j -> assertThat(j.description()).isEqualTo("Suitable"));
            assertThat(broadcaster.activeStreamCount()).isZero();
        }

        @Test
        void shouldGenerateSessionIdWhenMissing() throws IOException {
            AssertSubscriber<EvaluationEvent> subscriber =
                    subscribe(
                            service.evaluate(
                                    EvaluationCommand.inline(null, pngBase64(), "image/png", List.of("m1"))));

            subscriber.awaitCompletion();
            assertThat(subscriber.getItems()).hasSize(2);
            assertThat(subscriber.getItems().get(0).sessionId()).isNotBlank();
        }

        @Test
        void shouldAcceptDataUrlLocator() throws IOException {
            String dataUrl = "data:image/png;base64," + pngBase64();

            AssertSubscriber<EvaluationEvent> subscriber =
                    subscribe(service.evaluate(EvaluationCommand.located("s-2", dataUrl, List.of("m3"))));

            subscriber.awaitCompletion();
            assertThat(subscriber.getItems())
                    .extracting(EvaluationEvent::action)
                    .containsExactly("pushResult", "sessionComplete");
        }

        @Test
        void shouldRejectFileLocatorWithoutArtifactRoot(@TempDir Path tempDir) throws IOException {
            // Given
            Path secret = tempDir.resolve("private.png");
            Files.write(secret, Base64.getDecoder().decode(pngBase64()));

            // When
            AssertSubscriber<EvaluationEvent> byPath =
                    subscribe(
                            service.evaluate(
                                    EvaluationCommand.located("s1", secret.toString(), List.of("m1", "m23"))));
            AssertSubscriber<EvaluationEvent> byUri =
                    subscribe(
                            service.evaluate(
                                    EvaluationCommand.located(
                                            "s2", secret.toUri().toString(), List.of("m1", "m23"))));

            // Then
            byPath.awaitCompletion();
            byUri.awaitCompletion();
            assertThat(byPath.getItems()).hasSize(1);
            assertThat(messageOf(byPath.getItems().get(0))).isEqualTo("Artifact URI must be a data: URL");
            assertThat(messageOf(byUri.getItems().get(0))).isEqualTo("Artifact URI must be a data: URL");
            assertThat(environment.getDispatcher().getActiveSessionCount()).isZero();
        }

        @Test
        void shouldReportUnknownMetricFromDispatcher() throws IOException {
            AssertSubscriber<EvaluationEvent> subscriber =
                    subscribe(
                            service.evaluate(
                                    EvaluationCommand.inline("s-3", pngBase64(), "image/png", List.of("m99"))));

            subscriber.awaitCompletion();
            assertThat(subscriber.getItems()).hasSize(1);
            assertThat(messageOf(subscriber.getItems().get(0))).isEqualTo("Unknown metric 'm99'");
        }

        @Test
        void shouldRejectMalformedBase64AtBoundary() {
            AssertSubscriber<EvaluationEvent> subscriber =
                    subscribe(
                            service.evaluate(
                                    EvaluationCommand.inline("s-4", "%%%not-base64", "image/png", List.of("m1"))));

            subscriber.awaitCompletion();
            assertThat(subscriber.getItems()).hasSize(1);
            assertThat(messageOf(subscriber.getItems().get(0)))
                    .isEqualTo("Artifact data is not valid base64");
            assertThat(environment.getDispatcher().getActiveSessionCount()).isZero();
        }

        @Test
        void shouldRejectOversizedArtifactBeforeDecoding() {
            String oversized = Base64.getEncoder().encodeToString(new byte[(int) MAX_ARTIFACT_BYTES + 1]);

            AssertSubscriber<EvaluationEvent> subscriber =
                    subscribe(
                            service.evaluate(
                                    EvaluationCommand.inline("s-5", oversized, "image/png", List.of("m1"))));

            subscriber.awaitCompletion();
            assertThat(messageOf(subscriber.getItems().get(0)))
                    .isEqualTo("Artifact exceeds the limit of 4096 bytes");
        }

        @Test
        void shouldListEveryBoundaryProblem() {
            EvaluationCommand command =
                    new EvaluationCommand("../etc", "AAAA", "image/png", "file:/tmp/x.png", List.of("m1"));

            AssertSubscriber<EvaluationEvent> subscriber = subscribe(service.evaluate(command));

            subscriber.awaitCompletion();
            assertThat(messageOf(subscriber.getItems().get(0)))
                    .isEqualTo(
                            "Exactly one of artifact data and artifact URI must be given; Invalid session id");
            assertThat(subscriber.getItems().get(0).sessionId()).isEqualTo("../etc");
        }

        @Test
        void shouldRejectControlCharactersInMetricIds() throws IOException {
            AssertSubscriber<EvaluationEvent> subscriber =
                    subscribe(
                            service.evaluate(
                                    EvaluationCommand.inline(
                                            "s-6", pngBase64(), "image/png", List.of("m1", "m\u00002"))));

            subscriber.awaitCompletion();
            assertThat(messageOf(subscriber.getItems().get(0))).isEqualTo("Invalid metric id");
        }

        @Test
        void shouldListRegisteredMetrics() {
            assertThat(service.listMetrics())
                    .extracting(MetricDescriptor::getId)
                    .containsExactly("m1", "m2", "m3", "m13", "m15", "m16", "m23");
        }
    }

    @Nested
    class WithMockedDispatcher {

        private EvaluationDispatcher dispatcher;
        private EvaluationEventBroadcaster broadcaster;
        private EvaluationService service;

        @BeforeEach
        void setUp() {
            AimEnvironment environment = mock(AimEnvironment.class);
            dispatcher = mock(EvaluationDispatcher.class);
            lenient().when(environment.getDispatcher()).thenReturn(dispatcher);
            lenient().when(environment.getConfig()).thenReturn(new AimConfig());
            broadcaster = new EvaluationEventBroadcaster();
            service = new EvaluationService(environment, broadcaster);
        }

        private EvaluationCommand command(String sessionId) {
            return EvaluationCommand.inline(sessionId, "AAAA", "image/png", List.of("m1"));
        }

        @Test
        void shouldCancelSessionWhenSubscriberCancels() {
            // Given
            AssertSubscriber<EvaluationEvent> subscriber = subscribe(service.evaluate(command("s-9")));
            verify(dispatcher).submit(any(), any());

            // When
            subscriber.cancel();

            // Then
            verify(dispatcher).cancel("s-9");
            assertThat(broadcaster.hasStream("s-9")).isFalse();
        }

        @Test
        void shouldRejectSecondRequestForOpenSession() {
            service.evaluate(command("dup"));

            AssertSubscriber<EvaluationEvent> second = subscribe(service.evaluate(command("dup")));

            second.awaitCompletion();
            assertThat(messageOf(second.getItems().get(0))).isEqualTo("Session 'dup' is already active");
            verify(dispatcher).submit(any(), any());
        }

        @Test
        void shouldCompleteStreamOnExplicitCancel() {
            AssertSubscriber<EvaluationEvent> subscriber = subscribe(service.evaluate(command("s-10")));
            when(dispatcher.cancel("s-10")).thenReturn(true);

            boolean cancelled = service.cancel("s-10");

            assertThat(cancelled).isTrue();
            subscriber.awaitCompletion();
            assertThat(subscriber.getItems()).isEmpty();
        }

        @Test
        void shouldNotSubmitRejectedCommands() {
            subscribe(service.evaluate(EvaluationCommand.inline("s-11", "AAAA", null, List.of("m1"))))
                    .awaitCompletion();

            verify(dispatcher, never()).submit(any(), any());
        }

        @Test
        void shouldPassFileLocatorToDispatcherOnlyWithArtifactRoot() {
            // Given
            subscribe(service.evaluate(EvaluationCommand.located("s-12", "/tmp/private.png", List.of("m1"))))
                    .awaitCompletion();
            verify(dispatcher, never()).submit(any(), any());

            // When
            AimEnvironment rooted = mock(AimEnvironment.class);
            when(rooted.getDispatcher()).thenReturn(dispatcher);
            when(rooted.getConfig()).thenReturn(AimConfig.builder().artifactRoot(Path.of("/srv/shots")).build());
            new EvaluationService(rooted, broadcaster)
                    .evaluate(EvaluationCommand.located("s-13", "shot.png", List.of("m1")));

            // Then
            verify(dispatcher).submit(any(), any());
        }
    }
}
