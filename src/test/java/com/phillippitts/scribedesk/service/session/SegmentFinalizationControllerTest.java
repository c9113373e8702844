package com.phillippitts.scribedesk.service.session;

import com.phillippitts.scribedesk.domain.RecognitionEvent;
import com.phillippitts.scribedesk.domain.Segment;
import com.phillippitts.scribedesk.domain.Speaker;
import com.phillippitts.scribedesk.service.metrics.SessionMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SegmentFinalizationControllerTest {

    private static final Instant T0 = Instant.parse("2025-01-31T14:15:20.000Z");

    private SpeakerRegistry speakers;
    private TranscriptSegmentStore store;
    private TimestampMapper mapper;
    private SimpleMeterRegistry meters;
    private SegmentFinalizationController controller;

    @BeforeEach
    void setUp() {
        speakers = new SpeakerRegistry();
        store = new TranscriptSegmentStore();
        mapper = new TimestampMapper();
        meters = new SimpleMeterRegistry();
        controller = new SegmentFinalizationController(speakers, store, mapper, new SessionMetrics(meters));
    }

    @Test
    void finalThenSwitchProducesContiguousSegments() {
        // Arrange
        Speaker alice = speakers.addSpeaker("Alice");
        mapper.anchor(T0);
        controller.onSessionStart();

        // Act
        Optional<Segment> first = controller.onFinal(new RecognitionEvent.Final("Hello, this is an example.", 3.456));
        controller.onPartial("continuing");
        Speaker bob = speakers.addSpeaker("Bob");
        speakers.activate(bob.id());
        Optional<Segment> second = controller.onSpeakerSwitch(bob.id(), T0.plusSeconds(7));

        // Assert
        assertThat(first).get().satisfies(s -> {
            assertThat(s.speakerId()).isEqualTo(alice.id());
            assertThat(s.range().start()).isEqualTo(T0);
            assertThat(s.range().end()).isEqualTo(Instant.parse("2025-01-31T14:15:23.456Z"));
            assertThat(s.recognizedText()).isEqualTo("Hello, this is an example.");
        });
        assertThat(second).get().satisfies(s -> {
            assertThat(s.speakerId()).isEqualTo(alice.id());
            assertThat(s.range().start()).isEqualTo(Instant.parse("2025-01-31T14:15:23.456Z"));
            assertThat(s.range().end()).isEqualTo(Instant.parse("2025-01-31T14:15:27.000Z"));
            assertThat(s.recognizedText()).isEqualTo("continuing");
        });
        assertThat(store.openSegment()).get().satisfies(open -> {
            assertThat(open.speakerId()).isEqualTo(bob.id());
            assertThat(open.startTime()).isEqualTo(Instant.parse("2025-01-31T14:15:27.000Z"));
            assertThat(open.hasText()).isFalse();
        });
        assertThat(store.segments()).extracting(Segment::order).containsExactly(0L, 1L);
    }

    @Test
    void sessionStartWithoutAnchorFails() {
        speakers.addSpeaker("Alice");

        assertThatThrownBy(() -> controller.onSessionStart())
                .isInstanceOf(IllegalStateException.class);
        assertThat(controller.isRunning()).isFalse();
    }

    @Test
    void sessionStartWithoutActiveSpeakerLeavesNoOpenSegment() {
        mapper.anchor(T0);

        controller.onSessionStart();

        assertThat(controller.isRunning()).isTrue();
        assertThat(store.openSegment()).isEmpty();
    }

    @Test
    void partialNeverClosesASegment() {
        speakers.addSpeaker("Alice");
        mapper.anchor(T0);
        controller.onSessionStart();

        controller.onPartial("hello");
        controller.onPartial("hello there");

        assertThat(store.size()).isZero();
        assertThat(store.openSegment()).get()
                .extracting(OpenSegment::accumulatedText)
                .isEqualTo("hello there");
    }

    @Test
    void switchWithEmptyOpenSegmentDiscardsIt() {
        speakers.addSpeaker("Alice");
        Speaker bob = speakers.addSpeaker("Bob");
        mapper.anchor(T0);
        controller.onSessionStart();

        speakers.activate(bob.id());
        Optional<Segment> closed = controller.onSpeakerSwitch(bob.id(), T0.plusSeconds(2));

        assertThat(closed).isEmpty();
        assertThat(store.size()).isZero();
        assertThat(store.openSegment()).get().satisfies(open -> {
            assertThat(open.speakerId()).isEqualTo(bob.id());
            assertThat(open.startTime()).isEqualTo(T0.plusSeconds(2));
        });
    }

    @Test
    void switchToSameSpeakerIsNoOp() {
        Speaker alice = speakers.addSpeaker("Alice");
        mapper.anchor(T0);
        controller.onSessionStart();
        controller.onPartial("still talking");

        Optional<Segment> closed = controller.onSpeakerSwitch(alice.id(), T0.plusSeconds(3));

        assertThat(closed).isEmpty();
        assertThat(store.openSegment()).get().satisfies(open -> {
            assertThat(open.startTime()).isEqualTo(T0);
            assertThat(open.accumulatedText()).isEqualTo("still talking");
        });
    }

    @Test
    void blankFinalIsIgnored() {
        speakers.addSpeaker("Alice");
        mapper.anchor(T0);
        controller.onSessionStart();

        assertThat(controller.onFinal(new RecognitionEvent.Final("   ", 1.0))).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void endBeforeStartIsClampedToStart() {
        speakers.addSpeaker("Alice");
        Speaker bob = speakers.addSpeaker("Bob");
        mapper.anchor(T0);
        controller.onSessionStart();
        speakers.activate(bob.id());
        controller.onSpeakerSwitch(bob.id(), T0.plusSeconds(7));

        // Final computed for audio that ended before the switch
        Segment s = controller.onFinal(new RecognitionEvent.Final("late result", 5.0)).orElseThrow();

        assertThat(s.range().start()).isEqualTo(T0.plusSeconds(7));
        assertThat(s.range().end()).isEqualTo(T0.plusSeconds(7));
    }

    @Test
    void textWithoutSpeakerIsBufferedUntilActivation() {
        // Arrange: no speakers yet
        mapper.anchor(T0);
        controller.onSessionStart();

        // Act
        assertThat(controller.onFinal(new RecognitionEvent.Final("early words", 1.0))).isEmpty();
        assertThat(controller.bufferedText()).isEqualTo("early words");
        Speaker alice = speakers.addSpeaker("Alice");
        controller.onSpeakerSwitch(alice.id(), T0.plusSeconds(2));
        Segment s = controller.onFinal(new RecognitionEvent.Final("and more", 4.0)).orElseThrow();

        // Assert
        assertThat(s.speakerId()).isEqualTo(alice.id());
        assertThat(s.recognizedText()).isEqualTo("early words and more");
        assertThat(s.range().start()).isEqualTo(T0.plusSeconds(2));
        assertThat(s.range().end()).isEqualTo(T0.plusSeconds(4));
        assertThat(controller.bufferedText()).isEmpty();
    }

    @Test
    void bufferedPartialBecomesTextOfFirstSegment() {
        mapper.anchor(T0);
        controller.onSessionStart();
        controller.onPartial("half a sentence");

        Speaker alice = speakers.addSpeaker("Alice");
        controller.onSpeakerSwitch(alice.id(), T0.plusSeconds(1));
        Segment s = controller.flush(T0.plusSeconds(3)).orElseThrow();

        assertThat(s.recognizedText()).isEqualTo("half a sentence");
        assertThat(s.range().start()).isEqualTo(T0.plusSeconds(1));
    }

    @Test
    void flushClosesOpenSegmentWithText() {
        speakers.addSpeaker("Alice");
        mapper.anchor(T0);
        controller.onSessionStart();
        controller.onPartial("last words");

        Optional<Segment> closed = controller.flush(T0.plusSeconds(9));

        assertThat(closed).get().satisfies(s -> {
            assertThat(s.range().end()).isEqualTo(T0.plusSeconds(9));
            assertThat(s.recognizedText()).isEqualTo("last words");
        });
        assertThat(controller.isRunning()).isFalse();
        assertThat(store.openSegment()).isEmpty();
    }

    @Test
    void flushWithoutTextEmitsNothingAndIgnoresLaterEvents() {
        speakers.addSpeaker("Alice");
        mapper.anchor(T0);
        controller.onSessionStart();

        assertThat(controller.flush(T0.plusSeconds(1))).isEmpty();
        assertThat(controller.onFinal(new RecognitionEvent.Final("after stop", 2.0))).isEmpty();

        assertThat(store.size()).isZero();
    }

    @Test
    void closeReasonsAreCounted() {
        Speaker alice = speakers.addSpeaker("Alice");
        Speaker bob = speakers.addSpeaker("Bob");
        mapper.anchor(T0);
        controller.onSessionStart();

        controller.onFinal(new RecognitionEvent.Final("one", 1.0));
        controller.onPartial("two");
        speakers.activate(bob.id());
        controller.onSpeakerSwitch(bob.id(), T0.plusSeconds(2));
        controller.onPartial("three");
        controller.flush(T0.plusSeconds(3));

        assertThat(meters.get("scribedesk.session.segments").tag("reason", "final").counter().count()).isEqualTo(1.0);
        assertThat(meters.get("scribedesk.session.segments").tag("reason", "switch").counter().count()).isEqualTo(1.0);
        assertThat(meters.get("scribedesk.session.segments").tag("reason", "stop").counter().count()).isEqualTo(1.0);
        assertThat(alice.id()).isNotEqualTo(bob.id());
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 7L, 42L, 1234L, 98765L})
    void segmentCountEqualsFinalsPlusSwitchesWithText(long seed) {
        // Arrange
        Random random = new Random(seed);
        List<Speaker> people = List.of(speakers.addSpeaker("Alice"), speakers.addSpeaker("Bob"),
                speakers.addSpeaker("Carol"));
        mapper.anchor(T0);
        controller.onSessionStart();
        String active = people.get(0).id();
        boolean openHasText = false;
        int expected = 0;
        double t = 0.0;

        // Act
        for (int i = 0; i < 200; i++) {
            t += random.nextInt(2000) / 1000.0;
            int action = random.nextInt(3);
            if (action == 0) {
                boolean blank = random.nextInt(4) == 0;
                controller.onPartial(blank ? "" : "word" + i);
                openHasText = !blank;
            } else if (action == 1) {
                controller.onFinal(new RecognitionEvent.Final("utterance " + i, t));
                expected++;
                openHasText = false;
            } else {
                String next = people.get(random.nextInt(people.size())).id();
                speakers.activate(next);
                controller.onSpeakerSwitch(next, T0.plus(Duration.ofMillis(Math.round(t * 1000))));
                if (!next.equals(active)) {
                    if (openHasText) {
                        expected++;
                    }
                    openHasText = false;
                }
                active = next;
            }
        }

        // Assert
        List<Segment> segments = store.segments();
        assertThat(segments).hasSize(expected);
        for (int i = 0; i < segments.size(); i++) {
            Segment s = segments.get(i);
            assertThat(s.order()).isEqualTo(i);
            assertThat(s.range().start()).isBeforeOrEqualTo(s.range().end());
            assertThat(s.recognizedText()).isNotBlank();
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {3L, 11L, 2024L})
    void consecutiveSegmentsAreContiguousWhenNothingIsDiscarded(long seed) {
        // Arrange
        Random random = new Random(seed);
        List<Speaker> people = List.of(speakers.addSpeaker("Alice"), speakers.addSpeaker("Bob"));
        mapper.anchor(T0);
        controller.onSessionStart();
        int activeIndex = 0;
        double t = 0.0;

        // Act: every switch happens while the open segment has text
        for (int i = 0; i < 100; i++) {
            t += (1 + random.nextInt(1500)) / 1000.0;
            controller.onPartial("partial " + i);
            if (random.nextBoolean()) {
                controller.onFinal(new RecognitionEvent.Final("final " + i, t));
            } else {
                activeIndex = 1 - activeIndex;
                String next = people.get(activeIndex).id();
                speakers.activate(next);
                controller.onSpeakerSwitch(next, T0.plus(Duration.ofMillis(Math.round(t * 1000))));
            }
        }

        // Assert
        List<Segment> segments = store.segments();
        assertThat(segments).hasSize(100);
        for (int i = 0; i + 1 < segments.size(); i++) {
            assertThat(segments.get(i).range().end()).isEqualTo(segments.get(i + 1).range().start());
        }
    }
}
