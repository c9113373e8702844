package com.phillippitts.scribedesk.service.session;

import com.phillippitts.scribedesk.domain.Segment;
import com.phillippitts.scribedesk.domain.Speaker;
import com.phillippitts.scribedesk.domain.TimeRange;
import com.phillippitts.scribedesk.exception.InvalidOperationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProtectedTextModelTest {

    private static final Instant T0 = Instant.parse("2025-01-31T14:15:20.000Z");

    private SpeakerRegistry speakers;
    private TranscriptSegmentStore store;
    private ProtectedTextModel model;
    private Speaker alice;
    private Speaker bob;

    @BeforeEach
    void setUp() {
        speakers = new SpeakerRegistry();
        store = new TranscriptSegmentStore();
        model = new ProtectedTextModel(speakers, ZoneOffset.UTC);
        store.addAppendListener(model::appendFinalizedLine);
        speakers.addChangeListener(model::onSpeakerChanged);
        alice = speakers.addSpeaker("Alice");
        bob = speakers.addSpeaker("Bob");
    }

    private Segment close(Speaker speaker, long startMillis, long endMillis, String text) {
        return store.append(speaker.id(),
                new TimeRange(T0.plusMillis(startMillis), T0.plusMillis(endMillis)), text);
    }

    @Test
    void rendersOneLinePerClosedSegment() {
        close(alice, 0, 3456, "Hello, this is an example.");
        close(bob, 3456, 7000, "Hi.");

        assertThat(model.text()).isEqualTo(
                "[14:15:20.000-14:15:23.456] Alice: Hello, this is an example.\n"
                        + "[14:15:23.456-14:15:27.000] Bob: Hi.");
        assertThat(model.lineCount()).isEqualTo(2);
    }

    @Test
    void appendingSameSegmentTwiceFails() {
        Segment s = close(alice, 0, 1000, "once");

        assertThatThrownBy(() -> model.appendFinalizedLine(s))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(model.lineCount()).isEqualTo(1);
    }

    @Test
    void editInsideBodyIsApplied() {
        Segment s = close(alice, 0, 1000, "Hello world");
        int bodyStart = model.text().indexOf("Hello");

        boolean applied = model.applyEdit(bodyStart + 6, 5, "there");

        assertThat(applied).isTrue();
        assertThat(model.currentBodyText(s.id())).isEqualTo("Hello there");
        assertThat(s.recognizedText()).isEqualTo("Hello world");
    }

    @Test
    void editAtBodyEdgesIsApplied() {
        Segment s = close(alice, 0, 1000, "abc");
        int bodyStart = model.text().indexOf("abc");

        assertThat(model.applyEdit(bodyStart, 0, ">")).isTrue();
        assertThat(model.applyEdit(bodyStart + 4, 0, "<")).isTrue();

        assertThat(model.currentBodyText(s.id())).isEqualTo(">abc<");
    }

    @Test
    void bodyCanBeEmptiedAndRefilled() {
        Segment s = close(alice, 0, 1000, "abc");
        int bodyStart = model.text().indexOf("abc");

        assertThat(model.applyEdit(bodyStart, 3, "")).isTrue();
        assertThat(model.currentBodyText(s.id())).isEmpty();
        assertThat(model.applyEdit(bodyStart, 0, "xyz")).isTrue();

        assertThat(model.currentBodyText(s.id())).isEqualTo("xyz");
    }

    @Test
    void editTouchingPrefixIsRejected() {
        close(alice, 0, 1000, "Hello");
        String before = model.text();
        int bodyStart = before.indexOf("Hello");

        assertThat(model.applyEdit(0, 1, "")).isFalse();
        assertThat(model.applyEdit(bodyStart - 1, 2, "X")).isFalse();
        assertThat(model.applyEdit(bodyStart - 2, 0, "X")).isFalse();

        assertThat(model.text()).isEqualTo(before);
    }

    @Test
    void editSpanningTwoLinesIsRejected() {
        close(alice, 0, 1000, "first");
        close(bob, 1000, 2000, "second");
        String before = model.text();
        int firstBody = before.indexOf("first");

        assertThat(model.applyEdit(firstBody, before.length() - firstBody, "")).isFalse();
        assertThat(model.text()).isEqualTo(before);
    }

    @Test
    void lineBreaksCannotBeInserted() {
        close(alice, 0, 1000, "body");
        String before = model.text();
        int bodyStart = before.indexOf("body");

        assertThat(model.applyEdit(bodyStart, 0, "a\nb")).isFalse();
        assertThat(model.applyEdit(bodyStart, 0, "a\rb")).isFalse();
        assertThat(model.text()).isEqualTo(before);
    }

    @Test
    void outOfRangeEditsAreRejected() {
        close(alice, 0, 1000, "body");
        String before = model.text();

        assertThat(model.applyEdit(-1, 0, "x")).isFalse();
        assertThat(model.applyEdit(before.length() + 1, 0, "x")).isFalse();
        assertThat(model.applyEdit(before.length(), 1, "")).isFalse();
        assertThat(model.applyEdit(0, -1, "x")).isFalse();
        assertThat(model.text()).isEqualTo(before);
    }

    @Test
    void editsOnEmptyDocumentAreRejected() {
        assertThat(model.applyEdit(0, 0, "x")).isFalse();
        assertThat(model.text()).isEmpty();
    }

    @Test
    void locateLineMapsPositionsToSegments() {
        Segment first = close(alice, 0, 1000, "first");
        Segment second = close(bob, 1000, 2000, "second");
        String text = model.text();
        int newline = text.indexOf('\n');

        assertThat(model.locateLine(0)).contains(first.id());
        assertThat(model.locateLine(newline - 1)).contains(first.id());
        assertThat(model.locateLine(newline + 1)).contains(second.id());
        assertThat(model.locateLine(text.length())).contains(second.id());
        assertThat(model.locateLine(text.length() + 1)).isEmpty();
        assertThat(model.locateLine(-1)).isEmpty();
    }

    @Test
    void currentBodyTextForUnknownSegmentFails() {
        assertThatThrownBy(() -> model.currentBodyText(42))
                .isInstanceOf(InvalidOperationException.class);
    }

    @Test
    void renameUpdatesOnlyThatSpeakersPrefixesAndKeepsColor() {
        close(alice, 0, 1000, "one");
        close(bob, 1000, 2000, "two");
        close(alice, 2000, 3000, "three");

        speakers.rename(alice.id(), "Alicia");

        List<ProtectedTextModel.StyledLine> lines = model.styledLines();
        assertThat(lines).extracting(ProtectedTextModel.StyledLine::prefix).containsExactly(
                "[14:15:20.000-14:15:21.000] Alicia: ",
                "[14:15:21.000-14:15:22.000] Bob: ",
                "[14:15:22.000-14:15:23.000] Alicia: ");
        assertThat(lines.get(0).color()).isEqualTo(alice.color());
        assertThat(lines.get(1).color()).isEqualTo(bob.color());
    }

    @Test
    void recolorChangesLineColorButNotText() {
        close(alice, 0, 1000, "one");
        String before = model.text();

        speakers.recolor(alice.id(), "#123456");

        assertThat(model.styledLines().get(0).color()).isEqualTo("#123456");
        assertThat(model.text()).isEqualTo(before);
    }

    @Test
    void editedBodySurvivesRename() {
        Segment s = close(alice, 0, 1000, "original");
        int bodyStart = model.text().indexOf("original");
        model.applyEdit(bodyStart, 8, "edited");

        speakers.rename(alice.id(), "Alicia");

        assertThat(model.currentBodyText(s.id())).isEqualTo("edited");
        assertThat(model.text()).isEqualTo("[14:15:20.000-14:15:21.000] Alicia: edited");
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 17L, 123L, 4567L, 890123L})
    void randomEditsNeverChangePrefixes(long seed) {
        // Arrange
        Random random = new Random(seed);
        for (int i = 0; i < 8; i++) {
            close(i % 2 == 0 ? alice : bob, i * 1000L, (i + 1) * 1000L, "segment number " + i);
        }
        List<String> prefixesBefore = prefixes();
        String[] inserts = {"", "x", "hello ", "[00:00:00.000-00:00:01.000] Eve: ", "a\nb", ":"};

        // Act
        int applied = 0;
        for (int i = 0; i < 500; i++) {
            int length = model.text().length();
            int position = random.nextInt(length + 3) - 1;
            int delete = random.nextInt(12);
            String insert = inserts[random.nextInt(inserts.length)];
            String before = model.text();
            if (model.applyEdit(position, delete, insert)) {
                applied++;
            } else {
                assertThat(model.text()).isEqualTo(before);
            }
        }

        // Assert
        assertThat(prefixes()).isEqualTo(prefixesBefore);
        assertThat(model.lineCount()).isEqualTo(8);
        assertThat(model.text().split("\n", -1)).hasSize(8);
        assertThat(applied).isPositive();
        for (ProtectedTextModel.StyledLine line : model.styledLines()) {
            assertThat(model.text()).contains(line.prefix() + line.body());
        }
    }

    private List<String> prefixes() {
        return model.styledLines().stream()
                .map(ProtectedTextModel.StyledLine::prefix)
                .collect(Collectors.toList());
    }
}
