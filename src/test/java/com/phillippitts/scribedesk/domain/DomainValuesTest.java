package com.phillippitts.scribedesk.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainValuesTest {

    private static final Instant T0 = Instant.parse("2025-01-31T14:15:20Z");

    @Test
    void speakerNormalizesNameAndColor() {
        Speaker s = new Speaker("spk-1", "  Alice ", "#AABBCC");

        assertThat(s.name()).isEqualTo("Alice");
        assertThat(s.color()).isEqualTo("#aabbcc");
    }

    @Test
    void speakerRejectsBlankNameAndBadColor() {
        assertThatThrownBy(() -> new Speaker("spk-1", " ", "#000000"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Speaker("spk-1", "Alice", "red"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void speakerWithersKeepId() {
        Speaker s = new Speaker("spk-7", "Alice", "#000000");

        assertThat(s.withName("Alicia").id()).isEqualTo("spk-7");
        assertThat(s.withColor("#ffffff").name()).isEqualTo("Alice");
    }

    @Test
    void timeRangeRejectsEndBeforeStart() {
        assertThatThrownBy(() -> new TimeRange(T0, T0.minusMillis(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("precedes");
        assertThat(new TimeRange(T0, T0).start()).isEqualTo(T0);
    }

    @Test
    void finalRejectsNegativeOrNaNEndTime() {
        assertThatThrownBy(() -> new RecognitionEvent.Final("x", -1.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RecognitionEvent.Final("x", Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void noteWithTextKeepsSnapshot() {
        NoteSnapshot snap = new NoteSnapshot(new TimeRange(T0, T0.plusSeconds(1)), "Alice", "#1f77b4");
        Note note = new Note(1, snap, "");

        Note edited = note.withText("follow up");

        assertThat(edited.snapshot()).isSameAs(snap);
        assertThat(edited.text()).isEqualTo("follow up");
        assertThat(note.text()).isEmpty();
    }

    @Test
    void sessionStatusActiveStates() {
        assertThat(SessionStatus.IDLE.isActive()).isFalse();
        assertThat(SessionStatus.FAILED.isActive()).isFalse();
        assertThat(SessionStatus.LOADING.isActive()).isTrue();
        assertThat(SessionStatus.READY.isActive()).isTrue();
        assertThat(SessionStatus.STOPPING.isActive()).isTrue();
    }
}
