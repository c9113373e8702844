package com.phillippitts.scribedesk.service.stt.vosk;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VoskJsonParserTest {

    @Test
    void shouldTrimPartialText() {
        assertThat(VoskJsonParser.parsePartial("{\"partial\": \"  hello wor  \"}")).isEqualTo("hello wor");
    }

    @Test
    void shouldReturnEmptyPartialForMissingFieldOrGarbage() {
        assertThat(VoskJsonParser.parsePartial("{}")).isEmpty();
        assertThat(VoskJsonParser.parsePartial("not-a-json")).isEmpty();
        assertThat(VoskJsonParser.parsePartial(null)).isEmpty();
        assertThat(VoskJsonParser.parsePartial("   ")).isEmpty();
    }

    @Test
    void shouldExtractFinalTextAndLastWordEnd() {
        String json = "{\"result\": ["
                + "{\"conf\": 1.0, \"start\": 0.42, \"end\": 0.81, \"word\": \"hello\"},"
                + "{\"conf\": 0.97, \"start\": 0.81, \"end\": 1.26, \"word\": \"world\"}"
                + "], \"text\": \" hello world \"}";

        VoskJsonParser.VoskFinal parsed = VoskJsonParser.parseFinal(json);

        assertThat(parsed.text()).isEqualTo("hello world");
        assertThat(parsed.lastWordEnd()).isPresent();
        assertThat(parsed.lastWordEnd().getAsDouble()).isCloseTo(1.26, within(1e-9));
    }

    @Test
    void shouldOmitEndWhenNoWordTimings() {
        VoskJsonParser.VoskFinal parsed = VoskJsonParser.parseFinal("{\"text\": \"hello\"}");

        assertThat(parsed.text()).isEqualTo("hello");
        assertThat(parsed.lastWordEnd()).isEmpty();
    }

    @Test
    void shouldOmitEndWhenLastWordHasNoUsableEnd() {
        assertThat(VoskJsonParser.parseFinal("{\"text\": \"a\", \"result\": [{\"word\": \"a\"}]}")
                .lastWordEnd()).isEmpty();
        assertThat(VoskJsonParser.parseFinal("{\"text\": \"a\", \"result\": [{\"word\": \"a\", \"end\": -1}]}")
                .lastWordEnd()).isEmpty();
        assertThat(VoskJsonParser.parseFinal("{\"text\": \"\", \"result\": []}")
                .lastWordEnd()).isEmpty();
    }

    @Test
    void shouldReturnEmptyFinalForMalformedJson() {
        VoskJsonParser.VoskFinal parsed = VoskJsonParser.parseFinal("{\"text\": ");

        assertThat(parsed.text()).isEmpty();
        assertThat(parsed.lastWordEnd()).isEmpty();
    }

    @Test
    void shouldIgnoreOversizedResponses() {
        String huge = "{\"text\": \"" + "a".repeat(1_100_000) + "\"}";

        assertThat(VoskJsonParser.parseFinal(huge).text()).isEmpty();
    }
}
