package com.example.nem12.parser;

import com.example.nem12.model.MeterContext;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ParserStateTest {

    @Test
    void startsWithoutContext() {
        ParserState state = ParserState.initial();

        assertThat(state.getPhase()).isEqualTo(ParserState.Phase.NO_CONTEXT);
        assertThat(state.hasContext()).isFalse();
        assertThatThrownBy(state::getContext).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void contextIsReplacedWholesale() {
        MeterContext first = new MeterContext("NMI1", 30);
        MeterContext second = new MeterContext("NMI2", 15);

        ParserState s1 = ParserState.initial().withContext(first);
        ParserState s2 = s1.withContext(second);

        assertThat(s1.getContext()).isSameAs(first);
        assertThat(s2.getContext()).isSameAs(second);
        assertThat(s2.getPhase()).isEqualTo(ParserState.Phase.HAS_CONTEXT);
    }

    @Test
    void doneIsTerminal() {
        ParserState done = ParserState.initial().withContext(new MeterContext("NMI1", 30)).finish();

        assertThat(done.isDone()).isTrue();
        assertThat(done.hasContext()).isFalse();
        assertThatThrownBy(() -> done.withContext(new MeterContext("NMI2", 30)))
                .isInstanceOf(IllegalStateException.class);
    }
}
