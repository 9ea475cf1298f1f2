package org.pragmatica.callalign.alignment;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CallSiteTest {

    @Test
    void callSite_copiesArguments() {
        var arguments = new ArrayList<>(List.of(Argument.argument(4), Argument.argument(7)));
        var call = CallSite.callSite(Span.span(0, 9), arguments);

        arguments.clear();

        assertThat(call.arguments()).hasSize(2);
        assertThat(call.isLastArgument(1)).isTrue();
        assertThat(call.isLastArgument(0)).isFalse();
    }

    @Test
    void span_rejectsNegativeValues() {
        assertThatThrownBy(() -> Span.span(-1, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Span.span(1, -2)).isInstanceOf(IllegalArgumentException.class);
        assertThat(Span.span(3, 4).end()).isEqualTo(7);
    }

    @Test
    void argument_rejectsNegativeOffset() {
        assertThatThrownBy(() -> Argument.argument(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void closureArgument_carriesBody() {
        var argument = Argument.closureArgument(4, Span.span(6, 3));

        assertThat(argument.body()).contains(Span.span(6, 3));
        assertThat(Argument.argument(4).body()).isEmpty();
    }
}
