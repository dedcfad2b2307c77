package com.plantmodel.flowsheet.expansion;

import com.plantmodel.flowsheet.expansion.EndpointPatternExpander.Endpoint;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class EndpointPatternExpanderTest {

    private final EndpointPatternExpander expander = new EndpointPatternExpander();

    @Test
    void testEveryTrain() {
        assertThat(expander.expand("Basin-*", 3)).containsExactly(
                new Endpoint("Basin-1", 1), new Endpoint("Basin-2", 2), new Endpoint("Basin-3", 3));
    }

    @Test
    void testNextTrain() {
        assertThat(expander.expand("Basin-(*+1)", 3)).containsExactly(
                new Endpoint("Basin-2", 1), new Endpoint("Basin-3", 2));
        assertThat(expander.expand("Basin-(*+1)", 1)).isEmpty();
    }

    @Test
    void testLastTrainAndLiterals() {
        assertThat(expander.expand("Basin-N", 4)).containsExactly(new Endpoint("Basin-4", null));
        assertThat(expander.expand("Blower-1", 4)).containsExactly(new Endpoint("Blower-1", null));
        assertThat(expander.expand("BFD", 4)).singleElement().satisfies(e -> assertThat(e.isBoundary()).isTrue());
        assertThat(expander.expand("SubBFD-*", 2)).extracting(Endpoint::key).containsExactly("SubBFD-1", "SubBFD-2");
    }

    @Test
    void testPairingBySlot() {
        List<Endpoint> sources = expander.expand("Basin-*", 2);
        List<Endpoint> targets = expander.expand("Basin-(*+1)", 2);

        assertThat(EndpointPatternExpander.pairs(sources.get(0), targets.get(0))).isTrue();
        assertThat(EndpointPatternExpander.pairs(sources.get(1), targets.get(0))).isFalse();
        assertThat(EndpointPatternExpander.pairs(new Endpoint("Blower-1", null), sources.get(1))).isTrue();
    }
}
