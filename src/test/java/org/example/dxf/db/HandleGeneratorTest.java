package org.example.dxf.db;

import org.example.dxf.DxfStructureException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HandleGeneratorTest {

    @Test
    void next_producesUppercaseHexFromSeed() {
        HandleGenerator handles = HandleGenerator.fromSeed("FE");

        assertThat(handles.next()).isEqualTo("FE");
        assertThat(handles.next()).isEqualTo("FF");
        assertThat(handles.seed()).isEqualTo("100");
    }

    @Test
    void observe_movesSeedPastExistingHandles() {
        HandleGenerator handles = new HandleGenerator();

        handles.observe("2a");
        handles.observe("10");

        assertThat(handles.next()).isEqualTo("2B");
    }

    @Test
    void constructor_neverStartsAtZero() {
        assertThat(new HandleGenerator(0).next()).isEqualTo("1");
    }

    @Test
    void fromSeed_rejectsNonHexValue() {
        assertThatThrownBy(() -> HandleGenerator.fromSeed("XYZ"))
                .isInstanceOf(DxfStructureException.class);
    }
}
