package org.example.dxf.entity;

import org.example.dxf.DxfVersion;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.example.dxf.entity.EntityTestSupport.FACTORY;
import static org.example.dxf.entity.EntityTestSupport.export;
import static org.example.dxf.entity.EntityTestSupport.load;

class MTextTest {

    @Test
    void split_cutsAt250Characters() {
        String text = "a".repeat(600);

        List<String> chunks = MText.split(text);

        assertThat(chunks).extracting(String::length).containsExactly(250, 250, 100);
        assertThat(String.join("", chunks)).isEqualTo(text);
    }

    @Test
    void split_neverEndsChunkWithCaret() {
        String text = "a".repeat(249) + "^J" + "b".repeat(10);

        List<String> chunks = MText.split(text);

        assertThat(chunks.get(0)).hasSize(249).doesNotEndWith("^");
        assertThat(chunks.get(1)).startsWith("^J");
    }

    @Test
    void split_shortText_isSingleChunk() {
        assertThat(MText.split("")).containsExactly("");
        assertThat(MText.split("hello")).containsExactly("hello");
    }

    @Test
    void load_joinsChunksInOrder() {
        MText mtext = (MText) load("""
                  0
                MTEXT
                  5
                50
                100
                AcDbEntity
                  8
                0
                100
                AcDbMText
                 10
                0.0
                 20
                0.0
                 30
                0.0
                 40
                2.5
                  3
                first-
                  1
                last
                  7
                Standard
                """);

        assertThat(mtext.text()).isEqualTo("first-last");
    }

    @Test
    void export_writesChunksBeforeStyle() {
        MText mtext = FACTORY.create("MTEXT", MText.class);
        mtext.setText("x".repeat(300));
        mtext.set("style", "Notes");

        String out = export(mtext, DxfVersion.R2013);

        assertThat(out).contains("  3\n" + "x".repeat(250) + "\n  1\n" + "x".repeat(50) + "\n  7\nNotes\n");
    }
}
