package org.example.dxf.tag;

import org.example.dxf.DxfStructureException;
import org.example.dxf.MalformedPointException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DxfTagReaderTest {

    @Test
    void readAll_coalescesPointCoordinates() {
        List<DxfTag> tags = DxfTagReader.readAll("""
                  0
                LINE
                 10
                1.5
                 20
                2.5
                 30
                0.0
                 11
                4
                 21
                5
                  8
                WALLS
                """);

        assertThat(tags).hasSize(4);
        assertThat(tags.get(1).code()).isEqualTo(10);
        assertThat(tags.get(1).pointValue()).isEqualTo(DxfPoint.of(1.5, 2.5, 0));
        assertThat(tags.get(2).pointValue()).isEqualTo(DxfPoint.of(4, 5));
        assertThat(tags.get(3)).isEqualTo(DxfTag.of(8, "WALLS"));
    }

    @Test
    void readAll_convertsValuesByGroupCode() {
        List<DxfTag> tags = DxfTagReader.readAll("""
                 62
                  7
                 40
                2.25
                160
                123456789012
                  5
                 1F
                 70
                1.0
                """);

        assertThat(tags.get(0).value()).isEqualTo(7);
        assertThat(tags.get(1).value()).isEqualTo(2.25);
        assertThat(tags.get(2).value()).isEqualTo(123456789012L);
        assertThat(tags.get(3).value()).isEqualTo("1F");
        assertThat(tags.get(4).value()).isEqualTo(1);
    }

    @Test
    void readAll_skipsComments() {
        List<DxfTag> tags = DxfTagReader.readAll("""
                999
                generated by a test
                  0
                SECTION
                999
                another comment
                  2
                HEADER
                """);

        assertThat(tags).containsExactly(DxfTag.of(0, "SECTION"), DxfTag.of(2, "HEADER"));
    }

    @Test
    void readAll_decodesUnicodeEscapes() {
        List<DxfTag> tags = DxfTagReader.readAll("""
                  1
                \\U+4E2D\\U+6587 text
                """);

        assertThat(tags.get(0).stringValue()).isEqualTo("中文 text");
    }

    @Test
    void readAll_acceptsCrLfLineEndings() {
        List<DxfTag> tags = DxfTagReader.readAll("  0\r\nLINE\r\n  8\r\nA\r\n");

        assertThat(tags).containsExactly(DxfTag.of(0, "LINE"), DxfTag.of(8, "A"));
    }

    @Test
    void readAll_keepsRawTextOfParsedTags() {
        List<DxfTag> tags = DxfTagReader.readAll("""
                 40
                1.50000
                """);

        assertThat(tags.get(0).rawText()).containsExactly("1.50000");
        assertThat(tags.get(0).line()).isEqualTo(1);
    }

    @Test
    void readAll_missingYCoordinate_throwsMalformedPoint() {
        assertThatThrownBy(() -> DxfTagReader.readAll("""
                  0
                POINT
                 10
                1.0
                 30
                2.0
                """))
                .isInstanceOf(MalformedPointException.class)
                .satisfies(e -> assertThat(((MalformedPointException) e).getLine()).isEqualTo(3));
    }

    @Test
    void readAll_lonelyYCoordinate_throwsMalformedPoint() {
        assertThatThrownBy(() -> DxfTagReader.readAll("""
                 20
                1.0
                """))
                .isInstanceOf(MalformedPointException.class);
    }

    @Test
    void readAll_invalidGroupCode_throwsStructureError() {
        assertThatThrownBy(() -> DxfTagReader.readAll("""
                abc
                LINE
                """))
                .isInstanceOf(DxfStructureException.class)
                .hasMessageContaining("abc");
    }
}
