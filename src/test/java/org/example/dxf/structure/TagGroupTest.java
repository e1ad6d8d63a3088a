package org.example.dxf.structure;

import org.example.dxf.DxfStructureException;
import org.example.dxf.tag.DxfTag;
import org.example.dxf.tag.DxfTagReader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TagGroupTest {

    private static final String LINE_WITH_EXTRAS = """
              0
            LINE
              5
            2A
            102
            {ACAD_XDICTIONARY
            360
            2B
            102
            }
            330
            1F
            100
            AcDbEntity
              8
            WALLS
            100
            AcDbLine
             10
            0.0
             20
            0.0
             30
            0.0
             11
            1.0
             21
            1.0
             31
            0.0
            1001
            MYAPP
            1000
            hello
            1070
            7
            """;

    @Test
    void classify_splitsBaseSubclassesAndXData() {
        TagGroup group = TagGroup.classify(DxfTagReader.readAll(LINE_WITH_EXTRAS));

        assertThat(group.dxftype()).isEqualTo("LINE");
        assertThat(group.handle()).isEqualTo("2A");
        assertThat(group.appData()).hasSize(1);
        assertThat(group.appData().get(0).appid()).isEqualTo("ACAD_XDICTIONARY");
        assertThat(group.appData().get(0).tags()).containsExactly(DxfTag.of(360, "2B"));
        assertThat(group.subclasses()).extracting(TagGroup.Subclass::name).containsExactly("AcDbEntity", "AcDbLine");
        assertThat(group.subclasses().get(0).tags()).containsExactly(DxfTag.of(8, "WALLS"));
        assertThat(group.xdata()).hasSize(1);
        assertThat(group.xdata().get(0).appid()).isEqualTo("MYAPP");
        assertThat(group.xdata().get(0).tags()).hasSize(2);
        assertThat(group.isFlat()).isFalse();
    }

    @Test
    void classify_flattenIgnoresSubclassMarkers() {
        TagGroup group = TagGroup.classify(DxfTagReader.readAll(LINE_WITH_EXTRAS), true);

        assertThat(group.isFlat()).isTrue();
        assertThat(group.strippedMarkers()).isEqualTo(2);
        assertThat(group.findBase(8)).isEqualTo(DxfTag.of(8, "WALLS"));
        assertThat(group.find(11).pointValue().x()).isEqualTo(1.0);
    }

    @Test
    void classify_unterminatedControlGroup_throwsStructureError() {
        List<DxfTag> tags = DxfTagReader.readAll("""
                  0
                DICTIONARY
                  5
                C
                102
                {ACAD_REACTORS
                330
                1
                100
                AcDbDictionary
                """);

        assertThatThrownBy(() -> TagGroup.classify(tags))
                .isInstanceOf(DxfStructureException.class)
                .hasMessageContaining("{ACAD_REACTORS");
    }

    @Test
    void classify_requiresStructureTagFirst() {
        assertThatThrownBy(() -> TagGroup.classify(List.of(DxfTag.of(8, "0"))))
                .isInstanceOf(DxfStructureException.class);
    }
}
