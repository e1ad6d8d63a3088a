package org.example.dxf.structure;

import org.example.dxf.DxfStructureException;
import org.example.dxf.UnexpectedEndOfStreamException;
import org.example.dxf.tag.DxfTagReader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SectionSplitterTest {

    @Test
    void split_groupsEntitiesByStructureTag() {
        List<RawSection> sections = SectionSplitter.split(new DxfTagReader("""
                  0
                SECTION
                  2
                HEADER
                  9
                $ACADVER
                  1
                AC1015
                  0
                ENDSEC
                  0
                SECTION
                  2
                ENTITIES
                  0
                LINE
                  8
                0
                  0
                CIRCLE
                 40
                2.0
                  0
                ENDSEC
                  0
                EOF
                """));

        assertThat(sections).extracting(RawSection::name).containsExactly("HEADER", "ENTITIES");
        assertThat(sections.get(0).groups()).hasSize(1);
        RawSection entities = sections.get(1);
        assertThat(entities.groups()).hasSize(2);
        assertThat(entities.groups().get(1).get(0).stringValue()).isEqualTo("CIRCLE");
        assertThat(entities.line()).isEqualTo(11);
    }

    @Test
    void split_acceptsMissingEof() {
        List<RawSection> sections = SectionSplitter.split(new DxfTagReader("""
                  0
                SECTION
                  2
                ENTITIES
                  0
                ENDSEC
                """));

        assertThat(sections).hasSize(1);
        assertThat(sections.get(0).groups()).isEmpty();
    }

    @Test
    void split_missingEndsec_throwsUnexpectedEndOfStream() {
        assertThatThrownBy(() -> SectionSplitter.split(new DxfTagReader("""
                  0
                SECTION
                  2
                ENTITIES
                  0
                LINE
                  8
                0
                """)))
                .isInstanceOf(UnexpectedEndOfStreamException.class)
                .hasMessageContaining("ENTITIES");
    }

    @Test
    void split_eofInsideSection_throwsUnexpectedEndOfStream() {
        assertThatThrownBy(() -> SectionSplitter.split(new DxfTagReader("""
                  0
                SECTION
                  2
                ENTITIES
                  0
                EOF
                """)))
                .isInstanceOf(UnexpectedEndOfStreamException.class);
    }

    @Test
    void split_contentOutsideSection_throwsStructureError() {
        assertThatThrownBy(() -> SectionSplitter.split(new DxfTagReader("""
                  0
                LINE
                """)))
                .isInstanceOf(DxfStructureException.class)
                .hasMessageContaining("SECTION");
    }
}
