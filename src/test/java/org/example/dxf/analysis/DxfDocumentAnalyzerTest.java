package org.example.dxf.analysis;

import org.example.dxf.DxfDocument;
import org.example.dxf.DxfOptions;
import org.example.dxf.DxfVersion;
import org.example.dxf.dto.DxfDocumentSummary;
import org.example.dxf.dto.DxfEntityTypeCount;
import org.example.dxf.tag.DxfPoint;
import org.junit.jupiter.api.Test;

import java.util.Comparator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DxfDocumentAnalyzerTest {

    private static DxfDocument sample(DxfVersion version) {
        DxfDocument doc = DxfDocument.create(version, DxfOptions.defaults());
        doc.newLayer("WALLS");
        doc.newBlock("DOOR", DxfPoint.ORIGIN);
        doc.add(doc.modelspace(), "LINE");
        doc.add(doc.modelspace(), "LINE");
        doc.add(doc.paperspace(), "CIRCLE");
        return doc;
    }

    @Test
    void analyze_summarizesDocument() {
        DxfDocument doc = sample(DxfVersion.R2013);

        DxfDocumentSummary summary = DxfDocumentAnalyzer.analyze(doc);

        assertThat(summary.version()).isEqualTo("AC1027");
        assertThat(summary.codepage()).isEqualTo("ANSI_1252");
        assertThat(summary.handleSeed()).isEqualTo(doc.database().handles().seed());
        assertThat(summary.entityCount()).isEqualTo(doc.database().size());
        assertThat(summary.modelspaceEntities()).isEqualTo(2);
        assertThat(summary.paperspaceEntities()).isEqualTo(1);
        assertThat(summary.layers()).containsExactly("0", "WALLS");
        assertThat(summary.blocks()).containsExactly("DOOR");
        assertThat(summary.sections()).containsExactly("HEADER", "CLASSES", "TABLES", "BLOCKS", "ENTITIES", "OBJECTS");
        assertThat(summary.entityTypes())
                .contains(new DxfEntityTypeCount("LINE", 2), new DxfEntityTypeCount("CIRCLE", 1))
                .isSortedAccordingTo(Comparator.comparingInt(DxfEntityTypeCount::count).reversed());
        assertThat(summary.warnings()).isEmpty();
    }

    @Test
    void analyze_r12_listsLegacySections() {
        DxfDocumentSummary summary = DxfDocumentAnalyzer.analyze(sample(DxfVersion.R12));

        assertThat(summary.version()).isEqualTo("AC1009");
        assertThat(summary.sections()).containsExactly("HEADER", "TABLES", "BLOCKS", "ENTITIES");
    }

    @Test
    void analyze_truncatesEntityTypes() {
        DxfDocument doc = sample(DxfVersion.R2013);

        DxfDocumentSummary full = DxfDocumentAnalyzer.analyze(doc);
        DxfDocumentSummary limited = DxfDocumentAnalyzer.analyze(doc, 2);

        assertThat(limited.entityTypes()).containsExactlyElementsOf(full.entityTypes().subList(0, 2));
    }

    @Test
    void analyze_rejectsNonPositiveLimit() {
        DxfDocument doc = DxfDocument.create();

        assertThatThrownBy(() -> DxfDocumentAnalyzer.analyze(doc, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
