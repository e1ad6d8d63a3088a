package org.example.dxf.tag;

import org.example.dxf.DxfVersion;
import org.example.dxf.VersionConflictPolicy;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DxfTagWriterTest {

    @Test
    void formatDouble_usesShortestPlainRepresentation() {
        assertThat(DxfTagWriter.formatDouble(1.0)).isEqualTo("1.0");
        assertThat(DxfTagWriter.formatDouble(0.1)).isEqualTo("0.1");
        assertThat(DxfTagWriter.formatDouble(100.0)).isEqualTo("100.0");
        assertThat(DxfTagWriter.formatDouble(-2.5)).isEqualTo("-2.5");
        assertThat(DxfTagWriter.formatDouble(1e20)).isEqualTo("100000000000000000000.0");
        assertThat(DxfTagWriter.formatDouble(1e-10)).isEqualTo("0.0000000001");
    }

    @Test
    void formatDouble_rejectsNaN() {
        assertThatThrownBy(() -> DxfTagWriter.formatDouble(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void write_rightAlignsGroupCodes() {
        StringWriter out = new StringWriter();
        DxfTagWriter w = new DxfTagWriter(out, DxfVersion.R2013, VersionConflictPolicy.IGNORE, StandardCharsets.UTF_8);

        w.write(0, "LINE");
        w.write(62, 1);
        w.writePoint(10, DxfPoint.of(1, 2, 3), true);
        w.write(1001, "APP");

        assertThat(out.toString()).isEqualTo("  0\nLINE\n 62\n1\n 10\n1.0\n 20\n2.0\n 30\n3.0\n1001\nAPP\n");
    }

    @Test
    void write_parsedTagsKeepOriginalText() {
        StringWriter out = new StringWriter();
        DxfTagWriter w = new DxfTagWriter(out, DxfVersion.R2013, VersionConflictPolicy.IGNORE, StandardCharsets.UTF_8);
        List<DxfTag> tags = DxfTagReader.readAll("""
                 40
                1.50000
                 10
                1
                 20
                2
                """);

        w.writeAll(tags);

        assertThat(out.toString()).isEqualTo(" 40\n1.50000\n 10\n1\n 20\n2\n");
    }

    @Test
    void write_legacyVersionEscapesUnencodableCharacters() {
        StringWriter out = new StringWriter();
        DxfTagWriter w = new DxfTagWriter(out, DxfVersion.R2000, VersionConflictPolicy.IGNORE,
                Charset.forName("cp1252"));

        w.write(1, "Länge 中");

        assertThat(out.toString()).isEqualTo("  1\nLänge \\U+4E2D\n");
    }
}
