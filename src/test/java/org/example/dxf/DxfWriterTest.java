package org.example.dxf;

import org.example.dxf.entity.BlockRecord;
import org.example.dxf.entity.DictionaryObject;
import org.example.dxf.entity.DxfEntity;
import org.example.dxf.entity.Hatch;
import org.example.dxf.entity.HatchBoundaryPath;
import org.example.dxf.entity.Insert;
import org.example.dxf.entity.LwPolyline;
import org.example.dxf.entity.MText;
import org.example.dxf.entity.Mesh;
import org.example.dxf.entity.Polyline;
import org.example.dxf.entity.Spline;
import org.example.dxf.tag.DxfPoint;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DxfWriterTest {

    private static DxfDocument sampleDocument(DxfVersion version) {
        DxfDocument doc = DxfDocument.create(version, DxfOptions.defaults());
        doc.newLayer("WALLS").set("color", 1);

        DxfEntity line = doc.add(doc.modelspace(), "LINE");
        line.set("layer", "WALLS");
        line.set("end", DxfPoint.of(10, 0, 0));

        BlockRecord door = doc.newBlock("DOOR", DxfPoint.ORIGIN);
        DxfEntity arc = doc.add(door, "ARC");
        arc.set("radius", 0.9);
        arc.set("end_angle", 90.0);

        Insert insert = (Insert) doc.add(doc.modelspace(), "INSERT");
        insert.set("name", "DOOR");
        insert.set("insert", DxfPoint.of(5, 0, 0));
        doc.addAttrib(insert, "NUMBER", "12", DxfPoint.of(5, 1, 0));

        DxfEntity text = doc.add(doc.modelspace(), "TEXT");
        text.set("text", "Länge 中文");

        DxfEntity circle = doc.add(doc.paperspace(), "CIRCLE");
        circle.set("radius", 20.0);
        return doc;
    }

    private static List<String> handles(List<DxfEntity> entities) {
        return entities.stream().map(DxfEntity::handle).toList();
    }

    /**
     * 往返用例：在 R2018 文档中建出实体，返回需要按句柄比对的实体，以及属性之外还要比对的结构数据。
     */
    private record RoundTrip(String name, DxfVersion since, Function<DxfDocument, DxfEntity> build,
                             Function<DxfEntity, List<?>> structure) {

        @Override
        public String toString() {
            return name;
        }
    }

    private static final List<RoundTrip> ROUND_TRIPS = List.of(
            new RoundTrip("LINE", DxfVersion.R12, doc -> {
                DxfEntity line = doc.add(doc.modelspace(), "LINE");
                line.set("start", DxfPoint.of(1.5, 2.25, 0));
                line.set("end", DxfPoint.of(10, 0, 3));
                line.set("color", 3);
                return line;
            }, e -> List.of()),
            new RoundTrip("POLYLINE", DxfVersion.R12, doc -> {
                Polyline polyline = (Polyline) doc.add(doc.modelspace(), "POLYLINE");
                polyline.set("flags", Polyline.CLOSED);
                doc.addVertex(polyline, DxfPoint.of(0, 0, 0));
                doc.addVertex(polyline, DxfPoint.of(4, 0, 0)).set("bulge", 0.5);
                doc.addVertex(polyline, DxfPoint.of(4, 3, 0));
                return polyline;
            }, e -> {
                Polyline polyline = (Polyline) e;
                return List.of(attributesOf(polyline.vertices()), polyline.seqend() != null);
            }),
            new RoundTrip("INSERT", DxfVersion.R12, doc -> {
                doc.newBlock("DOOR", DxfPoint.ORIGIN);
                Insert insert = (Insert) doc.add(doc.modelspace(), "INSERT");
                insert.set("name", "DOOR");
                insert.set("insert", DxfPoint.of(5, 0, 0));
                insert.set("rotation", 90.0);
                doc.addAttrib(insert, "NUMBER", "12", DxfPoint.of(5, 1, 0));
                doc.addAttrib(insert, "WIDTH", "0.9", DxfPoint.of(5, 2, 0));
                return insert;
            }, e -> {
                Insert insert = (Insert) e;
                return List.of(attributesOf(insert.attribs()), insert.seqend() != null);
            }),
            new RoundTrip("LWPOLYLINE", DxfVersion.R2000, doc -> {
                LwPolyline polyline = (LwPolyline) doc.add(doc.modelspace(), "LWPOLYLINE");
                polyline.append(0, 0);
                polyline.append(2, 0);
                polyline.append(2, 1);
                polyline.setClosed(true);
                return polyline;
            }, e -> List.of(((LwPolyline) e).vertices())),
            new RoundTrip("SPLINE", DxfVersion.R2000, doc -> {
                Spline spline = (Spline) doc.add(doc.modelspace(), "SPLINE");
                spline.set("degree", 2);
                spline.knots().addAll(List.of(0.0, 0.0, 0.0, 1.0, 1.0, 1.0));
                spline.controlPoints().addAll(List.of(
                        DxfPoint.of(0, 0, 0), DxfPoint.of(5, 5, 0), DxfPoint.of(10, 0, 0)));
                return spline;
            }, e -> {
                Spline spline = (Spline) e;
                return List.of(spline.knots(), spline.weights(), spline.controlPoints(), spline.fitPoints());
            }),
            new RoundTrip("MTEXT", DxfVersion.R2000, doc -> {
                MText mtext = (MText) doc.add(doc.modelspace(), "MTEXT");
                mtext.set("insert", DxfPoint.of(1, 2, 0));
                mtext.set("char_height", 3.5);
                mtext.set("width", 40.0);
                mtext.setText("first\\Psecond");
                return mtext;
            }, e -> List.of(((MText) e).text())),
            new RoundTrip("HATCH", DxfVersion.R2000, doc -> {
                Hatch hatch = (Hatch) doc.add(doc.modelspace(), "HATCH");
                hatch.setSolidFill();
                hatch.paths().add(HatchBoundaryPath.polyline(1, true, List.of(
                        new HatchBoundaryPath.Vertex(0, 0, 0),
                        new HatchBoundaryPath.Vertex(4, 0, 0.5),
                        new HatchBoundaryPath.Vertex(4, 3, 0))));
                return hatch;
            }, e -> {
                Hatch hatch = (Hatch) e;
                return List.of(hatch.paths(), hatch.isSolidFill());
            }),
            new RoundTrip("MESH", DxfVersion.R2010, doc -> {
                Mesh mesh = (Mesh) doc.add(doc.modelspace(), "MESH");
                mesh.vertices().addAll(List.of(
                        DxfPoint.of(0, 0, 0), DxfPoint.of(1, 0, 0), DxfPoint.of(1, 1, 0), DxfPoint.of(0, 1, 0)));
                mesh.faces().add(List.of(0, 1, 2, 3));
                return mesh;
            }, e -> {
                Mesh mesh = (Mesh) e;
                return List.of(mesh.vertices(), mesh.faces());
            }),
            new RoundTrip("DICTIONARY", DxfVersion.R2000, doc -> {
                DictionaryObject root = doc.objects().rootDictionary().orElseThrow();
                DictionaryObject outer = doc.entityFactory().create("DICTIONARY", DictionaryObject.class);
                doc.register(outer, root.handle());
                doc.objects().add(outer);
                root.put("APP_DATA", outer.handle());
                DictionaryObject inner = doc.entityFactory().create("DICTIONARY", DictionaryObject.class);
                doc.register(inner, outer.handle());
                doc.objects().add(inner);
                outer.put("SETTINGS", inner.handle());
                outer.set("hard_owned", 1);
                return outer;
            }, e -> List.of(((DictionaryObject) e).entries()))
    );

    static Stream<Arguments> roundTrips() {
        List<Arguments> result = new ArrayList<>();
        for (RoundTrip roundTrip : ROUND_TRIPS) {
            for (DxfVersion version : List.of(DxfVersion.R12, DxfVersion.R2000, DxfVersion.R2018)) {
                if (!version.isBefore(roundTrip.since())) {
                    result.add(Arguments.of(roundTrip, version));
                }
            }
        }
        return result.stream();
    }

    private static List<Object> attributesOf(List<DxfEntity> entities) {
        List<Object> result = new ArrayList<>();
        for (DxfEntity e : entities) {
            result.add(List.of(e.handle(), e.attributes(), e.unknownTags()));
        }
        return result;
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @MethodSource("roundTrips")
    void writeString_entityRoundTripsThroughTargetVersion(RoundTrip roundTrip, DxfVersion version) {
        DxfDocument doc = DxfDocument.create(DxfVersion.R2018, DxfOptions.defaults());
        DxfEntity original = roundTrip.build().apply(doc);

        DxfDocument reread = new DxfReader().readString(new DxfWriter().writeString(doc, version));

        assertThat(reread.dxfVersion()).isEqualTo(version);
        DxfEntity copy = reread.entity(original.handle()).orElseThrow();
        assertThat(copy.dxftype()).isEqualTo(original.dxftype());
        assertThat(copy.attributes()).isEqualTo(original.attributes());
        assertThat(copy.unknownTags()).isEqualTo(original.unknownTags());
        assertThat(roundTrip.structure().apply(copy)).isEqualTo(roundTrip.structure().apply(original));
        assertThat(reread.warnings()).isEmpty();
    }

    @Test
    void writeString_createdDocument_readsBackWithSameContent() {
        DxfDocument doc = sampleDocument(DxfVersion.R2013);

        String text = new DxfWriter().writeString(doc);
        DxfDocument reread = new DxfReader().readString(text);

        assertThat(reread.dxfVersion()).isEqualTo(DxfVersion.R2013);
        assertThat(reread.modelspace().entities()).extracting(DxfEntity::dxftype)
                .containsExactly("LINE", "INSERT", "TEXT");
        assertThat(reread.paperspace().entities()).extracting(DxfEntity::dxftype).containsExactly("CIRCLE");
        assertThat(handles(reread.entities())).isEqualTo(handles(doc.entities()));
        assertThat(reread.modelspace().entities().get(2).getString("text")).isEqualTo("Länge 中文");
        assertThat(reread.tables().layers().get("walls")).map(l -> l.getInt("color")).contains(1);
        assertThat(reread.blocks().get("DOOR").orElseThrow().entities())
                .extracting(DxfEntity::dxftype).containsExactly("ARC");
        Insert insert = (Insert) reread.modelspace().entities().get(1);
        assertThat(insert.attrib("NUMBER")).map(a -> a.getString("text")).contains("12");
        assertThat(reread.warnings()).isEmpty();
    }

    @Test
    void writeString_loadedDocument_isStable() {
        DxfWriter writer = new DxfWriter();
        DxfReader reader = new DxfReader();
        String first = writer.writeString(reader.readString(writer.writeString(sampleDocument(DxfVersion.R2013))));

        String second = writer.writeString(reader.readString(first));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void write_r2000_escapesCharactersOutsideCodepage() throws IOException {
        DxfDocument doc = sampleDocument(DxfVersion.R2000);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        new DxfWriter().write(doc, out);

        assertThat(new DxfWriter().writeString(doc)).contains("Länge \\U+4E2D\\U+6587");
        DxfDocument reread = new DxfReader().read(out.toByteArray());
        assertThat(reread.dxfVersion()).isEqualTo(DxfVersion.R2000);
        assertThat(reread.modelspace().entities().get(2).getString("text")).isEqualTo("Länge 中文");
    }

    @Test
    void writeString_olderTarget_skipsNewerEntityTypes() {
        DxfDocument doc = sampleDocument(DxfVersion.R2013);
        doc.add(doc.modelspace(), "MESH");

        String text = new DxfWriter().writeString(doc, DxfVersion.R2000);

        DxfDocument reread = new DxfReader().readString(text);
        assertThat(reread.dxfVersion()).isEqualTo(DxfVersion.R2000);
        assertThat(reread.modelspace().entities()).extracting(DxfEntity::dxftype)
                .containsExactly("LINE", "INSERT", "TEXT");
        assertThat(doc.dxfVersion()).isEqualTo(DxfVersion.R2013);
    }

    @Test
    void writeString_olderTarget_raisePolicyRejectsNewerEntityTypes() {
        DxfDocument doc = sampleDocument(DxfVersion.R2013);
        doc.add(doc.modelspace(), "MESH");
        DxfWriter writer = new DxfWriter(DxfOptions.defaults().withVersionPolicy(VersionConflictPolicy.RAISE));

        assertThatThrownBy(() -> writer.writeString(doc, DxfVersion.R2000))
                .isInstanceOf(DxfVersionException.class)
                .hasMessageContaining("MESH");
        assertThat(doc.dxfVersion()).isEqualTo(DxfVersion.R2013);
    }

    @Test
    void writeString_r12_usesLegacyLayout() {
        DxfDocument doc = sampleDocument(DxfVersion.R2013);

        String text = new DxfWriter().writeString(doc, DxfVersion.R12);

        assertThat(text)
                .contains("$MODEL_SPACE")
                .contains("AC1009")
                .doesNotContain("OBJECTS")
                .doesNotContain("CLASSES")
                .doesNotContain("AcDb")
                .doesNotContain("BLOCK_RECORD");
        DxfDocument reread = new DxfReader().readString(text);
        assertThat(reread.dxfVersion()).isEqualTo(DxfVersion.R12);
        assertThat(reread.modelspace().entities()).extracting(DxfEntity::dxftype)
                .containsExactly("LINE", "INSERT", "TEXT");
        assertThat(reread.paperspace().entities()).extracting(DxfEntity::dxftype).containsExactly("CIRCLE");
        assertThat(reread.blocks().get("DOOR").orElseThrow().entities())
                .extracting(DxfEntity::dxftype).containsExactly("ARC");
    }

    @Test
    void write_path_roundTrips(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("sample.dxf");
        DxfDocument doc = sampleDocument(DxfVersion.R2010);

        new DxfWriter().write(doc, file);
        DxfDocument reread = new DxfReader().read(file);

        assertThat(reread.dxfVersion()).isEqualTo(DxfVersion.R2010);
        assertThat(handles(reread.entities())).isEqualTo(handles(doc.entities()));
    }
}
