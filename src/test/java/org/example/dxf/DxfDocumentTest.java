package org.example.dxf;

import org.example.dxf.entity.DictionaryObject;
import org.example.dxf.entity.DxfEntity;
import org.example.dxf.entity.Polyline;
import org.example.dxf.entity.Vertex;
import org.example.dxf.tag.DxfPoint;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DxfDocumentTest {

    @Test
    void create_buildsRequiredStructures() {
        DxfDocument doc = DxfDocument.create();

        assertThat(doc.dxfVersion()).isEqualTo(DxfVersion.R2013);
        assertThat(doc.header().getString("$ACADVER")).contains("AC1027");
        assertThat(doc.tables().layers().has("0")).isTrue();
        assertThat(doc.tables().linetypes().has("CONTINUOUS")).isTrue();
        assertThat(doc.tables().styles().has("Standard")).isTrue();
        assertThat(doc.modelspace().block()).isNotNull();
        assertThat(doc.paperspace().endblk()).isNotNull();
        assertThat(doc.objects().rootDictionary()).isPresent();
        assertThat(doc.database().resolve(doc.modelspace().layoutHandle())).isPresent();
        assertThat(doc.entities()).isEmpty();
        assertThat(doc.warnings()).isEmpty();
    }

    @Test
    void create_rootDictionaryListsLayouts() {
        DxfDocument doc = DxfDocument.create(DxfVersion.R2013, DxfOptions.defaults());
        DictionaryObject root = doc.objects().rootDictionary().orElseThrow();

        assertThat(root.entries()).containsOnlyKeys("ACAD_GROUP", "ACAD_LAYOUT", "ACAD_PLOTSTYLENAME");
        DictionaryObject layouts = (DictionaryObject) doc.entity(root.lookup("ACAD_LAYOUT").orElseThrow())
                .orElseThrow();
        assertThat(layouts.entries()).containsOnlyKeys("Model", "Layout1");
        assertThat(layouts.getInt("hard_owned")).isZero();
        assertThat(layouts.lookup("Model")).contains(doc.modelspace().layoutHandle());
    }

    @Test
    void add_registersEntityInLayout() {
        DxfDocument doc = DxfDocument.create();

        DxfEntity line = doc.add(doc.modelspace(), "LINE");
        DxfEntity circle = doc.add(doc.paperspace(), "CIRCLE");

        assertThat(line.handle()).isNotNull();
        assertThat(line.owner()).isEqualTo(doc.modelspace().handle());
        assertThat(doc.entity(line.handle())).containsSame(line);
        assertThat(circle.getInt("paperspace")).isEqualTo(1);
        assertThat(doc.entities()).containsExactly(line, circle);
    }

    @Test
    void add_rejectsNonGraphicalEntity() {
        DxfDocument doc = DxfDocument.create();
        DxfEntity layer = doc.entityFactory().create("LAYER");

        assertThatThrownBy(() -> doc.add(doc.modelspace(), layer)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void add_newerTypeFollowsVersionPolicy() {
        DxfDocument ignore = DxfDocument.create(DxfVersion.R2000, DxfOptions.defaults());
        DxfDocument upgrade = DxfDocument.create(DxfVersion.R2000,
                DxfOptions.defaults().withVersionPolicy(VersionConflictPolicy.UPGRADE));
        DxfDocument raise = DxfDocument.create(DxfVersion.R2000,
                DxfOptions.defaults().withVersionPolicy(VersionConflictPolicy.RAISE));

        ignore.add(ignore.modelspace(), "MESH");
        upgrade.add(upgrade.modelspace(), "MESH");

        assertThat(ignore.dxfVersion()).isEqualTo(DxfVersion.R2000);
        assertThat(ignore.modelspace().entities()).hasSize(1);
        assertThat(upgrade.dxfVersion()).isEqualTo(DxfVersion.R2010);
        assertThatThrownBy(() -> raise.add(raise.modelspace(), "MESH")).isInstanceOf(DxfVersionException.class);
        assertThat(raise.modelspace().entities()).isEmpty();
    }

    @Test
    void addVertex_ownsVerticesAndSeqend() {
        DxfDocument doc = DxfDocument.create();
        Polyline polyline = (Polyline) doc.add(doc.modelspace(), "POLYLINE");
        polyline.set("flags", Polyline.POLYLINE_3D);

        Vertex first = doc.addVertex(polyline, DxfPoint.of(0, 0, 0));
        Vertex second = doc.addVertex(polyline, DxfPoint.of(1, 2, 3));

        assertThat(polyline.vertices()).containsExactly(first, second);
        assertThat(second.owner()).isEqualTo(polyline.handle());
        assertThat(second.getInt("flags") & Vertex.POLYLINE_3D_VERTEX).isNotZero();
        assertThat(polyline.seqend()).isNotNull();
        assertThat(polyline.seqend().owner()).isEqualTo(polyline.handle());
        assertThat(doc.database().contains(polyline.seqend().handle())).isTrue();
    }

    @Test
    void addVertex_polyfaceLocationsUpdateMeshCounts() {
        DxfDocument doc = DxfDocument.create();
        Polyline polyface = (Polyline) doc.add(doc.modelspace(), "POLYLINE");
        polyface.set("flags", Polyline.POLYFACE);

        doc.addVertex(polyface, DxfPoint.of(0, 0, 0));
        doc.addVertex(polyface, DxfPoint.of(1, 0, 0));
        doc.addVertex(polyface, DxfPoint.of(0, 1, 0));

        assertThat(polyface.getInt("m_count")).isEqualTo(3);
        assertThat(polyface.getInt("n_count")).isZero();
        assertThat(polyface.vertices().get(0).getInt("flags"))
                .isEqualTo(Vertex.POLYFACE_MESH_VERTEX | Vertex.POLYGON_MESH_VERTEX);
    }

    @Test
    void newLayer_andNewBlock_rejectDuplicateNames() {
        DxfDocument doc = DxfDocument.create();
        doc.newLayer("Walls");
        doc.newBlock("DOOR", DxfPoint.ORIGIN);

        assertThatThrownBy(() -> doc.newLayer("WALLS")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> doc.newBlock("door", DxfPoint.ORIGIN)).isInstanceOf(IllegalArgumentException.class);
        assertThat(doc.blocks().blocks()).hasSize(1);
    }

    @Test
    void delete_removesEntityFromLayoutAndDatabase() {
        DxfDocument doc = DxfDocument.create();
        DxfEntity line = doc.add(doc.modelspace(), "LINE");
        String handle = line.handle();

        doc.delete(line);

        assertThat(doc.modelspace().entities()).isEmpty();
        assertThat(doc.entity(handle)).isEmpty();
        assertThat(line.isAlive()).isFalse();
    }

    @Test
    void delete_refusesLayouts() {
        DxfDocument doc = DxfDocument.create();

        assertThatThrownBy(() -> doc.delete(doc.modelspace())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> doc.delete(doc.paperspace())).isInstanceOf(IllegalArgumentException.class);
    }
}
