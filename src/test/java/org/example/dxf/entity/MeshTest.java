package org.example.dxf.entity;

import org.example.dxf.DxfStructureException;
import org.example.dxf.DxfVersion;
import org.example.dxf.tag.DxfPoint;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.example.dxf.entity.EntityTestSupport.FACTORY;
import static org.example.dxf.entity.EntityTestSupport.export;
import static org.example.dxf.entity.EntityTestSupport.load;

class MeshTest {

    private static final String QUAD = """
              0
            MESH
              5
            A0
            330
            1F
            100
            AcDbEntity
              8
            0
            100
            AcDbSubDMesh
             71
            2
             72
            0
             91
            0
             92
            4
             10
            0.0
             20
            0.0
             30
            0.0
             10
            1.0
             20
            0.0
             30
            0.0
             10
            1.0
             20
            1.0
             30
            0.0
             10
            0.0
             20
            1.0
             30
            0.0
             93
            5
             90
            4
             90
            0
             90
            1
             90
            2
             90
            3
             94
            0
             95
            0
             90
            0
            """;

    @Test
    void load_decodesCountedSections() {
        Mesh mesh = (Mesh) load(QUAD);

        assertThat(mesh.vertices()).hasSize(4).contains(DxfPoint.of(1, 1, 0));
        assertThat(mesh.faces()).containsExactly(List.of(0, 1, 2, 3));
        assertThat(mesh.edges()).isEmpty();
        assertThat(mesh.creases()).isEmpty();
    }

    @Test
    void export_roundTripsOverrideCount() {
        assertThat(export(load(QUAD), DxfVersion.R2013)).isEqualTo(QUAD);
    }

    @Test
    void export_newMesh_writesEdgesAndCreases() {
        Mesh mesh = FACTORY.create("MESH", Mesh.class);
        mesh.vertices().add(DxfPoint.of(0, 0, 0));
        mesh.vertices().add(DxfPoint.of(1, 0, 0));
        mesh.edges().add(new Mesh.Edge(0, 1));
        mesh.creases().add(0.5);

        assertThat(export(mesh, DxfVersion.R2013))
                .endsWith(" 93\n0\n 94\n1\n 90\n0\n 90\n1\n 95\n1\n140\n0.5\n 90\n0\n");
    }

    @Test
    void load_truncatedVertexList_throws() {
        String broken = QUAD.substring(0, QUAD.indexOf(" 10\n1.0\n 20\n1.0"));

        assertThatThrownBy(() -> load(broken))
                .isInstanceOf(DxfStructureException.class)
                .satisfies(e -> assertThat(((DxfStructureException) e).getDxftype()).isEqualTo("MESH"));
    }
}
