package org.example.dxf.entity;

import org.example.dxf.DxfVersion;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.example.dxf.entity.EntityTestSupport.FACTORY;
import static org.example.dxf.entity.EntityTestSupport.export;
import static org.example.dxf.entity.EntityTestSupport.load;

class LwPolylineTest {

    private static final String CLOSED_POLYLINE = """
              0
            LWPOLYLINE
              5
            30
            100
            AcDbEntity
              8
            0
            100
            AcDbPolyline
             90
            3
             70
            1
             10
            0.0
             20
            0.0
             10
            10.0
             20
            0.0
             42
            0.5
             10
            10.0
             20
            5.0
             40
            1.0
             41
            2.0
            """;

    @Test
    void load_collectsVerticesWithWidthsAndBulge() {
        LwPolyline polyline = (LwPolyline) load(CLOSED_POLYLINE);

        assertThat(polyline.isClosed()).isTrue();
        assertThat(polyline.vertices()).containsExactly(
                LwPolyline.Vertex.of(0, 0),
                LwPolyline.Vertex.of(10, 0, 0.5),
                new LwPolyline.Vertex(10, 5, 1, 2, 0, 0));
        assertThat(polyline.getInt("count")).isEqualTo(3);
    }

    @Test
    void export_reproducesVertexBlock() {
        String out = export(load(CLOSED_POLYLINE), DxfVersion.R2013);

        assertThat(out).endsWith("""
                100
                AcDbPolyline
                 90
                3
                 70
                1
                 10
                0.0
                 20
                0.0
                 10
                10.0
                 20
                0.0
                 42
                0.5
                 10
                10.0
                 20
                5.0
                 40
                1.0
                 41
                2.0
                """);
    }

    @Test
    void count_followsVertexList() {
        LwPolyline polyline = FACTORY.create("LWPOLYLINE", LwPolyline.class);
        polyline.append(0, 0);
        polyline.append(1, 0);
        polyline.append(1, 1);
        polyline.append(0, 1);
        polyline.setClosed(true);

        assertThat(polyline.getInt("count")).isEqualTo(4);
        assertThat(export(polyline, DxfVersion.R2013)).contains(" 90\n4\n 70\n1\n");

        polyline.setClosed(false);
        assertThat(polyline.isClosed()).isFalse();
    }
}
