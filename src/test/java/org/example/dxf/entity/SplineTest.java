package org.example.dxf.entity;

import org.example.dxf.DxfVersion;
import org.example.dxf.tag.DxfPoint;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.example.dxf.entity.EntityTestSupport.export;
import static org.example.dxf.entity.EntityTestSupport.load;

class SplineTest {

    private static final String SPLINE = """
              0
            SPLINE
              5
            40
            100
            AcDbEntity
              8
            0
            100
            AcDbSpline
             70
            8
             71
            2
             72
            6
             73
            3
             74
            0
             40
            0.0
             40
            0.0
             40
            0.0
             40
            1.0
             40
            1.0
             40
            1.0
             10
            0.0
             20
            0.0
             30
            0.0
             10
            5.0
             20
            5.0
             30
            0.0
             10
            10.0
             20
            0.0
             30
            0.0
            """;

    @Test
    void load_splitsKnotsAndControlPoints() {
        Spline spline = (Spline) load(SPLINE);

        assertThat(spline.getInt("degree")).isEqualTo(2);
        assertThat(spline.knots()).containsExactly(0.0, 0.0, 0.0, 1.0, 1.0, 1.0);
        assertThat(spline.controlPoints()).containsExactly(
                DxfPoint.of(0, 0, 0), DxfPoint.of(5, 5, 0), DxfPoint.of(10, 0, 0));
        assertThat(spline.fitPoints()).isEmpty();
    }

    @Test
    void counts_areComputedFromLists() {
        Spline spline = (Spline) load(SPLINE);
        spline.fitPoints().add(DxfPoint.of(0, 0, 0));
        spline.fitPoints().add(DxfPoint.of(10, 0, 0));

        assertThat(spline.getInt("n_fit_points")).isEqualTo(2);
        String out = export(spline, DxfVersion.R2013);
        assertThat(out).contains(" 72\n6\n 73\n3\n 74\n2\n");
        assertThat(out).endsWith(" 11\n0.0\n 21\n0.0\n 31\n0.0\n 11\n10.0\n 21\n0.0\n 31\n0.0\n");
    }
}
