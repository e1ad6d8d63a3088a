package org.example.dxf.entity;

import org.example.dxf.DxfVersion;
import org.example.dxf.schema.EntitySchema;
import org.example.dxf.tag.DxfPoint;
import org.example.dxf.tag.DxfTag;
import org.example.dxf.tag.DxfTagWriter;

import java.util.ArrayList;
import java.util.List;

/**
 * LWPOLYLINE：顶点列表是变长结构，顶点数（90）由列表计算。
 */
public class LwPolyline extends DxfEntity {

    private static final String SUBCLASS = "AcDbPolyline";
    private static final String POINTS = "points";

    /**
     * 轻量多段线顶点。宽度、凸度为 0 时不写出；{@code id}（91）仅 R2010 起写出。
     */
    public record Vertex(double x, double y, double startWidth, double endWidth, double bulge, int id) {

        public static Vertex of(double x, double y) {
            return new Vertex(x, y, 0, 0, 0, 0);
        }

        public static Vertex of(double x, double y, double bulge) {
            return new Vertex(x, y, 0, 0, bulge, 0);
        }
    }

    private final List<Vertex> vertices = new ArrayList<>();

    public LwPolyline(EntitySchema schema) {
        super(schema);
    }

    public List<Vertex> vertices() {
        return vertices;
    }

    public void append(double x, double y) {
        vertices.add(Vertex.of(x, y));
    }

    public boolean isClosed() {
        return (getInt("flags") & 1) != 0;
    }

    public void setClosed(boolean closed) {
        int flags = getInt("flags");
        set("flags", closed ? flags | 1 : flags & ~1);
    }

    @Override
    protected Object computedValue(String name) {
        return "count".equals(name) ? vertices.size() : null;
    }

    @Override
    protected List<DxfTag> loadStructure(String subclass, List<DxfTag> tags) {
        if (!SUBCLASS.equals(subclass)) {
            return tags;
        }
        List<DxfTag> rest = new ArrayList<>();
        boolean marked = false;
        double[] current = null;
        int id = 0;
        for (DxfTag tag : tags) {
            int code = tag.code();
            if (code == 10) {
                if (current != null) {
                    vertices.add(new Vertex(current[0], current[1], current[2], current[3], current[4], id));
                }
                DxfPoint p = tag.pointValue();
                current = new double[]{p.x(), p.y(), 0, 0, 0};
                id = 0;
                if (!marked) {
                    rest.add(slotMarker(POINTS));
                    marked = true;
                }
            } else if (current != null && code >= 40 && code <= 42) {
                current[code - 38] = tag.doubleValue();
            } else if (current != null && code == 91) {
                id = tag.intValue();
            } else {
                if (current != null) {
                    vertices.add(new Vertex(current[0], current[1], current[2], current[3], current[4], id));
                    current = null;
                }
                rest.add(tag);
            }
        }
        if (current != null) {
            vertices.add(new Vertex(current[0], current[1], current[2], current[3], current[4], id));
        }
        return rest;
    }

    @Override
    protected void exportSlot(String slot, DxfTagWriter w) {
        if (!POINTS.equals(slot)) {
            return;
        }
        boolean withId = w.version().isAtLeast(DxfVersion.R2010);
        for (Vertex v : vertices) {
            w.writePoint(10, DxfPoint.of(v.x(), v.y()), false);
            if (v.startWidth() != 0 || v.endWidth() != 0) {
                w.write(40, v.startWidth());
                w.write(41, v.endWidth());
            }
            if (v.bulge() != 0) {
                w.write(42, v.bulge());
            }
            if (withId && v.id() != 0) {
                w.write(91, v.id());
            }
        }
    }
}
