package org.example.dxf.entity;

import org.example.dxf.schema.EntitySchema;
import org.example.dxf.tag.DxfPoint;
import org.example.dxf.tag.DxfTag;
import org.example.dxf.tag.DxfTagWriter;

import java.util.ArrayList;
import java.util.List;

/**
 * MESH（细分网格）：顶点（92）、面（93）、边（94）、折痕（95）四段“数量 + 负载”结构。
 * <p>
 * 面列表按“顶点数, 索引...”连续存放在 90 组码中。折痕之后的属性覆盖数据不解析，作为未建模 tag 保留。
 */
public class Mesh extends DxfEntity {

    private static final String SUBCLASS = "AcDbSubDMesh";
    private static final String DATA = "mesh_data";

    public record Edge(int start, int end) {
    }

    private final List<DxfPoint> vertices = new ArrayList<>();
    private final List<List<Integer>> faces = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final List<Double> creases = new ArrayList<>();

    public Mesh(EntitySchema schema) {
        super(schema);
    }

    public List<DxfPoint> vertices() {
        return vertices;
    }

    public List<List<Integer>> faces() {
        return faces;
    }

    public List<Edge> edges() {
        return edges;
    }

    public List<Double> creases() {
        return creases;
    }

    @Override
    protected List<DxfTag> loadStructure(String subclass, List<DxfTag> tags) {
        if (!SUBCLASS.equals(subclass)) {
            return tags;
        }
        List<DxfTag> rest = new ArrayList<>();
        TagCursor cursor = new TagCursor(tags, 0, "MESH");
        // 四段结构只按 92、93、94、95 的顺序各出现一次
        int last = 0;
        while (cursor.hasNext()) {
            int code = cursor.peekCode();
            if (code < 92 || code > 95 || code <= last) {
                rest.add(tags.get(cursor.index()));
                cursor.expect(code);
                continue;
            }
            if (last == 0) {
                rest.add(slotMarker(DATA));
            }
            last = code;
            int count = cursor.expect(code).intValue();
            switch (code) {
                case 92 -> {
                    for (int i = 0; i < count; i++) {
                        vertices.add(cursor.expect(10).pointValue());
                    }
                }
                case 93 -> readFaces(cursor, count);
                case 94 -> {
                    for (int i = 0; i < count; i++) {
                        edges.add(new Edge(cursor.expect(90).intValue(), cursor.expect(90).intValue()));
                    }
                }
                default -> {
                    for (int i = 0; i < count; i++) {
                        creases.add(cursor.expect(140).doubleValue());
                    }
                }
            }
        }
        return rest;
    }

    private void readFaces(TagCursor cursor, int size) {
        int read = 0;
        while (read < size) {
            int n = cursor.expect(90).intValue();
            List<Integer> face = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                face.add(cursor.expect(90).intValue());
            }
            faces.add(face);
            read += n + 1;
        }
    }

    @Override
    protected void exportSlot(String slot, DxfTagWriter w) {
        if (!DATA.equals(slot)) {
            return;
        }
        w.write(92, vertices.size());
        vertices.forEach(p -> w.writePoint(10, p, true));
        w.write(93, faces.stream().mapToInt(f -> f.size() + 1).sum());
        for (List<Integer> face : faces) {
            w.write(90, face.size());
            face.forEach(i -> w.write(90, i));
        }
        w.write(94, edges.size());
        for (Edge e : edges) {
            w.write(90, e.start());
            w.write(90, e.end());
        }
        w.write(95, creases.size());
        creases.forEach(c -> w.write(140, c));
        if (!hasUnknownAfter(DATA)) {
            // 没有属性覆盖
            w.write(90, 0);
        }
    }
}
