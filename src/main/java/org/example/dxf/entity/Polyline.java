package org.example.dxf.entity;

import org.example.dxf.schema.EntitySchema;
import org.example.dxf.schema.SubclassDef;
import org.example.dxf.tag.DxfTagWriter;

import java.util.ArrayList;
import java.util.List;

/**
 * POLYLINE：后随 VERTEX 实体与 SEQEND，三者作为一个整体写出和删除。
 * <p>
 * 子类标记按标志位区分：8 三维多段线、16 多边形网格、64 多面网格，其余为二维多段线。
 * <p>
 * 网格的 M/N 计数（71/72）由顶点列表计算：多面网格为位置顶点数与面记录数；
 * 多边形网格按已有的 N 计算 M。
 */
public class Polyline extends DxfEntity implements EntityContainer {

    public static final int CLOSED = 1;
    public static final int POLYLINE_3D = 8;
    public static final int POLYMESH = 16;
    public static final int POLYFACE = 64;

    private final List<DxfEntity> vertices = new ArrayList<>();
    private DxfEntity seqend;

    public Polyline(EntitySchema schema) {
        super(schema);
    }

    public List<DxfEntity> vertices() {
        return vertices;
    }

    public DxfEntity seqend() {
        return seqend;
    }

    public void setSeqend(DxfEntity seqend) {
        this.seqend = seqend;
    }

    public boolean isClosed() {
        return (getInt("flags") & CLOSED) != 0;
    }

    public boolean isPolyface() {
        return (getInt("flags") & POLYFACE) != 0;
    }

    public boolean isPolymesh() {
        return (getInt("flags") & POLYMESH) != 0;
    }

    @Override
    protected Object computedValue(String name) {
        return switch (name) {
            case "vertices_follow" -> 1;
            case "m_count" -> isPolyface() ? countVertices(true) : polymeshRows();
            case "n_count" -> isPolyface() ? countVertices(false) : null;
            default -> null;
        };
    }

    /**
     * @param locations {@code true} 统计位置顶点，{@code false} 统计面记录
     */
    private Integer countVertices(boolean locations) {
        int count = 0;
        for (DxfEntity v : vertices) {
            int flags = v.getInt("flags");
            boolean face = (flags & Vertex.POLYFACE_MESH_VERTEX) != 0 && (flags & Vertex.POLYGON_MESH_VERTEX) == 0;
            if (face != locations) {
                count++;
            }
        }
        return count;
    }

    /**
     * 顶点按行排列，每行 N 个；不是多边形网格、N 未设置或与顶点数不整除时使用已保存的 M。
     */
    private Integer polymeshRows() {
        int columns = getInt("n_count");
        if (!isPolymesh() || columns <= 0 || vertices.size() % columns != 0) {
            return null;
        }
        return vertices.size() / columns;
    }

    @Override
    protected String defaultMarker(int index, SubclassDef def) {
        if (!"AcDb2dPolyline".equals(def.name())) {
            return def.name();
        }
        int flags = getInt("flags");
        if ((flags & POLYLINE_3D) != 0) {
            return "AcDb3dPolyline";
        }
        if ((flags & POLYMESH) != 0) {
            return "AcDbPolygonMesh";
        }
        if ((flags & POLYFACE) != 0) {
            return "AcDbPolyFaceMesh";
        }
        return def.name();
    }

    @Override
    public List<DxfEntity> subEntities() {
        List<DxfEntity> result = new ArrayList<>(vertices);
        if (seqend != null) {
            result.add(seqend);
        }
        return result;
    }

    @Override
    public void unlink(DxfEntity child) {
        vertices.remove(child);
        if (child == seqend) {
            seqend = null;
        }
    }

    @Override
    public void exportDxf(DxfTagWriter w) {
        super.exportDxf(w);
        vertices.forEach(v -> v.exportDxf(w));
        if (seqend != null) {
            seqend.exportDxf(w);
        }
    }
}
