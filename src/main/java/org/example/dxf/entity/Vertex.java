package org.example.dxf.entity;

import org.example.dxf.schema.EntitySchema;
import org.example.dxf.schema.SubclassDef;

/**
 * POLYLINE 的顶点。第二个子类标记按标志位选择。
 */
public class Vertex extends DxfEntity {

    public static final int POLYLINE_3D_VERTEX = 32;
    public static final int POLYGON_MESH_VERTEX = 64;
    public static final int POLYFACE_MESH_VERTEX = 128;

    public Vertex(EntitySchema schema) {
        super(schema);
    }

    @Override
    protected String defaultMarker(int index, SubclassDef def) {
        if (!"AcDb2dVertex".equals(def.name())) {
            return def.name();
        }
        int flags = getInt("flags");
        boolean mesh = (flags & POLYGON_MESH_VERTEX) != 0;
        if ((flags & POLYFACE_MESH_VERTEX) != 0) {
            return mesh ? "AcDbPolyFaceMeshVertex" : "AcDbFaceRecord";
        }
        if (mesh) {
            return "AcDbPolygonMeshVertex";
        }
        if ((flags & POLYLINE_3D_VERTEX) != 0) {
            return "AcDb3dPolylineVertex";
        }
        return def.name();
    }
}
