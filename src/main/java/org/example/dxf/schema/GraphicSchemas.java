package org.example.dxf.schema;

import org.example.dxf.tag.DxfPoint;

import java.util.List;

import static org.example.dxf.DxfVersion.R2000;
import static org.example.dxf.DxfVersion.R2004;
import static org.example.dxf.DxfVersion.R2007;
import static org.example.dxf.DxfVersion.R2010;
import static org.example.dxf.schema.AttrType.DOUBLE;
import static org.example.dxf.schema.AttrType.HANDLE;
import static org.example.dxf.schema.AttrType.INT;
import static org.example.dxf.schema.AttrType.POINT3D;
import static org.example.dxf.schema.AttrType.STRING;
import static org.example.dxf.schema.DxfAttr.optional;
import static org.example.dxf.schema.DxfAttr.required;
import static org.example.dxf.schema.DxfAttr.slot;

/**
 * 图形实体的 schema。
 * <p>
 * 所有图形实体共享 {@code AcDbEntity} 子类（图层、线型、颜色等），之后是各自的子类。
 * 子类内属性的顺序即写出顺序。
 */
final class GraphicSchemas {

    private GraphicSchemas() {
    }

    static final SubclassDef ENTITY = SubclassDef.of("AcDbEntity",
            optional("paperspace", 67, INT, 0),
            required("layer", 8, STRING, "0"),
            optional("linetype", 6, STRING, "BYLAYER"),
            optional("material_handle", 347, HANDLE).since(R2007),
            optional("color", 62, INT, 256),
            optional("lineweight", 370, INT, -1).since(R2000),
            optional("ltscale", 48, DOUBLE, 1.0).since(R2000),
            optional("invisible", 60, INT, 0).since(R2000),
            optional("true_color", 420, INT).since(R2004),
            optional("color_name", 430, STRING).since(R2004),
            optional("transparency", 440, INT).since(R2004),
            optional("plotstyle_enum", 380, INT, 1).since(R2007),
            optional("plotstyle_handle", 390, HANDLE).since(R2007),
            optional("shadow_mode", 284, INT).since(R2007),
            optional("visualstyle_handle", 348, HANDLE).since(R2010)
    );

    private static final SubclassDef TEXT_BASE = SubclassDef.of("AcDbText",
            optional("thickness", 39, DOUBLE, 0.0),
            required("insert", 10, POINT3D, DxfPoint.ORIGIN),
            required("height", 40, DOUBLE, 2.5),
            required("text", 1, STRING, ""),
            optional("rotation", 50, DOUBLE, 0.0),
            optional("oblique", 51, DOUBLE, 0.0),
            optional("style", 7, STRING, "Standard"),
            optional("width", 41, DOUBLE, 1.0),
            optional("text_generation_flag", 71, INT, 0),
            optional("halign", 72, INT, 0),
            optional("align_point", 11, POINT3D),
            optional("extrusion", 210, POINT3D, DxfPoint.Z_AXIS)
    );

    private static final SubclassDef CIRCLE = SubclassDef.of("AcDbCircle",
            optional("thickness", 39, DOUBLE, 0.0),
            required("center", 10, POINT3D, DxfPoint.ORIGIN),
            required("radius", 40, DOUBLE, 1.0),
            optional("extrusion", 210, POINT3D, DxfPoint.Z_AXIS)
    );

    private static final SubclassDef FACE = SubclassDef.of("AcDbTrace",
            required("vtx0", 10, POINT3D, DxfPoint.ORIGIN),
            required("vtx1", 11, POINT3D, DxfPoint.ORIGIN),
            required("vtx2", 12, POINT3D, DxfPoint.ORIGIN),
            required("vtx3", 13, POINT3D, DxfPoint.ORIGIN),
            optional("thickness", 39, DOUBLE, 0.0),
            optional("extrusion", 210, POINT3D, DxfPoint.Z_AXIS)
    );

    static List<EntitySchema> all() {
        return List.of(
                EntitySchema.of("LINE", ENTITY, SubclassDef.of("AcDbLine",
                        optional("thickness", 39, DOUBLE, 0.0),
                        required("start", 10, POINT3D, DxfPoint.ORIGIN),
                        required("end", 11, POINT3D, DxfPoint.ORIGIN),
                        optional("extrusion", 210, POINT3D, DxfPoint.Z_AXIS))),

                EntitySchema.of("POINT", ENTITY, SubclassDef.of("AcDbPoint",
                        required("location", 10, POINT3D, DxfPoint.ORIGIN),
                        optional("thickness", 39, DOUBLE, 0.0),
                        optional("extrusion", 210, POINT3D, DxfPoint.Z_AXIS),
                        optional("angle", 50, DOUBLE, 0.0))),

                EntitySchema.of("CIRCLE", ENTITY, CIRCLE),

                EntitySchema.of("ARC", ENTITY, CIRCLE, SubclassDef.of("AcDbArc",
                        required("start_angle", 50, DOUBLE, 0.0),
                        required("end_angle", 51, DOUBLE, 360.0))),

                EntitySchema.of("ELLIPSE", ENTITY, SubclassDef.of("AcDbEllipse",
                        required("center", 10, POINT3D, DxfPoint.ORIGIN),
                        required("major_axis", 11, POINT3D, DxfPoint.of(1, 0, 0)),
                        optional("extrusion", 210, POINT3D, DxfPoint.Z_AXIS),
                        required("ratio", 40, DOUBLE, 1.0),
                        required("start_param", 41, DOUBLE, 0.0),
                        required("end_param", 42, DOUBLE, Math.PI * 2))).since(R2000),

                EntitySchema.of("RAY", ENTITY, SubclassDef.of("AcDbRay",
                        required("start", 10, POINT3D, DxfPoint.ORIGIN),
                        required("unit_vector", 11, POINT3D, DxfPoint.of(1, 0, 0)))).since(R2000),

                EntitySchema.of("XLINE", ENTITY, SubclassDef.of("AcDbXline",
                        required("start", 10, POINT3D, DxfPoint.ORIGIN),
                        required("unit_vector", 11, POINT3D, DxfPoint.of(1, 0, 0)))).since(R2000),

                EntitySchema.of("SOLID", ENTITY, FACE),
                EntitySchema.of("TRACE", ENTITY, FACE),
                EntitySchema.of("3DFACE", ENTITY, SubclassDef.of("AcDbFace",
                        required("vtx0", 10, POINT3D, DxfPoint.ORIGIN),
                        required("vtx1", 11, POINT3D, DxfPoint.ORIGIN),
                        required("vtx2", 12, POINT3D, DxfPoint.ORIGIN),
                        required("vtx3", 13, POINT3D, DxfPoint.ORIGIN),
                        optional("invisible_edge", 70, INT, 0))),

                EntitySchema.of("TEXT", ENTITY, TEXT_BASE, SubclassDef.of("AcDbText",
                        optional("valign", 73, INT, 0))),

                EntitySchema.of("ATTRIB", ENTITY, TEXT_BASE, SubclassDef.of("AcDbAttribute",
                        required("version", 280, INT, 0).since(R2010),
                        required("tag", 2, STRING, ""),
                        required("flags", 70, INT, 0),
                        optional("field_length", 73, INT, 0),
                        optional("valign", 74, INT, 0),
                        required("lock_position", 280, INT, 0).since(R2010))),

                EntitySchema.of("ATTDEF", ENTITY, TEXT_BASE, SubclassDef.of("AcDbAttributeDefinition",
                        required("version", 280, INT, 0).since(R2010),
                        required("prompt", 3, STRING, ""),
                        required("tag", 2, STRING, ""),
                        required("flags", 70, INT, 0),
                        optional("field_length", 73, INT, 0),
                        optional("valign", 74, INT, 0),
                        required("lock_position", 280, INT, 0).since(R2010))),

                EntitySchema.of("MTEXT", ENTITY, SubclassDef.of("AcDbMText",
                        required("insert", 10, POINT3D, DxfPoint.ORIGIN),
                        required("char_height", 40, DOUBLE, 2.5),
                        optional("width", 41, DOUBLE),
                        optional("defined_height", 46, DOUBLE, 0.0).since(R2007),
                        required("attachment_point", 71, INT, 1),
                        optional("flow_direction", 72, INT, 1),
                        slot("text"),
                        optional("style", 7, STRING, "Standard"),
                        optional("extrusion", 210, POINT3D, DxfPoint.Z_AXIS),
                        optional("text_direction", 11, POINT3D),
                        optional("rotation", 50, DOUBLE, 0.0),
                        optional("line_spacing_style", 73, INT, 1),
                        optional("line_spacing_factor", 44, DOUBLE, 1.0),
                        optional("bg_fill", 90, INT, 0),
                        optional("bg_fill_color", 63, INT),
                        optional("bg_fill_true_color", 421, INT),
                        optional("bg_fill_color_name", 431, STRING),
                        optional("box_fill_scale", 45, DOUBLE),
                        optional("bg_fill_transparency", 441, INT))).since(R2000),

                EntitySchema.of("INSERT", ENTITY, SubclassDef.of("AcDbBlockReference",
                        optional("attribs_follow", 66, INT, 0),
                        required("name", 2, STRING, ""),
                        required("insert", 10, POINT3D, DxfPoint.ORIGIN),
                        optional("xscale", 41, DOUBLE, 1.0),
                        optional("yscale", 42, DOUBLE, 1.0),
                        optional("zscale", 43, DOUBLE, 1.0),
                        optional("rotation", 50, DOUBLE, 0.0),
                        optional("column_count", 70, INT, 1),
                        optional("row_count", 71, INT, 1),
                        optional("column_spacing", 44, DOUBLE, 0.0),
                        optional("row_spacing", 45, DOUBLE, 0.0),
                        optional("extrusion", 210, POINT3D, DxfPoint.Z_AXIS)).withAliases("AcDbMInsertBlock")),

                EntitySchema.of("POLYLINE", ENTITY, SubclassDef.of("AcDb2dPolyline",
                        required("vertices_follow", 66, INT, 1),
                        required("elevation", 10, POINT3D, DxfPoint.ORIGIN),
                        optional("thickness", 39, DOUBLE, 0.0),
                        optional("flags", 70, INT, 0),
                        optional("default_start_width", 40, DOUBLE, 0.0),
                        optional("default_end_width", 41, DOUBLE, 0.0),
                        optional("m_count", 71, INT, 0),
                        optional("n_count", 72, INT, 0),
                        optional("m_smooth_density", 73, INT, 0),
                        optional("n_smooth_density", 74, INT, 0),
                        optional("smooth_type", 75, INT, 0),
                        optional("extrusion", 210, POINT3D, DxfPoint.Z_AXIS))
                        .withAliases("AcDb3dPolyline", "AcDbPolygonMesh", "AcDbPolyFaceMesh")),

                EntitySchema.of("VERTEX", ENTITY, SubclassDef.of("AcDbVertex"), SubclassDef.of("AcDb2dVertex",
                        required("location", 10, POINT3D, DxfPoint.ORIGIN),
                        optional("start_width", 40, DOUBLE, 0.0),
                        optional("end_width", 41, DOUBLE, 0.0),
                        optional("bulge", 42, DOUBLE, 0.0),
                        optional("flags", 70, INT, 0),
                        optional("tangent", 50, DOUBLE),
                        optional("vtx0", 71, INT),
                        optional("vtx1", 72, INT),
                        optional("vtx2", 73, INT),
                        optional("vtx3", 74, INT),
                        optional("vertex_identifier", 91, INT).since(R2010))
                        .withAliases("AcDb3dPolylineVertex", "AcDbPolygonMeshVertex", "AcDbPolyFaceMeshVertex",
                                "AcDbFaceRecord")),

                EntitySchema.of("SEQEND", ENTITY),

                EntitySchema.of("LWPOLYLINE", ENTITY, SubclassDef.of("AcDbPolyline",
                        required("count", 90, INT, 0),
                        optional("flags", 70, INT, 0),
                        optional("const_width", 43, DOUBLE, 0.0),
                        optional("elevation", 38, DOUBLE, 0.0),
                        optional("thickness", 39, DOUBLE, 0.0),
                        slot("points"),
                        optional("extrusion", 210, POINT3D, DxfPoint.Z_AXIS))).since(R2000),

                EntitySchema.of("SPLINE", ENTITY, SubclassDef.of("AcDbSpline",
                        optional("extrusion", 210, POINT3D),
                        required("flags", 70, INT, 0),
                        required("degree", 71, INT, 3),
                        required("n_knots", 72, INT, 0),
                        required("n_control_points", 73, INT, 0),
                        required("n_fit_points", 74, INT, 0),
                        optional("knot_tolerance", 42, DOUBLE, 1e-10),
                        optional("control_point_tolerance", 43, DOUBLE, 1e-10),
                        optional("fit_tolerance", 44, DOUBLE, 1e-10),
                        optional("start_tangent", 12, POINT3D),
                        optional("end_tangent", 13, POINT3D),
                        slot("spline_data"))).since(R2000),

                EntitySchema.of("MESH", ENTITY, SubclassDef.of("AcDbSubDMesh",
                        required("version", 71, INT, 2),
                        required("blend_crease", 72, INT, 0),
                        required("subdivision_levels", 91, INT, 0),
                        slot("mesh_data"))).since(R2010),

                EntitySchema.of("HATCH", ENTITY, SubclassDef.of("AcDbHatch",
                        required("elevation", 10, POINT3D, DxfPoint.ORIGIN),
                        required("extrusion", 210, POINT3D, DxfPoint.Z_AXIS),
                        required("pattern_name", 2, STRING, "SOLID"),
                        required("solid_fill", 70, INT, 1),
                        required("associative", 71, INT, 0),
                        slot("paths"),
                        required("hatch_style", 75, INT, 1),
                        required("pattern_type", 76, INT, 1),
                        required("pattern_angle", 52, DOUBLE, 0.0),
                        required("pattern_scale", 41, DOUBLE, 1.0),
                        required("pattern_double", 77, INT, 0),
                        slot("pattern"),
                        optional("pixel_size", 47, DOUBLE),
                        slot("seeds"))).since(R2000),

                EntitySchema.of("DIMENSION", ENTITY, SubclassDef.of("AcDbDimension",
                        optional("version", 280, INT, 0).since(R2010),
                        required("geometry", 2, STRING, ""),
                        required("defpoint", 10, POINT3D, DxfPoint.ORIGIN),
                        optional("text_midpoint", 11, POINT3D),
                        optional("insert", 12, POINT3D),
                        required("dimtype", 70, INT, 0),
                        optional("attachment_point", 71, INT, 5).since(R2000),
                        optional("line_spacing_style", 72, INT, 1).since(R2000),
                        optional("line_spacing_factor", 41, DOUBLE, 1.0).since(R2000),
                        optional("actual_measurement", 42, DOUBLE).since(R2000),
                        optional("text", 1, STRING, ""),
                        optional("oblique_angle", 52, DOUBLE, 0.0),
                        optional("text_rotation", 53, DOUBLE, 0.0),
                        optional("horizontal_direction", 51, DOUBLE, 0.0),
                        optional("extrusion", 210, POINT3D, DxfPoint.Z_AXIS),
                        required("dimstyle", 3, STRING, "Standard"))),

                EntitySchema.of("BLOCK", ENTITY, SubclassDef.of("AcDbBlockBegin",
                        required("name", 2, STRING, ""),
                        required("flags", 70, INT, 0),
                        required("base_point", 10, POINT3D, DxfPoint.ORIGIN),
                        required("name2", 3, STRING, ""),
                        required("xref_path", 1, STRING, ""),
                        optional("description", 4, STRING, ""))),

                EntitySchema.of("ENDBLK", ENTITY, SubclassDef.of("AcDbBlockEnd"))
        );
    }
}
