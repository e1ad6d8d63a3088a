package org.example.dxf.schema;

import org.example.dxf.tag.DxfPoint;
import org.example.dxf.tag.GroupCodes;

import java.util.List;

import static org.example.dxf.DxfVersion.R2000;
import static org.example.dxf.DxfVersion.R2004;
import static org.example.dxf.DxfVersion.R2007;
import static org.example.dxf.schema.AttrType.DOUBLE;
import static org.example.dxf.schema.AttrType.HANDLE;
import static org.example.dxf.schema.AttrType.INT;
import static org.example.dxf.schema.AttrType.POINT2D;
import static org.example.dxf.schema.AttrType.POINT3D;
import static org.example.dxf.schema.AttrType.STRING;
import static org.example.dxf.schema.DxfAttr.optional;
import static org.example.dxf.schema.DxfAttr.required;

/**
 * 符号表（TABLE 头与九种表记录）的 schema。
 */
final class TableSchemas {

    private TableSchemas() {
    }

    private static final SubclassDef RECORD = SubclassDef.of("AcDbSymbolTableRecord");

    static List<EntitySchema> all() {
        return List.of(
                EntitySchema.of("TABLE", SubclassDef.of("AcDbSymbolTable",
                        required("count", 70, INT, 0))),

                EntitySchema.of("LAYER", RECORD, SubclassDef.of("AcDbLayerTableRecord",
                        required("name", 2, STRING, ""),
                        required("flags", 70, INT, 0),
                        required("color", 62, INT, 7),
                        optional("true_color", 420, INT).since(R2004),
                        required("linetype", 6, STRING, "Continuous"),
                        optional("plot", 290, INT, 1).since(R2000),
                        required("lineweight", 370, INT, -3).since(R2000),
                        optional("plotstyle_handle", 390, HANDLE).since(R2000),
                        optional("material_handle", 347, HANDLE).since(R2007),
                        optional("unknown1", 348, HANDLE).since(R2007))),

                // 线型图案（49/74/75/340/46/50/44/45/9）作为未建模 tag 原样保留
                EntitySchema.of("LTYPE", RECORD, SubclassDef.of("AcDbLinetypeTableRecord",
                        required("name", 2, STRING, ""),
                        required("flags", 70, INT, 0),
                        required("description", 3, STRING, ""),
                        required("alignment", 72, INT, 65),
                        required("items", 73, INT, 0),
                        required("total_pattern_length", 40, DOUBLE, 0.0))),

                EntitySchema.of("STYLE", RECORD, SubclassDef.of("AcDbTextStyleTableRecord",
                        required("name", 2, STRING, ""),
                        required("flags", 70, INT, 0),
                        required("height", 40, DOUBLE, 0.0),
                        required("width", 41, DOUBLE, 1.0),
                        required("oblique", 50, DOUBLE, 0.0),
                        required("generation_flags", 71, INT, 0),
                        required("last_height", 42, DOUBLE, 2.5),
                        required("font", 3, STRING, "txt"),
                        required("bigfont", 4, STRING, ""))),

                EntitySchema.of("VIEW", RECORD, SubclassDef.of("AcDbViewTableRecord",
                        required("name", 2, STRING, ""),
                        required("flags", 70, INT, 0),
                        required("height", 40, DOUBLE, 1.0),
                        required("center", 10, POINT2D, DxfPoint.ORIGIN),
                        required("width", 41, DOUBLE, 1.0),
                        required("direction", 11, POINT3D, DxfPoint.Z_AXIS),
                        required("target", 12, POINT3D, DxfPoint.ORIGIN),
                        required("focal_length", 42, DOUBLE, 50.0),
                        required("front_clipping", 43, DOUBLE, 0.0),
                        required("back_clipping", 44, DOUBLE, 0.0),
                        required("view_twist", 50, DOUBLE, 0.0),
                        required("view_mode", 71, INT, 0),
                        optional("render_mode", 281, INT, 0).since(R2000),
                        optional("ucs", 72, INT, 0).since(R2000),
                        optional("ucs_origin", 110, POINT3D).since(R2000),
                        optional("ucs_xaxis", 111, POINT3D).since(R2000),
                        optional("ucs_yaxis", 112, POINT3D).since(R2000),
                        optional("ucs_ortho_type", 79, INT).since(R2000),
                        optional("elevation", 146, DOUBLE).since(R2000),
                        optional("ucs_handle", 345, HANDLE).since(R2000),
                        optional("base_ucs_handle", 346, HANDLE).since(R2000))),

                EntitySchema.of("UCS", RECORD, SubclassDef.of("AcDbUCSTableRecord",
                        required("name", 2, STRING, ""),
                        required("flags", 70, INT, 0),
                        required("origin", 10, POINT3D, DxfPoint.ORIGIN),
                        required("xaxis", 11, POINT3D, DxfPoint.of(1, 0, 0)),
                        required("yaxis", 12, POINT3D, DxfPoint.of(0, 1, 0)))),

                EntitySchema.of("APPID", RECORD, SubclassDef.of("AcDbRegAppTableRecord",
                        required("name", 2, STRING, ""),
                        required("flags", 70, INT, 0))),

                EntitySchema.of("DIMSTYLE", RECORD, SubclassDef.of("AcDbDimStyleTableRecord",
                        required("name", 2, STRING, ""),
                        required("flags", 70, INT, 0),
                        optional("dimpost", 3, STRING, ""),
                        optional("dimapost", 4, STRING, ""),
                        optional("dimscale", 40, DOUBLE, 1.0),
                        optional("dimasz", 41, DOUBLE, 2.5),
                        optional("dimexo", 42, DOUBLE, 0.625),
                        optional("dimdli", 43, DOUBLE, 3.75),
                        optional("dimexe", 44, DOUBLE, 1.25),
                        optional("dimrnd", 45, DOUBLE, 0.0),
                        optional("dimdle", 46, DOUBLE, 0.0),
                        optional("dimtp", 47, DOUBLE, 0.0),
                        optional("dimtm", 48, DOUBLE, 0.0),
                        optional("dimtxt", 140, DOUBLE, 2.5),
                        optional("dimcen", 141, DOUBLE, 2.5),
                        optional("dimtsz", 142, DOUBLE, 0.0),
                        optional("dimaltf", 143, DOUBLE, 25.4),
                        optional("dimlfac", 144, DOUBLE, 1.0),
                        optional("dimtvp", 145, DOUBLE, 0.0),
                        optional("dimtfac", 146, DOUBLE, 1.0),
                        optional("dimgap", 147, DOUBLE, 0.625),
                        optional("dimtol", 71, INT, 0),
                        optional("dimlim", 72, INT, 0),
                        optional("dimtih", 73, INT, 0),
                        optional("dimtoh", 74, INT, 0),
                        optional("dimse1", 75, INT, 0),
                        optional("dimse2", 76, INT, 0),
                        optional("dimtad", 77, INT, 1),
                        optional("dimzin", 78, INT, 8),
                        optional("dimalt", 170, INT, 0),
                        optional("dimaltd", 171, INT, 3),
                        optional("dimtofl", 172, INT, 1),
                        optional("dimclrd", 176, INT, 0),
                        optional("dimclre", 177, INT, 0),
                        optional("dimclrt", 178, INT, 0),
                        optional("dimtxsty", 340, HANDLE).since(R2000),
                        optional("dimldrblk", 341, HANDLE).since(R2000)))
                        .withHandleCode(GroupCodes.DIMSTYLE_HANDLE),

                EntitySchema.of("VPORT", RECORD, SubclassDef.of("AcDbViewportTableRecord",
                        required("name", 2, STRING, ""),
                        required("flags", 70, INT, 0),
                        required("lower_left", 10, POINT2D, DxfPoint.ORIGIN),
                        required("upper_right", 11, POINT2D, DxfPoint.of(1, 1)),
                        required("center", 12, POINT2D, DxfPoint.ORIGIN),
                        required("snap_base", 13, POINT2D, DxfPoint.ORIGIN),
                        required("snap_spacing", 14, POINT2D, DxfPoint.of(10, 10)),
                        required("grid_spacing", 15, POINT2D, DxfPoint.of(10, 10)),
                        required("direction", 16, POINT3D, DxfPoint.Z_AXIS),
                        required("target", 17, POINT3D, DxfPoint.ORIGIN),
                        required("height", 40, DOUBLE, 1000.0),
                        required("aspect_ratio", 41, DOUBLE, 1.34),
                        required("focal_length", 42, DOUBLE, 50.0),
                        required("front_clipping", 43, DOUBLE, 0.0),
                        required("back_clipping", 44, DOUBLE, 0.0),
                        required("snap_rotation", 50, DOUBLE, 0.0),
                        required("view_twist", 51, DOUBLE, 0.0),
                        required("view_mode", 71, INT, 0),
                        required("circle_zoom", 72, INT, 1000),
                        required("fast_zoom", 73, INT, 1),
                        required("ucs_icon", 74, INT, 3),
                        required("snap_on", 75, INT, 0),
                        required("grid_on", 76, INT, 0),
                        required("snap_style", 77, INT, 0),
                        required("snap_isopair", 78, INT, 0))),

                EntitySchema.of("BLOCK_RECORD", RECORD, SubclassDef.of("AcDbBlockTableRecord",
                        required("name", 2, STRING, ""),
                        optional("layout", 340, HANDLE).since(R2000),
                        optional("units", 70, INT, 0).since(R2007),
                        optional("explode", 280, INT, 1).since(R2007),
                        optional("scale", 281, INT, 0).since(R2007))).since(R2000)
        );
    }
}
