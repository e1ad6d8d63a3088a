package org.example.dxf.schema;

import org.example.dxf.tag.DxfPoint;

import java.util.List;

import static org.example.dxf.DxfVersion.R2000;
import static org.example.dxf.DxfVersion.R2004;
import static org.example.dxf.schema.AttrType.DOUBLE;
import static org.example.dxf.schema.AttrType.HANDLE;
import static org.example.dxf.schema.AttrType.INT;
import static org.example.dxf.schema.AttrType.POINT2D;
import static org.example.dxf.schema.AttrType.POINT3D;
import static org.example.dxf.schema.AttrType.STRING;
import static org.example.dxf.schema.DxfAttr.optional;
import static org.example.dxf.schema.DxfAttr.required;
import static org.example.dxf.schema.DxfAttr.slot;

/**
 * OBJECTS 段中非图形对象的 schema（均从 R2000 起存在）。
 */
final class ObjectSchemas {

    private ObjectSchemas() {
    }

    private static final EntitySchema DICTIONARY = EntitySchema.of("DICTIONARY",
            SubclassDef.of("AcDbDictionary",
                    optional("hard_owned", 280, INT, 0),
                    required("merge_option", 281, INT, 1),
                    slot("entries"))).since(R2000);

    static List<EntitySchema> all() {
        return List.of(
                DICTIONARY,
                DICTIONARY.derive("DICTIONARYWDFLT", SubclassDef.of("AcDbDictionaryWithDefault",
                        required("default", 340, HANDLE, "0"))),

                // 数据 tag 全部作为未建模 tag 原样保留
                EntitySchema.of("XRECORD", SubclassDef.of("AcDbXrecord",
                        required("cloning", 280, INT, 1))).since(R2000),

                EntitySchema.of("ACDBPLACEHOLDER").since(R2000),

                EntitySchema.of("DICTIONARYVAR", SubclassDef.of("DictionaryVariables",
                        required("schema", 280, INT, 0),
                        required("value", 1, STRING, ""))).since(R2000),

                // 成员句柄（340）作为未建模 tag 保留，仍参与硬引用检查
                EntitySchema.of("GROUP", SubclassDef.of("AcDbGroup",
                        required("description", 300, STRING, ""),
                        required("unnamed", 70, INT, 1),
                        required("selectable", 71, INT, 1))).since(R2000),

                // 组码 1、70、76 在两个子类中含义不同
                EntitySchema.of("LAYOUT",
                        SubclassDef.of("AcDbPlotSettings",
                                required("page_setup_name", 1, STRING, ""),
                                required("plot_configuration_file", 2, STRING, "Adobe PDF"),
                                required("paper_size", 4, STRING, "A3"),
                                required("plot_view_name", 6, STRING, ""),
                                required("left_margin", 40, DOUBLE, 7.5),
                                required("bottom_margin", 41, DOUBLE, 20.0),
                                required("right_margin", 42, DOUBLE, 7.5),
                                required("top_margin", 43, DOUBLE, 20.0),
                                required("paper_width", 44, DOUBLE, 420.0),
                                required("paper_height", 45, DOUBLE, 297.0),
                                required("plot_origin_x_offset", 46, DOUBLE, 0.0),
                                required("plot_origin_y_offset", 47, DOUBLE, 0.0),
                                required("plot_window_x1", 48, DOUBLE, 0.0),
                                required("plot_window_y1", 49, DOUBLE, 0.0),
                                required("plot_window_x2", 140, DOUBLE, 0.0),
                                required("plot_window_y2", 141, DOUBLE, 0.0),
                                required("scale_numerator", 142, DOUBLE, 1.0),
                                required("scale_denominator", 143, DOUBLE, 1.0),
                                required("plot_layout_flags", 70, INT, 688),
                                required("plot_paper_units", 72, INT, 1),
                                required("plot_rotation", 73, INT, 0),
                                required("plot_type", 74, INT, 5),
                                required("current_style_sheet", 7, STRING, ""),
                                required("standard_scale_type", 75, INT, 16),
                                optional("shade_plot_mode", 76, INT, 0).since(R2004),
                                optional("shade_plot_resolution_level", 77, INT, 2).since(R2004),
                                optional("shade_plot_custom_dpi", 78, INT, 300).since(R2004),
                                required("unit_factor", 147, DOUBLE, 1.0),
                                required("paper_image_origin_x", 148, DOUBLE, 0.0),
                                required("paper_image_origin_y", 149, DOUBLE, 0.0),
                                optional("shade_plot_handle", 333, HANDLE).since(R2004)),
                        SubclassDef.of("AcDbLayout",
                                required("name", 1, STRING, "Layout1"),
                                required("layout_flags", 70, INT, 1),
                                required("taborder", 71, INT, 1),
                                required("limmin", 10, POINT2D, DxfPoint.ORIGIN),
                                required("limmax", 11, POINT2D, DxfPoint.of(420, 297)),
                                required("insert_base", 12, POINT3D, DxfPoint.ORIGIN),
                                required("extmin", 14, POINT3D, DxfPoint.of(1e20, 1e20, 1e20)),
                                required("extmax", 15, POINT3D, DxfPoint.of(-1e20, -1e20, -1e20)),
                                required("elevation", 146, DOUBLE, 0.0),
                                required("ucs_origin", 13, POINT3D, DxfPoint.ORIGIN),
                                required("ucs_xaxis", 16, POINT3D, DxfPoint.of(1, 0, 0)),
                                required("ucs_yaxis", 17, POINT3D, DxfPoint.of(0, 1, 0)),
                                required("ucs_type", 76, INT, 1),
                                required("block_record_handle", 330, HANDLE, "0"),
                                optional("viewport_handle", 331, HANDLE),
                                optional("ucs_handle", 345, HANDLE),
                                optional("base_ucs_handle", 346, HANDLE))).since(R2000)
        );
    }
}
