package org.example.dxf.entity;

import org.example.dxf.DxfVersion;
import org.example.dxf.schema.DxfAttr;
import org.example.dxf.schema.EntitySchema;

/**
 * 块定义的起始实体 BLOCK。组码 3 总是与块名相同。
 * <p>
 * R12 中模型空间/图纸空间的块名写作 {@code $MODEL_SPACE}/{@code $PAPER_SPACE}。
 */
public class Block extends DxfEntity {

    private static final String R12_MODEL_SPACE = "$MODEL_SPACE";
    private static final String R12_PAPER_SPACE = "$PAPER_SPACE";

    public Block(EntitySchema schema) {
        super(schema);
    }

    public String name() {
        return getString("name");
    }

    @Override
    protected Object computedValue(String name) {
        return "name2".equals(name) ? getString("name") : null;
    }

    @Override
    protected Object valueForExport(DxfAttr attr, DxfVersion version) {
        Object value = super.valueForExport(attr, version);
        if (version == DxfVersion.R12 && ("name".equals(attr.name()) || "name2".equals(attr.name()))
                && value instanceof String s) {
            return toR12Name(s);
        }
        return value;
    }

    static String toR12Name(String name) {
        if (BlockRecord.MODEL_SPACE.equalsIgnoreCase(name)) {
            return R12_MODEL_SPACE;
        }
        if (BlockRecord.PAPER_SPACE.equalsIgnoreCase(name)) {
            return R12_PAPER_SPACE;
        }
        return name;
    }

    /**
     * 把 R12 的布局块名换成 R2000 起的写法，其他名称原样返回。
     */
    public static String normalizeName(String name) {
        if (R12_MODEL_SPACE.equalsIgnoreCase(name) || BlockRecord.MODEL_SPACE.equalsIgnoreCase(name)) {
            return BlockRecord.MODEL_SPACE;
        }
        if (R12_PAPER_SPACE.equalsIgnoreCase(name) || BlockRecord.PAPER_SPACE.equalsIgnoreCase(name)) {
            return BlockRecord.PAPER_SPACE;
        }
        return name;
    }
}
