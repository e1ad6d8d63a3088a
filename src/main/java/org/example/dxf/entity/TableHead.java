package org.example.dxf.entity;

import org.example.dxf.schema.EntitySchema;
import org.example.dxf.tag.DxfTag;
import org.example.dxf.tag.DxfTagWriter;
import org.example.dxf.tag.GroupCodes;

import java.util.ArrayList;
import java.util.List;

/**
 * 符号表的表头实体（{@code 0 TABLE}）。表名（2）紧跟在类型之后，记录数（70）由记录列表计算。
 */
public class TableHead extends DxfEntity implements EntityContainer {

    private String tableName;
    private final List<DxfEntity> entries = new ArrayList<>();

    public TableHead(EntitySchema schema) {
        super(schema);
    }

    public String tableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public List<DxfEntity> entries() {
        return entries;
    }

    @Override
    public void unlink(DxfEntity child) {
        entries.remove(child);
    }

    @Override
    protected Object computedValue(String name) {
        return "count".equals(name) ? entries.size() : null;
    }

    @Override
    protected boolean loadBaseTag(DxfTag tag) {
        if (tag.code() == GroupCodes.NAME && tableName == null) {
            tableName = tag.stringValue();
            return true;
        }
        return false;
    }

    @Override
    protected void exportHead(DxfTagWriter w) {
        if (tableName != null) {
            w.write(GroupCodes.NAME, tableName);
        }
    }
}
