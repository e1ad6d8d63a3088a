package org.example.dxf.entity;

import org.example.dxf.schema.EntitySchema;
import org.example.dxf.tag.DxfTagWriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 块引用 INSERT；带属性时后随 ATTRIB 实体与 SEQEND。
 */
public class Insert extends DxfEntity implements EntityContainer {

    private final List<DxfEntity> attribs = new ArrayList<>();
    private DxfEntity seqend;

    public Insert(EntitySchema schema) {
        super(schema);
    }

    public String blockName() {
        return getString("name");
    }

    public List<DxfEntity> attribs() {
        return attribs;
    }

    /**
     * @return 指定标签（不区分大小写）的 ATTRIB
     */
    public Optional<DxfEntity> attrib(String tag) {
        return attribs.stream().filter(a -> tag.equalsIgnoreCase(a.getString("tag"))).findFirst();
    }

    public DxfEntity seqend() {
        return seqend;
    }

    public void setSeqend(DxfEntity seqend) {
        this.seqend = seqend;
    }

    @Override
    protected Object computedValue(String name) {
        return "attribs_follow".equals(name) ? (attribs.isEmpty() ? 0 : 1) : null;
    }

    @Override
    public List<DxfEntity> subEntities() {
        List<DxfEntity> result = new ArrayList<>(attribs);
        if (seqend != null) {
            result.add(seqend);
        }
        return result;
    }

    @Override
    public void unlink(DxfEntity child) {
        attribs.remove(child);
        if (child == seqend) {
            seqend = null;
        }
    }

    @Override
    public void exportDxf(DxfTagWriter w) {
        super.exportDxf(w);
        if (!attribs.isEmpty()) {
            attribs.forEach(a -> a.exportDxf(w));
            if (seqend != null) {
                seqend.exportDxf(w);
            }
        }
    }
}
