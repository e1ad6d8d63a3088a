package org.example.dxf.entity;

import org.example.dxf.schema.EntitySchema;

import java.util.ArrayList;
import java.util.List;

/**
 * BLOCK_RECORD：一个块定义（或布局）的所有者。持有 BLOCK、ENDBLK 与块内实体。
 * <p>
 * R12 没有块记录，读入时按块名补建，写出 R12 时不输出。
 */
public class BlockRecord extends DxfEntity implements EntityContainer {

    public static final String MODEL_SPACE = "*Model_Space";
    public static final String PAPER_SPACE = "*Paper_Space";

    private DxfEntity block;
    private DxfEntity endblk;
    private final List<DxfEntity> entities = new ArrayList<>();

    public BlockRecord(EntitySchema schema) {
        super(schema);
    }

    public String name() {
        return getString("name");
    }

    public boolean isModelSpace() {
        return MODEL_SPACE.equalsIgnoreCase(name());
    }

    /**
     * @return 是否为图纸空间布局（{@code *Paper_Space}、{@code *Paper_Space0} ...）
     */
    public boolean isPaperSpace() {
        return name().regionMatches(true, 0, PAPER_SPACE, 0, PAPER_SPACE.length());
    }

    public boolean isLayout() {
        return isModelSpace() || isPaperSpace();
    }

    /**
     * @return 是否为匿名块（名称以 {@code *} 开头且不是布局）
     */
    public boolean isAnonymous() {
        return name().startsWith("*") && !isLayout();
    }

    /**
     * @return 关联的 LAYOUT 对象句柄（R2000 起）
     */
    public String layoutHandle() {
        return getString("layout");
    }

    public void linkLayout(String layoutHandle) {
        store("layout", layoutHandle);
    }

    public DxfEntity block() {
        return block;
    }

    public void setBlock(DxfEntity block) {
        this.block = block;
    }

    public DxfEntity endblk() {
        return endblk;
    }

    public void setEndblk(DxfEntity endblk) {
        this.endblk = endblk;
    }

    /**
     * @return 块内实体（按写出顺序）
     */
    public List<DxfEntity> entities() {
        return entities;
    }

    @Override
    public void unlink(DxfEntity child) {
        entities.remove(child);
    }

    @Override
    public List<DxfEntity> subEntities() {
        List<DxfEntity> result = new ArrayList<>();
        if (block != null) {
            result.add(block);
        }
        result.addAll(entities);
        if (endblk != null) {
            result.add(endblk);
        }
        return result;
    }
}
