package org.example.dxf.section;

import org.example.dxf.entity.BlockRecord;
import org.example.dxf.entity.DxfEntity;
import org.example.dxf.tag.DxfTagWriter;
import org.example.dxf.tag.GroupCodes;

import java.util.List;
import java.util.Optional;

/**
 * BLOCKS 段：BLOCK_RECORD 表中每条记录对应的 BLOCK ... ENDBLK。
 * <p>
 * 块定义以块记录为唯一来源，本类只是按块记录表顺序的视图。
 * 模型空间与当前图纸空间的块在这里只写出 BLOCK/ENDBLK，其内容属于 ENTITIES 段。
 */
public class BlocksSection {

    private final TablesSection tables;

    public BlocksSection(TablesSection tables) {
        this.tables = tables;
    }

    public List<BlockRecord> blockRecords() {
        return tables.table("BLOCK_RECORD")
                .map(t -> t.entries().stream()
                        .filter(BlockRecord.class::isInstance)
                        .map(BlockRecord.class::cast)
                        .toList())
                .orElse(List.of());
    }

    /**
     * 按块名查找（不区分大小写）。
     */
    public Optional<BlockRecord> get(String name) {
        return blockRecords().stream().filter(br -> name.equalsIgnoreCase(br.name())).findFirst();
    }

    public boolean has(String name) {
        return get(name).isPresent();
    }

    /**
     * @return 普通块定义（不含布局）
     */
    public List<BlockRecord> blocks() {
        return blockRecords().stream().filter(br -> !br.isLayout()).toList();
    }

    public int size() {
        return blockRecords().size();
    }

    void export(DxfTagWriter w, EntityWriter entities) {
        w.write(GroupCodes.STRUCTURE, "SECTION");
        w.write(GroupCodes.NAME, "BLOCKS");
        for (BlockRecord br : blockRecords()) {
            if (br.block() == null) {
                continue;
            }
            entities.write(br.block());
            if (!isEntitiesSectionLayout(br)) {
                for (DxfEntity e : br.entities()) {
                    entities.write(e);
                }
            }
            if (br.endblk() != null) {
                entities.write(br.endblk());
            }
        }
        w.write(GroupCodes.STRUCTURE, "ENDSEC");
    }

    /**
     * 模型空间与当前图纸空间（{@code *Paper_Space}）的内容写在 ENTITIES 段。
     */
    static boolean isEntitiesSectionLayout(BlockRecord br) {
        return br.isModelSpace() || BlockRecord.PAPER_SPACE.equalsIgnoreCase(br.name());
    }
}
