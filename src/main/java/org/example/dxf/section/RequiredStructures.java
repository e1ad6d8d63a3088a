package org.example.dxf.section;

import org.example.dxf.DxfDocument;
import org.example.dxf.entity.BlockRecord;
import org.example.dxf.entity.DictionaryObject;
import org.example.dxf.entity.DxfEntity;
import org.example.dxf.entity.EntityFactory;
import org.example.dxf.entity.TableHead;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 补全文档必需的结构：九个符号表、默认表记录、模型/图纸空间块、根字典与布局。
 * <p>
 * 新建文档时创建全部结构；读入的文档只补全缺失的部分（已有内容不修改）。
 */
public final class RequiredStructures {

    private static final Logger log = LoggerFactory.getLogger(RequiredStructures.class);

    private static final String ROOT_OWNER = "0";

    private RequiredStructures() {
    }

    public static void ensure(DxfDocument doc) {
        ensureTables(doc);
        ensureTableEntry(doc, "VPORT", "*Active");
        ensureTableEntry(doc, "LTYPE", "ByBlock");
        ensureTableEntry(doc, "LTYPE", "ByLayer");
        DxfEntity continuous = ensureTableEntry(doc, "LTYPE", "Continuous");
        if (!continuous.hasAttr("description")) {
            continuous.set("description", "Solid line");
        }
        ensureTableEntry(doc, "LAYER", "0");
        ensureTableEntry(doc, "STYLE", "Standard");
        ensureTableEntry(doc, "APPID", "ACAD");
        ensureTableEntry(doc, "DIMSTYLE", "Standard");
        ensureBlockRecord(doc, BlockRecord.MODEL_SPACE);
        ensureBlockRecord(doc, BlockRecord.PAPER_SPACE);
        ensureObjects(doc);
    }

    public static void ensureTables(DxfDocument doc) {
        TablesSection tables = doc.tables();
        for (String name : TablesSection.TABLE_ORDER) {
            if (!tables.has(name)) {
                TableHead head = doc.entityFactory().create("TABLE", TableHead.class);
                head.setTableName(name);
                doc.register(head, ROOT_OWNER);
                tables.add(new DxfTable(head));
                log.debug("补建 {} 表", name);
            }
        }
    }

    /**
     * @return 已有的同名记录，或新建的记录
     */
    public static DxfEntity ensureTableEntry(DxfDocument doc, String tableName, String name) {
        DxfTable table = doc.tables().require(tableName);
        Optional<DxfEntity> existing = table.get(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        DxfEntity entry = doc.entityFactory().create(tableName);
        entry.set("name", name);
        doc.register(entry, table.head().handle());
        table.add(entry);
        return entry;
    }

    /**
     * @return 已有或新建的块记录；缺少 BLOCK/ENDBLK 时一并补建
     */
    public static BlockRecord ensureBlockRecord(DxfDocument doc, String name) {
        if (!doc.tables().has("BLOCK_RECORD")) {
            ensureTables(doc);
        }
        BlockRecord record = (BlockRecord) ensureTableEntry(doc, "BLOCK_RECORD", name);
        EntityFactory factory = doc.entityFactory();
        if (record.block() == null) {
            DxfEntity block = factory.create("BLOCK");
            block.set("name", name);
            if (record.isPaperSpace()) {
                block.set("paperspace", 1);
            }
            record.setBlock(block);
            doc.register(block, record.handle());
        }
        if (record.endblk() == null) {
            DxfEntity endblk = factory.create("ENDBLK");
            if (record.isPaperSpace()) {
                endblk.set("paperspace", 1);
            }
            record.setEndblk(endblk);
            doc.register(endblk, record.handle());
        }
        return record;
    }

    /**
     * 根字典（ACAD_GROUP、ACAD_LAYOUT、ACAD_PLOTSTYLENAME）与模型/图纸空间的 LAYOUT。
     */
    public static void ensureObjects(DxfDocument doc) {
        ObjectsSection objects = doc.objects();
        DictionaryObject root = objects.rootDictionary().orElse(null);
        if (root == null) {
            root = doc.entityFactory().create("DICTIONARY", DictionaryObject.class);
            doc.register(root, ROOT_OWNER);
            objects.insertFirst(root);
        }
        ensureDictionary(doc, root, "ACAD_GROUP", "DICTIONARY");
        DictionaryObject layouts = ensureDictionary(doc, root, "ACAD_LAYOUT", "DICTIONARY");
        DictionaryObject plotStyles = ensureDictionary(doc, root, "ACAD_PLOTSTYLENAME", "DICTIONARYWDFLT");
        if (!plotStyles.containsKey("Normal")) {
            DxfEntity placeholder = doc.entityFactory().create("ACDBPLACEHOLDER");
            doc.register(placeholder, plotStyles.handle());
            objects.add(placeholder);
            plotStyles.put("Normal", placeholder.handle());
            plotStyles.set("default", placeholder.handle());
        }
        ensureLayout(doc, layouts, doc.modelspace(), "Model", 0);
        ensureLayout(doc, layouts, doc.paperspace(), "Layout1", 1);
    }

    private static DictionaryObject ensureDictionary(DxfDocument doc, DictionaryObject parent, String key,
                                                     String dxftype) {
        Optional<DxfEntity> existing = parent.lookup(key).flatMap(doc.database()::resolve);
        if (existing.isPresent() && existing.get() instanceof DictionaryObject found) {
            return found;
        }
        DictionaryObject dict = doc.entityFactory().create(dxftype, DictionaryObject.class);
        doc.register(dict, parent.handle());
        doc.objects().add(dict);
        parent.put(key, dict.handle());
        return dict;
    }

    private static void ensureLayout(DxfDocument doc, DictionaryObject layouts, BlockRecord record, String name,
                                     int taborder) {
        if (doc.database().resolve(record.layoutHandle()).isPresent()) {
            return;
        }
        DxfEntity layout = doc.entityFactory().create("LAYOUT");
        layout.set("name", name);
        layout.set("taborder", taborder);
        layout.set("layout_flags", taborder == 0 ? 1 : 0);
        layout.set("block_record_handle", record.handle());
        doc.register(layout, layouts.handle());
        doc.objects().add(layout);
        if (!layouts.containsKey(name)) {
            layouts.put(name, layout.handle());
        }
        record.linkLayout(layout.handle());
    }
}
