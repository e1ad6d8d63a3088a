package org.example.dxf.section;

import org.example.dxf.DuplicateNamePolicy;
import org.example.dxf.DxfDocument;
import org.example.dxf.DxfOptions;
import org.example.dxf.DxfStructureException;
import org.example.dxf.DxfVersion;
import org.example.dxf.db.EntityDatabase;
import org.example.dxf.db.HandleGenerator;
import org.example.dxf.entity.Block;
import org.example.dxf.entity.BlockRecord;
import org.example.dxf.entity.DxfEntity;
import org.example.dxf.entity.EntityFactory;
import org.example.dxf.entity.Insert;
import org.example.dxf.entity.Polyline;
import org.example.dxf.entity.TableHead;
import org.example.dxf.structure.RawSection;
import org.example.dxf.structure.TagGroup;
import org.example.dxf.tag.DxfTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 把切分好的段组装为 {@link DxfDocument}。
 * <p>
 * 两遍处理：
 * <ol>
 *   <li>构建全部实体（表、块、ENTITIES、OBJECTS），按策略合并重名表记录与块，然后注册句柄
 *       （先注册文件中带句柄的实体，再给其余实体分配新句柄）</li>
 *   <li>解析所有者关系：表记录挂到表头，块内容挂到块记录，ENTITIES 中的实体挂到模型/图纸空间，
 *       最后补全缺失的必需结构</li>
 * </ol>
 * 所有者句柄存在但不指向 BLOCK_RECORD 的图形实体是结构错误，整个加载失败；
 * ENTITIES 段中的实体还必须属于模型空间或图纸空间。
 * <p>
 * 重名的块记录与重名的块定义按同一个策略（{@link DxfOptions#duplicateBlockPolicy()}）取舍，
 * 指向被丢弃块记录的所有者句柄改为指向保留的块记录。
 */
public class DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);

    private final DxfOptions options;
    private final EntityFactory factory;

    public DocumentLoader(DxfOptions options) {
        this.options = options;
        this.factory = new EntityFactory(options);
    }

    /**
     * 一个 BLOCK ... ENDBLK 区间。
     */
    private static final class BlockDefinition {
        private final Block block;
        private final List<TagGroup> content = new ArrayList<>();
        private List<DxfEntity> entities = List.of();
        private DxfEntity endblk;

        private BlockDefinition(Block block) {
            this.block = block;
        }
    }

    /**
     * @param codepage 编码探测得到的代码页（可以为 {@code null}）
     */
    public DxfDocument load(List<RawSection> sections, String codepage) {
        HeaderSection header = sections.stream()
                .filter(s -> "HEADER".equalsIgnoreCase(s.name()))
                .findFirst()
                .map(HeaderSection::load)
                .orElseGet(HeaderSection::new);
        DxfVersion version = header.getString("$ACADVER").map(DxfVersion::fromToken).orElse(DxfVersion.R12);
        boolean flatten = version == DxfVersion.R12;
        List<String> warnings = new ArrayList<>();

        ClassesSection classes = new ClassesSection();
        TablesSection tables = new TablesSection();
        ObjectsSection objects = new ObjectsSection();
        List<StoredSection> stored = new ArrayList<>();
        List<BlockDefinition> blocks = new ArrayList<>();
        List<DxfEntity> entities = new ArrayList<>();
        Map<String, String> droppedRecords = new HashMap<>();

        // 第一遍：构建实体
        for (RawSection section : sections) {
            String name = section.name().toUpperCase(Locale.ROOT);
            switch (name) {
                case "HEADER" -> {
                }
                case "CLASSES" -> classes = ClassesSection.load(section);
                case "TABLES" -> loadTables(section, tables, flatten, warnings, droppedRecords);
                case "BLOCKS" -> blocks.addAll(loadBlocks(section, flatten, warnings));
                case "ENTITIES" -> entities.addAll(assemble(classify(section.groups(), flatten), warnings));
                case "OBJECTS" -> classify(section.groups(), flatten).forEach(g -> objects.add(factory.load(g)));
                default -> {
                    log.debug("原样保留段 {}（{} 个 tag 组）", section.name(), section.groups().size());
                    stored.add(new StoredSection(section.name(), section.groups()));
                }
            }
        }
        blocks = mergeBlocks(blocks, warnings);

        // 注册句柄：先保留文件中的句柄，再为其余实体分配
        List<DxfEntity> all = new ArrayList<>();
        tables.tables().forEach(t -> {
            all.add(t.head());
            t.entries().forEach(e -> collect(e, all));
        });
        for (BlockDefinition def : blocks) {
            all.add(def.block);
            def.entities.forEach(e -> collect(e, all));
            all.add(def.endblk);
        }
        entities.forEach(e -> collect(e, all));
        objects.objects().forEach(all::add);

        EntityDatabase db = new EntityDatabase(handleSeed(header, warnings));
        for (DxfEntity e : all) {
            if (e.handle() != null) {
                db.register(e);
            }
        }
        for (DxfEntity e : all) {
            if (e.handle() == null) {
                db.register(e);
            }
        }

        DxfDocument doc = new DxfDocument(version, options, db, header, classes, tables, objects, stored);
        if (codepage != null) {
            doc.setCodepage(codepage);
        }
        all.forEach(e -> e.bind(doc));

        // 第二遍：所有者关系
        wireTables(tables);
        RequiredStructures.ensureTables(doc);
        for (BlockDefinition def : blocks) {
            wireBlock(doc, def, warnings, droppedRecords);
        }
        BlockRecord modelspace = RequiredStructures.ensureBlockRecord(doc, BlockRecord.MODEL_SPACE);
        BlockRecord paperspace = RequiredStructures.ensureBlockRecord(doc, BlockRecord.PAPER_SPACE);
        for (DxfEntity e : entities) {
            BlockRecord layout = resolveLayout(doc, e, modelspace, paperspace);
            layout.entities().add(e);
            wireChildren(db, e);
        }
        RequiredStructures.ensure(doc);

        warnings.forEach(doc::recordWarning);
        log.debug("加载 {} 文档：{} 个实体，{} 条警告", version, db.size(), warnings.size());
        return doc;
    }

    private static HandleGenerator handleSeed(HeaderSection header, List<String> warnings) {
        Optional<String> seed = header.getString("$HANDSEED");
        if (seed.isEmpty()) {
            return new HandleGenerator();
        }
        try {
            return HandleGenerator.fromSeed(seed.get());
        } catch (DxfStructureException e) {
            warn(warnings, "$HANDSEED 无效（" + seed.get() + "），句柄从 1 开始分配");
            return new HandleGenerator();
        }
    }

    private static void collect(DxfEntity entity, List<DxfEntity> into) {
        into.add(entity);
        entity.subEntities().forEach(sub -> collect(sub, into));
    }

    private static List<TagGroup> classify(List<List<DxfTag>> groups, boolean flatten) {
        List<TagGroup> result = new ArrayList<>(groups.size());
        for (List<DxfTag> tags : groups) {
            result.add(TagGroup.classify(tags, flatten));
        }
        return result;
    }

    // ---------------------------------------------------------------- TABLES

    private void loadTables(RawSection section, TablesSection tables, boolean flatten, List<String> warnings,
                            Map<String, String> droppedRecords) {
        DxfTable current = null;
        for (TagGroup group : classify(section.groups(), flatten)) {
            String type = group.dxftype();
            if ("TABLE".equals(type)) {
                TableHead head = (TableHead) factory.load(group);
                if (head.tableName() == null) {
                    throw new DxfStructureException("TABLE 缺少表名 (2, ...)", group.base().get(0).line());
                }
                Optional<DxfTable> existing = tables.table(head.tableName());
                if (existing.isPresent()) {
                    warn(warnings, "重复的 " + head.tableName() + " 表，记录合并到第一个表中");
                    current = existing.get();
                } else {
                    current = new DxfTable(head);
                    tables.add(current);
                }
            } else if ("ENDTAB".equals(type)) {
                current = null;
            } else {
                if (current == null) {
                    throw new DxfStructureException("表记录 " + type + " 出现在 TABLE 之外",
                            group.base().get(0).line());
                }
                addTableEntry(current, factory.load(group), warnings, droppedRecords);
            }
        }
    }

    /**
     * @param droppedRecords 被丢弃的块记录句柄 -> 保留的同名块记录句柄
     */
    private void addTableEntry(DxfTable table, DxfEntity entry, List<String> warnings,
                               Map<String, String> droppedRecords) {
        String name = entry.isSupported("name") ? entry.getString("name") : null;
        Optional<DxfEntity> existing = name == null ? Optional.empty() : table.get(name);
        if (existing.isEmpty()) {
            table.head().entries().add(entry);
            return;
        }
        boolean blockRecord = entry instanceof BlockRecord;
        DuplicateNamePolicy policy = blockRecord ? options.duplicateBlockPolicy() : options.duplicateTableEntryPolicy();
        DxfEntity kept;
        DxfEntity dropped;
        if (policy == DuplicateNamePolicy.LAST_WINS) {
            warn(warnings, table.name() + " 表记录重名：" + name + "，保留后出现的记录");
            table.replace(existing.get(), entry);
            kept = entry;
            dropped = existing.get();
        } else {
            warn(warnings, table.name() + " 表记录重名：" + name + "，保留先出现的记录");
            kept = existing.get();
            dropped = entry;
        }
        if (blockRecord && dropped.handle() != null && kept.handle() != null) {
            droppedRecords.put(key(dropped.handle()), kept.handle());
        }
    }

    private static void wireTables(TablesSection tables) {
        for (DxfTable table : tables.tables()) {
            TableHead head = table.head();
            if (head.owner() == null) {
                head.setOwner("0");
            }
            for (DxfEntity entry : table.entries()) {
                if (entry.owner() == null) {
                    entry.setOwner(head.handle());
                }
            }
        }
    }

    // ---------------------------------------------------------------- BLOCKS

    private List<BlockDefinition> loadBlocks(RawSection section, boolean flatten, List<String> warnings) {
        List<BlockDefinition> result = new ArrayList<>();
        BlockDefinition current = null;
        for (TagGroup group : classify(section.groups(), flatten)) {
            String type = group.dxftype();
            int line = group.base().get(0).line();
            if ("BLOCK".equals(type)) {
                if (current != null) {
                    throw new DxfStructureException("BLOCK " + current.block.name() + " 未以 ENDBLK 结束", line);
                }
                current = new BlockDefinition((Block) factory.load(group));
            } else if ("ENDBLK".equals(type)) {
                if (current == null) {
                    throw new DxfStructureException("ENDBLK 之前没有 BLOCK", line);
                }
                current.endblk = factory.load(group);
                current.entities = assemble(current.content, warnings);
                result.add(current);
                current = null;
            } else {
                if (current == null) {
                    throw new DxfStructureException("实体 " + type + " 出现在 BLOCK 之外", line);
                }
                current.content.add(group);
            }
        }
        if (current != null) {
            throw new DxfStructureException("BLOCK " + current.block.name() + " 缺少 ENDBLK", section.line());
        }
        return result;
    }

    /**
     * 按块名（不区分大小写，R12 的 {@code $MODEL_SPACE} 等视为布局名）合并重复的块定义。
     */
    private List<BlockDefinition> mergeBlocks(List<BlockDefinition> blocks, List<String> warnings) {
        List<BlockDefinition> result = new ArrayList<>();
        for (BlockDefinition def : blocks) {
            String name = Block.normalizeName(def.block.name());
            if (!name.equals(def.block.name())) {
                def.block.set("name", name);
            }
            int index = -1;
            for (int i = 0; i < result.size(); i++) {
                if (result.get(i).block.name().equalsIgnoreCase(name)) {
                    index = i;
                    break;
                }
            }
            if (index < 0) {
                result.add(def);
            } else if (options.duplicateBlockPolicy() == DuplicateNamePolicy.LAST_WINS) {
                warn(warnings, "块名重复：" + name + "，保留后出现的定义");
                result.set(index, def);
            } else {
                warn(warnings, "块名重复：" + name + "，保留先出现的定义");
            }
        }
        return result;
    }

    private void wireBlock(DxfDocument doc, BlockDefinition def, List<String> warnings,
                           Map<String, String> droppedRecords) {
        String name = def.block.name();
        BlockRecord record = doc.blocks().get(name).orElse(null);
        if (record == null) {
            // R12 没有块记录
            record = (BlockRecord) RequiredStructures.ensureTableEntry(doc, "BLOCK_RECORD", name);
        }
        if (record.block() != null) {
            warn(warnings, "块记录 " + name + " 已有块定义，忽略重复的 BLOCK #" + def.block.handle());
            return;
        }
        record.setBlock(def.block);
        record.setEndblk(def.endblk);
        record.entities().addAll(def.entities);
        EntityDatabase db = doc.database();
        for (DxfEntity e : record.subEntities()) {
            if (e.owner() == null || "0".equals(e.owner())) {
                e.setOwner(record.handle());
            } else if (droppedRecords.containsKey(key(e.owner()))) {
                db.setOwner(e, droppedRecords.get(key(e.owner())));
            } else {
                requireBlockRecordOwner(db, e);
            }
            wireChildren(db, e);
        }
    }

    // ---------------------------------------------------------------- ENTITIES

    private static BlockRecord resolveLayout(DxfDocument doc, DxfEntity entity, BlockRecord modelspace,
                                             BlockRecord paperspace) {
        String owner = entity.owner();
        if (owner == null || "0".equals(owner)) {
            BlockRecord layout = entity.isSupported("paperspace") && entity.getInt("paperspace") == 1
                    ? paperspace : modelspace;
            entity.setOwner(layout.handle());
            return layout;
        }
        BlockRecord record = requireBlockRecordOwner(doc.database(), entity);
        if (!BlocksSection.isEntitiesSectionLayout(record)) {
            throw new DxfStructureException("ENTITIES 段中的实体属于块 " + record.name() + "，不属于模型空间或图纸空间")
                    .withEntity(entity.dxftype(), entity.handle());
        }
        return record;
    }

    private static BlockRecord requireBlockRecordOwner(EntityDatabase db, DxfEntity entity) {
        DxfEntity owner = db.resolve(entity.owner()).orElse(null);
        if (owner instanceof BlockRecord record) {
            return record;
        }
        String reason = owner == null ? "无法解析" : "指向 " + owner.dxftype();
        throw new DxfStructureException("所有者句柄 #" + entity.owner() + " " + reason + "，不是 BLOCK_RECORD")
                .withEntity(entity.dxftype(), entity.handle());
    }

    private static void wireChildren(EntityDatabase db, DxfEntity parent) {
        for (DxfEntity child : parent.subEntities()) {
            if (child.owner() == null || "0".equals(child.owner())) {
                db.setOwner(child, parent.handle());
            }
        }
    }

    /**
     * 把 POLYLINE/VERTEX/SEQEND 与 INSERT/ATTRIB/SEQEND 序列组装为父子结构。缺少的 SEQEND 自动补建。
     */
    private List<DxfEntity> assemble(List<TagGroup> groups, List<String> warnings) {
        List<DxfEntity> result = new ArrayList<>();
        int i = 0;
        int n = groups.size();
        while (i < n) {
            TagGroup group = groups.get(i++);
            DxfEntity entity = factory.load(group);
            if (entity instanceof Polyline polyline) {
                while (i < n && "VERTEX".equals(groups.get(i).dxftype())) {
                    polyline.vertices().add(factory.load(groups.get(i++)));
                }
                if (i < n && "SEQEND".equals(groups.get(i).dxftype())) {
                    polyline.setSeqend(factory.load(groups.get(i++)));
                } else {
                    warn(warnings, "POLYLINE #" + polyline.handle() + " 缺少 SEQEND，已补建");
                    polyline.setSeqend(factory.create("SEQEND"));
                }
                result.add(polyline);
            } else if (entity instanceof Insert insert) {
                while (i < n && "ATTRIB".equals(groups.get(i).dxftype())) {
                    insert.attribs().add(factory.load(groups.get(i++)));
                }
                if (i < n && "SEQEND".equals(groups.get(i).dxftype())) {
                    insert.setSeqend(factory.load(groups.get(i++)));
                } else if (!insert.attribs().isEmpty()) {
                    warn(warnings, "INSERT #" + insert.handle() + " 缺少 SEQEND，已补建");
                    insert.setSeqend(factory.create("SEQEND"));
                }
                result.add(insert);
            } else if (isChainMember(group.dxftype())) {
                warn(warnings, "忽略不属于 POLYLINE/INSERT 的 " + group.dxftype() + " #" + entity.handle());
            } else {
                result.add(entity);
            }
        }
        return result;
    }

    private static boolean isChainMember(String dxftype) {
        return "VERTEX".equals(dxftype) || "ATTRIB".equals(dxftype) || "SEQEND".equals(dxftype);
    }

    private static String key(String handle) {
        return handle.toUpperCase(Locale.ROOT);
    }

    private static void warn(List<String> warnings, String message) {
        log.warn(message);
        warnings.add(message);
    }
}
