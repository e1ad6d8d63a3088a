package org.example.dxf;

import org.example.dxf.db.EntityDatabase;
import org.example.dxf.entity.BlockRecord;
import org.example.dxf.entity.DxfEntity;
import org.example.dxf.entity.EntityContext;
import org.example.dxf.entity.EntityFactory;
import org.example.dxf.entity.Insert;
import org.example.dxf.entity.Polyline;
import org.example.dxf.entity.Vertex;
import org.example.dxf.schema.SchemaRegistry;
import org.example.dxf.section.BlocksSection;
import org.example.dxf.section.ClassesSection;
import org.example.dxf.section.DxfTable;
import org.example.dxf.section.HeaderSection;
import org.example.dxf.section.ObjectsSection;
import org.example.dxf.section.RequiredStructures;
import org.example.dxf.section.StoredSection;
import org.example.dxf.section.TablesSection;
import org.example.dxf.tag.DxfEncoding;
import org.example.dxf.tag.DxfPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 一个打开的 DXF 文档：各段、实体数据库与文档版本。
 * <p>
 * 使用方式：
 * <ul>
 *   <li>新建：{@link #create()}，自动创建必需的表记录、模型/图纸空间与根字典</li>
 *   <li>读取：{@link DxfReader}；写出：{@link DxfWriter}</li>
 *   <li>添加实体：{@link #add(BlockRecord, String)}；删除实体：{@link #delete(DxfEntity)}</li>
 * </ul>
 * 非线程安全。
 */
public class DxfDocument implements EntityContext {

    private static final Logger log = LoggerFactory.getLogger(DxfDocument.class);

    private DxfVersion version;
    private String codepage;
    private final DxfOptions options;
    private final EntityDatabase database;
    private final EntityFactory factory;
    private final HeaderSection header;
    private final ClassesSection classes;
    private final TablesSection tables;
    private final BlocksSection blocks;
    private final ObjectsSection objects;
    private final List<StoredSection> storedSections;
    private final List<String> warnings = new ArrayList<>();

    /**
     * 由加载器或 {@link #create} 调用；各段内容在之后由调用方填充。
     */
    public DxfDocument(DxfVersion version, DxfOptions options, EntityDatabase database, HeaderSection header,
                       ClassesSection classes, TablesSection tables, ObjectsSection objects,
                       List<StoredSection> storedSections) {
        this.version = version;
        this.options = options;
        this.database = database;
        this.factory = new EntityFactory(options);
        this.header = header;
        this.classes = classes;
        this.tables = tables;
        this.blocks = new BlocksSection(tables);
        this.objects = objects;
        this.storedSections = new ArrayList<>(storedSections);
        this.codepage = header.getString("$DWGCODEPAGE").orElse(DxfEncoding.DEFAULT_CODEPAGE);
    }

    public static DxfDocument create() {
        return create(DxfOptions.defaults());
    }

    public static DxfDocument create(DxfOptions options) {
        return create(options.defaultVersion(), options);
    }

    /**
     * 新建文档，包含必需的表记录、模型空间与图纸空间、根字典与布局。
     */
    public static DxfDocument create(DxfVersion version, DxfOptions options) {
        HeaderSection header = new HeaderSection();
        header.set("$ACADVER", 1, version.token());
        header.set("$DWGCODEPAGE", 3, DxfEncoding.DEFAULT_CODEPAGE);
        header.set("$INSBASE", 10, DxfPoint.ORIGIN);
        header.set("$MEASUREMENT", 70, options.measurement().headerValue());
        DxfDocument doc = new DxfDocument(version, options, new EntityDatabase(), header, new ClassesSection(),
                new TablesSection(), new ObjectsSection(), List.of());
        RequiredStructures.ensure(doc);
        log.debug("新建 {} 文档", version);
        return doc;
    }

    // ---------------------------------------------------------------- EntityContext

    @Override
    public DxfVersion dxfVersion() {
        return version;
    }

    @Override
    public VersionConflictPolicy versionPolicy() {
        return options.versionPolicy();
    }

    @Override
    public void upgradeVersion(DxfVersion target) {
        if (version.isBefore(target)) {
            log.info("文档版本由 {} 提升为 {}", version, target);
            version = target;
        }
    }

    /**
     * 修改文档版本（默认的写出版本）。
     */
    public void setDxfVersion(DxfVersion version) {
        this.version = version;
    }

    // ---------------------------------------------------------------- 访问

    public String codepage() {
        return codepage;
    }

    public void setCodepage(String codepage) {
        this.codepage = codepage;
    }

    public DxfOptions options() {
        return options;
    }

    public EntityDatabase database() {
        return database;
    }

    public EntityFactory entityFactory() {
        return factory;
    }

    public HeaderSection header() {
        return header;
    }

    public ClassesSection classes() {
        return classes;
    }

    public TablesSection tables() {
        return tables;
    }

    public BlocksSection blocks() {
        return blocks;
    }

    public ObjectsSection objects() {
        return objects;
    }

    public List<StoredSection> storedSections() {
        return Collections.unmodifiableList(storedSections);
    }

    /**
     * @return 加载过程中记录的非致命问题（重复名称被合并、补全的 SEQEND 等）
     */
    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public void recordWarning(String warning) {
        warnings.add(warning);
    }

    public BlockRecord modelspace() {
        return blocks.get(BlockRecord.MODEL_SPACE)
                .orElseThrow(() -> new DxfStructureException("文档缺少模型空间 " + BlockRecord.MODEL_SPACE));
    }

    /**
     * @return 当前图纸空间（{@code *Paper_Space}）
     */
    public BlockRecord paperspace() {
        return blocks.get(BlockRecord.PAPER_SPACE)
                .orElseThrow(() -> new DxfStructureException("文档缺少图纸空间 " + BlockRecord.PAPER_SPACE));
    }

    /**
     * @return ENTITIES 段的内容：模型空间实体加当前图纸空间实体
     */
    public List<DxfEntity> entities() {
        List<DxfEntity> result = new ArrayList<>(modelspace().entities());
        result.addAll(paperspace().entities());
        return result;
    }

    public Optional<DxfEntity> entity(String handle) {
        return database.resolve(handle);
    }

    // ---------------------------------------------------------------- 修改

    /**
     * 注册实体及其子实体并设置所有者。子实体的所有者为其父实体。
     */
    public void register(DxfEntity entity, String ownerHandle) {
        database.register(entity);
        if (ownerHandle != null) {
            database.setOwner(entity, ownerHandle);
        }
        entity.bind(this);
        for (DxfEntity sub : entity.subEntities()) {
            if (sub.handle() == null || database.resolve(sub.handle()).orElse(null) != sub) {
                register(sub, sub.owner() != null ? sub.owner() : entity.handle());
            }
        }
    }

    /**
     * 新建实体并加入布局或块。
     */
    public DxfEntity add(BlockRecord layout, String dxftype) {
        return add(layout, factory.create(dxftype));
    }

    /**
     * 把新建的图形实体加入布局或块。
     *
     * @throws IllegalArgumentException 不是图形实体，或实体已属于某个文档
     * @throws DxfVersionException      实体类型高于文档版本且策略为 {@link VersionConflictPolicy#RAISE}
     */
    public DxfEntity add(BlockRecord layout, DxfEntity entity) {
        if (!SchemaRegistry.isGraphical(entity.dxftype())) {
            throw new IllegalArgumentException(entity.dxftype() + " 不是图形实体，不能加入布局");
        }
        if (entity.handle() != null) {
            throw new IllegalArgumentException(entity + " 已属于某个文档");
        }
        checkVersion(entity);
        ensureSeqend(entity);
        if (layout.isPaperSpace()) {
            entity.set("paperspace", 1);
        }
        register(entity, layout.handle());
        layout.entities().add(entity);
        return entity;
    }

    /**
     * 给 POLYLINE 追加顶点。顶点标志按多段线种类设置（三维顶点、网格顶点或多面网格的位置顶点）。
     */
    public Vertex addVertex(Polyline polyline, DxfPoint location) {
        Vertex vertex = factory.create("VERTEX", Vertex.class);
        vertex.set("location", location);
        if (polyline.isPolyface()) {
            vertex.set("flags", Vertex.POLYFACE_MESH_VERTEX | Vertex.POLYGON_MESH_VERTEX);
        } else if (polyline.isPolymesh()) {
            vertex.set("flags", Vertex.POLYGON_MESH_VERTEX);
        } else if ((polyline.getInt("flags") & Polyline.POLYLINE_3D) != 0) {
            vertex.set("flags", Vertex.POLYLINE_3D_VERTEX);
        }
        copyLayer(polyline, vertex);
        polyline.vertices().add(vertex);
        attachChild(polyline);
        return vertex;
    }

    /**
     * 给 INSERT 追加属性 ATTRIB。
     */
    public DxfEntity addAttrib(Insert insert, String tag, String text, DxfPoint location) {
        DxfEntity attrib = factory.create("ATTRIB");
        attrib.set("tag", tag);
        attrib.set("text", text);
        attrib.set("insert", location);
        copyLayer(insert, attrib);
        insert.attribs().add(attrib);
        attachChild(insert);
        return attrib;
    }

    private void attachChild(DxfEntity parent) {
        ensureSeqend(parent);
        if (parent.handle() != null) {
            register(parent, parent.owner());
        }
    }

    private static void copyLayer(DxfEntity parent, DxfEntity child) {
        if (parent.hasAttr("layer")) {
            child.set("layer", parent.get("layer"));
        }
    }

    private void ensureSeqend(DxfEntity entity) {
        if (entity instanceof Polyline polyline && polyline.seqend() == null) {
            polyline.setSeqend(factory.create("SEQEND"));
        } else if (entity instanceof Insert insert && insert.seqend() == null && !insert.attribs().isEmpty()) {
            insert.setSeqend(factory.create("SEQEND"));
        }
    }

    private void checkVersion(DxfEntity entity) {
        DxfVersion required = entity.schema().minVersion();
        if (!version.isBefore(required)) {
            return;
        }
        switch (options.versionPolicy()) {
            case RAISE -> throw new DxfVersionException(entity.dxftype() + " 需要 " + required + "，文档版本为 " + version);
            case UPGRADE -> upgradeVersion(required);
            case IGNORE -> log.debug("{} 需要 {}，文档版本为 {}，写出时将跳过", entity.dxftype(), required, version);
        }
    }

    /**
     * 新建块定义（块记录、BLOCK、ENDBLK）。
     *
     * @throws IllegalArgumentException 同名块已存在
     */
    public BlockRecord newBlock(String name, DxfPoint basePoint) {
        if (blocks.has(name)) {
            throw new IllegalArgumentException("块已存在：" + name);
        }
        BlockRecord record = RequiredStructures.ensureBlockRecord(this, name);
        record.block().set("base_point", basePoint);
        return record;
    }

    /**
     * 新建表记录（名称不区分大小写唯一）。
     *
     * @throws IllegalArgumentException 表不存在或同名记录已存在
     */
    public DxfEntity newTableEntry(String tableName, String name) {
        DxfTable table = tables.require(tableName);
        if (table.has(name)) {
            throw new IllegalArgumentException(tableName + " 表中已存在记录：" + name);
        }
        return RequiredStructures.ensureTableEntry(this, tableName, name);
    }

    public DxfEntity newLayer(String name) {
        return newTableEntry("LAYER", name);
    }

    /**
     * 删除实体（连同子实体与扩展字典）。仍有硬引用时拒绝删除，文档不变。
     *
     * @throws ProtectedEntityException 仍被其他实体硬引用
     * @throws IllegalArgumentException 删除模型空间或当前图纸空间
     */
    public void delete(DxfEntity entity) {
        if (entity instanceof BlockRecord br
                && (br.isModelSpace() || BlockRecord.PAPER_SPACE.equalsIgnoreCase(br.name()))) {
            throw new IllegalArgumentException("不能删除布局 " + br.name());
        }
        database.purge(entity);
        objects.prune();
    }

    @Override
    public String toString() {
        return "DxfDocument[" + version + ", " + database.size() + " entities]";
    }
}
