package org.example.dxf.entity;

import org.example.dxf.DxfVersion;
import org.example.dxf.DxfVersionException;
import org.example.dxf.VersionConflictPolicy;
import org.example.dxf.schema.DxfAttr;
import org.example.dxf.schema.EntitySchema;
import org.example.dxf.schema.HandleReference;
import org.example.dxf.schema.ReferenceKind;
import org.example.dxf.schema.SubclassDef;
import org.example.dxf.structure.TagGroup;
import org.example.dxf.tag.DxfPoint;
import org.example.dxf.tag.DxfTag;
import org.example.dxf.tag.DxfTagWriter;
import org.example.dxf.tag.GroupCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 已解析的 DXF 实体/对象记录。
 * <p>
 * 结构：
 * <ul>
 *   <li>基类：句柄（一经分配不可变）、所有者句柄、扩展字典、持久反应器、应用数据</li>
 *   <li>属性命名空间：只保存显式出现/设置过的属性；读取缺失的属性时返回 schema 声明的默认值，
 *       因此“属性缺失”和“属性等于默认值”可以区分</li>
 *   <li>未建模 tag：按所在子类与其前一个已建模属性（锚点）记录，写出时回到原来的相对位置</li>
 *   <li>未建模子类、嵌入对象、XDATA：原样保留</li>
 * </ul>
 * 引用关系一律保存为句柄字符串，通过数据库按需解析。
 * <p>
 * 带变长结构的类型（LWPOLYLINE、HATCH 等）继承本类，通过 {@link #loadStructure}/{@link #exportSlot}
 * 在通用属性处理之前/之中编解码自己的结构。
 */
public class DxfEntity {

    private static final Logger log = LoggerFactory.getLogger(DxfEntity.class);

    /**
     * 结构占位 tag 的组码（不会出现在文件中）。
     */
    protected static final int SLOT_MARKER = Integer.MIN_VALUE;

    private static final int BASE = -1;

    /**
     * 扁平载入（没有子类标记）时未能匹配的 tag：无法确定所属子类，只在不带子类标记的 R12 输出中写出。
     */
    private static final int FLAT = -2;

    private record AnchoredTag(int subclass, String anchor, DxfTag tag) {
    }

    private record ExtraSubclass(int after, String name, List<DxfTag> tags) {
    }

    private final EntitySchema schema;
    private String handle;
    private String owner;
    private final Map<String, Object> attribs = new LinkedHashMap<>();
    private final List<AnchoredTag> unknownTags = new ArrayList<>();
    private final List<ExtraSubclass> extraSubclasses = new ArrayList<>();
    private final Map<Integer, String> markers = new HashMap<>();
    private String xdictionary;
    private final List<String> reactors = new ArrayList<>();
    private final Map<String, List<DxfTag>> appData = new LinkedHashMap<>();
    private final Map<String, List<DxfTag>> xdata = new LinkedHashMap<>();
    private final List<List<DxfTag>> embeddedObjects = new ArrayList<>();
    private EntityContext context;
    private boolean alive = true;

    public DxfEntity(EntitySchema schema) {
        this.schema = schema;
    }

    public String dxftype() {
        return schema.dxftype();
    }

    public EntitySchema schema() {
        return schema;
    }

    // ---------------------------------------------------------------- 基类

    public String handle() {
        return handle;
    }

    /**
     * 分配句柄。句柄一经分配不可修改。
     */
    public void assignHandle(String handle) {
        if (this.handle != null && !this.handle.equalsIgnoreCase(handle)) {
            throw new IllegalStateException(dxftype() + " 已有句柄 #" + this.handle + "，不能改为 #" + handle);
        }
        this.handle = handle;
    }

    public String owner() {
        return owner;
    }

    /**
     * 设置唯一的所有者（覆盖旧值）。一般通过 {@code EntityDatabase#setOwner} 调用。
     */
    public void setOwner(String owner) {
        this.owner = owner;
    }

    public String xdictionary() {
        return xdictionary;
    }

    public void setXdictionary(String handle) {
        this.xdictionary = handle;
    }

    public List<String> reactors() {
        return reactors;
    }

    /**
     * @return 应用数据（不含扩展字典与反应器），APPID -> tag
     */
    public Map<String, List<DxfTag>> appData() {
        return appData;
    }

    /**
     * @return XDATA，APPID -> tag（不含 1001）
     */
    public Map<String, List<DxfTag>> xdata() {
        return xdata;
    }

    public void setXdata(String appid, List<DxfTag> tags) {
        xdata.put(appid, new ArrayList<>(tags));
    }

    public List<List<DxfTag>> embeddedObjects() {
        return embeddedObjects;
    }

    public boolean isAlive() {
        return alive;
    }

    /**
     * 由数据库在删除时调用。
     */
    public void destroy() {
        alive = false;
        context = null;
    }

    public void bind(EntityContext context) {
        this.context = context;
    }

    // ---------------------------------------------------------------- 属性命名空间

    /**
     * @return 属性值；未设置时返回 schema 默认值（可能为 {@code null}）
     * @throws org.example.dxf.UnsupportedAttributeException 属性不在该类型的 schema 中
     */
    public Object get(String name) {
        DxfAttr attr = schema.require(name);
        Object computed = computedValue(name);
        if (computed != null) {
            return computed;
        }
        Object value = attribs.get(name);
        return value != null ? value : attr.defaultValue();
    }

    public String getString(String name) {
        Object v = get(name);
        return v == null ? null : v.toString();
    }

    public int getInt(String name) {
        Object v = get(name);
        return v == null ? 0 : ((Number) v).intValue();
    }

    public double getDouble(String name) {
        Object v = get(name);
        return v == null ? 0.0 : ((Number) v).doubleValue();
    }

    public DxfPoint getPoint(String name) {
        return (DxfPoint) get(name);
    }

    /**
     * @return 属性是否显式存在（从文件读出或通过 {@link #set} 设置过）
     */
    public boolean hasAttr(String name) {
        schema.require(name);
        return attribs.containsKey(name);
    }

    public boolean isSupported(String name) {
        return schema.find(name).filter(a -> !a.isSlot()).isPresent();
    }

    /**
     * 设置属性。
     * <p>
     * 实体已加入文档且文档版本低于属性最低版本时，按文档的 {@link VersionConflictPolicy} 处理：
     * 忽略（照常保存）、提升文档版本或抛出 {@link DxfVersionException}。
     */
    public void set(String name, Object value) {
        DxfAttr attr = schema.require(name);
        Object v = attr.coerce(value);
        if (context != null && context.dxfVersion().isBefore(attr.minVersion())) {
            switch (context.versionPolicy()) {
                case RAISE -> throw new DxfVersionException(dxftype() + " 的属性 " + name + " 需要 "
                        + attr.minVersion() + "，文档版本为 " + context.dxfVersion());
                case UPGRADE -> context.upgradeVersion(attr.minVersion());
                case IGNORE -> log.debug("文档版本 {} 低于属性 {}.{} 的最低版本 {}，写出时将省略",
                        context.dxfVersion(), dxftype(), name, attr.minVersion());
            }
        }
        attribs.put(name, v);
    }

    /**
     * 保存属性值，不做版本检查。只用于文档内部结构的维护（例如块记录与布局的关联）。
     */
    protected void store(String name, Object value) {
        DxfAttr attr = schema.require(name);
        attribs.put(name, attr.coerce(value));
    }

    public void discard(String name) {
        schema.require(name);
        attribs.remove(name);
    }

    /**
     * @return 全部属性的当前值（含默认值），按 schema 顺序
     */
    public Map<String, Object> attributes() {
        Map<String, Object> result = new LinkedHashMap<>();
        for (DxfAttr attr : schema.attributes()) {
            if (!attr.isSlot()) {
                result.put(attr.name(), get(attr.name()));
            }
        }
        return result;
    }

    /**
     * @return 未建模 tag（含未建模子类中的 tag），按读入顺序
     */
    public List<DxfTag> unknownTags() {
        List<DxfTag> result = new ArrayList<>();
        unknownTags.forEach(a -> result.add(a.tag()));
        extraSubclasses.forEach(s -> result.addAll(s.tags()));
        return Collections.unmodifiableList(result);
    }

    /**
     * @return 未建模子类的标记名
     */
    public List<String> unknownSubclasses() {
        return extraSubclasses.stream().map(ExtraSubclass::name).toList();
    }

    // ---------------------------------------------------------------- 引用

    /**
     * @return 本实体发出的全部句柄引用（属性、扩展字典、反应器、未建模 tag、应用数据、XDATA、变长结构）
     */
    public List<HandleReference> references() {
        List<HandleReference> refs = new ArrayList<>();
        for (DxfAttr attr : schema.attributes()) {
            ReferenceKind kind = attr.referenceKind();
            Object value = attribs.get(attr.name());
            if (kind != null && value != null && !"0".equals(value)) {
                refs.add(new HandleReference((String) value, kind, attr.code()));
            }
        }
        if (xdictionary != null) {
            refs.add(new HandleReference(xdictionary, ReferenceKind.HARD_OWNER, GroupCodes.XDICTIONARY));
        }
        for (String r : reactors) {
            refs.add(new HandleReference(r, ReferenceKind.SOFT_POINTER, GroupCodes.OWNER));
        }
        unknownTags.forEach(a -> addTagReference(refs, a.tag()));
        extraSubclasses.forEach(s -> s.tags().forEach(t -> addTagReference(refs, t)));
        appData.values().forEach(tags -> tags.forEach(t -> addTagReference(refs, t)));
        xdata.values().forEach(tags -> tags.forEach(t -> addTagReference(refs, t)));
        collectReferences(refs);
        return refs;
    }

    protected static void addTagReference(List<HandleReference> refs, DxfTag tag) {
        ReferenceKind kind = ReferenceKind.ofGroupCode(tag.code());
        if (kind != null && tag.value() instanceof String s && !s.isEmpty() && !"0".equals(s)) {
            refs.add(new HandleReference(s, kind, tag.code()));
        }
    }

    /**
     * 删除某个句柄的全部硬引用（用于解除删除保护）：属性置空，未建模 tag 移除。
     *
     * @return 是否有引用被移除
     */
    public boolean clearReferencesTo(String target) {
        boolean changed = false;
        for (DxfAttr attr : schema.attributes()) {
            if (attr.referenceKind() != null && target.equalsIgnoreCase(String.valueOf(attribs.get(attr.name())))) {
                attribs.remove(attr.name());
                changed = true;
            }
        }
        changed |= unknownTags.removeIf(a -> ReferenceKind.ofGroupCode(a.tag().code()) != null
                && target.equalsIgnoreCase(a.tag().stringValue()));
        if (target.equalsIgnoreCase(xdictionary)) {
            xdictionary = null;
            changed = true;
        }
        return changed;
    }

    /**
     * @return 随本实体一起删除/写出的子实体（VERTEX、ATTRIB、SEQEND、块内容等）
     */
    public List<DxfEntity> subEntities() {
        return List.of();
    }

    // ---------------------------------------------------------------- 扩展点

    /**
     * 在通用属性载入之前，从子类 tag 中取出变长结构；返回剩余 tag，结构所在位置用 {@link #slotMarker(String)} 标记。
     */
    protected List<DxfTag> loadStructure(String subclass, List<DxfTag> tags) {
        return tags;
    }

    /**
     * 处理基类中的专有 tag（例如表头的表名）；返回 {@code true} 表示已处理。
     */
    protected boolean loadBaseTag(DxfTag tag) {
        return false;
    }

    /**
     * 紧跟在类型 tag 之后写出的专有 tag。
     */
    protected void exportHead(DxfTagWriter writer) {
    }

    /**
     * 在 schema 中 {@link org.example.dxf.schema.AttrType#SLOT} 的位置写出变长结构。
     */
    protected void exportSlot(String slot, DxfTagWriter writer) {
    }

    /**
     * 由实时集合计算的属性值（例如顶点数）；不需要计算时返回 {@code null}。
     */
    protected Object computedValue(String name) {
        return null;
    }

    /**
     * 写出时使用的属性值，默认是计算值或已保存的值。
     */
    protected Object valueForExport(DxfAttr attr, DxfVersion version) {
        Object computed = computedValue(attr.name());
        return computed != null ? computed : attribs.get(attr.name());
    }

    /**
     * @return 属性在当前状态下是否需要写出（例如实心填充不写图案参数）
     */
    protected boolean isExported(DxfAttr attr, DxfVersion version) {
        return true;
    }

    /**
     * 新建实体的子类标记名（读入的实体沿用文件中的标记）。
     */
    protected String defaultMarker(int index, SubclassDef def) {
        return def.name();
    }

    protected void collectReferences(List<HandleReference> refs) {
    }

    /**
     * @return 是否有未建模 tag 锚定在指定属性（或结构占位）之后
     */
    protected boolean hasUnknownAfter(String anchor) {
        return unknownTags.stream().anyMatch(a -> anchor.equals(a.anchor()));
    }

    protected static DxfTag slotMarker(String slot) {
        return DxfTag.of(SLOT_MARKER, slot);
    }

    protected EntityContext context() {
        return context;
    }

    // ---------------------------------------------------------------- 载入

    /**
     * 从分类后的 tag 组载入实体。
     */
    public void load(TagGroup group) {
        List<DxfTag> baseRest = new ArrayList<>();
        List<DxfTag> base = group.base();
        for (int i = 1; i < base.size(); i++) {
            DxfTag tag = base.get(i);
            if (tag.code() == schema.handleCode() && handle == null) {
                handle = tag.stringValue();
            } else if (tag.code() == GroupCodes.OWNER && owner == null) {
                owner = tag.stringValue();
            } else if (!loadBaseTag(tag)) {
                baseRest.add(tag);
            }
        }
        for (TagGroup.AppData data : group.appData()) {
            switch (data.appid()) {
                case GroupCodes.REACTORS -> data.tags().forEach(t -> reactors.add(t.stringValue()));
                case GroupCodes.XDICTIONARY_APPID -> data.tags().stream()
                        .filter(t -> t.code() == GroupCodes.XDICTIONARY)
                        .findFirst()
                        .ifPresent(t -> xdictionary = t.stringValue());
                default -> appData.putIfAbsent(data.appid(), new ArrayList<>(data.tags()));
            }
        }
        if (group.isFlat()) {
            if (group.strippedMarkers() > 0) {
                log.debug("{} #{} 扁平化载入，忽略了 {} 个子类标记", dxftype(), handle, group.strippedMarkers());
            }
            List<DxfAttr> all = schema.attributes().stream().filter(a -> !a.isSlot()).toList();
            List<SubclassDef> defs = schema.subclasses();
            if (defs.isEmpty()) {
                loadAttributes(BASE, all, baseRest);
            } else {
                loadAttributes(FLAT, all, loadStructure(defs.get(defs.size() - 1).name(), baseRest));
            }
        } else {
            baseRest.forEach(t -> unknownTags.add(new AnchoredTag(BASE, null, t)));
            loadSubclasses(group.subclasses());
        }
        group.embeddedObjects().forEach(tags -> embeddedObjects.add(new ArrayList<>(tags)));
        for (TagGroup.XDataBlock block : group.xdata()) {
            if (xdata.containsKey(block.appid())) {
                xdata.get(block.appid()).addAll(block.tags());
            } else {
                xdata.put(block.appid(), new ArrayList<>(block.tags()));
            }
        }
    }

    private void loadSubclasses(List<TagGroup.Subclass> subclasses) {
        List<SubclassDef> defs = schema.subclasses();
        boolean[] used = new boolean[defs.size()];
        int lastKnown = BASE;
        for (TagGroup.Subclass sc : subclasses) {
            int index = -1;
            for (int i = 0; i < defs.size(); i++) {
                if (!used[i] && defs.get(i).matches(sc.name())) {
                    index = i;
                    break;
                }
            }
            if (index < 0) {
                extraSubclasses.add(new ExtraSubclass(lastKnown, sc.name(), new ArrayList<>(sc.tags())));
                continue;
            }
            used[index] = true;
            SubclassDef def = defs.get(index);
            if (!def.name().equals(sc.name())) {
                markers.put(index, sc.name());
            }
            loadAttributes(index, def.attrs(), loadStructure(def.name(), sc.tags()));
            lastKnown = index;
        }
    }

    private void loadAttributes(int subclass, List<DxfAttr> attrs, List<DxfTag> tags) {
        String anchor = null;
        Set<String> assigned = new HashSet<>();
        for (DxfTag tag : tags) {
            if (tag.code() == SLOT_MARKER) {
                anchor = tag.stringValue();
                continue;
            }
            DxfAttr match = null;
            for (DxfAttr attr : attrs) {
                if (attr.code() == tag.code() && !assigned.contains(attr.name()) && attr.accepts(tag.value())) {
                    match = attr;
                    break;
                }
            }
            if (match == null) {
                unknownTags.add(new AnchoredTag(subclass, anchor, tag));
            } else {
                attribs.put(match.name(), tag.value());
                assigned.add(match.name());
                anchor = match.name();
            }
        }
    }

    // ---------------------------------------------------------------- 写出

    /**
     * 按目标版本写出实体：基类、按 schema 顺序的子类（未建模 tag 回到原位置）、嵌入对象（R2018+）、XDATA。
     */
    public void exportDxf(DxfTagWriter w) {
        DxfVersion v = w.version();
        boolean subclassed = v.isAtLeast(DxfVersion.R2000);
        w.write(GroupCodes.STRUCTURE, dxftype());
        exportHead(w);
        if (handle != null) {
            w.write(schema.handleCode(), handle);
        }
        if (subclassed) {
            for (Map.Entry<String, List<DxfTag>> e : appData.entrySet()) {
                w.write(GroupCodes.CONTROL, "{" + e.getKey());
                w.writeAll(e.getValue());
                w.write(GroupCodes.CONTROL, "}");
            }
            if (!reactors.isEmpty()) {
                w.write(GroupCodes.CONTROL, "{" + GroupCodes.REACTORS);
                reactors.forEach(r -> w.write(GroupCodes.OWNER, r));
                w.write(GroupCodes.CONTROL, "}");
            }
            if (xdictionary != null) {
                w.write(GroupCodes.CONTROL, "{" + GroupCodes.XDICTIONARY_APPID);
                w.write(GroupCodes.XDICTIONARY, xdictionary);
                w.write(GroupCodes.CONTROL, "}");
            }
            if (owner != null) {
                w.write(GroupCodes.OWNER, owner);
            }
        }
        writeUnknown(w, BASE);
        if (subclassed) {
            warnDroppedFlatTags(v);
        } else {
            writeUnknown(w, FLAT);
        }
        writeExtraSubclasses(w, BASE, subclassed);
        List<SubclassDef> defs = schema.subclasses();
        for (int i = 0; i < defs.size(); i++) {
            SubclassDef def = defs.get(i);
            if (subclassed) {
                w.write(GroupCodes.SUBCLASS_MARKER, markers.getOrDefault(i, defaultMarker(i, def)));
            }
            writeUnknown(w, i);
            for (DxfAttr attr : def.attrs()) {
                if (attr.isSlot()) {
                    exportSlot(attr.name(), w);
                } else {
                    exportAttribute(attr, w);
                }
                writeAnchored(w, attr.name(), subclassed);
            }
            writeExtraSubclasses(w, i, subclassed);
        }
        if (v.isAtLeast(DxfVersion.R2018)) {
            for (List<DxfTag> tags : embeddedObjects) {
                w.write(GroupCodes.EMBEDDED_OBJECT, GroupCodes.EMBEDDED_OBJECT_MARKER);
                w.writeAll(tags);
            }
        }
        for (Map.Entry<String, List<DxfTag>> e : xdata.entrySet()) {
            w.write(GroupCodes.XDATA_APPID, e.getKey());
            w.writeAll(e.getValue());
        }
    }

    private void writeUnknown(DxfTagWriter w, int subclass) {
        for (AnchoredTag a : unknownTags) {
            if (a.subclass() == subclass && a.anchor() == null) {
                w.write(a.tag());
            }
        }
    }

    private void writeAnchored(DxfTagWriter w, String anchor, boolean subclassed) {
        for (AnchoredTag a : unknownTags) {
            if (anchor.equals(a.anchor()) && !(subclassed && a.subclass() == FLAT)) {
                w.write(a.tag());
            }
        }
    }

    private void warnDroppedFlatTags(DxfVersion version) {
        long count = unknownTags.stream().filter(a -> a.subclass() == FLAT).count();
        if (count > 0) {
            log.warn("写出 {} 时省略 {} #{} 的 {} 个未建模 tag（扁平载入，无法确定所属子类）",
                    version, dxftype(), handle, count);
        }
    }

    private void writeExtraSubclasses(DxfTagWriter w, int after, boolean subclassed) {
        for (ExtraSubclass extra : extraSubclasses) {
            if (extra.after() == after) {
                if (subclassed) {
                    w.write(GroupCodes.SUBCLASS_MARKER, extra.name());
                }
                w.writeAll(extra.tags());
            }
        }
    }

    protected void exportAttribute(DxfAttr attr, DxfTagWriter w) {
        DxfVersion version = w.version();
        if (!isExported(attr, version)) {
            return;
        }
        Object value = valueForExport(attr, version);
        boolean explicit = value != null;
        if (!explicit) {
            if (attr.optional() || attr.defaultValue() == null) {
                return;
            }
            value = attr.defaultValue();
        } else if (attr.optional() && value.equals(attr.defaultValue())) {
            return;
        }
        if (version.isBefore(attr.minVersion())) {
            if (explicit) {
                if (w.versionPolicy() == VersionConflictPolicy.RAISE) {
                    throw new DxfVersionException(dxftype() + " #" + handle + " 的属性 " + attr.name()
                            + " 需要 " + attr.minVersion() + "，不能写出为 " + version);
                }
                log.warn("写出 {} 时省略 {} #{} 的属性 {}（最低版本 {}）",
                        version, dxftype(), handle, attr.name(), attr.minVersion());
            }
            return;
        }
        writeValue(w, attr, value);
    }

    private static void writeValue(DxfTagWriter w, DxfAttr attr, Object value) {
        switch (attr.type()) {
            case STRING, HANDLE -> w.write(attr.code(), (String) value);
            case INT -> w.write(attr.code(), ((Number) value).intValue());
            case LONG -> w.write(attr.code(), ((Number) value).longValue());
            case DOUBLE -> w.write(attr.code(), ((Number) value).doubleValue());
            case POINT2D -> w.writePoint(attr.code(), (DxfPoint) value, false);
            case POINT3D -> w.writePoint(attr.code(), (DxfPoint) value, true);
            case SLOT -> throw new IllegalStateException("结构占位不能按属性写出：" + attr.name());
        }
    }

    @Override
    public String toString() {
        return dxftype() + "(#" + handle + ")";
    }
}
