package org.example.dxf.schema;

import org.example.dxf.DxfVersion;
import org.example.dxf.UnsupportedAttributeException;
import org.example.dxf.tag.GroupCodes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 一个 DXF 类型的完整 schema：按输出顺序排列的子类定义。
 * <p>
 * 基类（类型、句柄、所有者、应用数据）不在 schema 中描述，由实体统一处理。
 */
public final class EntitySchema {

    private final String dxftype;
    private final List<SubclassDef> subclasses;
    private final DxfVersion minVersion;
    private final int handleCode;
    private final Map<String, DxfAttr> byName = new LinkedHashMap<>();

    public EntitySchema(String dxftype, DxfVersion minVersion, int handleCode, List<SubclassDef> subclasses) {
        this.dxftype = dxftype;
        this.minVersion = minVersion;
        this.handleCode = handleCode;
        this.subclasses = List.copyOf(subclasses);
        for (SubclassDef def : this.subclasses) {
            for (DxfAttr attr : def.attrs()) {
                if (byName.put(attr.name(), attr) != null) {
                    throw new IllegalStateException(dxftype + " 的属性名重复：" + attr.name());
                }
            }
        }
    }

    public static EntitySchema of(String dxftype, SubclassDef... subclasses) {
        return new EntitySchema(dxftype, DxfVersion.R12, GroupCodes.HANDLE, List.of(subclasses));
    }

    /**
     * 未建模类型的 schema：没有子类定义，全部子类作为未知内容原样保留。
     */
    public static EntitySchema unknown(String dxftype) {
        return new EntitySchema(dxftype, DxfVersion.R12, GroupCodes.HANDLE, List.of());
    }

    public EntitySchema since(DxfVersion version) {
        return new EntitySchema(dxftype, version, handleCode, subclasses);
    }

    public EntitySchema withHandleCode(int code) {
        return new EntitySchema(dxftype, minVersion, code, subclasses);
    }

    /**
     * 以当前 schema 为基础派生新类型（追加子类）。
     */
    public EntitySchema derive(String newType, SubclassDef... extra) {
        List<SubclassDef> all = new ArrayList<>(subclasses);
        Collections.addAll(all, extra);
        return new EntitySchema(newType, minVersion, handleCode, all);
    }

    public String dxftype() {
        return dxftype;
    }

    public List<SubclassDef> subclasses() {
        return subclasses;
    }

    public DxfVersion minVersion() {
        return minVersion;
    }

    public int handleCode() {
        return handleCode;
    }

    public Optional<DxfAttr> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * @throws UnsupportedAttributeException 属性不在 schema 中
     */
    public DxfAttr require(String name) {
        DxfAttr attr = byName.get(name);
        if (attr == null || attr.isSlot()) {
            throw new UnsupportedAttributeException(dxftype, name);
        }
        return attr;
    }

    /**
     * @return 所有属性（按子类与输出顺序）
     */
    public List<DxfAttr> attributes() {
        return List.copyOf(byName.values());
    }

    /**
     * @return 包含指定子类标记（或其别名）的子类定义
     */
    public boolean hasSubclass(String marker) {
        return subclasses.stream().anyMatch(d -> d.matches(marker));
    }

    @Override
    public String toString() {
        return "EntitySchema[" + dxftype + "]";
    }
}
