package org.example.dxf.entity;

import org.example.dxf.DxfOptions;
import org.example.dxf.DxfStructureException;
import org.example.dxf.schema.EntitySchema;
import org.example.dxf.schema.SchemaRegistry;
import org.example.dxf.structure.TagGroup;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * 按 DXF 类型名创建实体：带变长结构或子实体的类型使用专门的子类，其他类型使用通用的 {@link DxfEntity}。
 */
public final class EntityFactory {

    private static final Map<String, Function<EntitySchema, DxfEntity>> TYPES = new HashMap<>();

    static {
        TYPES.put("LWPOLYLINE", LwPolyline::new);
        TYPES.put("SPLINE", Spline::new);
        TYPES.put("MESH", Mesh::new);
        TYPES.put("MTEXT", MText::new);
        TYPES.put("HATCH", Hatch::new);
        TYPES.put("POLYLINE", Polyline::new);
        TYPES.put("VERTEX", Vertex::new);
        TYPES.put("INSERT", Insert::new);
        TYPES.put("BLOCK", Block::new);
        TYPES.put("BLOCK_RECORD", BlockRecord::new);
        TYPES.put("TABLE", TableHead::new);
        TYPES.put("DICTIONARY", DictionaryObject::new);
        TYPES.put("DICTIONARYWDFLT", DictionaryObject::new);
    }

    private final DxfOptions options;

    public EntityFactory(DxfOptions options) {
        this.options = options;
    }

    /**
     * 从分类后的 tag 组载入实体；未建模类型按原样保留。
     *
     * @throws DxfStructureException 实体内部结构损坏（异常中带实体类型与句柄）
     */
    public DxfEntity load(TagGroup group) {
        DxfEntity entity = instantiate(SchemaRegistry.get(group.dxftype()));
        try {
            entity.load(group);
        } catch (DxfStructureException e) {
            throw e.withEntity(group.dxftype(), group.handle());
        }
        return entity;
    }

    /**
     * 新建一个已建模类型的空实体（没有句柄，尚未加入文档）。
     *
     * @throws IllegalArgumentException 类型未建模
     */
    public DxfEntity create(String dxftype) {
        DxfEntity entity = instantiate(SchemaRegistry.require(dxftype));
        if (entity instanceof Hatch hatch) {
            hatch.set("pattern_scale", options.hatchPatternScale());
        }
        return entity;
    }

    public <T extends DxfEntity> T create(String dxftype, Class<T> type) {
        return type.cast(create(dxftype));
    }

    private static DxfEntity instantiate(EntitySchema schema) {
        Function<EntitySchema, DxfEntity> constructor = TYPES.get(schema.dxftype());
        return constructor != null ? constructor.apply(schema) : new DxfEntity(schema);
    }
}
