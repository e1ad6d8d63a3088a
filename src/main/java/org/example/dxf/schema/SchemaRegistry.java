package org.example.dxf.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 静态的 schema 注册表：DXF 类型名 -> {@link EntitySchema}。
 * <p>
 * 版本逻辑只允许出现在两个地方：属性/子类的最低版本（本注册表中的描述），以及写出时的目标版本。
 */
public final class SchemaRegistry {

    private static final Map<String, EntitySchema> SCHEMAS;

    static {
        Map<String, EntitySchema> m = new LinkedHashMap<>();
        GraphicSchemas.all().forEach(s -> m.put(s.dxftype(), s));
        TableSchemas.all().forEach(s -> m.put(s.dxftype(), s));
        ObjectSchemas.all().forEach(s -> m.put(s.dxftype(), s));
        SCHEMAS = Collections.unmodifiableMap(m);
    }

    private SchemaRegistry() {
    }

    public static Optional<EntitySchema> find(String dxftype) {
        return Optional.ofNullable(SCHEMAS.get(dxftype));
    }

    /**
     * @return 已建模类型的 schema；未建模类型返回只保留原始内容的 schema
     */
    public static EntitySchema get(String dxftype) {
        EntitySchema schema = SCHEMAS.get(dxftype);
        return schema != null ? schema : EntitySchema.unknown(dxftype);
    }

    /**
     * @throws IllegalArgumentException 类型未建模
     */
    public static EntitySchema require(String dxftype) {
        EntitySchema schema = SCHEMAS.get(dxftype);
        if (schema == null) {
            throw new IllegalArgumentException("未建模的 DXF 类型：" + dxftype);
        }
        return schema;
    }

    public static boolean isModeled(String dxftype) {
        return SCHEMAS.containsKey(dxftype);
    }

    public static Set<String> dxftypes() {
        return SCHEMAS.keySet();
    }

    /**
     * @return 是否为图形实体类型（schema 含 {@code AcDbEntity} 子类）
     */
    public static boolean isGraphical(String dxftype) {
        EntitySchema schema = SCHEMAS.get(dxftype);
        return schema != null && schema.hasSubclass(GraphicSchemas.ENTITY.name());
    }
}
