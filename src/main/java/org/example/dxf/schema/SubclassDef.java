package org.example.dxf.schema;

import java.util.List;
import java.util.Objects;

/**
 * 子类定义：子类标记名与该子类内按输出顺序排列的属性。
 * <p>
 * {@code aliases} 是可替代的标记名：例如 VERTEX 的第二个子类按顶点种类写作
 * {@code AcDb2dVertex}、{@code AcDb3dPolylineVertex} 等，属性布局相同。
 */
public record SubclassDef(String name, List<String> aliases, List<DxfAttr> attrs) {

    public SubclassDef {
        Objects.requireNonNull(name, "name");
        aliases = List.copyOf(aliases);
        attrs = List.copyOf(attrs);
    }

    public static SubclassDef of(String name, DxfAttr... attrs) {
        return new SubclassDef(name, List.of(), List.of(attrs));
    }

    public SubclassDef withAliases(String... aliases) {
        return new SubclassDef(name, List.of(aliases), attrs);
    }

    public boolean matches(String marker) {
        return name.equals(marker) || aliases.contains(marker);
    }
}
