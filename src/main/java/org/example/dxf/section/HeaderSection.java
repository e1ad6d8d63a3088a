package org.example.dxf.section;

import org.example.dxf.DxfStructureException;
import org.example.dxf.structure.RawSection;
import org.example.dxf.tag.DxfTag;
import org.example.dxf.tag.DxfTagWriter;
import org.example.dxf.tag.GroupCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * HEADER 段：变量名 -> 值 tag（大多数变量只有一个值，点坐标变量是一个点 tag，少数变量有多个 tag）。
 * <p>
 * 重复的变量名只保留第一次出现的值。
 */
public class HeaderSection {

    private static final Logger log = LoggerFactory.getLogger(HeaderSection.class);

    private final Map<String, List<DxfTag>> variables = new LinkedHashMap<>();

    public static HeaderSection load(RawSection section) {
        HeaderSection header = new HeaderSection();
        String current = null;
        List<DxfTag> values = null;
        for (List<DxfTag> group : section.groups()) {
            for (DxfTag tag : group) {
                if (tag.code() == GroupCodes.HEADER_VARIABLE) {
                    current = tag.stringValue();
                    if (header.variables.containsKey(current)) {
                        log.debug("HEADER 变量 {} 重复出现（行 {}），保留第一次的值", current, tag.line());
                        values = new ArrayList<>();
                    } else {
                        values = new ArrayList<>();
                        header.variables.put(current, values);
                    }
                } else if (values == null) {
                    throw new DxfStructureException("HEADER 段的值之前缺少 (9, 变量名)：" + tag, tag.line());
                } else {
                    values.add(tag);
                }
            }
        }
        return header;
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    public Optional<List<DxfTag>> get(String name) {
        return Optional.ofNullable(variables.get(name)).map(Collections::unmodifiableList);
    }

    /**
     * @return 变量的第一个值
     */
    public Optional<Object> value(String name) {
        List<DxfTag> tags = variables.get(name);
        return tags == null || tags.isEmpty() ? Optional.empty() : Optional.of(tags.get(0).value());
    }

    public Optional<String> getString(String name) {
        return value(name).map(String::valueOf);
    }

    public void set(String name, int code, Object value) {
        List<DxfTag> tags = new ArrayList<>();
        tags.add(DxfTag.of(code, value));
        variables.put(name, tags);
    }

    public void set(String name, List<DxfTag> tags) {
        variables.put(name, new ArrayList<>(tags));
    }

    public void remove(String name) {
        variables.remove(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(variables.keySet());
    }

    public int size() {
        return variables.size();
    }

    /**
     * 写出 HEADER 段。{@code overrides} 中的变量替换原值（不存在时写在最前面），文档本身不被修改。
     */
    public void export(DxfTagWriter w, Map<String, DxfTag> overrides) {
        w.write(GroupCodes.STRUCTURE, "SECTION");
        w.write(GroupCodes.NAME, "HEADER");
        for (Map.Entry<String, DxfTag> e : overrides.entrySet()) {
            if (!variables.containsKey(e.getKey())) {
                w.write(GroupCodes.HEADER_VARIABLE, e.getKey());
                w.write(e.getValue());
            }
        }
        for (Map.Entry<String, List<DxfTag>> e : variables.entrySet()) {
            w.write(GroupCodes.HEADER_VARIABLE, e.getKey());
            DxfTag override = overrides.get(e.getKey());
            if (override != null) {
                w.write(override);
            } else {
                w.writeAll(e.getValue());
            }
        }
        w.write(GroupCodes.STRUCTURE, "ENDSEC");
    }
}
