package org.example.dxf.section;

import org.example.dxf.DxfVersion;
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

/**
 * CLASSES 段（R2000 起）。按 (类型名, C++ 类名) 去重，保留第一次出现的定义。
 */
public class ClassesSection {

    private static final Logger log = LoggerFactory.getLogger(ClassesSection.class);

    private final Map<String, DxfClass> classes = new LinkedHashMap<>();

    public static ClassesSection load(RawSection section) {
        ClassesSection result = new ClassesSection();
        for (List<DxfTag> group : section.groups()) {
            if (group.isEmpty() || !group.get(0).is(GroupCodes.STRUCTURE, "CLASS")) {
                log.warn("CLASSES 段中忽略非 CLASS 记录：{}", group.isEmpty() ? "<empty>" : group.get(0));
                continue;
            }
            DxfClass cls = parse(group);
            if (result.classes.putIfAbsent(key(cls), cls) != null) {
                log.debug("CLASSES 中重复的类定义 {}，保留第一次出现的定义", cls.name());
            }
        }
        return result;
    }

    private static DxfClass parse(List<DxfTag> group) {
        String name = "";
        String cpp = "";
        String app = "";
        int flags = 0;
        int count = 0;
        boolean proxy = false;
        boolean entity = false;
        for (DxfTag tag : group.subList(1, group.size())) {
            switch (tag.code()) {
                case 1 -> name = tag.stringValue();
                case 2 -> cpp = tag.stringValue();
                case 3 -> app = tag.stringValue();
                case 90 -> flags = tag.intValue();
                case 91 -> count = tag.intValue();
                case 280 -> proxy = tag.intValue() != 0;
                case 281 -> entity = tag.intValue() != 0;
                default -> log.debug("CLASS {} 中忽略未知组码 {}", name, tag.code());
            }
        }
        return new DxfClass(name, cpp, app, flags, count, proxy, entity);
    }

    private static String key(DxfClass cls) {
        return cls.name() + "|" + cls.cppName();
    }

    public void add(DxfClass cls) {
        classes.putIfAbsent(key(cls), cls);
    }

    public Optional<DxfClass> get(String name) {
        return classes.values().stream().filter(c -> c.name().equals(name)).findFirst();
    }

    public List<DxfClass> classes() {
        return Collections.unmodifiableList(new ArrayList<>(classes.values()));
    }

    /**
     * 按当前文档内容更新实例数（R2004 起写出）。
     */
    public void updateInstanceCounts(Map<String, Integer> countsByType) {
        classes.replaceAll((k, c) -> c.withInstanceCount(countsByType.getOrDefault(c.name(), 0)));
    }

    public void export(DxfTagWriter w) {
        w.write(GroupCodes.STRUCTURE, "SECTION");
        w.write(GroupCodes.NAME, "CLASSES");
        boolean withCount = w.version().isAtLeast(DxfVersion.R2004);
        for (DxfClass c : classes.values()) {
            w.write(GroupCodes.STRUCTURE, "CLASS");
            w.write(1, c.name());
            w.write(2, c.cppName());
            w.write(3, c.appName());
            w.write(90, c.flags());
            if (withCount) {
                w.write(91, c.instanceCount());
            }
            w.write(280, c.wasAProxy() ? 1 : 0);
            w.write(281, c.isEntity() ? 1 : 0);
        }
        w.write(GroupCodes.STRUCTURE, "ENDSEC");
    }
}
