package org.example.dxf.entity;

import org.example.dxf.schema.EntitySchema;
import org.example.dxf.schema.HandleReference;
import org.example.dxf.schema.ReferenceKind;
import org.example.dxf.tag.DxfTag;
import org.example.dxf.tag.DxfTagWriter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * DICTIONARY / DICTIONARYWDFLT：有序的“键 -> 句柄”映射（3 + 350/360）。
 * <p>
 * 从文件读入的条目保留原来的组码；新增条目按 {@code hard_owned} 选择 360 或 350。
 */
public class DictionaryObject extends DxfEntity implements EntityContainer {

    private static final String SUBCLASS = "AcDbDictionary";
    private static final String ENTRIES = "entries";
    private static final int KEY = 3;
    private static final int SOFT_OWNER = 350;
    private static final int HARD_OWNER = 360;

    private record Entry(String handle, int code) {
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public DictionaryObject(EntitySchema schema) {
        super(schema);
    }

    /**
     * 按键查找条目句柄（区分大小写）。
     */
    public Optional<String> lookup(String key) {
        return Optional.ofNullable(entries.get(key)).map(Entry::handle);
    }

    public void put(String key, String handle) {
        int code = getInt("hard_owned") == 1 ? HARD_OWNER : SOFT_OWNER;
        entries.put(key, new Entry(handle, code));
    }

    public Optional<String> remove(String key) {
        return Optional.ofNullable(entries.remove(key)).map(Entry::handle);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return 键 -> 句柄（按插入顺序，只读视图）
     */
    public Map<String, String> entries() {
        Map<String, String> result = new LinkedHashMap<>();
        entries.forEach((k, e) -> result.put(k, e.handle()));
        return Collections.unmodifiableMap(result);
    }

    @Override
    public void unlink(DxfEntity child) {
        if (child.handle() != null) {
            entries.values().removeIf(e -> e.handle().equalsIgnoreCase(child.handle()));
        }
    }

    @Override
    protected void collectReferences(List<HandleReference> refs) {
        entries.values().forEach(e -> refs.add(new HandleReference(e.handle(), ReferenceKind.ofGroupCode(e.code()),
                e.code())));
    }

    @Override
    public boolean clearReferencesTo(String target) {
        boolean changed = super.clearReferencesTo(target);
        return entries.values().removeIf(e -> e.handle().equalsIgnoreCase(target)) || changed;
    }

    @Override
    protected List<DxfTag> loadStructure(String subclass, List<DxfTag> tags) {
        if (!SUBCLASS.equals(subclass)) {
            return tags;
        }
        List<DxfTag> rest = new ArrayList<>();
        boolean marked = false;
        for (int i = 0; i < tags.size(); i++) {
            DxfTag tag = tags.get(i);
            DxfTag next = i + 1 < tags.size() ? tags.get(i + 1) : null;
            if (tag.code() == KEY && next != null && (next.code() == SOFT_OWNER || next.code() == HARD_OWNER)) {
                if (!marked) {
                    rest.add(slotMarker(ENTRIES));
                    marked = true;
                }
                entries.putIfAbsent(tag.stringValue(), new Entry(next.stringValue(), next.code()));
                i++;
            } else {
                rest.add(tag);
            }
        }
        return rest;
    }

    @Override
    protected void exportSlot(String slot, DxfTagWriter w) {
        if (!ENTRIES.equals(slot)) {
            return;
        }
        entries.forEach((key, e) -> {
            w.write(KEY, key);
            w.write(e.code(), e.handle());
        });
    }
}
