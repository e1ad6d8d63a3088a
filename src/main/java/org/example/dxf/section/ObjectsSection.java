package org.example.dxf.section;

import org.example.dxf.entity.DictionaryObject;
import org.example.dxf.entity.DxfEntity;
import org.example.dxf.tag.DxfTagWriter;
import org.example.dxf.tag.GroupCodes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * OBJECTS 段（R2000 起）：非图形对象，第一个对象是根字典。
 */
public class ObjectsSection {

    private final List<DxfEntity> objects = new ArrayList<>();

    public List<DxfEntity> objects() {
        return Collections.unmodifiableList(objects);
    }

    public void add(DxfEntity object) {
        objects.add(object);
    }

    void insertFirst(DxfEntity object) {
        objects.add(0, object);
    }

    /**
     * 移除已删除的对象。
     */
    public void prune() {
        objects.removeIf(o -> !o.isAlive());
    }

    public Optional<DictionaryObject> rootDictionary() {
        return objects.stream()
                .filter(DictionaryObject.class::isInstance)
                .map(DictionaryObject.class::cast)
                .findFirst();
    }

    public List<DxfEntity> query(String dxftype) {
        return objects.stream().filter(o -> o.dxftype().equals(dxftype)).toList();
    }

    public int size() {
        return objects.size();
    }

    void export(DxfTagWriter w, EntityWriter entities) {
        w.write(GroupCodes.STRUCTURE, "SECTION");
        w.write(GroupCodes.NAME, "OBJECTS");
        for (DxfEntity o : objects) {
            if (o.isAlive()) {
                entities.write(o);
            }
        }
        w.write(GroupCodes.STRUCTURE, "ENDSEC");
    }
}
