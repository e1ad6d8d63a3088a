package org.example.dxf.section;

import org.example.dxf.DxfDocument;
import org.example.dxf.DxfVersion;
import org.example.dxf.DxfVersionException;
import org.example.dxf.VersionConflictPolicy;
import org.example.dxf.entity.DxfEntity;
import org.example.dxf.tag.DxfTag;
import org.example.dxf.tag.DxfTagWriter;
import org.example.dxf.tag.GroupCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 按目标版本写出整个文档：HEADER、CLASSES、TABLES、BLOCKS、ENTITIES、OBJECTS、原样保存的段、EOF。
 * <p>
 * R12 只写出 HEADER、TABLES、BLOCKS、ENTITIES；类型本身高于目标版本的实体按写出策略跳过或报错。
 * 除了 CLASSES 的实例数（写出前按当前内容更新），写出不修改文档。
 */
public class DocumentExporter {

    private static final Logger log = LoggerFactory.getLogger(DocumentExporter.class);

    private final DxfDocument doc;

    public DocumentExporter(DxfDocument doc) {
        this.doc = doc;
    }

    public void export(DxfTagWriter w) {
        DxfVersion target = w.version();
        boolean modern = target.isAtLeast(DxfVersion.R2000);
        EntityWriter entities = e -> writeEntity(e, w);

        doc.header().export(w, headerOverrides(target));
        if (modern) {
            ClassesSection classes = doc.classes();
            classes.updateInstanceCounts(instanceCounts());
            classes.export(w);
        }
        doc.tables().export(w, entities);
        doc.blocks().export(w, entities);

        w.write(GroupCodes.STRUCTURE, "SECTION");
        w.write(GroupCodes.NAME, "ENTITIES");
        doc.modelspace().entities().forEach(entities::write);
        doc.paperspace().entities().forEach(entities::write);
        w.write(GroupCodes.STRUCTURE, "ENDSEC");

        if (modern) {
            doc.objects().export(w, entities);
            doc.storedSections().forEach(s -> s.export(w));
        } else if (!doc.storedSections().isEmpty()) {
            log.debug("R12 不写出 {} 个原样保存的段", doc.storedSections().size());
        }
        w.write(GroupCodes.STRUCTURE, "EOF");
    }

    private Map<String, DxfTag> headerOverrides(DxfVersion target) {
        Map<String, DxfTag> overrides = new LinkedHashMap<>();
        overrides.put("$ACADVER", DxfTag.of(1, target.token()));
        overrides.put("$HANDSEED", DxfTag.of(GroupCodes.HANDLE, doc.database().handles().seed()));
        if (!target.usesUtf8()) {
            overrides.put("$DWGCODEPAGE", DxfTag.of(3, doc.codepage()));
        }
        return overrides;
    }

    private Map<String, Integer> instanceCounts() {
        Map<String, Integer> counts = new HashMap<>();
        for (DxfEntity e : doc.database().entities()) {
            if (e.isAlive()) {
                counts.merge(e.dxftype(), 1, Integer::sum);
            }
        }
        return counts;
    }

    private static void writeEntity(DxfEntity entity, DxfTagWriter w) {
        DxfVersion required = entity.schema().minVersion();
        if (w.version().isBefore(required)) {
            if (w.versionPolicy() == VersionConflictPolicy.RAISE) {
                throw new DxfVersionException(entity.dxftype() + " #" + entity.handle() + " 需要 " + required
                        + "，不能写出为 " + w.version());
            }
            log.warn("写出 {} 时跳过 {} #{}（最低版本 {}）", w.version(), entity.dxftype(), entity.handle(), required);
            return;
        }
        entity.exportDxf(w);
    }
}
