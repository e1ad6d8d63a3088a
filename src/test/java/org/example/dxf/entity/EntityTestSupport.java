package org.example.dxf.entity;

import org.example.dxf.DxfOptions;
import org.example.dxf.DxfVersion;
import org.example.dxf.VersionConflictPolicy;
import org.example.dxf.structure.TagGroup;
import org.example.dxf.tag.DxfTagReader;
import org.example.dxf.tag.DxfTagWriter;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

/**
 * 实体编解码测试的公共方法。
 */
final class EntityTestSupport {

    static final EntityFactory FACTORY = new EntityFactory(DxfOptions.defaults());

    private EntityTestSupport() {
    }

    static DxfEntity load(String text) {
        return FACTORY.load(TagGroup.classify(DxfTagReader.readAll(text)));
    }

    static String export(DxfEntity entity, DxfVersion version) {
        return export(entity, version, VersionConflictPolicy.IGNORE);
    }

    static String export(DxfEntity entity, DxfVersion version, VersionConflictPolicy policy) {
        StringWriter out = new StringWriter();
        entity.exportDxf(new DxfTagWriter(out, version, policy, StandardCharsets.UTF_8));
        return out.toString();
    }
}
