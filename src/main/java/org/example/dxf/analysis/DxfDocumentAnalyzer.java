package org.example.dxf.analysis;

import org.example.dxf.DxfDocument;
import org.example.dxf.DxfVersion;
import org.example.dxf.dto.DxfDocumentSummary;
import org.example.dxf.dto.DxfEntityTypeCount;
import org.example.dxf.entity.BlockRecord;
import org.example.dxf.entity.DxfEntity;
import org.example.dxf.section.StoredSection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 生成文档概览：版本、编码、句柄种子、实体类型统计、图层/块名与段列表。
 * <p>
 * 只读取文档，不做任何修改。
 */
public final class DxfDocumentAnalyzer {

    /**
     * 默认最多返回的实体类型数。
     */
    public static final int DEFAULT_MAX_ENTITY_TYPES = 50;

    private DxfDocumentAnalyzer() {
    }

    public static DxfDocumentSummary analyze(DxfDocument doc) {
        return analyze(doc, DEFAULT_MAX_ENTITY_TYPES);
    }

    /**
     * @param maxEntityTypes 类型计数最多保留多少项（按数量降序，数量相同时按类型名）
     */
    public static DxfDocumentSummary analyze(DxfDocument doc, int maxEntityTypes) {
        if (maxEntityTypes < 1) {
            throw new IllegalArgumentException("maxEntityTypes 必须大于 0：" + maxEntityTypes);
        }
        return new DxfDocumentSummary(
                doc.dxfVersion().token(),
                doc.codepage(),
                doc.database().handles().seed(),
                doc.database().size(),
                doc.modelspace().entities().size(),
                doc.paperspace().entities().size(),
                entityTypes(doc, maxEntityTypes),
                doc.tables().layers().entries().stream().map(e -> e.getString("name")).toList(),
                doc.blocks().blocks().stream().map(BlockRecord::name).toList(),
                sections(doc),
                doc.warnings()
        );
    }

    private static List<DxfEntityTypeCount> entityTypes(DxfDocument doc, int limit) {
        Map<String, Integer> counts = new HashMap<>();
        for (DxfEntity e : doc.database().entities()) {
            if (e.isAlive()) {
                counts.merge(e.dxftype(), 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .map(e -> new DxfEntityTypeCount(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingInt(DxfEntityTypeCount::count).reversed()
                        .thenComparing(DxfEntityTypeCount::type))
                .limit(limit)
                .toList();
    }

    private static List<String> sections(DxfDocument doc) {
        boolean modern = doc.dxfVersion().isAtLeast(DxfVersion.R2000);
        List<String> result = new ArrayList<>();
        result.add("HEADER");
        if (modern) {
            result.add("CLASSES");
        }
        result.add("TABLES");
        result.add("BLOCKS");
        result.add("ENTITIES");
        if (modern) {
            result.add("OBJECTS");
            doc.storedSections().stream().map(StoredSection::name).forEach(result::add);
        }
        return result;
    }
}
