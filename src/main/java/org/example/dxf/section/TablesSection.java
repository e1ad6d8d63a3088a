package org.example.dxf.section;

import org.example.dxf.DxfVersion;
import org.example.dxf.entity.DxfEntity;
import org.example.dxf.tag.DxfTagWriter;
import org.example.dxf.tag.GroupCodes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * TABLES 段。写出顺序固定为 VPORT、LTYPE、LAYER、STYLE、VIEW、UCS、APPID、DIMSTYLE、BLOCK_RECORD，
 * 其他（未知）表按读入顺序排在最后。R12 不写出 BLOCK_RECORD 表。
 */
public class TablesSection {

    public static final List<String> TABLE_ORDER = List.of(
            "VPORT", "LTYPE", "LAYER", "STYLE", "VIEW", "UCS", "APPID", "DIMSTYLE", "BLOCK_RECORD");

    private final Map<String, DxfTable> tables = new LinkedHashMap<>();

    public Optional<DxfTable> table(String name) {
        return Optional.ofNullable(tables.get(name.toUpperCase(Locale.ROOT)));
    }

    /**
     * @throws IllegalArgumentException 表不存在
     */
    public DxfTable require(String name) {
        return table(name).orElseThrow(() -> new IllegalArgumentException("表不存在：" + name));
    }

    public boolean has(String name) {
        return tables.containsKey(name.toUpperCase(Locale.ROOT));
    }

    public void add(DxfTable table) {
        tables.putIfAbsent(table.name().toUpperCase(Locale.ROOT), table);
    }

    public DxfTable layers() {
        return require("LAYER");
    }

    public DxfTable linetypes() {
        return require("LTYPE");
    }

    public DxfTable styles() {
        return require("STYLE");
    }

    public DxfTable blockRecords() {
        return require("BLOCK_RECORD");
    }

    /**
     * @return 全部表（按写出顺序）
     */
    public List<DxfTable> tables() {
        List<DxfTable> result = new ArrayList<>();
        for (String name : TABLE_ORDER) {
            table(name).ifPresent(result::add);
        }
        for (Map.Entry<String, DxfTable> e : tables.entrySet()) {
            if (!TABLE_ORDER.contains(e.getKey())) {
                result.add(e.getValue());
            }
        }
        return result;
    }

    void export(DxfTagWriter w, EntityWriter entities) {
        w.write(GroupCodes.STRUCTURE, "SECTION");
        w.write(GroupCodes.NAME, "TABLES");
        for (DxfTable table : tables()) {
            if (w.version() == DxfVersion.R12 && "BLOCK_RECORD".equalsIgnoreCase(table.name())) {
                continue;
            }
            table.head().exportDxf(w);
            for (DxfEntity entry : table.entries()) {
                entities.write(entry);
            }
            w.write(GroupCodes.STRUCTURE, "ENDTAB");
        }
        w.write(GroupCodes.STRUCTURE, "ENDSEC");
    }
}
