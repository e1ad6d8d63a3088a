package org.example.dxf.section;

import org.example.dxf.tag.DxfTag;
import org.example.dxf.tag.DxfTagWriter;
import org.example.dxf.tag.GroupCodes;

import java.util.List;

/**
 * 原样保存的段（THUMBNAILIMAGE、ACDSDATA 以及其他未知段），写出时逐 tag 输出。
 */
public record StoredSection(String name, List<List<DxfTag>> groups) {

    public StoredSection {
        groups = groups.stream().map(List::copyOf).toList();
    }

    void export(DxfTagWriter w) {
        w.write(GroupCodes.STRUCTURE, "SECTION");
        w.write(GroupCodes.NAME, name);
        groups.forEach(w::writeAll);
        w.write(GroupCodes.STRUCTURE, "ENDSEC");
    }
}
