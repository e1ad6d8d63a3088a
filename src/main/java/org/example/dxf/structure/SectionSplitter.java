package org.example.dxf.structure;

import org.example.dxf.DxfStructureException;
import org.example.dxf.UnexpectedEndOfStreamException;
import org.example.dxf.tag.DxfTag;
import org.example.dxf.tag.GroupCodes;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * 把 tag 流切分为顶层段。
 * <p>
 * 规则：段以 {@code (0, SECTION)(2, name)} 开始、以 {@code (0, ENDSEC)} 结束；段内遇到 {@code (0, ...)} 开始新的 tag 组。
 * 整个流以 {@code (0, EOF)} 结束（缺少 EOF 的文件照常接受）。
 * 段未以 ENDSEC 结束就遇到 EOF 或流结束时抛出 {@link UnexpectedEndOfStreamException}。
 */
public final class SectionSplitter {

    private SectionSplitter() {
    }

    public static List<RawSection> split(Iterator<DxfTag> tags) {
        List<RawSection> sections = new ArrayList<>();
        while (tags.hasNext()) {
            DxfTag tag = tags.next();
            if (tag.is(GroupCodes.STRUCTURE, "EOF")) {
                break;
            }
            if (!tag.is(GroupCodes.STRUCTURE, "SECTION")) {
                throw new DxfStructureException("期望 (0, SECTION)，实际为 " + tag, tag.line());
            }
            if (!tags.hasNext()) {
                throw new UnexpectedEndOfStreamException("SECTION 之后缺少段名", tag.line());
            }
            DxfTag name = tags.next();
            if (name.code() != GroupCodes.NAME) {
                throw new DxfStructureException("SECTION 之后应为 (2, 段名)，实际为 " + name, name.line());
            }
            sections.add(readSection(name.stringValue().trim(), tag.line(), tags));
        }
        return sections;
    }

    private static RawSection readSection(String name, int line, Iterator<DxfTag> tags) {
        List<List<DxfTag>> groups = new ArrayList<>();
        List<DxfTag> current = null;
        while (true) {
            if (!tags.hasNext()) {
                throw new UnexpectedEndOfStreamException("段 " + name + " 缺少 ENDSEC", line);
            }
            DxfTag tag = tags.next();
            if (tag.code() == GroupCodes.STRUCTURE) {
                String value = tag.stringValue();
                if ("ENDSEC".equals(value)) {
                    return new RawSection(name, groups, line);
                }
                if ("EOF".equals(value)) {
                    throw new UnexpectedEndOfStreamException("段 " + name + " 在 EOF 之前没有以 ENDSEC 结束", tag.line());
                }
                if ("SECTION".equals(value)) {
                    throw new DxfStructureException("段 " + name + " 未结束就开始了新的 SECTION", tag.line());
                }
                current = new ArrayList<>();
                groups.add(current);
            } else if (current == null) {
                current = new ArrayList<>();
                groups.add(current);
            }
            current.add(tag);
        }
    }
}
