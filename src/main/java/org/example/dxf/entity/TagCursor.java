package org.example.dxf.entity;

import org.example.dxf.DxfStructureException;
import org.example.dxf.tag.DxfTag;

import java.util.List;

/**
 * 变长结构解码用的 tag 游标（“先读数量，再读负载”）。
 */
final class TagCursor {

    private final List<DxfTag> tags;
    private final String context;
    private int index;

    TagCursor(List<DxfTag> tags, int start, String context) {
        this.tags = tags;
        this.index = start;
        this.context = context;
    }

    int index() {
        return index;
    }

    boolean hasNext() {
        return index < tags.size();
    }

    /**
     * @return 下一个 tag 的组码；已到结尾时返回 -1
     */
    int peekCode() {
        return hasNext() ? tags.get(index).code() : -1;
    }

    /**
     * @return 下下个 tag 的组码；不存在时返回 -1
     */
    int peekCode(int offset) {
        int i = index + offset;
        return i < tags.size() ? tags.get(i).code() : -1;
    }

    DxfTag peek() {
        return tags.get(index);
    }

    DxfTag expect(int code) {
        if (!hasNext()) {
            DxfTag last = tags.isEmpty() ? null : tags.get(tags.size() - 1);
            throw new DxfStructureException(context + " 数据提前结束，期望组码 " + code,
                    last == null ? -1 : last.line());
        }
        DxfTag tag = tags.get(index);
        if (tag.code() != code) {
            throw new DxfStructureException(context + " 数据损坏：期望组码 " + code + "，实际为 " + tag, tag.line());
        }
        index++;
        return tag;
    }

    /**
     * 下一个 tag 是指定组码时读取并返回，否则返回 {@code null}。
     */
    DxfTag optional(int code) {
        if (peekCode() == code) {
            return tags.get(index++);
        }
        return null;
    }
}
