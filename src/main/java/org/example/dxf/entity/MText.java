package org.example.dxf.entity;

import org.example.dxf.schema.EntitySchema;
import org.example.dxf.tag.DxfTag;
import org.example.dxf.tag.DxfTagWriter;

import java.util.ArrayList;
import java.util.List;

/**
 * MTEXT：正文超过 250 个字符时拆成若干 3 组码块加最后一个 1 组码块。
 */
public class MText extends DxfEntity {

    private static final String SUBCLASS = "AcDbMText";
    private static final String TEXT = "text";
    static final int CHUNK_SIZE = 250;

    private String text = "";

    public MText(EntitySchema schema) {
        super(schema);
    }

    public String text() {
        return text;
    }

    public void setText(String text) {
        this.text = text == null ? "" : text;
    }

    @Override
    protected List<DxfTag> loadStructure(String subclass, List<DxfTag> tags) {
        if (!SUBCLASS.equals(subclass)) {
            return tags;
        }
        List<DxfTag> rest = new ArrayList<>();
        StringBuilder sb = new StringBuilder();
        boolean marked = false;
        for (DxfTag tag : tags) {
            if (tag.code() == 3 || tag.code() == 1) {
                sb.append(tag.stringValue());
                if (!marked) {
                    rest.add(slotMarker(TEXT));
                    marked = true;
                }
            } else {
                rest.add(tag);
            }
        }
        text = sb.toString();
        return rest;
    }

    @Override
    protected void exportSlot(String slot, DxfTagWriter w) {
        if (!TEXT.equals(slot)) {
            return;
        }
        List<String> chunks = split(text);
        for (int i = 0; i < chunks.size() - 1; i++) {
            w.write(3, chunks.get(i));
        }
        w.write(1, chunks.get(chunks.size() - 1));
    }

    /**
     * 按 250 字符切分；块末尾不能是转义符 {@code ^}，否则转义会被拆开。
     */
    static List<String> split(String text) {
        List<String> chunks = new ArrayList<>();
        String remaining = text;
        while (remaining.length() > CHUNK_SIZE) {
            int size = CHUNK_SIZE;
            if (remaining.charAt(size - 1) == '^') {
                size--;
            }
            chunks.add(remaining.substring(0, size));
            remaining = remaining.substring(size);
        }
        chunks.add(remaining);
        return chunks;
    }
}
