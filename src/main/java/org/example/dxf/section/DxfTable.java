package org.example.dxf.section;

import org.example.dxf.entity.DxfEntity;
import org.example.dxf.entity.TableHead;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 一个符号表：表头实体加有序的表记录。记录名的查找不区分大小写。
 */
public class DxfTable {

    private final TableHead head;

    public DxfTable(TableHead head) {
        this.head = head;
    }

    public String name() {
        return head.tableName();
    }

    public TableHead head() {
        return head;
    }

    public List<DxfEntity> entries() {
        return Collections.unmodifiableList(head.entries());
    }

    public int size() {
        return head.entries().size();
    }

    public Optional<DxfEntity> get(String name) {
        return head.entries().stream()
                .filter(e -> e.isSupported("name") && name.equalsIgnoreCase(e.getString("name")))
                .findFirst();
    }

    public boolean has(String name) {
        return get(name).isPresent();
    }

    /**
     * 追加记录。所有者与句柄由调用方（文档）负责。
     *
     * @throws IllegalArgumentException 同名记录已存在
     */
    public void add(DxfEntity entry) {
        String name = entry.getString("name");
        if (has(name)) {
            throw new IllegalArgumentException(name() + " 表中已存在记录：" + name);
        }
        head.entries().add(entry);
    }

    /**
     * 用 {@code replacement} 替换同名的已有记录（保持原位置）。
     */
    void replace(DxfEntity existing, DxfEntity replacement) {
        int index = head.entries().indexOf(existing);
        head.entries().set(index, replacement);
    }

    @Override
    public String toString() {
        return "DxfTable[" + name() + ", " + size() + " entries]";
    }
}
