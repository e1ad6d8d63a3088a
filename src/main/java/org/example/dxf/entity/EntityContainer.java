package org.example.dxf.entity;

/**
 * 持有子实体的容器（块记录、字典、表头、POLYLINE/INSERT 等）。
 * <p>
 * 删除实体时，数据库通过所有者句柄找到容器并调用 {@link #unlink(DxfEntity)} 解除关联。
 */
public interface EntityContainer {

    void unlink(DxfEntity child);
}
