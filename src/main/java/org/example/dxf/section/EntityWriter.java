package org.example.dxf.section;

import org.example.dxf.entity.DxfEntity;

/**
 * 段写出时逐个写出实体的回调（由 {@link DocumentExporter} 提供版本检查）。
 */
@FunctionalInterface
interface EntityWriter {

    void write(DxfEntity entity);
}
