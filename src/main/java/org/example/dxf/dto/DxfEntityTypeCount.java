package org.example.dxf.dto;

/**
 * 实体类型计数项。
 *
 * @param type  DXF 类型名（如 LWPOLYLINE）
 * @param count 文档中存活实体的数量
 */
public record DxfEntityTypeCount(
        String type,
        int count
) {
}
