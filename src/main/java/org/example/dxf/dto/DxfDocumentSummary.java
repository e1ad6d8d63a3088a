package org.example.dxf.dto;

import java.util.List;

/**
 * 文档概览。
 *
 * @param version            文档版本令牌（例如 {@code AC1027}）
 * @param codepage           文档代码页（{@code $DWGCODEPAGE}）
 * @param handleSeed         下一个可分配的句柄
 * @param entityCount        数据库中的实体总数（含表记录、对象）
 * @param modelspaceEntities 模型空间实体数
 * @param paperspaceEntities 当前图纸空间实体数
 * @param entityTypes        按数量降序的类型计数（可能被截断）
 * @param layers             图层名（表顺序）
 * @param blocks             普通块名（不含布局块）
 * @param sections           写出时会包含的段
 * @param warnings           加载时记录的非致命问题
 */
public record DxfDocumentSummary(
        String version,
        String codepage,
        String handleSeed,
        int entityCount,
        int modelspaceEntities,
        int paperspaceEntities,
        List<DxfEntityTypeCount> entityTypes,
        List<String> layers,
        List<String> blocks,
        List<String> sections,
        List<String> warnings
) {
}
