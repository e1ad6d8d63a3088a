package org.example.dxf.dto;

/**
 * 审计发现的问题。
 *
 * @param kind    问题类别
 * @param handle  出问题的实体句柄
 * @param dxftype 出问题的实体类型
 * @param message 可读的说明
 */
public record DxfAuditIssue(
        Kind kind,
        String handle,
        String dxftype,
        String message
) {

    public enum Kind {
        /**
         * 引用的句柄不存在。
         */
        DANGLING_REFERENCE,
        /**
         * 图形实体的所有者不是块记录（也不是其父实体）。
         */
        INVALID_OWNER,
        UNDEFINED_LAYER,
        UNDEFINED_LINETYPE,
        /**
         * INSERT 引用的块不存在。
         */
        UNDEFINED_BLOCK
    }
}
