package org.example.dxf.schema;

/**
 * 一条从某个实体出发的句柄引用。
 *
 * @param handle 被引用实体的句柄
 * @param kind   引用语义
 * @param code   承载该引用的组码
 */
public record HandleReference(String handle, ReferenceKind kind, int code) {
}
