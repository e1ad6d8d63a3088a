package org.example.dxf.structure;

import org.example.dxf.tag.DxfTag;

import java.util.List;

/**
 * 一个顶层段（SECTION ... ENDSEC）切分后的原始内容。
 *
 * @param name   段名（HEADER、TABLES、ENTITIES 等）
 * @param groups 以 {@code (0, ...)} 开头切分的 tag 组，不含 SECTION/ENDSEC 本身；
 *               HEADER 段的变量 tag 没有 {@code (0, ...)} 开头，整体作为一个组
 * @param line   SECTION 所在行号
 */
public record RawSection(String name, List<List<DxfTag>> groups, int line) {
}
