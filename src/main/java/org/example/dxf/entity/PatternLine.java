package org.example.dxf.entity;

import org.example.dxf.tag.DxfPoint;

import java.util.List;

/**
 * 填充图案的一条定义线（53/43/44/45/46/79/49）。
 */
public record PatternLine(double angle, DxfPoint base, DxfPoint offset, List<Double> dashes) {

    public PatternLine {
        dashes = List.copyOf(dashes);
    }
}
