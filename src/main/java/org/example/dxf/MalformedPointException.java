package org.example.dxf;

/**
 * 点坐标 tag 不完整或顺序错误（例如缺少 y 坐标，或 z 坐标单独出现）。
 */
public class MalformedPointException extends DxfStructureException {

    public MalformedPointException(String message, int line) {
        super(message, line);
    }
}
