package org.example.dxf;

/**
 * 同一文档中出现了重复句柄。
 */
public class DuplicateHandleException extends DxfStructureException {

    public DuplicateHandleException(String handle) {
        super("重复的句柄：" + handle);
    }
}
