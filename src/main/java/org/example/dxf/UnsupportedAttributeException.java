package org.example.dxf;

/**
 * 访问了实体类型的 schema 中不存在的属性。
 */
public class UnsupportedAttributeException extends DxfException {

    public UnsupportedAttributeException(String dxftype, String attribute) {
        super(dxftype + " 不支持属性：" + attribute);
    }
}
