package org.example.dxf;

/**
 * 版本相关错误：无效的版本令牌，或在低于属性最低版本的文档中设置/写出该属性（取决于 {@link VersionConflictPolicy}）。
 */
public class DxfVersionException extends DxfException {

    public DxfVersionException(String message) {
        super(message);
    }
}
