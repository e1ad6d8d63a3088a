package org.example.dxf;

/**
 * DXF 处理过程中所有异常的基类（非受检异常）。
 * <p>
 * 结构类错误（{@link DxfStructureException} 及其子类）会中止整个加载；属性级错误
 * （{@link UnsupportedAttributeException}、{@link DxfVersionException}）与删除错误
 * （{@link ProtectedEntityException}）只影响当前这一次调用，文档其余部分仍然可用。
 */
public class DxfException extends RuntimeException {

    public DxfException(String message) {
        super(message);
    }

    public DxfException(String message, Throwable cause) {
        super(message, cause);
    }
}
