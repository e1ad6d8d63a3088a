package org.example.dxf;

import java.util.List;

/**
 * 实体仍被其他实体以硬指针/硬所有者方式引用，不能删除。
 * <p>
 * 调用方需要先清除这些引用（{@link #getReferrers()} 给出引用方句柄）再重试。
 */
public class ProtectedEntityException extends DxfException {

    private final String handle;
    private final List<String> referrers;

    public ProtectedEntityException(String handle, List<String> referrers) {
        super("实体 #" + handle + " 仍被硬引用，不能删除：" + referrers);
        this.handle = handle;
        this.referrers = List.copyOf(referrers);
    }

    public String getHandle() {
        return handle;
    }

    public List<String> getReferrers() {
        return referrers;
    }
}
