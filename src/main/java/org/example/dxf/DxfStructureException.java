package org.example.dxf;

/**
 * DXF 结构错误：tag 流损坏、控制标记不配对、所有者句柄无法解析、重复句柄等。
 * <p>
 * 该异常会中止整个加载，不会返回“半成品”文档。为了便于排查第三方生成的异常文件，
 * 异常携带出错的行号（从 1 开始，未知时为 -1），以及最近的外层实体类型与句柄（若可得）。
 */
public class DxfStructureException extends DxfException {

    private final int line;
    private String dxftype;
    private String handle;

    public DxfStructureException(String message) {
        this(message, -1);
    }

    public DxfStructureException(String message, int line) {
        super(message);
        this.line = line;
    }

    /**
     * 补充外层实体信息（只在尚未记录时生效，保留最内层的上下文）。
     */
    public DxfStructureException withEntity(String dxftype, String handle) {
        if (this.dxftype == null) {
            this.dxftype = dxftype;
            this.handle = handle;
        }
        return this;
    }

    public int getLine() {
        return line;
    }

    public String getDxftype() {
        return dxftype;
    }

    public String getHandle() {
        return handle;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (line > 0) {
            sb.append("（行 ").append(line).append('）');
        }
        if (dxftype != null) {
            sb.append("［实体 ").append(dxftype);
            if (handle != null) {
                sb.append(" #").append(handle);
            }
            sb.append('］');
        }
        return sb.toString();
    }
}
