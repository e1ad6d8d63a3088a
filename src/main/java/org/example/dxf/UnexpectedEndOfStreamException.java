package org.example.dxf;

/**
 * tag 流提前结束：SECTION 没有以 ENDSEC 结束，或组码行之后缺少值行。
 */
public class UnexpectedEndOfStreamException extends DxfStructureException {

    public UnexpectedEndOfStreamException(String message, int line) {
        super(message, line);
    }
}
