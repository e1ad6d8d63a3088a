package org.example.dxf;

import org.example.dxf.section.DocumentLoader;
import org.example.dxf.structure.RawSection;
import org.example.dxf.structure.SectionSplitter;
import org.example.dxf.tag.DxfEncoding;
import org.example.dxf.tag.DxfTagReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 读取 ASCII DXF 文件。
 * <p>
 * 流程：探测版本与代码页 -> 按字符集解码 -> tag 读取 -> 段切分 -> 文档装配。
 * 任何结构错误都以 {@link DxfStructureException} 中止加载，不返回半成品文档。
 * <p>
 * 实例本身无状态，可在多个线程间共享；每次读取得到的文档只由调用线程使用。
 */
public class DxfReader {

    private static final Logger log = LoggerFactory.getLogger(DxfReader.class);

    private final DxfOptions options;

    public DxfReader() {
        this(DxfOptions.defaults());
    }

    public DxfReader(DxfOptions options) {
        this.options = options;
    }

    public DxfOptions options() {
        return options;
    }

    public DxfDocument read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            log.debug("读取 DXF 文件：{}", path);
            return read(in);
        }
    }

    /**
     * 读取整个流（不关闭流）。
     */
    public DxfDocument read(InputStream in) throws IOException {
        return read(in.readAllBytes());
    }

    public DxfDocument read(byte[] data) {
        DxfEncoding.Detection detection = DxfEncoding.detect(data, options.defaultEncoding());
        log.debug("探测结果：版本 {}，代码页 {}，字符集 {}",
                detection.version(), detection.codepage(), detection.charset().name());
        String text = new String(data, detection.bomSkip(), data.length - detection.bomSkip(), detection.charset());
        return load(text, detection.codepage());
    }

    /**
     * 从已解码的文本读取（编码探测由调用方负责）。
     */
    public DxfDocument readString(String text) {
        String content = !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
        return load(content, null);
    }

    private DxfDocument load(String text, String codepage) {
        List<RawSection> sections = SectionSplitter.split(new DxfTagReader(text));
        return new DocumentLoader(options).load(sections, codepage);
    }
}
