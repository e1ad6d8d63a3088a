package org.example.dxf;

import org.example.dxf.section.DocumentExporter;
import org.example.dxf.tag.DxfEncoding;
import org.example.dxf.tag.DxfTagWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 把文档写出为 ASCII DXF。
 * <p>
 * 目标版本默认为文档版本；R2007 起使用 UTF-8，更早的版本使用文档代码页
 * （无法编码的字符写成 {@code \U+nnnn}）。写出不修改文档的版本。
 */
public class DxfWriter {

    private static final Logger log = LoggerFactory.getLogger(DxfWriter.class);

    private final DxfOptions options;

    public DxfWriter() {
        this(DxfOptions.defaults());
    }

    public DxfWriter(DxfOptions options) {
        this.options = options;
    }

    public void write(DxfDocument doc, Path path) throws IOException {
        write(doc, doc.dxfVersion(), path);
    }

    public void write(DxfDocument doc, DxfVersion version, Path path) throws IOException {
        try (OutputStream out = Files.newOutputStream(path)) {
            write(doc, version, out);
        }
        log.debug("已写出 {}：{}", version, path);
    }

    public void write(DxfDocument doc, OutputStream out) throws IOException {
        write(doc, doc.dxfVersion(), out);
    }

    /**
     * 写出到流（不关闭流）。
     *
     * @throws DxfVersionException 写出策略为 {@link VersionConflictPolicy#RAISE} 且有内容高于目标版本
     */
    public void write(DxfDocument doc, DxfVersion version, OutputStream out) throws IOException {
        Charset charset = charsetFor(doc, version);
        Writer writer = new BufferedWriter(new OutputStreamWriter(out, charset));
        export(doc, version, writer, charset);
        writer.flush();
    }

    public String writeString(DxfDocument doc) {
        return writeString(doc, doc.dxfVersion());
    }

    /**
     * 写出为字符串。R2007 之前的版本仍按文档代码页转义无法表示的字符。
     */
    public String writeString(DxfDocument doc, DxfVersion version) {
        StringWriter writer = new StringWriter();
        try {
            export(doc, version, writer, charsetFor(doc, version));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    private Charset charsetFor(DxfDocument doc, DxfVersion version) {
        if (version.usesUtf8()) {
            return StandardCharsets.UTF_8;
        }
        return DxfEncoding.charsetFor(doc.codepage(), options.defaultEncoding());
    }

    private void export(DxfDocument doc, DxfVersion version, Writer writer, Charset charset) throws IOException {
        DxfTagWriter tags = new DxfTagWriter(writer, version, options.versionPolicy(), charset);
        try {
            new DocumentExporter(doc).export(tags);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
