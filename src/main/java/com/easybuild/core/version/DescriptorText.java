package com.easybuild.core.version;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Raw UTF-8 content of a descriptor file, remembering whether it started with a
 * byte-order mark so the mark can be written back unchanged.
 */
record DescriptorText(String content, boolean byteOrderMark) {

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    static DescriptorText read(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        boolean bom = bytes.length >= UTF8_BOM.length
                && Arrays.equals(Arrays.copyOf(bytes, UTF8_BOM.length), UTF8_BOM);
        int offset = bom ? UTF8_BOM.length : 0;
        return new DescriptorText(new String(bytes, offset, bytes.length - offset, StandardCharsets.UTF_8), bom);
    }

    DescriptorText withContent(String newContent) {
        return new DescriptorText(newContent, byteOrderMark);
    }

    void write(Path file) throws IOException {
        byte[] body = content.getBytes(StandardCharsets.UTF_8);
        if (!byteOrderMark) {
            Files.write(file, body);
            return;
        }
        byte[] withBom = new byte[UTF8_BOM.length + body.length];
        System.arraycopy(UTF8_BOM, 0, withBom, 0, UTF8_BOM.length);
        System.arraycopy(body, 0, withBom, UTF8_BOM.length, body.length);
        Files.write(file, withBom);
    }
}
