package com.boardrag.pipeline.infra;

import lombok.Getter;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Open read of a stored object. Bytes are copied in fixed-size pieces so serving a large file never
 * holds more than one buffer in memory.
 */
@Getter
public class ObjectStream implements Closeable {

    private final InputStream content;
    private final long size;
    private final String contentType;
    private final int bufferSize;

    public ObjectStream(InputStream content, long size, String contentType, int bufferSize) {
        this.content = content;
        this.size = size;
        this.contentType = contentType;
        this.bufferSize = bufferSize;
    }

    public long transferTo(OutputStream out) throws IOException {
        byte[] buffer = new byte[bufferSize];
        long transferred = 0;
        int read;
        while ((read = content.read(buffer)) != -1) {
            out.write(buffer, 0, read);
            transferred += read;
        }
        out.flush();
        return transferred;
    }

    @Override
    public void close() throws IOException {
        content.close();
    }
}
