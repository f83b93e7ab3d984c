package com.lhcz.txn2db.sink;

import org.apache.parquet.io.OutputFile;
import org.apache.parquet.io.PositionOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Parquet 写到内存，写完后整块上传对象存储
 */
class InMemoryOutputFile implements OutputFile {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    @Override
    public PositionOutputStream create(long blockSizeHint) {
        return createOrOverwrite(blockSizeHint);
    }

    @Override
    public PositionOutputStream createOrOverwrite(long blockSizeHint) {
        buffer.reset();
        return new PositionOutputStream() {
            private long pos;

            @Override
            public long getPos() {
                return pos;
            }

            @Override
            public void write(int b) {
                buffer.write(b);
                pos++;
            }

            @Override
            public void write(byte[] b, int off, int len) {
                buffer.write(b, off, len);
                pos += len;
            }

            @Override
            public void close() throws IOException {
                buffer.flush();
            }
        };
    }

    @Override
    public boolean supportsBlockSize() {
        return false;
    }

    @Override
    public long defaultBlockSize() {
        return 0;
    }

    byte[] toByteArray() {
        return buffer.toByteArray();
    }
}
