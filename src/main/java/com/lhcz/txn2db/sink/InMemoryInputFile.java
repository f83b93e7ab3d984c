package com.lhcz.txn2db.sink;

import org.apache.parquet.io.DelegatingSeekableInputStream;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.SeekableInputStream;

import java.io.ByteArrayInputStream;
import java.io.EOFException;

/**
 * 从对象存储整块取回的 Parquet 内容，供裁剪残留文件时读取
 */
class InMemoryInputFile implements InputFile {

    private final byte[] content;

    InMemoryInputFile(byte[] content) {
        this.content = content;
    }

    @Override
    public long getLength() {
        return content.length;
    }

    @Override
    public SeekableInputStream newStream() {
        SeekableBytes in = new SeekableBytes(content);
        return new DelegatingSeekableInputStream(in) {
            @Override
            public long getPos() {
                return in.position();
            }

            @Override
            public void seek(long newPos) throws EOFException {
                in.seek(newPos);
            }
        };
    }

    private static class SeekableBytes extends ByteArrayInputStream {

        SeekableBytes(byte[] buf) {
            super(buf);
        }

        synchronized long position() {
            return pos;
        }

        synchronized void seek(long newPos) throws EOFException {
            if (newPos < 0 || newPos > count) {
                throw new EOFException("seek 越界: " + newPos + " / " + count);
            }
            pos = (int) newPos;
        }
    }
}
