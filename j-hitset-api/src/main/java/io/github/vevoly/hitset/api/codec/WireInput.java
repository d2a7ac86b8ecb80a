package io.github.vevoly.hitset.api.codec;

import com.google.common.io.LittleEndianDataInputStream;
import io.github.vevoly.hitset.api.exception.MalformedInputException;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * <h3>线路格式输入 (Wire Input)</h3>
 *
 * <p>
 * {@link WireOutput} 的逆操作。读取越界、长度字段超出剩余数据、或信封兼容版本高于本地支持版本时，
 * 一律抛出 {@link MalformedInputException}，不会越过当前信封读取兄弟数据。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Wire Input.</b><br>
 * Inverse of {@link WireOutput}. Underflow, length fields larger than the remaining data, and envelopes whose
 * compat version is newer than the local one all raise {@link MalformedInputException}; a payload reader never
 * reads past its own envelope.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class WireInput {

    private final ByteArrayInputStream source;
    private final LittleEndianDataInputStream in;

    public WireInput(byte[] data) {
        this(data, 0, data.length);
    }

    public WireInput(byte[] data, int offset, int length) {
        this.source = new ByteArrayInputStream(data, offset, length);
        this.in = new LittleEndianDataInputStream(source);
    }

    public int readU8() throws MalformedInputException {
        try {
            return in.readUnsignedByte();
        } catch (EOFException e) {
            throw underflow(1, e);
        } catch (IOException e) {
            throw bufferFailure(e);
        }
    }

    public int readU16() throws MalformedInputException {
        try {
            return in.readUnsignedShort();
        } catch (EOFException e) {
            throw underflow(2, e);
        } catch (IOException e) {
            throw bufferFailure(e);
        }
    }

    public long readU32() throws MalformedInputException {
        try {
            return Integer.toUnsignedLong(in.readInt());
        } catch (EOFException e) {
            throw underflow(4, e);
        } catch (IOException e) {
            throw bufferFailure(e);
        }
    }

    /**
     * 读取 64 位原始值；无符号语义由调用方按需使用 {@link Long#toUnsignedString(long)} 等方法处理。
     * <br>
     * <span style="color: gray;">Reads 64 raw bits; callers apply unsigned semantics where needed.</span>
     */
    public long readU64() throws MalformedInputException {
        try {
            return in.readLong();
        } catch (EOFException e) {
            throw underflow(8, e);
        } catch (IOException e) {
            throw bufferFailure(e);
        }
    }

    public boolean readBool() throws MalformedInputException {
        return readU8() != 0;
    }

    public byte[] readRaw(int length) throws MalformedInputException {
        if (length < 0 || length > remaining()) {
            throw new MalformedInputException(String.format(
                    "长度字段越界 / Length %d exceeds remaining %d bytes", length, remaining()));
        }
        byte[] bytes = new byte[length];
        try {
            in.readFully(bytes);
        } catch (EOFException e) {
            throw underflow(length, e);
        } catch (IOException e) {
            throw bufferFailure(e);
        }
        return bytes;
    }

    public byte[] readBytes() throws MalformedInputException {
        return readRaw(checkedLength(readU32()));
    }

    public String readString() throws MalformedInputException {
        return new String(readBytes(), StandardCharsets.UTF_8);
    }

    /**
     * 剩余未读字节数 / Bytes left to read
     */
    public int remaining() {
        return source.available();
    }

    /**
     * <h3>读取版本信封 (Read Versioned Envelope)</h3>
     * <p>
     * 载荷被完整切出后交给回调；回调未读完的尾部字节（更新版本写入的字段）会被直接跳过。
     * </p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * The payload is sliced out and handed to the reader; trailing bytes it leaves unread (fields added by newer
     * writers) are skipped.
     * </span>
     *
     * @param supportedVersion 本地支持的结构版本 (Struct version understood locally)
     * @param body             载荷读取逻辑 (Payload reader)
     * @throws MalformedInputException 头部或载荷非法 (Invalid header or payload)
     */
    public void readEnvelope(int supportedVersion, PayloadReader body) throws MalformedInputException {
        int structVersion = readU8();
        int compatVersion = readU8();
        WireInput payload = slicePayload(supportedVersion, structVersion, compatVersion);
        body.read(payload, structVersion);
    }

    /**
     * 与 {@link #readEnvelope(int, PayloadReader)} 相同，但由回调产出新对象。
     * <br>
     * <span style="color: gray;">Same as {@link #readEnvelope(int, PayloadReader)}, the callback produces a new value.</span>
     */
    public <T> T decodeEnvelope(int supportedVersion, PayloadDecoder<T> body) throws MalformedInputException {
        int structVersion = readU8();
        int compatVersion = readU8();
        WireInput payload = slicePayload(supportedVersion, structVersion, compatVersion);
        return body.decode(payload, structVersion);
    }

    private WireInput slicePayload(int supportedVersion, int structVersion, int compatVersion) throws MalformedInputException {
        if (compatVersion > supportedVersion) {
            throw new MalformedInputException(String.format(
                    "信封版本不兼容 / Decode past compat: struct_v=%d, compat_v=%d, supported=%d",
                    structVersion, compatVersion, supportedVersion));
        }
        int length = checkedLength(readU32());
        return new WireInput(readRaw(length));
    }

    private int checkedLength(long length) throws MalformedInputException {
        if (length > remaining()) {
            throw new MalformedInputException(String.format(
                    "长度字段越界 / Length %d exceeds remaining %d bytes", length, remaining()));
        }
        return (int) length;
    }

    private static MalformedInputException underflow(int wanted, EOFException cause) {
        return new MalformedInputException("数据截断 / Buffer underflow while reading " + wanted + " bytes", cause);
    }

    private static UncheckedIOException bufferFailure(IOException e) {
        return new UncheckedIOException("读取内存缓冲区失败 / Failed to read in-memory buffer", e);
    }
}
