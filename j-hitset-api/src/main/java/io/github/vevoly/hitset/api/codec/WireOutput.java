package io.github.vevoly.hitset.api.codec;

import com.google.common.base.Preconditions;
import com.google.common.io.LittleEndianDataOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * <h3>线路格式输出 (Wire Output)</h3>
 *
 * <p>
 * 所有整数均按 <b>小端序</b> 写入。{@link #writeEnvelope(int, int, PayloadWriter)} 写出带版本的信封：
 * {@code [u8 struct_v][u8 compat_v][u32 payload_len][payload]}，旧版本读取方可据此跳过不认识的尾部字段。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Wire Output.</b><br>
 * Every integer is written little-endian. {@link #writeEnvelope(int, int, PayloadWriter)} frames a payload as
 * {@code [u8 struct_v][u8 compat_v][u32 payload_len][payload]} so older readers can skip trailing fields.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class WireOutput {

    private final ByteArrayOutputStream buffer;
    private final LittleEndianDataOutputStream out;

    public WireOutput() {
        this(64);
    }

    public WireOutput(int initialCapacity) {
        this.buffer = new ByteArrayOutputStream(initialCapacity);
        this.out = new LittleEndianDataOutputStream(buffer);
    }

    public WireOutput writeU8(int value) {
        Preconditions.checkArgument(value >= 0 && value <= 0xFF, "u8 out of range: %s", value);
        try {
            out.writeByte(value);
        } catch (IOException e) {
            throw bufferFailure(e);
        }
        return this;
    }

    public WireOutput writeU16(int value) {
        Preconditions.checkArgument(value >= 0 && value <= 0xFFFF, "u16 out of range: %s", value);
        try {
            out.writeShort(value);
        } catch (IOException e) {
            throw bufferFailure(e);
        }
        return this;
    }

    /**
     * 写入无符号 32 位整数 (Write u32).
     *
     * @param value 取值范围 {@code [0, 2^32)} (Value in {@code [0, 2^32)})
     */
    public WireOutput writeU32(long value) {
        Preconditions.checkArgument(value >= 0 && value <= 0xFFFFFFFFL, "u32 out of range: %s", value);
        try {
            out.writeInt((int) value);
        } catch (IOException e) {
            throw bufferFailure(e);
        }
        return this;
    }

    /**
     * 写入 64 位整数，按位写出，读取方决定按有符号或无符号解释。
     * <br>
     * <span style="color: gray;">Writes 64 raw bits; the reader decides on signedness.</span>
     */
    public WireOutput writeU64(long value) {
        try {
            out.writeLong(value);
        } catch (IOException e) {
            throw bufferFailure(e);
        }
        return this;
    }

    public WireOutput writeBool(boolean value) {
        return writeU8(value ? 1 : 0);
    }

    /**
     * 写入原始字节，不带长度前缀 / Raw bytes, no length prefix
     */
    public WireOutput writeRaw(byte[] bytes) {
        try {
            out.write(bytes);
        } catch (IOException e) {
            throw bufferFailure(e);
        }
        return this;
    }

    /**
     * 写入带长度前缀的字节块 {@code [u32 len][bytes]} / Length-prefixed byte block
     */
    public WireOutput writeBytes(byte[] bytes) {
        writeU32(bytes.length);
        return writeRaw(bytes);
    }

    /**
     * 写入 UTF-8 字符串 {@code [u32 len][utf8]} / UTF-8 string
     */
    public WireOutput writeString(String value) {
        return writeBytes(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * <h3>写入版本信封 (Write Versioned Envelope)</h3>
     * <p>
     * 载荷先写入独立缓冲区以确定长度，再连同头部写出。
     * </p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * The payload is rendered into its own buffer first so its length is known, then written after the header.
     * </span>
     *
     * @param structVersion 当前结构版本 (Current struct version)
     * @param compatVersion 能读懂该载荷的最低版本 (Oldest version able to read this payload)
     * @param body          载荷写入逻辑 (Payload writer)
     */
    public WireOutput writeEnvelope(int structVersion, int compatVersion, PayloadWriter body) {
        Preconditions.checkArgument(compatVersion <= structVersion,
                "compat version %s newer than struct version %s", compatVersion, structVersion);
        WireOutput payload = new WireOutput();
        body.write(payload);
        byte[] bytes = payload.toByteArray();
        writeU8(structVersion);
        writeU8(compatVersion);
        writeU32(bytes.length);
        return writeRaw(bytes);
    }

    public int size() {
        return buffer.size();
    }

    public byte[] toByteArray() {
        return buffer.toByteArray();
    }

    private static UncheckedIOException bufferFailure(IOException e) {
        return new UncheckedIOException("写入内存缓冲区失败 / Failed to write to in-memory buffer", e);
    }
}
