package io.github.vevoly.hitset.api.codec;

import io.github.vevoly.hitset.api.exception.MalformedInputException;

/**
 * 信封载荷读取回调 / Reads the payload of an envelope into existing state.
 *
 * @author vevoly
 * @since 1.0.0
 */
@FunctionalInterface
public interface PayloadReader {

    /**
     * @param payload       仅包含本信封载荷的输入 (Input limited to this envelope's payload)
     * @param structVersion 写入方的结构版本 (Writer's struct version)
     * @throws MalformedInputException 载荷无法解析 (Payload cannot be parsed)
     */
    void read(WireInput payload, int structVersion) throws MalformedInputException;
}
