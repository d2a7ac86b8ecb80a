package io.github.vevoly.hitset.api.codec;

/**
 * 信封载荷写入回调 / Writes the payload of an envelope.
 *
 * @author vevoly
 * @since 1.0.0
 */
@FunctionalInterface
public interface PayloadWriter {

    /**
     * @param payload 仅属于本信封的输出 (Output scoped to this envelope)
     */
    void write(WireOutput payload);
}
