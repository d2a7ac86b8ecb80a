package io.github.vevoly.hitset.api.codec;

import io.github.vevoly.hitset.api.exception.MalformedInputException;

/**
 * 信封载荷解码回调，产出新对象 / Decodes the payload of an envelope into a new value.
 *
 * @param <T> 解码结果类型 (Decoded type)
 * @author vevoly
 * @since 1.0.0
 */
@FunctionalInterface
public interface PayloadDecoder<T> {

    T decode(WireInput payload, int structVersion) throws MalformedInputException;
}
