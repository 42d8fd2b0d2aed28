package com.umitunal.jobqueue.serialization;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Codec for String payloads. Decoding is strict: malformed UTF-8 is rejected
 * instead of being replaced, so a damaged payload fails the job instead of
 * running it with garbage.
 */
public class StringCodec implements PayloadCodec<String> {

    @Override
    public byte[] encode(String payload) {
        if (payload == null) {
            throw new PayloadCodecException("String payload must not be null");
        }
        return payload.getBytes(UTF_8);
    }

    @Override
    public String decode(byte[] bytes) {
        CharsetDecoder decoder = UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            CharBuffer chars = decoder.decode(ByteBuffer.wrap(bytes));
            return chars.toString();
        } catch (CharacterCodingException e) {
            throw new PayloadCodecException("Payload is not valid UTF-8", e);
        }
    }
}
