package com.shardkv.serializer;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.Serializable;

/**
 * @author sakame
 * @version 1.0
 */
class SerializerTest {

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class Payload implements Serializable {

        private String key;

        private String value;

        private long seqId;

    }

    @ParameterizedTest
    @ValueSource(strings = {SerializerKeys.JDK, SerializerKeys.HESSIAN, SerializerKeys.KRYO})
    void testCopiesAcrossTheWire(String key) throws IOException {
        Serializer serializer = SerializerFactory.getInstance(key);
        Payload payload = new Payload("k", null, 1L << 61);

        Payload copy = serializer.deserialize(serializer.serialize(payload), Payload.class);
        Assertions.assertEquals(payload, copy);
        Assertions.assertNotSame(payload, copy);
        Assertions.assertNull(copy.getValue());
    }

    @Test
    void testFactoryCachesInstances() {
        Assertions.assertSame(SerializerFactory.getInstance(SerializerKeys.KRYO), SerializerFactory.getInstance(SerializerKeys.KRYO));
        Assertions.assertInstanceOf(HessianSerializer.class, SerializerFactory.getInstance(SerializerKeys.HESSIAN));
        Assertions.assertThrows(RuntimeException.class, () -> SerializerFactory.getInstance("protobuf"));
    }

}
