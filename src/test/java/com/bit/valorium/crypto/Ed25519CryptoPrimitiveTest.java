package com.bit.valorium.crypto;

import com.bit.valorium.crypto.impl.Ed25519CryptoPrimitive;
import com.bit.valorium.structure.key.KeyInfo;
import com.bit.valorium.util.ByteUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class Ed25519CryptoPrimitiveTest {

    private final CryptoPrimitive crypto = new Ed25519CryptoPrimitive();

    @Test
    void signAndVerify() {
        KeyInfo keys = crypto.deriveKeys("Neural_1", ByteUtils.utf8("seed-1"));
        byte[] message = ByteUtils.utf8("proof||Neural_1");
        byte[] signature = crypto.sign(message, keys.getPrivateKey());

        assertEquals(64, signature.length);
        assertTrue(crypto.verify(message, signature, keys.getPublicKey()));
        assertFalse(crypto.verify(ByteUtils.utf8("tampered"), signature, keys.getPublicKey()));
    }

    @Test
    void wrongKeyFailsVerification() {
        KeyInfo alice = crypto.deriveKeys("alice", ByteUtils.utf8("a"));
        KeyInfo bob = crypto.deriveKeys("bob", ByteUtils.utf8("b"));
        byte[] message = ByteUtils.utf8("hello");

        assertFalse(crypto.verify(message, crypto.sign(message, alice.getPrivateKey()), bob.getPublicKey()));
        assertFalse(crypto.verify(message, null, bob.getPublicKey()));
    }

    @Test
    void keyDerivationIsDeterministic() {
        KeyInfo first = crypto.deriveKeys("n", ByteUtils.utf8("same-seed"));
        KeyInfo second = crypto.deriveKeys("n", ByteUtils.utf8("same-seed"));

        assertArrayEquals(first.getPublicKey(), second.getPublicKey());
    }
}
